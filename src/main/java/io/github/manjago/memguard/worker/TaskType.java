package io.github.manjago.memguard.worker;

import org.jetbrains.annotations.NotNull;

/**
 * Kind of task assigned to a worker.
 */
public enum TaskType {
    /** Stateless remote function call, retried up to max-retries */
    NORMAL_TASK("normal"),

    /** Task that constructs an actor, restarted up to max-actor-restarts */
    ACTOR_CREATION_TASK("actor-creation"),

    /** Method call on an existing actor */
    ACTOR_TASK("actor"),

    /** The driver program itself */
    DRIVER_TASK("driver");

    private final String shortName;

    TaskType(String shortName) {
        this.shortName = shortName;
    }

    public String shortName() {
        return shortName;
    }

    /**
     * Resolve a short name ("normal", "actor-creation", ...) or an enum name.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static @NotNull TaskType fromName(@NotNull String name) {
        for (TaskType type : values()) {
            if (type.shortName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown task type: " + name);
    }
}
