package io.github.manjago.memguard.policy;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * The available worker killing policies, selected at configuration time.
 */
public enum KillingPolicyType {
    RETRIABLE_LIFO(RetriableLifoWorkerKillingPolicy.NAME),
    GROUP_BY_DEPTH(GroupByDepthWorkerKillingPolicy.NAME);

    private final String configName;

    KillingPolicyType(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    /**
     * Create a policy instance of this type.
     */
    public @NotNull WorkerKillingPolicy create() {
        return switch (this) {
            case RETRIABLE_LIFO -> new RetriableLifoWorkerKillingPolicy();
            case GROUP_BY_DEPTH -> new GroupByDepthWorkerKillingPolicy();
        };
    }

    /**
     * Resolve a configuration name ("retriable-lifo") or an enum name ("RETRIABLE_LIFO").
     *
     * @throws IllegalArgumentException for unknown names
     */
    @Contract(pure = true)
    public static @NotNull KillingPolicyType fromConfigName(@NotNull String name) {
        for (KillingPolicyType type : values()) {
            if (type.configName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown killing policy: " + name
                + " (expected " + RETRIABLE_LIFO.configName + " or " + GROUP_BY_DEPTH.configName + ")");
    }
}
