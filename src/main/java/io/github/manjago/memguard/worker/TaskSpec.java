package io.github.manjago.memguard.worker;

/**
 * Read-only description of the task a worker is running.
 *
 * @param taskType kind of task
 * @param maxRetries retry budget of a normal task (-1 = unlimited)
 * @param maxActorRestarts restart budget of an actor-creation task (-1 = unlimited)
 * @param depth nesting level of submission, 1 = submitted by the driver
 */
public record TaskSpec(
    TaskType taskType,
    int maxRetries,
    int maxActorRestarts,
    int depth
) {

    public TaskSpec {
        if (taskType == null) {
            throw new IllegalArgumentException("taskType is required");
        }
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be >= 1: " + depth);
        }
    }

    public static TaskSpec normalTask(int maxRetries, int depth) {
        return new TaskSpec(TaskType.NORMAL_TASK, maxRetries, 0, depth);
    }

    public static TaskSpec actorCreationTask(int maxActorRestarts, int depth) {
        return new TaskSpec(TaskType.ACTOR_CREATION_TASK, 0, maxActorRestarts, depth);
    }

    public static TaskSpec actorTask(int maxActorRestarts, int depth) {
        return new TaskSpec(TaskType.ACTOR_TASK, 0, maxActorRestarts, depth);
    }

    /**
     * Whether killing the worker loses no work for good: the task will be
     * resubmitted automatically.
     *
     * Actor tasks are never retriable here, whatever restart budget their
     * actor has: restarting the actor does not replay the killed method call.
     */
    public boolean isRetriable() {
        return switch (taskType) {
            case NORMAL_TASK -> maxRetries != 0;
            case ACTOR_CREATION_TASK -> maxActorRestarts != 0;
            default -> false;
        };
    }

    @Override
    public String toString() {
        int budget = taskType == TaskType.NORMAL_TASK ? maxRetries : maxActorRestarts;
        return String.format("%s(budget=%d, depth=%d)", taskType.shortName(), budget, depth);
    }
}
