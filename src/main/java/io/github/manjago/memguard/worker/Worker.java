package io.github.manjago.memguard.worker;

/**
 * Handle to one worker process and the task it is running.
 *
 * Handles are owned by the worker pool. Killing policies only read them
 * for the duration of one selection.
 */
public interface Worker {

    WorkerId workerId();

    /**
     * The single task currently assigned to this worker.
     */
    TaskSpec assignedTask();

    /**
     * When the task was assigned, as a monotonic sequence: a larger value
     * means a more recent assignment. No two live workers share a value.
     */
    long assignedTaskTime();

    default String toShortString() {
        return String.format("Worker#%s[%s, t=%d]", workerId().toShortString(), assignedTask(), assignedTaskTime());
    }
}
