package io.github.manjago.memguard.worker;

/**
 * Kills worker processes. Implemented by the process supervisor.
 */
@FunctionalInterface
public interface WorkerTerminator {

    /**
     * Request termination of a worker. May return before the process is gone;
     * the worker leaves the registry once it has been reaped.
     *
     * @param worker the worker to kill
     * @param reason human-readable cause, surfaced to the task's owner
     */
    void terminate(Worker worker, String reason);
}
