package io.github.manjago.memguard.policy;

import io.github.manjago.memguard.monitor.MemoryMonitor;
import io.github.manjago.memguard.worker.Worker;

import java.util.List;
import java.util.Optional;

/**
 * Chooses which worker to kill when the node runs low on memory.
 *
 * Like an OS OOM killer, but ranking by task metadata (retriability,
 * nesting depth, assignment order) instead of process memory scores.
 * Policies are stateless: the caller removes the killed worker and asks
 * again, and repeated calls converge to a complete kill order.
 */
public interface WorkerKillingPolicy {

    /**
     * Select the next worker to kill.
     *
     * Never modifies {@code workers}. The monitor is read for logging only
     * and never changes the outcome.
     *
     * @param workers live workers, no duplicates, each with an assigned task
     * @param monitor the node's memory monitor
     * @return one element of {@code workers} (the same instance), or empty
     *         if there is nothing to kill
     */
    <W extends Worker> Optional<W> selectWorkerToKill(List<W> workers, MemoryMonitor monitor);

    /**
     * Short name used in configuration and logs.
     */
    String name();
}
