package io.github.manjago.memguard.policy;

import io.github.manjago.memguard.monitor.MemoryMonitor;
import io.github.manjago.memguard.worker.Worker;
import io.github.manjago.memguard.worker.WorkerId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Shared plumbing for killing policies: empty input, input checks and
 * selection logging. Subclasses only rank a non-empty worker list.
 */
public abstract class AbstractWorkerKillingPolicy implements WorkerKillingPolicy {

    private static final Logger log = LoggerFactory.getLogger(AbstractWorkerKillingPolicy.class);

    /** Workers listed in the debug line of a selection. */
    static final int WORKERS_TO_DESCRIBE = 10;

    /** Most recently assigned first. */
    static final Comparator<Worker> NEWEST_FIRST =
            Comparator.comparingLong(Worker::assignedTaskTime).reversed();

    @Override
    public final <W extends Worker> Optional<W> selectWorkerToKill(List<W> workers, MemoryMonitor monitor) {
        if (workers == null || workers.isEmpty()) {
            log.debug("[{}] No workers to kill", name());
            return Optional.empty();
        }
        assert hasDistinctIds(workers) : "Duplicate worker ids in " + describeWorkers(workers, workers.size());

        W victim = select(workers);

        if (log.isDebugEnabled()) {
            log.debug("[{}] Selected {} out of {} workers, memory: {}, candidates: {}",
                    name(), victim.toShortString(), workers.size(),
                    monitor != null ? monitor.getMemorySnapshot() : "n/a",
                    describeWorkers(workers, WORKERS_TO_DESCRIBE));
        }
        return Optional.of(victim);
    }

    /**
     * Rank the workers and return the victim.
     *
     * @param workers non-empty, duplicate-free list; must not be modified
     * @return an element of {@code workers}
     */
    protected abstract <W extends Worker> W select(List<W> workers);

    /**
     * One-line listing of the first {@code limit} workers, for logs.
     */
    public static String describeWorkers(List<? extends Worker> workers, int limit) {
        String listed = workers.stream()
                .limit(limit)
                .map(Worker::toShortString)
                .collect(Collectors.joining(", ", "[", "]"));
        int hidden = workers.size() - Math.min(limit, workers.size());
        return hidden > 0 ? listed + " and " + hidden + " more" : listed;
    }

    private static boolean hasDistinctIds(List<? extends Worker> workers) {
        Set<WorkerId> seen = new HashSet<>();
        for (Worker worker : workers) {
            if (!seen.add(worker.workerId())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name() + "]";
    }
}
