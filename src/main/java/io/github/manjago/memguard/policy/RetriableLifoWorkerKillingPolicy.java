package io.github.manjago.memguard.policy;

import io.github.manjago.memguard.worker.Worker;

import java.util.Comparator;
import java.util.List;

/**
 * Prefer-retriable LIFO policy.
 *
 * Kills workers whose task will be retried before workers whose task would
 * be lost for good. Inside each of the two groups the most recently
 * assigned worker goes first.
 *
 * Draining a pool with this policy yields: all retriable workers
 * newest-first, then all non-retriable workers newest-first.
 */
public class RetriableLifoWorkerKillingPolicy extends AbstractWorkerKillingPolicy {

    public static final String NAME = "retriable-lifo";

    // Retriable (false -> sorts first) before non-retriable, then newest first
    private static final Comparator<Worker> KILL_ORDER =
            Comparator.comparing((Worker w) -> !w.assignedTask().isRetriable())
                    .thenComparing(NEWEST_FIRST);

    @Override
    protected <W extends Worker> W select(List<W> workers) {
        W victim = workers.get(0);
        for (W candidate : workers) {
            if (KILL_ORDER.compare(candidate, victim) < 0) {
                victim = candidate;
            }
        }
        return victim;
    }

    @Override
    public String name() {
        return NAME;
    }
}
