package io.github.manjago.memguard.policy;

import io.github.manjago.memguard.worker.Worker;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Group-by-depth policy.
 *
 * Workers are grouped by the nesting depth of their task. The largest group
 * is shrunk first; among equally large groups the deepest one is chosen,
 * since nested work is cheaper to recompute than its ancestors. Inside the
 * chosen group the most recently assigned worker is killed.
 *
 * Groups are rebuilt on every call: membership changes as the caller
 * removes killed workers.
 */
public class GroupByDepthWorkerKillingPolicy extends AbstractWorkerKillingPolicy {

    public static final String NAME = "group-by-depth";

    @Override
    protected <W extends Worker> W select(List<W> workers) {
        Map<Integer, List<W>> byDepth = groupByDepth(workers);

        // Ascending depth, so ">=" lets a deeper group win a size tie
        List<W> target = null;
        for (List<W> group : byDepth.values()) {
            if (target == null || group.size() >= target.size()) {
                target = group;
            }
        }

        W victim = target.get(0);
        for (W candidate : target) {
            if (NEWEST_FIRST.compare(candidate, victim) < 0) {
                victim = candidate;
            }
        }
        return victim;
    }

    /**
     * Workers keyed by task depth, ascending.
     */
    static <W extends Worker> Map<Integer, List<W>> groupByDepth(List<W> workers) {
        Map<Integer, List<W>> byDepth = new TreeMap<>();
        for (W worker : workers) {
            byDepth.computeIfAbsent(worker.assignedTask().depth(), d -> new ArrayList<>()).add(worker);
        }
        return byDepth;
    }

    @Override
    public String name() {
        return NAME;
    }
}
