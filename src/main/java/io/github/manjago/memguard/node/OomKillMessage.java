package io.github.manjago.memguard.node;

import io.github.manjago.memguard.monitor.MemorySnapshot;
import io.github.manjago.memguard.worker.Worker;
import org.jetbrains.annotations.NotNull;

import java.util.Locale;

/**
 * Builds the reason reported to the owner of a task killed for memory.
 */
public final class OomKillMessage {

    private OomKillMessage() {
    }

    public static @NotNull String format(@NotNull Worker worker, @NotNull MemorySnapshot snapshot,
                                         double usageThreshold, @NotNull String policyName) {
        String retry = worker.assignedTask().isRetriable()
                ? "The task will be retried."
                : "The task is not retriable and has failed.";
        return String.format(Locale.ROOT,
                "Worker %s running %s was killed because the node was running low on memory. "
                        + "Memory on the node was %.2fGB / %.2fGB (%.3f), which exceeds the memory usage threshold of %.3f. "
                        + "Victim chosen by the %s policy. %s",
                worker.workerId(), worker.assignedTask(),
                snapshot.usedGb(), snapshot.totalGb(), snapshot.usageFraction(), usageThreshold,
                policyName, retry);
    }
}
