package io.github.manjago.memguard.node;

import io.github.manjago.memguard.monitor.MemoryMonitor;
import io.github.manjago.memguard.monitor.MemorySnapshot;
import io.github.manjago.memguard.monitor.MemoryUsageCallback;
import io.github.manjago.memguard.policy.WorkerKillingPolicy;
import io.github.manjago.memguard.worker.Worker;
import io.github.manjago.memguard.worker.WorkerRegistry;
import io.github.manjago.memguard.worker.WorkerTerminator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Reacts to memory pressure by killing one worker at a time.
 *
 * Registered as the monitor's callback. On a tick above threshold it asks
 * the policy for a victim among the live workers and hands it to the
 * terminator. Until that victim has left the registry no other worker is
 * killed, so a slow exit does not cause a burst of kills.
 */
public class MemoryPressureResponder implements MemoryUsageCallback {

    private static final Logger log = LoggerFactory.getLogger(MemoryPressureResponder.class);

    private final MemoryMonitor monitor;
    private final WorkerKillingPolicy policy;
    private final WorkerRegistry registry;
    private final WorkerTerminator terminator;

    // Written only on the tick thread; read by status getters
    private volatile Worker pendingVictim;

    private volatile int killCount = 0;
    private volatile int unrelievedTicks = 0;

    public MemoryPressureResponder(MemoryMonitor monitor, WorkerKillingPolicy policy,
                                   WorkerRegistry registry, WorkerTerminator terminator) {
        this.monitor = monitor;
        this.policy = policy;
        this.registry = registry;
        this.terminator = terminator;
    }

    @Override
    public void onMemoryUsage(boolean aboveThreshold, MemorySnapshot snapshot, double usageThreshold) {
        if (!aboveThreshold) {
            return;
        }

        List<Worker> workers = registry.liveWorkers();

        if (pendingVictim != null) {
            if (containsWorker(workers, pendingVictim)) {
                log.debug("Still waiting for {} to exit, not killing another worker", pendingVictim.toShortString());
                return;
            }
            pendingVictim = null;
        }

        Optional<Worker> victim = policy.selectWorkerToKill(workers, monitor);
        if (victim.isEmpty()) {
            unrelievedTicks++;
            log.warn("Memory usage above threshold ({}) but no worker can be killed to free memory: {}",
                    usageThreshold, snapshot);
            return;
        }

        Worker worker = victim.get();
        String reason = OomKillMessage.format(worker, snapshot, usageThreshold, policy.name());
        log.info("Killing {} to relieve memory pressure ({} live workers, {})",
                worker.toShortString(), workers.size(), snapshot);

        // A failed terminate leaves nothing pending, the next tick selects again
        terminator.terminate(worker, reason);
        pendingVictim = worker;
        killCount++;
    }

    private static boolean containsWorker(List<Worker> workers, Worker target) {
        for (Worker worker : workers) {
            if (worker.workerId().equals(target.workerId())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Number of workers the terminator accepted without failing.
     */
    public int getKillCount() {
        return killCount;
    }

    /**
     * Ticks above threshold on which no worker could be chosen.
     */
    public int getUnrelievedTicks() {
        return unrelievedTicks;
    }

    public boolean isWaitingForVictim() {
        return pendingVictim != null;
    }

    @Override
    public String toString() {
        return String.format("MemoryPressureResponder[policy=%s, kills=%d, unrelieved=%d]",
                policy.name(), killCount, unrelievedTicks);
    }
}
