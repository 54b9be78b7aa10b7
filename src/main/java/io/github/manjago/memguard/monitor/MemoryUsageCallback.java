package io.github.manjago.memguard.monitor;

/**
 * Receives the result of every {@link MemoryMonitor} tick.
 *
 * Runs synchronously on the monitor's tick thread: a slow callback delays
 * the next tick.
 */
@FunctionalInterface
public interface MemoryUsageCallback {

    /**
     * Called once per tick, whether or not the pressure state changed.
     *
     * @param aboveThreshold true if memory usage is at or above the threshold,
     *                       or free memory is below the configured floor
     * @param snapshot the memory reading of this tick
     * @param usageThreshold the usage fraction the reading was compared against
     */
    void onMemoryUsage(boolean aboveThreshold, MemorySnapshot snapshot, double usageThreshold);

    /**
     * Callback that does nothing.
     */
    MemoryUsageCallback NOOP = (aboveThreshold, snapshot, usageThreshold) -> {};
}
