package io.github.manjago.memguard.monitor;

import io.github.manjago.memguard.config.MonitorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically samples system memory and reports pressure to a callback.
 *
 * Every tick reads a {@link MemorySnapshot}, evaluates it against the
 * configured usage threshold and free memory floor, and invokes the callback
 * with the result. Ticks run one at a time on a single scheduler thread.
 * With a refresh interval of 0 nothing is scheduled and the callback only
 * runs from an explicit {@link #tick()}.
 *
 * Sensor failures, checked or not, never escape a tick: they degrade to
 * {@link MemorySnapshot#unknown}, which is never above threshold.
 */
public class MemoryMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MemoryMonitor.class);

    private static final long SHUTDOWN_TIMEOUT_MS = 5_000;

    private final MonitorConfig config;
    private final MemorySampler sampler;
    private final Clock clock;

    // Guards the sensor read (tick thread vs getMemorySnapshot callers)
    private final Object samplerLock = new Object();

    // Guards a whole tick (scheduled vs manual)
    private final Object tickLock = new Object();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong tickCount = new AtomicLong();

    private volatile MemoryUsageCallback callback;
    private volatile ScheduledExecutorService scheduler;

    /**
     * Create a monitor.
     *
     * @param config thresholds and refresh interval
     * @param sampler memory sensor
     * @param clock time source for unknown snapshots
     */
    public MemoryMonitor(MonitorConfig config, MemorySampler sampler, Clock clock) {
        this.config = config;
        this.sampler = sampler;
        this.clock = clock;
    }

    /**
     * Create a monitor reading the operating system (host and cgroup memory).
     */
    public static MemoryMonitor create(MonitorConfig config) {
        Clock clock = Clock.systemUTC();
        return new MemoryMonitor(config, SystemMemorySampler.fromConfig(config, clock), clock);
    }

    /**
     * Start monitoring.
     *
     * @param callback invoked on every tick
     * @throws IllegalStateException if already started or closed
     */
    public void start(MemoryUsageCallback callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback is required");
        }
        if (closed.get()) {
            throw new IllegalStateException("Memory monitor is closed");
        }
        if (started.getAndSet(true)) {
            throw new IllegalStateException("Memory monitor already started");
        }
        this.callback = callback;

        long interval = config.refreshIntervalMs();
        if (interval == 0) {
            log.info("Memory monitor started without automatic ticks (threshold {}, min free {})",
                    config.usageThreshold(), config.minMemoryFreeBytes());
            return;
        }

        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "memory-monitor");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(this::tick, interval, interval, TimeUnit.MILLISECONDS);
        this.scheduler = executor;

        log.info("Memory monitor started (every {} ms, threshold {}, min free {}, sampler {})",
                interval, config.usageThreshold(), config.minMemoryFreeBytes(), sampler);
    }

    /**
     * Run one evaluation now: sample, compare, invoke the callback.
     * Does nothing once the monitor is closed.
     *
     * @throws IllegalStateException if the monitor was never started
     */
    public void tick() {
        MemoryUsageCallback target = callback;
        if (target == null) {
            throw new IllegalStateException("Memory monitor not started");
        }

        synchronized (tickLock) {
            if (closed.get()) {
                log.debug("Tick ignored, memory monitor is closed");
                return;
            }

            MemorySnapshot snapshot = getMemorySnapshot();
            boolean above = isUsageAboveThreshold(snapshot, config.usageThreshold(), config.minMemoryFreeBytes());
            long tick = tickCount.incrementAndGet();

            log.debug("Tick {}: {} (above threshold: {})", tick, snapshot, above);

            try {
                target.onMemoryUsage(above, snapshot, config.usageThreshold());
            } catch (RuntimeException e) {
                log.error("Memory usage callback failed on tick {}", tick, e);
            }
        }
    }

    /**
     * Read memory now, without waiting for a tick.
     *
     * @return the current snapshot, or an unknown snapshot if the sensor failed
     */
    public MemorySnapshot getMemorySnapshot() {
        synchronized (samplerLock) {
            try {
                return sampler.sample();
            } catch (MemorySamplingException e) {
                log.warn("Unable to read system memory, reporting unknown usage: {}", e.getMessage());
                return MemorySnapshot.unknown(clock.instant());
            } catch (RuntimeException e) {
                log.error("Memory sampler {} failed, reporting unknown usage", sampler, e);
                return MemorySnapshot.unknown(clock.instant());
            }
        }
    }

    /**
     * Evaluate a snapshot against the thresholds.
     *
     * @param snapshot memory reading
     * @param usageThreshold used / total fraction at which pressure starts
     * @param minMemoryFreeBytes free memory floor, negative to disable
     * @return true if the reading indicates memory pressure
     */
    public static boolean isUsageAboveThreshold(MemorySnapshot snapshot, double usageThreshold,
                                                long minMemoryFreeBytes) {
        if (!snapshot.isKnown()) {
            return false;
        }
        boolean usageAbove = snapshot.usageFraction() >= usageThreshold;
        boolean freeBelow = minMemoryFreeBytes >= 0 && snapshot.freeBytes() < minMemoryFreeBytes;
        return usageAbove || freeBelow;
    }

    /**
     * Stop future ticks and wait for a tick in progress to finish.
     * Safe to call more than once.
     */
    @Override
    public void close() {
        if (closed.getAndSet(true)) {
            return;
        }
        ScheduledExecutorService executor = scheduler;
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                    log.warn("Memory monitor tick did not finish within {} ms, interrupting", SHUTDOWN_TIMEOUT_MS);
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Memory monitor stopped after {} ticks", tickCount.get());
    }

    public MonitorConfig getConfig() {
        return config;
    }

    public long getTickCount() {
        return tickCount.get();
    }

    public boolean isRunning() {
        return started.get() && !closed.get();
    }

    @Override
    public String toString() {
        return String.format("MemoryMonitor[threshold=%.2f, minFree=%d, interval=%dms, ticks=%d]",
                config.usageThreshold(), config.minMemoryFreeBytes(), config.refreshIntervalMs(), tickCount.get());
    }
}
