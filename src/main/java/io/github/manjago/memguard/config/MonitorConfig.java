package io.github.manjago.memguard.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.github.manjago.memguard.policy.KillingPolicyType;

import java.nio.file.Path;

/**
 * Configuration for the memory monitor and the worker killing policy.
 *
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 * Immutable for the lifetime of a monitor.
 */
public record MonitorConfig(
    // Fraction of total memory (0..1) at which pressure is signaled
    double usageThreshold,

    // Absolute free memory floor, -1 = disabled
    long minMemoryFreeBytes,

    // Tick period, 0 = never tick automatically
    long refreshIntervalMs,

    // Sensors
    Path meminfoPath,
    Path cgroupRoot,

    // Victim selection
    KillingPolicyType killingPolicy
) {

    /** Value of {@link #minMemoryFreeBytes} that disables the free memory floor. */
    public static final long MIN_MEMORY_FREE_DISABLED = -1;

    public MonitorConfig {
        if (Double.isNaN(usageThreshold) || usageThreshold < 0.0 || usageThreshold > 1.0) {
            throw new IllegalArgumentException("usage-threshold must be within [0, 1]: " + usageThreshold);
        }
        if (minMemoryFreeBytes < MIN_MEMORY_FREE_DISABLED) {
            throw new IllegalArgumentException(
                    "min-memory-free-bytes must be >= 0, or -1 to disable: " + minMemoryFreeBytes);
        }
        if (refreshIntervalMs < 0) {
            throw new IllegalArgumentException("refresh-interval-ms must be >= 0: " + refreshIntervalMs);
        }
        if (meminfoPath == null || cgroupRoot == null || killingPolicy == null) {
            throw new IllegalArgumentException("meminfo-path, cgroup-root and killing-policy are required");
        }
    }

    /**
     * Load default configuration.
     */
    public static MonitorConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file.
     */
    public static MonitorConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     */
    public static MonitorConfig fromConfig(Config config) {
        Config c = config.getConfig("memguard");

        return new MonitorConfig(
            c.getDouble("monitor.usage-threshold"),
            c.getLong("monitor.min-memory-free-bytes"),
            c.getLong("monitor.refresh-interval-ms"),
            Path.of(c.getString("monitor.meminfo-path")),
            Path.of(c.getString("monitor.cgroup-root")),
            KillingPolicyType.fromConfigName(c.getString("killing-policy"))
        );
    }

    /**
     * True when the free memory floor participates in the pressure check.
     */
    public boolean isMinMemoryFreeEnabled() {
        return minMemoryFreeBytes >= 0;
    }

    /**
     * Builder pre-filled with this configuration, for overriding single values.
     */
    public Builder toBuilder() {
        return new Builder()
                .usageThreshold(usageThreshold)
                .minMemoryFreeBytes(minMemoryFreeBytes)
                .refreshIntervalMs(refreshIntervalMs)
                .meminfoPath(meminfoPath)
                .cgroupRoot(cgroupRoot)
                .killingPolicy(killingPolicy);
    }

    /**
     * Builder for programmatic configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double usageThreshold = 0.95;
        private long minMemoryFreeBytes = MIN_MEMORY_FREE_DISABLED;
        private long refreshIntervalMs = 250;
        private Path meminfoPath = Path.of("/proc/meminfo");
        private Path cgroupRoot = Path.of("/sys/fs/cgroup");
        private KillingPolicyType killingPolicy = KillingPolicyType.RETRIABLE_LIFO;

        public Builder usageThreshold(double threshold) { this.usageThreshold = threshold; return this; }
        public Builder minMemoryFreeBytes(long bytes) { this.minMemoryFreeBytes = bytes; return this; }
        public Builder refreshIntervalMs(long ms) { this.refreshIntervalMs = ms; return this; }
        public Builder meminfoPath(Path path) { this.meminfoPath = path; return this; }
        public Builder cgroupRoot(Path path) { this.cgroupRoot = path; return this; }
        public Builder killingPolicy(KillingPolicyType policy) { this.killingPolicy = policy; return this; }

        public MonitorConfig build() {
            return new MonitorConfig(
                usageThreshold, minMemoryFreeBytes, refreshIntervalMs,
                meminfoPath, cgroupRoot, killingPolicy
            );
        }
    }

    @Override
    public String toString() {
        return String.format("""
            MonitorConfig:
              monitor.usage-threshold:       %.2f (%.0f%%)
              monitor.min-memory-free-bytes: %s
              monitor.refresh-interval-ms:   %s
              monitor.meminfo-path:          %s
              monitor.cgroup-root:           %s
              killing-policy:                %s
            """,
            usageThreshold, usageThreshold * 100,
            isMinMemoryFreeEnabled() ? String.format("%,d", minMemoryFreeBytes) : "disabled",
            refreshIntervalMs == 0 ? "manual ticks only" : String.format("%,d", refreshIntervalMs),
            meminfoPath,
            cgroupRoot,
            killingPolicy.configName()
        );
    }
}
