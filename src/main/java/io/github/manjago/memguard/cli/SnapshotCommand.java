package io.github.manjago.memguard.cli;

import io.github.manjago.memguard.config.MonitorConfig;
import io.github.manjago.memguard.monitor.MemoryMonitor;
import io.github.manjago.memguard.monitor.MemorySnapshot;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * Read memory once and evaluate it against the configured thresholds.
 *
 * Exit code 0 = no pressure, 1 = above threshold, 2 = memory unreadable.
 */
@Command(
    name = "snapshot",
    description = "Read system memory once and report pressure",
    mixinStandardHelpOptions = true
)
public class SnapshotCommand implements Callable<Integer> {

    @Mixin
    private ConfigOptions configOptions;

    @Override
    public Integer call() {
        MonitorConfig config = configOptions.load();

        try (MemoryMonitor monitor = MemoryMonitor.create(config)) {
            MemorySnapshot snapshot = monitor.getMemorySnapshot();
            if (!snapshot.isKnown()) {
                System.out.println("Memory usage unknown (sensor read failed)");
                return 2;
            }

            boolean above = MemoryMonitor.isUsageAboveThreshold(
                    snapshot, config.usageThreshold(), config.minMemoryFreeBytes());

            System.out.printf("Total:     %,d bytes (%.2f GB)%n", snapshot.totalBytes(), snapshot.totalGb());
            System.out.printf("Used:      %,d bytes (%.2f GB)%n", snapshot.usedBytes(), snapshot.usedGb());
            System.out.printf("Free:      %,d bytes%n", snapshot.freeBytes());
            System.out.printf("Usage:     %.1f%% (threshold %.1f%%)%n",
                    snapshot.usageFraction() * 100, config.usageThreshold() * 100);
            System.out.printf("Pressure:  %s%n", above ? "ABOVE THRESHOLD" : "ok");
            return above ? 1 : 0;
        }
    }
}
