package io.github.manjago.memguard.cli;

import io.github.manjago.memguard.config.MonitorConfig;
import io.github.manjago.memguard.monitor.MemoryMonitor;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

/**
 * Run the memory monitor and print every tick.
 *
 * Examples:
 *   memguard watch                     # Until Ctrl-C
 *   memguard watch -n 10 -i 1000       # 10 ticks, one per second
 *   memguard watch -t 0.5              # Flag pressure from 50% usage
 */
@Command(
    name = "watch",
    description = "Run the memory monitor and print each tick",
    mixinStandardHelpOptions = true
)
public class WatchCommand implements Callable<Integer> {

    @Mixin
    private ConfigOptions configOptions;

    @Option(names = {"-n", "--ticks"}, description = "Stop after this many ticks (0 = until interrupted)",
            defaultValue = "0")
    private long ticks;

    @Override
    public Integer call() throws InterruptedException {
        MonitorConfig config = configOptions.load();
        if (config.refreshIntervalMs() == 0) {
            System.err.println("Refresh interval is 0, nothing would ever tick. Use --interval.");
            return 2;
        }

        CountDownLatch done = new CountDownLatch(1);
        MemoryMonitor monitor = MemoryMonitor.create(config);

        // Setup graceful shutdown
        Thread shutdownHook = new Thread(() -> {
            monitor.close();
            done.countDown();
        });
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        monitor.start((aboveThreshold, snapshot, usageThreshold) -> {
            System.out.printf("%s  used %.2f / %.2f GB (%.1f%%)  free %,d  %s%n",
                    snapshot.timestamp(),
                    snapshot.usedGb(), snapshot.totalGb(), snapshot.usageFraction() * 100,
                    snapshot.freeBytes(),
                    aboveThreshold ? "ABOVE " + usageThreshold : "ok");
            if (ticks > 0 && monitor.getTickCount() >= ticks) {
                done.countDown();
            }
        });

        done.await();
        monitor.close();
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            // JVM already shutting down; the hook is running
            return 0;
        }
        return 0;
    }
}
