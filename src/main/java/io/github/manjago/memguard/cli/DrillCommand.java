package io.github.manjago.memguard.cli;

import io.github.manjago.memguard.config.MonitorConfig;
import io.github.manjago.memguard.monitor.MemoryMonitor;
import io.github.manjago.memguard.monitor.MemorySnapshot;
import io.github.manjago.memguard.node.MemoryPressureResponder;
import io.github.manjago.memguard.policy.WorkerKillingPolicy;
import io.github.manjago.memguard.worker.TaskSpec;
import io.github.manjago.memguard.worker.Worker;
import io.github.manjago.memguard.worker.WorkerPool;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.PrintStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Rehearse an out-of-memory episode: fill a worker pool, hold memory above
 * the threshold and let the configured policy kill workers until none are
 * left. Prints the kill order.
 *
 * Examples:
 *   memguard drill                                              # Default worker mix
 *   memguard drill -p group-by-depth -w normal:0:1 -w normal:0:2
 *   memguard drill -w actor:7 -w actor-creation:5 -w normal:11
 */
@Command(
    name = "drill",
    description = "Drain a simulated worker pool under constant memory pressure",
    mixinStandardHelpOptions = true
)
public class DrillCommand implements Callable<Integer> {

    private static final long DRILL_TOTAL_BYTES = 16L * 1024 * 1024 * 1024;

    @Mixin
    private ConfigOptions configOptions;

    @Option(names = {"-w", "--worker"}, description = "Worker as kind:budget[:depth], in submission order",
            converter = TaskSpecConverter.class)
    private List<TaskSpec> workerSpecs = new ArrayList<>();

    private final PrintStream out;

    public DrillCommand() {
        this(System.out);
    }

    DrillCommand(PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() {
        MonitorConfig config = configOptions.load().toBuilder().refreshIntervalMs(0).build();
        List<TaskSpec> specs = workerSpecs.isEmpty() ? defaultWorkerMix() : workerSpecs;

        WorkerPool pool = new WorkerPool();
        Map<Worker, Integer> submissionIndex = new HashMap<>();
        for (TaskSpec spec : specs) {
            submissionIndex.put(pool.assign(spec), submissionIndex.size() + 1);
        }

        // Memory stays full for the whole drill
        Clock clock = Clock.systemUTC();
        MemoryMonitor monitor = new MemoryMonitor(config,
                () -> MemorySnapshot.ofTotalAndFree(DRILL_TOTAL_BYTES, 0, clock.instant()), clock);

        WorkerKillingPolicy policy = config.killingPolicy().create();
        List<Worker> killed = new ArrayList<>();
        MemoryPressureResponder responder = new MemoryPressureResponder(monitor, policy, pool,
                (worker, reason) -> {
                    killed.add(worker);
                    pool.remove(worker);
                });

        out.printf("Drill: %d workers, policy %s%n%n", pool.size(), policy.name());

        try (monitor) {
            monitor.start(responder);
            while (pool.size() > 0) {
                monitor.tick();
            }
        }

        for (int i = 0; i < killed.size(); i++) {
            Worker worker = killed.get(i);
            out.printf("%2d. submitted #%d  %-32s %s%n",
                    i + 1, submissionIndex.get(worker), worker.assignedTask(),
                    worker.assignedTask().isRetriable() ? "retriable" : "not retriable");
        }
        return 0;
    }

    private static List<TaskSpec> defaultWorkerMix() {
        return List.of(
                TaskSpec.actorTask(7, 1),
                TaskSpec.actorCreationTask(5, 1),
                TaskSpec.normalTask(0, 1),
                TaskSpec.normalTask(11, 2),
                TaskSpec.actorCreationTask(0, 2),
                TaskSpec.actorTask(0, 3));
    }
}
