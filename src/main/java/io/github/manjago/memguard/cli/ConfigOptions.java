package io.github.manjago.memguard.cli;

import io.github.manjago.memguard.config.MonitorConfig;
import io.github.manjago.memguard.policy.KillingPolicyType;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Configuration options shared by all commands.
 *
 * Values come from reference.conf, then the --config file, then the
 * individual options.
 */
public class ConfigOptions {

    @Option(names = {"-f", "--config"}, description = "Configuration file (HOCON)")
    private Path configFile;

    @Option(names = {"-t", "--threshold"}, description = "Memory usage threshold (0.0-1.0)")
    private Double usageThreshold;

    @Option(names = {"--min-free"}, description = "Minimum free memory in bytes (-1 = disabled)")
    private Long minMemoryFreeBytes;

    @Option(names = {"-i", "--interval"}, description = "Refresh interval in ms (0 = manual ticks)")
    private Long refreshIntervalMs;

    @Option(names = {"-p", "--policy"}, description = "Killing policy: retriable-lifo, group-by-depth")
    private String policy;

    public MonitorConfig load() {
        MonitorConfig base = configFile != null ? MonitorConfig.fromFile(configFile) : MonitorConfig.defaults();
        MonitorConfig.Builder builder = base.toBuilder();

        // Override from CLI options
        if (usageThreshold != null) builder.usageThreshold(usageThreshold);
        if (minMemoryFreeBytes != null) builder.minMemoryFreeBytes(minMemoryFreeBytes);
        if (refreshIntervalMs != null) builder.refreshIntervalMs(refreshIntervalMs);
        if (policy != null) builder.killingPolicy(KillingPolicyType.fromConfigName(policy));

        return builder.build();
    }
}
