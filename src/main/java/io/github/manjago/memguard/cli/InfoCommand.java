package io.github.manjago.memguard.cli;

import io.github.manjago.memguard.config.MonitorConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * Show the effective configuration.
 */
@Command(
    name = "info",
    description = "Show version and effective configuration",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Mixin
    private ConfigOptions configOptions;

    @Override
    public Integer call() {
        System.out.println("memguard 1.0.0");
        System.out.println();
        System.out.println(configOptions.load());
        return 0;
    }
}
