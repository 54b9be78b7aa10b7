package io.github.manjago.memguard.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Entry point of the {@code memguard} executable jar.
 *
 * {@code snapshot} and {@code watch} read the real host (or container)
 * memory with the configured thresholds; {@code drill} replays the kill
 * order of a policy over a made-up worker pool without touching any
 * process. All of them take the shared {@link ConfigOptions}.
 */
@Command(
    name = "memguard",
    description = "Node memory monitor and out-of-memory worker killer",
    mixinStandardHelpOptions = true,
    version = "memguard 1.0.0",
    subcommands = {
        SnapshotCommand.class,
        WatchCommand.class,
        DrillCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class MemguardCli implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    /**
     * A bare {@code memguard} has nothing to do: list the subcommands and
     * fail as a usage error so scripts notice.
     */
    @Override
    public Integer call() {
        spec.commandLine().getErr().println("Missing subcommand: one of snapshot, watch, drill, info");
        spec.commandLine().usage(spec.commandLine().getErr());
        return spec.exitCodeOnInvalidInput();
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MemguardCli())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
