package io.github.manjago.memguard.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DrillCommandTest {

    /**
     * Run the drill and return the submission numbers in kill order.
     */
    private List<String> killOrder(String... args) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

        int exitCode = new CommandLine(new DrillCommand(out)).execute(args);
        assertEquals(0, exitCode);

        return Arrays.stream(buffer.toString(StandardCharsets.UTF_8).split("\n"))
                .filter(line -> line.contains("submitted #"))
                .map(line -> line.replaceAll(".*submitted #(\\d+).*", "$1"))
                .toList();
    }

    @Test
    @DisplayName("Default mix under retriable-lifo")
    void defaultMixRetriableLifo() {
        assertEquals(List.of("4", "2", "6", "5", "3", "1"), killOrder("-p", "retriable-lifo"));
    }

    @Test
    @DisplayName("Explicit workers under group-by-depth")
    void groupByDepth() {
        List<String> order = killOrder("-p", "group-by-depth",
                "-w", "normal:0:1", "-w", "normal:0:1", "-w", "normal:0:2", "-w", "normal:0:2");

        assertEquals(List.of("4", "2", "3", "1"), order);
    }

    @Test
    @DisplayName("Bad worker spec is a usage error")
    void badWorker() {
        PrintStream out = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);
        CommandLine cli = new CommandLine(new DrillCommand(out));
        cli.setErr(new PrintWriter(new ByteArrayOutputStream()));

        assertNotEquals(0, cli.execute("-w", "normal"));
    }
}
