package io.github.manjago.memguard.cli;

import io.github.manjago.memguard.worker.TaskSpec;
import io.github.manjago.memguard.worker.TaskType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import picocli.CommandLine.TypeConversionException;

import static org.junit.jupiter.api.Assertions.*;

class TaskSpecConverterTest {

    private final TaskSpecConverter converter = new TaskSpecConverter();

    @Test
    @DisplayName("Normal task with depth")
    void normalWithDepth() {
        assertEquals(TaskSpec.normalTask(3, 2), converter.convert("normal:3:2"));
    }

    @Test
    @DisplayName("Depth defaults to 1")
    void defaultDepth() {
        assertEquals(TaskSpec.actorCreationTask(5, 1), converter.convert("actor-creation:5"));
    }

    @Test
    @DisplayName("Budget of an actor task is its restart count")
    void actorBudget() {
        TaskSpec spec = converter.convert("actor:7");
        assertEquals(TaskType.ACTOR_TASK, spec.taskType());
        assertEquals(7, spec.maxActorRestarts());
    }

    @ParameterizedTest
    @ValueSource(strings = {"normal", "normal:x", "normal:1:0", "bogus:1", "normal:1:2:3"})
    @DisplayName("Malformed values are rejected")
    void malformed(String value) {
        assertThrows(TypeConversionException.class, () -> converter.convert(value));
    }
}
