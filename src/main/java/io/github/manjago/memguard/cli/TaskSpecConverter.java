package io.github.manjago.memguard.cli;

import io.github.manjago.memguard.worker.TaskSpec;
import io.github.manjago.memguard.worker.TaskType;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/**
 * Parses "kind:budget[:depth]" into a {@link TaskSpec}.
 *
 * kind is a task type short name (normal, actor-creation, actor, driver),
 * budget is max-retries for normal tasks and max-actor-restarts otherwise,
 * depth defaults to 1.
 */
public class TaskSpecConverter implements ITypeConverter<TaskSpec> {

    @Override
    public TaskSpec convert(String value) {
        String[] parts = value.split(":");
        if (parts.length < 2 || parts.length > 3) {
            throw new TypeConversionException("Expected kind:budget[:depth] but was '" + value + "'");
        }
        try {
            TaskType type = TaskType.fromName(parts[0].trim());
            int budget = Integer.parseInt(parts[1].trim());
            int depth = parts.length == 3 ? Integer.parseInt(parts[2].trim()) : 1;

            return switch (type) {
                case NORMAL_TASK -> TaskSpec.normalTask(budget, depth);
                case ACTOR_CREATION_TASK -> TaskSpec.actorCreationTask(budget, depth);
                case ACTOR_TASK -> TaskSpec.actorTask(budget, depth);
                case DRIVER_TASK -> new TaskSpec(TaskType.DRIVER_TASK, 0, 0, depth);
            };
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            throw new TypeConversionException("Invalid worker '" + value + "': " + e.getMessage());
        }
    }
}
