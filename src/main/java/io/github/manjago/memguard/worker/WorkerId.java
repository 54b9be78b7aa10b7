package io.github.manjago.memguard.worker;

import java.util.UUID;

/**
 * Unique identity of a worker process.
 */
public record WorkerId(UUID value) {

    public WorkerId {
        if (value == null) {
            throw new IllegalArgumentException("value is required");
        }
    }

    public static WorkerId random() {
        return new WorkerId(UUID.randomUUID());
    }

    /**
     * First 8 hex digits, for logs.
     */
    public String toShortString() {
        return value.toString().substring(0, 8);
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
