package io.github.manjago.memguard.monitor;

/**
 * Thrown when a {@link MemorySampler} cannot determine memory usage.
 */
public class MemorySamplingException extends Exception {

    public MemorySamplingException(String message) {
        super(message);
    }

    public MemorySamplingException(String message, Throwable cause) {
        super(message, cause);
    }
}
