package io.github.manjago.memguard.monitor;

/**
 * Sensor for system-wide memory usage.
 *
 * Implementations read the operating system; tests substitute a lambda.
 */
@FunctionalInterface
public interface MemorySampler {

    /**
     * Read current memory usage.
     *
     * @return a fresh snapshot
     * @throws MemorySamplingException if memory usage could not be determined
     */
    MemorySnapshot sample() throws MemorySamplingException;
}
