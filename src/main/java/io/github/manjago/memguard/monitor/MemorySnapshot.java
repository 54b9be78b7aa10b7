package io.github.manjago.memguard.monitor;

import java.time.Instant;

/**
 * System memory at one point in time, in bytes.
 *
 * A snapshot with a non-positive total is "unknown": the sensor read failed
 * and the values carry no information.
 */
public record MemorySnapshot(
    long totalBytes,
    long usedBytes,
    long freeBytes,
    Instant timestamp
) {

    private static final double BYTES_PER_GB = 1024.0 * 1024.0 * 1024.0;

    /**
     * Zeroed snapshot used when the sensor could not be read.
     */
    public static MemorySnapshot unknown(Instant timestamp) {
        return new MemorySnapshot(0, 0, 0, timestamp);
    }

    /**
     * Build a snapshot from total and free memory; used memory is the difference.
     */
    public static MemorySnapshot ofTotalAndFree(long totalBytes, long freeBytes, Instant timestamp) {
        long free = Math.max(0, Math.min(freeBytes, totalBytes));
        return new MemorySnapshot(totalBytes, totalBytes - free, free, timestamp);
    }

    public boolean isKnown() {
        return totalBytes > 0;
    }

    /**
     * Used / total, or 0 for an unknown snapshot.
     */
    public double usageFraction() {
        return isKnown() ? (double) usedBytes / totalBytes : 0.0;
    }

    public double usedGb() {
        return usedBytes / BYTES_PER_GB;
    }

    public double totalGb() {
        return totalBytes / BYTES_PER_GB;
    }

    @Override
    public String toString() {
        if (!isKnown()) {
            return "MemorySnapshot[unknown, at=" + timestamp + "]";
        }
        return String.format("MemorySnapshot[used=%.2fGB, total=%.2fGB, free=%,d bytes, usage=%.1f%%, at=%s]",
                usedGb(), totalGb(), freeBytes, usageFraction() * 100, timestamp);
    }
}
