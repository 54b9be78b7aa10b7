package io.github.manjago.memguard.monitor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads host memory from a /proc/meminfo style file (see proc(5)).
 *
 * Free memory is MemAvailable. Kernels older than 3.14 lack it, then
 * MemFree + Buffers + Cached is used instead.
 */
public class ProcMeminfoSampler implements MemorySampler {

    private static final long BYTES_PER_KB = 1024;

    private final Path meminfoPath;
    private final Clock clock;

    public ProcMeminfoSampler(Path meminfoPath, Clock clock) {
        this.meminfoPath = meminfoPath;
        this.clock = clock;
    }

    @Override
    public MemorySnapshot sample() throws MemorySamplingException {
        Map<String, Long> fields = readFields();

        Long total = fields.get("MemTotal");
        if (total == null || total <= 0) {
            throw new MemorySamplingException("No MemTotal in " + meminfoPath);
        }

        long available;
        if (fields.containsKey("MemAvailable")) {
            available = fields.get("MemAvailable");
        } else {
            available = fields.getOrDefault("MemFree", 0L)
                    + fields.getOrDefault("Buffers", 0L)
                    + fields.getOrDefault("Cached", 0L);
        }

        return MemorySnapshot.ofTotalAndFree(total, available, clock.instant());
    }

    /**
     * Parse "Key:   value kB" lines; values are returned in bytes.
     */
    private Map<String, Long> readFields() throws MemorySamplingException {
        List<String> lines;
        try {
            lines = Files.readAllLines(meminfoPath, StandardCharsets.US_ASCII);
        } catch (IOException e) {
            throw new MemorySamplingException("Cannot read " + meminfoPath, e);
        }

        Map<String, Long> fields = new HashMap<>();
        for (String line : lines) {
            int colon = line.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String key = line.substring(0, colon).trim();
            String[] parts = line.substring(colon + 1).trim().split("\\s+");
            if (parts.length == 0 || parts[0].isEmpty()) {
                continue;
            }
            try {
                long value = Long.parseLong(parts[0]);
                boolean inKb = parts.length > 1 && parts[1].equalsIgnoreCase("kB");
                fields.put(key, inKb ? value * BYTES_PER_KB : value);
            } catch (NumberFormatException e) {
                throw new MemorySamplingException("Malformed line in " + meminfoPath + ": " + line, e);
            }
        }
        return fields;
    }

    @Override
    public String toString() {
        return "ProcMeminfoSampler[" + meminfoPath + "]";
    }
}
