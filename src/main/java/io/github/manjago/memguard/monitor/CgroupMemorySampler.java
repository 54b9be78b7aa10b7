package io.github.manjago.memguard.monitor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Reads the memory limit and usage of the cgroup this process runs in.
 *
 * Supports cgroup v2 (unified hierarchy, memory.max) and cgroup v1
 * (memory/memory.limit_in_bytes). Reclaimable page cache (inactive_file)
 * is not counted as used.
 */
public class CgroupMemorySampler {

    private static final String V2_LIMIT = "memory.max";
    private static final String V2_USAGE = "memory.current";
    private static final String V2_STAT = "memory.stat";
    private static final String V2_INACTIVE_FILE = "inactive_file";

    private static final String V1_LIMIT = "memory/memory.limit_in_bytes";
    private static final String V1_USAGE = "memory/memory.usage_in_bytes";
    private static final String V1_STAT = "memory/memory.stat";
    private static final String V1_INACTIVE_FILE = "total_inactive_file";

    private static final String UNLIMITED = "max";

    private final Path cgroupRoot;
    private final Clock clock;

    public CgroupMemorySampler(Path cgroupRoot, Clock clock) {
        this.cgroupRoot = cgroupRoot;
        this.clock = clock;
    }

    /**
     * Sample the cgroup view of memory.
     *
     * @return the snapshot, or empty if no cgroup memory controller is
     *         visible or the cgroup has no limit
     * @throws MemorySamplingException if the controller files exist but cannot be read
     */
    public Optional<MemorySnapshot> sampleIfLimited() throws MemorySamplingException {
        if (Files.isRegularFile(cgroupRoot.resolve(V2_LIMIT))) {
            return read(V2_LIMIT, V2_USAGE, V2_STAT, V2_INACTIVE_FILE);
        }
        if (Files.isRegularFile(cgroupRoot.resolve(V1_LIMIT))) {
            return read(V1_LIMIT, V1_USAGE, V1_STAT, V1_INACTIVE_FILE);
        }
        return Optional.empty();
    }

    private Optional<MemorySnapshot> read(String limitFile, String usageFile,
                                          String statFile, String inactiveKey) throws MemorySamplingException {
        String limitText = readFirstLine(cgroupRoot.resolve(limitFile));
        if (limitText.equals(UNLIMITED)) {
            return Optional.empty();
        }
        long limit = parseLong(limitText, limitFile);
        if (limit <= 0) {
            return Optional.empty();
        }

        long usage = parseLong(readFirstLine(cgroupRoot.resolve(usageFile)), usageFile);
        long inactiveFile = readStat(cgroupRoot.resolve(statFile), inactiveKey);
        long used = Math.max(0, usage - inactiveFile);

        return Optional.of(MemorySnapshot.ofTotalAndFree(limit, limit - used, clock.instant()));
    }

    private long readStat(Path statPath, String key) throws MemorySamplingException {
        if (!Files.isRegularFile(statPath)) {
            return 0;
        }
        for (String line : readLines(statPath)) {
            String[] parts = line.trim().split("\\s+");
            if (parts.length == 2 && parts[0].equals(key)) {
                return parseLong(parts[1], statPath.getFileName().toString());
            }
        }
        return 0;
    }

    private String readFirstLine(Path path) throws MemorySamplingException {
        List<String> lines = readLines(path);
        if (lines.isEmpty()) {
            throw new MemorySamplingException("Empty cgroup file " + path);
        }
        return lines.get(0).trim();
    }

    private static List<String> readLines(Path path) throws MemorySamplingException {
        try {
            return Files.readAllLines(path, StandardCharsets.US_ASCII);
        } catch (IOException e) {
            throw new MemorySamplingException("Cannot read " + path, e);
        }
    }

    private static long parseLong(String text, String source) throws MemorySamplingException {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new MemorySamplingException("Malformed value in " + source + ": " + text, e);
        }
    }

    @Override
    public String toString() {
        return "CgroupMemorySampler[" + cgroupRoot + "]";
    }
}
