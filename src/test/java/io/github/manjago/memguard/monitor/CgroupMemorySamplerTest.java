package io.github.manjago.memguard.monitor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CgroupMemorySamplerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-05-05T05:05:05Z"), ZoneOffset.UTC);

    @TempDir
    Path root;

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private Optional<MemorySnapshot> sample() throws MemorySamplingException {
        return new CgroupMemorySampler(root, CLOCK).sampleIfLimited();
    }

    @Test
    @DisplayName("No memory controller means no limit")
    void noController() throws Exception {
        assertTrue(sample().isEmpty());
    }

    @Nested
    @DisplayName("cgroup v2")
    class V2 {

        @Test
        @DisplayName("Usage minus inactive_file against memory.max")
        void limited() throws Exception {
            write("memory.max", "1000\n");
            write("memory.current", "700\n");
            write("memory.stat", "anon 400\ninactive_file 100\nactive_file 200\n");

            MemorySnapshot snapshot = sample().orElseThrow();

            assertEquals(1000, snapshot.totalBytes());
            assertEquals(600, snapshot.usedBytes());
            assertEquals(400, snapshot.freeBytes());
        }

        @Test
        @DisplayName("memory.max of 'max' means no limit")
        void unlimited() throws Exception {
            write("memory.max", "max\n");
            write("memory.current", "700\n");

            assertTrue(sample().isEmpty());
        }

        @Test
        @DisplayName("Missing memory.stat counts no reclaimable cache")
        void missingStat() throws Exception {
            write("memory.max", "1000\n");
            write("memory.current", "250\n");

            assertEquals(250, sample().orElseThrow().usedBytes());
        }

        @Test
        @DisplayName("Garbage in memory.current is a sampling failure")
        void garbageUsage() throws Exception {
            write("memory.max", "1000\n");
            write("memory.current", "n/a\n");

            assertThrows(MemorySamplingException.class, CgroupMemorySamplerTest.this::sample);
        }
    }

    @Nested
    @DisplayName("cgroup v1")
    class V1 {

        @Test
        @DisplayName("Usage minus total_inactive_file against limit_in_bytes")
        void limited() throws Exception {
            write("memory/memory.limit_in_bytes", "2048\n");
            write("memory/memory.usage_in_bytes", "1024\n");
            write("memory/memory.stat", "cache 512\ntotal_inactive_file 24\n");

            MemorySnapshot snapshot = sample().orElseThrow();

            assertEquals(2048, snapshot.totalBytes());
            assertEquals(1000, snapshot.usedBytes());
        }
    }
}
