package io.github.manjago.memguard.monitor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ProcMeminfoSamplerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-05-05T05:05:05Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private ProcMeminfoSampler samplerFor(String content) throws IOException {
        Path meminfo = tempDir.resolve("meminfo");
        Files.writeString(meminfo, content);
        return new ProcMeminfoSampler(meminfo, CLOCK);
    }

    @Test
    @DisplayName("Uses MemTotal and MemAvailable, converting kB to bytes")
    void readsMemAvailable() throws Exception {
        ProcMeminfoSampler sampler = samplerFor("""
                MemTotal:       16000000 kB
                MemFree:         1000000 kB
                MemAvailable:    4000000 kB
                Buffers:          200000 kB
                Cached:          2500000 kB
                HugePages_Total:       0
                """);

        MemorySnapshot snapshot = sampler.sample();

        assertEquals(16_000_000L * 1024, snapshot.totalBytes());
        assertEquals(4_000_000L * 1024, snapshot.freeBytes());
        assertEquals(12_000_000L * 1024, snapshot.usedBytes());
        assertEquals(CLOCK.instant(), snapshot.timestamp());
    }

    @Test
    @DisplayName("Falls back to MemFree + Buffers + Cached without MemAvailable")
    void fallsBackWithoutMemAvailable() throws Exception {
        ProcMeminfoSampler sampler = samplerFor("""
                MemTotal:       8000 kB
                MemFree:        1000 kB
                Buffers:         500 kB
                Cached:         1500 kB
                """);

        MemorySnapshot snapshot = sampler.sample();

        assertEquals(3000L * 1024, snapshot.freeBytes());
        assertEquals(5000L * 1024, snapshot.usedBytes());
    }

    @Test
    @DisplayName("Missing file is a sampling failure")
    void missingFile() {
        ProcMeminfoSampler sampler = new ProcMeminfoSampler(tempDir.resolve("absent"), CLOCK);
        assertThrows(MemorySamplingException.class, sampler::sample);
    }

    @Test
    @DisplayName("Missing MemTotal is a sampling failure")
    void missingTotal() throws Exception {
        ProcMeminfoSampler sampler = samplerFor("MemFree: 100 kB\n");
        assertThrows(MemorySamplingException.class, sampler::sample);
    }

    @Test
    @DisplayName("Malformed numbers are a sampling failure")
    void malformedNumber() throws Exception {
        ProcMeminfoSampler sampler = samplerFor("MemTotal: lots kB\n");
        assertThrows(MemorySamplingException.class, sampler::sample);
    }
}
