package io.github.manjago.memguard.node;

import io.github.manjago.memguard.config.MonitorConfig;
import io.github.manjago.memguard.monitor.MemoryMonitor;
import io.github.manjago.memguard.monitor.MemorySnapshot;
import io.github.manjago.memguard.policy.GroupByDepthWorkerKillingPolicy;
import io.github.manjago.memguard.policy.RetriableLifoWorkerKillingPolicy;
import io.github.manjago.memguard.worker.TaskSpec;
import io.github.manjago.memguard.worker.Worker;
import io.github.manjago.memguard.worker.WorkerPool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class MemoryPressureResponderTest {

    private static final long GB = 1024L * 1024 * 1024;
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-02-02T02:02:02Z"), ZoneOffset.UTC);

    private WorkerPool pool;
    private AtomicLong freeBytes;
    private MemoryMonitor monitor;
    private List<Worker> terminated;
    private List<String> reasons;

    @BeforeEach
    void setUp() {
        pool = new WorkerPool();
        freeBytes = new AtomicLong(GB);
        terminated = new ArrayList<>();
        reasons = new ArrayList<>();

        MonitorConfig config = MonitorConfig.builder()
                .usageThreshold(0.9)
                .refreshIntervalMs(0)
                .build();
        monitor = new MemoryMonitor(config,
                () -> MemorySnapshot.ofTotalAndFree(16 * GB, freeBytes.get(), CLOCK.instant()), CLOCK);
    }

    @AfterEach
    void tearDown() {
        monitor.close();
    }

    private MemoryPressureResponder startResponder(boolean reapImmediately) {
        MemoryPressureResponder responder = new MemoryPressureResponder(
                monitor, new RetriableLifoWorkerKillingPolicy(), pool,
                (worker, reason) -> {
                    terminated.add(worker);
                    reasons.add(reason);
                    if (reapImmediately) {
                        pool.remove(worker);
                    }
                });
        monitor.start(responder);
        return responder;
    }

    @Test
    @DisplayName("Nothing is killed below the threshold")
    void belowThresholdDoesNothing() {
        pool.assign(TaskSpec.normalTask(1, 1));
        freeBytes.set(8 * GB);
        MemoryPressureResponder responder = startResponder(true);

        monitor.tick();

        assertTrue(terminated.isEmpty());
        assertEquals(0, responder.getKillCount());
    }

    @Test
    @DisplayName("Above the threshold the policy's victim is terminated")
    void killsPolicyVictim() {
        pool.assign(TaskSpec.normalTask(0, 1));
        Worker retriable = pool.assign(TaskSpec.normalTask(3, 1));
        pool.assign(TaskSpec.actorTask(0, 1));
        MemoryPressureResponder responder = startResponder(true);

        monitor.tick();

        assertEquals(List.of(retriable), terminated);
        assertEquals(1, responder.getKillCount());
        assertFalse(pool.contains(retriable));
    }

    @Test
    @DisplayName("Only one kill in flight until the victim leaves the pool")
    void waitsForVictimToExit() {
        Worker older = pool.assign(TaskSpec.normalTask(1, 1));
        Worker newer = pool.assign(TaskSpec.normalTask(1, 1));
        MemoryPressureResponder responder = startResponder(false);

        monitor.tick();
        monitor.tick();
        monitor.tick();

        assertEquals(List.of(newer), terminated);
        assertTrue(responder.isWaitingForVictim());

        pool.remove(newer);
        monitor.tick();

        assertEquals(List.of(newer, older), terminated);
        assertEquals(2, responder.getKillCount());
    }

    @Test
    @DisplayName("Failed termination is not counted and the next tick tries again")
    void failedTerminationRetried() {
        Worker victim = pool.assign(TaskSpec.normalTask(1, 1));
        AtomicInteger attempts = new AtomicInteger();
        MemoryPressureResponder responder = new MemoryPressureResponder(
                monitor, new RetriableLifoWorkerKillingPolicy(), pool,
                (worker, reason) -> {
                    if (attempts.incrementAndGet() == 1) {
                        throw new IllegalStateException("kill signal not delivered");
                    }
                    terminated.add(worker);
                });
        monitor.start(responder);

        monitor.tick();

        assertEquals(1, attempts.get());
        assertEquals(0, responder.getKillCount());
        assertFalse(responder.isWaitingForVictim());

        monitor.tick();

        assertEquals(2, attempts.get());
        assertEquals(List.of(victim), terminated);
        assertEquals(1, responder.getKillCount());
        assertTrue(responder.isWaitingForVictim());
    }

    @Test
    @DisplayName("Empty pool under pressure is reported, not an error")
    void emptyPoolUnrelieved() {
        MemoryPressureResponder responder = startResponder(true);

        monitor.tick();
        monitor.tick();

        assertTrue(terminated.isEmpty());
        assertEquals(2, responder.getUnrelievedTicks());
    }

    @Test
    @DisplayName("Repeated pressure drains the pool in policy order")
    void drainsInPolicyOrder() {
        Worker first = pool.assign(TaskSpec.actorTask(7, 1));
        Worker second = pool.assign(TaskSpec.actorCreationTask(5, 1));
        Worker third = pool.assign(TaskSpec.normalTask(0, 1));
        Worker fourth = pool.assign(TaskSpec.normalTask(11, 1));
        Worker fifth = pool.assign(TaskSpec.actorCreationTask(0, 1));
        Worker sixth = pool.assign(TaskSpec.actorTask(0, 1));
        startResponder(true);

        for (int i = 0; i < 6; i++) {
            monitor.tick();
        }

        assertEquals(List.of(fourth, second, sixth, fifth, third, first), terminated);
        assertEquals(0, pool.size());
    }

    @Test
    @DisplayName("Kill reason names the memory usage, threshold and policy")
    void reasonDescribesPressure() {
        pool.assign(TaskSpec.normalTask(0, 2));
        MemoryPressureResponder responder = new MemoryPressureResponder(
                monitor, new GroupByDepthWorkerKillingPolicy(), pool,
                (worker, reason) -> reasons.add(reason));
        monitor.start(responder);

        monitor.tick();

        String reason = reasons.get(0);
        assertTrue(reason.contains("15.00GB / 16.00GB"), reason);
        assertTrue(reason.contains("0.900"), reason);
        assertTrue(reason.contains(GroupByDepthWorkerKillingPolicy.NAME), reason);
        assertTrue(reason.contains("not retriable"), reason);
    }
}
