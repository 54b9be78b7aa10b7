package io.github.manjago.memguard.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-process registry of live workers.
 *
 * Each assignment gets the next value of a monotonic sequence, which is the
 * worker's assigned task time. Thread-safe; readers get immutable copies.
 */
public class WorkerPool implements WorkerRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    // Insertion order = assignment order
    private final Map<WorkerId, Worker> workers = new LinkedHashMap<>();

    private long nextAssignment = 1;

    /**
     * Start a new worker running the given task.
     *
     * @param task the task to assign
     * @return the new worker
     */
    public synchronized Worker assign(TaskSpec task) {
        if (task == null) {
            throw new IllegalArgumentException("task is required");
        }
        Worker worker = new PooledWorker(WorkerId.random(), task, nextAssignment++);
        workers.put(worker.workerId(), worker);
        log.debug("Assigned {} (pool size: {})", worker.toShortString(), workers.size());
        return worker;
    }

    /**
     * Remove a worker that exited or was killed.
     *
     * @return true if the worker was in the pool
     */
    public synchronized boolean remove(Worker worker) {
        if (worker == null) {
            return false;
        }
        boolean removed = workers.remove(worker.workerId(), worker);
        if (removed) {
            log.debug("Removed {} (pool size: {})", worker.toShortString(), workers.size());
        }
        return removed;
    }

    public synchronized boolean contains(Worker worker) {
        return worker != null && workers.get(worker.workerId()) == worker;
    }

    @Override
    public synchronized List<Worker> liveWorkers() {
        return List.copyOf(workers.values());
    }

    public synchronized int size() {
        return workers.size();
    }

    @Override
    public synchronized String toString() {
        return String.format("WorkerPool[size=%d, assignments=%d]", workers.size(), nextAssignment - 1);
    }

    private record PooledWorker(WorkerId workerId, TaskSpec assignedTask, long assignedTaskTime)
            implements Worker {
    }
}
