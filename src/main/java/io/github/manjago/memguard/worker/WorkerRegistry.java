package io.github.manjago.memguard.worker;

import java.util.List;

/**
 * Source of the node's live workers.
 */
public interface WorkerRegistry {

    /**
     * Current live workers, each with an assigned task.
     *
     * @return an immutable copy, never null
     */
    List<Worker> liveWorkers();
}
