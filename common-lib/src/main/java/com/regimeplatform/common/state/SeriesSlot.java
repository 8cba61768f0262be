package com.regimeplatform.common.state;

import com.regimeplatform.common.pipeline.Pipeline;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One registered series: its pipeline, the lock that serialises every operation on it, and the
 * prediction ids other threads evicted from the pending index on its behalf.
 */
final class SeriesSlot {

    final String seriesId;
    final long generation;
    final ReentrantLock lock = new ReentrantLock();
    final Pipeline pipeline;

    /** Set under the registry monitor when the slot leaves the registry; read under {@link #lock}. */
    volatile boolean evicted;

    private final Queue<String> evictedIds = new ConcurrentLinkedQueue<>();

    SeriesSlot(String seriesId, long generation, Pipeline pipeline) {
        this.seriesId = seriesId;
        this.generation = generation;
        this.pipeline = pipeline;
    }

    void enqueueEviction(String predictionId) {
        evictedIds.add(predictionId);
    }

    /** Caller holds {@link #lock}. */
    int drainEvictions() {
        int removed = 0;
        String id;
        while ((id = evictedIds.poll()) != null) {
            if (pipeline.evictPrediction(id)) removed++;
        }
        return removed;
    }
}
