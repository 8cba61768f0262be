package com.regimeplatform.common.state;

import com.regimeplatform.common.pipeline.Pipeline;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * LRU map of series id → slot, bounded by {@code maxSeries}. A leaf monitor: no series lock is
 * ever acquired while holding it.
 */
final class SeriesRegistry {

    private final int maxSeries;
    private final LinkedHashMap<String, SeriesSlot> slots = new LinkedHashMap<>(16, 0.75f, true);
    private long nextGeneration = 1;

    SeriesRegistry(int maxSeries) {
        this.maxSeries = maxSeries;
    }

    /**
     * Returns the slot for {@code seriesId}, creating it when absent. Slots pushed out by the
     * insertion are flagged evicted and appended to {@code evictedOut}.
     */
    synchronized SeriesSlot getOrCreate(String seriesId, Function<String, Pipeline> pipelineFactory,
                                        List<SeriesSlot> evictedOut) {
        SeriesSlot slot = slots.get(seriesId);
        if (slot != null) {
            return slot;
        }
        slot = new SeriesSlot(seriesId, nextGeneration++, pipelineFactory.apply(seriesId));
        slots.put(seriesId, slot);
        trim(evictedOut);
        return slot;
    }

    /** Lookup that refreshes recency; never creates. */
    synchronized SeriesSlot get(String seriesId) {
        return slots.get(seriesId);
    }

    synchronized SeriesSlot insert(String seriesId, Pipeline pipeline, List<SeriesSlot> evictedOut) {
        SeriesSlot slot = new SeriesSlot(seriesId, nextGeneration++, pipeline);
        SeriesSlot previous = slots.put(seriesId, slot);
        if (previous != null) {
            previous.evicted = true;
            evictedOut.add(previous);
        }
        trim(evictedOut);
        return slot;
    }

    synchronized SeriesSlot remove(String seriesId) {
        SeriesSlot slot = slots.remove(seriesId);
        if (slot != null) {
            slot.evicted = true;
        }
        return slot;
    }

    synchronized List<SeriesSlot> clear() {
        List<SeriesSlot> all = new ArrayList<>(slots.values());
        all.forEach(s -> s.evicted = true);
        slots.clear();
        return all;
    }

    /** Least recently used first. */
    synchronized List<SeriesSlot> snapshotOrder() {
        return new ArrayList<>(slots.values());
    }

    synchronized int size() {
        return slots.size();
    }

    private void trim(List<SeriesSlot> evictedOut) {
        Iterator<Map.Entry<String, SeriesSlot>> it = slots.entrySet().iterator();
        while (slots.size() > maxSeries && it.hasNext()) {
            SeriesSlot victim = it.next().getValue();
            it.remove();
            victim.evicted = true;
            evictedOut.add(victim);
        }
    }
}
