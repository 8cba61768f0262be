package com.regimeplatform.common.state;

import java.util.Iterator;
import java.util.LinkedHashMap;

/**
 * Truths keyed by (series, target) that arrived before their prediction. FIFO bounded.
 */
final class EarlyTruthQueue {

    private record Key(String seriesId, String targetTimestamp) {}

    private final int capacity;
    private final LinkedHashMap<Key, Double> values = new LinkedHashMap<>();

    EarlyTruthQueue(int capacity) {
        this.capacity = capacity;
    }

    synchronized void offer(String seriesId, String targetTimestamp, double value) {
        values.put(new Key(seriesId, targetTimestamp), value);
        Iterator<Key> it = values.keySet().iterator();
        while (values.size() > capacity && it.hasNext()) {
            it.next();
            it.remove();
        }
    }

    synchronized Double take(String seriesId, String targetTimestamp) {
        return values.remove(new Key(seriesId, targetTimestamp));
    }

    synchronized void clear() {
        values.clear();
    }

    synchronized int size() {
        return values.size();
    }
}
