package com.regimeplatform.common.state;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Service-wide index of outstanding predictions: id → owner and (series, target) → id, in
 * registration order and capped. Eviction is synchronous with the insert that overflows it.
 */
final class PendingIndex {

    record Entry(String predictionId, String seriesId, long generation, String targetTimestamp) {}

    private record Key(String seriesId, String targetTimestamp) {}

    private final int capacity;
    private final LinkedHashMap<String, Entry> byId = new LinkedHashMap<>();
    private final Map<Key, String> byKey = new HashMap<>();

    PendingIndex(int capacity) {
        this.capacity = capacity;
    }

    /** Inserts and returns entries evicted to respect the cap, oldest first. */
    synchronized List<Entry> put(Entry entry) {
        byId.put(entry.predictionId(), entry);
        // newest prediction for a (series, target) wins the key; the older one stays reachable by id
        byKey.put(new Key(entry.seriesId(), entry.targetTimestamp()), entry.predictionId());
        List<Entry> evicted = new ArrayList<>();
        Iterator<Entry> it = byId.values().iterator();
        while (byId.size() > capacity && it.hasNext()) {
            Entry victim = it.next();
            it.remove();
            unlinkKey(victim);
            evicted.add(victim);
        }
        return evicted;
    }

    synchronized Entry get(String predictionId) {
        return byId.get(predictionId);
    }

    synchronized Entry find(String seriesId, String targetTimestamp) {
        String id = byKey.get(new Key(seriesId, targetTimestamp));
        return id == null ? null : byId.get(id);
    }

    synchronized Entry remove(String predictionId) {
        Entry entry = byId.remove(predictionId);
        if (entry != null) {
            unlinkKey(entry);
        }
        return entry;
    }

    synchronized void clear() {
        byId.clear();
        byKey.clear();
    }

    synchronized int size() {
        return byId.size();
    }

    private void unlinkKey(Entry entry) {
        Key key = new Key(entry.seriesId(), entry.targetTimestamp());
        if (Objects.equals(byKey.get(key), entry.predictionId())) {
            byKey.remove(key);
        }
    }
}
