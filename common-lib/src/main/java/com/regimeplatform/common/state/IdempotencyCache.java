package com.regimeplatform.common.state;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Recently resolved predictions, used to answer replayed truths. Bounded by {@code maxIds}
 * (oldest resolution evicted first, synchronously on insert); entries older than {@code ttl}
 * stay until pushed out but no longer count as idempotent.
 */
final class IdempotencyCache {

    record Resolution(String predictionId, String seriesId, String targetTimestamp,
                      double value, Instant resolvedAt) {}

    private record Key(String seriesId, String targetTimestamp) {}

    private final Duration ttl;
    private final int maxIds;
    private final Clock clock;
    private final LinkedHashMap<String, Resolution> byId = new LinkedHashMap<>();
    private final Map<Key, String> byKey = new HashMap<>();

    IdempotencyCache(Duration ttl, int maxIds, Clock clock) {
        this.ttl = ttl;
        this.maxIds = maxIds;
        this.clock = clock;
    }

    synchronized void record(String predictionId, String seriesId, String targetTimestamp, double value) {
        Resolution r = new Resolution(predictionId, seriesId, targetTimestamp, value, clock.instant());
        byId.put(predictionId, r);
        byKey.put(new Key(seriesId, targetTimestamp), predictionId);
        Iterator<Resolution> it = byId.values().iterator();
        while (byId.size() > maxIds && it.hasNext()) {
            Resolution victim = it.next();
            it.remove();
            Key key = new Key(victim.seriesId(), victim.targetTimestamp());
            if (Objects.equals(byKey.get(key), victim.predictionId())) {
                byKey.remove(key);
            }
        }
    }

    synchronized Resolution byId(String predictionId) {
        return byId.get(predictionId);
    }

    synchronized Resolution byKey(String seriesId, String targetTimestamp) {
        String id = byKey.get(new Key(seriesId, targetTimestamp));
        return id == null ? null : byId.get(id);
    }

    boolean withinTtl(Resolution resolution) {
        return !clock.instant().isAfter(resolution.resolvedAt().plus(ttl));
    }

    synchronized void clear() {
        byId.clear();
        byKey.clear();
    }

    synchronized int size() {
        return byId.size();
    }
}
