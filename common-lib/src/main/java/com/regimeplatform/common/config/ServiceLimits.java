package com.regimeplatform.common.config;

import java.time.Duration;

/**
 * Bounds of the multi-series state manager.
 */
public record ServiceLimits(
    int pendingCap,
    int maxSeries,
    Duration truthTtl,
    int truthMaxIds,
    TruthMatching truthMatching,
    boolean queueEarlyTruths
) {
    public ServiceLimits {
        if (pendingCap < 1) throw new IllegalArgumentException("service.pending-cap must be >= 1");
        if (maxSeries < 1) throw new IllegalArgumentException("service.max-series must be >= 1");
        if (truthMaxIds < 1) throw new IllegalArgumentException("service.truth-max-ids must be >= 1");
        if (truthTtl == null || truthTtl.isNegative()) truthTtl = Duration.ofHours(1);
        if (truthMatching == null) truthMatching = TruthMatching.KEYED;
    }

    public static ServiceLimits defaults() {
        return new ServiceLimits(4096, 1024, Duration.ofHours(1), 100_000, TruthMatching.KEYED, false);
    }

    public ServiceLimits withPendingCap(int cap) {
        return new ServiceLimits(cap, maxSeries, truthTtl, truthMaxIds, truthMatching, queueEarlyTruths);
    }

    public ServiceLimits withMaxSeries(int cap) {
        return new ServiceLimits(pendingCap, cap, truthTtl, truthMaxIds, truthMatching, queueEarlyTruths);
    }
}
