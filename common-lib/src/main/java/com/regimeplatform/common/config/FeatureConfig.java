package com.regimeplatform.common.config;

/**
 * Rolling-statistics settings. When {@code ewmAlpha} is not positive it is derived from
 * {@code window} with the usual EMA-from-window rule {@code 2 / (window + 1)}.
 */
public record FeatureConfig(int window, int rvWindow, double ewmAlpha, int minWarmup) {

    public FeatureConfig {
        if (window < 1) throw new IllegalArgumentException("features.window must be >= 1");
        if (rvWindow < 1) throw new IllegalArgumentException("features.rv-window must be >= 1");
        if (ewmAlpha > 1.0) throw new IllegalArgumentException("features.ewm-alpha must be <= 1");
        minWarmup = Math.max(1, minWarmup);
    }

    public static FeatureConfig defaults() {
        return new FeatureConfig(20, 20, 0.1, 20);
    }

    public double effectiveAlpha() {
        double a = ewmAlpha > 0.0 ? ewmAlpha : 2.0 / (window + 1.0);
        return Math.max(1e-6, Math.min(a, 1.0));
    }

    public double rvAlpha() {
        return 2.0 / (rvWindow + 1.0);
    }
}
