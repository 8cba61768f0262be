package com.regimeplatform.common.config;

/**
 * Model routing policy. {@code switchThreshold} and {@code switchPenalty} are relative loss
 * improvements; {@code lossAlpha} smooths each model's absolute one-step error.
 */
public record RouterConfig(
    String defaultModel,
    int dwellMin,
    double switchThreshold,
    double switchPenalty,
    boolean freezeOnRecentCp,
    int freezeTicks,
    double lossAlpha,
    int minLossSamples
) {
    public RouterConfig {
        if (dwellMin < 0) throw new IllegalArgumentException("router.dwell-min must be >= 0");
        if (switchThreshold < 0.0 || switchPenalty < 0.0) {
            throw new IllegalArgumentException("router.switch-threshold and switch-penalty must be >= 0");
        }
        if (freezeTicks < 0) throw new IllegalArgumentException("router.freeze-ticks must be >= 0");
        if (!(lossAlpha > 0.0 && lossAlpha <= 1.0)) throw new IllegalArgumentException("router.loss-alpha must be in (0, 1]");
        minLossSamples = Math.max(1, minLossSamples);
    }

    public static RouterConfig defaults() {
        return new RouterConfig("EWMA", 10, 0.05, 0.02, true, 5, 0.05, 20);
    }
}
