package com.regimeplatform.common.config;

/**
 * BOCPD settings: constant hazard, run-length cap, alarm threshold with cooldown, and the
 * Normal-Inverse-Gamma prior {@code (mu0, kappa0, alpha0, beta0)}.
 *
 * <p>{@code volThreshold <= 0} disables the volatility split on the feature std.
 */
public record DetectorConfig(
    double hazard,
    int maxRunLength,
    double threshold,
    int cooldown,
    int shortRunWindow,
    double mu0,
    double kappa0,
    double alpha0,
    double beta0,
    double volThreshold
) {
    public DetectorConfig {
        if (!(hazard > 0.0 && hazard < 1.0)) throw new IllegalArgumentException("detector.hazard must be in (0, 1)");
        if (maxRunLength < 1) throw new IllegalArgumentException("detector.max-run-length must be >= 1");
        if (!(threshold > 0.0 && threshold <= 1.0)) throw new IllegalArgumentException("detector.threshold must be in (0, 1]");
        if (cooldown < 0) throw new IllegalArgumentException("detector.cooldown must be >= 0");
        if (shortRunWindow < 0 || shortRunWindow >= maxRunLength) {
            throw new IllegalArgumentException("detector.short-run-window must be in [0, max-run-length)");
        }
        if (kappa0 <= 0.0 || alpha0 <= 0.0 || beta0 <= 0.0) {
            throw new IllegalArgumentException("detector prior kappa0, alpha0, beta0 must be > 0");
        }
    }

    public static DetectorConfig defaults() {
        return new DetectorConfig(1.0 / 200.0, 300, 0.5, 10, 5, 0.0, 1.0, 1.0, 0.1, 0.0);
    }
}
