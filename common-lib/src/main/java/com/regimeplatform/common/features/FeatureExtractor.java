package com.regimeplatform.common.features;

import com.regimeplatform.common.config.FeatureConfig;
import com.regimeplatform.common.model.FeatureState;
import com.regimeplatform.common.snapshot.FeatureSnapshot;

import java.util.Map;

/**
 * Constant-time rolling statistics for one series.
 *
 * <pre>
 *   m_t   = a * x + (1 - a) * m_{t-1}
 *   s_t   = a * x^2 + (1 - a) * s_{t-1}
 *   var_t = max(0, s_t - m_t^2)
 *   rv_t  = b * (x_t - x_{t-1})^2 + (1 - b) * rv_{t-1}     (b from rvWindow)
 *   ac1_t = EWMA[(x_t - m)(x_{t-1} - m)] / var_t           (clamped to [-1, 1])
 * </pre>
 *
 * <p>A finite {@code rv} covariate overrides the computed realized variance for that tick.
 * Not thread-safe: owned by exactly one pipeline and mutated under its series lock.
 */
public class FeatureExtractor {

    public static final String RV_COVARIATE = "rv";

    private final double alpha;
    private final double rvAlpha;
    private final int minWarmup;

    private long count;
    private double mean;
    private double secondMoment;
    private double realizedVariance;
    private double lagCovariance;
    private Double previousX;

    public FeatureExtractor(FeatureConfig config) {
        this.alpha     = config.effectiveAlpha();
        this.rvAlpha   = config.rvAlpha();
        this.minWarmup = config.minWarmup();
    }

    public FeatureState update(double x) {
        return update(x, Map.of());
    }

    public FeatureState update(double x, Map<String, Double> covariates) {
        count++;
        if (count == 1) {
            mean = x;
            secondMoment = x * x;
        } else {
            mean = alpha * x + (1.0 - alpha) * mean;
            secondMoment = alpha * (x * x) + (1.0 - alpha) * secondMoment;
        }

        // floored: s - m^2 can drift slightly negative in floating point
        double variance = Math.max(0.0, secondMoment - mean * mean);
        double std = Math.sqrt(variance);

        if (previousX != null) {
            double diff = x - previousX;
            realizedVariance = rvAlpha * diff * diff + (1.0 - rvAlpha) * realizedVariance;
            double cross = (x - mean) * (previousX - mean);
            lagCovariance = alpha * cross + (1.0 - alpha) * lagCovariance;
        }
        previousX = x;

        double autocorrelation = variance > 0.0
            ? Math.max(-1.0, Math.min(1.0, lagCovariance / variance))
            : 0.0;
        double zScore = std > 0.0 ? (x - mean) / std : 0.0;

        boolean covariatesDegraded = false;
        double rv = realizedVariance;
        if (covariates != null && covariates.containsKey(RV_COVARIATE)) {
            Double supplied = covariates.get(RV_COVARIATE);
            if (supplied != null && Double.isFinite(supplied) && supplied >= 0.0) {
                rv = supplied;
            } else {
                covariatesDegraded = true;
            }
        }
        if (covariates != null) {
            for (Double v : covariates.values()) {
                if (v == null || !Double.isFinite(v)) {
                    covariatesDegraded = true;
                    break;
                }
            }
        }

        return new FeatureState(mean, secondMoment, variance, std, zScore, std, rv,
            autocorrelation, count, count < minWarmup, covariatesDegraded);
    }

    public long count() {
        return count;
    }

    public FeatureSnapshot snapshot() {
        return new FeatureSnapshot(count, mean, secondMoment, realizedVariance, lagCovariance, previousX);
    }

    public void restore(FeatureSnapshot snapshot) {
        if (snapshot == null) return;
        this.count            = snapshot.count();
        this.mean             = snapshot.mean();
        this.secondMoment     = snapshot.secondMoment();
        this.realizedVariance = snapshot.realizedVariance();
        this.lagCovariance    = snapshot.lagCovariance();
        this.previousX        = snapshot.previousX();
    }
}
