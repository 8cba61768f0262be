package com.regimeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable view of the rolling statistics after one {@code FeatureExtractor} update.
 */
public record FeatureState(
    @JsonProperty("ewmMean") double ewmMean,
    @JsonProperty("ewmSecondMoment") double ewmSecondMoment,
    @JsonProperty("variance") double variance,
    @JsonProperty("std") double std,
    @JsonProperty("zScore") double zScore,
    @JsonProperty("ewmVolatility") double ewmVolatility,
    @JsonProperty("realizedVariance") double realizedVariance,
    @JsonProperty("autocorrelation") double autocorrelation,
    @JsonProperty("count") long count,
    @JsonProperty("warmup") boolean warmup,
    @JsonProperty("covariatesDegraded") boolean covariatesDegraded
) {
    /** Regressor vector used by the feature-driven models: {@code [x, m, z, vol, ac1, rv]}. */
    public double[] regressors(double x) {
        return new double[] {x, ewmMean, zScore, ewmVolatility, autocorrelation, realizedVariance};
    }
}
