package com.regimeplatform.common.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FeatureSnapshot(
    @JsonProperty("count") long count,
    @JsonProperty("mean") double mean,
    @JsonProperty("secondMoment") double secondMoment,
    @JsonProperty("realizedVariance") double realizedVariance,
    @JsonProperty("lagCovariance") double lagCovariance,
    @JsonProperty("previousX") Double previousX
) {}
