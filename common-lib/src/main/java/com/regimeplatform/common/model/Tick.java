package com.regimeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * One observation of a univariate series. Per series, {@code timestamp} is strictly increasing.
 */
public record Tick(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("x") double x,
    @JsonProperty("covariates") Map<String, Double> covariates
) {
    public Tick {
        covariates = covariates == null ? Map.of() : Map.copyOf(covariates);
    }

    public static Tick of(Instant timestamp, double x) {
        return new Tick(timestamp, x, Map.of());
    }
}
