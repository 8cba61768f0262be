package com.regimeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A forecast awaiting its truth value. Consumed at most once, then discarded.
 */
public record PendingPrediction(
    @JsonProperty("predictionId") String predictionId,
    @JsonProperty("seriesId") String seriesId,
    @JsonProperty("targetTimestamp") String targetTimestamp,
    @JsonProperty("yHat") double yHat,
    @JsonProperty("regime") Regime regime,
    @JsonProperty("createdAt") Instant createdAt
) {}
