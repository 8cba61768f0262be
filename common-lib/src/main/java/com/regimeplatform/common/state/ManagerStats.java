package com.regimeplatform.common.state;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ManagerStats(
    @JsonProperty("series") int series,
    @JsonProperty("pending") int pending,
    @JsonProperty("resolved_ids") int resolvedIds,
    @JsonProperty("queued_truths") int queuedTruths,
    @JsonProperty("predictions") long predictions,
    @JsonProperty("truths_applied") long truthsApplied,
    @JsonProperty("evicted_predictions") long evictedPredictions,
    @JsonProperty("evicted_series") long evictedSeries
) {}
