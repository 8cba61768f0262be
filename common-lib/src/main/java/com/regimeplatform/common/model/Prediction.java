package com.regimeplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Structured output of one {@code Pipeline.process} call.
 *
 * <p>{@code intervals} is keyed by the alpha label ({@code alpha=0.10}); the primary interval is
 * repeated in {@code intervalLow}/{@code intervalHigh}. {@code stageLatencies} holds
 * milliseconds per stage plus {@code total_ms}.
 */
public record Prediction(
    @JsonProperty("yHat") double yHat,
    @JsonProperty("intervalLow") double intervalLow,
    @JsonProperty("intervalHigh") double intervalHigh,
    @JsonProperty("intervals") Map<String, List<Double>> intervals,
    @JsonProperty("regime") Regime regime,
    @JsonProperty("score") double score,
    @JsonProperty("changePoint") boolean changePoint,
    @JsonProperty("model") String model,
    @JsonProperty("warmup") boolean warmup,
    @JsonProperty("degraded") boolean degraded,
    @JsonProperty("stageLatencies") Map<String, Double> stageLatencies
) {}
