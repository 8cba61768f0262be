package com.regimeplatform.forecast.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.regimeplatform.common.model.Prediction;
import com.regimeplatform.common.state.PredictionReceipt;

import java.util.List;
import java.util.Locale;
import java.util.Map;

public record PredictResponse(
    @JsonProperty("prediction_id") String predictionId,
    @JsonProperty("series_id") String seriesId,
    @JsonProperty("target_timestamp") String targetTimestamp,
    @JsonProperty("y_hat") double yHat,
    @JsonProperty("interval_low") double intervalLow,
    @JsonProperty("interval_high") double intervalHigh,
    @JsonProperty("intervals") Map<String, List<Double>> intervals,
    @JsonProperty("regime") String regime,
    @JsonProperty("score") double score,
    @JsonProperty("change_point") boolean changePoint,
    @JsonProperty("model") String model,
    @JsonProperty("warmup") boolean warmup,
    @JsonProperty("degraded") boolean degraded,
    @JsonProperty("latency_ms") Map<String, Double> latencyMs
) {
    public static PredictResponse from(PredictionReceipt receipt, Map<String, Double> latencyMs) {
        Prediction p = receipt.prediction();
        return new PredictResponse(receipt.predictionId(), receipt.seriesId(), receipt.targetTimestamp(),
            p.yHat(), p.intervalLow(), p.intervalHigh(), p.intervals(), p.regime().name().toLowerCase(Locale.ROOT),
            p.score(), p.changePoint(), p.model(), p.warmup(), p.degraded(), latencyMs);
    }
}
