package com.regimeplatform.forecast.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The observed value may arrive as {@code y}, {@code y_true} or {@code value}; the first present wins.
 */
public record TruthRequest(
    @JsonProperty("prediction_id") String predictionId,
    @JsonProperty("series_id") String seriesId,
    @JsonProperty("target_timestamp") Object targetTimestamp,
    @JsonProperty("y") Object y,
    @JsonProperty("y_true") Object yTrue,
    @JsonProperty("value") Object value
) {
    public Object observed() {
        if (y != null) return y;
        if (yTrue != null) return yTrue;
        return value;
    }
}
