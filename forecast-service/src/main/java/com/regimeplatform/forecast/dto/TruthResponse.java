package com.regimeplatform.forecast.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.regimeplatform.common.state.TruthResult;
import com.regimeplatform.common.state.TruthStatus;

public record TruthResponse(
    @JsonProperty("status") String status,
    @JsonProperty("prediction_id") String predictionId,
    @JsonProperty("series_id") String seriesId,
    @JsonProperty("matched_by") String matchedBy,
    @JsonProperty("idempotent") boolean idempotent
) {
    public static TruthResponse from(TruthResult result) {
        String status = result.status() == TruthStatus.QUEUED ? "queued" : "ok";
        return new TruthResponse(status, result.predictionId(), result.seriesId(), result.matchedBy(),
            result.idempotent());
    }
}
