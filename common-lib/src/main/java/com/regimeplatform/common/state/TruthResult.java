package com.regimeplatform.common.state;

/**
 * @param matchedBy {@code prediction_id}, {@code series_target} or {@code fifo}
 */
public record TruthResult(TruthStatus status, String predictionId, String seriesId, String matchedBy) {

    public boolean idempotent() {
        return status == TruthStatus.IDEMPOTENT;
    }
}
