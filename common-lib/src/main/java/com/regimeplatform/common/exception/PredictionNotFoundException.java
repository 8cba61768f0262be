package com.regimeplatform.common.exception;

/**
 * Truth submitted for a prediction that is unknown, already evicted, or whose series was evicted.
 */
public class PredictionNotFoundException extends ForecastException {

    public PredictionNotFoundException(String message) {
        super("NOT_FOUND", message);
    }

    public static PredictionNotFoundException forId(String predictionId) {
        return new PredictionNotFoundException("Unknown prediction_id (not pending): " + predictionId);
    }

    public static PredictionNotFoundException forKey(String seriesId, String targetTimestamp) {
        return new PredictionNotFoundException(String.format(
            "Prediction for (series_id=%s, target_timestamp=%s) not pending", seriesId, targetTimestamp));
    }
}
