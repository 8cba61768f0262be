package com.regimeplatform.common.state;

/**
 * Normalised truth request. Exactly one addressing form is used, checked in this order:
 * prediction id, (series, target timestamp), series alone (oldest pending, FIFO matching only).
 */
public record TruthCommand(String predictionId, String seriesId, String targetTimestamp, double value) {

    public static TruthCommand byId(String predictionId, double value) {
        return new TruthCommand(predictionId, null, null, value);
    }

    public static TruthCommand byKey(String seriesId, String targetTimestamp, double value) {
        return new TruthCommand(null, seriesId, targetTimestamp, value);
    }

    public static TruthCommand oldest(String seriesId, double value) {
        return new TruthCommand(null, seriesId, null, value);
    }

    boolean hasId()  { return predictionId != null && !predictionId.isBlank(); }
    boolean hasKey() { return seriesId != null && targetTimestamp != null; }
}
