package com.regimeplatform.common.state;

import com.regimeplatform.common.model.Prediction;

public record PredictionReceipt(
    String predictionId,
    String seriesId,
    String targetTimestamp,
    Prediction prediction
) {}
