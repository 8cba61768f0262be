package com.regimeplatform.common.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.regimeplatform.common.model.PendingPrediction;

import java.time.Instant;
import java.util.List;

/**
 * Best-effort capture of one series: enough to resume calibration and detection after a clean
 * restart. Forecast model internals are not captured; models warm up again after restore.
 */
public record PipelineSnapshot(
    @JsonProperty("seriesId") String seriesId,
    @JsonProperty("lastTimestamp") Instant lastTimestamp,
    @JsonProperty("features") FeatureSnapshot features,
    @JsonProperty("detector") DetectorSnapshot detector,
    @JsonProperty("router") RouterSnapshot router,
    @JsonProperty("conformal") ConformalSnapshot conformal,
    @JsonProperty("pending") List<PendingPrediction> pending
) {}
