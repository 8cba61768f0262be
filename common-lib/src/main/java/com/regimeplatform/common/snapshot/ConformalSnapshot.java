package com.regimeplatform.common.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.regimeplatform.common.model.Regime;

import java.util.List;
import java.util.Map;

/**
 * Residual buffers, oldest first. Decay weights are recomputed from position on restore.
 */
public record ConformalSnapshot(
    @JsonProperty("global") List<Double> global,
    @JsonProperty("byRegime") Map<Regime, List<Double>> byRegime
) {}
