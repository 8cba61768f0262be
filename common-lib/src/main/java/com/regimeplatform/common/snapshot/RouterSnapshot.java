package com.regimeplatform.common.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record RouterSnapshot(
    @JsonProperty("current") String current,
    @JsonProperty("ticksSinceSwitch") long ticksSinceSwitch,
    @JsonProperty("freezeRemaining") int freezeRemaining,
    @JsonProperty("switchCount") long switchCount,
    @JsonProperty("losses") Map<String, Double> losses,
    @JsonProperty("lossSamples") Map<String, Long> lossSamples
) {}
