package com.regimeplatform.common.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Serialized capture of every series held by the state manager, least recently used first.
 */
public record ServiceSnapshot(
    @JsonProperty("version") int version,
    @JsonProperty("capturedAt") Instant capturedAt,
    @JsonProperty("series") List<PipelineSnapshot> series
) {
    public static final int CURRENT_VERSION = 1;
}
