package com.regimeplatform.forecast.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SnapshotResponse(
    @JsonProperty("status") String status,
    @JsonProperty("name") String name,
    @JsonProperty("series") int series
) {}
