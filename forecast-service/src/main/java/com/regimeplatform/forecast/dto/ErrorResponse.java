package com.regimeplatform.forecast.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record ErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("message") String message,
    @JsonProperty("path") String path,
    @JsonProperty("timestamp") Instant timestamp
) {}
