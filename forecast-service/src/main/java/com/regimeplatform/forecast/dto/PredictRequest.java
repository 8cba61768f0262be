package com.regimeplatform.forecast.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * {@code timestamp} and {@code target_timestamp} accept ISO-8601 text or epoch seconds;
 * {@code x} and covariate values accept numbers or numeric strings.
 */
public record PredictRequest(
    @JsonProperty("timestamp") Object timestamp,
    @JsonProperty("x") Object x,
    @JsonProperty("covariates") Map<String, Object> covariates,
    @JsonProperty("series_id") String seriesId,
    @JsonProperty("target_timestamp") Object targetTimestamp
) {}
