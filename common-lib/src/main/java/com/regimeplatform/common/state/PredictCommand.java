package com.regimeplatform.common.state;

import com.regimeplatform.common.model.Tick;

/**
 * Normalised predict request. {@code targetTimestamp} is the canonical key the truth will be
 * matched against.
 */
public record PredictCommand(String seriesId, Tick tick, String targetTimestamp) {}
