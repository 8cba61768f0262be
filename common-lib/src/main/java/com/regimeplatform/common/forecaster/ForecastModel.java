package com.regimeplatform.common.forecaster;

import com.regimeplatform.common.model.FeatureState;
import com.regimeplatform.common.model.Tick;

/**
 * Online one-step-ahead forecaster.
 *
 * <p>{@link #predictUpdate} is called exactly once per tick. It folds the current tick into the
 * model state and returns the forecast for the next tick. Implementations must only use data up
 * to and including {@code tick}, and must never throw on numeric trouble: they fall back to the
 * naive forecast {@code tick.x()} instead.
 */
public interface ForecastModel {

    String name();

    double predictUpdate(Tick tick, FeatureState features);
}
