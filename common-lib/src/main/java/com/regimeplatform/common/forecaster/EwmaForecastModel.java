package com.regimeplatform.common.forecaster;

import com.regimeplatform.common.model.FeatureState;
import com.regimeplatform.common.model.Tick;

/**
 * Baseline: the next value is forecast as the exponentially weighted mean of values seen so far.
 */
public class EwmaForecastModel implements ForecastModel {

    private final double alpha;
    private boolean initialised;
    private double ema;

    public EwmaForecastModel(double alpha) {
        if (!(alpha > 0.0 && alpha <= 1.0)) {
            throw new IllegalArgumentException("models.ewma-alpha must be in (0, 1]");
        }
        this.alpha = alpha;
    }

    @Override
    public String name() {
        return ModelVariant.EWMA.name();
    }

    @Override
    public double predictUpdate(Tick tick, FeatureState features) {
        double x = tick.x();
        if (!initialised) {
            ema = x;
            initialised = true;
        } else {
            ema = alpha * x + (1.0 - alpha) * ema;
        }
        return ema;
    }
}
