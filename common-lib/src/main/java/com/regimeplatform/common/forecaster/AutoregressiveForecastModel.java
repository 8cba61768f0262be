package com.regimeplatform.common.forecaster;

import com.regimeplatform.common.model.FeatureState;
import com.regimeplatform.common.model.Tick;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AR(p) with intercept, fit by ordinary least squares on the last {@code window} values.
 *
 * <p>Refits are sparse: once every {@code refitEvery} ticks. Between refits the last coefficients
 * are applied to the newest lags. Until a fit succeeds, or when a fit is singular (constant
 * input), the forecast is the naive random walk {@code x_t}.
 */
public class AutoregressiveForecastModel implements ForecastModel {

    private static final Logger log = LoggerFactory.getLogger(AutoregressiveForecastModel.class);
    /** QR pivots below this are treated as singular (collinear or constant history). */
    private static final double SINGULARITY_THRESHOLD = 1e-10;

    private final int order;
    private final int window;
    private final int refitEvery;
    private final double[] history;

    private int size;
    private int head;
    private int sinceRefit;
    private double[] coefficients;

    public AutoregressiveForecastModel(int order, int window, int refitEvery) {
        if (order < 1) throw new IllegalArgumentException("models.ar-order must be >= 1");
        if (window < minObservations(order)) {
            throw new IllegalArgumentException("models.ar-window must be >= " + minObservations(order));
        }
        if (refitEvery < 1) throw new IllegalArgumentException("models.ar-refit-every must be >= 1");
        this.order = order;
        this.window = window;
        this.refitEvery = refitEvery;
        this.history = new double[window];
    }

    private static int minObservations(int order) {
        return Math.max(10, 3 * order + 5);
    }

    @Override
    public String name() {
        return ModelVariant.AUTOREGRESSIVE.name();
    }

    @Override
    public double predictUpdate(Tick tick, FeatureState features) {
        double x = tick.x();
        append(x);
        sinceRefit++;

        if (size >= minObservations(order) && (coefficients == null || sinceRefit >= refitEvery)) {
            refit();
        }
        if (coefficients == null) {
            return x;
        }
        double yHat = coefficients[0];
        for (int lag = 1; lag <= order; lag++) {
            yHat += coefficients[lag] * valueAgo(lag - 1);
        }
        return Double.isFinite(yHat) ? yHat : x;
    }

    private void refit() {
        int rows = size - order;
        double[] y = new double[rows];
        double[][] design = new double[rows][order];
        for (int i = 0; i < rows; i++) {
            // chronological index order + i is the target, its lags precede it
            int t = order + i;
            y[i] = chronological(t);
            for (int lag = 1; lag <= order; lag++) {
                design[i][lag - 1] = chronological(t - lag);
            }
        }
        try {
            OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression(SINGULARITY_THRESHOLD);
            ols.newSampleData(y, design);
            double[] beta = ols.estimateRegressionParameters();
            for (double b : beta) {
                if (!Double.isFinite(b)) return;
            }
            coefficients = beta;
            sinceRefit = 0;
        } catch (MathIllegalArgumentException | MathArithmeticException e) {
            log.debug("[AutoregressiveForecastModel] refit skipped. rows={} reason={}", rows, e.getMessage());
            sinceRefit = 0;
        }
    }

    private void append(double x) {
        history[head] = x;
        head = (head + 1) % window;
        if (size < window) size++;
    }

    /** {@code ago = 0} is the newest value. */
    private double valueAgo(int ago) {
        int idx = Math.floorMod(head - 1 - ago, window);
        return history[idx];
    }

    /** Oldest retained value is index 0. */
    private double chronological(int index) {
        return valueAgo(size - 1 - index);
    }
}
