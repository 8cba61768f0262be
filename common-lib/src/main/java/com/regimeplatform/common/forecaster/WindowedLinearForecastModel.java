package com.regimeplatform.common.forecaster;

import com.regimeplatform.common.model.FeatureState;
import com.regimeplatform.common.model.Tick;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Ridge regression of {@code x_{t+1}} on the feature vector observed at {@code t}
 * ({@code [1, x, m, z, vol, ac1, rv]}), retrained on a sliding window of pairs.
 *
 * <p>A pair is only formed once its target has arrived: the features of tick {@code t} are held
 * back and paired with {@code x_{t+1}} on the next call. Retraining starts after
 * {@code minTrain} pairs and repeats every {@code retrainEvery} ticks.
 */
public class WindowedLinearForecastModel implements ForecastModel {

    private static final Logger log = LoggerFactory.getLogger(WindowedLinearForecastModel.class);

    private final int window;
    private final int retrainEvery;
    private final int minTrain;
    private final double ridge;

    private final Deque<double[]> inputs = new ArrayDeque<>();
    private final Deque<Double> targets = new ArrayDeque<>();

    private double[] lastInput;
    private int sinceRetrain;
    private RealVector weights;

    public WindowedLinearForecastModel(int window, int retrainEvery, int minTrain, double ridge) {
        if (minTrain < 10) throw new IllegalArgumentException("models.linear-min-train must be >= 10");
        if (window < minTrain) throw new IllegalArgumentException("models.linear-window must be >= linear-min-train");
        if (retrainEvery < 1) throw new IllegalArgumentException("models.linear-retrain-every must be >= 1");
        if (ridge < 0.0) throw new IllegalArgumentException("models.linear-ridge must be >= 0");
        this.window = window;
        this.retrainEvery = retrainEvery;
        this.minTrain = minTrain;
        this.ridge = ridge;
    }

    @Override
    public String name() {
        return ModelVariant.LINEAR.name();
    }

    @Override
    public double predictUpdate(Tick tick, FeatureState features) {
        double x = tick.x();
        double[] input = withIntercept(features.regressors(x));

        if (lastInput != null) {
            inputs.addLast(lastInput);
            targets.addLast(x);
            if (inputs.size() > window) {
                inputs.removeFirst();
                targets.removeFirst();
            }
        }
        lastInput = input;
        sinceRetrain++;

        if (inputs.size() >= minTrain && (weights == null || sinceRetrain >= retrainEvery)) {
            retrain();
        }
        if (weights == null) {
            return x;
        }
        double yHat = weights.dotProduct(new ArrayRealVector(input, false));
        return Double.isFinite(yHat) ? yHat : x;
    }

    private void retrain() {
        int n = inputs.size();
        int d = lastInput.length;
        double[][] rows = inputs.toArray(new double[0][]);
        double[] y = new double[n];
        int i = 0;
        for (Double t : targets) {
            y[i++] = t;
        }
        RealMatrix design = new Array2DRowRealMatrix(rows, false);
        RealMatrix gram = design.transpose().multiply(design);

        double trace = 0.0;
        for (int j = 0; j < d; j++) {
            trace += gram.getEntry(j, j);
        }
        double penalty = ridge * Math.max(trace / d, 1e-12);
        // intercept (column 0) is not penalised
        for (int j = 1; j < d; j++) {
            gram.addToEntry(j, j, penalty);
        }
        try {
            RealVector rhs = design.transpose().operate(new ArrayRealVector(y, false));
            RealVector solved = new QRDecomposition(gram).getSolver().solve(rhs);
            for (int j = 0; j < solved.getDimension(); j++) {
                if (!Double.isFinite(solved.getEntry(j))) return;
            }
            weights = solved;
            sinceRetrain = 0;
        } catch (MathIllegalArgumentException | MathArithmeticException e) {
            log.debug("[WindowedLinearForecastModel] retrain skipped. pairs={} reason={}", n, e.getMessage());
            sinceRetrain = 0;
        }
    }

    private static double[] withIntercept(double[] regressors) {
        double[] out = new double[regressors.length + 1];
        out[0] = 1.0;
        System.arraycopy(regressors, 0, out, 1, regressors.length);
        return out;
    }
}
