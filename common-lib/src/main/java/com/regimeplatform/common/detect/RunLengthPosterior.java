package com.regimeplatform.common.detect;

import com.regimeplatform.common.snapshot.DetectorSnapshot;
import org.apache.commons.math3.special.Gamma;

import java.util.Arrays;

/**
 * Log-space posterior over run length {@code r = 0..min(t, maxRunLength)} with per-run
 * Normal-Inverse-Gamma sufficient statistics.
 *
 * <p>Storage is fixed at {@code maxRunLength + 1} slots and double-buffered, so an update never
 * allocates. Mass that would grow past the cap is folded into the boundary slot.
 */
final class RunLengthPosterior {

    static final double MIN_SCALE = 1e-12;

    private static final double LOG_PI = Math.log(Math.PI);

    private final int capacity;
    private final double logHazard;
    private final double logSurvival;
    private final double mu0;
    private final double kappa0;
    private final double alpha0;
    private final double beta0;

    private double[] logProb;
    private double[] mu;
    private double[] kappa;
    private double[] alpha;
    private double[] beta;

    private double[] nextLogProb;
    private double[] nextMu;
    private double[] nextKappa;
    private double[] nextAlpha;
    private double[] nextBeta;

    private final double[] logJoint;
    private int size;

    RunLengthPosterior(int maxRunLength, double hazard, double mu0, double kappa0, double alpha0, double beta0) {
        this.capacity    = maxRunLength + 1;
        this.logHazard   = Math.log(hazard);
        this.logSurvival = Math.log1p(-hazard);
        this.mu0    = mu0;
        this.kappa0 = kappa0;
        this.alpha0 = alpha0;
        this.beta0  = beta0;

        this.logProb = new double[capacity];
        this.mu      = new double[capacity];
        this.kappa   = new double[capacity];
        this.alpha   = new double[capacity];
        this.beta    = new double[capacity];
        this.nextLogProb = new double[capacity];
        this.nextMu      = new double[capacity];
        this.nextKappa   = new double[capacity];
        this.nextAlpha   = new double[capacity];
        this.nextBeta    = new double[capacity];
        this.logJoint    = new double[capacity];
        reset();
    }

    /** All mass on {@code r = 0} with the prior statistics. */
    void reset() {
        size = 1;
        logProb[0] = 0.0;
        setPrior(mu, kappa, alpha, beta, 0);
    }

    void update(double x) {
        // 1. predictive probability of x under every run
        for (int r = 0; r < size; r++) {
            logJoint[r] = logProb[r] + studentTLogPdf(x, mu[r], kappa[r], alpha[r], beta[r]);
        }

        // 3. change mass -> r = 0
        double evidence = logSumExp(logJoint, size);
        int nextSize = Math.min(size + 1, capacity);
        nextLogProb[0] = logHazard + evidence;
        setPrior(nextMu, nextKappa, nextAlpha, nextBeta, 0);

        // 2. growth mass -> r + 1, with 5. tail folding into the boundary slot
        for (int i = 1; i < nextSize; i++) {
            nextLogProb[i] = Double.NEGATIVE_INFINITY;
        }
        for (int r = 0; r < size; r++) {
            double growth = logJoint[r] + logSurvival;
            int target = Math.min(r + 1, capacity - 1);
            nextLogProb[target] = logAddExp(nextLogProb[target], growth);
            if (r + 1 < capacity) {
                conjugateUpdate(r, r + 1, x);
            }
        }

        // 4. renormalise
        double total = logSumExp(nextLogProb, nextSize);
        if (!Double.isFinite(total)) {
            reset();
            return;
        }
        for (int i = 0; i < nextSize; i++) {
            nextLogProb[i] -= total;
        }

        swap();
        size = nextSize;
    }

    int size() {
        return size;
    }

    double probability(int runLength) {
        return runLength < size ? Math.exp(logProb[runLength]) : 0.0;
    }

    double totalMass() {
        double sum = 0.0;
        for (int r = 0; r < size; r++) {
            sum += Math.exp(logProb[r]);
        }
        return sum;
    }

    /** Probability mass at run lengths {@code 0..maxRun} inclusive. */
    double massUpTo(int maxRun) {
        double sum = 0.0;
        int upper = Math.min(maxRun, size - 1);
        for (int r = 0; r <= upper; r++) {
            sum += Math.exp(logProb[r]);
        }
        return Math.min(1.0, sum);
    }

    int mode() {
        int best = 0;
        for (int r = 1; r < size; r++) {
            if (logProb[r] > logProb[best]) best = r;
        }
        return best;
    }

    double expectedRunLength() {
        double e = 0.0;
        for (int r = 0; r < size; r++) {
            e += r * Math.exp(logProb[r]);
        }
        return e;
    }

    DetectorSnapshot snapshot(long observations, int cooldownRemaining) {
        return new DetectorSnapshot(observations,
            Arrays.copyOf(logProb, size), Arrays.copyOf(mu, size), Arrays.copyOf(kappa, size),
            Arrays.copyOf(alpha, size), Arrays.copyOf(beta, size), cooldownRemaining);
    }

    void restore(DetectorSnapshot snapshot) {
        double[] lp = snapshot.logProbabilities();
        if (lp == null || lp.length == 0) {
            reset();
            return;
        }
        int n = Math.min(lp.length, capacity);
        System.arraycopy(lp, 0, logProb, 0, n);
        System.arraycopy(snapshot.mu(), 0, mu, 0, n);
        System.arraycopy(snapshot.kappa(), 0, kappa, 0, n);
        System.arraycopy(snapshot.alpha(), 0, alpha, 0, n);
        System.arraycopy(snapshot.beta(), 0, beta, 0, n);
        size = n;
        double total = logSumExp(logProb, size);
        if (!Double.isFinite(total)) {
            reset();
            return;
        }
        for (int i = 0; i < size; i++) {
            logProb[i] -= total;
        }
    }

    // ── math helpers ────────────────────────────────────────────────────────

    private void conjugateUpdate(int from, int to, double x) {
        double k = kappa[from];
        double m = mu[from];
        nextMu[to]    = (k * m + x) / (k + 1.0);
        nextKappa[to] = k + 1.0;
        nextAlpha[to] = alpha[from] + 0.5;
        nextBeta[to]  = beta[from] + k * (x - m) * (x - m) / (2.0 * (k + 1.0));
    }

    private void setPrior(double[] m, double[] k, double[] a, double[] b, int idx) {
        m[idx] = mu0;
        k[idx] = kappa0;
        a[idx] = alpha0;
        b[idx] = beta0;
    }

    private void swap() {
        double[] t;
        t = logProb; logProb = nextLogProb; nextLogProb = t;
        t = mu;      mu      = nextMu;      nextMu      = t;
        t = kappa;   kappa   = nextKappa;   nextKappa   = t;
        t = alpha;   alpha   = nextAlpha;   nextAlpha   = t;
        t = beta;    beta    = nextBeta;    nextBeta    = t;
    }

    /**
     * Student-t log density with {@code df = 2a}, location {@code m} and
     * {@code scale^2 = b (k + 1) / (a k)}; the scale is clamped to {@link #MIN_SCALE}.
     */
    static double studentTLogPdf(double x, double m, double k, double a, double b) {
        double df = 2.0 * a;
        double scale2 = b * (k + 1.0) / (a * k);
        double scale = Math.sqrt(scale2);
        if (!(scale > MIN_SCALE)) {
            scale = MIN_SCALE;
        }
        double z = (x - m) / scale;
        return Gamma.logGamma((df + 1.0) / 2.0) - Gamma.logGamma(df / 2.0)
            - 0.5 * (Math.log(df) + LOG_PI) - Math.log(scale)
            - (df + 1.0) / 2.0 * Math.log1p(z * z / df);
    }

    static double logSumExp(double[] values, int n) {
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            if (values[i] > max) max = values[i];
        }
        if (max == Double.NEGATIVE_INFINITY || Double.isNaN(max)) return max;
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            sum += Math.exp(values[i] - max);
        }
        return max + Math.log(sum);
    }

    static double logAddExp(double a, double b) {
        if (a == Double.NEGATIVE_INFINITY) return b;
        if (b == Double.NEGATIVE_INFINITY) return a;
        double max = Math.max(a, b);
        return max + Math.log1p(Math.exp(-Math.abs(a - b)));
    }
}
