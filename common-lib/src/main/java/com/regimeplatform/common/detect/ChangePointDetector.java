package com.regimeplatform.common.detect;

import com.regimeplatform.common.config.DetectorConfig;
import com.regimeplatform.common.model.Regime;
import com.regimeplatform.common.snapshot.DetectorSnapshot;

/**
 * Bayesian online change-point detection (Adams &amp; MacKay) with a constant hazard and a
 * Normal-Inverse-Gamma conjugate model.
 *
 * <h3>Per observation</h3>
 * <ol>
 *   <li>Student-t predictive of {@code x} under every run length</li>
 *   <li>growth mass {@code p_r * pred_r * (1 - H)} shifts to {@code r + 1}</li>
 *   <li>change mass {@code sum_r p_r * pred_r * H} lands on {@code r = 0}</li>
 *   <li>renormalise, update sufficient statistics</li>
 *   <li>truncate at {@code maxRunLength}, folding the tail into the boundary</li>
 * </ol>
 *
 * <h3>Labelling</h3>
 * The score is the posterior mass at run lengths {@code <= shortRunWindow}. Crossing
 * {@code threshold} raises an alarm and opens a {@code cooldown} window in which no new alarm
 * fires and the regime stays {@link Regime#VOLATILE}. When {@code volThreshold > 0} a feature
 * std at or above it also labels the tick volatile.
 *
 * <p>Not thread-safe; one instance per series.
 */
public class ChangePointDetector {

    private final DetectorConfig config;
    private final RunLengthPosterior posterior;

    private long observations;
    private int cooldownRemaining;

    public ChangePointDetector(DetectorConfig config) {
        this.config = config;
        this.posterior = new RunLengthPosterior(config.maxRunLength(), config.hazard(),
            config.mu0(), config.kappa0(), config.alpha0(), config.beta0());
    }

    public DetectorResult update(double x) {
        return update(x, 0.0);
    }

    public DetectorResult update(double x, double featureStd) {
        posterior.update(x);
        observations++;

        // every run is short while t <= shortRunWindow, so the mass carries no signal yet
        double score = observations > config.shortRunWindow()
            ? posterior.massUpTo(config.shortRunWindow())
            : 0.0;

        boolean changePoint = false;
        if (cooldownRemaining > 0) {
            cooldownRemaining--;
        } else if (score >= config.threshold()) {
            changePoint = true;
            cooldownRemaining = config.cooldown();
        }

        boolean recentChange = changePoint || cooldownRemaining > 0 || score >= config.threshold();
        boolean highVol = config.volThreshold() > 0.0 && featureStd >= config.volThreshold();
        Regime regime = recentChange || highVol ? Regime.VOLATILE : Regime.CALM;

        return new DetectorResult(score, changePoint, regime, posterior.mode(), posterior.expectedRunLength());
    }

    /** Sum of run-length probabilities; 1 within floating tolerance after every update. */
    public double posteriorMass() {
        return posterior.totalMass();
    }

    public int runLengthSupport() {
        return posterior.size();
    }

    public double runLengthProbability(int runLength) {
        return posterior.probability(runLength);
    }

    public long observations() {
        return observations;
    }

    public DetectorSnapshot snapshot() {
        return posterior.snapshot(observations, cooldownRemaining);
    }

    public void restore(DetectorSnapshot snapshot) {
        if (snapshot == null) return;
        posterior.restore(snapshot);
        this.observations = snapshot.observations();
        this.cooldownRemaining = Math.max(0, snapshot.cooldownRemaining());
    }
}
