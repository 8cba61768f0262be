package com.regimeplatform.common.router;

import com.regimeplatform.common.config.RouterConfig;
import com.regimeplatform.common.snapshot.RouterSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finite state machine over the available forecast models.
 *
 * <h3>Transition rules (evaluated in order)</h3>
 * <ol>
 *   <li>change-point spike with {@code freezeOnRecentCp} → hold for {@code freezeTicks}</li>
 *   <li>fewer than {@code dwellMin} ticks since the last switch → hold</li>
 *   <li>best eligible candidate improves on the current loss by more than
 *       {@code switchThreshold + switchPenalty} (relative) → switch</li>
 *   <li>otherwise → hold</li>
 * </ol>
 *
 * <p>Expected loss per model is an EWMA of its absolute one-step error, fed by
 * {@link #recordLoss}. A model needs {@code minLossSamples} scored forecasts to be a candidate.
 * No terminal state.
 */
public class ModelRouter {

    private static final Logger log = LoggerFactory.getLogger(ModelRouter.class);
    private static final double EPS = 1e-12;

    private final RouterConfig config;
    private final List<String> models;
    private final Map<String, Double> losses = new LinkedHashMap<>();
    private final Map<String, Long> lossSamples = new LinkedHashMap<>();

    private String current;
    private long ticksSinceSwitch;
    private int freezeRemaining;
    private long switchCount;

    public ModelRouter(RouterConfig config, List<String> models) {
        if (models == null || models.isEmpty()) {
            throw new IllegalArgumentException("router needs at least one model");
        }
        this.config = config;
        this.models = List.copyOf(models);
        this.current = models.contains(config.defaultModel()) ? config.defaultModel() : models.get(0);
        for (String m : this.models) {
            losses.put(m, Double.NaN);
            lossSamples.put(m, 0L);
        }
    }

    /** Folds one absolute error into the model's expected loss. Non-finite errors are ignored. */
    public void recordLoss(String model, double absError) {
        if (!losses.containsKey(model) || !Double.isFinite(absError)) return;
        double prev = losses.get(model);
        double next = Double.isNaN(prev)
            ? absError
            : config.lossAlpha() * absError + (1.0 - config.lossAlpha()) * prev;
        losses.put(model, next);
        lossSamples.merge(model, 1L, Long::sum);
    }

    public RouterDecision choose(boolean changePointSpike) {
        ticksSinceSwitch++;

        if (config.freezeOnRecentCp() && changePointSpike && config.freezeTicks() > 0) {
            freezeRemaining = config.freezeTicks();
        }
        if (freezeRemaining > 0) {
            freezeRemaining--;
            return new RouterDecision(current, false, true);
        }
        if (ticksSinceSwitch < config.dwellMin()) {
            return new RouterDecision(current, false, false);
        }

        String best = bestCandidate();
        if (best == null || best.equals(current)) {
            return new RouterDecision(current, false, false);
        }
        double currentLoss = losses.get(current);
        double candidateLoss = losses.get(best);
        if (Double.isNaN(currentLoss) || !eligible(current)) {
            // current model has no track record yet; an eligible candidate wins outright
            return switchTo(best, currentLoss, candidateLoss);
        }
        double improvement = (currentLoss - candidateLoss) / Math.max(currentLoss, EPS);
        if (improvement > config.switchThreshold() + config.switchPenalty()) {
            return switchTo(best, currentLoss, candidateLoss);
        }
        return new RouterDecision(current, false, false);
    }

    private RouterDecision switchTo(String next, double fromLoss, double toLoss) {
        log.debug("[Router] switch from={} to={} fromLoss={} toLoss={} afterTicks={}",
            current, next, fromLoss, toLoss, ticksSinceSwitch);
        current = next;
        ticksSinceSwitch = 0;
        switchCount++;
        return new RouterDecision(current, true, false);
    }

    private String bestCandidate() {
        String best = null;
        double bestLoss = Double.POSITIVE_INFINITY;
        for (String m : models) {
            if (!eligible(m)) continue;
            double l = losses.get(m);
            if (l < bestLoss) {
                bestLoss = l;
                best = m;
            }
        }
        return best;
    }

    private boolean eligible(String model) {
        return lossSamples.getOrDefault(model, 0L) >= config.minLossSamples()
            && !Double.isNaN(losses.getOrDefault(model, Double.NaN));
    }

    public String current() {
        return current;
    }

    public long switchCount() {
        return switchCount;
    }

    public long ticksSinceSwitch() {
        return ticksSinceSwitch;
    }

    public double expectedLoss(String model) {
        return losses.getOrDefault(model, Double.NaN);
    }

    public RouterSnapshot snapshot() {
        Map<String, Double> scored = new LinkedHashMap<>();
        losses.forEach((m, l) -> {
            if (Double.isFinite(l)) scored.put(m, l);
        });
        return new RouterSnapshot(current, ticksSinceSwitch, freezeRemaining, switchCount,
            scored, new LinkedHashMap<>(lossSamples));
    }

    public void restore(RouterSnapshot snapshot) {
        if (snapshot == null) return;
        if (snapshot.current() != null && models.contains(snapshot.current())) {
            this.current = snapshot.current();
        }
        this.ticksSinceSwitch = snapshot.ticksSinceSwitch();
        this.freezeRemaining  = Math.max(0, snapshot.freezeRemaining());
        this.switchCount      = snapshot.switchCount();
        if (snapshot.losses() != null) {
            snapshot.losses().forEach((m, l) -> {
                if (losses.containsKey(m) && l != null) losses.put(m, l);
            });
        }
        if (snapshot.lossSamples() != null) {
            snapshot.lossSamples().forEach((m, n) -> {
                if (lossSamples.containsKey(m) && n != null) lossSamples.put(m, n);
            });
        }
    }
}
