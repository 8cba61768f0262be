package com.regimeplatform.common.conformal;

import com.regimeplatform.common.config.ConformalConfig;
import com.regimeplatform.common.model.Regime;
import com.regimeplatform.common.snapshot.ConformalSnapshot;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Absolute-residual split conformal calibration with a global buffer and, optionally, one buffer
 * per regime.
 *
 * <h3>Radius for level alpha</h3>
 * <pre>
 *   regime buffer >= minSamples → max(q_regime(1 - alpha), q_global(1 - alpha))
 *   otherwise (degraded)        → max(q_global(1 - alpha) * coldScale, coldRadius)
 *   no residual at all          → coldRadius (degraded)
 * </pre>
 * Wider is preferred over under-coverage, hence the max with the global estimate.
 *
 * <p>Residual buffers are only ever fed from matched truths; they never influence the point
 * forecast. Not thread-safe.
 */
public class OnlineConformal {

    private final ConformalConfig config;
    private final ResidualBuffer global;
    private final Map<Regime, ResidualBuffer> byRegime = new EnumMap<>(Regime.class);

    public OnlineConformal(ConformalConfig config) {
        this.config = config;
        this.global = new ResidualBuffer(config.window(), config.decay());
    }

    /**
     * Learns {@code |yTrue - yHat|} into the regime recorded at prediction time and the global
     * buffer. Returns false (and learns nothing) for non-finite input.
     */
    public boolean update(double yHat, double yTrue, Regime regime) {
        double residual = Math.abs(yTrue - yHat);
        if (!Double.isFinite(residual)) return false;
        global.add(residual);
        if (config.byRegime() && regime != null && regime != Regime.UNKNOWN) {
            bufferFor(regime).add(residual);
        }
        return true;
    }

    public ConformalInterval interval(double yHat, Regime regime) {
        return interval(yHat, regime, config.allAlphas());
    }

    public ConformalInterval interval(double yHat, Regime regime, List<Double> alphas) {
        Map<String, List<Double>> intervals = new LinkedHashMap<>();
        boolean degraded = false;
        double primaryRadius = Double.NaN;
        for (Double alpha : alphas) {
            Radius r = radius(alpha, regime);
            degraded |= r.degraded();
            if (Double.isNaN(primaryRadius)) primaryRadius = r.value();
            intervals.put(label(alpha), List.of(yHat - r.value(), yHat + r.value()));
        }
        if (Double.isNaN(primaryRadius)) {
            primaryRadius = config.coldRadius();
            degraded = true;
        }
        return new ConformalInterval(yHat - primaryRadius, yHat + primaryRadius, primaryRadius, intervals, degraded);
    }

    Radius radius(double alpha, Regime regime) {
        double level = 1.0 - alpha;
        ResidualBuffer active = config.byRegime() && regime != null && regime != Regime.UNKNOWN
            ? byRegime.get(regime)
            : global;
        int activeSize = active == null ? 0 : active.size();

        if (global.isEmpty()) {
            return new Radius(config.coldRadius(), true);
        }
        double qGlobal = global.quantile(level);
        if (activeSize < config.minSamples()) {
            return new Radius(Math.max(qGlobal * config.coldScale(), config.coldRadius()), true);
        }
        double qActive = active.quantile(level);
        return new Radius(Math.max(qActive, qGlobal), false);
    }

    private ResidualBuffer bufferFor(Regime regime) {
        return byRegime.computeIfAbsent(regime, r -> new ResidualBuffer(config.window(), config.decay()));
    }

    public int globalSize() {
        return global.size();
    }

    public int regimeSize(Regime regime) {
        ResidualBuffer b = byRegime.get(regime);
        return b == null ? 0 : b.size();
    }

    public static String label(double alpha) {
        return String.format(Locale.ROOT, "alpha=%.2f", alpha);
    }

    public ConformalSnapshot snapshot() {
        Map<Regime, List<Double>> regimes = new EnumMap<>(Regime.class);
        byRegime.forEach((k, v) -> regimes.put(k, v.toList()));
        return new ConformalSnapshot(global.toList(), regimes);
    }

    public void restore(ConformalSnapshot snapshot) {
        if (snapshot == null) return;
        global.clear();
        byRegime.clear();
        if (snapshot.global() != null) {
            snapshot.global().forEach(global::add);
        }
        if (snapshot.byRegime() != null) {
            snapshot.byRegime().forEach((regime, values) -> {
                if (regime == null || values == null) return;
                ResidualBuffer b = bufferFor(regime);
                values.forEach(b::add);
            });
        }
    }

    record Radius(double value, boolean degraded) {}
}
