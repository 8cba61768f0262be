package com.regimeplatform.common.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Online conformal calibration settings.
 *
 * <p>{@code alpha} is the primary miscoverage level; {@code auxAlphas} are reported alongside.
 * {@code coldScale} multiplies the global quantile when a regime buffer is below
 * {@code minSamples}; {@code coldRadius} is used while no residual has been observed at all.
 */
public record ConformalConfig(
    int window,
    double decay,
    boolean byRegime,
    int minSamples,
    double coldScale,
    double coldRadius,
    double alpha,
    List<Double> auxAlphas
) {
    public ConformalConfig {
        if (window < 1) throw new IllegalArgumentException("conformal.window must be >= 1");
        if (!(decay > 0.0 && decay <= 1.0)) throw new IllegalArgumentException("conformal.decay must be in (0, 1]");
        if (!(alpha > 0.0 && alpha < 1.0)) throw new IllegalArgumentException("conformal.alpha must be in (0, 1)");
        if (coldScale <= 0.0) throw new IllegalArgumentException("conformal.cold-scale must be > 0");
        if (coldRadius < 0.0) throw new IllegalArgumentException("conformal.cold-radius must be >= 0");
        minSamples = Math.max(1, minSamples);
        auxAlphas = auxAlphas == null ? List.of() : List.copyOf(auxAlphas);
        for (Double a : auxAlphas) {
            if (a == null || !(a > 0.0 && a < 1.0)) {
                throw new IllegalArgumentException("conformal.aux-alphas entries must be in (0, 1)");
            }
        }
    }

    public static ConformalConfig defaults() {
        return new ConformalConfig(500, 1.0, true, 30, 1.25, 0.01, 0.1, List.of(0.05, 0.2));
    }

    /** Primary alpha first, then the auxiliary ones without duplicates. */
    public List<Double> allAlphas() {
        List<Double> out = new ArrayList<>();
        out.add(alpha);
        for (Double a : auxAlphas) {
            if (!out.contains(a)) out.add(a);
        }
        return Collections.unmodifiableList(out);
    }
}
