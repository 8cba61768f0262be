package com.regimeplatform.common.conformal;

import java.util.List;
import java.util.Map;

/**
 * Calibrated interval around a point forecast.
 *
 * @param low       primary lower bound
 * @param high      primary upper bound
 * @param radius    primary radius
 * @param intervals every requested level, keyed {@code alpha=0.10}
 * @param degraded  true when any level fell back to the global buffer or the cold radius
 */
public record ConformalInterval(
    double low,
    double high,
    double radius,
    Map<String, List<Double>> intervals,
    boolean degraded
) {}
