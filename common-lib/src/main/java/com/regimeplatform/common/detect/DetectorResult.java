package com.regimeplatform.common.detect;

import com.regimeplatform.common.model.Regime;

/**
 * Per-tick detector output.
 *
 * @param score              posterior mass at short run lengths, in [0, 1]
 * @param changePoint        true only on the tick an alarm is raised (cooldown suppresses repeats)
 * @param regime             label after cooldown/hysteresis
 * @param runLengthMode      most probable run length
 * @param expectedRunLength  posterior mean run length
 */
public record DetectorResult(
    double score,
    boolean changePoint,
    Regime regime,
    int runLengthMode,
    double expectedRunLength
) {}
