package com.regimeplatform.common.model;

/**
 * Discrete label summarising the change-point detector state for one series.
 * Residual buffers are partitioned by this label.
 */
public enum Regime {
    CALM,
    VOLATILE,
    UNKNOWN
}
