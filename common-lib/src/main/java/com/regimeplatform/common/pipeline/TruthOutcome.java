package com.regimeplatform.common.pipeline;

/**
 * Result of applying a truth value inside one pipeline.
 */
public enum TruthOutcome {
    /** Pending entry removed and its residual learned. */
    APPLIED,
    /** No pending entry with that id (never registered, already consumed, or evicted). */
    NOT_PENDING
}
