package com.regimeplatform.common.state;

public enum TruthStatus {
    APPLIED,
    /** Replay of an already applied truth with the same value, inside the idempotency window. */
    IDEMPOTENT,
    /** Held until the matching prediction is registered. */
    QUEUED
}
