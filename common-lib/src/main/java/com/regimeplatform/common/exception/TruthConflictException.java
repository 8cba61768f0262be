package com.regimeplatform.common.exception;

/**
 * Duplicate truth that cannot be treated as an idempotent replay: a different value for an
 * already resolved prediction, or a replay arriving after the idempotency window closed.
 */
public class TruthConflictException extends ForecastException {

    public TruthConflictException(String message) {
        super("CONFLICT", message);
    }
}
