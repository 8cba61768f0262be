package com.regimeplatform.common.exception;

/**
 * Base type for request-level failures raised by the forecasting core.
 * Numeric edge cases are never reported through this hierarchy; they are clamped locally.
 */
public class ForecastException extends RuntimeException {
    private final String errorCode;

    public ForecastException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ForecastException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
