package com.regimeplatform.common.exception;

/**
 * Invalid external input: non-finite value, malformed or non-monotonic timestamp, missing field.
 * Always raised before any series state is touched.
 */
public class ValidationException extends ForecastException {

    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }

    public ValidationException(String message, Throwable cause) {
        super("VALIDATION_ERROR", message, cause);
    }

    public static ValidationException missingField(String field) {
        return new ValidationException(String.format("Missing required field '%s'", field));
    }

    public static ValidationException invalidParameter(String paramName, Object value, String expected) {
        return new ValidationException(
            String.format("Invalid parameter '%s': got '%s', expected %s", paramName, value, expected));
    }
}
