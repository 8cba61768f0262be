package com.regimeplatform.common.time;

import com.regimeplatform.common.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Parses external timestamps: ISO-8601 with {@code Z} or an explicit offset, or epoch seconds
 * (integer or fractional, as a number or a numeric string).
 */
public final class TimestampParser {

    private static final Pattern EPOCH_SECONDS =
        Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    /** Numeric timestamps longer than this are rejected without parsing. */
    static final int MAX_NUMERIC_LENGTH = 64;

    private static final BigDecimal MAX_EPOCH_SECOND = BigDecimal.valueOf(Instant.MAX.getEpochSecond());
    private static final BigDecimal MIN_EPOCH_SECOND = BigDecimal.valueOf(Instant.MIN.getEpochSecond());
    private static final BigDecimal ONE_NANO = BigDecimal.ONE.movePointLeft(9);

    private TimestampParser() {}

    public static Instant parse(String field, Object raw) {
        if (raw == null) {
            throw ValidationException.missingField(field);
        }
        if (raw instanceof Number number) {
            if (!Double.isFinite(number.doubleValue())) {
                throw ValidationException.invalidParameter(field, raw, "a finite epoch-seconds value");
            }
            return fromEpochSeconds(field, boundedDecimal(field, number.toString()));
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            throw ValidationException.missingField(field);
        }
        if (looksNumeric(text)) {
            try {
                return fromEpochSeconds(field, boundedDecimal(field, text));
            } catch (NumberFormatException e) {
                throw new ValidationException("Invalid " + field + ": " + text, e);
            }
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            throw new ValidationException(
                "Invalid " + field + " (expected ISO-8601 with offset or epoch seconds): " + text, e);
        }
    }

    /** Canonical text form used as the pending-index key. */
    public static String canonical(Instant instant) {
        return instant.toString();
    }

    private static BigDecimal boundedDecimal(String field, String text) {
        if (text.length() > MAX_NUMERIC_LENGTH) {
            throw ValidationException.invalidParameter(field, text.substring(0, 16) + "...", "epoch seconds of reasonable length");
        }
        return new BigDecimal(text);
    }

    // compareTo works on exponents, so out-of-range values fail here without expanding digits
    private static Instant fromEpochSeconds(String field, BigDecimal seconds) {
        if (seconds.compareTo(MAX_EPOCH_SECOND) > 0 || seconds.compareTo(MIN_EPOCH_SECOND) < 0) {
            throw new ValidationException("Epoch seconds out of range for " + field + ": " + seconds);
        }
        if (seconds.abs().compareTo(ONE_NANO) < 0) {
            return Instant.EPOCH;
        }
        try {
            BigDecimal whole = seconds.setScale(0, RoundingMode.FLOOR);
            int nanos = seconds.subtract(whole).movePointRight(9).setScale(0, RoundingMode.DOWN).intValueExact();
            return Instant.ofEpochSecond(whole.longValueExact(), nanos);
        } catch (ArithmeticException | DateTimeException e) {
            throw new ValidationException("Epoch seconds out of range for " + field + ": " + seconds, e);
        }
    }

    private static boolean looksNumeric(String text) {
        return EPOCH_SECONDS.matcher(text).matches();
    }
}
