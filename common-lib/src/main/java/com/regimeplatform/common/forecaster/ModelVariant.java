package com.regimeplatform.common.forecaster;

import java.util.Locale;

/**
 * Forecast model variants in fixed precedence order (richest first). {@link #EWMA} needs no
 * library and is always available.
 */
public enum ModelVariant {
    LINEAR("org.apache.commons.math3.linear.QRDecomposition"),
    AUTOREGRESSIVE("org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression"),
    EWMA(null);

    private final String requiredClass;

    ModelVariant(String requiredClass) {
        this.requiredClass = requiredClass;
    }

    public String requiredClass() {
        return requiredClass;
    }

    public static ModelVariant parse(String raw) {
        if (raw == null) return null;
        String key = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (key) {
            case "LINEAR", "GRADIENT", "XGB", "SGD" -> LINEAR;
            case "AUTOREGRESSIVE", "AR", "ARIMA", "SARIMAX" -> AUTOREGRESSIVE;
            case "EWMA", "BASELINE" -> EWMA;
            default -> null;
        };
    }
}
