package com.regimeplatform.common.config;

import java.util.List;

/**
 * Forecast model variants and their parameters. {@code enabled} lists the variants the process
 * may construct; precedence among them is fixed by {@code ModelVariant}.
 */
public record ModelConfig(
    List<String> enabled,
    double ewmaAlpha,
    int arOrder,
    int arWindow,
    int arRefitEvery,
    int linearWindow,
    int linearRetrainEvery,
    int linearMinTrain,
    double linearRidge
) {
    public ModelConfig {
        enabled = enabled == null ? List.of("EWMA") : List.copyOf(enabled);
    }

    public static ModelConfig defaults() {
        return new ModelConfig(List.of("LINEAR", "AUTOREGRESSIVE", "EWMA"),
            0.2, 2, 500, 50, 1000, 50, 200, 1e-3);
    }
}
