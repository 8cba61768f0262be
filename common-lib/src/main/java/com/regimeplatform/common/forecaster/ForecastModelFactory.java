package com.regimeplatform.common.forecaster;

import com.regimeplatform.common.config.ModelConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves which forecast model variants this process can offer, once, at construction.
 *
 * <p>A variant is dropped (with a warning) when it is not enabled, when its backing library is
 * not on the classpath, or when its parameters fail validation. {@link ModelVariant#EWMA} is
 * always kept. After resolution {@link #create} only instantiates variants already known to
 * construct, so nothing on the per-tick path branches on failure.
 */
public class ForecastModelFactory {

    private static final Logger log = LoggerFactory.getLogger(ForecastModelFactory.class);

    private final ModelConfig config;
    private final List<ModelVariant> resolved;

    public ForecastModelFactory(ModelConfig config) {
        this(config, ForecastModelFactory.class.getClassLoader());
    }

    ForecastModelFactory(ModelConfig config, ClassLoader classLoader) {
        this.config = config;
        this.resolved = Collections.unmodifiableList(resolve(config, classLoader));
        log.info("[ForecastModelFactory] resolved variants={} (precedence order)", resolved);
    }

    private List<ModelVariant> resolve(ModelConfig config, ClassLoader classLoader) {
        Set<ModelVariant> requested = EnumSet.noneOf(ModelVariant.class);
        for (String raw : config.enabled()) {
            ModelVariant v = ModelVariant.parse(raw);
            if (v == null) {
                log.warn("[ForecastModelFactory] unknown model variant ignored. name={}", raw);
            } else {
                requested.add(v);
            }
        }

        List<ModelVariant> out = new ArrayList<>();
        for (ModelVariant variant : ModelVariant.values()) {
            if (variant == ModelVariant.EWMA) continue;
            if (!requested.contains(variant)) continue;
            if (!isPresent(variant.requiredClass(), classLoader)) {
                log.warn("[ForecastModelFactory] variant={} unavailable: class {} not found, degrading",
                    variant, variant.requiredClass());
                continue;
            }
            try {
                instantiate(variant);
                out.add(variant);
            } catch (IllegalArgumentException e) {
                log.warn("[ForecastModelFactory] variant={} rejected, degrading. reason={}", variant, e.getMessage());
            }
        }
        instantiate(ModelVariant.EWMA);
        out.add(ModelVariant.EWMA);
        return out;
    }

    private static boolean isPresent(String className, ClassLoader classLoader) {
        if (className == null) return true;
        try {
            Class.forName(className, false, classLoader);
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }

    private ForecastModel instantiate(ModelVariant variant) {
        return switch (variant) {
            case LINEAR -> new WindowedLinearForecastModel(config.linearWindow(), config.linearRetrainEvery(),
                config.linearMinTrain(), config.linearRidge());
            case AUTOREGRESSIVE -> new AutoregressiveForecastModel(config.arOrder(), config.arWindow(),
                config.arRefitEvery());
            case EWMA -> new EwmaForecastModel(config.ewmaAlpha());
        };
    }

    /** Resolved variants, richest first; the last entry is always {@code EWMA}. */
    public List<ModelVariant> variants() {
        return resolved;
    }

    public List<String> modelNames() {
        List<String> names = new ArrayList<>(resolved.size());
        for (ModelVariant v : resolved) {
            names.add(v.name());
        }
        return names;
    }

    /** Fresh model instances for one series, in precedence order. */
    public List<ForecastModel> create() {
        List<ForecastModel> models = new ArrayList<>(resolved.size());
        for (ModelVariant v : resolved) {
            models.add(instantiate(v));
        }
        return models;
    }
}
