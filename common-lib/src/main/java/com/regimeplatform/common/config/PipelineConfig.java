package com.regimeplatform.common.config;

/**
 * Full per-series engine configuration. Built once at startup and shared read-only by every
 * pipeline. {@code selfTruth} makes a pipeline treat each tick's value as the truth of the
 * previous forecast (replay/backtest mode).
 */
public record PipelineConfig(
    FeatureConfig features,
    DetectorConfig detector,
    RouterConfig router,
    ModelConfig models,
    ConformalConfig conformal,
    int pendingCap,
    boolean selfTruth
) {
    public PipelineConfig {
        if (features == null)  features  = FeatureConfig.defaults();
        if (detector == null)  detector  = DetectorConfig.defaults();
        if (router == null)    router    = RouterConfig.defaults();
        if (models == null)    models    = ModelConfig.defaults();
        if (conformal == null) conformal = ConformalConfig.defaults();
        pendingCap = Math.max(1, pendingCap);
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(null, null, null, null, null, 4096, false);
    }

    public PipelineConfig withSelfTruth(boolean enabled) {
        return new PipelineConfig(features, detector, router, models, conformal, pendingCap, enabled);
    }

    public PipelineConfig withConformal(ConformalConfig conformalConfig) {
        return new PipelineConfig(features, detector, router, models, conformalConfig, pendingCap, selfTruth);
    }

    public PipelineConfig withRouter(RouterConfig routerConfig) {
        return new PipelineConfig(features, detector, routerConfig, models, conformal, pendingCap, selfTruth);
    }

    public PipelineConfig withModels(ModelConfig modelConfig) {
        return new PipelineConfig(features, detector, router, modelConfig, conformal, pendingCap, selfTruth);
    }
}
