package com.regimeplatform.forecast.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.regimeplatform.common.config.ConformalConfig;
import com.regimeplatform.common.config.DetectorConfig;
import com.regimeplatform.common.config.FeatureConfig;
import com.regimeplatform.common.config.ModelConfig;
import com.regimeplatform.common.config.PipelineConfig;
import com.regimeplatform.common.config.RouterConfig;
import com.regimeplatform.common.config.ServiceLimits;
import com.regimeplatform.common.config.TruthMatching;
import com.regimeplatform.common.forecaster.ForecastModelFactory;
import com.regimeplatform.common.state.ForecastStateManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Locale;

@Configuration
public class ForecastServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(ForecastServiceConfig.class);

    @Bean
    public PipelineConfig pipelineConfig(ForecastProperties props) {
        ForecastProperties.Features f = props.getFeatures();
        ForecastProperties.Detector d = props.getDetector();
        ForecastProperties.Router r = props.getRouter();
        ForecastProperties.Models m = props.getModels();
        ForecastProperties.Conformal c = props.getConformal();

        PipelineConfig config = new PipelineConfig(
            new FeatureConfig(f.getWindow(), f.getRvWindow(), f.getEwmAlpha(), f.getMinWarmup()),
            new DetectorConfig(d.getHazard(), d.getMaxRunLength(), d.getThreshold(), d.getCooldown(),
                d.getShortRunWindow(), d.getMu0(), d.getKappa0(), d.getAlpha0(), d.getBeta0(), d.getVolThreshold()),
            new RouterConfig(r.getDefaultModel(), r.getDwellMin(), r.getSwitchThreshold(), r.getSwitchPenalty(),
                r.isFreezeOnRecentCp(), r.getFreezeTicks(), r.getLossAlpha(), r.getMinLossSamples()),
            new ModelConfig(List.copyOf(m.getEnabled()), m.getEwmaAlpha(), m.getArOrder(), m.getArWindow(),
                m.getArRefitEvery(), m.getLinearWindow(), m.getLinearRetrainEvery(), m.getLinearMinTrain(),
                m.getLinearRidge()),
            new ConformalConfig(c.getWindow(), c.getDecay(), c.isByRegime(), c.getMinSamples(), c.getColdScale(),
                c.getColdRadius(), c.getAlpha(), List.copyOf(c.getAuxAlphas())),
            props.getService().getPendingCap(),
            props.getService().isSelfTruth());
        log.info("[ForecastServiceConfig] pipeline configured. models={} alpha={} hazard={} selfTruth={}",
            m.getEnabled(), c.getAlpha(), d.getHazard(), config.selfTruth());
        return config;
    }

    @Bean
    public ServiceLimits serviceLimits(ForecastProperties props) {
        ForecastProperties.Service s = props.getService();
        return new ServiceLimits(s.getPendingCap(), s.getMaxSeries(), s.getTruthTtl(), s.getTruthMaxIds(),
            TruthMatching.valueOf(s.getTruthMatching().trim().toUpperCase(Locale.ROOT)), s.isQueueEarlyTruths());
    }

    @Bean
    public ForecastModelFactory forecastModelFactory(PipelineConfig pipelineConfig) {
        return new ForecastModelFactory(pipelineConfig.models());
    }

    @Bean
    public ForecastStateManager forecastStateManager(PipelineConfig pipelineConfig, ServiceLimits limits,
                                                     ForecastModelFactory modelFactory) {
        return new ForecastStateManager(pipelineConfig, limits, modelFactory);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
