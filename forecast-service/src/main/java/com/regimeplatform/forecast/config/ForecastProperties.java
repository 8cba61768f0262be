package com.regimeplatform.forecast.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalised engine and service settings. Converted once into the framework-free config records
 * by {@link ForecastServiceConfig}.
 */
@Data
@ConfigurationProperties(prefix = "forecast")
public class ForecastProperties {

    private Features features = new Features();
    private Detector detector = new Detector();
    private Router router = new Router();
    private Models models = new Models();
    private Conformal conformal = new Conformal();
    private Service service = new Service();

    @Data
    public static class Features {
        private int window = 20;
        private int rvWindow = 20;
        /** Overrides the window-derived smoothing factor when set in (0, 1]. */
        private double ewmAlpha = 0.1;
        private int minWarmup = 20;
    }

    @Data
    public static class Detector {
        private double hazard = 1.0 / 200;
        private int maxRunLength = 300;
        private double threshold = 0.5;
        private int cooldown = 10;
        private int shortRunWindow = 5;
        private double mu0 = 0.0;
        private double kappa0 = 1.0;
        private double alpha0 = 1.0;
        private double beta0 = 0.1;
        /** Feature std at or above which a series counts as volatile; 0 disables. */
        private double volThreshold = 0.0;
    }

    @Data
    public static class Router {
        private String defaultModel = "EWMA";
        private int dwellMin = 10;
        private double switchThreshold = 0.05;
        private double switchPenalty = 0.02;
        private boolean freezeOnRecentCp = true;
        private int freezeTicks = 5;
        private double lossAlpha = 0.05;
        private int minLossSamples = 20;
    }

    @Data
    public static class Models {
        private List<String> enabled = new ArrayList<>(List.of("LINEAR", "AUTOREGRESSIVE", "EWMA"));
        private double ewmaAlpha = 0.2;
        private int arOrder = 2;
        private int arWindow = 500;
        private int arRefitEvery = 50;
        private int linearWindow = 1000;
        private int linearRetrainEvery = 50;
        private int linearMinTrain = 200;
        private double linearRidge = 1e-3;
    }

    @Data
    public static class Conformal {
        private int window = 500;
        private double decay = 1.0;
        private boolean byRegime = true;
        private int minSamples = 30;
        private double coldScale = 1.25;
        private double coldRadius = 0.01;
        private double alpha = 0.1;
        private List<Double> auxAlphas = new ArrayList<>(List.of(0.05, 0.2));
    }

    @Data
    public static class Service {
        private int pendingCap = 4096;
        private int maxSeries = 1024;
        private Duration truthTtl = Duration.ofHours(1);
        private int truthMaxIds = 100_000;
        private String truthMatching = "KEYED";
        private boolean queueEarlyTruths = false;
        private boolean selfTruth = false;
        private String stateDir = "./state";
        private int stateKeep = 5;
        private boolean snapshotOnShutdown = true;
        private boolean restoreOnStartup = true;
        /** Empty disables authentication. */
        private String apiKey = "";
        /** Requests per second per client on predict and truth; 0 disables. */
        private double rateLimitRps = 0.0;
        private int rateLimitBurst = 50;
    }
}
