package com.regimeplatform.common.pipeline;

import com.regimeplatform.common.conformal.ConformalInterval;
import com.regimeplatform.common.conformal.OnlineConformal;
import com.regimeplatform.common.config.PipelineConfig;
import com.regimeplatform.common.detect.ChangePointDetector;
import com.regimeplatform.common.detect.DetectorResult;
import com.regimeplatform.common.exception.ValidationException;
import com.regimeplatform.common.features.FeatureExtractor;
import com.regimeplatform.common.forecaster.ForecastModel;
import com.regimeplatform.common.forecaster.ForecastModelFactory;
import com.regimeplatform.common.model.FeatureState;
import com.regimeplatform.common.model.PendingPrediction;
import com.regimeplatform.common.model.Prediction;
import com.regimeplatform.common.model.Regime;
import com.regimeplatform.common.model.Tick;
import com.regimeplatform.common.router.ModelRouter;
import com.regimeplatform.common.router.RouterDecision;
import com.regimeplatform.common.snapshot.PipelineSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Single-series online pipeline: features → detector → router → model → conformal interval.
 *
 * <h3>Per-tick order (leakage-safe)</h3>
 * <ol>
 *   <li>validate; nothing is mutated for a rejected tick</li>
 *   <li>self-truth mode only: learn the previous forecast's residual against this tick's x</li>
 *   <li>score every model's previous forecast against x (router losses)</li>
 *   <li>features, detector, routing, then every model's {@code predictUpdate}</li>
 *   <li>interval from the residual buffers as they stand now, before this forecast's truth</li>
 * </ol>
 * Registration of the returned forecast for later truth matching is a separate call
 * ({@link #registerPrediction}) so the caller can assign the id.
 *
 * <p>Not thread-safe: the owner serialises all calls for one series.
 */
public class Pipeline {

    private final String seriesId;
    private final PipelineConfig config;
    private final FeatureExtractor features;
    private final ChangePointDetector detector;
    private final ModelRouter router;
    private final List<ForecastModel> models;
    private final OnlineConformal conformal;
    private final LinkedHashMap<String, PendingPrediction> pending = new LinkedHashMap<>();

    private final double[] lastModelForecasts;
    private Instant lastTimestamp;
    private double latestYHat = Double.NaN;
    private Regime latestRegime = Regime.UNKNOWN;
    private String latestPredictionId;
    private boolean latestResolved = true;

    public Pipeline(String seriesId, PipelineConfig config, ForecastModelFactory modelFactory) {
        this.seriesId  = seriesId;
        this.config    = config;
        this.features  = new FeatureExtractor(config.features());
        this.detector  = new ChangePointDetector(config.detector());
        this.models    = modelFactory.create();
        this.router    = new ModelRouter(config.router(), modelFactory.modelNames());
        this.conformal = new OnlineConformal(config.conformal());
        this.lastModelForecasts = new double[models.size()];
        Arrays.fill(lastModelForecasts, Double.NaN);
    }

    /** Throws {@link ValidationException} without touching state when the tick is unusable. */
    public void validate(Tick tick) {
        if (tick == null) throw ValidationException.missingField("tick");
        if (tick.timestamp() == null) throw ValidationException.missingField("timestamp");
        if (!Double.isFinite(tick.x())) {
            throw ValidationException.invalidParameter("x", tick.x(), "a finite number");
        }
        if (lastTimestamp != null && !tick.timestamp().isAfter(lastTimestamp)) {
            throw new ValidationException(String.format(
                "Non-monotonic timestamp for series '%s': %s is not after %s",
                seriesId, tick.timestamp(), lastTimestamp));
        }
    }

    public Prediction process(Tick tick) {
        validate(tick);
        Map<String, Double> latencies = new LinkedHashMap<>();
        long start = System.nanoTime();
        double x = tick.x();

        if (config.selfTruth() && !latestResolved) {
            long t = System.nanoTime();
            applyTruthToLatest(x);
            latencies.put("truth_ms", millisSince(t));
        }
        for (int i = 0; i < models.size(); i++) {
            if (Double.isFinite(lastModelForecasts[i])) {
                router.recordLoss(models.get(i).name(), Math.abs(x - lastModelForecasts[i]));
            }
        }

        long t = System.nanoTime();
        FeatureState featureState = features.update(x, tick.covariates());
        latencies.put("features_ms", millisSince(t));

        t = System.nanoTime();
        DetectorResult detection = detector.update(x, featureState.std());
        latencies.put("detector_ms", millisSince(t));

        t = System.nanoTime();
        RouterDecision decision = router.choose(detection.changePoint());
        latencies.put("router_ms", millisSince(t));

        t = System.nanoTime();
        double yHat = x;
        for (int i = 0; i < models.size(); i++) {
            ForecastModel model = models.get(i);
            double forecast = model.predictUpdate(tick, featureState);
            lastModelForecasts[i] = forecast;
            if (model.name().equals(decision.model())) {
                yHat = forecast;
            }
        }
        latencies.put("model_ms", millisSince(t));

        t = System.nanoTime();
        ConformalInterval interval = conformal.interval(yHat, detection.regime());
        latencies.put("conformal_ms", millisSince(t));

        lastTimestamp = tick.timestamp();
        latestYHat = yHat;
        latestRegime = detection.regime();
        latestPredictionId = null;
        latestResolved = false;

        latencies.put("total_ms", millisSince(start));
        return new Prediction(yHat, interval.low(), interval.high(), interval.intervals(),
            detection.regime(), detection.score(), detection.changePoint(), decision.model(),
            featureState.warmup(), interval.degraded() || featureState.covariatesDegraded(), latencies);
    }

    /**
     * Registers the most recent forecast for truth matching. Returns the ids evicted from this
     * pipeline's own pending set when it exceeds its cap (oldest first).
     */
    public List<String> registerPrediction(PendingPrediction prediction) {
        pending.put(prediction.predictionId(), prediction);
        latestPredictionId = prediction.predictionId();
        List<String> evicted = new ArrayList<>();
        Iterator<String> it = pending.keySet().iterator();
        while (pending.size() > config.pendingCap() && it.hasNext()) {
            evicted.add(it.next());
            it.remove();
        }
        return evicted;
    }

    public TruthOutcome updateTruthById(String predictionId, double yTrue) {
        if (!Double.isFinite(yTrue)) {
            throw ValidationException.invalidParameter("y", yTrue, "a finite number");
        }
        PendingPrediction p = pending.remove(predictionId);
        if (p == null) {
            return TruthOutcome.NOT_PENDING;
        }
        conformal.update(p.yHat(), yTrue, p.regime());
        if (predictionId.equals(latestPredictionId)) {
            latestResolved = true;
        }
        return TruthOutcome.APPLIED;
    }

    /** Oldest pending prediction, used by legacy FIFO truth matching. */
    public Optional<PendingPrediction> oldestPending() {
        Iterator<PendingPrediction> it = pending.values().iterator();
        return it.hasNext() ? Optional.of(it.next()) : Optional.empty();
    }

    /** Best-effort removal after the owner's pending index evicted this id. */
    public boolean evictPrediction(String predictionId) {
        return pending.remove(predictionId) != null;
    }

    private void applyTruthToLatest(double yTrue) {
        if (latestPredictionId != null && pending.containsKey(latestPredictionId)) {
            updateTruthById(latestPredictionId, yTrue);
        } else if (Double.isFinite(latestYHat)) {
            conformal.update(latestYHat, yTrue, latestRegime);
        }
        latestResolved = true;
    }

    private static double millisSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    // ── accessors ──────────────────────────────────────────────────────────

    public String seriesId()              { return seriesId; }
    public Instant lastTimestamp()        { return lastTimestamp; }
    public int pendingCount()             { return pending.size(); }
    public boolean isPending(String id)   { return pending.containsKey(id); }
    public List<String> pendingIds()      { return new ArrayList<>(pending.keySet()); }
    public OnlineConformal conformal()    { return conformal; }
    public ChangePointDetector detector() { return detector; }
    public ModelRouter router()           { return router; }

    // ── snapshot ───────────────────────────────────────────────────────────

    public PipelineSnapshot snapshot() {
        return new PipelineSnapshot(seriesId, lastTimestamp, features.snapshot(), detector.snapshot(),
            router.snapshot(), conformal.snapshot(), new ArrayList<>(pending.values()));
    }

    public static Pipeline restore(PipelineSnapshot snapshot, PipelineConfig config, ForecastModelFactory modelFactory) {
        Pipeline p = new Pipeline(snapshot.seriesId(), config, modelFactory);
        p.lastTimestamp = snapshot.lastTimestamp();
        p.features.restore(snapshot.features());
        p.detector.restore(snapshot.detector());
        p.router.restore(snapshot.router());
        p.conformal.restore(snapshot.conformal());
        if (snapshot.pending() != null) {
            for (PendingPrediction pp : snapshot.pending()) {
                if (pp != null && pp.predictionId() != null) {
                    p.registerPrediction(pp);
                }
            }
        }
        p.latestPredictionId = null;
        p.latestResolved = true;
        return p;
    }
}
