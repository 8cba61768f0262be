package com.regimeplatform.forecast.service;

import com.regimeplatform.common.exception.ValidationException;
import com.regimeplatform.common.model.Tick;
import com.regimeplatform.common.state.ForecastStateManager;
import com.regimeplatform.common.state.ManagerStats;
import com.regimeplatform.common.state.PredictCommand;
import com.regimeplatform.common.state.PredictionReceipt;
import com.regimeplatform.common.state.TruthCommand;
import com.regimeplatform.common.state.TruthResult;
import com.regimeplatform.common.time.TimestampParser;
import com.regimeplatform.forecast.dto.PredictRequest;
import com.regimeplatform.forecast.dto.PredictResponse;
import com.regimeplatform.forecast.dto.SnapshotResponse;
import com.regimeplatform.forecast.dto.TruthRequest;
import com.regimeplatform.forecast.dto.TruthResponse;
import com.regimeplatform.forecast.snapshot.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Boundary between HTTP payloads and the state manager. Parses and validates loosely typed JSON
 * values, then runs the blocking, lock-taking core call on {@code boundedElastic}.
 */
@Service
public class ForecastService {

    private static final Logger log = LoggerFactory.getLogger(ForecastService.class);

    public static final String DEFAULT_SERIES = "default";

    private final ForecastStateManager stateManager;
    private final SnapshotStore snapshotStore;

    public ForecastService(ForecastStateManager stateManager, SnapshotStore snapshotStore) {
        this.stateManager  = stateManager;
        this.snapshotStore = snapshotStore;
    }

    public Mono<PredictResponse> predict(PredictRequest request) {
        return Mono.fromCallable(() -> {
                long start = System.nanoTime();
                PredictCommand command = toCommand(request);
                PredictionReceipt receipt = stateManager.predict(command);
                Map<String, Double> latency = new LinkedHashMap<>(receipt.prediction().stageLatencies());
                latency.put("service_ms", (System.nanoTime() - start) / 1_000_000.0);
                return PredictResponse.from(receipt, latency);
            })
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(r -> log.debug("[ForecastService] predict seriesId={} predictionId={} model={} regime={}",
                r.seriesId(), r.predictionId(), r.model(), r.regime()));
    }

    public Mono<TruthResponse> truth(TruthRequest request) {
        return Mono.fromCallable(() -> {
                TruthResult result = stateManager.applyTruth(toCommand(request));
                return TruthResponse.from(result);
            })
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(r -> log.debug("[ForecastService] truth status={} predictionId={} matchedBy={}",
                r.status(), r.predictionId(), r.matchedBy()));
    }

    public Mono<ManagerStats> stats() {
        return Mono.fromCallable(stateManager::stats);
    }

    public Mono<SnapshotResponse> snapshot() {
        return Mono.fromCallable(() -> {
                String name = snapshotStore.save();
                return new SnapshotResponse("ok", name, stateManager.stats().series());
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<SnapshotResponse> restore(String name) {
        return Mono.fromCallable(() -> {
                int restored = snapshotStore.restore(name);
                return new SnapshotResponse("ok", name == null || name.isBlank() ? "latest.json" : name, restored);
            })
            .subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<List<String>> snapshots() {
        return Mono.fromCallable(snapshotStore::list).subscribeOn(Schedulers.boundedElastic());
    }

    // ── request normalisation ──────────────────────────────────────────────

    static PredictCommand toCommand(PredictRequest request) {
        if (request == null) throw ValidationException.missingField("body");
        Instant timestamp = TimestampParser.parse("timestamp", request.timestamp());
        double x = toFiniteDouble("x", request.x());
        Map<String, Double> covariates = new LinkedHashMap<>();
        if (request.covariates() != null) {
            // non-finite covariates pass through; the feature extractor flags them as degraded
            request.covariates().forEach((k, v) -> covariates.put(k, toDouble(k, v)));
        }
        String target = request.targetTimestamp() == null
            ? TimestampParser.canonical(timestamp)
            : TimestampParser.canonical(TimestampParser.parse("target_timestamp", request.targetTimestamp()));
        return new PredictCommand(seriesOrDefault(request.seriesId()), new Tick(timestamp, x, covariates), target);
    }

    static TruthCommand toCommand(TruthRequest request) {
        if (request == null) throw ValidationException.missingField("body");
        if (request.observed() == null) throw ValidationException.missingField("y");
        double value = toFiniteDouble("y", request.observed());
        if (request.predictionId() != null && !request.predictionId().isBlank()) {
            return TruthCommand.byId(request.predictionId().trim(), value);
        }
        String series = seriesOrDefault(request.seriesId());
        if (request.targetTimestamp() != null) {
            String target = TimestampParser.canonical(TimestampParser.parse("target_timestamp", request.targetTimestamp()));
            return TruthCommand.byKey(series, target, value);
        }
        return TruthCommand.oldest(series, value);
    }

    private static String seriesOrDefault(String seriesId) {
        return seriesId == null || seriesId.isBlank() ? DEFAULT_SERIES : seriesId.trim();
    }

    private static double toFiniteDouble(String field, Object raw) {
        if (raw == null) throw ValidationException.missingField(field);
        double value = toDouble(field, raw);
        if (!Double.isFinite(value)) {
            throw ValidationException.invalidParameter(field, raw, "a finite number");
        }
        return value;
    }

    private static double toDouble(String field, Object raw) {
        if (raw == null) return Double.NaN;
        if (raw instanceof Number n) return n.doubleValue();
        if (raw instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw ValidationException.invalidParameter(field, s, "a number");
            }
        }
        throw ValidationException.invalidParameter(field, raw, "a number");
    }
}
