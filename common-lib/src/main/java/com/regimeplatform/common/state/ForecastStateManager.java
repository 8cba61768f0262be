package com.regimeplatform.common.state;

import com.regimeplatform.common.config.PipelineConfig;
import com.regimeplatform.common.config.ServiceLimits;
import com.regimeplatform.common.config.TruthMatching;
import com.regimeplatform.common.exception.PredictionNotFoundException;
import com.regimeplatform.common.exception.TruthConflictException;
import com.regimeplatform.common.exception.ValidationException;
import com.regimeplatform.common.forecaster.ForecastModelFactory;
import com.regimeplatform.common.model.PendingPrediction;
import com.regimeplatform.common.model.Prediction;
import com.regimeplatform.common.model.Tick;
import com.regimeplatform.common.pipeline.Pipeline;
import com.regimeplatform.common.pipeline.TruthOutcome;
import com.regimeplatform.common.snapshot.PipelineSnapshot;
import com.regimeplatform.common.snapshot.ServiceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Multi-series owner of pipelines, pending predictions and truth idempotency.
 *
 * <h3>Locking</h3>
 * Every predict, truth application and eviction of one series runs under that series' lock.
 * The registry, pending index, idempotency cache and early-truth queue are leaf monitors: none
 * of them is ever held while a series lock is awaited, so distinct series never block each other
 * beyond those short critical sections. A pending id evicted by another series' insert is queued
 * on its owner's slot and dropped from the owner's pipeline the next time that lock is taken;
 * until then the id is already gone from the index, which is what truth matching consults.
 */
public class ForecastStateManager {

    private static final Logger log = LoggerFactory.getLogger(ForecastStateManager.class);

    static final String MATCHED_BY_ID = "prediction_id";
    static final String MATCHED_BY_KEY = "series_target";
    static final String MATCHED_BY_FIFO = "fifo";

    private final PipelineConfig pipelineConfig;
    private final ServiceLimits limits;
    private final ForecastModelFactory modelFactory;
    private final Clock clock;

    private final SeriesRegistry registry;
    private final PendingIndex index;
    private final IdempotencyCache resolved;
    private final EarlyTruthQueue earlyTruths;

    private final AtomicLong predictions = new AtomicLong();
    private final AtomicLong truthsApplied = new AtomicLong();
    private final AtomicLong evictedPredictions = new AtomicLong();
    private final AtomicLong evictedSeries = new AtomicLong();

    public ForecastStateManager(PipelineConfig pipelineConfig, ServiceLimits limits, ForecastModelFactory modelFactory) {
        this(pipelineConfig, limits, modelFactory, Clock.systemUTC());
    }

    public ForecastStateManager(PipelineConfig pipelineConfig, ServiceLimits limits,
                                ForecastModelFactory modelFactory, Clock clock) {
        this.pipelineConfig = pipelineConfig;
        this.limits = limits;
        this.modelFactory = modelFactory;
        this.clock = clock;
        this.registry = new SeriesRegistry(limits.maxSeries());
        this.index = new PendingIndex(limits.pendingCap());
        this.resolved = new IdempotencyCache(limits.truthTtl(), limits.truthMaxIds(), clock);
        this.earlyTruths = new EarlyTruthQueue(limits.pendingCap());
    }

    // ── predict ────────────────────────────────────────────────────────────

    public PredictionReceipt predict(PredictCommand command) {
        String seriesId = requireSeries(command.seriesId());
        Tick tick = command.tick();
        if (tick == null || tick.timestamp() == null) throw ValidationException.missingField("timestamp");
        if (!Double.isFinite(tick.x())) throw ValidationException.invalidParameter("x", tick.x(), "a finite number");
        String target = command.targetTimestamp() != null ? command.targetTimestamp() : tick.timestamp().toString();

        while (true) {
            List<SeriesSlot> evictedSlots = new ArrayList<>();
            SeriesSlot slot = registry.getOrCreate(seriesId, this::newPipeline, evictedSlots);
            releaseSlots(evictedSlots);

            slot.lock.lock();
            try {
                if (slot.evicted) {
                    continue;
                }
                slot.drainEvictions();
                return predictLocked(slot, tick, target);
            } finally {
                slot.lock.unlock();
            }
        }
    }

    private PredictionReceipt predictLocked(SeriesSlot slot, Tick tick, String target) {
        Prediction prediction = slot.pipeline.process(tick);
        String predictionId = UUID.randomUUID().toString();

        PendingPrediction pending = new PendingPrediction(predictionId, slot.seriesId, target,
            prediction.yHat(), prediction.regime(), clock.instant());
        for (String dropped : slot.pipeline.registerPrediction(pending)) {
            if (index.remove(dropped) != null) evictedPredictions.incrementAndGet();
        }
        List<PendingIndex.Entry> overflow =
            index.put(new PendingIndex.Entry(predictionId, slot.seriesId, slot.generation, target));
        for (PendingIndex.Entry victim : overflow) {
            evictedPredictions.incrementAndGet();
            if (victim.seriesId().equals(slot.seriesId) && victim.generation() == slot.generation) {
                slot.pipeline.evictPrediction(victim.predictionId());
            } else {
                SeriesSlot owner = registry.get(victim.seriesId());
                if (owner != null && owner.generation == victim.generation()) {
                    owner.enqueueEviction(victim.predictionId());
                }
            }
            log.debug("[StateManager] pending evicted predictionId={} seriesId={}", victim.predictionId(), victim.seriesId());
        }
        predictions.incrementAndGet();

        if (limits.queueEarlyTruths()) {
            Double early = earlyTruths.take(slot.seriesId, target);
            if (early != null && index.remove(predictionId) != null
                && slot.pipeline.updateTruthById(predictionId, early) == TruthOutcome.APPLIED) {
                resolved.record(predictionId, slot.seriesId, target, early);
                truthsApplied.incrementAndGet();
                log.debug("[StateManager] queued truth applied predictionId={} seriesId={}", predictionId, slot.seriesId);
            }
        }
        return new PredictionReceipt(predictionId, slot.seriesId, target, prediction);
    }

    // ── truth ──────────────────────────────────────────────────────────────

    public TruthResult applyTruth(TruthCommand command) {
        if (!Double.isFinite(command.value())) {
            throw ValidationException.invalidParameter("y", command.value(), "a finite number");
        }
        if (command.hasId()) {
            return applyById(command.predictionId(), command.value());
        }
        if (command.hasKey()) {
            return applyByKey(requireSeries(command.seriesId()), command.targetTimestamp(), command.value());
        }
        if (command.seriesId() != null && limits.truthMatching() == TruthMatching.FIFO) {
            return applyOldest(requireSeries(command.seriesId()), command.value());
        }
        throw new ValidationException("Truth requires prediction_id or series_id with target_timestamp");
    }

    private TruthResult applyById(String predictionId, double value) {
        PendingIndex.Entry entry = index.get(predictionId);
        if (entry == null) {
            return replay(resolved.byId(predictionId), value, MATCHED_BY_ID, predictionId)
                .orElseThrow(() -> PredictionNotFoundException.forId(predictionId));
        }
        return applyEntry(entry, value, MATCHED_BY_ID)
            .orElseThrow(() -> PredictionNotFoundException.forId(predictionId));
    }

    private TruthResult applyByKey(String seriesId, String target, double value) {
        PendingIndex.Entry entry = index.find(seriesId, target);
        if (entry != null) {
            Optional<TruthResult> applied = applyEntry(entry, value, MATCHED_BY_KEY);
            if (applied.isPresent()) return applied.get();
        }
        Optional<TruthResult> replayed = replay(resolved.byKey(seriesId, target), value, MATCHED_BY_KEY, null);
        if (replayed.isPresent()) return replayed.get();
        if (limits.queueEarlyTruths()) {
            earlyTruths.offer(seriesId, target, value);
            log.debug("[StateManager] truth queued seriesId={} target={}", seriesId, target);
            return new TruthResult(TruthStatus.QUEUED, null, seriesId, MATCHED_BY_KEY);
        }
        throw PredictionNotFoundException.forKey(seriesId, target);
    }

    private TruthResult applyOldest(String seriesId, double value) {
        SeriesSlot slot = registry.get(seriesId);
        if (slot == null) throw PredictionNotFoundException.forKey(seriesId, "oldest");
        slot.lock.lock();
        try {
            if (slot.evicted) throw PredictionNotFoundException.forKey(seriesId, "oldest");
            slot.drainEvictions();
            Optional<PendingPrediction> oldest;
            while ((oldest = slot.pipeline.oldestPending()).isPresent()) {
                String id = oldest.get().predictionId();
                if (index.remove(id) != null) {
                    slot.pipeline.updateTruthById(id, value);
                    resolved.record(id, seriesId, oldest.get().targetTimestamp(), value);
                    truthsApplied.incrementAndGet();
                    return new TruthResult(TruthStatus.APPLIED, id, seriesId, MATCHED_BY_FIFO);
                }
                slot.pipeline.evictPrediction(id);
            }
            throw PredictionNotFoundException.forKey(seriesId, "oldest");
        } finally {
            slot.lock.unlock();
        }
    }

    /** Empty when the entry was consumed or evicted before this thread got the series lock. */
    private Optional<TruthResult> applyEntry(PendingIndex.Entry entry, double value, String matchedBy) {
        SeriesSlot slot = registry.get(entry.seriesId());
        if (slot == null || slot.generation != entry.generation()) {
            // left over from an evicted incarnation of the series
            index.remove(entry.predictionId());
            return replay(resolved.byId(entry.predictionId()), value, matchedBy, entry.predictionId());
        }
        slot.lock.lock();
        try {
            if (slot.evicted) {
                return Optional.empty();
            }
            slot.drainEvictions();
            if (index.remove(entry.predictionId()) == null) {
                // a concurrent truth for the same id won; it recorded its resolution under this lock
                return replay(resolved.byId(entry.predictionId()), value, matchedBy, entry.predictionId());
            }
            if (slot.pipeline.updateTruthById(entry.predictionId(), value) != TruthOutcome.APPLIED) {
                return Optional.empty();
            }
            resolved.record(entry.predictionId(), entry.seriesId(), entry.targetTimestamp(), value);
            truthsApplied.incrementAndGet();
            return Optional.of(new TruthResult(TruthStatus.APPLIED, entry.predictionId(), entry.seriesId(), matchedBy));
        } finally {
            slot.lock.unlock();
        }
    }

    private Optional<TruthResult> replay(IdempotencyCache.Resolution previous, double value,
                                         String matchedBy, String predictionId) {
        if (previous == null) {
            return Optional.empty();
        }
        String id = predictionId != null ? predictionId : previous.predictionId();
        if (!resolved.withinTtl(previous)) {
            throw new TruthConflictException("Truth for prediction_id " + id + " already applied and the replay window closed");
        }
        if (Double.compare(previous.value(), value) != 0) {
            throw new TruthConflictException(String.format(
                "Truth for prediction_id %s already applied with y=%s; got y=%s", id, previous.value(), value));
        }
        return Optional.of(new TruthResult(TruthStatus.IDEMPOTENT, id, previous.seriesId(), matchedBy));
    }

    // ── lifecycle ──────────────────────────────────────────────────────────

    public boolean evictSeries(String seriesId) {
        SeriesSlot slot = registry.remove(seriesId);
        if (slot == null) {
            return false;
        }
        releaseSlots(List.of(slot));
        return true;
    }

    /** Captures every live series, least recently used first. Series are locked one at a time. */
    public ServiceSnapshot snapshot() {
        List<PipelineSnapshot> series = new ArrayList<>();
        for (SeriesSlot slot : registry.snapshotOrder()) {
            slot.lock.lock();
            try {
                if (!slot.evicted) {
                    slot.drainEvictions();
                    series.add(slot.pipeline.snapshot());
                }
            } finally {
                slot.lock.unlock();
            }
        }
        return new ServiceSnapshot(ServiceSnapshot.CURRENT_VERSION, clock.instant(), series);
    }

    /** Replaces all state with the snapshot's series. Returns how many were restored. */
    public int restore(ServiceSnapshot snapshot) {
        if (snapshot == null || snapshot.version() != ServiceSnapshot.CURRENT_VERSION) {
            throw new ValidationException("Unsupported snapshot version: "
                + (snapshot == null ? "null" : snapshot.version()));
        }
        registry.clear();
        index.clear();
        resolved.clear();
        earlyTruths.clear();

        int restored = 0;
        List<PipelineSnapshot> series = snapshot.series() == null ? List.of() : snapshot.series();
        for (PipelineSnapshot ps : series) {
            if (ps == null || ps.seriesId() == null) continue;
            Pipeline pipeline = Pipeline.restore(ps, pipelineConfig, modelFactory);
            List<SeriesSlot> evictedSlots = new ArrayList<>();
            SeriesSlot slot = registry.insert(ps.seriesId(), pipeline, evictedSlots);
            releaseSlots(evictedSlots);
            if (ps.pending() != null) {
                for (PendingPrediction pp : ps.pending()) {
                    if (pp == null || !pipeline.isPending(pp.predictionId())) continue;
                    for (PendingIndex.Entry victim : index.put(new PendingIndex.Entry(
                            pp.predictionId(), ps.seriesId(), slot.generation, pp.targetTimestamp()))) {
                        SeriesSlot owner = registry.get(victim.seriesId());
                        if (owner != null && owner.generation == victim.generation()) {
                            owner.enqueueEviction(victim.predictionId());
                        }
                    }
                }
            }
            restored++;
        }
        log.info("[StateManager] restored series={} pending={} capturedAt={}", restored, index.size(), snapshot.capturedAt());
        return restored;
    }

    public ManagerStats stats() {
        return new ManagerStats(registry.size(), index.size(), resolved.size(), earlyTruths.size(),
            predictions.get(), truthsApplied.get(), evictedPredictions.get(), evictedSeries.get());
    }

    public PipelineConfig pipelineConfig() { return pipelineConfig; }
    public ServiceLimits limits()          { return limits; }

    // ── internals ──────────────────────────────────────────────────────────

    private Pipeline newPipeline(String seriesId) {
        log.info("[StateManager] series created seriesId={}", seriesId);
        return new Pipeline(seriesId, pipelineConfig, modelFactory);
    }

    /**
     * Drops the pending entries of slots that already left the registry. Each slot's lock is taken
     * so an operation that got in before the eviction finishes first and none can follow it.
     * Caller holds no series lock.
     */
    private void releaseSlots(List<SeriesSlot> slots) {
        for (SeriesSlot slot : slots) {
            int dropped = 0;
            slot.lock.lock();
            try {
                for (String id : slot.pipeline.pendingIds()) {
                    if (index.remove(id) != null) dropped++;
                }
            } finally {
                slot.lock.unlock();
            }
            evictedSeries.incrementAndGet();
            log.info("[StateManager] series evicted seriesId={} droppedPending={}", slot.seriesId, dropped);
        }
    }

    private static String requireSeries(String seriesId) {
        if (seriesId == null || seriesId.isBlank()) throw ValidationException.missingField("series_id");
        return seriesId;
    }
}
