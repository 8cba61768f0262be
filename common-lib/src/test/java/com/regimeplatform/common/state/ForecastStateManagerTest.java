package com.regimeplatform.common.state;

import com.regimeplatform.common.config.PipelineConfig;
import com.regimeplatform.common.config.ServiceLimits;
import com.regimeplatform.common.config.TruthMatching;
import com.regimeplatform.common.exception.PredictionNotFoundException;
import com.regimeplatform.common.exception.TruthConflictException;
import com.regimeplatform.common.exception.ValidationException;
import com.regimeplatform.common.forecaster.ForecastModelFactory;
import com.regimeplatform.common.model.Tick;
import com.regimeplatform.common.snapshot.ServiceSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ForecastStateManagerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final PipelineConfig CONFIG = PipelineConfig.defaults();
    private static final ForecastModelFactory FACTORY = new ForecastModelFactory(CONFIG.models());

    private final MutableClock clock = new MutableClock(T0);

    private ForecastStateManager manager(ServiceLimits limits) {
        return new ForecastStateManager(CONFIG, limits, FACTORY, clock);
    }

    private static ServiceLimits limits(int pendingCap, int maxSeries, TruthMatching matching, boolean queueEarly) {
        return new ServiceLimits(pendingCap, maxSeries, Duration.ofMinutes(10), 1000, matching, queueEarly);
    }

    private static PredictionReceipt predict(ForecastStateManager m, String series, int t, double x) {
        Instant ts = T0.plusSeconds(t);
        return m.predict(new PredictCommand(series, Tick.of(ts, x), ts.toString()));
    }

    private static int residuals(ForecastStateManager m, String series) {
        return m.snapshot().series().stream()
            .filter(s -> s.seriesId().equals(series))
            .mapToInt(s -> s.conformal().global().size())
            .sum();
    }

    @Nested
    @DisplayName("predict")
    class Predict {

        @Test
        @DisplayName("registers a pending prediction with a fresh id")
        void registersPending() {
            ForecastStateManager m = manager(ServiceLimits.defaults());
            PredictionReceipt a = predict(m, "s1", 0, 1.0);
            PredictionReceipt b = predict(m, "s1", 1, 1.1);
            assertNotEquals(a.predictionId(), b.predictionId());
            assertEquals(T0.toString(), a.targetTimestamp());
            assertEquals(2, m.stats().pending());
            assertEquals(1, m.stats().series());
        }

        @Test
        @DisplayName("NaN x → ValidationException, no series, no pending")
        void nanCreatesNothing() {
            ForecastStateManager m = manager(ServiceLimits.defaults());
            assertThrows(ValidationException.class, () -> predict(m, "s1", 0, Double.NaN));
            assertEquals(0, m.stats().pending());
            assertEquals(0, m.stats().series());
        }

        @Test
        @DisplayName("blank series id rejected")
        void blankSeries() {
            ForecastStateManager m = manager(ServiceLimits.defaults());
            assertThrows(ValidationException.class,
                () -> m.predict(new PredictCommand(" ", Tick.of(T0, 1.0), null)));
        }
    }

    @Nested
    @DisplayName("truth by id")
    class TruthById {

        @Test
        @DisplayName("applied once, replay with same value is idempotent and learns nothing")
        void idempotentReplay() {
            ForecastStateManager m = manager(ServiceLimits.defaults());
            PredictionReceipt r = predict(m, "s1", 0, 1.0);

            TruthResult first = m.applyTruth(TruthCommand.byId(r.predictionId(), 1.2));
            assertEquals(TruthStatus.APPLIED, first.status());
            assertEquals(ForecastStateManager.MATCHED_BY_ID, first.matchedBy());
            assertEquals(1, residuals(m, "s1"));

            TruthResult replay = m.applyTruth(TruthCommand.byId(r.predictionId(), 1.2));
            assertEquals(TruthStatus.IDEMPOTENT, replay.status());
            assertTrue(replay.idempotent());
            assertEquals(1, residuals(m, "s1"));
        }

        @Test
        @DisplayName("idempotent replay leaves the computed quantiles unchanged")
        void replayKeepsQuantiles() {
            ForecastStateManager a = manager(ServiceLimits.defaults());
            ForecastStateManager b = manager(ServiceLimits.defaults());
            String lastId = null;
            for (int t = 0; t < 6; t++) {
                double x = Math.sin(t);
                PredictionReceipt ra = predict(a, "s1", t, x);
                PredictionReceipt rb = predict(b, "s1", t, x);
                a.applyTruth(TruthCommand.byId(ra.predictionId(), x + 0.1 * t));
                b.applyTruth(TruthCommand.byId(rb.predictionId(), x + 0.1 * t));
                lastId = rb.predictionId();
            }
            assertEquals(TruthStatus.IDEMPOTENT, b.applyTruth(TruthCommand.byId(lastId, Math.sin(5) + 0.5)).status());

            PredictionReceipt nextA = predict(a, "s1", 6, 0.2);
            PredictionReceipt nextB = predict(b, "s1", 6, 0.2);
            assertEquals(residuals(a, "s1"), residuals(b, "s1"));
            assertEquals(nextA.prediction().intervals(), nextB.prediction().intervals());
            assertEquals(nextA.prediction().intervalHigh(), nextB.prediction().intervalHigh());
        }

        @Test
        @DisplayName("different value for a resolved id → conflict")
        void conflictingReplay() {
            ForecastStateManager m = manager(ServiceLimits.defaults());
            PredictionReceipt r = predict(m, "s1", 0, 1.0);
            m.applyTruth(TruthCommand.byId(r.predictionId(), 1.2));
            assertThrows(TruthConflictException.class, () -> m.applyTruth(TruthCommand.byId(r.predictionId(), 1.3)));
        }

        @Test
        @DisplayName("replay after the idempotency window → conflict")
        void replayAfterTtl() {
            ForecastStateManager m = manager(limits(16, 16, TruthMatching.KEYED, false));
            PredictionReceipt r = predict(m, "s1", 0, 1.0);
            m.applyTruth(TruthCommand.byId(r.predictionId(), 1.2));
            clock.advance(Duration.ofMinutes(11));
            assertThrows(TruthConflictException.class, () -> m.applyTruth(TruthCommand.byId(r.predictionId(), 1.2)));
        }

        @Test
        @DisplayName("unknown id → not found")
        void unknownId() {
            ForecastStateManager m = manager(ServiceLimits.defaults());
            assertThrows(PredictionNotFoundException.class, () -> m.applyTruth(TruthCommand.byId("nope", 1.0)));
        }

        @Test
        @DisplayName("NaN truth → ValidationException, prediction stays pending")
        void nanTruth() {
            ForecastStateManager m = manager(ServiceLimits.defaults());
            PredictionReceipt r = predict(m, "s1", 0, 1.0);
            assertThrows(ValidationException.class, () -> m.applyTruth(TruthCommand.byId(r.predictionId(), Double.NaN)));
            assertEquals(TruthStatus.APPLIED, m.applyTruth(TruthCommand.byId(r.predictionId(), 1.0)).status());
        }
    }

    @Nested
    @DisplayName("eviction")
    class Eviction {

        @Test
        @DisplayName("pending cap 1: the older prediction is evicted and its truth is not found")
        void pendingCapOne() {
            ForecastStateManager m = manager(limits(1, 16, TruthMatching.KEYED, false));
            PredictionReceipt first = predict(m, "s1", 0, 1.0);
            PredictionReceipt second = predict(m, "s1", 1, 1.0);
            assertThrows(PredictionNotFoundException.class, () -> m.applyTruth(TruthCommand.byId(first.predictionId(), 1.0)));
            assertEquals(TruthStatus.APPLIED, m.applyTruth(TruthCommand.byId(second.predictionId(), 1.0)).status());
            assertEquals(1, m.stats().evictedPredictions());
        }

        @Test
        @DisplayName("pending cap across series: another series' insert evicts, owner drops it lazily")
        void pendingCapAcrossSeries() {
            ForecastStateManager m = manager(limits(1, 16, TruthMatching.KEYED, false));
            PredictionReceipt a = predict(m, "a", 0, 1.0);
            predict(m, "b", 0, 1.0);
            assertThrows(PredictionNotFoundException.class, () -> m.applyTruth(TruthCommand.byId(a.predictionId(), 1.0)));
            predict(m, "a", 1, 1.0);
            assertTrue(m.snapshot().series().stream()
                .filter(s -> s.seriesId().equals("a"))
                .flatMap(s -> s.pending().stream())
                .noneMatch(p -> p.predictionId().equals(a.predictionId())));
        }

        @Test
        @DisplayName("LRU series eviction drops its pending predictions")
        void seriesEviction() {
            ForecastStateManager m = manager(limits(64, 1, TruthMatching.KEYED, false));
            PredictionReceipt old = predict(m, "old", 0, 1.0);
            predict(m, "new", 0, 1.0);
            assertEquals(1, m.stats().series());
            assertEquals(1, m.stats().evictedSeries());
            assertThrows(PredictionNotFoundException.class, () -> m.applyTruth(TruthCommand.byId(old.predictionId(), 1.0)));
            assertThrows(PredictionNotFoundException.class,
                () -> m.applyTruth(TruthCommand.byKey("old", old.targetTimestamp(), 1.0)));
            assertEquals(1, m.stats().pending());
        }

        @Test
        @DisplayName("a recreated series does not resolve truths of its evicted incarnation")
        void recreatedSeries() {
            ForecastStateManager m = manager(limits(64, 1, TruthMatching.KEYED, false));
            PredictionReceipt old = predict(m, "a", 0, 1.0);
            predict(m, "b", 0, 1.0);
            predict(m, "a", 5, 1.0);
            assertEquals(1, m.stats().pending());
            assertThrows(PredictionNotFoundException.class, () -> m.applyTruth(TruthCommand.byId(old.predictionId(), 1.0)));
            assertThrows(PredictionNotFoundException.class,
                () -> m.applyTruth(TruthCommand.byKey("a", old.targetTimestamp(), 1.0)));
            assertEquals(0, residuals(m, "a"));
        }

        @Test
        @DisplayName("explicit series eviction")
        void evictSeries() {
            ForecastStateManager m = manager(ServiceLimits.defaults());
            PredictionReceipt r = predict(m, "s1", 0, 1.0);
            assertTrue(m.evictSeries("s1"));
            assertFalse(m.evictSeries("s1"));
            assertThrows(PredictionNotFoundException.class, () -> m.applyTruth(TruthCommand.byId(r.predictionId(), 1.0)));
            // a recreated series starts fresh, so an earlier timestamp is accepted
            assertDoesNotThrow(() -> predict(m, "s1", -10, 1.0));
        }
    }

    @Nested
    @DisplayName("truth by (series, target) and FIFO")
    class KeyedAndFifo {

        @Test
        @DisplayName("keyed truth matches the prediction for that target")
        void keyed() {
            ForecastStateManager m = manager(ServiceLimits.defaults());
            predict(m, "s1", 0, 1.0);
            PredictionReceipt second = predict(m, "s1", 1, 2.0);
            TruthResult result = m.applyTruth(TruthCommand.byKey("s1", second.targetTimestamp(), 2.1));
            assertEquals(second.predictionId(), result.predictionId());
            assertEquals(ForecastStateManager.MATCHED_BY_KEY, result.matchedBy());
            assertEquals(TruthStatus.IDEMPOTENT,
                m.applyTruth(TruthCommand.byKey("s1", second.targetTimestamp(), 2.1)).status());
        }

        @Test
        @DisplayName("keyed truth for an unknown target → not found when queueing is off")
        void keyedUnknown() {
            ForecastStateManager m = manager(ServiceLimits.defaults());
            assertThrows(PredictionNotFoundException.class,
                () -> m.applyTruth(TruthCommand.byKey("s1", T0.toString(), 1.0)));
        }

        @Test
        @DisplayName("early truth is queued and applied when its prediction registers")
        void earlyTruthQueued() {
            ForecastStateManager m = manager(limits(16, 16, TruthMatching.KEYED, true));
            TruthResult queued = m.applyTruth(TruthCommand.byKey("s1", T0.toString(), 1.5));
            assertEquals(TruthStatus.QUEUED, queued.status());
            assertEquals(1, m.stats().queuedTruths());

            predict(m, "s1", 0, 1.0);
            assertEquals(0, m.stats().pending());
            assertEquals(0, m.stats().queuedTruths());
            assertEquals(1, m.stats().truthsApplied());
            assertEquals(1, residuals(m, "s1"));
        }

        @Test
        @DisplayName("FIFO matching applies to the oldest pending prediction")
        void fifo() {
            ForecastStateManager m = manager(limits(16, 16, TruthMatching.FIFO, false));
            PredictionReceipt first = predict(m, "s1", 0, 1.0);
            predict(m, "s1", 1, 1.0);
            TruthResult r = m.applyTruth(TruthCommand.oldest("s1", 1.0));
            assertEquals(first.predictionId(), r.predictionId());
            assertEquals(ForecastStateManager.MATCHED_BY_FIFO, r.matchedBy());
            assertEquals(1, m.stats().pending());
        }

        @Test
        @DisplayName("series-only truth is rejected under KEYED matching")
        void seriesOnlyRejectedWhenKeyed() {
            ForecastStateManager m = manager(ServiceLimits.defaults());
            predict(m, "s1", 0, 1.0);
            assertThrows(ValidationException.class, () -> m.applyTruth(TruthCommand.oldest("s1", 1.0)));
        }
    }

    @Test
    @DisplayName("snapshot → restore into a new manager keeps pending predictions answerable")
    void snapshotRestore() {
        ForecastStateManager a = manager(ServiceLimits.defaults());
        PredictionReceipt r0 = predict(a, "s1", 0, 1.0);
        PredictionReceipt r1 = predict(a, "s1", 1, 1.1);
        predict(a, "s2", 0, 5.0);
        a.applyTruth(TruthCommand.byId(r0.predictionId(), 1.0));

        ServiceSnapshot snap = a.snapshot();
        ForecastStateManager b = manager(ServiceLimits.defaults());
        assertEquals(2, b.restore(snap));
        assertEquals(2, b.stats().series());
        assertEquals(2, b.stats().pending());
        assertEquals(TruthStatus.APPLIED, b.applyTruth(TruthCommand.byId(r1.predictionId(), 1.1)).status());
        assertThrows(ValidationException.class, () -> predict(b, "s1", 1, 1.0));
    }

    @Test
    @DisplayName("unsupported snapshot version rejected")
    void restoreVersion() {
        ForecastStateManager m = manager(ServiceLimits.defaults());
        assertThrows(ValidationException.class, () -> m.restore(new ServiceSnapshot(99, T0, List.of())));
    }

    @Nested
    @DisplayName("concurrency")
    class Concurrency {

        @Test
        @DisplayName("parallel predict/truth across and within series stays consistent")
        void parallelSeries() throws Exception {
            ForecastStateManager m = manager(limits(10_000, 64, TruthMatching.KEYED, false));
            int threads = 8;
            int ticks = 150;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Integer>> results = new ArrayList<>();
            for (int w = 0; w < threads; w++) {
                String series = "s" + (w % 4);
                int offset = w / 4;
                Callable<Integer> task = () -> {
                    start.await();
                    int applied = 0;
                    for (int t = 0; t < ticks; t++) {
                        PredictionReceipt r;
                        try {
                            // two workers share each series; distinct timestamps, strictly increasing per worker
                            Instant ts = T0.plusMillis(t * 10L + offset);
                            r = m.predict(new PredictCommand(series, Tick.of(ts, Math.sin(t)), ts.toString()));
                        } catch (ValidationException interleaved) {
                            continue;
                        }
                        if (m.applyTruth(TruthCommand.byId(r.predictionId(), Math.sin(t) + 0.1)).status() == TruthStatus.APPLIED) {
                            applied++;
                        }
                    }
                    return applied;
                };
                results.add(pool.submit(task));
            }
            start.countDown();
            int applied = 0;
            for (Future<Integer> f : results) {
                applied += f.get(60, TimeUnit.SECONDS);
            }
            pool.shutdown();

            ManagerStats stats = m.stats();
            assertEquals(4, stats.series());
            assertEquals(0, stats.pending());
            assertEquals(stats.predictions(), applied);
            assertEquals(applied, stats.truthsApplied());
        }

        @Test
        @DisplayName("evictions racing with predicts leave no orphaned pending entries")
        void evictionRace() throws Exception {
            ForecastStateManager m = manager(limits(10_000, 2, TruthMatching.KEYED, false));
            int threads = 4;
            ExecutorService pool = Executors.newFixedThreadPool(threads + 1);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> results = new ArrayList<>();
            for (int w = 0; w < threads; w++) {
                String series = "s" + w;
                results.add(pool.submit(() -> {
                    start.await();
                    for (int t = 0; t < 300; t++) {
                        predict(m, series, t, Math.cos(t));
                    }
                    return null;
                }));
            }
            results.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < 300; i++) {
                    m.evictSeries("s" + (i % threads));
                }
                return null;
            }));
            start.countDown();
            for (Future<?> f : results) {
                f.get(60, TimeUnit.SECONDS);
            }
            pool.shutdown();

            for (int w = 0; w < threads; w++) {
                m.evictSeries("s" + w);
            }
            ManagerStats stats = m.stats();
            assertEquals(0, stats.series());
            assertEquals(0, stats.pending());
        }
    }

    static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
