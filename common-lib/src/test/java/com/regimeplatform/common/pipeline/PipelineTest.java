package com.regimeplatform.common.pipeline;

import com.regimeplatform.common.config.PipelineConfig;
import com.regimeplatform.common.exception.ValidationException;
import com.regimeplatform.common.forecaster.ForecastModelFactory;
import com.regimeplatform.common.model.PendingPrediction;
import com.regimeplatform.common.model.Prediction;
import com.regimeplatform.common.model.Regime;
import com.regimeplatform.common.model.Tick;
import com.regimeplatform.common.snapshot.PipelineSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class PipelineTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final PipelineConfig CONFIG = PipelineConfig.defaults();
    private static final ForecastModelFactory FACTORY = new ForecastModelFactory(CONFIG.models());

    private static Pipeline pipeline() {
        return new Pipeline("s1", CONFIG, FACTORY);
    }

    private static Tick tick(int t, double x) {
        return Tick.of(T0.plusSeconds(t), x);
    }

    /** Processes, registers and returns the pending entry for tick {@code t}. */
    private static PendingPrediction step(Pipeline p, int t, double x) {
        Prediction pred = p.process(tick(t, x));
        PendingPrediction pending = new PendingPrediction("p" + t, p.seriesId(), tick(t, x).timestamp().toString(),
            pred.yHat(), pred.regime(), T0);
        p.registerPrediction(pending);
        return pending;
    }

    @Nested
    @DisplayName("process()")
    class Process {

        @Test
        @DisplayName("returns a full prediction with stage latencies")
        void shape() {
            Prediction pred = pipeline().process(tick(0, 1.5));
            assertEquals(1.5, pred.yHat(), 1e-12);
            assertTrue(pred.intervalLow() <= pred.yHat() && pred.yHat() <= pred.intervalHigh());
            assertTrue(pred.warmup());
            assertTrue(pred.degraded(), "no residuals yet");
            assertEquals("EWMA", pred.model());
            assertEquals(3, pred.intervals().size());
            assertTrue(pred.stageLatencies().keySet().containsAll(
                List.of("features_ms", "detector_ms", "router_ms", "model_ms", "conformal_ms", "total_ms")));
        }

        @Test
        @DisplayName("60 constant ticks → calm, warmup cleared")
        void constantSeries() {
            Pipeline p = pipeline();
            Prediction last = null;
            for (int t = 0; t < 60; t++) {
                last = p.process(tick(t, 0.0));
            }
            assertEquals(Regime.CALM, last.regime());
            assertFalse(last.warmup());
            assertFalse(last.changePoint());
            assertEquals(0.0, last.yHat(), 1e-9);
        }

        @Test
        @DisplayName("NaN x rejected without touching state")
        void nanRejected() {
            Pipeline p = pipeline();
            step(p, 0, 1.0);
            assertThrows(ValidationException.class, () -> p.process(tick(1, Double.NaN)));
            assertEquals(1, p.pendingCount());
            assertEquals(T0, p.lastTimestamp());
            assertDoesNotThrow(() -> p.process(tick(1, 1.0)));
        }

        @Test
        @DisplayName("non-increasing timestamp rejected")
        void monotonicTimestamps() {
            Pipeline p = pipeline();
            p.process(tick(5, 1.0));
            assertThrows(ValidationException.class, () -> p.process(tick(5, 1.0)));
            assertThrows(ValidationException.class, () -> p.process(tick(4, 1.0)));
        }
    }

    @Nested
    @DisplayName("truth handling")
    class Truth {

        @Test
        @DisplayName("interval at t ignores the truth for t; the truth shows up at t + 1")
        void noLeakage() {
            Pipeline a = pipeline();
            Pipeline b = pipeline();
            Random rnd = new Random(1);
            // few residuals so one truth moves the quantile
            for (int t = 0; t < 3; t++) {
                double x = rnd.nextGaussian();
                double y = x + rnd.nextGaussian() * 0.2;
                PendingPrediction pa = step(a, t, x);
                PendingPrediction pb = step(b, t, x);
                a.updateTruthById(pa.predictionId(), y);
                b.updateTruthById(pb.predictionId(), y);
            }

            Prediction atA = a.process(tick(3, 0.3));
            Prediction atB = b.process(tick(3, 0.3));
            assertEquals(atA.intervalLow(), atB.intervalLow());
            assertEquals(atA.intervalHigh(), atB.intervalHigh());

            a.registerPrediction(new PendingPrediction("a3", "s1", "t3", atA.yHat(), atA.regime(), T0));
            b.registerPrediction(new PendingPrediction("b3", "s1", "t3", atB.yHat(), atB.regime(), T0));
            a.updateTruthById("a3", atA.yHat());
            b.updateTruthById("b3", atB.yHat() + 1_000.0);

            Prediction nextA = a.process(tick(4, 0.3));
            Prediction nextB = b.process(tick(4, 0.3));
            assertEquals(nextA.yHat(), nextB.yHat(), 1e-12);
            assertNotEquals(nextA.intervalHigh(), nextB.intervalHigh());
        }

        @Test
        @DisplayName("truth is consumed once")
        void consumedOnce() {
            Pipeline p = pipeline();
            PendingPrediction pp = step(p, 0, 1.0);
            assertEquals(TruthOutcome.APPLIED, p.updateTruthById(pp.predictionId(), 1.1));
            assertEquals(TruthOutcome.NOT_PENDING, p.updateTruthById(pp.predictionId(), 1.1));
            assertEquals(1, p.conformal().globalSize());
        }

        @Test
        @DisplayName("residual is learned under the regime recorded at prediction time")
        void regimeAtPredictionTime() {
            Pipeline p = pipeline();
            p.registerPrediction(new PendingPrediction("v", "s1", "t", 0.0, Regime.VOLATILE, T0));
            p.updateTruthById("v", 1.0);
            assertEquals(1, p.conformal().regimeSize(Regime.VOLATILE));
            assertEquals(0, p.conformal().regimeSize(Regime.CALM));
        }

        @Test
        @DisplayName("NaN truth rejected and the prediction stays pending")
        void nanTruth() {
            Pipeline p = pipeline();
            PendingPrediction pp = step(p, 0, 1.0);
            assertThrows(ValidationException.class, () -> p.updateTruthById(pp.predictionId(), Double.NaN));
            assertTrue(p.isPending(pp.predictionId()));
        }

        @Test
        @DisplayName("pending set is capped, oldest evicted first")
        void pendingCap() {
            PipelineConfig capped = new PipelineConfig(null, null, null, null, null, 2, false);
            Pipeline p = new Pipeline("s1", capped, FACTORY);
            step(p, 0, 1.0);
            step(p, 1, 1.0);
            Prediction pred = p.process(tick(2, 1.0));
            List<String> evicted = p.registerPrediction(
                new PendingPrediction("p2", "s1", "t2", pred.yHat(), pred.regime(), T0));
            assertEquals(List.of("p0"), evicted);
            assertEquals(TruthOutcome.NOT_PENDING, p.updateTruthById("p0", 1.0));
            assertEquals("p1", p.oldestPending().orElseThrow().predictionId());
        }

        @Test
        @DisplayName("self-truth mode learns each tick as the previous forecast's truth")
        void selfTruth() {
            Pipeline p = new Pipeline("s1", CONFIG.withSelfTruth(true), FACTORY);
            for (int t = 0; t < 25; t++) {
                p.process(tick(t, Math.sin(t / 3.0)));
            }
            assertEquals(24, p.conformal().globalSize());
        }

        @Test
        @DisplayName("self-truth consumes a registered latest prediction instead of learning it twice")
        void selfTruthConsumesPending() {
            Pipeline p = new Pipeline("s1", CONFIG.withSelfTruth(true), FACTORY);
            PendingPrediction pp = step(p, 0, 1.0);
            p.process(tick(1, 1.2));
            assertFalse(p.isPending(pp.predictionId()));
            assertEquals(1, p.conformal().globalSize());
        }
    }

    @Test
    @DisplayName("snapshot → restore keeps calibration, detector state and pending predictions")
    void snapshotRestore() {
        Pipeline a = pipeline();
        Random rnd = new Random(2);
        for (int t = 0; t < 50; t++) {
            PendingPrediction pp = step(a, t, rnd.nextGaussian());
            if (t < 45) a.updateTruthById(pp.predictionId(), rnd.nextGaussian());
        }
        PipelineSnapshot snap = a.snapshot();
        Pipeline b = Pipeline.restore(snap, CONFIG, FACTORY);

        assertEquals(a.lastTimestamp(), b.lastTimestamp());
        assertEquals(5, b.pendingCount());
        assertEquals(a.conformal().globalSize(), b.conformal().globalSize());
        assertEquals(a.detector().observations(), b.detector().observations());
        assertThrows(ValidationException.class, () -> b.process(tick(49, 0.0)));

        Prediction pa = a.process(tick(50, 0.1));
        Prediction pb = b.process(tick(50, 0.1));
        assertEquals(pa.score(), pb.score(), 1e-12);
        assertEquals(pa.regime(), pb.regime());
    }
}
