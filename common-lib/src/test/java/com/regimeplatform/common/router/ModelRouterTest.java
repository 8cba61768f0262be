package com.regimeplatform.common.router;

import com.regimeplatform.common.config.RouterConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelRouterTest {

    private static final List<String> MODELS = List.of("LINEAR", "AUTOREGRESSIVE", "EWMA");

    private static RouterConfig config(int dwellMin, boolean freeze) {
        return new RouterConfig("EWMA", dwellMin, 0.05, 0.02, freeze, 5, 0.5, 3);
    }

    private static void feed(ModelRouter router, double linear, double ar, double ewma) {
        router.recordLoss("LINEAR", linear);
        router.recordLoss("AUTOREGRESSIVE", ar);
        router.recordLoss("EWMA", ewma);
    }

    @Test
    @DisplayName("starts on the default model")
    void startsOnDefault() {
        assertEquals("EWMA", new ModelRouter(config(10, false), MODELS).current());
    }

    @Test
    @DisplayName("unknown default falls back to the first model")
    void unknownDefault() {
        ModelRouter router = new ModelRouter(new RouterConfig("NOPE", 1, 0.05, 0.02, false, 5, 0.5, 3), MODELS);
        assertEquals("LINEAR", router.current());
    }

    @Nested
    @DisplayName("dwell")
    class Dwell {

        @Test
        @DisplayName("no switch within dwellMin ticks, whatever the losses")
        void noSwitchWithinDwell() {
            int dwellMin = 10;
            ModelRouter router = new ModelRouter(config(dwellMin, false), MODELS);
            long lastSwitchTick = 0;
            boolean switchedOnce = false;
            for (int t = 1; t <= 400; t++) {
                // best model flips every 3 ticks to provoke churn
                boolean flip = (t / 3) % 2 == 0;
                feed(router, flip ? 0.1 : 5.0, flip ? 5.0 : 0.1, 2.0);
                RouterDecision d = router.choose(false);
                if (d.switched()) {
                    if (switchedOnce) {
                        assertTrue(t - lastSwitchTick >= dwellMin,
                            "switched after only " + (t - lastSwitchTick) + " ticks");
                    }
                    switchedOnce = true;
                    lastSwitchTick = t;
                }
            }
            assertTrue(router.switchCount() > 0);
        }

        @Test
        @DisplayName("holds during the initial dwell even when a better model is ready")
        void initialDwell() {
            ModelRouter router = new ModelRouter(config(10, false), MODELS);
            for (int t = 1; t < 10; t++) {
                feed(router, 0.1, 1.0, 5.0);
                assertFalse(router.choose(false).switched(), "tick " + t);
            }
            feed(router, 0.1, 1.0, 5.0);
            RouterDecision d = router.choose(false);
            assertTrue(d.switched());
            assertEquals("LINEAR", d.model());
        }
    }

    @Nested
    @DisplayName("switch rule")
    class SwitchRule {

        @Test
        @DisplayName("small relative improvement does not switch")
        void hysteresis() {
            ModelRouter router = new ModelRouter(config(1, false), MODELS);
            for (int t = 0; t < 20; t++) {
                feed(router, 0.97, 1.5, 1.0);
                assertEquals("EWMA", router.choose(false).model());
            }
        }

        @Test
        @DisplayName("models below minLossSamples are not candidates")
        void minSamples() {
            ModelRouter router = new ModelRouter(config(1, false), MODELS);
            router.recordLoss("LINEAR", 0.01);
            router.recordLoss("LINEAR", 0.01);
            router.recordLoss("EWMA", 9.0);
            assertEquals("EWMA", router.choose(false).model());
        }

        @Test
        @DisplayName("non-finite losses are ignored")
        void nonFiniteLoss() {
            ModelRouter router = new ModelRouter(config(1, false), MODELS);
            router.recordLoss("LINEAR", Double.NaN);
            assertTrue(Double.isNaN(router.expectedLoss("LINEAR")));
        }
    }

    @Test
    @DisplayName("change-point spike freezes routing for freezeTicks")
    void freezeOnChangePoint() {
        ModelRouter router = new ModelRouter(config(1, true), MODELS);
        for (int i = 0; i < 5; i++) feed(router, 0.1, 1.0, 5.0);

        RouterDecision first = router.choose(true);
        assertTrue(first.frozen());
        assertEquals("EWMA", first.model());
        for (int i = 0; i < 4; i++) {
            assertTrue(router.choose(false).frozen());
        }
        RouterDecision after = router.choose(false);
        assertFalse(after.frozen());
        assertEquals("LINEAR", after.model());
    }

    @Test
    @DisplayName("snapshot → restore keeps the current model and losses")
    void snapshotRestore() {
        ModelRouter a = new ModelRouter(config(1, false), MODELS);
        for (int i = 0; i < 5; i++) feed(a, 0.1, 1.0, 5.0);
        a.choose(false);
        assertEquals("LINEAR", a.current());

        ModelRouter b = new ModelRouter(config(1, false), MODELS);
        b.restore(a.snapshot());
        assertEquals("LINEAR", b.current());
        assertEquals(a.expectedLoss("EWMA"), b.expectedLoss("EWMA"), 1e-12);
        assertEquals(a.switchCount(), b.switchCount());
    }
}
