package com.wakeengine.common.adaptation;

import com.wakeengine.common.model.AdaptationSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AdaptationBlenderTest {

    @Nested
    @DisplayName("blend(): worked scenarios")
    class Scenarios {

        @Test
        @DisplayName("rain at 0.8 effectiveness, no sleep shift → −2, below threshold")
        void smallShiftNotSignificant() {
            BlendResult result = AdaptationBlender.blend(-8.0, 0, 0.7);
            assertEquals(-2, result.adjustment());
            assertFalse(result.significant());
        }

        @Test
        @DisplayName("rain at 1.0 effectiveness, sleep −12 → −11, confidence 1.0, sleep dominates")
        void agreeingShiftsApplied() {
            BlendResult result = AdaptationBlender.blend(-10.0, -12, 0.7);
            assertEquals(-11, result.adjustment());
            assertTrue(result.significant());
            assertEquals(1.0, result.confidence(), 1e-9);
            assertEquals(AdaptationSource.SLEEP_PATTERN, result.dominantSource());
        }
    }

    @Nested
    @DisplayName("significance gating")
    class Significance {

        @Test
        @DisplayName("|−5| is significant, |−4| is not")
        void threshold() {
            assertTrue(AdaptationBlender.blend(0, -5, 1.0).significant());
            assertFalse(AdaptationBlender.blend(0, -4, 1.0).significant());
            assertTrue(AdaptationBlender.isSignificant(5));
        }
    }

    @Nested
    @DisplayName("confidence & dominance")
    class Confidence {

        @Test
        @DisplayName("opposite shifts that cancel → 0.5, no bonus")
        void disagreement() {
            assertEquals(0.5, AdaptationBlender.confidence(20, -20), 1e-9);
        }

        @Test
        @DisplayName("close, small shifts → agreement bonus plus partial magnitude")
        void partialMagnitude() {
            assertEquals(0.9, AdaptationBlender.confidence(-1, -2), 1e-9);
        }

        @Test
        @DisplayName("equal weighted contributions → condition dominates")
        void tieGoesToCondition() {
            assertEquals(AdaptationSource.CONDITION, AdaptationBlender.blend(10, 10, 0.5).dominantSource());
        }

        @Test
        @DisplayName("weight above 1 is treated as 1")
        void weightClamped() {
            assertEquals(AdaptationBlender.blend(-30, -8, 1.0), AdaptationBlender.blend(-30, -8, 2.0));
        }
    }

    @Test
    @DisplayName("clampToWindow bounds both directions")
    void clampToWindow() {
        assertEquals(30, AdaptationBlender.clampToWindow(45, 30));
        assertEquals(-30, AdaptationBlender.clampToWindow(-45, 30));
        assertEquals(-11, AdaptationBlender.clampToWindow(-11, 30));
    }
}
