package com.wakeengine.common.sleep;

import com.wakeengine.common.model.OptimalTimeSlot;
import com.wakeengine.common.model.SleepPattern;
import com.wakeengine.common.model.SleepStage;
import com.wakeengine.common.model.StagePrediction;
import com.wakeengine.common.model.WakeDifficulty;
import com.wakeengine.common.model.WakeFeeling;
import com.wakeengine.common.model.WakeRecommendation;
import com.wakeengine.common.model.WakeUpFeedback;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SleepPatternAdjusterTest {

    private static final LocalTime SEVEN = LocalTime.of(7, 0);

    private static WakeUpFeedback feedback(LocalTime woke, WakeDifficulty difficulty, WakeFeeling feeling) {
        return new WakeUpFeedback(LocalDate.of(2026, 3, 1), SEVEN, woke, difficulty, feeling,
            6, 10, false, false, null);
    }

    // ── optimal time slots ────────────────────────────────────────────────

    @Nested
    @DisplayName("calculateOptimalTimeSlots()")
    class Slots {

        @Test
        @DisplayName("no predictions, no feedback → baseline first, then nearest neighbours")
        void rankedByProximity() {
            List<OptimalTimeSlot> slots = SleepPatternAdjuster.calculateOptimalTimeSlots(
                SEVEN, 30, Collections.emptyList(), Collections.emptyList());

            assertEquals(5, slots.size());
            assertEquals(List.of(LocalTime.of(7, 0), LocalTime.of(6, 55), LocalTime.of(7, 5),
                                 LocalTime.of(6, 50), LocalTime.of(7, 10)),
                slots.stream().map(OptimalTimeSlot::time).toList());

            OptimalTimeSlot best = slots.get(0);
            assertEquals(1.0, best.confidence(), 1e-9);
            assertEquals(SleepStage.LIGHT, best.sleepStage());
            assertEquals(0, best.adjustment());
            assertEquals(List.of("Optimal sleep stage (light)", "Close to preferred time",
                                 "High confidence based on patterns"), best.factors());
        }

        @Test
        @DisplayName("deep sleep at baseline → baseline drops below light neighbours")
        void deepStagePenalised() {
            List<StagePrediction> predictions = List.of(
                new StagePrediction(420, SleepStage.DEEP),
                new StagePrediction(410, SleepStage.LIGHT),
                new StagePrediction(430, SleepStage.LIGHT));

            List<OptimalTimeSlot> slots = SleepPatternAdjuster.calculateOptimalTimeSlots(
                SEVEN, 30, predictions, Collections.emptyList());

            assertNotEquals(SEVEN, slots.get(0).time());
            assertTrue(slots.stream().noneMatch(s -> s.time().equals(SEVEN)));
        }

        @Test
        @DisplayName("terrible wake-up near 06:50 → nearby candidates scaled by 0.7")
        void feedbackPreference() {
            List<OptimalTimeSlot> slots = SleepPatternAdjuster.calculateOptimalTimeSlots(
                SEVEN, 30, Collections.emptyList(),
                List.of(feedback(LocalTime.of(6, 50), WakeDifficulty.HARD, WakeFeeling.TERRIBLE)));

            assertEquals(LocalTime.of(7, 5), slots.get(0).time());
            OptimalTimeSlot baseline = slots.stream().filter(s -> s.time().equals(SEVEN)).findFirst().orElseThrow();
            assertEquals(0.7, baseline.confidence(), 1e-9);
            assertTrue(slots.stream().noneMatch(s -> s.time().equals(LocalTime.of(6, 55))));
        }

        @Test
        @DisplayName("confidence always within [0, 1]")
        void confidenceBounded() {
            List<WakeUpFeedback> great = List.of(
                feedback(SEVEN, WakeDifficulty.VERY_EASY, WakeFeeling.EXCELLENT),
                feedback(SEVEN, WakeDifficulty.VERY_EASY, WakeFeeling.EXCELLENT));
            for (OptimalTimeSlot slot : SleepPatternAdjuster.calculateOptimalTimeSlots(SEVEN, 60, List.of(), great)) {
                assertTrue(slot.confidence() >= 0.0 && slot.confidence() <= 1.0);
            }
        }

        @Test
        @DisplayName("wake window 0 → three trailing candidates, no division by zero")
        void zeroWindow() {
            List<OptimalTimeSlot> slots = SleepPatternAdjuster.calculateOptimalTimeSlots(
                SEVEN, 0, List.of(), List.of());

            assertEquals(3, slots.size());
            assertEquals(SEVEN, slots.get(0).time());
        }

        @Test
        @DisplayName("stageAt → nearest prediction wins, LIGHT when none")
        void stageAt() {
            List<StagePrediction> predictions = List.of(
                new StagePrediction(410, SleepStage.LIGHT),
                new StagePrediction(425, SleepStage.DEEP));
            assertEquals(SleepStage.DEEP, SleepPatternAdjuster.stageAt(predictions, 420));
            assertEquals(SleepStage.LIGHT, SleepPatternAdjuster.stageAt(List.of(), 420));
        }
    }

    // ── sleep-pattern adjustment ──────────────────────────────────────────

    @Nested
    @DisplayName("calculateSleepPatternAdjustment()")
    class Adjustment {

        private final WakeRecommendation at0648 = new WakeRecommendation(LocalTime.of(6, 48), 0.8);

        @Test
        @DisplayName("recommendation 06:48, static window 30 → −12")
        void staticWindow() {
            assertEquals(-12, SleepPatternAdjuster.calculateSleepPatternAdjustment(
                SEVEN, 30, false, at0648, null, List.of()));
        }

        @Test
        @DisplayName("static window 10 → clamped to −10")
        void staticClamp() {
            assertEquals(-10, SleepPatternAdjuster.calculateSleepPatternAdjustment(
                SEVEN, 10, false, at0648, null, List.of()));
        }

        @Test
        @DisplayName("no recommendation → 0")
        void noRecommendation() {
            assertEquals(0, SleepPatternAdjuster.calculateSleepPatternAdjustment(
                SEVEN, 30, true, null, new SleepPattern(90, 420), List.of()));
        }

        @Test
        @DisplayName("dynamic window with 0% efficiency → half the window")
        void dynamicLowEfficiency() {
            WakeRecommendation early = new WakeRecommendation(LocalTime.of(6, 30), 0.9);
            assertEquals(-15, SleepPatternAdjuster.calculateSleepPatternAdjustment(
                SEVEN, 30, true, early, new SleepPattern(0, 300), List.of()));
        }

        @Test
        @DisplayName("dynamic window shrinks with hard wake-ups")
        void dynamicWindowFeedback() {
            List<WakeUpFeedback> hard = List.of(
                feedback(SEVEN, WakeDifficulty.VERY_HARD, WakeFeeling.TIRED),
                feedback(SEVEN, WakeDifficulty.VERY_HARD, WakeFeeling.TIRED));
            assertEquals(30, SleepPatternAdjuster.dynamicWakeWindow(30, new SleepPattern(100, 480), List.of()));
            assertEquals(18, SleepPatternAdjuster.dynamicWakeWindow(30, new SleepPattern(100, 480), hard));
        }

        @Test
        @DisplayName("feedbackFactor → 1.0 without feedback, 0.8 for normal wake-ups")
        void feedbackFactor() {
            assertEquals(1.0, SleepPatternAdjuster.feedbackFactor(List.of()));
            assertEquals(0.8, SleepPatternAdjuster.feedbackFactor(
                List.of(feedback(SEVEN, WakeDifficulty.NORMAL, WakeFeeling.OKAY))), 1e-9);
        }

        @Test
        @DisplayName("across midnight → shortest signed offset")
        void wrapsMidnight() {
            assertEquals(-15, SleepPatternAdjuster.calculateSleepPatternAdjustment(
                LocalTime.of(0, 10), 30, false, new WakeRecommendation(LocalTime.of(23, 55), 0.7), null, List.of()));
        }
    }
}
