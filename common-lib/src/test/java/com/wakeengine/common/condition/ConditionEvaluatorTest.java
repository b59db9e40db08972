package com.wakeengine.common.condition;

import com.wakeengine.common.model.ConditionAdjustment;
import com.wakeengine.common.model.ConditionDefinition;
import com.wakeengine.common.model.ConditionReading;
import com.wakeengine.common.model.ConditionTrigger;
import com.wakeengine.common.model.ConditionType;
import com.wakeengine.common.model.ReadingValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link ConditionEvaluator}.
 */
class ConditionEvaluatorTest {

    private static ConditionReading reading(ConditionType type, ReadingValue value) {
        return ConditionReading.of(Map.of(type, value));
    }

    // ── matching ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("evaluate(): matching")
    class Matching {

        @Test
        @DisplayName("rain in weather text → fires −8.0 (−10 × 0.8)")
        void rainFires() {
            ConditionEvaluation result = ConditionEvaluator.evaluate(
                List.of(ConditionPresets.WEATHER_RAIN),
                reading(ConditionType.WEATHER, ReadingValue.text("light rain")));

            assertEquals(1, result.fired().size());
            assertEquals(-8.0, result.totalConditionAdjustment(), 1e-9);
            assertEquals("weather: -8.0min", result.fired().get(0).reason());
            assertEquals(List.of("weather_rain"), result.firedIds());
        }

        @Test
        @DisplayName("contains on a tag list → membership match")
        void containsOnList() {
            ConditionEvaluation result = ConditionEvaluator.evaluate(
                List.of(ConditionPresets.CALENDAR_IMPORTANT),
                reading(ConditionType.CALENDAR, ReadingValue.textList(List.of("gym", "important"))));

            assertEquals(-27.0, result.totalConditionAdjustment(), 1e-9);
        }

        @Test
        @DisplayName("sleep debt 75 > 60 → fires −10.5")
        void greaterThanFires() {
            ConditionEvaluation result = ConditionEvaluator.evaluate(
                List.of(ConditionPresets.SLEEP_DEBT_HIGH),
                reading(ConditionType.SLEEP_DEBT, ReadingValue.number(75)));

            assertEquals(-10.5, result.totalConditionAdjustment(), 1e-9);
            assertEquals("sleep_debt: -10.5min", result.summary());
        }

        @Test
        @DisplayName("sleep debt 60 is not > 60 → nothing fires, nothing skipped")
        void thresholdIsExclusive() {
            ConditionEvaluation result = ConditionEvaluator.evaluate(
                List.of(ConditionPresets.SLEEP_DEBT_HIGH),
                reading(ConditionType.SLEEP_DEBT, ReadingValue.number(60)));

            assertTrue(result.fired().isEmpty());
            assertTrue(result.skipped().isEmpty());
            assertEquals("none", result.summary());
        }

        @Test
        @DisplayName("weekend day type equals 'weekend' → fires +27.0")
        void equalsFires() {
            ConditionEvaluation result = ConditionEvaluator.evaluate(
                List.of(ConditionPresets.CALENDAR_WEEKEND),
                reading(ConditionType.CALENDAR, ReadingValue.text("weekend")));

            assertEquals(27.0, result.totalConditionAdjustment(), 1e-9);
        }

        @Test
        @DisplayName("several conditions fire → linear sum, catalog order kept")
        void sumsFiredConditions() {
            ConditionReading readings = ConditionReading.of(Map.of(
                ConditionType.WEATHER,    ReadingValue.text("rain"),
                ConditionType.SLEEP_DEBT, ReadingValue.number(90)));

            ConditionEvaluation result = ConditionEvaluator.evaluate(ConditionPresets.defaults(), readings);

            assertEquals(List.of("weather_rain", "sleep_debt_high"), result.firedIds());
            assertEquals(List.of("weekend_relaxed"), result.skipped());
            assertEquals(-18.5, result.totalConditionAdjustment(), 1e-9);
        }
    }

    // ── skipping ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("evaluate(): missing and malformed data")
    class Skipping {

        @Test
        @DisplayName("no reading for the type → skipped, not an error")
        void missingReadingSkipped() {
            ConditionEvaluation result = ConditionEvaluator.evaluate(
                List.of(ConditionPresets.WEATHER_RAIN), ConditionReading.empty());

            assertEquals(List.of("weather_rain"), result.skipped());
            assertEquals(0.0, result.totalConditionAdjustment());
        }

        @Test
        @DisplayName("text reading for a numeric type → skipped")
        void wrongShapeSkipped() {
            ConditionEvaluation result = ConditionEvaluator.evaluate(
                List.of(ConditionPresets.SLEEP_DEBT_HIGH),
                reading(ConditionType.SLEEP_DEBT, ReadingValue.text("a lot")));

            assertEquals(List.of("sleep_debt_high"), result.skipped());
            assertTrue(result.fired().isEmpty());
        }

        @Test
        @DisplayName("disabled condition → ignored entirely")
        void disabledIgnored() {
            ConditionEvaluation result = ConditionEvaluator.evaluate(
                List.of(ConditionPresets.WEATHER_RAIN.withEnabled(false)),
                reading(ConditionType.WEATHER, ReadingValue.text("rain")));

            assertTrue(result.fired().isEmpty());
            assertTrue(result.skipped().isEmpty());
        }

        @Test
        @DisplayName("null reading → every enabled condition skipped")
        void nullReading() {
            ConditionEvaluation result = ConditionEvaluator.evaluate(ConditionPresets.defaults(), null);
            assertEquals(3, result.skipped().size());
        }
    }

    // ── clamping & idempotence ────────────────────────────────────────────

    @Nested
    @DisplayName("appliedMinutes(): clamping")
    class Clamping {

        @Test
        @DisplayName("raw shift beyond maxAdjustment → clamped to maxAdjustment")
        void clampsToMax() {
            ConditionDefinition oversized = new ConditionDefinition(
                "oversized", ConditionType.STRESS_LEVEL, true, 3, ConditionTrigger.greaterThan(5),
                new ConditionAdjustment(-40, 20, "test"), 1.0, null);

            assertEquals(-20.0, ConditionEvaluator.appliedMinutes(oversized));
        }

        @Test
        @DisplayName("every preset at full effectiveness stays within its maxAdjustment")
        void presetsNeverExceedMax() {
            for (ConditionDefinition def : ConditionPresets.forProfile(null)) {
                double applied = ConditionEvaluator.appliedMinutes(def.withEffectivenessScore(1.0));
                assertTrue(Math.abs(applied) <= def.adjustment().maxAdjustment(), def.id());
            }
        }

        @Test
        @DisplayName("identical inputs → identical output")
        void idempotent() {
            ConditionReading readings = ConditionReading.of(Map.of(
                ConditionType.WEATHER, ReadingValue.textList(List.of("rain", "wind"))));

            assertEquals(
                ConditionEvaluator.evaluate(ConditionPresets.defaults(), readings),
                ConditionEvaluator.evaluate(ConditionPresets.defaults(), readings));
        }
    }
}
