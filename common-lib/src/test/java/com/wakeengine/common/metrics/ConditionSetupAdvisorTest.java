package com.wakeengine.common.metrics;

import com.wakeengine.common.condition.ConditionPresets;
import com.wakeengine.common.model.AdaptationSettings;
import com.wakeengine.common.model.ConditionDefinition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConditionSetupAdvisorTest {

    private static final AdaptationSettings SETTINGS = AdaptationSettings.defaults();

    @Test
    @DisplayName("default conditions → 100, Excellent, valid")
    void defaultsScorePerfect() {
        ConditionSetupReport report = ConditionSetupAdvisor.review("a", ConditionPresets.defaults(), SETTINGS);

        assertEquals(100, report.score());
        assertEquals("Excellent", report.grade());
        assertTrue(report.valid());
        assertEquals(3, report.enabledConditions());
        assertEquals(new ConditionSetupReport.EffectivenessBreakdown(1, 2, 0, 0), report.breakdown());
        assertEquals(List.of("weekend_relaxed"), report.topPerformers());
        assertEquals(0.8, report.averageEffectiveness(), 1e-9);
    }

    @Test
    @DisplayName("no conditions → 10, Poor")
    void empty() {
        ConditionSetupReport report = ConditionSetupAdvisor.review("a", List.of(), SETTINGS);

        assertEquals(10, report.score());
        assertEquals("Poor", report.grade());
        assertFalse(report.valid());
        assertEquals(0.0, report.averageEffectiveness());
    }

    @Test
    @DisplayName("disabled weather and a too-low learning factor → 65, Fair")
    void disabledAndLowLearning() {
        List<ConditionDefinition> conditions = List.of(
            ConditionPresets.WEATHER_RAIN.withEnabled(false),
            ConditionPresets.SLEEP_DEBT_HIGH,
            ConditionPresets.CALENDAR_WEEKEND);

        ConditionSetupReport report = ConditionSetupAdvisor.review("a", conditions,
            new AdaptationSettings(true, true, 0.7, 0.05));

        assertEquals(65, report.score());
        assertEquals("Fair", report.grade());
        assertEquals(2, report.issues().size());
    }

    @Test
    @DisplayName("each weak enabled condition costs 5 points")
    void weakConditions() {
        List<ConditionDefinition> conditions = List.of(
            ConditionPresets.WEATHER_RAIN.withEffectivenessScore(0.4),
            ConditionPresets.SLEEP_DEBT_HIGH.withEffectivenessScore(0.3),
            ConditionPresets.CALENDAR_WEEKEND);

        ConditionSetupReport report = ConditionSetupAdvisor.review("a", conditions, SETTINGS);

        assertEquals(90, report.score());
        assertEquals(List.of("weather_rain", "sleep_debt_high"), report.underPerformers());
    }

    @Test
    @DisplayName("grade bands")
    void grades() {
        assertEquals("Excellent", ConditionSetupAdvisor.grade(90));
        assertEquals("Good",      ConditionSetupAdvisor.grade(75));
        assertEquals("Fair",      ConditionSetupAdvisor.grade(60));
        assertEquals("Poor",      ConditionSetupAdvisor.grade(59));
    }
}
