package com.wakeengine.common.condition;

import com.wakeengine.common.model.ConditionAdjustment;
import com.wakeengine.common.model.ConditionDefinition;
import com.wakeengine.common.model.ConditionTrigger;
import com.wakeengine.common.model.ConditionType;
import com.wakeengine.common.model.UserProfile;

import java.util.List;

/**
 * Ready-made condition definitions.
 *
 * <p>Readings are keyed by {@link ConditionType}: weather is a text or tag list
 * ({@code "light rain"}, {@code ["snow","wind"]}), calendar is either the day type
 * ({@code "weekend"}) or a tag list for the day ({@code ["important","travel"]}),
 * sleep debt / exercise / screen time are minutes and stress is a 0–10 score.
 */
public final class ConditionPresets {

    // ── weather ──────────────────────────────────────────────────────────────
    public static final ConditionDefinition WEATHER_RAIN = define(
        "weather_rain", ConditionType.WEATHER, 3, ConditionTrigger.contains("rain"),
        -10, 20, "Allow extra time for rainy weather commute", 0.8);

    public static final ConditionDefinition WEATHER_SNOW = define(
        "weather_snow", ConditionType.WEATHER, 5, ConditionTrigger.contains("snow"),
        -30, 60, "Snow makes the commute slow and unsafe", 0.9);

    public static final ConditionDefinition WEATHER_FREEZING = define(
        "weather_extreme_cold", ConditionType.WEATHER, 3, ConditionTrigger.contains("freezing"),
        -15, 25, "Extreme cold requires extra warm-up time", 0.75);

    public static final ConditionDefinition WEATHER_HEATWAVE = define(
        "weather_extreme_heat", ConditionType.WEATHER, 3, ConditionTrigger.contains("heatwave"),
        -10, 20, "Extreme heat requires cooling preparation", 0.7);

    // ── calendar ─────────────────────────────────────────────────────────────
    public static final ConditionDefinition CALENDAR_WEEKEND = define(
        "weekend_relaxed", ConditionType.CALENDAR, 2, ConditionTrigger.equalsTo("weekend"),
        30, 60, "Weekend lie-in", 0.9);

    public static final ConditionDefinition CALENDAR_IMPORTANT = define(
        "calendar_important", ConditionType.CALENDAR, 4, ConditionTrigger.contains("important"),
        -30, 60, "Important meetings need thorough preparation", 0.9);

    public static final ConditionDefinition CALENDAR_CRITICAL = define(
        "calendar_critical", ConditionType.CALENDAR, 5, ConditionTrigger.contains("critical"),
        -60, 120, "Critical events require extensive preparation", 0.95);

    public static final ConditionDefinition CALENDAR_EARLY_MEETING = define(
        "calendar_early_meeting", ConditionType.CALENDAR, 4, ConditionTrigger.contains("early_meeting"),
        -25, 45, "Early meetings require additional preparation time", 0.85);

    public static final ConditionDefinition CALENDAR_FREE_DAY = define(
        "calendar_free_day", ConditionType.CALENDAR, 1, ConditionTrigger.contains("free_day"),
        15, 30, "Free day allows relaxed morning routine", 0.8);

    public static final ConditionDefinition CALENDAR_TRAVEL = define(
        "calendar_travel", ConditionType.CALENDAR, 5, ConditionTrigger.contains("travel"),
        -90, 180, "Travel requires extensive preparation and buffer time", 0.95);

    // ── sleep debt (minutes) ─────────────────────────────────────────────────
    public static final ConditionDefinition SLEEP_DEBT_MODERATE = define(
        "sleep_debt_moderate", ConditionType.SLEEP_DEBT, 3, ConditionTrigger.greaterThan(30),
        -15, 25, "Moderate sleep debt requires schedule adjustment", 0.75);

    public static final ConditionDefinition SLEEP_DEBT_HIGH = define(
        "sleep_debt_high", ConditionType.SLEEP_DEBT, 4, ConditionTrigger.greaterThan(60),
        -15, 30, "Extra sleep to recover from sleep debt", 0.7);

    public static final ConditionDefinition SLEEP_DEBT_SEVERE = define(
        "sleep_debt_severe", ConditionType.SLEEP_DEBT, 5, ConditionTrigger.greaterThan(120),
        -40, 75, "Severe sleep debt requires immediate schedule correction", 0.9);

    // ── exercise (previous-day minutes) ──────────────────────────────────────
    public static final ConditionDefinition EXERCISE_RECOVERY = define(
        "exercise_intense_recovery", ConditionType.EXERCISE, 3, ConditionTrigger.greaterThan(90),
        20, 40, "Intense exercise requires additional recovery sleep", 0.8);

    // ── stress (0–10) ────────────────────────────────────────────────────────
    public static final ConditionDefinition STRESS_HIGH = define(
        "stress_high_day", ConditionType.STRESS_LEVEL, 3, ConditionTrigger.greaterThan(7),
        -20, 35, "High stress days need extra mental preparation time", 0.75);

    public static final ConditionDefinition STRESS_LOW = define(
        "stress_low_day", ConditionType.STRESS_LEVEL, 2, ConditionTrigger.lessThan(3),
        10, 20, "Low stress day allows relaxed morning routine", 0.7);

    // ── screen time (evening minutes) ────────────────────────────────────────
    public static final ConditionDefinition SCREEN_TIME_HIGH = define(
        "screen_time_high", ConditionType.SCREEN_TIME, 2, ConditionTrigger.greaterThan(120),
        10, 20, "High screen time delays natural sleep hormones", 0.65);

    private ConditionPresets() {}

    /** Rain, high sleep debt and weekend lie-in. */
    public static List<ConditionDefinition> defaults() {
        return List.of(WEATHER_RAIN, SLEEP_DEBT_HIGH, CALENDAR_WEEKEND);
    }

    public static List<ConditionDefinition> forProfile(UserProfile profile) {
        if (profile == null) return defaults();
        return switch (profile) {
            case PROFESSIONAL -> List.of(WEATHER_RAIN, WEATHER_SNOW, CALENDAR_IMPORTANT,
                                         CALENDAR_EARLY_MEETING, CALENDAR_WEEKEND, SLEEP_DEBT_HIGH, STRESS_HIGH);
            case STUDENT      -> List.of(CALENDAR_CRITICAL, CALENDAR_WEEKEND, CALENDAR_FREE_DAY,
                                         SLEEP_DEBT_MODERATE, SCREEN_TIME_HIGH, STRESS_HIGH);
            case FITNESS      -> List.of(EXERCISE_RECOVERY, SLEEP_DEBT_HIGH, WEATHER_RAIN, STRESS_LOW);
            case SHIFT_WORKER -> List.of(CALENDAR_CRITICAL, SLEEP_DEBT_SEVERE, STRESS_HIGH,
                                         WEATHER_FREEZING, WEATHER_SNOW);
            case PARENT       -> List.of(CALENDAR_IMPORTANT, CALENDAR_WEEKEND, SLEEP_DEBT_HIGH,
                                         WEATHER_RAIN, STRESS_HIGH);
            case TRAVELER     -> List.of(CALENDAR_TRAVEL, WEATHER_FREEZING, WEATHER_HEATWAVE,
                                         WEATHER_SNOW, SLEEP_DEBT_HIGH);
        };
    }

    private static ConditionDefinition define(String id, ConditionType type, int priority,
                                              ConditionTrigger trigger, int minutes, int max,
                                              String reason, double effectiveness) {
        return new ConditionDefinition(id, type, true, priority, trigger,
            new ConditionAdjustment(minutes, max, reason), effectiveness, null);
    }
}
