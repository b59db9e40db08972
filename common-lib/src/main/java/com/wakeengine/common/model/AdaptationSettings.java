package com.wakeengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-alarm tuning of the adaptation engine.
 *
 * <ul>
 *   <li>{@code realTimeAdaptation}  – run the periodic adaptation loop for this alarm</li>
 *   <li>{@code dynamicWakeWindow}   – bound sleep-pattern shifts by the efficiency/feedback scaled window</li>
 *   <li>{@code sleepPatternWeight}  – blend weight of the sleep-pattern shift vs. condition shifts ([0.0, 1.0])</li>
 *   <li>{@code learningFactor}      – EMA rate applied to condition effectiveness on feedback ([0.0, 1.0])</li>
 * </ul>
 */
public record AdaptationSettings(
    @JsonProperty("realTimeAdaptation") boolean realTimeAdaptation,
    @JsonProperty("dynamicWakeWindow")  boolean dynamicWakeWindow,
    @JsonProperty("sleepPatternWeight") double  sleepPatternWeight,
    @JsonProperty("learningFactor")     double  learningFactor
) {

    public static final double DEFAULT_SLEEP_PATTERN_WEIGHT = 0.7;
    public static final double DEFAULT_LEARNING_FACTOR      = 0.3;

    public static AdaptationSettings defaults() {
        return new AdaptationSettings(true, true, DEFAULT_SLEEP_PATTERN_WEIGHT, DEFAULT_LEARNING_FACTOR);
    }

    public AdaptationSettings withRealTimeAdaptation(boolean value) {
        return new AdaptationSettings(value, dynamicWakeWindow, sleepPatternWeight, learningFactor);
    }
}
