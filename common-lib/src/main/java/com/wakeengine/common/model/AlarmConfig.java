package com.wakeengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalTime;
import java.util.List;

/**
 * Input for creating an adaptive alarm. Every field except {@code baselineTime}
 * is optional; absent values take the engine defaults.
 *
 * <p>Conditions come from {@code conditions} when given, otherwise from the
 * {@code profile} template, otherwise from the default condition set.
 */
public record AlarmConfig(
    @JsonProperty("label")              String                    label,
    @JsonProperty("baselineTime")       LocalTime                 baselineTime,
    @JsonProperty("wakeWindow")         Integer                   wakeWindow,
    @JsonProperty("enabled")            Boolean                   enabled,
    @JsonProperty("realTimeAdaptation") Boolean                   realTimeAdaptation,
    @JsonProperty("dynamicWakeWindow")  Boolean                   dynamicWakeWindow,
    @JsonProperty("sleepPatternWeight") Double                    sleepPatternWeight,
    @JsonProperty("learningFactor")     Double                    learningFactor,
    @JsonProperty("profile")            UserProfile               profile,
    @JsonProperty("conditions")         List<ConditionDefinition> conditions
) {

    public static final int DEFAULT_WAKE_WINDOW = 30;

    public static AlarmConfig at(LocalTime baselineTime) {
        return new AlarmConfig(null, baselineTime, null, null, null, null, null, null, null, null);
    }
}
