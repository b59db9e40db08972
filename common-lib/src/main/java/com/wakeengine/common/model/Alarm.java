package com.wakeengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * An adaptive alarm.
 *
 * <p>{@code baselineTime} is the time the user chose and never moves on its own.
 * {@code targetTime} is the time the engine currently wants the alarm to fire; every
 * adaptation is computed relative to the baseline, so the target always stays within
 * {@code baselineTime ± wakeWindow}.
 */
public record Alarm(
    @JsonProperty("id")           String             id,
    @JsonProperty("label")        String             label,
    @JsonProperty("baselineTime") LocalTime          baselineTime,
    @JsonProperty("targetTime")   LocalTime          targetTime,
    @JsonProperty("wakeWindow")   int                wakeWindow,
    @JsonProperty("enabled")      boolean            enabled,
    @JsonProperty("settings")     AdaptationSettings settings,
    @JsonProperty("createdAt")    LocalDateTime      createdAt,
    @JsonProperty("updatedAt")    LocalDateTime      updatedAt
) {

    public Alarm withTargetTime(LocalTime time, LocalDateTime at) {
        return new Alarm(id, label, baselineTime, time, wakeWindow, enabled, settings, createdAt, at);
    }

    public Alarm withSettings(AdaptationSettings value, LocalDateTime at) {
        return new Alarm(id, label, baselineTime, targetTime, wakeWindow, enabled, value, createdAt, at);
    }
}
