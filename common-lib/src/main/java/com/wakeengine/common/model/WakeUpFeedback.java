package com.wakeengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * User-reported outcome of one wake event.
 *
 * <ul>
 *   <li>{@code sleepQuality}     – 1 (worst) .. 10 (best)</li>
 *   <li>{@code timeToFullyAwake} – minutes until the user felt fully awake</li>
 * </ul>
 */
public record WakeUpFeedback(
    @JsonProperty("date")               LocalDate      date,
    @JsonProperty("originalTime")       LocalTime      originalTime,
    @JsonProperty("actualWakeTime")     LocalTime      actualWakeTime,
    @JsonProperty("difficulty")         WakeDifficulty difficulty,
    @JsonProperty("feeling")            WakeFeeling    feeling,
    @JsonProperty("sleepQuality")       int            sleepQuality,
    @JsonProperty("timeToFullyAwake")   int            timeToFullyAwake,
    @JsonProperty("wouldPreferEarlier") boolean        wouldPreferEarlier,
    @JsonProperty("wouldPreferLater")   boolean        wouldPreferLater,
    @JsonProperty("notes")              String         notes
) {}
