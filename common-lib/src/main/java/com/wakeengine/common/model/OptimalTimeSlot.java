package com.wakeengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalTime;
import java.util.List;

/**
 * A ranked candidate wake time.
 * {@code adjustment} is the signed minute offset from the alarm's baseline.
 */
public record OptimalTimeSlot(
    @JsonProperty("time")       LocalTime    time,
    @JsonProperty("confidence") double       confidence,
    @JsonProperty("sleepStage") SleepStage   sleepStage,
    @JsonProperty("factors")    List<String> factors,
    @JsonProperty("adjustment") int          adjustment
) {}
