package com.wakeengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Predicted sleep stage at a minute of the day ({@code 0..1439}).
 */
public record StagePrediction(
    @JsonProperty("minuteOfDay") int        minuteOfDay,
    @JsonProperty("stage")       SleepStage stage
) {}
