package com.wakeengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalTime;

/**
 * The sleep predictor's single best wake time for an alarm.
 */
public record WakeRecommendation(
    @JsonProperty("time")       LocalTime time,
    @JsonProperty("confidence") double    confidence
) {}
