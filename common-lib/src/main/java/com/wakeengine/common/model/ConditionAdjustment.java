package com.wakeengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Time shift a condition requests when its trigger fires.
 * Negative {@code minutes} move the alarm earlier, positive later.
 * The realised shift is always bounded by {@code maxAdjustment} in both directions.
 */
public record ConditionAdjustment(
    @JsonProperty("minutes")       int    minutes,
    @JsonProperty("maxAdjustment") int    maxAdjustment,
    @JsonProperty("reason")        String reason
) {}
