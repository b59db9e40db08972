package com.wakeengine.common.metrics;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RecommendationType {
    TIME_ADJUSTMENT,
    CONDITION_CHANGE,
    SLEEP_GOAL_UPDATE;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
