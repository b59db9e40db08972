package com.wakeengine.common.metrics;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Impact {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
