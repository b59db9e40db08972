package com.wakeengine.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SleepStage {
    LIGHT,
    DEEP,
    REM;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SleepStage fromKey(String key) {
        return key == null ? null : valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
