package com.wakeengine.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which input dominated an applied adaptation.
 */
public enum AdaptationSource {
    SLEEP_PATTERN,
    CONDITION,
    USER_FEEDBACK,
    LEARNING;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AdaptationSource fromKey(String key) {
        return key == null ? null : valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
