package com.wakeengine.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifestyle templates used to seed an alarm's condition catalog.
 */
public enum UserProfile {
    PROFESSIONAL,
    STUDENT,
    FITNESS,
    SHIFT_WORKER,
    PARENT,
    TRAVELER;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static UserProfile fromKey(String key) {
        return key == null ? null : valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
