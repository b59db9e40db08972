package com.wakeengine.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Self-reported mood after waking, ordered worst first.
 */
public enum WakeFeeling {
    TERRIBLE,
    TIRED,
    OKAY,
    GOOD,
    EXCELLENT;

    /** 0.0 (terrible) .. 1.0 (excellent). */
    public double normalized() {
        return ordinal() / 4.0;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WakeFeeling fromKey(String key) {
        return key == null ? null : valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
