package com.wakeengine.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Self-reported effort of getting up, ordered easiest first.
 */
public enum WakeDifficulty {
    VERY_EASY,
    EASY,
    NORMAL,
    HARD,
    VERY_HARD;

    /** 1 (very easy) .. 5 (very hard). */
    public int ordinalScore() {
        return ordinal() + 1;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WakeDifficulty fromKey(String key) {
        return key == null ? null : valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
