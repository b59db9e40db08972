package com.wakeengine.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * External signal families a {@link ConditionDefinition} can react to.
 *
 * <p>Each type declares the {@link ReadingValue.Kind reading shapes} it accepts.
 * A reading of any other shape is skipped by the evaluator rather than coerced.
 */
public enum ConditionType {
    WEATHER("weather",           EnumSet.of(ReadingValue.Kind.TEXT, ReadingValue.Kind.TEXT_LIST)),
    CALENDAR("calendar",         EnumSet.of(ReadingValue.Kind.TEXT, ReadingValue.Kind.TEXT_LIST, ReadingValue.Kind.FLAG)),
    SLEEP_DEBT("sleep_debt",     EnumSet.of(ReadingValue.Kind.NUMBER)),
    STRESS_LEVEL("stress_level", EnumSet.of(ReadingValue.Kind.NUMBER)),
    EXERCISE("exercise",         EnumSet.of(ReadingValue.Kind.NUMBER, ReadingValue.Kind.FLAG)),
    SCREEN_TIME("screen_time",   EnumSet.of(ReadingValue.Kind.NUMBER));

    private final String key;
    private final Set<ReadingValue.Kind> acceptedKinds;

    ConditionType(String key, Set<ReadingValue.Kind> acceptedKinds) {
        this.key = key;
        this.acceptedKinds = acceptedKinds;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public boolean accepts(ReadingValue value) {
        return value != null && acceptedKinds.contains(value.kind());
    }

    /**
     * @param key wire key such as {@code "sleep_debt"}; the enum constant name is accepted too
     * @return the matching type, or {@code null} when the key is unknown
     */
    @JsonCreator
    public static ConditionType fromKey(String key) {
        if (key == null) return null;
        for (ConditionType type : values()) {
            if (type.key.equalsIgnoreCase(key) || type.name().equalsIgnoreCase(key)) {
                return type;
            }
        }
        return null;
    }
}
