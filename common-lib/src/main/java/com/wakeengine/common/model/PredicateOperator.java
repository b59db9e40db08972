package com.wakeengine.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PredicateOperator {
    EQUALS,
    GREATER_THAN,
    LESS_THAN,
    CONTAINS;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PredicateOperator fromKey(String key) {
        return key == null ? null : valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
