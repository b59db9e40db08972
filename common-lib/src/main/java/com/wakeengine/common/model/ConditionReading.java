package com.wakeengine.common.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of the condition signals observed for one evaluation cycle.
 * Absent keys mean "no data this cycle" and are never an error.
 */
public final class ConditionReading {

    private static final ConditionReading EMPTY = new ConditionReading(Map.of());

    private final Map<ConditionType, ReadingValue> values;

    private ConditionReading(Map<ConditionType, ReadingValue> values) {
        this.values = values;
    }

    public static ConditionReading of(Map<ConditionType, ReadingValue> values) {
        if (values == null || values.isEmpty()) return EMPTY;
        EnumMap<ConditionType, ReadingValue> copy = new EnumMap<>(ConditionType.class);
        values.forEach((type, value) -> {
            if (type != null && value != null) copy.put(type, value);
        });
        return new ConditionReading(Collections.unmodifiableMap(copy));
    }

    public static ConditionReading empty() {
        return EMPTY;
    }

    public Optional<ReadingValue> get(ConditionType type) {
        return Optional.ofNullable(values.get(type));
    }

    public Map<ConditionType, ReadingValue> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return "ConditionReading" + values;
    }
}
