package com.wakeengine.common.condition;

import com.wakeengine.common.model.ConditionTrigger;
import com.wakeengine.common.model.ReadingValue;

/**
 * Evaluates a {@link ConditionTrigger} against one reading.
 *
 * <ul>
 *   <li>{@code equals}       – value equality of reading and {@code value}</li>
 *   <li>{@code greater_than} – numeric reading {@code >} threshold (or {@code value} when no threshold)</li>
 *   <li>{@code less_than}    – numeric reading {@code <} threshold (or {@code value} when no threshold)</li>
 *   <li>{@code contains}     – list membership for list readings, substring match otherwise</li>
 * </ul>
 *
 * Any shape the operator cannot compare yields {@code false}.
 */
final class TriggerMatcher {

    private TriggerMatcher() {}

    static boolean matches(ConditionTrigger trigger, ReadingValue reading) {
        if (trigger == null || trigger.operator() == null || reading == null) {
            return false;
        }
        return switch (trigger.operator()) {
            case EQUALS       -> reading.equals(trigger.value());
            case GREATER_THAN -> compare(reading, trigger) > 0;
            case LESS_THAN    -> compare(reading, trigger) < 0;
            case CONTAINS     -> contains(reading, trigger.value());
        };
    }

    /** Signed comparison of reading vs. comparand; 0 when either side is not numeric. */
    private static int compare(ReadingValue reading, ConditionTrigger trigger) {
        if (!reading.isNumber()) return 0;
        Double comparand = trigger.threshold();
        if (comparand == null) {
            if (trigger.value() == null || !trigger.value().isNumber()) return 0;
            comparand = trigger.value().asNumber();
        }
        return Double.compare(reading.asNumber(), comparand);
    }

    private static boolean contains(ReadingValue reading, ReadingValue needle) {
        if (needle == null) return false;
        String target = needle.asText();
        if (reading.kind() == ReadingValue.Kind.TEXT_LIST) {
            return reading.asTextList().contains(target);
        }
        return reading.asText().contains(target);
    }
}
