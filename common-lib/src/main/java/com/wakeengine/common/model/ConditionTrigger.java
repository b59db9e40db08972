package com.wakeengine.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Predicate a condition applies to its reading.
 *
 * <ul>
 *   <li>{@code operator}  – comparison to run</li>
 *   <li>{@code value}     – comparand for {@code equals} / {@code contains}; numeric fallback for ordering operators</li>
 *   <li>{@code threshold} – numeric comparand for {@code greater_than} / {@code less_than}; optional</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConditionTrigger(
    @JsonProperty("operator")  PredicateOperator operator,
    @JsonProperty("value")     ReadingValue      value,
    @JsonProperty("threshold") Double            threshold
) {

    public static ConditionTrigger equalsTo(String value) {
        return new ConditionTrigger(PredicateOperator.EQUALS, ReadingValue.text(value), null);
    }

    public static ConditionTrigger contains(String value) {
        return new ConditionTrigger(PredicateOperator.CONTAINS, ReadingValue.text(value), null);
    }

    public static ConditionTrigger greaterThan(double threshold) {
        return new ConditionTrigger(PredicateOperator.GREATER_THAN, ReadingValue.number(threshold), threshold);
    }

    public static ConditionTrigger lessThan(double threshold) {
        return new ConditionTrigger(PredicateOperator.LESS_THAN, ReadingValue.number(threshold), threshold);
    }
}
