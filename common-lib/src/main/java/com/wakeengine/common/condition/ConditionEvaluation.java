package com.wakeengine.common.condition;

import java.util.List;

/**
 * Output of one {@link ConditionEvaluator} run.
 *
 * <ul>
 *   <li>{@code fired}                    – conditions that matched, in catalog order</li>
 *   <li>{@code skipped}                  – ids of conditions with no usable reading this cycle</li>
 *   <li>{@code totalConditionAdjustment} – linear sum of {@code fired[*].appliedMinutes}</li>
 * </ul>
 */
public record ConditionEvaluation(
    List<FiredCondition> fired,
    List<String>         skipped,
    double               totalConditionAdjustment
) {

    public static ConditionEvaluation none() {
        return new ConditionEvaluation(List.of(), List.of(), 0.0);
    }

    public List<String> firedIds() {
        return fired.stream().map(FiredCondition::conditionId).toList();
    }

    /** {@code "weather: -8.0min, sleep_debt: -10.5min"}, or {@code "none"}. */
    public String summary() {
        if (fired.isEmpty()) return "none";
        return String.join(", ", fired.stream().map(FiredCondition::reason).toList());
    }
}
