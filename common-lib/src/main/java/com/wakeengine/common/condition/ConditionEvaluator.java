package com.wakeengine.common.condition;

import com.wakeengine.common.model.ConditionDefinition;
import com.wakeengine.common.model.ConditionReading;
import com.wakeengine.common.model.ReadingValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Stateless evaluator that turns condition readings into per-condition time shifts.
 *
 * <p><b>Per condition</b> (enabled definitions only):
 * <pre>
 *   reading missing or wrong shape → skipped
 *   trigger matches               → applied = clamp(minutes × effectivenessScore, −maxAdjustment, +maxAdjustment)
 * </pre>
 *
 * <p>{@code totalConditionAdjustment} is the plain sum of the applied values; it is
 * not clamped here. The evaluator never writes {@code lastTriggered}; the caller
 * stamps fired conditions once an adaptation is actually applied.
 */
public final class ConditionEvaluator {

    private ConditionEvaluator() {}

    public static ConditionEvaluation evaluate(List<ConditionDefinition> definitions, ConditionReading reading) {
        if (definitions == null || definitions.isEmpty()) {
            return ConditionEvaluation.none();
        }
        ConditionReading readings = reading != null ? reading : ConditionReading.empty();

        List<FiredCondition> fired   = new ArrayList<>();
        List<String>         skipped = new ArrayList<>();
        double total = 0.0;

        for (ConditionDefinition def : definitions) {
            if (!def.enabled() || def.type() == null) continue;

            Optional<ReadingValue> value = readings.get(def.type());
            if (value.isEmpty() || !def.type().accepts(value.get())) {
                skipped.add(def.id());
                continue;
            }
            if (!TriggerMatcher.matches(def.trigger(), value.get())) {
                continue;
            }

            double applied = appliedMinutes(def);
            total += applied;
            fired.add(new FiredCondition(def.id(), def.type(), applied, reasonText(def, applied)));
        }
        return new ConditionEvaluation(List.copyOf(fired), List.copyOf(skipped), total);
    }

    /**
     * Effectiveness-scaled shift for a matched condition, always inside
     * {@code [-maxAdjustment, +maxAdjustment]}.
     */
    public static double appliedMinutes(ConditionDefinition def) {
        double raw = def.adjustment().minutes() * def.effectivenessScore();
        double max = Math.abs(def.adjustment().maxAdjustment());
        return Math.max(-max, Math.min(max, raw));
    }

    private static String reasonText(ConditionDefinition def, double applied) {
        return String.format(Locale.ROOT, "%s: %.1fmin", def.type().key(), applied);
    }
}
