package com.wakeengine.common.condition;

import com.wakeengine.common.exception.ValidationException;
import com.wakeengine.common.model.ConditionDefinition;
import com.wakeengine.common.model.PredicateOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks applied before a {@link ConditionDefinition} enters a catalog.
 */
public final class ConditionValidator {

    static final int MIN_PRIORITY = 1;
    static final int MAX_PRIORITY = 5;

    private ConditionValidator() {}

    /**
     * @throws ValidationException listing every violated rule
     */
    public static void validate(ConditionDefinition def) {
        List<String> errors = collectErrors(def);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    public static List<String> collectErrors(ConditionDefinition def) {
        List<String> errors = new ArrayList<>();
        if (def == null) {
            errors.add("condition definition is required");
            return errors;
        }
        if (def.id() == null || def.id().isBlank()) {
            errors.add("id must not be blank");
        }
        if (def.type() == null) {
            errors.add("type is required");
        }
        if (def.priority() < MIN_PRIORITY || def.priority() > MAX_PRIORITY) {
            errors.add("priority must be within [" + MIN_PRIORITY + ", " + MAX_PRIORITY + "], was " + def.priority());
        }
        if (Double.isNaN(def.effectivenessScore())
                || def.effectivenessScore() < 0.0 || def.effectivenessScore() > 1.0) {
            errors.add("effectivenessScore must be within [0, 1], was " + def.effectivenessScore());
        }

        if (def.trigger() == null || def.trigger().operator() == null) {
            errors.add("trigger operator is required");
        } else {
            PredicateOperator op = def.trigger().operator();
            boolean ordering = op == PredicateOperator.GREATER_THAN || op == PredicateOperator.LESS_THAN;
            if (ordering && def.trigger().threshold() == null
                    && (def.trigger().value() == null || !def.trigger().value().isNumber())) {
                errors.add(op.key() + " needs a numeric threshold or value");
            }
            if (!ordering && def.trigger().value() == null) {
                errors.add(op.key() + " needs a value");
            }
        }

        if (def.adjustment() == null) {
            errors.add("adjustment is required");
        } else {
            int minutes = def.adjustment().minutes();
            int max     = def.adjustment().maxAdjustment();
            if (max < 0) {
                errors.add("maxAdjustment must not be negative, was " + max);
            }
            if (max < Math.abs(minutes)) {
                errors.add("maxAdjustment (" + max + ") must be at least |minutes| (" + Math.abs(minutes) + ")");
            }
        }
        return errors;
    }
}
