package com.wakeengine.common.condition;

import com.wakeengine.common.model.ConditionType;

/**
 * A condition whose trigger matched this cycle.
 * {@code appliedMinutes} is already scaled by effectiveness and clamped.
 */
public record FiredCondition(
    String        conditionId,
    ConditionType type,
    double        appliedMinutes,
    String        reason
) {}
