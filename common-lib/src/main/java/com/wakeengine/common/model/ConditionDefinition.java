package com.wakeengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * A user-editable rule that shifts the wake time when an external signal matches.
 *
 * <ul>
 *   <li>{@code priority} (1–5) orders conditions for display only; evaluation ignores it.</li>
 *   <li>{@code effectivenessScore} ([0.0, 1.0]) scales the requested shift and is learned
 *       from wake-up feedback.</li>
 *   <li>{@code lastTriggered} is the last time an applied adaptation included this condition.</li>
 * </ul>
 */
public record ConditionDefinition(
    @JsonProperty("id")                 String              id,
    @JsonProperty("type")               ConditionType       type,
    @JsonProperty("enabled")            boolean             enabled,
    @JsonProperty("priority")           int                 priority,
    @JsonProperty("trigger")            ConditionTrigger    trigger,
    @JsonProperty("adjustment")         ConditionAdjustment adjustment,
    @JsonProperty("effectivenessScore") double              effectivenessScore,
    @JsonProperty("lastTriggered")      LocalDateTime       lastTriggered
) {

    public ConditionDefinition withEffectivenessScore(double score) {
        return new ConditionDefinition(id, type, enabled, priority, trigger, adjustment, score, lastTriggered);
    }

    public ConditionDefinition withLastTriggered(LocalDateTime at) {
        return new ConditionDefinition(id, type, enabled, priority, trigger, adjustment, effectivenessScore, at);
    }

    public ConditionDefinition withEnabled(boolean value) {
        return new ConditionDefinition(id, type, value, priority, trigger, adjustment, effectivenessScore, lastTriggered);
    }
}
