package com.wakeengine.common.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Quality check of an alarm's condition setup, produced by {@link ConditionSetupAdvisor}.
 *
 * <p>{@code valid} is true only when no issue was found; missing condition types
 * lower the score and add recommendations without counting as issues.
 */
public record ConditionSetupReport(
    @JsonProperty("alarmId")              String              alarmId,
    @JsonProperty("valid")                boolean             valid,
    @JsonProperty("score")                int                 score,
    @JsonProperty("grade")                String              grade,
    @JsonProperty("issues")               List<String>        issues,
    @JsonProperty("recommendations")      List<String>        recommendations,
    @JsonProperty("enabledConditions")    int                 enabledConditions,
    @JsonProperty("totalConditions")      int                 totalConditions,
    @JsonProperty("breakdown")            EffectivenessBreakdown breakdown,
    @JsonProperty("topPerformers")        List<String>        topPerformers,
    @JsonProperty("underPerformers")      List<String>        underPerformers,
    @JsonProperty("averageEffectiveness") double              averageEffectiveness
) {

    /** Condition counts per effectiveness band: ≥0.9, ≥0.7, ≥0.5, below. */
    public record EffectivenessBreakdown(
        @JsonProperty("excellent") int excellent,
        @JsonProperty("good")      int good,
        @JsonProperty("fair")      int fair,
        @JsonProperty("poor")      int poor
    ) {}
}
