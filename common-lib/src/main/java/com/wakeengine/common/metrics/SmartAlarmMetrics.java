package com.wakeengine.common.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Read-side summary of one alarm over the last 30 days.
 *
 * <ul>
 *   <li>{@code averageWakeUpDifficulty} – mean difficulty, 1 (very easy) .. 5 (very hard); 0 without feedback</li>
 *   <li>{@code sleepQualityTrend}       – sleep quality of the last seven feedback entries, oldest first</li>
 *   <li>{@code adaptationSuccess}       – mean recorded effectiveness of adaptations; 0.5 when none is known</li>
 *   <li>{@code userSatisfaction}        – mean normalised feeling ([0.0, 1.0]); 0 without feedback</li>
 *   <li>{@code mostEffectiveConditions} – up to three condition type keys, best first</li>
 *   <li>{@code recentAdaptations}       – adaptations applied in the last seven days</li>
 *   <li>{@code sampleSize}              – feedback entries inside the window</li>
 * </ul>
 */
public record SmartAlarmMetrics(
    @JsonProperty("alarmId")                 String                    alarmId,
    @JsonProperty("averageWakeUpDifficulty") double                    averageWakeUpDifficulty,
    @JsonProperty("sleepQualityTrend")       List<Integer>             sleepQualityTrend,
    @JsonProperty("adaptationSuccess")       double                    adaptationSuccess,
    @JsonProperty("userSatisfaction")        double                    userSatisfaction,
    @JsonProperty("mostEffectiveConditions") List<String>              mostEffectiveConditions,
    @JsonProperty("recommendedAdjustments")  List<SmartRecommendation> recommendedAdjustments,
    @JsonProperty("recentAdaptations")       int                       recentAdaptations,
    @JsonProperty("sampleSize")              int                       sampleSize
) {}
