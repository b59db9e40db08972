package com.wakeengine.common.metrics;

import com.wakeengine.common.model.AdaptationRecord;
import com.wakeengine.common.model.Alarm;
import com.wakeengine.common.model.ConditionDefinition;
import com.wakeengine.common.model.WakeUpFeedback;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Stateless read-side aggregation over an alarm's feedback and adaptation log.
 *
 * <p>Time-windowed views are computed on read; the stored logs are never pruned.
 *
 * <p><b>Recommendation rules</b>:
 * <pre>
 *   averageDifficulty &gt; 3.5                         → widen wake window by 10      (time_adjustment,   medium, 0.7)
 *   satisfaction &lt; 0.4                              → go to bed 30 min earlier     (sleep_goal_update, high,   0.8)
 *   real-time on, alarm older than 7 days,
 *     no adaptation in the last 7 days              → review conditions            (condition_change,  low,    0.5)
 *   enabled condition with effectiveness &lt; 0.4     → consider disabling it        (condition_change,  low,    0.6)
 * </pre>
 * The first two rules only fire when there is feedback in the window.
 */
public final class MetricsAggregator {

    public static final int    WINDOW_DAYS              = 30;
    public static final int    RECENT_DAYS              = 7;
    public static final int    TREND_LENGTH             = 7;
    public static final int    TOP_CONDITIONS           = 3;
    public static final double DEFAULT_SUCCESS          = 0.5;
    static final double        HARD_WAKE_THRESHOLD      = 3.5;
    static final double        LOW_SATISFACTION         = 0.4;
    static final double        INEFFECTIVE_CONDITION    = 0.4;
    static final int           WAKE_WINDOW_STEP_MINUTES = 10;
    static final int           BEDTIME_SHIFT_MINUTES    = -30;

    private MetricsAggregator() {}

    public static SmartAlarmMetrics aggregate(Alarm alarm,
                                              List<ConditionDefinition> conditions,
                                              List<AdaptationRecord> history,
                                              List<WakeUpFeedback> feedback,
                                              LocalDateTime now) {
        LocalDate windowStart = now.toLocalDate().minusDays(WINDOW_DAYS);
        List<WakeUpFeedback> recentFeedback = feedback.stream()
            .filter(f -> f.date() != null && f.date().isAfter(windowStart))
            .toList();
        List<AdaptationRecord> windowHistory = history.stream()
            .filter(r -> r.recordedAt() != null && r.recordedAt().toLocalDate().isAfter(windowStart))
            .toList();

        LocalDateTime recentStart = now.minusDays(RECENT_DAYS);
        int recentAdaptations = (int) history.stream()
            .filter(r -> r.recordedAt() != null && r.recordedAt().isAfter(recentStart))
            .count();

        double avgDifficulty = averageDifficulty(recentFeedback);
        double satisfaction  = userSatisfaction(recentFeedback);

        List<SmartRecommendation> recommendations = new ArrayList<>();
        if (!recentFeedback.isEmpty()) {
            if (avgDifficulty > HARD_WAKE_THRESHOLD) {
                recommendations.add(new SmartRecommendation(
                    RecommendationType.TIME_ADJUSTMENT,
                    "Consider moving your alarm 15-20 minutes earlier to align with lighter sleep phases",
                    Impact.MEDIUM, 0.7,
                    new SmartRecommendation.Action("adjust_wake_window",
                        alarm.wakeWindow() + WAKE_WINDOW_STEP_MINUTES)));
            }
            if (satisfaction < LOW_SATISFACTION) {
                recommendations.add(new SmartRecommendation(
                    RecommendationType.SLEEP_GOAL_UPDATE,
                    "Your sleep goals may need adjustment. Consider going to bed 30 minutes earlier",
                    Impact.HIGH, 0.8,
                    new SmartRecommendation.Action("adjust_bedtime", BEDTIME_SHIFT_MINUTES)));
            }
        }
        if (alarm.settings() != null && alarm.settings().realTimeAdaptation()
            && alarm.createdAt() != null && alarm.createdAt().isBefore(recentStart)
            && recentAdaptations == 0) {
            recommendations.add(new SmartRecommendation(
                RecommendationType.CONDITION_CHANGE,
                "No adaptations in the last week although real-time adaptation is on. Review your conditions and data sources",
                Impact.LOW, 0.5,
                new SmartRecommendation.Action("review_conditions", alarm.id())));
        }
        for (ConditionDefinition def : conditions) {
            if (def.enabled() && def.effectivenessScore() < INEFFECTIVE_CONDITION) {
                recommendations.add(new SmartRecommendation(
                    RecommendationType.CONDITION_CHANGE,
                    "Condition '" + def.id() + "' rarely helps. Consider disabling it",
                    Impact.LOW, 0.6,
                    new SmartRecommendation.Action("disable_condition", def.id())));
            }
        }

        return new SmartAlarmMetrics(
            alarm.id(),
            avgDifficulty,
            sleepQualityTrend(recentFeedback),
            adaptationSuccess(windowHistory),
            satisfaction,
            mostEffectiveConditions(conditions),
            List.copyOf(recommendations),
            recentAdaptations,
            recentFeedback.size());
    }

    /** Mean difficulty ordinal (1..5); 0 when there is no feedback. */
    public static double averageDifficulty(List<WakeUpFeedback> feedback) {
        return feedback.stream()
            .filter(f -> f.difficulty() != null)
            .mapToInt(f -> f.difficulty().ordinalScore())
            .average()
            .orElse(0.0);
    }

    /** Mean normalised feeling; 0 when there is no feedback. */
    public static double userSatisfaction(List<WakeUpFeedback> feedback) {
        return feedback.stream()
            .filter(f -> f.feeling() != null)
            .mapToDouble(f -> f.feeling().normalized())
            .average()
            .orElse(0.0);
    }

    public static List<Integer> sleepQualityTrend(List<WakeUpFeedback> feedback) {
        int from = Math.max(0, feedback.size() - TREND_LENGTH);
        return feedback.subList(from, feedback.size()).stream()
            .map(WakeUpFeedback::sleepQuality)
            .toList();
    }

    public static double adaptationSuccess(List<AdaptationRecord> history) {
        return history.stream()
            .map(AdaptationRecord::effectiveness)
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .average()
            .orElse(DEFAULT_SUCCESS);
    }

    /** Distinct condition type keys ordered by best effectiveness score. */
    public static List<String> mostEffectiveConditions(List<ConditionDefinition> conditions) {
        return conditions.stream()
            .filter(def -> def.type() != null)
            .sorted(Comparator.comparingDouble(ConditionDefinition::effectivenessScore).reversed())
            .map(def -> def.type().key())
            .distinct()
            .limit(TOP_CONDITIONS)
            .toList();
    }
}
