package com.wakeengine.common.metrics;

import com.wakeengine.common.model.AdaptationSettings;
import com.wakeengine.common.model.ConditionDefinition;
import com.wakeengine.common.model.ConditionType;

import java.util.ArrayList;
import java.util.List;

/**
 * Stateless scoring of how well an alarm's conditions are set up.
 *
 * <pre>
 *   score = 100
 *     − 40   no conditions at all
 *     − 10   any condition disabled
 *     − 15   no enabled weather condition
 *     − 15   no enabled calendar condition
 *     − 20   no enabled sleep-debt condition
 *     − 10   more than three enabled priority-5 conditions
 *     −  5   per enabled condition with effectiveness &lt; 0.6
 *     − 10   learningFactor &lt; 0.1      (or − 5 when &gt; 0.6)
 *
 *   grade: ≥ 90 Excellent, ≥ 75 Good, ≥ 60 Fair, otherwise Poor
 * </pre>
 */
public final class ConditionSetupAdvisor {

    static final int    MAX_CRITICAL_CONDITIONS = 3;
    static final int    CRITICAL_PRIORITY       = 5;
    static final double LOW_EFFECTIVENESS       = 0.6;
    static final double MIN_LEARNING_FACTOR     = 0.1;
    static final double MAX_LEARNING_FACTOR     = 0.6;

    private ConditionSetupAdvisor() {}

    public static ConditionSetupReport review(String alarmId,
                                              List<ConditionDefinition> conditions,
                                              AdaptationSettings settings) {
        List<String> issues          = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        int score = 100;

        if (conditions.isEmpty()) {
            issues.add("No conditions configured");
            recommendations.add("Enable basic conditions (weather, calendar, sleep debt)");
            score -= 40;
        }

        List<ConditionDefinition> enabled = conditions.stream().filter(ConditionDefinition::enabled).toList();
        if (enabled.size() < conditions.size()) {
            issues.add((conditions.size() - enabled.size()) + " conditions are disabled");
            recommendations.add("Review and enable useful conditions");
            score -= 10;
        }

        if (!hasType(enabled, ConditionType.WEATHER)) {
            recommendations.add("Add weather conditions for commute optimization");
            score -= 15;
        }
        if (!hasType(enabled, ConditionType.CALENDAR)) {
            recommendations.add("Add calendar integration for event preparation");
            score -= 15;
        }
        if (!hasType(enabled, ConditionType.SLEEP_DEBT)) {
            recommendations.add("Add sleep debt tracking for energy management");
            score -= 20;
        }

        long critical = enabled.stream().filter(c -> c.priority() == CRITICAL_PRIORITY).count();
        if (critical > MAX_CRITICAL_CONDITIONS) {
            issues.add("Too many critical priority conditions may cause conflicts");
            recommendations.add("Review priority levels and reduce critical conditions");
            score -= 10;
        }

        long weak = enabled.stream().filter(c -> c.effectivenessScore() < LOW_EFFECTIVENESS).count();
        if (weak > 0) {
            issues.add(weak + " conditions have low effectiveness");
            recommendations.add("Disable or adjust poorly performing conditions");
            score -= (int) weak * 5;
        }

        double learningFactor = settings != null ? settings.learningFactor() : AdaptationSettings.DEFAULT_LEARNING_FACTOR;
        if (learningFactor < MIN_LEARNING_FACTOR) {
            issues.add("Learning factor too low for effective adaptation");
            recommendations.add("Increase learning factor to 0.2-0.3");
            score -= 10;
        } else if (learningFactor > MAX_LEARNING_FACTOR) {
            issues.add("Learning factor too high may cause instability");
            recommendations.add("Reduce learning factor to 0.3-0.4");
            score -= 5;
        }

        score = Math.max(0, score);

        return new ConditionSetupReport(
            alarmId,
            issues.isEmpty(),
            score,
            grade(score),
            List.copyOf(issues),
            List.copyOf(recommendations),
            enabled.size(),
            conditions.size(),
            breakdown(conditions),
            conditions.stream().filter(c -> c.effectivenessScore() >= 0.9).limit(3).map(ConditionDefinition::id).toList(),
            conditions.stream().filter(c -> c.effectivenessScore() < 0.5).map(ConditionDefinition::id).toList(),
            conditions.stream().mapToDouble(ConditionDefinition::effectivenessScore).average().orElse(0.0));
    }

    public static String grade(int score) {
        if (score >= 90) return "Excellent";
        if (score >= 75) return "Good";
        if (score >= 60) return "Fair";
        return "Poor";
    }

    static ConditionSetupReport.EffectivenessBreakdown breakdown(List<ConditionDefinition> conditions) {
        int excellent = 0, good = 0, fair = 0, poor = 0;
        for (ConditionDefinition c : conditions) {
            double s = c.effectivenessScore();
            if (s >= 0.9)      excellent++;
            else if (s >= 0.7) good++;
            else if (s >= 0.5) fair++;
            else               poor++;
        }
        return new ConditionSetupReport.EffectivenessBreakdown(excellent, good, fair, poor);
    }

    private static boolean hasType(List<ConditionDefinition> enabled, ConditionType type) {
        return enabled.stream().anyMatch(c -> c.type() == type);
    }
}
