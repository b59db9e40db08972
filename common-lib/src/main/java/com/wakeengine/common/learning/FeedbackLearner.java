package com.wakeengine.common.learning;

import com.wakeengine.common.exception.ValidationException;
import com.wakeengine.common.model.AdaptationRecord;
import com.wakeengine.common.model.ConditionDefinition;
import com.wakeengine.common.model.WakeUpFeedback;

import java.util.ArrayList;
import java.util.List;

/**
 * Stateless learner that turns one wake-up feedback entry into updated
 * condition effectiveness scores.
 *
 * <p><b>Effectiveness</b> of the feedback (each sub-score in [0, 1]):
 * <pre>
 *   difficultyScore = (5 − difficultyIndex) / 5      very_easy = 1.0 … very_hard = 0.2
 *   feelingScore    = feelingIndex / 4               terrible  = 0.0 … excellent = 1.0
 *   qualityScore    = sleepQuality / 10
 *   effectiveness   = (difficultyScore + feelingScore + qualityScore) / 3
 * </pre>
 *
 * <p><b>Update</b> for every condition whose {@code lastTriggered} falls on {@code feedback.date}:
 * <pre>
 *   score' = clamp(score × (1 − learningFactor) + effectiveness × learningFactor, 0, 1)
 * </pre>
 * Same-day adaptation records that have no effectiveness yet receive the same value.
 * This is the only place an effectiveness score is ever changed.
 */
public final class FeedbackLearner {

    public static final int MIN_SLEEP_QUALITY = 1;
    public static final int MAX_SLEEP_QUALITY = 10;

    private FeedbackLearner() {}

    /**
     * Result of one learning step.
     *
     * <ul>
     *   <li>{@code conditions}        – the full catalog after the step, in input order</li>
     *   <li>{@code updatedConditions} – only the definitions whose score moved</li>
     *   <li>{@code updatedRecords}    – same-day records that received an effectiveness</li>
     * </ul>
     */
    public record LearningOutcome(
        double                    effectiveness,
        List<ConditionDefinition> conditions,
        List<ConditionDefinition> updatedConditions,
        List<AdaptationRecord>    updatedRecords
    ) {}

    /**
     * @throws ValidationException when a required field is missing or out of range
     */
    public static void validate(WakeUpFeedback feedback) {
        if (feedback == null) throw new ValidationException("feedback is required");
        List<String> errors = new ArrayList<>();
        if (feedback.date() == null)           errors.add("date is required");
        if (feedback.actualWakeTime() == null) errors.add("actualWakeTime is required");
        if (feedback.difficulty() == null)     errors.add("difficulty is required");
        if (feedback.feeling() == null)        errors.add("feeling is required");
        if (feedback.sleepQuality() < MIN_SLEEP_QUALITY || feedback.sleepQuality() > MAX_SLEEP_QUALITY) {
            errors.add("sleepQuality must be within [1, 10], was " + feedback.sleepQuality());
        }
        if (feedback.timeToFullyAwake() < 0) {
            errors.add("timeToFullyAwake must not be negative, was " + feedback.timeToFullyAwake());
        }
        if (!errors.isEmpty()) throw new ValidationException(errors);
    }

    public static double effectiveness(WakeUpFeedback feedback) {
        double difficultyScore = (5.0 - feedback.difficulty().ordinal()) / 5.0;
        double feelingScore    = feedback.feeling().normalized();
        double qualityScore    = feedback.sleepQuality() / 10.0;
        return (difficultyScore + feelingScore + qualityScore) / 3.0;
    }

    /** Exponential moving average step, clamped to [0, 1]. */
    public static double updateScore(double current, double effectiveness, double learningFactor) {
        double lf = Math.max(0.0, Math.min(1.0, learningFactor));
        double next = current * (1 - lf) + effectiveness * lf;
        return Math.max(0.0, Math.min(1.0, next));
    }

    public static LearningOutcome apply(WakeUpFeedback feedback,
                                        List<ConditionDefinition> conditions,
                                        List<AdaptationRecord> history,
                                        double learningFactor) {
        validate(feedback);
        double eff = effectiveness(feedback);

        List<ConditionDefinition> all     = new ArrayList<>(conditions.size());
        List<ConditionDefinition> changed = new ArrayList<>();
        for (ConditionDefinition def : conditions) {
            if (triggeredOn(def, feedback)) {
                ConditionDefinition next =
                    def.withEffectivenessScore(updateScore(def.effectivenessScore(), eff, learningFactor));
                all.add(next);
                if (next.effectivenessScore() != def.effectivenessScore()) changed.add(next);
            } else {
                all.add(def);
            }
        }

        List<AdaptationRecord> backfilled = new ArrayList<>();
        for (AdaptationRecord record : history) {
            if (record.effectiveness() == null
                && record.recordedAt() != null
                && record.recordedAt().toLocalDate().equals(feedback.date())) {
                backfilled.add(record.withEffectiveness(eff));
            }
        }

        return new LearningOutcome(eff, List.copyOf(all), List.copyOf(changed), List.copyOf(backfilled));
    }

    private static boolean triggeredOn(ConditionDefinition def, WakeUpFeedback feedback) {
        return def.lastTriggered() != null
            && def.lastTriggered().toLocalDate().equals(feedback.date());
    }
}
