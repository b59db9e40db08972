package com.wakeengine.common.sleep;

import com.wakeengine.common.model.OptimalTimeSlot;
import com.wakeengine.common.model.SleepPattern;
import com.wakeengine.common.model.SleepStage;
import com.wakeengine.common.model.StagePrediction;
import com.wakeengine.common.model.WakeRecommendation;
import com.wakeengine.common.model.WakeUpFeedback;
import com.wakeengine.common.time.TimeOfDay;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Stateless calculator for sleep-stage driven wake-time choices.
 *
 * <p><b>Slot confidence</b> for each candidate in {@code [baseline − wakeWindow, baseline + 10]}
 * (5-minute steps):
 * <pre>
 *   confidence  = 0.5 + stageBonus                 light +0.3, rem +0.1, deep −0.2
 *   confidence += max(0, 0.2 − |Δ| / wakeWindow × 0.2)
 *   confidence *= Π (0.7 + 0.3 × feeling)          over the last 5 feedback entries woken within 15 min
 *   confidence  = clamp(confidence, 0, 1)
 * </pre>
 *
 * <p><b>Sleep-pattern adjustment</b>:
 * <pre>
 *   adjustment = recommended − baseline
 *   bound      = dynamic ? round(wakeWindow × (0.5 + 0.5 × efficiency) × feedbackFactor) : wakeWindow
 *   feedbackFactor = 0.6 + (5 − avgDifficulty) × 0.1    over the last 10 feedback entries (1.0 when none)
 * </pre>
 */
public final class SleepPatternAdjuster {

    static final int    SLOT_STEP_MINUTES        = 5;
    static final int    SLOT_TRAILING_MINUTES    = 10;
    static final int    MAX_SLOTS                = 5;
    static final double BASE_CONFIDENCE          = 0.5;
    static final double PROXIMITY_BONUS          = 0.2;
    static final int    PREFERENCE_HISTORY       = 5;
    static final int    PREFERENCE_RADIUS_MIN    = 15;
    static final int    DIFFICULTY_HISTORY       = 10;
    static final int    CLOSE_TO_BASELINE_MIN    = 10;
    static final double HIGH_CONFIDENCE          = 0.8;

    private SleepPatternAdjuster() {}

    /**
     * Ranks candidate wake times around the baseline.
     *
     * @param predictions predicted stages across the night (may be empty)
     * @param feedback    wake-up feedback, oldest first (may be empty)
     * @return at most five slots, highest confidence first; ties keep the earlier candidate first
     */
    public static List<OptimalTimeSlot> calculateOptimalTimeSlots(LocalTime baseline,
                                                                  int wakeWindow,
                                                                  List<StagePrediction> predictions,
                                                                  List<WakeUpFeedback> feedback) {
        int window = Math.max(0, wakeWindow);
        List<OptimalTimeSlot> slots = new ArrayList<>();

        for (int offset = -window; offset <= SLOT_TRAILING_MINUTES; offset += SLOT_STEP_MINUTES) {
            LocalTime candidate = TimeOfDay.shift(baseline, offset);
            SleepStage stage = stageAt(predictions, TimeOfDay.toMinutes(candidate));
            int distance = Math.abs(offset);

            double confidence = BASE_CONFIDENCE + stageBonus(stage);
            confidence += proximityBonus(distance, window);
            confidence *= timePreferenceFactor(feedback, candidate);
            confidence = Math.max(0.0, Math.min(1.0, confidence));

            slots.add(new OptimalTimeSlot(candidate, confidence, stage,
                optimalityFactors(stage, distance, confidence), offset));
        }

        slots.sort(Comparator.comparingDouble(OptimalTimeSlot::confidence).reversed());
        return List.copyOf(slots.subList(0, Math.min(MAX_SLOTS, slots.size())));
    }

    /**
     * Signed minutes the sleep predictor would move the alarm, bounded by the
     * static or dynamic wake window. Returns 0 when there is no recommendation.
     */
    public static int calculateSleepPatternAdjustment(LocalTime baseline,
                                                      int wakeWindow,
                                                      boolean dynamicWindow,
                                                      WakeRecommendation recommendation,
                                                      SleepPattern pattern,
                                                      List<WakeUpFeedback> feedback) {
        if (recommendation == null || recommendation.time() == null) return 0;

        int adjustment = TimeOfDay.signedDifference(baseline, recommendation.time());
        int bound = dynamicWindow
            ? dynamicWakeWindow(wakeWindow, pattern, feedback)
            : Math.max(0, wakeWindow);
        return Math.max(-bound, Math.min(bound, adjustment));
    }

    /**
     * Wake window scaled by sleep efficiency (more consistent sleep tolerates a wider
     * window) and by how hard recent wake-ups were.
     */
    public static int dynamicWakeWindow(int wakeWindow, SleepPattern pattern, List<WakeUpFeedback> feedback) {
        double efficiency = pattern == null
            ? 1.0
            : Math.max(0.0, Math.min(100.0, pattern.sleepEfficiency())) / 100.0;
        double consistencyFactor = 0.5 + efficiency * 0.5;
        long bound = Math.round(Math.max(0, wakeWindow) * consistencyFactor * feedbackFactor(feedback));
        return (int) Math.max(0, bound);
    }

    /** {@code 0.6 + (5 − avgDifficulty) × 0.1} over the last ten entries; 1.0 without feedback. */
    public static double feedbackFactor(List<WakeUpFeedback> feedback) {
        List<WakeUpFeedback> recent = tail(feedback, DIFFICULTY_HISTORY);
        if (recent.isEmpty()) return 1.0;
        double avgDifficulty = recent.stream()
            .mapToInt(f -> f.difficulty().ordinalScore())
            .average()
            .orElse(3.0);
        return 0.6 + (5 - avgDifficulty) * 0.1;
    }

    static double timePreferenceFactor(List<WakeUpFeedback> feedback, LocalTime candidate) {
        double factor = 1.0;
        for (WakeUpFeedback f : tail(feedback, PREFERENCE_HISTORY)) {
            if (f.actualWakeTime() == null || f.feeling() == null) continue;
            if (TimeOfDay.circularDistance(candidate, f.actualWakeTime()) < PREFERENCE_RADIUS_MIN) {
                factor *= 0.7 + f.feeling().normalized() * 0.3;
            }
        }
        return factor;
    }

    /** Stage of the prediction nearest to {@code minuteOfDay}; {@code LIGHT} when nothing is predicted. */
    static SleepStage stageAt(List<StagePrediction> predictions, int minuteOfDay) {
        if (predictions == null || predictions.isEmpty()) return SleepStage.LIGHT;
        StagePrediction closest = null;
        int best = Integer.MAX_VALUE;
        for (StagePrediction p : predictions) {
            int d = TimeOfDay.circularDistance(p.minuteOfDay(), minuteOfDay);
            if (d < best) {
                best = d;
                closest = p;
            }
        }
        return closest == null || closest.stage() == null ? SleepStage.LIGHT : closest.stage();
    }

    private static double stageBonus(SleepStage stage) {
        return switch (stage) {
            case LIGHT -> 0.3;
            case REM   -> 0.1;
            case DEEP  -> -0.2;
        };
    }

    private static double proximityBonus(int distance, int window) {
        if (window == 0) return distance == 0 ? PROXIMITY_BONUS : 0.0;
        return Math.max(0.0, PROXIMITY_BONUS - ((double) distance / window) * PROXIMITY_BONUS);
    }

    private static List<String> optimalityFactors(SleepStage stage, int distance, double confidence) {
        List<String> factors = new ArrayList<>(3);
        switch (stage) {
            case LIGHT -> factors.add("Optimal sleep stage (light)");
            case REM   -> factors.add("Good sleep stage (REM)");
            case DEEP  -> factors.add("Suboptimal sleep stage (deep)");
        }
        if (distance < CLOSE_TO_BASELINE_MIN) factors.add("Close to preferred time");
        if (confidence > HIGH_CONFIDENCE)     factors.add("High confidence based on patterns");
        return List.copyOf(factors);
    }

    private static <T> List<T> tail(List<T> items, int n) {
        if (items == null || items.isEmpty()) return List.of();
        return items.subList(Math.max(0, items.size() - n), items.size());
    }
}
