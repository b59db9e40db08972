package com.wakeengine.common.adaptation;

import com.wakeengine.common.model.AdaptationSource;

/**
 * Stateless blender that combines the condition and sleep-pattern shifts into a single decision.
 *
 * <pre>
 *   adjustment  = round(conditionAdj × (1 − w) + sleepAdj × w)
 *   significant = |adjustment| ≥ 5
 *   confidence  = min(1.0, 0.5 + agreement + magnitude)
 *     agreement = 0.3 when |conditionAdj − sleepAdj| &lt; 10, else 0
 *     magnitude = min(0.3, |conditionAdj + sleepAdj| / 30)
 * </pre>
 *
 * <p>Confidence never gates the change; only {@code significant} does. When the two
 * inputs disagree in sign the linear blend stands as is.
 */
public final class AdaptationBlender {

    public static final int SIGNIFICANCE_THRESHOLD_MINUTES = 5;

    static final double BASE_CONFIDENCE      = 0.5;
    static final double AGREEMENT_BONUS      = 0.3;
    static final double AGREEMENT_TOLERANCE  = 10.0;
    static final double MAX_MAGNITUDE_BONUS  = 0.3;
    static final double MAGNITUDE_SCALE      = 30.0;

    private AdaptationBlender() {}

    /**
     * @param sleepPatternWeight weight of the sleep-pattern shift; values outside [0, 1] are clamped
     */
    public static BlendResult blend(double conditionAdjustment,
                                    double sleepPatternAdjustment,
                                    double sleepPatternWeight) {
        double w = Math.max(0.0, Math.min(1.0, sleepPatternWeight));

        double conditionPart = conditionAdjustment * (1 - w);
        double sleepPart     = sleepPatternAdjustment * w;
        int adjustment = (int) Math.round(conditionPart + sleepPart);

        AdaptationSource dominant = Math.abs(sleepPart) > Math.abs(conditionPart)
            ? AdaptationSource.SLEEP_PATTERN
            : AdaptationSource.CONDITION;

        return new BlendResult(
            adjustment,
            isSignificant(adjustment),
            confidence(conditionAdjustment, sleepPatternAdjustment),
            dominant);
    }

    public static boolean isSignificant(int adjustment) {
        return Math.abs(adjustment) >= SIGNIFICANCE_THRESHOLD_MINUTES;
    }

    public static double confidence(double conditionAdjustment, double sleepPatternAdjustment) {
        double agreement = Math.abs(conditionAdjustment - sleepPatternAdjustment) < AGREEMENT_TOLERANCE
            ? AGREEMENT_BONUS
            : 0.0;
        double magnitude = Math.min(MAX_MAGNITUDE_BONUS,
            Math.abs(conditionAdjustment + sleepPatternAdjustment) / MAGNITUDE_SCALE);
        return Math.min(1.0, BASE_CONFIDENCE + agreement + magnitude);
    }

    /** Bounds a shift to {@code [-wakeWindow, +wakeWindow]}. */
    public static int clampToWindow(int adjustment, int wakeWindow) {
        int bound = Math.max(0, wakeWindow);
        return Math.max(-bound, Math.min(bound, adjustment));
    }
}
