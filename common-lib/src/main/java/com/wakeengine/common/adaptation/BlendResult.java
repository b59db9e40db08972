package com.wakeengine.common.adaptation;

import com.wakeengine.common.model.AdaptationSource;

/**
 * Output of {@link AdaptationBlender#blend}.
 *
 * <ul>
 *   <li>{@code adjustment}     – rounded blended shift in minutes, not yet clamped to the wake window</li>
 *   <li>{@code significant}    – {@code |adjustment| ≥ 5}; only significant results are applied</li>
 *   <li>{@code confidence}     – informational [0.0, 1.0] score surfaced with the change</li>
 *   <li>{@code dominantSource} – whichever input contributed more to the blend</li>
 * </ul>
 */
public record BlendResult(
    int              adjustment,
    boolean          significant,
    double           confidence,
    AdaptationSource dominantSource
) {}
