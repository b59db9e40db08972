package com.wakeengine.common.spi;

import com.wakeengine.common.model.Alarm;
import com.wakeengine.common.model.SleepPattern;
import com.wakeengine.common.model.StagePrediction;
import com.wakeengine.common.model.WakeRecommendation;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Source of sleep data for an alarm's owner.
 *
 * <p>An empty {@link Mono} from {@link #currentPattern} or {@link #recommend} means
 * "no data yet" and is not an error.
 */
public interface SleepStagePredictor {

    Mono<SleepPattern> currentPattern(Alarm alarm);

    /** Predicted sleep stages around the alarm's wake window. */
    Mono<List<StagePrediction>> predict(Alarm alarm, SleepPattern pattern);

    /** The single best wake time the predictor would choose. */
    Mono<WakeRecommendation> recommend(Alarm alarm);
}
