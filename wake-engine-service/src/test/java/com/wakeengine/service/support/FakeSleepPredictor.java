package com.wakeengine.service.support;

import com.wakeengine.common.model.Alarm;
import com.wakeengine.common.model.SleepPattern;
import com.wakeengine.common.model.StagePrediction;
import com.wakeengine.common.model.WakeRecommendation;
import com.wakeengine.common.spi.SleepStagePredictor;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Supplier;

/** Predictor whose answers are swapped per test; a null value answers empty. */
public class FakeSleepPredictor implements SleepStagePredictor {

    public volatile SleepPattern pattern = new SleepPattern(100.0, 450.0);
    public volatile WakeRecommendation recommendation;
    public volatile List<StagePrediction> predictions = List.of();
    public volatile Supplier<Mono<SleepPattern>> patternOverride;
    public volatile RuntimeException predictFailure;

    @Override
    public Mono<SleepPattern> currentPattern(Alarm alarm) {
        if (patternOverride != null) return patternOverride.get();
        return Mono.justOrEmpty(pattern);
    }

    @Override
    public Mono<List<StagePrediction>> predict(Alarm alarm, SleepPattern pattern) {
        if (predictFailure != null) return Mono.error(predictFailure);
        return Mono.just(predictions);
    }

    @Override
    public Mono<WakeRecommendation> recommend(Alarm alarm) {
        return Mono.justOrEmpty(recommendation);
    }
}
