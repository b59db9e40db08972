package com.wakeengine.service.client;

import com.wakeengine.common.model.Alarm;
import com.wakeengine.common.model.SleepPattern;
import com.wakeengine.common.model.StagePrediction;
import com.wakeengine.common.model.WakeRecommendation;
import com.wakeengine.common.spi.SleepStagePredictor;
import com.wakeengine.service.dto.StagePredictionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * HTTP client for the sleep-predictor service.
 *
 * <p>A 404 means "no sleep data yet" and maps to an empty {@link Mono}; every other
 * error propagates so the adaptation loop can take its failure path.
 */
@Component
public class RestSleepStagePredictor implements SleepStagePredictor {

    private static final Logger log = LoggerFactory.getLogger(RestSleepStagePredictor.class);

    private final WebClient sleepPredictorClient;

    public RestSleepStagePredictor(WebClient sleepPredictorClient) {
        this.sleepPredictorClient = sleepPredictorClient;
    }

    @Override
    public Mono<SleepPattern> currentPattern(Alarm alarm) {
        return sleepPredictorClient.get()
            .uri("/api/v1/sleep/pattern/{alarmId}", alarm.id())
            .retrieve()
            .bodyToMono(SleepPattern.class)
            .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                log.info("No sleep pattern yet. alarmId={}", alarm.id());
                return Mono.empty();
            });
    }

    @Override
    public Mono<List<StagePrediction>> predict(Alarm alarm, SleepPattern pattern) {
        return sleepPredictorClient.post()
            .uri("/api/v1/sleep/predict")
            .bodyValue(new StagePredictionRequest(alarm.id(), alarm.baselineTime(), alarm.wakeWindow(), pattern))
            .retrieve()
            .bodyToFlux(StagePrediction.class)
            .collectList()
            .doOnSuccess(p -> log.debug("Stage predictions received. alarmId={} count={}",
                                        alarm.id(), p == null ? 0 : p.size()));
    }

    @Override
    public Mono<WakeRecommendation> recommend(Alarm alarm) {
        return sleepPredictorClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/v1/sleep/recommendation/{alarmId}")
                .queryParam("baseline", alarm.baselineTime())
                .queryParam("wakeWindow", alarm.wakeWindow())
                .build(alarm.id()))
            .retrieve()
            .bodyToMono(WakeRecommendation.class)
            .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty());
    }
}
