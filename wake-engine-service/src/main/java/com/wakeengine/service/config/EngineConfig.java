package com.wakeengine.service.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;

@Configuration
public class EngineConfig {

    @Value("${services.sleep-predictor.base-url}")
    private String sleepPredictorUrl;

    @Value("${services.condition-source.base-url}")
    private String conditionSourceUrl;

    @Value("${services.notifier.base-url}")
    private String notifierUrl;

    @Value("${engine.tick-cadence:15m}")
    private Duration tickCadence;

    @Value("${engine.collaborator-timeout:4s}")
    private Duration collaboratorTimeout;

    @Value("${engine.zone:}")
    private String zone;

    @Bean
    public WebClient sleepPredictorClient(WebClient.Builder builder) {
        return builder.baseUrl(sleepPredictorUrl).build();
    }

    @Bean
    public WebClient conditionSourceClient(WebClient.Builder builder) {
        return builder.baseUrl(conditionSourceUrl).build();
    }

    @Bean
    public WebClient notifierClient(WebClient.Builder builder) {
        return builder.baseUrl(notifierUrl).build();
    }

    @Bean
    public EngineTiming engineTiming() {
        return new EngineTiming(tickCadence, collaboratorTimeout);
    }

    /** Wall clock in the zone that defines "same day" for feedback and metrics. */
    @Bean
    public Clock engineClock() {
        return zone == null || zone.isBlank()
            ? Clock.systemDefaultZone()
            : Clock.system(ZoneId.of(zone));
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
