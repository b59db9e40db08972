package com.wakeengine.service.client;

import com.wakeengine.common.model.ConditionReading;
import com.wakeengine.common.model.ConditionType;
import com.wakeengine.common.model.ReadingValue;
import com.wakeengine.common.spi.ConditionReadingSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.Map;

/**
 * Fetches the current condition signals as a flat JSON object, e.g.
 * <pre>
 *   {"weather": "light rain", "calendar": ["important"], "sleep_debt": 45}
 * </pre>
 * Unknown keys and values with no usable shape are dropped here; a missing key is
 * "no data this cycle" for the evaluator.
 */
@Component
public class RestConditionReadingSource implements ConditionReadingSource {

    private static final Logger log = LoggerFactory.getLogger(RestConditionReadingSource.class);

    private static final ParameterizedTypeReference<Map<String, Object>> READINGS_TYPE =
        new ParameterizedTypeReference<>() {};

    private final WebClient conditionSourceClient;

    public RestConditionReadingSource(WebClient conditionSourceClient) {
        this.conditionSourceClient = conditionSourceClient;
    }

    @Override
    public Mono<ConditionReading> currentReadings() {
        return conditionSourceClient.get()
            .uri("/api/v1/conditions/current")
            .retrieve()
            .bodyToMono(READINGS_TYPE)
            .map(RestConditionReadingSource::toReading);
    }

    static ConditionReading toReading(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) return ConditionReading.empty();
        Map<ConditionType, ReadingValue> values = new EnumMap<>(ConditionType.class);
        raw.forEach((key, value) -> {
            ConditionType type = ConditionType.fromKey(key);
            if (type == null) {
                log.debug("Ignoring unknown condition key. key={}", key);
                return;
            }
            if (value == null) return;
            try {
                values.put(type, ReadingValue.of(value));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring unreadable condition value. key={} reason={}", key, e.getMessage());
            }
        });
        return ConditionReading.of(values);
    }
}
