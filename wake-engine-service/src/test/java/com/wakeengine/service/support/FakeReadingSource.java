package com.wakeengine.service.support;

import com.wakeengine.common.model.ConditionReading;
import com.wakeengine.common.model.ConditionType;
import com.wakeengine.common.model.ReadingValue;
import com.wakeengine.common.spi.ConditionReadingSource;
import reactor.core.publisher.Mono;

import java.util.Map;

public class FakeReadingSource implements ConditionReadingSource {

    public volatile Mono<ConditionReading> next = Mono.just(ConditionReading.empty());

    public void answer(Map<ConditionType, ReadingValue> values) {
        next = Mono.just(ConditionReading.of(values));
    }

    @Override
    public Mono<ConditionReading> currentReadings() {
        return next;
    }
}
