package com.wakeengine.common.spi;

import com.wakeengine.common.model.ConditionReading;
import reactor.core.publisher.Mono;

/**
 * Latest external signals (weather, calendar, sleep debt, ...).
 * Absent keys in the reading mean "no data this cycle".
 */
public interface ConditionReadingSource {
    Mono<ConditionReading> currentReadings();
}
