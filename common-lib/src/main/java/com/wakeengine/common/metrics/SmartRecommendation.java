package com.wakeengine.common.metrics;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Advisory produced by {@link MetricsAggregator}. Never applied automatically.
 *
 * <p>{@code action.value} is a minute count for time and bedtime suggestions and a
 * condition id for {@code disable_condition}.
 */
public record SmartRecommendation(
    @JsonProperty("type")        RecommendationType type,
    @JsonProperty("description") String             description,
    @JsonProperty("impact")      Impact             impact,
    @JsonProperty("confidence")  double             confidence,
    @JsonProperty("action")      Action             action
) {

    public record Action(
        @JsonProperty("type")  String type,
        @JsonProperty("value") Object value
    ) {}
}
