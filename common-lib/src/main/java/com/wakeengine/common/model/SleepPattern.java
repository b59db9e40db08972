package com.wakeengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Recent sleep summary supplied by the sleep-stage predictor.
 *
 * <ul>
 *   <li>{@code sleepEfficiency}     – time asleep over time in bed, as a percentage ([0, 100]).</li>
 *   <li>{@code averageSleepMinutes} – mean nightly sleep duration over the predictor's window.</li>
 * </ul>
 */
public record SleepPattern(
    @JsonProperty("sleepEfficiency")     double sleepEfficiency,
    @JsonProperty("averageSleepMinutes") double averageSleepMinutes
) {}
