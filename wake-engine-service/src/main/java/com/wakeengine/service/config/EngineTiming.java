package com.wakeengine.service.config;

import java.time.Duration;

/**
 * Timing knobs of the adaptation loop.
 *
 * <ul>
 *   <li>{@code tickCadence}         – delay between two scheduled ticks of one alarm</li>
 *   <li>{@code collaboratorTimeout} – upper bound for each predictor, reading-source and storage call inside a tick</li>
 * </ul>
 */
public record EngineTiming(Duration tickCadence, Duration collaboratorTimeout) {

    public static final Duration DEFAULT_TICK_CADENCE         = Duration.ofMinutes(15);
    public static final Duration DEFAULT_COLLABORATOR_TIMEOUT = Duration.ofSeconds(4);

    public static EngineTiming defaults() {
        return new EngineTiming(DEFAULT_TICK_CADENCE, DEFAULT_COLLABORATOR_TIMEOUT);
    }
}
