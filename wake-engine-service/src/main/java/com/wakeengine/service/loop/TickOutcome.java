package com.wakeengine.service.loop;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalTime;

/**
 * Result of one adaptation tick, returned by {@code tickNow} and logged by the scheduler.
 * {@code newTime} is the alarm's target after the tick (unchanged unless {@code APPLIED}).
 */
public record TickOutcome(
    @JsonProperty("alarmId")    String    alarmId,
    @JsonProperty("tickId")     String    tickId,
    @JsonProperty("state")      TickState state,
    @JsonProperty("adjustment") int       adjustment,
    @JsonProperty("newTime")    LocalTime newTime,
    @JsonProperty("confidence") double    confidence,
    @JsonProperty("reason")     String    reason
) {

    public static TickOutcome applied(String alarmId, String tickId, int adjustment,
                                      LocalTime newTime, double confidence, String reason) {
        return new TickOutcome(alarmId, tickId, TickState.APPLIED, adjustment, newTime, confidence, reason);
    }

    public static TickOutcome skipped(String alarmId, String tickId, int adjustment,
                                      LocalTime currentTime, String reason) {
        return new TickOutcome(alarmId, tickId, TickState.SKIPPED, adjustment, currentTime, 0.0, reason);
    }

    public static TickOutcome failed(String alarmId, String tickId, LocalTime currentTime, String reason) {
        return new TickOutcome(alarmId, tickId, TickState.FAILED, 0, currentTime, 0.0, reason);
    }

    public static TickOutcome disabled(String alarmId, String tickId, LocalTime currentTime) {
        return new TickOutcome(alarmId, tickId, TickState.DISABLED, 0, currentTime, 0.0,
            "real-time adaptation is off");
    }
}
