package com.wakeengine.common.spi;

import java.time.LocalTime;

/**
 * Receives alarm time changes after an adaptation has been applied.
 *
 * <p>Implementations MUST be non-blocking fire-and-forget: the engine never waits
 * for acknowledgement and a failed delivery never undoes an adaptation.
 */
public interface ScheduleNotifier {
    void onScheduleChanged(String alarmId, LocalTime newTime, double confidence, String reason);
}
