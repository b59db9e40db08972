package com.wakeengine.common.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

class TimeOfDayTest {

    @Test
    @DisplayName("shift wraps around midnight both ways")
    void shiftWraps() {
        assertEquals(LocalTime.of(23, 50), TimeOfDay.shift(LocalTime.of(0, 10), -20));
        assertEquals(LocalTime.of(0, 5),   TimeOfDay.shift(LocalTime.of(23, 55), 10));
        assertEquals(LocalTime.of(6, 49),  TimeOfDay.shift(LocalTime.of(7, 0), -11));
    }

    @Test
    @DisplayName("signedDifference takes the short way round")
    void signedDifference() {
        assertEquals(-12, TimeOfDay.signedDifference(LocalTime.of(7, 0), LocalTime.of(6, 48)));
        assertEquals(20,  TimeOfDay.signedDifference(LocalTime.of(23, 50), LocalTime.of(0, 10)));
        assertEquals(720, TimeOfDay.signedDifference(LocalTime.of(0, 0), LocalTime.of(12, 0)));
    }

    @Test
    @DisplayName("circularDistance is symmetric and never above 720")
    void circularDistance() {
        assertEquals(10, TimeOfDay.circularDistance(LocalTime.of(23, 55), LocalTime.of(0, 5)));
        assertEquals(10, TimeOfDay.circularDistance(LocalTime.of(0, 5), LocalTime.of(23, 55)));
        assertEquals(720, TimeOfDay.circularDistance(0, 720));
    }
}
