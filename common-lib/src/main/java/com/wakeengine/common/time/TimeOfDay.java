package com.wakeengine.common.time;

import java.time.LocalTime;

/**
 * Minutes-of-day arithmetic with same-day wraparound.
 *
 * <p>All shifts are taken modulo {@value #MINUTES_PER_DAY}, so shifting {@code 00:10}
 * by {@code -20} lands on {@code 23:50}.
 */
public final class TimeOfDay {

    public static final int MINUTES_PER_DAY = 24 * 60;

    private TimeOfDay() {}

    public static int toMinutes(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }

    /** Normalises any integer minute count into a time of day. */
    public static LocalTime fromMinutes(int totalMinutes) {
        int normalized = Math.floorMod(totalMinutes, MINUTES_PER_DAY);
        return LocalTime.of(normalized / 60, normalized % 60);
    }

    public static LocalTime shift(LocalTime time, int minutes) {
        return fromMinutes(toMinutes(time) + minutes);
    }

    /**
     * Shortest signed offset that moves {@code from} onto {@code to},
     * in {@code [-719, 720]}.
     */
    public static int signedDifference(LocalTime from, LocalTime to) {
        int diff = Math.floorMod(toMinutes(to) - toMinutes(from), MINUTES_PER_DAY);
        return diff > MINUTES_PER_DAY / 2 ? diff - MINUTES_PER_DAY : diff;
    }

    /** Unsigned distance between two minutes-of-day values, going the short way round. */
    public static int circularDistance(int minuteA, int minuteB) {
        int diff = Math.floorMod(minuteA - minuteB, MINUTES_PER_DAY);
        return Math.min(diff, MINUTES_PER_DAY - diff);
    }

    public static int circularDistance(LocalTime a, LocalTime b) {
        return circularDistance(toMinutes(a), toMinutes(b));
    }
}
