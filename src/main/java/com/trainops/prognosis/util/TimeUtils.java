package com.trainops.prognosis.util;

import java.time.LocalTime;

/**
 * Times in this project are whole seconds since midnight of the simulated day, held in plain ints.
 */
public abstract class TimeUtils {

    /** Marks a time field that has not been set. */
    public static final int NO_TIME = Integer.MIN_VALUE;

    public static final int SECONDS_PER_MINUTE = 60;

    public static final int SECONDS_PER_DAY = 24 * 60 * 60;

    public static boolean isSet (int time) {
        return time != NO_TIME;
    }

    /** @return seconds since midnight, or NO_TIME for a null input. */
    public static int fromLocalTime (LocalTime time) {
        return time == null ? NO_TIME : time.toSecondOfDay();
    }

    public static int hm (int hours, int minutes) {
        return (hours * 60 + minutes) * SECONDS_PER_MINUTE;
    }

    /** Format as HH:MM, or an empty string for NO_TIME. */
    public static String timeToString (int time) {
        if (time == NO_TIME) return "";
        int minutes = Math.floorDiv(time, SECONDS_PER_MINUTE);
        return String.format("%02d:%02d", Math.floorDiv(minutes, 60), Math.floorMod(minutes, 60));
    }

    /** Format a signed duration in whole minutes, e.g. "+3" or "-1". */
    public static String deltaToString (int seconds) {
        int minutes = seconds / SECONDS_PER_MINUTE;
        return minutes >= 0 ? "+" + minutes : Integer.toString(minutes);
    }

}
