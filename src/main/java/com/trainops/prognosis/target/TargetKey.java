package com.trainops.prognosis.target;

/**
 * Identifies a target: the train, its planned time at the target (seconds since midnight) and the planned track.
 * Entry and exit targets use the fixed times ENTRY_TIME and EXIT_TIME and the id of the entry or exit point as
 * location, so they stay put when the timetable shifts.
 */
public record TargetKey (int trainId, int time, String location) {

    public static final int ENTRY_TIME = 0;

    public static final int EXIT_TIME = 24 * 60 * 60;

    @Override
    public String toString () {
        return String.format("%d@%d:%s", trainId, time, location);
    }

}
