package com.trainops.prognosis.ingest;

import com.google.common.base.Preconditions;

import java.time.LocalTime;
import java.util.Objects;

/**
 * Something that just happened to a train in the running simulation.
 */
public class LiveOccurrence {

    public final int trainId;

    public final OccurrenceKind kind;

    /** Simulation clock at the time of the occurrence. */
    public final LocalTime wallTime;

    /** Where the train is. */
    public final String location;

    /**
     * Track of the timetable line the occurrence refers to. While the train is travelling this is usually the next
     * target rather than the one just left.
     */
    public final String plannedLocation;

    /** True if the train stands at a platform, false while it is moving or passing through. */
    public final boolean atPlatform;

    public LiveOccurrence (int trainId, OccurrenceKind kind, LocalTime wallTime, String location,
                           String plannedLocation, boolean atPlatform) {
        Preconditions.checkNotNull(kind);
        Preconditions.checkNotNull(wallTime);
        this.trainId = trainId;
        this.kind = kind;
        this.wallTime = wallTime;
        this.location = location;
        this.plannedLocation = plannedLocation;
        this.atPlatform = atPlatform;
    }

    /** True if the other occurrence reports the same thing for the same train, ignoring the time. */
    public boolean repeats (LiveOccurrence other) {
        return other != null && trainId == other.trainId && kind == other.kind && atPlatform == other.atPlatform
                && Objects.equals(location, other.location)
                && Objects.equals(plannedLocation, other.plannedLocation);
    }

    @Override
    public String toString () {
        return String.format("%s %d %s at %s (%s)%s", kind, trainId, wallTime, location, plannedLocation,
                atPlatform ? " platform" : "");
    }

}
