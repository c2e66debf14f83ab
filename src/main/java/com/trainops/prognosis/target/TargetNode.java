package com.trainops.prognosis.target;

import com.trainops.prognosis.util.TimeUtils;

import static com.trainops.prognosis.util.TimeUtils.NO_TIME;

/**
 * A planned stop, pass-through, entry or exit of one train. Times are seconds since midnight, NO_TIME if absent.
 * The two delay fields are written only by the feedback step after each prognosis. Status and reported delays come
 * from the position reported with the train's timetable.
 */
public class TargetNode {

    public final TargetKey key;

    public final int trainId;

    public TargetType type;

    public final String plannedLocation;

    /** Current track, differs from the planned one when a dispatcher reroutes the train. */
    public String location;

    public int plannedArrival = NO_TIME;

    public int plannedDeparture = NO_TIME;

    /** Estimated minimum dwell in seconds. */
    public int minimumDwell = 0;

    public ScheduleFlags flags = new ScheduleFlags("");

    /** Arrival delay in seconds relative to the planned arrival, NO_TIME until known. */
    public int arrivalDelay = NO_TIME;

    public int departureDelay = NO_TIME;

    public TargetStatus status = TargetStatus.AHEAD;

    /** Delays reported with the timetable, used to seed the events of this target. NO_TIME if not reported. */
    public int reportedArrivalDelay = NO_TIME;

    public int reportedDepartureDelay = NO_TIME;

    public TargetNode (TargetKey key, TargetType type, String plannedLocation) {
        this.key = key;
        this.trainId = key.trainId();
        this.type = type;
        this.plannedLocation = plannedLocation;
        this.location = plannedLocation;
    }

    /** Planned arrival, falling back to the planned departure. */
    public int plannedArrivalOrDeparture () {
        return plannedArrival != NO_TIME ? plannedArrival : plannedDeparture;
    }

    /** Planned departure, falling back to the planned arrival. */
    public int plannedDepartureOrArrival () {
        return plannedDeparture != NO_TIME ? plannedDeparture : plannedArrival;
    }

    @Override
    public String toString () {
        return String.format("%d %c %s %s/%s %s", trainId, type.code, plannedLocation,
                TimeUtils.timeToString(plannedArrival), TimeUtils.timeToString(plannedDeparture), flags);
    }

}
