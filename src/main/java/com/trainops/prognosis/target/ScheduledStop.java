package com.trainops.prognosis.target;

import java.time.LocalTime;

/**
 * One line of a train's timetable as delivered by the schedule source.
 */
public class ScheduledStop {

    /** Track the train is scheduled to use. */
    public String plannedLocation;

    /** Track the train has been routed to, if a dispatcher changed it. Otherwise equal to the planned location. */
    public String location;

    /** Either time may be null. A pass-through usually only has one. */
    public LocalTime arrival;

    public LocalTime departure;

    /** Raw operational flags, e.g. "D" for a pass-through or "E(1234)" for a replacement by train 1234. */
    public String flags = "";

    public ScheduledStop () { }

    public ScheduledStop (String plannedLocation, LocalTime arrival, LocalTime departure, String flags) {
        this.plannedLocation = plannedLocation;
        this.location = plannedLocation;
        this.arrival = arrival;
        this.departure = departure;
        this.flags = flags == null ? "" : flags;
    }

    @Override
    public String toString () {
        return String.format("%s %s-%s %s", plannedLocation, arrival, departure, flags);
    }

}
