package com.trainops.prognosis;

import com.trainops.prognosis.event.EventGraph;
import com.trainops.prognosis.event.EventKind;
import com.trainops.prognosis.target.EntryExitPoint;
import com.trainops.prognosis.target.ScheduledStop;
import com.trainops.prognosis.target.TargetGraph;
import com.trainops.prognosis.target.TargetKey;
import com.trainops.prognosis.target.TargetNode;
import com.trainops.prognosis.target.TargetType;
import com.trainops.prognosis.target.TrainSchedule;

import java.time.LocalTime;

import static com.trainops.prognosis.util.TimeUtils.NO_TIME;

/**
 * Small timetables and hand-made target graphs shared by the tests.
 */
public abstract class ScheduleFixtures {

    public static LocalTime at (int hours, int minutes) {
        return LocalTime.of(hours, minutes);
    }

    public static ScheduledStop stop (String track, LocalTime arrival, LocalTime departure, String flags) {
        return new ScheduledStop(track, arrival, departure, flags);
    }

    public static ScheduledStop stop (String track, LocalTime arrival, LocalTime departure) {
        return new ScheduledStop(track, arrival, departure, "");
    }

    public static TrainSchedule train (int trainId, ScheduledStop... stops) {
        TrainSchedule schedule = new TrainSchedule(trainId, "T" + trainId);
        for (ScheduledStop stop : stops) schedule.addStop(stop);
        return schedule;
    }

    public static TrainSchedule fromOutside (TrainSchedule schedule, String entryId, String exitId) {
        if (entryId != null) schedule.entryPoint = new EntryExitPoint(entryId, "Entry " + entryId);
        if (exitId != null) schedule.exitPoint = new EntryExitPoint(exitId, "Exit " + exitId);
        return schedule;
    }

    /**
     * Add a target directly, bypassing the timetable import. Times are seconds since midnight, NO_TIME if absent.
     */
    public static int addTarget (TargetGraph graph, int trainId, TargetType type, String track,
                                 int arrival, int departure, int dwell) {
        int keyTime = arrival != NO_TIME ? arrival : departure;
        TargetNode node = new TargetNode(new TargetKey(trainId, keyTime, track), type, track);
        node.plannedArrival = arrival;
        node.plannedDeparture = departure;
        node.minimumDwell = dwell;
        return graph.addTarget(node);
    }

    /** The event of the given kind derived from a target, or -1. */
    public static int eventOf (EventGraph events, TargetGraph targets, int target, EventKind kind) {
        TargetNode node = targets.getVertex(target);
        return events.findByIdentity(node.trainId, node.key, kind);
    }

}
