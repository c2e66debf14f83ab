package com.trainops.prognosis.target;

import com.google.common.base.Preconditions;

import static com.trainops.prognosis.util.TimeUtils.NO_TIME;

import java.util.ArrayList;
import java.util.List;

/**
 * The timetable of one train: its stops in order and, where the train starts or ends outside the simulated
 * network, the points where it enters or leaves.
 */
public class TrainSchedule {

    public final int trainId;

    public final String name;

    public final List<ScheduledStop> stops = new ArrayList<>();

    /** True once the train has entered the network. No entry target is synthesized for such trains. */
    public boolean entered = false;

    /** Null if the train starts inside the network. */
    public EntryExitPoint entryPoint;

    /** Null if the train ends inside the network. */
    public EntryExitPoint exitPoint;

    /** Index into stops of the stop the train is heading for or standing at, -1 if none. */
    public int currentStop = -1;

    /** True if the train stands at its current stop. */
    public boolean atPlatform = false;

    /** Current delay of the train in seconds, NO_TIME if not reported. */
    public int delay = NO_TIME;

    public TrainSchedule (int trainId, String name) {
        Preconditions.checkArgument(trainId > 0, "Train ids must be positive, got %s", trainId);
        this.trainId = trainId;
        this.name = name;
    }

    public TrainSchedule addStop (ScheduledStop stop) {
        stops.add(stop);
        return this;
    }

    @Override
    public String toString () {
        return String.format("%s (%d)", name, trainId);
    }

}
