package com.trainops.prognosis.event;

import com.trainops.prognosis.target.TargetKey;
import com.trainops.prognosis.util.TimeUtils;

import static com.trainops.prognosis.util.TimeUtils.NO_TIME;

/**
 * An atomic occurrence in the life of a train: arrival, departure, or one of the operations that hand a movement
 * over between two trains. Times are seconds since midnight.
 *
 * The measured time is set once, from a live occurrence, and is never changed afterward. The predicted time is
 * rewritten by every prognosis run.
 */
public class EventNode {

    public final int trainId;

    /** Unique per train, assigned by the graph. The first event of a train has sequence 0. */
    int sequence = -1;

    /** The target this event was derived from, or null. */
    public final TargetKey target;

    public final EventKind kind;

    public final String plannedLocation;

    public String location;

    public int plannedTime = NO_TIME;

    private int predictedTime = NO_TIME;

    private int measuredTime = NO_TIME;

    /** Position along the line, only used by diagrams. */
    public double linePosition = Double.NaN;

    public EventNode (int trainId, TargetKey target, EventKind kind, String plannedLocation) {
        this.trainId = trainId;
        this.target = target;
        this.kind = kind;
        this.plannedLocation = plannedLocation;
        this.location = plannedLocation;
    }

    public int getSequence () {
        return sequence;
    }

    public int getPredictedTime () {
        return predictedTime;
    }

    public int getMeasuredTime () {
        return measuredTime;
    }

    public boolean hasMeasuredTime () {
        return measuredTime != NO_TIME;
    }

    public boolean hasPredictedTime () {
        return predictedTime != NO_TIME;
    }

    /**
     * Record when this event actually happened.
     * @return false if a measured time was already present, in which case it is kept.
     */
    public boolean setMeasuredTime (int time) {
        if (measuredTime != NO_TIME) return false;
        measuredTime = time;
        return true;
    }

    public void setPredictedTime (int time) {
        predictedTime = time;
    }

    /** Measured time if present, else predicted time, else planned time, else NO_TIME. */
    public int effectiveTime () {
        if (measuredTime != NO_TIME) return measuredTime;
        if (predictedTime != NO_TIME) return predictedTime;
        return plannedTime;
    }

    @Override
    public String toString () {
        return String.format("%s %d/%d %s %s/%s/%s", kind.code, trainId, sequence, location,
                TimeUtils.timeToString(plannedTime), TimeUtils.timeToString(predictedTime),
                TimeUtils.timeToString(measuredTime));
    }

}
