package com.trainops.prognosis.event;

import com.google.common.base.Preconditions;
import com.trainops.prognosis.graph.DirectedEdge;

/**
 * A duration constraint between two events. Edges are immutable; a changed constraint replaces the edge at the same
 * index via {@link EventGraph#replaceEdge}.
 *
 * The dispatcher correction shifts the bounds: a positive value raises the minimum (wait for something), a negative
 * value lowers the maximum (leave earlier). It never affects the other bound.
 */
public class EventEdge extends DirectedEdge {

    /** Value of maxDuration when the edge has no upper bound. */
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public final EventEdgeType type;

    /** The train this edge belongs to: the owner of the source event. */
    public final int trainId;

    /** Seconds. */
    public final int minDuration;

    /** Seconds, or UNBOUNDED. */
    public final int maxDuration;

    /** Seconds, zero if no dispatcher order applies. */
    public final int correction;

    public EventEdge (int fromVertex, int toVertex, EventEdgeType type, int trainId,
                      int minDuration, int maxDuration, int correction) {
        super(fromVertex, toVertex);
        Preconditions.checkArgument(maxDuration >= minDuration, "Edge maximum below minimum");
        this.type = type;
        this.trainId = trainId;
        this.minDuration = minDuration;
        this.maxDuration = maxDuration;
        this.correction = correction;
    }

    public EventEdge (int fromVertex, int toVertex, EventEdgeType type, int trainId, int minDuration) {
        this(fromVertex, toVertex, type, trainId, minDuration, UNBOUNDED, 0);
    }

    public boolean hasMaxDuration () {
        return maxDuration != UNBOUNDED;
    }

    public EventEdge withCorrection (int correction) {
        return new EventEdge(fromVertex, toVertex, type, trainId, minDuration, maxDuration, correction);
    }

    public EventEdge withMaxDuration (int maxDuration) {
        return new EventEdge(fromVertex, toVertex, type, trainId, minDuration, maxDuration, correction);
    }

    @Override
    public String toString () {
        StringBuilder sb = new StringBuilder();
        sb.append(type.code).append(' ').append(minDuration);
        if (hasMaxDuration()) sb.append("..").append(maxDuration);
        if (correction != 0) sb.append(correction > 0 ? " +" : " ").append(correction);
        return sb.toString();
    }

}
