package com.trainops.prognosis.event.build;

import com.trainops.prognosis.event.EventEdge;
import com.trainops.prognosis.event.EventEdgeType;

/**
 * An edge between two consecutive events of a {@link PendingChain}, without its end points.
 */
public record PendingEdge (EventEdgeType type, int trainId, int minDuration, int maxDuration) {

    public PendingEdge (EventEdgeType type, int trainId, int minDuration) {
        this(type, trainId, minDuration, EventEdge.UNBOUNDED);
    }

    public PendingEdge withMinDuration (int minDuration) {
        return new PendingEdge(type, trainId, minDuration, Math.max(minDuration, maxDuration));
    }

    public EventEdge toEventEdge (int fromVertex, int toVertex) {
        return new EventEdge(fromVertex, toVertex, type, trainId, minDuration, maxDuration, 0);
    }

}
