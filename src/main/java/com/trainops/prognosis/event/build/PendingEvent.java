package com.trainops.prognosis.event.build;

import com.trainops.prognosis.event.EventKind;
import com.trainops.prognosis.event.EventNode;
import com.trainops.prognosis.target.TargetKey;

/**
 * An event that the translation intends to add to the event graph. Identity in the graph is (train, target, kind);
 * the other fields are copied onto the graph event on commit.
 */
public record PendingEvent (int trainId, TargetKey target, EventKind kind, String plannedLocation, String location,
                            int plannedTime) {

    public EventNode toEventNode () {
        EventNode node = new EventNode(trainId, target, kind, plannedLocation);
        node.location = location;
        node.plannedTime = plannedTime;
        return node;
    }

}
