package com.trainops.prognosis.event.build;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.trainops.prognosis.event.EventEdgeType;
import com.trainops.prognosis.event.EventKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * The events and edges a target will contribute to the event graph, before anything is committed. Edge i connects
 * event i to event i + 1, so a non-empty chain always has one edge less than it has events.
 *
 * Chains are immutable. Each splice returns a new chain, so that the link builders can rewrite the default pattern
 * of a target without sharing mutable state.
 */
public final class PendingChain {

    public final ImmutableList<PendingEvent> events;

    public final ImmutableList<PendingEdge> edges;

    /** Coupling events still to be inserted in front of the final departure, see {@link #withCouplingsSpliced()}. */
    public final ImmutableList<PendingEvent> couplings;

    /** The train the target belongs to. */
    public final int trainId;

    /** True if the target has no same-train predecessor, the first own event then becomes sequence 0. */
    public final boolean trainStart;

    /** Minimum dwell of the target in seconds, the default duration of the edges leaving the first event. */
    public final int dwell;

    public PendingChain (int trainId, boolean trainStart, int dwell, List<PendingEvent> events, List<PendingEdge> edges,
                         List<PendingEvent> couplings) {
        Preconditions.checkArgument(events.isEmpty() ? edges.isEmpty() : edges.size() == events.size() - 1,
                "A chain of %s events cannot have %s edges", events.size(), edges.size());
        this.trainId = trainId;
        this.trainStart = trainStart;
        this.dwell = dwell;
        this.events = ImmutableList.copyOf(events);
        this.edges = ImmutableList.copyOf(edges);
        this.couplings = ImmutableList.copyOf(couplings);
    }

    public PendingEvent first () {
        return events.isEmpty() ? null : events.get(0);
    }

    public PendingEvent last () {
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }

    public boolean startsWith (EventKind kind) {
        return !events.isEmpty() && first().kind() == kind;
    }

    public boolean endsWith (EventKind kind) {
        return !events.isEmpty() && last().kind() == kind;
    }

    private PendingChain with (List<PendingEvent> newEvents, List<PendingEdge> newEdges, List<PendingEvent> newCouplings) {
        return new PendingChain(trainId, trainStart, dwell, newEvents, newEdges, newCouplings);
    }

    /**
     * Insert an operation right after the first event, reached from it by the given edge. The edge that used to leave
     * the first event now leaves the operation.
     */
    public PendingChain withOperationAfterFirst (PendingEvent operation, PendingEdge edge) {
        Preconditions.checkState(!events.isEmpty(), "Cannot insert after the first event of an empty chain");
        List<PendingEvent> newEvents = new ArrayList<>(events);
        List<PendingEdge> newEdges = new ArrayList<>(edges);
        newEvents.add(1, operation);
        newEdges.add(0, edge);
        return with(newEvents, newEdges, couplings);
    }

    /**
     * Insert an event right before the final departure, leading to it by the given edge. Chains that do not end in a
     * departure are returned unchanged.
     */
    public PendingChain withFeederBeforeLast (PendingEvent feeder, PendingEdge edge) {
        if (!endsWith(EventKind.DEPARTURE)) return this;
        List<PendingEvent> newEvents = new ArrayList<>(events);
        List<PendingEdge> newEdges = new ArrayList<>(edges);
        newEvents.add(newEvents.size() - 1, feeder);
        newEdges.add(edge);
        return with(newEvents, newEdges, couplings);
    }

    public PendingChain withoutTrailingDeparture () {
        if (!endsWith(EventKind.DEPARTURE)) return this;
        List<PendingEvent> newEvents = new ArrayList<>(events.subList(0, events.size() - 1));
        List<PendingEdge> newEdges = edges.isEmpty() ? edges : edges.subList(0, edges.size() - 1);
        return with(newEvents, newEdges, couplings);
    }

    public PendingChain withoutLeadingArrival () {
        if (!startsWith(EventKind.ARRIVAL)) return this;
        List<PendingEvent> newEvents = events.subList(1, events.size());
        List<PendingEdge> newEdges = edges.isEmpty() ? edges : edges.subList(1, edges.size());
        return with(newEvents, newEdges, couplings);
    }

    /** Change the minimum duration of the edge into the last event. */
    public PendingChain withLastEdgeMinDuration (int minDuration) {
        if (edges.isEmpty()) return this;
        List<PendingEdge> newEdges = new ArrayList<>(edges);
        int last = newEdges.size() - 1;
        newEdges.set(last, newEdges.get(last).withMinDuration(minDuration));
        return with(events, newEdges, couplings);
    }

    public PendingChain withCoupling (PendingEvent coupling) {
        List<PendingEvent> newCouplings = new ArrayList<>(couplings);
        newCouplings.add(coupling);
        return with(events, edges, newCouplings);
    }

    /**
     * Insert the collected coupling events, earliest first, before the final departure. Each leads on to the next
     * (or to the departure) without delay.
     */
    public PendingChain withCouplingsSpliced () {
        if (couplings.isEmpty()) return this;
        List<PendingEvent> ordered = new ArrayList<>(couplings);
        ordered.sort(Comparator.comparingInt(PendingEvent::plannedTime));
        PendingChain chain = with(events, edges, ImmutableList.of());
        for (PendingEvent coupling : ordered) {
            chain = chain.withFeederBeforeLast(coupling, new PendingEdge(EventEdgeType.HOLD, coupling.trainId(), 0));
        }
        return chain;
    }

    @Override
    public String toString () {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < events.size(); i++) {
            if (i > 0) sb.append(" -").append(edges.get(i - 1).type().code).append("-> ");
            sb.append(events.get(i).kind().code);
        }
        return sb.toString();
    }

}
