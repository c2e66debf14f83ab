package com.trainops.prognosis.event.build;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.trainops.prognosis.event.EventEdgeType;
import com.trainops.prognosis.event.EventGraph;
import com.trainops.prognosis.event.EventKind;
import com.trainops.prognosis.event.EventNode;
import com.trainops.prognosis.graph.DirectedGraph;
import com.trainops.prognosis.target.TargetNode;
import com.trainops.prognosis.target.TargetStatus;
import com.trainops.prognosis.target.TargetType;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

import static com.trainops.prognosis.util.TimeUtils.NO_TIME;

/**
 * Translates one target into events. The builder starts out with the default pattern of the target type. Link
 * builders may then rewrite the pattern through {@link #update(UnaryOperator)} before {@link #addToGraph} commits it.
 * A builder commits once; later calls return the same result.
 */
public class EventNodeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(EventNodeBuilder.class);

    public final TargetNode target;

    private PendingChain chain;

    /** Vertex indexes of the committed events in chain order, null before commit. */
    private TIntList committed = null;

    private final TIntList committedEdges = new TIntArrayList();

    public EventNodeBuilder (TargetNode target, boolean trainStart) {
        this.target = target;
        this.chain = defaultChain(target, trainStart);
    }

    /**
     * Stops become arrival, hold, departure. Entries only have a departure and exits only an arrival. The hold edge
     * gets an upper bound where the timetable allows an early departure.
     */
    static PendingChain defaultChain (TargetNode target, boolean trainStart) {
        int trainId = target.trainId;
        PendingEvent arrival = new PendingEvent(trainId, target.key, EventKind.ARRIVAL, target.plannedLocation,
                target.location, target.plannedArrivalOrDeparture());
        PendingEvent departure = new PendingEvent(trainId, target.key, EventKind.DEPARTURE, target.plannedLocation,
                target.location, target.plannedDepartureOrArrival());
        List<PendingEvent> events;
        List<PendingEdge> edges;
        if (target.type == TargetType.ENTRY) {
            events = ImmutableList.of(departure);
            edges = ImmutableList.of();
        } else if (target.type == TargetType.EXIT) {
            events = ImmutableList.of(arrival);
            edges = ImmutableList.of();
        } else {
            PendingEdge hold = target.flags.earlyDeparture
                    ? new PendingEdge(EventEdgeType.HOLD, trainId, target.minimumDwell, target.minimumDwell)
                    : new PendingEdge(EventEdgeType.HOLD, trainId, target.minimumDwell);
            events = ImmutableList.of(arrival, departure);
            edges = ImmutableList.of(hold);
        }
        return new PendingChain(trainId, trainStart, target.minimumDwell, events, edges, ImmutableList.of());
    }

    public PendingChain chain () {
        return chain;
    }

    /** Replace the pending chain by a spliced version of it. Not allowed after commit. */
    public void update (UnaryOperator<PendingChain> splice) {
        Preconditions.checkState(committed == null, "Target %s was already committed", target);
        chain = splice.apply(chain);
    }

    public boolean isCommitted () {
        return committed != null;
    }

    /**
     * Add the pending events and edges to the graph. Events made earlier for the same train, target and kind are
     * reused and get their location and planned time refreshed. Events of this target that are no longer part of the
     * chain are withdrawn unless they were already measured. Arrival and departure of the target are seeded from the
     * train's reported position.
     *
     * @return vertex indexes of the chain's events in order.
     */
    public TIntList addToGraph (EventGraph graph) {
        if (committed != null) return committed;
        chain = chain.withCouplingsSpliced();
        TIntList indexes = new TIntArrayList(chain.events.size());
        boolean startPending = chain.trainStart;
        for (PendingEvent pending : chain.events) {
            int index = graph.findByIdentity(pending.trainId(), pending.target(), pending.kind());
            if (index == DirectedGraph.NONE) {
                boolean start = startPending && pending.trainId() == chain.trainId;
                index = graph.addEvent(pending.toEventNode(), start);
            } else {
                EventNode node = graph.getVertex(index);
                node.location = pending.location();
                node.plannedTime = pending.plannedTime();
            }
            if (pending.trainId() == chain.trainId) startPending = false;
            if (pending.target().equals(target.key)) seedFromPosition(graph.getVertex(index));
            indexes.add(index);
        }
        for (int i = 0; i < chain.edges.size(); i++) {
            committedEdges.add(graph.addEventEdge(chain.edges.get(i).toEventEdge(indexes.get(i), indexes.get(i + 1))));
        }
        withdrawSuperseded(graph, indexes);
        committed = indexes;
        LOG.debug("Committed {} as {}", target, chain);
        return committed;
    }

    /**
     * Arrivals and departures the reported position says have already happened are measured at the planned time
     * plus the reported delay. Events still to come start out predicted with the reported delay.
     */
    private void seedFromPosition (EventNode node) {
        if (node.hasMeasuredTime() || node.plannedTime == NO_TIME) return;
        int delay;
        boolean happened;
        switch (node.kind) {
            case ARRIVAL:
                delay = target.reportedArrivalDelay;
                happened = target.status != TargetStatus.AHEAD;
                break;
            case DEPARTURE:
                delay = target.reportedDepartureDelay;
                happened = target.status == TargetStatus.PASSED;
                break;
            default:
                return;
        }
        int time = delay == NO_TIME ? node.plannedTime : node.plannedTime + delay;
        if (happened) {
            node.setMeasuredTime(time);
        } else if (delay != NO_TIME) {
            node.setPredictedTime(time);
        }
    }

    private void withdrawSuperseded (EventGraph graph, TIntList indexes) {
        TIntSet current = new TIntHashSet(indexes);
        for (int index : new ArrayList<>(graph.eventsForTarget(target.key))) {
            if (current.contains(index)) continue;
            EventNode node = graph.getVertex(index);
            if (node.hasMeasuredTime()) {
                LOG.debug("Keeping measured event {} although {} no longer produces it", node, target);
                continue;
            }
            graph.withdrawEvent(index);
        }
    }

    /** Edge indexes of the committed chain. */
    public TIntList committedEdges () {
        return committedEdges;
    }

    /** Vertex index of the first committed event, or NONE if the chain is empty. */
    public int firstEvent () {
        Preconditions.checkState(committed != null, "Target %s is not committed yet", target);
        return committed.isEmpty() ? DirectedGraph.NONE : committed.get(0);
    }

    public int lastEvent () {
        Preconditions.checkState(committed != null, "Target %s is not committed yet", target);
        return committed.isEmpty() ? DirectedGraph.NONE : committed.get(committed.size() - 1);
    }

}
