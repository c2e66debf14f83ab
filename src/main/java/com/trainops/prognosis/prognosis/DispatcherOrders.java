package com.trainops.prognosis.prognosis;

import com.google.common.base.Preconditions;
import com.trainops.prognosis.event.EventEdge;
import com.trainops.prognosis.event.EventEdgeType;
import com.trainops.prognosis.event.EventGraph;
import com.trainops.prognosis.event.EventKind;
import com.trainops.prognosis.event.EventNode;
import com.trainops.prognosis.graph.DirectedGraph;
import gnu.trove.list.TIntList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.trainops.prognosis.util.TimeUtils.NO_TIME;

/**
 * Dispatcher orders expressed as edge changes in the event graph. The engine does not decide on these orders; it
 * applies them when a dispatcher (or a tool acting for one) issues them, and the next prognosis takes them into
 * account.
 */
public abstract class DispatcherOrders {

    private static final Logger LOG = LoggerFactory.getLogger(DispatcherOrders.class);

    /**
     * Hold an event until at least {@code waitSecs} after another event, e.g. a departure waiting for a connecting
     * arrival. If the two events are already connected, that edge gets the correction.
     *
     * @return the index of the edge carrying the order.
     */
    public static int waitFor (EventGraph graph, int awaitedEvent, int waitingEvent, int waitSecs) {
        Preconditions.checkArgument(waitSecs >= 0, "Waiting time must not be negative");
        Preconditions.checkArgument(graph.containsVertex(awaitedEvent) && graph.containsVertex(waitingEvent),
                "Both events must exist");
        int existing = graph.findEdge(awaitedEvent, waitingEvent);
        if (existing != DirectedGraph.NONE) {
            graph.replaceEdge(existing, graph.getEdge(existing).withCorrection(waitSecs));
            return existing;
        }
        EventNode awaited = graph.getVertex(awaitedEvent);
        int edge = graph.addEdge(new EventEdge(awaitedEvent, waitingEvent, EventEdgeType.DEPENDENCY, awaited.trainId,
                0, EventEdge.UNBOUNDED, waitSecs));
        LOG.info("Dependency added: {}", graph.edgeInfo(edge));
        return edge;
    }

    /**
     * Let a departure leave up to {@code secs} before its planned time, e.g. to clear a track for another train. The
     * hold edge into the departure is bounded by the planned stay and the bound is lowered by the correction. The
     * minimum dwell still applies.
     *
     * @return false if the event is not a departure reached by a hold edge.
     */
    public static boolean departEarly (EventGraph graph, int departureEvent, int secs) {
        Preconditions.checkArgument(secs >= 0, "Early departure must be given as a positive number of seconds");
        EventNode departure = graph.getVertex(departureEvent);
        if (departure == null || departure.kind != EventKind.DEPARTURE) return false;
        TIntList in = graph.incomingEdges(departureEvent);
        for (int i = 0; i < in.size(); i++) {
            EventEdge edge = graph.getEdge(in.get(i));
            if (edge.type != EventEdgeType.HOLD) continue;
            EventNode arrival = graph.getVertex(edge.fromVertex);
            int stay = edge.minDuration;
            if (arrival.plannedTime != NO_TIME && departure.plannedTime != NO_TIME) {
                stay = Math.max(stay, departure.plannedTime - arrival.plannedTime);
            }
            EventEdge changed = edge.hasMaxDuration() ? edge : edge.withMaxDuration(stay);
            graph.replaceEdge(in.get(i), changed.withCorrection(-secs));
            LOG.info("Early departure ordered: {}", graph.edgeInfo(in.get(i)));
            return true;
        }
        return false;
    }

    /** Set the dispatcher correction of an edge directly, zero to cancel an order. */
    public static void setCorrection (EventGraph graph, int edgeIndex, int correction) {
        EventEdge edge = graph.getEdge(edgeIndex);
        Preconditions.checkArgument(edge != null, "Edge %s does not exist", edgeIndex);
        graph.replaceEdge(edgeIndex, edge.withCorrection(correction));
    }

}
