package com.trainops.prognosis.event.build;

import com.trainops.prognosis.error.ProblemLog;
import com.trainops.prognosis.event.EventEdge;
import com.trainops.prognosis.event.EventEdgeType;
import com.trainops.prognosis.event.EventGraph;
import com.trainops.prognosis.event.EventNode;
import com.trainops.prognosis.graph.DirectedGraph;
import com.trainops.prognosis.target.TargetEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.trainops.prognosis.util.TimeUtils.NO_TIME;

/**
 * Travel from one stop to the next: an edge from the last event of the first target to the first event of the
 * second, with the planned travel time as minimum duration.
 */
public class PlannedTravelBuilder extends EventEdgeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(PlannedTravelBuilder.class);

    private final int defaultTravelSecs;

    public PlannedTravelBuilder (TargetEdge targetEdge, EventNodeBuilder from, EventNodeBuilder to,
                                 int defaultTravelSecs) {
        super(targetEdge, from, to);
        this.defaultTravelSecs = defaultTravelSecs;
    }

    @Override
    protected void link (EventGraph graph, ProblemLog problems) {
        int fromEvent = from.lastEvent();
        int toEvent = to.firstEvent();
        if (fromEvent == DirectedGraph.NONE || toEvent == DirectedGraph.NONE) {
            LOG.debug("No events to connect between {} and {}", from.target, to.target);
            return;
        }
        EventNode a = graph.getVertex(fromEvent);
        EventNode b = graph.getVertex(toEvent);
        int duration;
        if (a.plannedTime == NO_TIME || b.plannedTime == NO_TIME) {
            duration = defaultTravelSecs;
        } else {
            duration = b.plannedTime - a.plannedTime;
            if (duration < 0) {
                LOG.debug("Planned travel from {} to {} runs backward in time, using zero.", a, b);
                duration = 0;
            }
        }
        EventEdge travel = new EventEdge(fromEvent, toEvent, EventEdgeType.PLANNED, a.trainId, duration);
        linkedEdges.add(graph.addEventEdge(travel));
    }

}
