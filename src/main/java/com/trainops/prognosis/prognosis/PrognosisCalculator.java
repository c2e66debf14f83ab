package com.trainops.prognosis.prognosis;

import com.trainops.prognosis.error.Problem;
import com.trainops.prognosis.error.ProblemLog;
import com.trainops.prognosis.error.ProblemType;
import com.trainops.prognosis.event.EventEdge;
import com.trainops.prognosis.event.EventGraph;
import com.trainops.prognosis.event.EventKind;
import com.trainops.prognosis.event.EventNode;
import com.trainops.prognosis.graph.GraphAlgorithms;
import gnu.trove.list.TIntList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.trainops.prognosis.util.TimeUtils.NO_TIME;

/**
 * Assigns a predicted time to every event that has not been measured yet.
 *
 * Events are visited in topological order, so all predecessors of an event have their final time when it is
 * reached. Each incoming edge bounds the event from below (predecessor time + minimum duration, raised by a positive
 * dispatcher correction) and, if the edge declares a maximum, from above (predecessor time + maximum duration,
 * lowered by a negative correction). The predicted time starts out as
 * <ul>
 *     <li>the event's own current time for the first event of a train,</li>
 *     <li>the planned time for departures, which do not leave early unless allowed to,</li>
 *     <li>as early as possible for everything else,</li>
 * </ul>
 * and is then clamped to the upper bound and after that to the lower bound, so the lower bound wins a conflict.
 *
 * The usual dispatching situations all come down to how the edges are populated:
 * ordinary stop (minimum = dwell), stop with early departure (maximum declared), pass-through (minimum 0),
 * waiting for another event (minimum raised by the correction), and leaving earlier (maximum lowered).
 */
public class PrognosisCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(PrognosisCalculator.class);

    private final CycleBreaker cycleBreaker = new CycleBreaker();

    public void prognose (EventGraph graph, ProblemLog problems) {
        cycleBreaker.breakCycles(graph, problems);
        TIntList order = GraphAlgorithms.topologicalOrder(graph);
        if (order == null) {
            // Not reachable after breaking cycles, but never run on a graph we cannot order.
            LOG.error("Event graph is still cyclic, skipping prognosis.");
            problems.add(Problem.forGraph(ProblemType.CYCLE_DETECTED));
            return;
        }
        int predicted = 0;
        int unavailable = 0;
        for (int i = 0; i < order.size(); i++) {
            int v = order.get(i);
            EventNode node = graph.getVertex(v);
            if (node.hasMeasuredTime()) continue;
            long lower = Long.MIN_VALUE;
            long upper = Long.MAX_VALUE;
            TIntList in = graph.incomingEdges(v);
            for (int j = 0; j < in.size(); j++) {
                EventEdge edge = graph.getEdge(in.get(j));
                int time = graph.getVertex(edge.fromVertex).effectiveTime();
                if (time == NO_TIME) continue;
                lower = Math.max(lower, (long) time + edge.minDuration + Math.max(0, edge.correction));
                if (edge.hasMaxDuration()) {
                    upper = Math.min(upper, (long) time + edge.maxDuration + Math.min(0, edge.correction));
                }
            }
            long candidate = Long.MIN_VALUE;
            if (node.getSequence() == 0) {
                if (node.effectiveTime() != NO_TIME) candidate = node.effectiveTime();
            } else if (node.kind == EventKind.DEPARTURE && node.plannedTime != NO_TIME) {
                candidate = node.plannedTime;
            }
            candidate = Math.min(candidate, upper);
            candidate = Math.max(candidate, lower);
            if (candidate != Long.MIN_VALUE && candidate != Long.MAX_VALUE) {
                node.setPredictedTime((int) candidate);
                predicted += 1;
            } else {
                LOG.warn("No prognosis possible for {}", node);
                problems.add(Problem.forTrain(ProblemType.PROGNOSIS_UNAVAILABLE, node.trainId)
                        .setSubject(node.toString()));
                unavailable += 1;
            }
        }
        LOG.debug("Prognosis: {} events predicted, {} without prognosis.", predicted, unavailable);
    }

}
