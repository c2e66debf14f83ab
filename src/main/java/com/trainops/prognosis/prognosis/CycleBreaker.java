package com.trainops.prognosis.prognosis;

import com.trainops.prognosis.error.Problem;
import com.trainops.prognosis.error.ProblemLog;
import com.trainops.prognosis.error.ProblemType;
import com.trainops.prognosis.event.EventEdge;
import com.trainops.prognosis.event.EventGraph;
import com.trainops.prognosis.graph.GraphAlgorithms;
import gnu.trove.list.TIntList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.StringJoiner;

/**
 * Removes edges until the event graph is acyclic. Cycles only appear with inconsistent input, e.g. two trains
 * flagged as each other's replacement, or a dispatcher dependency against the direction of travel.
 *
 * From each cycle found, the first edge that connects two different trains is removed, because operational links and
 * dependencies are more likely to be wrong than a train's own sequence of events. If all edges of the cycle belong to
 * one train, the last edge of the cycle goes. This is a heuristic: the remaining graph is acyclic but need not be
 * what the timetable intended.
 */
public class CycleBreaker {

    private static final Logger LOG = LoggerFactory.getLogger(CycleBreaker.class);

    /** @return the number of edges removed. */
    public int breakCycles (EventGraph graph, ProblemLog problems) {
        int removed = 0;
        for (TIntList cycle = GraphAlgorithms.findCycle(graph); !cycle.isEmpty(); cycle = GraphAlgorithms.findCycle(graph)) {
            int victim = chooseEdge(graph, cycle);
            EventEdge edge = graph.getEdge(victim);
            String info = graph.edgeInfo(victim);
            LOG.error("Event graph contains a cycle {}, removing edge {}", describe(graph, cycle), info);
            problems.add(Problem.forTrain(ProblemType.CYCLE_DETECTED, edge.trainId)
                    .setSubject(info)
                    .addInfo("cycleLength", cycle.size()));
            graph.removeEdge(victim);
            removed += 1;
        }
        return removed;
    }

    private static int chooseEdge (EventGraph graph, TIntList cycle) {
        for (int i = 0; i < cycle.size(); i++) {
            EventEdge edge = graph.getEdge(cycle.get(i));
            if (graph.getVertex(edge.fromVertex).trainId != graph.getVertex(edge.toVertex).trainId) {
                return cycle.get(i);
            }
        }
        return cycle.get(cycle.size() - 1);
    }

    private static String describe (EventGraph graph, TIntList cycle) {
        StringJoiner joiner = new StringJoiner(" -> ", "[", "]");
        for (int i = 0; i < cycle.size(); i++) {
            joiner.add(graph.nodeInfo(graph.getEdge(cycle.get(i)).fromVertex));
        }
        return joiner.toString();
    }

}
