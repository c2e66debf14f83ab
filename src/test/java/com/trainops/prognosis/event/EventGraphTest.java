package com.trainops.prognosis.event;

import com.trainops.prognosis.target.TargetKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.trainops.prognosis.util.TimeUtils.hm;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class EventGraphTest {

    private EventGraph graph;

    @BeforeEach
    public void setUp () {
        graph = new EventGraph();
    }

    private int event (String track, EventKind kind, int plannedTime, boolean trainStart) {
        EventNode node = new EventNode(1, new TargetKey(1, plannedTime, track), kind, track);
        node.plannedTime = plannedTime;
        return graph.addEvent(node, trainStart);
    }

    @Test
    public void earliestOpenEventBecomesTheStart () {
        int arrival = event("1", EventKind.ARRIVAL, hm(9, 10), true);
        int departure = event("1", EventKind.DEPARTURE, hm(9, 11), false);
        graph.addEventEdge(new EventEdge(arrival, departure, EventEdgeType.HOLD, 1, 60));
        // An earlier event without predecessor shows up while the old start still has none either.
        int entry = event("E1", EventKind.DEPARTURE, hm(9, 5), false);

        graph.markTrainStarts();

        assertEquals(entry, graph.trainStart(1));
        assertEquals(0, graph.getVertex(entry).getSequence());
        assertEquals(arrival, graph.indexOf(1, graph.getVertex(arrival).getSequence()));
    }

    @Test
    public void currentStartWinsTies () {
        int arrival = event("1", EventKind.ARRIVAL, hm(9, 10), true);
        event("2", EventKind.ARRIVAL, hm(9, 10), false);

        graph.markTrainStarts();

        assertEquals(arrival, graph.trainStart(1));
    }

    @Test
    public void startWithPredecessorIsMovedToTheOpenEvent () {
        int arrival = event("1", EventKind.ARRIVAL, hm(9, 10), true);
        int entry = event("E1", EventKind.DEPARTURE, hm(9, 5), false);
        graph.addEventEdge(new EventEdge(entry, arrival, EventEdgeType.PLANNED, 1, 300));

        graph.markTrainStarts();

        assertEquals(entry, graph.trainStart(1));
        assertEquals(arrival, graph.nextEvent(entry));
    }

}
