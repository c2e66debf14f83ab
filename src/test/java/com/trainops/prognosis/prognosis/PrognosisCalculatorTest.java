package com.trainops.prognosis.prognosis;

import com.trainops.prognosis.config.PrognosisConfig;
import com.trainops.prognosis.error.ProblemLog;
import com.trainops.prognosis.error.ProblemType;
import com.trainops.prognosis.event.EventEdge;
import com.trainops.prognosis.event.EventGraph;
import com.trainops.prognosis.event.EventKind;
import com.trainops.prognosis.event.EventNode;
import com.trainops.prognosis.event.build.EventGraphTranslator;
import com.trainops.prognosis.graph.GraphAlgorithms;
import com.trainops.prognosis.target.ScheduleFlags;
import com.trainops.prognosis.target.TargetEdgeType;
import com.trainops.prognosis.target.TargetGraph;
import com.trainops.prognosis.target.TargetType;
import com.trainops.prognosis.target.TrainSchedule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static com.trainops.prognosis.ScheduleFixtures.addTarget;
import static com.trainops.prognosis.ScheduleFixtures.at;
import static com.trainops.prognosis.ScheduleFixtures.eventOf;
import static com.trainops.prognosis.ScheduleFixtures.stop;
import static com.trainops.prognosis.ScheduleFixtures.train;
import static com.trainops.prognosis.util.TimeUtils.NO_TIME;
import static com.trainops.prognosis.util.TimeUtils.hm;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PrognosisCalculatorTest {

    private TargetGraph targets;

    private EventGraph events;

    private ProblemLog problems;

    private final PrognosisCalculator calculator = new PrognosisCalculator();

    @BeforeEach
    public void setUp () {
        targets = new TargetGraph(new PrognosisConfig());
        events = new EventGraph();
        problems = new ProblemLog();
    }

    private void translate () {
        new EventGraphTranslator(new PrognosisConfig()).translate(targets, events, problems);
    }

    private EventNode node (int target, EventKind kind) {
        return events.getVertex(eventOf(events, targets, target, kind));
    }

    @Test
    public void delayPropagatesThroughDwellAndTravel () {
        int entry = addTarget(targets, 1, TargetType.ENTRY, "E1", hm(9, 5), hm(9, 5), 0);
        int halt = addTarget(targets, 1, TargetType.HALT, "1", hm(9, 10), hm(9, 11), 60);
        int exit = addTarget(targets, 1, TargetType.EXIT, "A1", hm(9, 17), NO_TIME, 0);
        targets.addLink(entry, halt, TargetEdgeType.PLANNED);
        targets.addLink(halt, exit, TargetEdgeType.PLANNED);
        translate();
        assertEquals(4, events.vertexCount());

        node(halt, EventKind.ARRIVAL).setMeasuredTime(hm(9, 13));
        calculator.prognose(events, problems);

        assertEquals(hm(9, 5), node(entry, EventKind.DEPARTURE).effectiveTime());
        assertEquals(hm(9, 13), node(halt, EventKind.ARRIVAL).effectiveTime());
        assertEquals(hm(9, 14), node(halt, EventKind.DEPARTURE).getPredictedTime());
        assertEquals(hm(9, 20), node(exit, EventKind.ARRIVAL).getPredictedTime());
        assertTrue(problems.isEmpty());
    }

    @Test
    public void punctualTrainKeepsPlannedDeparture () {
        int halt = addTarget(targets, 1, TargetType.HALT, "1", hm(9, 10), hm(9, 15), 60);
        int next = addTarget(targets, 1, TargetType.HALT, "2", hm(9, 20), hm(9, 21), 60);
        targets.addLink(halt, next, TargetEdgeType.PLANNED);
        translate();
        node(halt, EventKind.ARRIVAL).setMeasuredTime(hm(9, 8));
        calculator.prognose(events, problems);

        // Departures do not leave before their planned time without an explicit permission.
        assertEquals(hm(9, 15), node(halt, EventKind.DEPARTURE).getPredictedTime());
        assertEquals(hm(9, 20), node(next, EventKind.ARRIVAL).getPredictedTime());
        assertEquals(hm(9, 21), node(next, EventKind.DEPARTURE).getPredictedTime());
    }

    @Test
    public void measuredEventsAreNeverOverwritten () {
        int halt = addTarget(targets, 1, TargetType.HALT, "1", hm(9, 10), hm(9, 11), 60);
        int exit = addTarget(targets, 1, TargetType.EXIT, "A1", hm(9, 17), NO_TIME, 0);
        targets.addLink(halt, exit, TargetEdgeType.PLANNED);
        translate();
        node(halt, EventKind.ARRIVAL).setMeasuredTime(hm(9, 30));
        node(exit, EventKind.ARRIVAL).setMeasuredTime(hm(9, 18));
        calculator.prognose(events, problems);

        EventNode last = node(exit, EventKind.ARRIVAL);
        assertEquals(hm(9, 18), last.effectiveTime());
        assertFalse(last.hasPredictedTime());
    }

    @Test
    public void lowerBoundsHoldOnEveryEdge () {
        TrainSchedule schedule = train(1,
                stop("1", at(8, 0), at(8, 2)),
                stop("2", at(8, 10), at(8, 10), "D"),
                stop("3", at(8, 20), at(8, 25), "R"),
                stop("4", at(8, 40), at(8, 41)));
        Map<Integer, TrainSchedule> directory = new HashMap<>();
        targets.importTrain(schedule, directory, problems);
        translate();
        events.getVertex(events.trainStart(1)).setMeasuredTime(hm(8, 7));
        calculator.prognose(events, problems);

        events.forEachEdge(e -> {
            EventEdge edge = events.getEdge(e);
            int from = events.getVertex(edge.fromVertex).effectiveTime();
            int to = events.getVertex(edge.toVertex).effectiveTime();
            assertTrue(to >= from + edge.minDuration, events.edgeInfo(e));
        });
    }

    @Test
    public void couplingWaitsForTheLaterTrain () {
        int x = addTarget(targets, 4, TargetType.HALT, "X", hm(11, 0), hm(11, 1), 0);
        int ending = addTarget(targets, 4, TargetType.HALT, "3", hm(11, 10), hm(11, 12), 0);
        int continuing = addTarget(targets, 5, TargetType.HALT, "3", hm(11, 14), hm(11, 16), 120);
        int y = addTarget(targets, 5, TargetType.HALT, "Y", hm(11, 30), hm(11, 31), 0);
        targets.addLink(x, ending, TargetEdgeType.PLANNED);
        targets.addLink(continuing, y, TargetEdgeType.PLANNED);
        targets.addLink(ending, continuing, TargetEdgeType.COUPLING);
        translate();

        node(ending, EventKind.ARRIVAL).setMeasuredTime(hm(11, 20));
        calculator.prognose(events, problems);

        EventNode coupling = events.getVertex(
                events.findByIdentity(5, targets.getVertex(ending).key, EventKind.COUPLING));
        assertEquals(hm(11, 20), coupling.getPredictedTime());
        assertEquals(hm(11, 20), node(continuing, EventKind.DEPARTURE).getPredictedTime());
        assertEquals(hm(11, 34), node(y, EventKind.ARRIVAL).getPredictedTime());
    }

    @Test
    public void earlyDepartureFlagAllowsLeavingBeforePlan () {
        int halt = addTarget(targets, 1, TargetType.HALT, "1", hm(9, 10), hm(9, 11), 60);
        targets.getVertex(halt).flags = new ScheduleFlags("A");
        translate();
        node(halt, EventKind.ARRIVAL).setMeasuredTime(hm(9, 8));
        calculator.prognose(events, problems);
        assertEquals(hm(9, 9), node(halt, EventKind.DEPARTURE).getPredictedTime());
    }

    @Test
    public void dispatcherOrdersShiftTheBounds () {
        int halt = addTarget(targets, 1, TargetType.HALT, "1", hm(9, 10), hm(9, 15), 60);
        int other = addTarget(targets, 2, TargetType.HALT, "2", hm(10, 0), hm(10, 2), 0);
        translate();
        int departure = eventOf(events, targets, halt, EventKind.DEPARTURE);
        node(halt, EventKind.ARRIVAL).setMeasuredTime(hm(9, 10));

        assertTrue(DispatcherOrders.departEarly(events, departure, 120));
        calculator.prognose(events, problems);
        assertEquals(hm(9, 13), node(halt, EventKind.DEPARTURE).getPredictedTime());

        int connection = DispatcherOrders.waitFor(events, eventOf(events, targets, other, EventKind.ARRIVAL),
                eventOf(events, targets, other, EventKind.DEPARTURE), 300);
        node(other, EventKind.ARRIVAL).setMeasuredTime(hm(10, 5));
        calculator.prognose(events, problems);
        assertEquals(hm(10, 10), node(other, EventKind.DEPARTURE).getPredictedTime());

        DispatcherOrders.setCorrection(events, connection, 0);
        calculator.prognose(events, problems);
        assertEquals(hm(10, 5), node(other, EventKind.DEPARTURE).getPredictedTime());
        assertFalse(DispatcherOrders.departEarly(events, eventOf(events, targets, other, EventKind.ARRIVAL), 60));
    }

    @Test
    public void inconsistentLinksAreBrokenUp () {
        TrainSchedule first = train(1, stop("X", at(8, 0), at(8, 2)), stop("Y", at(8, 10), at(8, 12), "E(2)"));
        TrainSchedule second = train(2, stop("Z", at(8, 20), at(8, 22)), stop("W", at(8, 30), at(8, 32), "E(1)"));
        Map<Integer, TrainSchedule> directory = new HashMap<>();
        directory.put(1, first);
        directory.put(2, second);
        targets.importTrain(first, directory, problems);
        translate();
        assertFalse(GraphAlgorithms.isAcyclic(events));

        calculator.prognose(events, problems);
        assertTrue(GraphAlgorithms.isAcyclic(events));
        assertTrue(problems.contains(ProblemType.CYCLE_DETECTED));
    }

}
