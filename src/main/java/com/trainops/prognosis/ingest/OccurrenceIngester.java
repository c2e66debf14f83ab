package com.trainops.prognosis.ingest;

import com.trainops.prognosis.config.PrognosisConfig;
import com.trainops.prognosis.error.Problem;
import com.trainops.prognosis.error.ProblemLog;
import com.trainops.prognosis.error.ProblemType;
import com.trainops.prognosis.event.EventGraph;
import com.trainops.prognosis.event.EventKind;
import com.trainops.prognosis.event.EventNode;
import com.trainops.prognosis.util.TimeUtils;
import gnu.trove.list.TIntList;
import gnu.trove.map.TIntIntMap;
import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntIntHashMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.IntPredicate;

import static com.trainops.prognosis.graph.DirectedGraph.NONE;

/**
 * Maps live occurrences onto events of the event graph and records when they happened.
 *
 * For each train the ingester keeps a cursor on the next event the train is expected to reach. Searches for the
 * event an occurrence refers to start at the cursor (or at the train's first event), so that a train calling at the
 * same track twice is matched to the right visit. Searches continue across a replacement or coupling into the
 * events of the continuing train.
 *
 * Occurrences that cannot be matched are logged, recorded as NOT_FOUND and dropped.
 */
public class OccurrenceIngester {

    private static final Logger LOG = LoggerFactory.getLogger(OccurrenceIngester.class);

    private final EventGraph graph;

    private final PrognosisConfig config;

    /** Next expected event per train. Trains without an entry have no cursor. */
    private final TIntIntMap cursors = new TIntIntHashMap(64, 0.5f, 0, NONE);

    private final TIntObjectMap<LiveOccurrence> lastOccurrence = new TIntObjectHashMap<>();

    public OccurrenceIngester (EventGraph graph, PrognosisConfig config) {
        this.graph = graph;
        this.config = config;
    }

    /** @return the event index the train is expected to reach next, or NONE. */
    public int cursor (int trainId) {
        return cursors.get(trainId);
    }

    public void clear () {
        cursors.clear();
        lastOccurrence.clear();
    }

    /**
     * Apply one occurrence.
     * @return true if the occurrence matched an event of the graph.
     */
    public boolean ingest (LiveOccurrence occurrence, ProblemLog problems) {
        final int trainId = occurrence.trainId;
        if (trainId <= 0) {
            LOG.debug("Ignoring shunting movement {}", occurrence);
            return false;
        }
        if (config.ignoreRepeatedOccurrences && occurrence.repeats(lastOccurrence.get(trainId))) {
            LOG.debug("Ignoring repeated occurrence {}", occurrence);
            return false;
        }
        if (graph.trainStart(trainId) == NONE) {
            return notFound(occurrence, "unknown train", problems);
        }
        boolean matched = apply(occurrence, problems);
        // Only matched occurrences count as seen, so that a resend after the timetable arrived is not dropped.
        if (matched) lastOccurrence.put(trainId, occurrence);
        return matched;
    }

    private boolean apply (LiveOccurrence occurrence, ProblemLog problems) {
        int time = TimeUtils.fromLocalTime(occurrence.wallTime);
        switch (occurrence.kind) {
            case ENTRY:
                return entry(occurrence, time);
            case ARRIVAL:
                return occurrence.atPlatform ? arrival(occurrence, time, problems) : passThrough(occurrence, time, problems);
            case DEPARTURE:
                return occurrence.atPlatform ? departure(occurrence, time, problems) : departed(occurrence, time, problems);
            case RED_SIGNAL_STOP:
            case CLEARED:
                return waypoint(occurrence, problems);
            case REPLACEMENT:
                return replacement(occurrence, time, problems);
            case COUPLING:
                return coupling(occurrence, time, problems);
            case SPLITTING:
                return splitting(occurrence, time, problems);
            case EXIT:
                return exit(occurrence, time, problems);
            default:
                throw new IllegalStateException("Unhandled occurrence kind " + occurrence.kind);
        }
    }

    private boolean entry (LiveOccurrence occurrence, int time) {
        int start = graph.trainStart(occurrence.trainId);
        measure(start, time);
        int next = graph.nextEvent(start);
        setCursor(occurrence.trainId, next == NONE ? NONE : graph.findOnPath(next, false, isKind(EventKind.ARRIVAL)));
        return true;
    }

    /** Arrival at a platform: the arrival event at the announced track. */
    private boolean arrival (LiveOccurrence occurrence, int time, ProblemLog problems) {
        int found = search(occurrence, isKind(EventKind.ARRIVAL).and(isAt(occurrence)));
        if (found == NONE) return notFound(occurrence, "arrival", problems);
        measure(found, time);
        advancePast(occurrence.trainId, found);
        return true;
    }

    /** Arrival without stopping: the departure half of the pass-through becomes the expected event. */
    private boolean passThrough (LiveOccurrence occurrence, int time, ProblemLog problems) {
        IntPredicate departureAfterArrival = e -> {
            int previous = graph.previousEvent(e);
            return previous != NONE && graph.getVertex(previous).kind == EventKind.ARRIVAL;
        };
        int found = search(occurrence, isKind(EventKind.DEPARTURE).and(isAt(occurrence)).and(departureAfterArrival));
        if (found == NONE) return notFound(occurrence, "pass-through", problems);
        setCursor(occurrence.trainId, found);
        measure(graph.previousEvent(found), time);
        return true;
    }

    /** Departure reported while still at the platform. */
    private boolean departure (LiveOccurrence occurrence, int time, ProblemLog problems) {
        int found = search(occurrence, isKind(EventKind.DEPARTURE).and(isAt(occurrence)));
        if (found == NONE) return notFound(occurrence, "departure", problems);
        measure(found, time);
        advancePast(occurrence.trainId, found);
        return true;
    }

    /**
     * Departure reported after leaving. The announced track is then the next target: the next event there becomes
     * the expected event, and the event before it is the departure that just happened.
     */
    private boolean departed (LiveOccurrence occurrence, int time, ProblemLog problems) {
        int found = search(occurrence, isAt(occurrence));
        if (found == NONE) return notFound(occurrence, "departure", problems);
        if (graph.getVertex(found).kind == EventKind.DEPARTURE) {
            // Announced track is the one just left.
            measure(found, time);
            advancePast(occurrence.trainId, found);
            return true;
        }
        setCursor(occurrence.trainId, found);
        int previous = graph.previousEvent(found);
        if (previous == NONE) return notFound(occurrence, "departure before " + graph.nodeInfo(found), problems);
        measure(previous, time);
        return true;
    }

    /** Red signal or cleared signal: only moves the cursor. */
    private boolean waypoint (LiveOccurrence occurrence, ProblemLog problems) {
        int found = search(occurrence, isAt(occurrence));
        if (found == NONE) return notFound(occurrence, "signal", problems);
        setCursor(occurrence.trainId, found);
        return true;
    }

    private boolean replacement (LiveOccurrence occurrence, int time, ProblemLog problems) {
        int found = search(occurrence, isKind(EventKind.REPLACEMENT).and(isAt(occurrence)));
        if (found == NONE) return notFound(occurrence, "replacement", problems);
        measure(found, time);
        setCursor(occurrence.trainId, NONE);
        pointFollowersAt(found);
        return true;
    }

    private boolean coupling (LiveOccurrence occurrence, int time, ProblemLog problems) {
        int found = search(occurrence, isKind(EventKind.COUPLING).and(isAt(occurrence)));
        if (found == NONE) return notFound(occurrence, "coupling", problems);
        measure(found, time);
        EventNode node = graph.getVertex(found);
        if (node.trainId != occurrence.trainId) setCursor(occurrence.trainId, NONE);
        int owner = node.trainId;
        int ownerCursor = cursors.get(owner);
        if (ownerCursor == NONE || ownerCursor == found || occurrence.trainId == owner) {
            setCursor(owner, graph.nextEvent(found));
        }
        return true;
    }

    private boolean splitting (LiveOccurrence occurrence, int time, ProblemLog problems) {
        int from = cursorOrStart(occurrence.trainId);
        int found = graph.findOnPath(from, false, isKind(EventKind.SPLITTING).and(isAt(occurrence)));
        if (found == NONE) return notFound(occurrence, "splitting", problems);
        measure(found, time);
        setCursor(occurrence.trainId, graph.nextEvent(found));
        pointFollowersAt(found);
        return true;
    }

    private boolean exit (LiveOccurrence occurrence, int time, ProblemLog problems) {
        TIntList path = graph.trainPath(occurrence.trainId);
        if (path.isEmpty()) return notFound(occurrence, "exit", problems);
        measure(path.get(path.size() - 1), time);
        setCursor(occurrence.trainId, NONE);
        return true;
    }

    /** Trains continuing after an operation expect their event following it, unless they already expect another. */
    private void pointFollowersAt (int operation) {
        int owner = graph.getVertex(operation).trainId;
        TIntList successors = graph.successors(operation);
        for (int i = 0; i < successors.size(); i++) {
            int next = successors.get(i);
            int trainId = graph.getVertex(next).trainId;
            if (trainId != owner && cursors.get(trainId) == NONE) setCursor(trainId, next);
        }
    }

    /** Move the cursor behind an event. A replacement must be confirmed by its own occurrence, so it is not expected. */
    private void advancePast (int trainId, int event) {
        int next = graph.nextEvent(event);
        if (next != NONE && graph.getVertex(next).kind == EventKind.REPLACEMENT) next = NONE;
        setCursor(trainId, next);
    }

    private int search (LiveOccurrence occurrence, IntPredicate test) {
        return graph.findOnPath(cursorOrStart(occurrence.trainId), true, test);
    }

    private int cursorOrStart (int trainId) {
        int cursor = cursors.get(trainId);
        return graph.containsVertex(cursor) ? cursor : graph.trainStart(trainId);
    }

    private void setCursor (int trainId, int event) {
        if (event == NONE) {
            cursors.remove(trainId);
        } else {
            cursors.put(trainId, event);
        }
    }

    private void measure (int event, int time) {
        EventNode node = graph.getVertex(event);
        if (node == null) return;
        if (node.setMeasuredTime(time)) {
            LOG.debug("Measured {}", node);
        } else {
            LOG.debug("{} was measured before, keeping {}", node, TimeUtils.timeToString(node.getMeasuredTime()));
        }
    }

    private IntPredicate isKind (EventKind kind) {
        return e -> graph.getVertex(e).kind == kind;
    }

    /** Matches the planned or current track of an event. Occurrences without a planned track match everywhere. */
    private IntPredicate isAt (LiveOccurrence occurrence) {
        String track = occurrence.plannedLocation;
        if (track == null) return e -> true;
        return e -> {
            EventNode node = graph.getVertex(e);
            return track.equalsIgnoreCase(node.plannedLocation) || track.equalsIgnoreCase(node.location);
        };
    }

    private boolean notFound (LiveOccurrence occurrence, String what, ProblemLog problems) {
        LOG.warn("No event found for {} ({})", occurrence, what);
        problems.add(Problem.forTrain(ProblemType.NOT_FOUND, occurrence.trainId)
                .setSubject(occurrence.toString())
                .addInfo("searched", what));
        return false;
    }

}
