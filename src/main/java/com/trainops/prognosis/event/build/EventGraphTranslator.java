package com.trainops.prognosis.event.build;

import com.trainops.prognosis.config.PrognosisConfig;
import com.trainops.prognosis.error.ProblemLog;
import com.trainops.prognosis.event.EventEdgeType;
import com.trainops.prognosis.event.EventGraph;
import com.trainops.prognosis.target.TargetEdge;
import com.trainops.prognosis.target.TargetGraph;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers the target graph into the event graph. A target does not map to a fixed number of events: a stop becomes
 * an arrival and a departure, an entry or exit a single event, and replacement, coupling and splitting links drop
 * some of these and add events of their own. The translation therefore runs in phases:
 * <ol>
 *     <li>one node builder per target, holding the default pattern of that target,</li>
 *     <li>one edge builder per target edge, which may rewrite the patterns of the two targets it connects,</li>
 *     <li>commit of all node builders, then of all edge builders.</li>
 * </ol>
 * The translation can be run again after new trains were imported. Events and edges created before are found again
 * and kept, so measured times survive. Edges the targets no longer produce are removed.
 */
public class EventGraphTranslator {

    private static final Logger LOG = LoggerFactory.getLogger(EventGraphTranslator.class);

    private final PrognosisConfig config;

    public EventGraphTranslator (PrognosisConfig config) {
        this.config = config;
    }

    public void translate (TargetGraph targets, EventGraph events, ProblemLog problems) {
        int eventsBefore = events.vertexCount();
        int edgesBefore = events.edgeCount();

        TIntObjectMap<EventNodeBuilder> nodeBuilders = new TIntObjectHashMap<>();
        targets.forEachVertex(t -> nodeBuilders.put(t, new EventNodeBuilder(targets.getVertex(t), targets.isTrainStart(t))));

        List<EventEdgeBuilder> edgeBuilders = new ArrayList<>();
        targets.forEachEdge(e -> {
            EventEdgeBuilder builder = createEdgeBuilder(targets.getEdge(e), nodeBuilders);
            if (builder != null) edgeBuilders.add(builder);
        });

        for (EventEdgeBuilder builder : edgeBuilders) builder.splice(problems);
        targets.forEachVertex(t -> nodeBuilders.get(t).addToGraph(events));
        for (EventEdgeBuilder builder : edgeBuilders) builder.addToGraph(events, problems);
        removeStaleEdges(events, nodeBuilders, edgeBuilders);
        events.markTrainStarts();

        LOG.info("Translated {} targets into {} events ({} new) and {} edges ({} new).", targets.vertexCount(),
                events.vertexCount(), events.vertexCount() - eventsBefore, events.edgeCount(),
                events.edgeCount() - edgesBefore);
    }

    /**
     * Remove edges left from an earlier translation that the current targets no longer produce, e.g. the travel edge
     * to an exit after a stop was inserted before it. Dispatcher dependencies are not derived from targets and stay.
     */
    private static void removeStaleEdges (EventGraph events, TIntObjectMap<EventNodeBuilder> nodeBuilders,
                                          List<EventEdgeBuilder> edgeBuilders) {
        TIntSet current = new TIntHashSet();
        for (EventNodeBuilder builder : nodeBuilders.valueCollection()) current.addAll(builder.committedEdges());
        for (EventEdgeBuilder builder : edgeBuilders) current.addAll(builder.linkedEdges());
        TIntList stale = new TIntArrayList();
        events.forEachEdge(e -> {
            if (!current.contains(e) && events.getEdge(e).type != EventEdgeType.DEPENDENCY) stale.add(e);
        });
        for (int i = 0; i < stale.size(); i++) {
            LOG.debug("Removing edge no longer in the timetable: {}", events.edgeInfo(stale.get(i)));
            events.removeEdge(stale.get(i));
        }
    }

    private EventEdgeBuilder createEdgeBuilder (TargetEdge edge, TIntObjectMap<EventNodeBuilder> nodeBuilders) {
        EventNodeBuilder from = nodeBuilders.get(edge.fromVertex);
        EventNodeBuilder to = nodeBuilders.get(edge.toVertex);
        switch (edge.type) {
            case PLANNED:
                return new PlannedTravelBuilder(edge, from, to, config.defaultTravelSecs);
            case REPLACEMENT:
                return new ReplacementBuilder(edge, from, to);
            case COUPLING:
                return new CouplingBuilder(edge, from, to);
            case SPLITTING:
                return new SplittingBuilder(edge, from, to);
            default:
                LOG.debug("Target edge {} between {} and {} is not translated.", edge, from.target, to.target);
                return null;
        }
    }

}
