package com.trainops.prognosis.event;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.SetMultimap;
import com.trainops.prognosis.graph.DirectedGraph;
import com.trainops.prognosis.target.TargetKey;
import com.trainops.prognosis.util.TimeUtils;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.TIntIntMap;
import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.TLongIntMap;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TIntIntHashMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import gnu.trove.map.hash.TLongIntHashMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.function.IntPredicate;

/**
 * The event graph. Each vertex is an arrival, departure or operation of one train, each edge a minimum (and
 * optionally maximum) duration between two events. The prognosis works on this graph, so it must stay acyclic.
 *
 * Events are addressed in three ways:
 * <ul>
 *     <li>by vertex index, which is stable for the lifetime of the graph,</li>
 *     <li>by (train id, sequence), where sequence 0 is always the first event of the train,</li>
 *     <li>by identity (train id, target, kind), which the translation uses to find events it made before.</li>
 * </ul>
 *
 * Following the same-train successors from sequence 0 visits all events of a train in order. Replacement, coupling
 * and splitting events belong to exactly one train but link two chains; the "continuation" walks cross over them.
 */
public class EventGraph extends DirectedGraph<EventNode, EventEdge> {

    private static final Logger LOG = LoggerFactory.getLogger(EventGraph.class);

    private record Identity (int trainId, TargetKey target, EventKind kind) { }

    private final TLongIntMap indexForKey = new TLongIntHashMap(100, 0.5f, Long.MIN_VALUE, NONE);

    private final TObjectIntMap<Identity> indexForIdentity = new TObjectIntHashMap<>(100, 0.5f, NONE);

    private final SetMultimap<TargetKey, Integer> eventsForTarget = HashMultimap.create();

    private final TIntObjectMap<TIntSet> eventsForTrain = new TIntObjectHashMap<>();

    /** Next sequence number to hand out per train. Sequence 0 is reserved for the train start. */
    private final TIntIntMap nextSequence = new TIntIntHashMap();

    private static long key (int trainId, int sequence) {
        return ((long) trainId << 32) | (sequence & 0xFFFFFFFFL);
    }

    /**
     * Add an event and assign its sequence number.
     * @param trainStart if true and the train has no sequence 0 yet, the event becomes the train's start.
     * @return the vertex index.
     */
    public int addEvent (EventNode node, boolean trainStart) {
        int index = addVertex(node);
        int trainId = node.trainId;
        if (trainStart && indexOf(trainId, 0) == NONE) {
            node.sequence = 0;
        } else {
            int seq = Math.max(1, nextSequence.get(trainId));
            node.sequence = seq;
            nextSequence.put(trainId, seq + 1);
        }
        indexForKey.put(key(trainId, node.sequence), index);
        if (node.target != null) {
            indexForIdentity.put(new Identity(trainId, node.target, node.kind), index);
            eventsForTarget.put(node.target, index);
        }
        TIntSet events = eventsForTrain.get(trainId);
        if (events == null) {
            events = new TIntHashSet();
            eventsForTrain.put(trainId, events);
        }
        events.add(index);
        return index;
    }

    /**
     * Add an edge unless the two events are already connected. An existing edge takes over the type and minimum
     * duration of the new one but keeps its dispatcher correction and, where it has one, its maximum.
     * @return the index of the new or existing edge.
     */
    public int addEventEdge (EventEdge edge) {
        int existing = findEdge(edge.fromVertex, edge.toVertex);
        if (existing == NONE) return addEdge(edge);
        EventEdge old = getEdge(existing);
        if (old.type != edge.type || old.minDuration != edge.minDuration) {
            int max = old.hasMaxDuration() ? Math.max(old.maxDuration, edge.minDuration) : edge.maxDuration;
            replaceEdge(existing, new EventEdge(edge.fromVertex, edge.toVertex, edge.type, edge.trainId,
                    edge.minDuration, max, old.correction));
        }
        return existing;
    }

    /** Remove an event and its edges. Its sequence number is not reused. */
    public void withdrawEvent (int index) {
        EventNode node = getVertex(index);
        if (node == null) return;
        indexForKey.remove(key(node.trainId, node.sequence));
        if (node.target != null) {
            indexForIdentity.remove(new Identity(node.trainId, node.target, node.kind));
            eventsForTarget.remove(node.target, index);
        }
        TIntSet events = eventsForTrain.get(node.trainId);
        if (events != null) events.remove(index);
        removeVertex(index);
        LOG.debug("Withdrew event {}", node);
    }

    public int indexOf (int trainId, int sequence) {
        return indexForKey.get(key(trainId, sequence));
    }

    public EventNode get (int trainId, int sequence) {
        return getVertex(indexOf(trainId, sequence));
    }

    /** @return the vertex index of the first event of the train, or NONE. */
    public int trainStart (int trainId) {
        return indexOf(trainId, 0);
    }

    public int findByIdentity (int trainId, TargetKey target, EventKind kind) {
        return indexForIdentity.get(new Identity(trainId, target, kind));
    }

    /** Vertex indexes of the events derived from the given target, across all trains. */
    public Set<Integer> eventsForTarget (TargetKey target) {
        return eventsForTarget.get(target);
    }

    public TIntSet trains () {
        TIntSet trains = new TIntHashSet();
        eventsForTrain.forEachEntry((train, events) -> {
            if (!events.isEmpty()) trains.add(train);
            return true;
        });
        return trains;
    }

    /** @return the successor of an event that belongs to the same train, or NONE. */
    public int nextEvent (int index) {
        TIntList out = outgoingEdges(index);
        int trainId = getVertex(index).trainId;
        for (int i = 0; i < out.size(); i++) {
            int to = getEdge(out.get(i)).toVertex;
            if (getVertex(to).trainId == trainId) return to;
        }
        return NONE;
    }

    /**
     * Successor of an event, optionally continuing across a replacement (into the departure of the new train) or a
     * coupling (into the coupling event owned by the continuing train).
     */
    public int nextEvent (int index, boolean followContinuation) {
        int next = nextEvent(index);
        if (next != NONE || !followContinuation) return next;
        EventNode node = getVertex(index);
        TIntList out = outgoingEdges(index);
        for (int i = 0; i < out.size(); i++) {
            EventEdge edge = getEdge(out.get(i));
            EventNode to = getVertex(edge.toVertex);
            if (node.kind == EventKind.REPLACEMENT && edge.type == EventEdgeType.HOLD) return edge.toVertex;
            if (to.kind == EventKind.COUPLING && edge.type == EventEdgeType.COUPLING) return edge.toVertex;
        }
        return NONE;
    }

    /** @return the predecessor of an event that belongs to the same train, or NONE. */
    public int previousEvent (int index) {
        TIntList in = incomingEdges(index);
        int trainId = getVertex(index).trainId;
        for (int i = 0; i < in.size(); i++) {
            int from = getEdge(in.get(i)).fromVertex;
            if (getVertex(from).trainId == trainId) return from;
        }
        return NONE;
    }

    /**
     * Walk along a train starting at (and including) the given event and return the first event that passes the
     * test, or NONE.
     */
    public int findOnPath (int start, boolean followContinuation, IntPredicate test) {
        TIntSet seen = new TIntHashSet();
        for (int e = start; e != NONE && seen.add(e); e = nextEvent(e, followContinuation)) {
            if (test.test(e)) return e;
        }
        return NONE;
    }

    /** Vertex indexes of a train's events in order, starting at sequence 0. */
    public TIntList trainPath (int trainId) {
        TIntList path = new TIntArrayList();
        TIntSet seen = new TIntHashSet();
        for (int e = trainStart(trainId); e != NONE && seen.add(e); e = nextEvent(e)) path.add(e);
        return path;
    }

    /**
     * Make sure sequence 0 of every train is its first event. After an incremental build an earlier event may have
     * been added to a train (for example an entry), in which case the sequence numbers of the old and new start
     * are swapped.
     */
    public void markTrainStarts () {
        eventsForTrain.forEachEntry((trainId, events) -> {
            int current = trainStart(trainId);
            int best = NONE;
            for (int e : events.toArray()) {
                if (previousEvent(e) != NONE) continue;
                if (best == NONE || startsBefore(getVertex(e), getVertex(best))) best = e;
            }
            if (best == NONE || best == current) return true;
            // Ties go to the current start.
            if (current != NONE && previousEvent(current) == NONE
                    && !startsBefore(getVertex(best), getVertex(current))) {
                return true;
            }
            EventNode start = getVertex(best);
            if (current != NONE) {
                EventNode old = getVertex(current);
                old.sequence = start.sequence;
                indexForKey.put(key(trainId, old.sequence), current);
            } else {
                indexForKey.remove(key(trainId, start.sequence));
            }
            start.sequence = 0;
            indexForKey.put(key(trainId, 0), best);
            LOG.debug("Train {} now starts at {}", trainId, start);
            return true;
        });
    }

    private static boolean startsBefore (EventNode a, EventNode b) {
        if (b.plannedTime == TimeUtils.NO_TIME) return true;
        if (a.plannedTime == TimeUtils.NO_TIME) return false;
        return a.plannedTime < b.plannedTime;
    }

    /** Short description of an event for log messages. */
    public String nodeInfo (int index) {
        EventNode node = getVertex(index);
        return node == null ? "#" + index + " (removed)" : node.toString();
    }

    /** Short description of an edge for log messages. */
    public String edgeInfo (int edgeIndex) {
        EventEdge edge = getEdge(edgeIndex);
        if (edge == null) return "#" + edgeIndex + " (removed)";
        return String.format("[%s] -%s-> [%s]", nodeInfo(edge.fromVertex), edge, nodeInfo(edge.toVertex));
    }

    @Override
    public void clear () {
        super.clear();
        indexForKey.clear();
        indexForIdentity.clear();
        eventsForTarget.clear();
        eventsForTrain.clear();
        nextSequence.clear();
    }

}
