package com.trainops.prognosis.target;

import com.google.common.base.Preconditions;
import com.trainops.prognosis.config.PrognosisConfig;
import com.trainops.prognosis.error.Problem;
import com.trainops.prognosis.error.ProblemLog;
import com.trainops.prognosis.error.ProblemType;
import com.trainops.prognosis.graph.DirectedGraph;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import gnu.trove.map.hash.TObjectIntHashMap;
import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.trainops.prognosis.util.TimeUtils.NO_TIME;
import static com.trainops.prognosis.util.TimeUtils.fromLocalTime;

/**
 * The target graph has one vertex per planned stop, pass-through, entry and exit of every known train. Consecutive
 * targets of a train are connected by PLANNED edges. REPLACEMENT, COUPLING and SPLITTING edges connect the targets
 * of two trains where one train continues as, joins or splits off another.
 *
 * Importing a train again adds what is new and refreshes planned data of existing targets. Targets listed in the new
 * timetable are relinked in their new order; targets it no longer lists (stops already passed) keep their links.
 * Cross-train links and the delays written back by the prognosis are kept.
 */
public class TargetGraph extends DirectedGraph<TargetNode, TargetEdge> {

    private static final Logger LOG = LoggerFactory.getLogger(TargetGraph.class);

    /**
     * A cross-train link whose partner train was unknown at import time. It is retried whenever the partner is
     * imported.
     */
    public record PendingLink (TargetKey from, TargetEdgeType type, int partnerTrainId) { }

    private final PrognosisConfig config;

    private final TObjectIntMap<TargetKey> indexForKey = new TObjectIntHashMap<>(100, 0.5f, NONE);

    /** Vertex indexes of each train's targets, in order of creation. Ordering along the train is by PLANNED edges. */
    private final TIntObjectMap<TIntList> targetsForTrain = new TIntObjectHashMap<>();

    private final Set<PendingLink> pendingLinks = new LinkedHashSet<>();

    /** Trains whose import is under way, to stop mutually referencing trains from importing each other forever. */
    private final TIntSet importing = new TIntHashSet();

    public TargetGraph (PrognosisConfig config) {
        this.config = config;
    }

    /**
     * Add a target unless one with the same key exists.
     * @return the vertex index of the new or existing target.
     */
    public int addTarget (TargetNode node) {
        int existing = indexForKey.get(node.key);
        if (existing != NONE) return existing;
        int index = addVertex(node);
        indexForKey.put(node.key, index);
        TIntList targets = targetsForTrain.get(node.trainId);
        if (targets == null) {
            targets = new TIntArrayList();
            targetsForTrain.put(node.trainId, targets);
        }
        targets.add(index);
        return index;
    }

    /**
     * Connect two targets unless they are the same target or already connected.
     * @return the edge index, or NONE if no edge was added or found.
     */
    public int addLink (int fromTarget, int toTarget, TargetEdgeType type) {
        if (fromTarget == toTarget) return NONE;
        int existing = findEdge(fromTarget, toTarget);
        if (existing != NONE) return existing;
        return addEdge(new TargetEdge(fromTarget, toTarget, type));
    }

    public int indexOf (TargetKey key) {
        return indexForKey.get(key);
    }

    public TargetNode get (TargetKey key) {
        int index = indexForKey.get(key);
        return index == NONE ? null : getVertex(index);
    }

    public TIntSet trains () {
        return new TIntHashSet(targetsForTrain.keySet());
    }

    public boolean containsTrain (int trainId) {
        return targetsForTrain.containsKey(trainId);
    }

    /**
     * @return true if the target has no PLANNED predecessor of the same train, i.e. the train starts here.
     */
    public boolean isTrainStart (int target) {
        TIntList in = incomingEdges(target);
        for (int i = 0; i < in.size(); i++) {
            TargetEdge edge = getEdge(in.get(i));
            if (edge.type == TargetEdgeType.PLANNED && getVertex(edge.fromVertex).trainId == getVertex(target).trainId) {
                return false;
            }
        }
        return true;
    }

    /** @return the same-train PLANNED successor of a target, or NONE. */
    public int nextTarget (int target) {
        TIntList out = outgoingEdges(target);
        for (int i = 0; i < out.size(); i++) {
            TargetEdge edge = getEdge(out.get(i));
            if (edge.type == TargetEdgeType.PLANNED && getVertex(edge.toVertex).trainId == getVertex(target).trainId) {
                return edge.toVertex;
            }
        }
        return NONE;
    }

    /**
     * The targets of one train in travel order, starting at the earliest train start. Empty if the train is unknown.
     */
    public TIntList trainPath (int trainId) {
        TIntList result = new TIntArrayList();
        int start = firstOf(trainId);
        TIntSet seen = new TIntHashSet();
        for (int t = start; t != NONE && seen.add(t); t = nextTarget(t)) result.add(t);
        return result;
    }

    /** @return the first target of a train, or NONE. Where a train has several starts the earliest one wins. */
    public int firstOf (int trainId) {
        TIntList targets = targetsForTrain.get(trainId);
        if (targets == null) return NONE;
        int best = NONE;
        for (int i = 0; i < targets.size(); i++) {
            int t = targets.get(i);
            if (!isTrainStart(t)) continue;
            if (best == NONE || startsBefore(getVertex(t), getVertex(best))) best = t;
        }
        return best;
    }

    private static boolean startsBefore (TargetNode a, TargetNode b) {
        if (a.type == TargetType.ENTRY) return true;
        if (b.type == TargetType.ENTRY) return false;
        return a.plannedArrivalOrDeparture() < b.plannedArrivalOrDeparture();
    }

    public int lastOf (int trainId) {
        TIntList path = trainPath(trainId);
        return path.isEmpty() ? NONE : path.get(path.size() - 1);
    }

    public Set<PendingLink> pendingLinks () {
        return Collections.unmodifiableSet(pendingLinks);
    }

    /**
     * Import or refresh one train. Each stop becomes a target, consecutive targets are linked by PLANNED edges, and
     * entry and exit targets are synthesized where the train comes from or goes to outside the network.
     *
     * Replacement, coupling and splitting flags are resolved against the trains already in this graph. A partner that
     * is missing from the graph but present in the directory is imported first. Links to unknown partners are kept
     * as pending links and resolved when the partner shows up.
     *
     * @param directory all trains known to the caller by id, may be empty.
     */
    public void importTrain (TrainSchedule schedule, Map<Integer, TrainSchedule> directory, ProblemLog problems) {
        Preconditions.checkNotNull(schedule);
        if (!importing.add(schedule.trainId)) return;
        try {
            doImport(schedule, directory, problems);
        } finally {
            importing.remove(schedule.trainId);
        }
    }

    private void doImport (TrainSchedule schedule, Map<Integer, TrainSchedule> directory, ProblemLog problems) {
        final int trainId = schedule.trainId;
        TIntList path = new TIntArrayList();
        List<TargetNode> stopNodes = new ArrayList<>();
        TargetNode current = null;
        for (int i = 0; i < schedule.stops.size(); i++) {
            ScheduledStop stop = schedule.stops.get(i);
            int arrival = fromLocalTime(stop.arrival);
            int departure = fromLocalTime(stop.departure);
            int time = arrival != NO_TIME ? arrival : departure;
            if (time == NO_TIME || stop.plannedLocation == null) {
                LOG.warn("Skipping stop without time or location in train {}: {}", schedule, stop);
                problems.add(Problem.forTrain(ProblemType.INCOMPLETE_DATA, trainId).setSubject(stop.toString()));
                continue;
            }
            ScheduleFlags flags = new ScheduleFlags(stop.flags);
            TargetKey key = new TargetKey(trainId, time, stop.plannedLocation);
            TargetNode node = get(key);
            if (node == null) {
                node = new TargetNode(key, flags.passThrough ? TargetType.PASS_THROUGH : TargetType.HALT,
                        stop.plannedLocation);
                addTarget(node);
            } else if (!node.type.isBorder()) {
                node.type = flags.passThrough ? TargetType.PASS_THROUGH : TargetType.HALT;
            }
            node.location = stop.location != null ? stop.location : stop.plannedLocation;
            node.plannedArrival = arrival;
            node.plannedDeparture = departure;
            node.flags = flags;
            node.minimumDwell = flags.minimumDwell(config);
            path.add(indexOf(key));
            stopNodes.add(node);
            if (i == schedule.currentStop) current = node;
        }

        if (stopNodes.isEmpty()) {
            LOG.warn("Train {} has no usable stops, nothing imported.", schedule);
            problems.add(Problem.forTrain(ProblemType.INCOMPLETE_DATA, trainId).setSubject("timetable"));
            return;
        }

        if (schedule.entryPoint != null) {
            TargetKey entryKey = new TargetKey(trainId, TargetKey.ENTRY_TIME, schedule.entryPoint.id);
            int entry = indexOf(entryKey);
            if (entry == NONE && !schedule.entered) {
                TargetNode node = new TargetNode(entryKey, TargetType.ENTRY, schedule.entryPoint.id);
                entry = addTarget(node);
            }
            // Once the train has entered, its entry keeps its times and its link to the stop it entered towards.
            if (entry != NONE && !schedule.entered) {
                TargetNode node = getVertex(entry);
                node.plannedArrival = stopNodes.get(0).plannedArrivalOrDeparture() - config.entryLeadSecs;
                node.plannedDeparture = node.plannedArrival;
                path.insert(0, entry);
            }
        }
        if (schedule.exitPoint != null) {
            TargetKey exitKey = new TargetKey(trainId, TargetKey.EXIT_TIME, schedule.exitPoint.id);
            TargetNode node = get(exitKey);
            if (node == null) {
                node = new TargetNode(exitKey, TargetType.EXIT, schedule.exitPoint.id);
                addTarget(node);
            }
            node.plannedArrival = stopNodes.get(stopNodes.size() - 1).plannedDepartureOrArrival() + config.exitLagSecs;
            node.plannedDeparture = node.plannedArrival;
            path.add(indexOf(exitKey));
        }

        for (int i = 1; i < path.size(); i++) {
            addLink(path.get(i - 1), path.get(i), TargetEdgeType.PLANNED);
        }
        TIntSet onPath = new TIntHashSet(path);
        for (int i = 0; i < path.size(); i++) {
            removeStalePlannedLinks(path.get(i), i + 1 < path.size() ? path.get(i + 1) : NONE, onPath);
        }

        for (TargetNode node : stopNodes) {
            if (node.flags.hasReplacement()) {
                link(node, TargetEdgeType.REPLACEMENT, node.flags.replacementTrain, directory, problems);
            }
            if (node.flags.hasCoupling()) {
                link(node, TargetEdgeType.COUPLING, node.flags.couplingTrain, directory, problems);
            }
            if (node.flags.hasSplitting()) {
                link(node, TargetEdgeType.SPLITTING, node.flags.splittingTrain, directory, problems);
            }
        }

        applyPosition(schedule, current);
        retryPendingLinks(trainId, directory, problems);
        LOG.debug("Imported train {} with {} targets.", schedule, path.size());
    }

    /**
     * Set the status of each target along the train's path from the reported position: targets before the current
     * stop are passed if the train has entered, the current stop is ahead or at the platform, later ones are ahead.
     * Without a current stop the whole path is ahead. A reported delay is carried to the events not happened yet.
     */
    private void applyPosition (TrainSchedule schedule, TargetNode current) {
        TargetStatus status = current != null && schedule.entered ? TargetStatus.PASSED : TargetStatus.AHEAD;
        TIntList path = trainPath(schedule.trainId);
        for (int i = 0; i < path.size(); i++) {
            TargetNode node = getVertex(path.get(i));
            if (node == current) {
                status = schedule.atPlatform ? TargetStatus.AT_PLATFORM : TargetStatus.AHEAD;
            } else if (status == TargetStatus.AT_PLATFORM) {
                status = TargetStatus.AHEAD;
            }
            node.status = status;
            if (schedule.delay == NO_TIME) continue;
            if (status == TargetStatus.AHEAD) node.reportedArrivalDelay = schedule.delay;
            if (status != TargetStatus.PASSED) node.reportedDepartureDelay = schedule.delay;
        }
    }

    /**
     * Drop PLANNED links left by an older timetable that skip over or go back along the new path, e.g. after a stop
     * was inserted. Links to targets missing from the new path stay: a timetable that no longer lists the stops
     * already passed must not cut the train's path apart.
     */
    private void removeStalePlannedLinks (int target, int successor, TIntSet onPath) {
        TIntList out = outgoingEdges(target);
        for (int e : out.toArray()) {
            TargetEdge edge = getEdge(e);
            if (edge.type != TargetEdgeType.PLANNED || edge.toVertex == successor) continue;
            if (!onPath.contains(edge.toVertex)) continue;
            if (getVertex(edge.toVertex).trainId != getVertex(target).trainId) continue;
            LOG.debug("Timetable of train {} changed, removing link {} -> {}", getVertex(target).trainId,
                    getVertex(target), getVertex(edge.toVertex));
            removeEdge(e);
        }
    }

    /**
     * Resolve one operational flag to an edge. Leaves a pending link behind if the partner train is unknown or has
     * no matching target.
     */
    private void link (TargetNode from, TargetEdgeType type, int partnerTrainId,
                       Map<Integer, TrainSchedule> directory, ProblemLog problems) {
        PendingLink pending = new PendingLink(from.key, type, partnerTrainId);
        if (!containsTrain(partnerTrainId) && directory != null && directory.containsKey(partnerTrainId)) {
            importTrain(directory.get(partnerTrainId), directory, problems);
        }
        int to = NONE;
        if (containsTrain(partnerTrainId)) {
            to = type == TargetEdgeType.COUPLING ? findCouplingTarget(from, partnerTrainId) : firstStopOf(partnerTrainId);
        }
        if (to == NONE) {
            if (pendingLinks.add(pending)) {
                LOG.warn("Partner train {} of {} link at {} not found, keeping link pending.",
                        partnerTrainId, type, from);
                problems.add(Problem.forTrain(ProblemType.NOT_FOUND, from.trainId)
                        .setSubject(from.toString())
                        .addInfo("partner", partnerTrainId)
                        .addInfo("link", type));
            }
            return;
        }
        pendingLinks.remove(pending);
        addLink(indexOf(from.key), to, type);
    }

    private void retryPendingLinks (int trainId, Map<Integer, TrainSchedule> directory, ProblemLog problems) {
        List<PendingLink> retry = new ArrayList<>();
        for (PendingLink pending : pendingLinks) {
            if (pending.partnerTrainId() == trainId) retry.add(pending);
        }
        for (PendingLink pending : retry) {
            TargetNode from = get(pending.from());
            if (from == null) {
                pendingLinks.remove(pending);
                continue;
            }
            link(from, pending.type(), pending.partnerTrainId(), directory, problems);
        }
    }

    /** The first real stop of a train, skipping a synthesized entry. */
    private int firstStopOf (int trainId) {
        TIntList path = trainPath(trainId);
        for (int i = 0; i < path.size(); i++) {
            if (getVertex(path.get(i)).type != TargetType.ENTRY) return path.get(i);
        }
        return NONE;
    }

    /**
     * Find the target where the partner train waits to be coupled to: same planned track (ignoring case) and a
     * planned stay that covers our arrival. If no stay covers the arrival, the stop on that track nearest in time.
     */
    private int findCouplingTarget (TargetNode from, int partnerTrainId) {
        int time = from.plannedArrivalOrDeparture();
        int nearest = NONE;
        long nearestDistance = Long.MAX_VALUE;
        TIntList path = trainPath(partnerTrainId);
        for (int i = 0; i < path.size(); i++) {
            TargetNode candidate = getVertex(path.get(i));
            if (candidate.type.isBorder() || !candidate.plannedLocation.equalsIgnoreCase(from.plannedLocation)) {
                continue;
            }
            boolean afterArrival = candidate.plannedArrival == NO_TIME || time >= candidate.plannedArrival;
            boolean beforeDeparture = candidate.plannedDeparture == NO_TIME || time <= candidate.plannedDeparture;
            if (afterArrival && beforeDeparture) return path.get(i);
            long distance = Math.abs((long) candidate.plannedArrivalOrDeparture() - time);
            if (distance < nearestDistance) {
                nearestDistance = distance;
                nearest = path.get(i);
            }
        }
        return nearest;
    }

    @Override
    public void clear () {
        super.clear();
        indexForKey.clear();
        targetsForTrain.clear();
        pendingLinks.clear();
        importing.clear();
    }

}
