package com.trainops.prognosis.event.build;

import com.trainops.prognosis.error.Problem;
import com.trainops.prognosis.error.ProblemLog;
import com.trainops.prognosis.error.ProblemType;
import com.trainops.prognosis.event.EventEdgeType;
import com.trainops.prognosis.event.EventKind;
import com.trainops.prognosis.target.TargetEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.trainops.prognosis.util.TimeUtils.NO_TIME;

/**
 * A second train is split off. The splitting event belongs to the source train, both departures follow it:
 * <pre>
 *     An(source) -F-> F -H(0)-> Ab(source)
 *                     F -H(0)-> Ab(split)
 * </pre>
 * The split train's own arrival is dropped.
 */
public class SplittingBuilder extends EventEdgeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(SplittingBuilder.class);

    public SplittingBuilder (TargetEdge targetEdge, EventNodeBuilder from, EventNodeBuilder to) {
        super(targetEdge, from, to);
    }

    @Override
    protected void rewriteChains (ProblemLog problems) {
        PendingChain source = from.chain();
        PendingChain split = to.chain();
        if (source.events.isEmpty() || !split.endsWith(EventKind.DEPARTURE)) {
            LOG.warn("Cannot translate splitting {} -> {}: {} / {}", from.target, to.target, source, split);
            problems.add(Problem.forTrain(ProblemType.INCOMPLETE_DATA, from.target.trainId)
                    .setSubject(from.target.toString())
                    .addInfo("link", "splitting"));
            return;
        }
        int arrival = source.first().plannedTime();
        int plannedTime = arrival == NO_TIME ? NO_TIME : arrival + source.dwell;
        PendingEvent splitting = new PendingEvent(from.target.trainId, from.target.key, EventKind.SPLITTING,
                from.target.plannedLocation, from.target.location, plannedTime);
        from.update(chain -> {
            PendingChain spliced = chain.withOperationAfterFirst(splitting,
                    new PendingEdge(EventEdgeType.SPLITTING, chain.trainId, chain.dwell));
            // The dwell is spent before the split, the source train may leave right after it.
            return spliced.endsWith(EventKind.DEPARTURE) ? spliced.withLastEdgeMinDuration(0) : spliced;
        });
        to.update(chain -> chain
                .withFeederBeforeLast(splitting, new PendingEdge(EventEdgeType.HOLD, splitting.trainId(), 0))
                .withoutLeadingArrival());
    }

}
