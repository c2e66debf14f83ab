package com.trainops.prognosis.event.build;

import com.trainops.prognosis.error.Problem;
import com.trainops.prognosis.error.ProblemLog;
import com.trainops.prognosis.error.ProblemType;
import com.trainops.prognosis.event.EventEdgeType;
import com.trainops.prognosis.event.EventKind;
import com.trainops.prognosis.target.TargetEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The train continues under a new number. The old train's departure and the new train's arrival are dropped:
 * <pre>
 *     An(old) -E-> E(old) -H(0)-> Ab(new)
 * </pre>
 * The replacement event belongs to the old train and is planned at the new train's departure time.
 */
public class ReplacementBuilder extends EventEdgeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(ReplacementBuilder.class);

    public ReplacementBuilder (TargetEdge targetEdge, EventNodeBuilder from, EventNodeBuilder to) {
        super(targetEdge, from, to);
    }

    @Override
    protected void rewriteChains (ProblemLog problems) {
        PendingChain oldChain = from.chain();
        PendingChain newChain = to.chain();
        if (oldChain.events.isEmpty() || !newChain.endsWith(EventKind.DEPARTURE)) {
            LOG.warn("Cannot translate replacement {} -> {}: {} / {}", from.target, to.target, oldChain, newChain);
            problems.add(Problem.forTrain(ProblemType.INCOMPLETE_DATA, from.target.trainId)
                    .setSubject(from.target.toString())
                    .addInfo("link", "replacement"));
            return;
        }
        PendingEvent replacement = new PendingEvent(from.target.trainId, from.target.key, EventKind.REPLACEMENT,
                from.target.plannedLocation, from.target.location, newChain.last().plannedTime());
        from.update(chain -> chain
                .withOperationAfterFirst(replacement,
                        new PendingEdge(EventEdgeType.REPLACEMENT, chain.trainId, chain.dwell))
                .withoutTrailingDeparture());
        to.update(chain -> chain
                .withFeederBeforeLast(replacement, new PendingEdge(EventEdgeType.HOLD, replacement.trainId(), 0))
                .withoutLeadingArrival());
    }

}
