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
 * The first train is coupled to the second, which continues. Both arrivals feed the coupling event, which belongs
 * to the continuing train:
 * <pre>
 *     An(ending) -K-> K
 *     An(continuing) -H-> K -H(0)-> Ab(continuing)
 * </pre>
 * The coupling is planned when both trains have completed their minimum dwell. The ending train's departure is
 * dropped. Several trains can be coupled to the same continuing train; their coupling events are ordered by time.
 */
public class CouplingBuilder extends EventEdgeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(CouplingBuilder.class);

    public CouplingBuilder (TargetEdge targetEdge, EventNodeBuilder from, EventNodeBuilder to) {
        super(targetEdge, from, to);
    }

    @Override
    protected void rewriteChains (ProblemLog problems) {
        PendingChain ending = from.chain();
        PendingChain continuing = to.chain();
        if (ending.events.isEmpty() || !continuing.endsWith(EventKind.DEPARTURE)) {
            LOG.warn("Cannot translate coupling {} -> {}: {} / {}", from.target, to.target, ending, continuing);
            problems.add(Problem.forTrain(ProblemType.INCOMPLETE_DATA, from.target.trainId)
                    .setSubject(from.target.toString())
                    .addInfo("link", "coupling"));
            return;
        }
        int plannedTime = Math.max(readyTime(ending), readyTime(continuing));
        // Keyed by the ending train's target so that each train coupled in gets its own event.
        PendingEvent coupling = new PendingEvent(to.target.trainId, from.target.key, EventKind.COUPLING,
                to.target.plannedLocation, to.target.location, plannedTime);
        from.update(chain -> chain
                .withOperationAfterFirst(coupling, new PendingEdge(EventEdgeType.COUPLING, chain.trainId, chain.dwell))
                .withoutTrailingDeparture());
        to.update(chain -> chain.withCoupling(coupling));
    }

    /** Planned time of the first event plus minimum dwell, or NO_TIME. */
    private static int readyTime (PendingChain chain) {
        int time = chain.first().plannedTime();
        return time == NO_TIME ? NO_TIME : time + chain.dwell;
    }

}
