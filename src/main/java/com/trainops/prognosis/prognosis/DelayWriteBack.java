package com.trainops.prognosis.prognosis;

import com.trainops.prognosis.error.Problem;
import com.trainops.prognosis.error.ProblemLog;
import com.trainops.prognosis.error.ProblemType;
import com.trainops.prognosis.event.EventGraph;
import com.trainops.prognosis.event.EventNode;
import com.trainops.prognosis.target.TargetGraph;
import com.trainops.prognosis.target.TargetNode;
import com.trainops.prognosis.target.TargetType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.trainops.prognosis.util.TimeUtils.NO_TIME;

/**
 * Copies the outcome of the prognosis back onto the target graph as arrival and departure delays, for consumers
 * that think in stops rather than events.
 *
 * Pass-through stops, operational stops and exits only have a meaningful arrival, which also counts as their
 * departure. Entries only have a departure, which also counts as their arrival.
 */
public class DelayWriteBack {

    private static final Logger LOG = LoggerFactory.getLogger(DelayWriteBack.class);

    public void writeBack (EventGraph events, TargetGraph targets, ProblemLog problems) {
        events.forEachVertex(v -> {
            EventNode event = events.getVertex(v);
            if (event.target == null || event.kind.isOperation()) return;
            TargetNode target = targets.get(event.target);
            if (target == null) return;
            int effective = event.effectiveTime();
            if (effective == NO_TIME || event.plannedTime == NO_TIME) {
                LOG.warn("Cannot compute delay of {}, time missing.", event);
                problems.add(Problem.forTrain(ProblemType.INCOMPLETE_DATA, event.trainId).setSubject(event.toString()));
                return;
            }
            int delay = effective - event.plannedTime;
            switch (event.kind) {
                case DEPARTURE:
                    if (target.type == TargetType.HALT || target.type == TargetType.SIGNAL_STOP) {
                        target.departureDelay = delay;
                    } else if (target.type == TargetType.ENTRY) {
                        target.departureDelay = delay;
                        target.arrivalDelay = delay;
                    }
                    break;
                case ARRIVAL:
                    target.arrivalDelay = delay;
                    if (target.type == TargetType.PASS_THROUGH || target.type == TargetType.OPERATIONAL_STOP
                            || target.type == TargetType.EXIT) {
                        target.departureDelay = delay;
                    }
                    break;
                default:
                    break;
            }
        });
    }

}
