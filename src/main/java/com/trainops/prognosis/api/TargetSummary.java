package com.trainops.prognosis.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.trainops.prognosis.target.TargetNode;
import com.trainops.prognosis.util.TimeUtils;

/**
 * Read-only view of one target with the delays written back by the last prognosis, in seconds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TargetSummary {

    public int trainId;
    public String type;
    public String plannedLocation;
    public String location;
    public Integer plannedArrival;
    public Integer plannedDeparture;
    public Integer arrivalDelay;
    public Integer departureDelay;
    public String flags;

    public static TargetSummary of (TargetNode node) {
        TargetSummary summary = new TargetSummary();
        summary.trainId = node.trainId;
        summary.type = String.valueOf(node.type.code);
        summary.plannedLocation = node.plannedLocation;
        summary.location = node.location;
        summary.plannedArrival = boxed(node.plannedArrival);
        summary.plannedDeparture = boxed(node.plannedDeparture);
        summary.arrivalDelay = boxed(node.arrivalDelay);
        summary.departureDelay = boxed(node.departureDelay);
        summary.flags = node.flags.raw.isEmpty() ? null : node.flags.raw;
        return summary;
    }

    private static Integer boxed (int value) {
        return TimeUtils.isSet(value) ? value : null;
    }

}
