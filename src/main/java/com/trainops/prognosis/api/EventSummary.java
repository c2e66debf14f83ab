package com.trainops.prognosis.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.trainops.prognosis.event.EventNode;
import com.trainops.prognosis.util.TimeUtils;

/**
 * Read-only view of one event for displays. Times are seconds since midnight and are left out when absent; the
 * formatted fields carry the same times as HH:MM.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventSummary {

    public int trainId;
    public int sequence;
    public String kind;
    public String location;
    public String plannedLocation;
    public Integer plannedTime;
    public Integer predictedTime;
    public Integer measuredTime;
    public Integer effectiveTime;
    public String planned;
    public String effective;

    public static EventSummary of (EventNode node) {
        EventSummary summary = new EventSummary();
        summary.trainId = node.trainId;
        summary.sequence = node.getSequence();
        summary.kind = node.kind.code;
        summary.location = node.location;
        summary.plannedLocation = node.plannedLocation;
        summary.plannedTime = boxed(node.plannedTime);
        summary.predictedTime = boxed(node.getPredictedTime());
        summary.measuredTime = boxed(node.getMeasuredTime());
        summary.effectiveTime = boxed(node.effectiveTime());
        summary.planned = summary.plannedTime == null ? null : TimeUtils.timeToString(node.plannedTime);
        summary.effective = summary.effectiveTime == null ? null : TimeUtils.timeToString(node.effectiveTime());
        return summary;
    }

    private static Integer boxed (int time) {
        return TimeUtils.isSet(time) ? time : null;
    }

}
