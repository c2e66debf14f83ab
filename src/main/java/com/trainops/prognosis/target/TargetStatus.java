package com.trainops.prognosis.target;

/**
 * Where a train stands relative to one of its targets, as last reported with its timetable.
 */
public enum TargetStatus {
    /** Not reached yet. */
    AHEAD,
    /** The train stands at this target. */
    AT_PLATFORM,
    /** The train has left this target. */
    PASSED
}
