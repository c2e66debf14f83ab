package com.trainops.prognosis.ingest;

/**
 * The kinds of live occurrence reported by the simulator.
 */
public enum OccurrenceKind {
    ENTRY,
    ARRIVAL,
    DEPARTURE,
    EXIT,
    RED_SIGNAL_STOP,
    CLEARED,
    REPLACEMENT,
    COUPLING,
    SPLITTING
}
