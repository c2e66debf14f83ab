package com.trainops.prognosis.event;

public enum EventEdgeType {
    /** Travel between two stops. */
    PLANNED('P'),
    /** Stay at a stop, or the hand-over after an operation. */
    HOLD('H'),
    REPLACEMENT('E'),
    COUPLING('K'),
    SPLITTING('F'),
    /** Ordered by a dispatcher, e.g. waiting for a connecting train. */
    DEPENDENCY('A');

    public final char code;

    EventEdgeType (char code) {
        this.code = code;
    }
}
