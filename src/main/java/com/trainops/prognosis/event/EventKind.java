package com.trainops.prognosis.event;

public enum EventKind {
    ARRIVAL("An"),
    DEPARTURE("Ab"),
    /** The train continues under a new train number. */
    REPLACEMENT("E"),
    /** Two trains are joined, the resulting train carries the number of the continuing one. */
    COUPLING("K"),
    /** A second train is split off. */
    SPLITTING("F");

    public final String code;

    EventKind (String code) {
        this.code = code;
    }

    /** Replacement, coupling and splitting events are shared between the chains of two trains. */
    public boolean isOperation () {
        return this == REPLACEMENT || this == COUPLING || this == SPLITTING;
    }
}
