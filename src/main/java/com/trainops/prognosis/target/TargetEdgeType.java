package com.trainops.prognosis.target;

public enum TargetEdgeType {
    /** Consecutive stops of the same train. */
    PLANNED('P'),
    /** The train continues under a new train number. */
    REPLACEMENT('E'),
    /** The train is coupled to another train which continues. */
    COUPLING('K'),
    /** A second train is split off from this one. */
    SPLITTING('F'),
    // The following are placed by dispatchers or display code and are not translated into events.
    SHUNT('R'),
    DEPENDENCY('A'),
    SORT_HELPER('O');

    public final char code;

    TargetEdgeType (char code) {
        this.code = code;
    }
}
