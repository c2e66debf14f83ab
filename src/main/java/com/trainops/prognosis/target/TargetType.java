package com.trainops.prognosis.target;

/**
 * What a train does at a target. The single letter codes are the ones shown to dispatchers.
 */
public enum TargetType {
    HALT('H'),
    PASS_THROUGH('D'),
    ENTRY('E'),
    EXIT('A'),
    OPERATIONAL_STOP('B'),
    SIGNAL_STOP('S');

    public final char code;

    TargetType (char code) {
        this.code = code;
    }

    /** Entry and exit points are at the border of the network and have only one event. */
    public boolean isBorder () {
        return this == ENTRY || this == EXIT;
    }
}
