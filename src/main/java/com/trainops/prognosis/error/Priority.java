package com.trainops.prognosis.error;

public enum Priority {
    /**
     * The structure of the event graph had to be changed to keep it usable,
     * e.g. an edge was removed to break a cycle.
     */
    HIGH,

    /**
     * Some information could not be applied and predictions for part of a train will be less accurate,
     * e.g. a live occurrence that matched no event.
     */
    MEDIUM,

    /**
     * Something that is expected to resolve itself once more information arrives,
     * e.g. a node that has no prognosis yet.
     */
    LOW
}
