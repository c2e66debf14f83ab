package com.trainops.prognosis.target;

/**
 * A connection of the simulated network to the outside world, where trains enter or leave.
 */
public class EntryExitPoint {

    /** Element number of the point in the simulator, used as location of the synthesized targets. */
    public final String id;

    public final String name;

    public EntryExitPoint (String id, String name) {
        this.id = id;
        this.name = name;
    }

    @Override
    public String toString () {
        return name == null ? id : name;
    }

}
