package com.trainops.prognosis.target;

import com.trainops.prognosis.graph.DirectedEdge;

public class TargetEdge extends DirectedEdge {

    public final TargetEdgeType type;

    public TargetEdge (int fromVertex, int toVertex, TargetEdgeType type) {
        super(fromVertex, toVertex);
        this.type = type;
    }

    @Override
    public String toString () {
        return String.format("%c %d->%d", type.code, fromVertex, toVertex);
    }

}
