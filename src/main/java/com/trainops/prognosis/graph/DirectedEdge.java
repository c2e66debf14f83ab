package com.trainops.prognosis.graph;

/**
 * Common part of the edges stored in a {@link DirectedGraph}: the integer indexes of the two vertices.
 * Subclasses add the typed payload of their own graph.
 */
public abstract class DirectedEdge {

    /** Index of the vertex this edge leaves from. */
    public final int fromVertex;

    /** Index of the vertex this edge leads to. */
    public final int toVertex;

    protected DirectedEdge (int fromVertex, int toVertex) {
        this.fromVertex = fromVertex;
        this.toVertex = toVertex;
    }

}
