package com.trainops.prognosis.graph;

import com.google.common.base.Preconditions;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntConsumer;

/**
 * An arena holding the vertices and edges of a directed graph. Vertices and edges are addressed by the integer index
 * at which they were added. Rather than letting each vertex hold references to its neighbors, the graph keeps one
 * list of incoming and one list of outgoing edge indexes per vertex, as Trove int lists.
 *
 * Removing a vertex or edge leaves an empty (null) slot so that the indexes of all other elements stay valid.
 * Indexes are never reused, so a removed element cannot be confused with one added later.
 *
 * There is at most one edge from any vertex to any other vertex; see {@link #findEdge(int, int)}.
 */
public class DirectedGraph<V, E extends DirectedEdge> {

    /** Returned by lookups that find nothing. */
    public static final int NONE = -1;

    private final List<V> vertices = new ArrayList<>();

    private final List<E> edges = new ArrayList<>();

    private final List<TIntList> outgoingEdges = new ArrayList<>();

    private final List<TIntList> incomingEdges = new ArrayList<>();

    private int liveVertexCount = 0;

    private int liveEdgeCount = 0;

    /** @return the index of the new vertex. */
    public int addVertex (V vertex) {
        Preconditions.checkNotNull(vertex);
        vertices.add(vertex);
        outgoingEdges.add(new TIntArrayList(2));
        incomingEdges.add(new TIntArrayList(2));
        liveVertexCount += 1;
        return vertices.size() - 1;
    }

    /** @return the index of the new edge. */
    public int addEdge (E edge) {
        Preconditions.checkNotNull(edge);
        Preconditions.checkArgument(containsVertex(edge.fromVertex), "Edge leaves from missing vertex %s", edge.fromVertex);
        Preconditions.checkArgument(containsVertex(edge.toVertex), "Edge leads to missing vertex %s", edge.toVertex);
        edges.add(edge);
        int edgeIndex = edges.size() - 1;
        outgoingEdges.get(edge.fromVertex).add(edgeIndex);
        incomingEdges.get(edge.toVertex).add(edgeIndex);
        liveEdgeCount += 1;
        return edgeIndex;
    }

    /**
     * Swap the payload of an existing edge, for instance to change its durations. The replacement must connect the
     * same two vertices.
     */
    public void replaceEdge (int edgeIndex, E edge) {
        E old = getEdge(edgeIndex);
        Preconditions.checkState(old != null, "Edge %s does not exist", edgeIndex);
        Preconditions.checkArgument(old.fromVertex == edge.fromVertex && old.toVertex == edge.toVertex,
                "Replacement edge must connect the same vertices");
        edges.set(edgeIndex, edge);
    }

    public void removeEdge (int edgeIndex) {
        E edge = getEdge(edgeIndex);
        if (edge == null) return;
        outgoingEdges.get(edge.fromVertex).remove(edgeIndex);
        incomingEdges.get(edge.toVertex).remove(edgeIndex);
        edges.set(edgeIndex, null);
        liveEdgeCount -= 1;
    }

    /** Remove a vertex together with every edge touching it. */
    public void removeVertex (int vertexIndex) {
        if (!containsVertex(vertexIndex)) return;
        for (int e : outgoingEdges.get(vertexIndex).toArray()) removeEdge(e);
        for (int e : incomingEdges.get(vertexIndex).toArray()) removeEdge(e);
        vertices.set(vertexIndex, null);
        liveVertexCount -= 1;
    }

    public boolean containsVertex (int vertexIndex) {
        return vertexIndex >= 0 && vertexIndex < vertices.size() && vertices.get(vertexIndex) != null;
    }

    /** @return the vertex at the given index, or null if there is none or it was removed. */
    public V getVertex (int vertexIndex) {
        if (vertexIndex < 0 || vertexIndex >= vertices.size()) return null;
        return vertices.get(vertexIndex);
    }

    /** @return the edge at the given index, or null if there is none or it was removed. */
    public E getEdge (int edgeIndex) {
        if (edgeIndex < 0 || edgeIndex >= edges.size()) return null;
        return edges.get(edgeIndex);
    }

    /** @return the index of the edge from one vertex to another, or NONE. */
    public int findEdge (int fromVertex, int toVertex) {
        if (!containsVertex(fromVertex)) return NONE;
        TIntList out = outgoingEdges.get(fromVertex);
        for (int i = 0; i < out.size(); i++) {
            int e = out.get(i);
            if (edges.get(e).toVertex == toVertex) return e;
        }
        return NONE;
    }

    public boolean hasEdge (int fromVertex, int toVertex) {
        return findEdge(fromVertex, toVertex) != NONE;
    }

    /** The returned list is a live view and must not be modified by the caller. */
    public TIntList outgoingEdges (int vertexIndex) {
        return outgoingEdges.get(vertexIndex);
    }

    /** The returned list is a live view and must not be modified by the caller. */
    public TIntList incomingEdges (int vertexIndex) {
        return incomingEdges.get(vertexIndex);
    }

    public TIntList successors (int vertexIndex) {
        TIntList out = outgoingEdges.get(vertexIndex);
        TIntList result = new TIntArrayList(out.size());
        for (int i = 0; i < out.size(); i++) result.add(edges.get(out.get(i)).toVertex);
        return result;
    }

    public TIntList predecessors (int vertexIndex) {
        TIntList in = incomingEdges.get(vertexIndex);
        TIntList result = new TIntArrayList(in.size());
        for (int i = 0; i < in.size(); i++) result.add(edges.get(in.get(i)).fromVertex);
        return result;
    }

    public int inDegree (int vertexIndex) {
        return incomingEdges.get(vertexIndex).size();
    }

    public int outDegree (int vertexIndex) {
        return outgoingEdges.get(vertexIndex).size();
    }

    /** One past the highest vertex index ever handed out, including removed vertices. */
    public int vertexCapacity () {
        return vertices.size();
    }

    public int vertexCount () {
        return liveVertexCount;
    }

    public int edgeCount () {
        return liveEdgeCount;
    }

    public void forEachVertex (IntConsumer consumer) {
        for (int v = 0; v < vertices.size(); v++) {
            if (vertices.get(v) != null) consumer.accept(v);
        }
    }

    public void forEachEdge (IntConsumer consumer) {
        for (int e = 0; e < edges.size(); e++) {
            if (edges.get(e) != null) consumer.accept(e);
        }
    }

    public void clear () {
        vertices.clear();
        edges.clear();
        outgoingEdges.clear();
        incomingEdges.clear();
        liveVertexCount = 0;
        liveEdgeCount = 0;
    }

}
