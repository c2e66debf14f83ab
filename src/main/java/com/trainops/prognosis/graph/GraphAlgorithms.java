package com.trainops.prognosis.graph;

import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;

/**
 * Static traversal routines over a {@link DirectedGraph}.
 */
public abstract class GraphAlgorithms {

    private static final byte WHITE = 0;
    private static final byte GREY = 1;
    private static final byte BLACK = 2;

    /**
     * Kahn's algorithm. Vertices with no ordering between them come out in index order.
     * @return the live vertex indexes in topological order, or null if the graph contains a cycle.
     */
    public static TIntList topologicalOrder (DirectedGraph<?, ?> graph) {
        int n = graph.vertexCapacity();
        int[] remainingInDegree = new int[n];
        TIntList queue = new TIntArrayList(graph.vertexCount());
        for (int v = 0; v < n; v++) {
            if (!graph.containsVertex(v)) continue;
            remainingInDegree[v] = graph.inDegree(v);
            if (remainingInDegree[v] == 0) queue.add(v);
        }
        // The queue doubles as the output list, the head pointer marks what has been processed.
        for (int head = 0; head < queue.size(); head++) {
            TIntList out = graph.outgoingEdges(queue.get(head));
            for (int i = 0; i < out.size(); i++) {
                int w = graph.getEdge(out.get(i)).toVertex;
                if (--remainingInDegree[w] == 0) queue.add(w);
            }
        }
        return queue.size() == graph.vertexCount() ? queue : null;
    }

    public static boolean isAcyclic (DirectedGraph<?, ?> graph) {
        return topologicalOrder(graph) != null;
    }

    /**
     * Depth-first search for a back edge.
     * @return the edge indexes of one cycle in traversal order, or an empty list if the graph is acyclic.
     */
    public static TIntList findCycle (DirectedGraph<?, ?> graph) {
        int n = graph.vertexCapacity();
        byte[] color = new byte[n];
        // The edge through which each vertex was entered, used to walk the cycle back once a back edge is found.
        int[] parentEdge = new int[n];
        int[] nextChild = new int[n];
        TIntList stack = new TIntArrayList();
        for (int root = 0; root < n; root++) {
            if (!graph.containsVertex(root) || color[root] != WHITE) continue;
            parentEdge[root] = DirectedGraph.NONE;
            color[root] = GREY;
            stack.add(root);
            while (!stack.isEmpty()) {
                int v = stack.get(stack.size() - 1);
                TIntList out = graph.outgoingEdges(v);
                if (nextChild[v] >= out.size()) {
                    color[v] = BLACK;
                    stack.removeAt(stack.size() - 1);
                    continue;
                }
                int e = out.get(nextChild[v]++);
                int w = graph.getEdge(e).toVertex;
                if (color[w] == WHITE) {
                    color[w] = GREY;
                    parentEdge[w] = e;
                    stack.add(w);
                } else if (color[w] == GREY) {
                    TIntList cycle = new TIntArrayList();
                    cycle.add(e);
                    for (int u = v; u != w; u = graph.getEdge(parentEdge[u]).fromVertex) {
                        cycle.add(parentEdge[u]);
                    }
                    cycle.reverse();
                    return cycle;
                }
            }
        }
        return new TIntArrayList(0);
    }

}
