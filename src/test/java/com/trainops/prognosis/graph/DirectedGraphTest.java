package com.trainops.prognosis.graph;

import gnu.trove.list.TIntList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DirectedGraphTest {

    private static class Edge extends DirectedEdge {
        Edge (int from, int to) {
            super(from, to);
        }
    }

    private DirectedGraph<String, Edge> graph;

    private int a, b, c, d;

    @BeforeEach
    public void setUp () {
        graph = new DirectedGraph<>();
        a = graph.addVertex("a");
        b = graph.addVertex("b");
        c = graph.addVertex("c");
        d = graph.addVertex("d");
    }

    @Test
    public void edgesAreIndexedBothWays () {
        int ab = graph.addEdge(new Edge(a, b));
        int ac = graph.addEdge(new Edge(a, c));
        graph.addEdge(new Edge(b, d));
        assertEquals(ab, graph.findEdge(a, b));
        assertEquals(ac, graph.findEdge(a, c));
        assertEquals(DirectedGraph.NONE, graph.findEdge(b, a));
        assertEquals(2, graph.outDegree(a));
        assertEquals(1, graph.inDegree(d));
        assertEquals(b, graph.predecessors(d).get(0));
        assertEquals(3, graph.edgeCount());
    }

    @Test
    public void removedElementsKeepOtherIndexesValid () {
        int ab = graph.addEdge(new Edge(a, b));
        int bc = graph.addEdge(new Edge(b, c));
        graph.addEdge(new Edge(c, d));
        graph.removeEdge(ab);
        assertNull(graph.getEdge(ab));
        assertNotNull(graph.getEdge(bc));
        assertEquals(0, graph.outDegree(a));
        assertEquals(2, graph.edgeCount());

        graph.removeVertex(c);
        assertFalse(graph.containsVertex(c));
        assertEquals(3, graph.vertexCount());
        assertEquals(0, graph.edgeCount());
        assertEquals(0, graph.outDegree(b));
        assertEquals("d", graph.getVertex(d));
        // A new vertex gets a fresh index.
        assertEquals(4, graph.addVertex("e"));
    }

    @Test
    public void edgeToMissingVertexIsRejected () {
        graph.removeVertex(d);
        assertThrows(IllegalArgumentException.class, () -> graph.addEdge(new Edge(a, d)));
    }

    @Test
    public void topologicalOrderRespectsEdges () {
        graph.addEdge(new Edge(d, c));
        graph.addEdge(new Edge(c, b));
        graph.addEdge(new Edge(a, b));
        TIntList order = GraphAlgorithms.topologicalOrder(graph);
        assertNotNull(order);
        assertEquals(4, order.size());
        assertTrue(order.indexOf(d) < order.indexOf(c));
        assertTrue(order.indexOf(c) < order.indexOf(b));
        assertTrue(order.indexOf(a) < order.indexOf(b));
        assertTrue(GraphAlgorithms.findCycle(graph).isEmpty());
    }

    @Test
    public void cycleIsReportedInTraversalOrder () {
        int ab = graph.addEdge(new Edge(a, b));
        int bc = graph.addEdge(new Edge(b, c));
        int ca = graph.addEdge(new Edge(c, a));
        graph.addEdge(new Edge(c, d));
        assertNull(GraphAlgorithms.topologicalOrder(graph));
        assertFalse(GraphAlgorithms.isAcyclic(graph));
        TIntList cycle = GraphAlgorithms.findCycle(graph);
        assertEquals(3, cycle.size());
        assertEquals(ab, cycle.get(0));
        assertEquals(bc, cycle.get(1));
        assertEquals(ca, cycle.get(2));
    }

    @Test
    public void selfLoopIsACycle () {
        int loop = graph.addEdge(new Edge(b, b));
        TIntList cycle = GraphAlgorithms.findCycle(graph);
        assertEquals(1, cycle.size());
        assertEquals(loop, cycle.get(0));
    }

}
