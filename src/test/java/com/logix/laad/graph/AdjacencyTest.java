package com.logix.laad.graph;

import org.junit.Test;

import java.util.BitSet;
import java.util.List;

import static org.junit.Assert.*;

public class AdjacencyTest {

    @Test
    public void testEmpty() {
        Adjacency adj = Adjacency.builder(0).build();
        assertEquals(0, adj.size());
    }

    @Test
    public void testChildrenInEdgeOrder() {
        // 0 -> 2, 0 -> 1, 1 -> 2
        Adjacency adj = Adjacency.builder(3)
                .addEdge(0, 2)
                .addEdge(0, 1)
                .addEdge(1, 2)
                .build();

        assertEquals(2, adj.childCount(0));
        assertEquals(2, adj.child(0, 0));
        assertEquals(1, adj.child(0, 1));
        assertEquals(1, adj.childCount(1));
        assertEquals(0, adj.childCount(2));

        assertEquals(0, adj.parentCount(0));
        assertEquals(1, adj.parentCount(1));
        assertEquals(2, adj.parentCount(2));
    }

    @Test
    public void testReachabilityToleratesCycles() {
        // 0 -> 1 -> 2 -> 1, 3 isolated
        Adjacency adj = Adjacency.builder(4)
                .addEdge(0, 1)
                .addEdge(1, 2)
                .addEdge(2, 1)
                .build();

        BitSet seeds = new BitSet();
        seeds.set(0);
        BitSet reached = adj.reachableFrom(seeds);
        assertTrue(reached.get(0));
        assertTrue(reached.get(1));
        assertTrue(reached.get(2));
        assertFalse(reached.get(3));
        assertEquals(1, seeds.cardinality());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEdgeOutOfRange() {
        Adjacency.builder(2).addEdge(0, 2);
    }

    @Test
    public void testSnapshotOfGraphSkipsRemovedVertices() {
        Graph g = new Graph("g");
        Vertex a = g.addVertex("a", "t", List.of(
                new Port("out", Direction.OUT, PortKind.IMPULSE, null, false)), null, false);
        Vertex b = g.addVertex("b", "t", List.of(
                new Port("in", Direction.IN, PortKind.IMPULSE, null, false)), null, false);
        Vertex c = g.addVertex("c", "t", List.of(
                new Port("in", Direction.IN, PortKind.IMPULSE, null, false)), null, false);
        g.connect(new Endpoint(a.id(), "out"), new Endpoint(b.id(), "in"));
        g.connect(new Endpoint(a.id(), "out"), new Endpoint(c.id(), "in"));
        g.removeVertex(b.id());

        Adjacency adj = Adjacency.of(g);
        assertEquals(3, adj.size());
        assertEquals(1, adj.childCount(a.id()));
        assertEquals(c.id(), adj.child(a.id(), 0));
        assertEquals(0, adj.parentCount(b.id()));
    }
}
