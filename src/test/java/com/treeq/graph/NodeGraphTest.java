package com.treeq.graph;

import org.eclipse.collections.impl.factory.primitive.IntLists;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class NodeGraphTest {

    @Test
    public void testDirectedAdjacency() {
        NodeGraph.Builder builder = NodeGraph.builder(true).addNodes(4);
        builder.addEdge(0, 2);
        builder.addEdge(0, 1);
        builder.addEdge(3, 0);
        NodeGraph graph = builder.build();

        assertEquals(IntLists.immutable.with(1, 2), graph.successors(0));
        assertEquals(IntLists.immutable.with(3), graph.predecessors(0));
        assertEquals(IntLists.immutable.with(1, 2, 3), graph.neighbors(0));
        assertEquals(2, graph.outDegree(0));
        assertEquals(1, graph.inDegree(0));
        assertEquals(3, graph.degree(0));
        assertFalse(graph.hasEdge(1, 0));
    }

    @Test
    public void testUndirectedEdgesAreNormalized() {
        NodeGraph.Builder builder = NodeGraph.builder(false).addNodes(3);
        assertTrue(builder.addEdge(2, 0));
        assertFalse(builder.addEdge(0, 2));
        NodeGraph graph = builder.build();

        assertEquals(1, graph.edgeCount());
        Edge edge = graph.edges().get(0);
        assertEquals(0, edge.source());
        assertEquals(2, edge.target());
        assertEquals(0, edge.other(2));
        assertTrue(graph.hasEdge(2, 0));
        assertEquals(1, graph.degree(2));
    }

    @Test
    public void testFirstEdgeForPairWins() {
        NodeGraph.Builder builder = NodeGraph.builder(true).addNodes(2);
        assertTrue(builder.addEdge(0, 1, EdgeType.PARENT_CHILD, Map.of("w", 1)));
        assertFalse(builder.addEdge(0, 1, EdgeType.SIBLING, Map.of("w", 2)));
        assertTrue(builder.addEdge(1, 0, EdgeType.SIBLING, Map.of()));
        NodeGraph graph = builder.build();

        assertEquals(2, graph.edgeCount());
        assertEquals(1, graph.edge(0, 1).orElseThrow().attribute("w"));
        assertEquals("parent-child", graph.edge(0, 1).orElseThrow().attribute(Edge.EDGE_TYPE));
    }

    @Test
    public void testRejectsSelfLoopsAndUnknownNodes() {
        NodeGraph.Builder builder = NodeGraph.builder(true).addNodes(2);

        assertThrows(IllegalArgumentException.class, () -> builder.addEdge(1, 1));
        assertThrows(IndexOutOfBoundsException.class, () -> builder.addEdge(0, 2));
        assertThrows(IndexOutOfBoundsException.class, () -> builder.build().successors(5));
    }

    @Test
    public void testNodeAttributesAreCopied() {
        NodeGraph.Builder builder = NodeGraph.builder(true);
        int node = builder.addNode(Map.of("type", "call"));
        NodeGraph graph = builder.build();

        assertEquals(0, node);
        assertEquals("call", graph.nodeAttributes(0).get("type"));
        assertTrue(graph.edge(0, 0).isEmpty());
    }
}
