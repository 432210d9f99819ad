package com.treeq.match;

import com.treeq.graph.Edge;
import com.treeq.graph.GraphBuilder;

import java.util.Objects;

/**
 * Common node and edge matchers.
 */
public final class Matchers {
    private Matchers() {
    }

    public static NodeMatcher anyNode() {
        return (pattern, target) -> true;
    }

    public static EdgeMatcher anyEdge() {
        return (pattern, target) -> true;
    }

    /**
     * Nodes match when their grammar types are equal. A pattern node without a type
     * matches anything.
     */
    public static NodeMatcher sameType() {
        return attributeEquals(GraphBuilder.TYPE);
    }

    /**
     * Pattern nodes match target nodes carrying the same value for {@code key}; pattern
     * nodes without the key match anything.
     */
    public static NodeMatcher attributeEquals(String key) {
        return (pattern, target) -> !pattern.containsKey(key) || Objects.equals(pattern.get(key), target.get(key));
    }

    public static EdgeMatcher sameEdgeType() {
        return (pattern, target) -> Objects.equals(pattern.get(Edge.EDGE_TYPE), target.get(Edge.EDGE_TYPE));
    }
}
