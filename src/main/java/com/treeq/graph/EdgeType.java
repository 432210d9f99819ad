package com.treeq.graph;

/**
 * Origin of an edge in a projected graph.
 */
public enum EdgeType {
    PARENT_CHILD("parent-child"),
    SIBLING("sibling"),
    CUSTOM("custom");

    private final String label;

    EdgeType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
