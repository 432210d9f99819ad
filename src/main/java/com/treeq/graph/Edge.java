package com.treeq.graph;

import org.eclipse.collections.api.map.ImmutableMap;

/**
 * Edge between two graph indices. In undirected graphs {@code source < target}.
 */
public record Edge(int source, int target, EdgeType type, ImmutableMap<String, Object> attributes) {
    public static final String EDGE_TYPE = "edgeType";

    public Object attribute(String key) {
        return attributes.get(key);
    }

    public int other(int endpoint) {
        return endpoint == source ? target : source;
    }
}
