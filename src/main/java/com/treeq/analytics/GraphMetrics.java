package com.treeq.analytics;

/**
 * Summary of a graph. Density is edges over the maximum possible given directedness.
 */
public record GraphMetrics(int nodeCount, int edgeCount, double density, int componentCount,
                           boolean connected, boolean acyclic) {
}
