package com.treeq.analytics;

/**
 * Bounds for simple-path enumeration, which is exponential in the worst case.
 *
 * @param maxDepth longest path considered, in edges
 * @param maxPaths most paths returned before the enumeration gives up
 */
public record PathBudget(int maxDepth, int maxPaths) {
    public PathBudget {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1: " + maxDepth);
        }
        if (maxPaths < 1) {
            throw new IllegalArgumentException("maxPaths must be at least 1: " + maxPaths);
        }
    }

    public static PathBudget of(int maxDepth, int maxPaths) {
        return new PathBudget(maxDepth, maxPaths);
    }
}
