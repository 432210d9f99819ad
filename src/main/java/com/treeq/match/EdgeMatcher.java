package com.treeq.match;

import org.eclipse.collections.api.map.ImmutableMap;

/**
 * Decides whether a target edge may stand in for a pattern edge, given both attribute maps.
 */
@FunctionalInterface
public interface EdgeMatcher {
    boolean matches(ImmutableMap<String, Object> patternEdge, ImmutableMap<String, Object> targetEdge);
}
