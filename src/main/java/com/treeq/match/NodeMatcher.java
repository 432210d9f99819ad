package com.treeq.match;

import org.eclipse.collections.api.map.ImmutableMap;

/**
 * Decides whether a target node may stand in for a pattern node, given both attribute maps.
 */
@FunctionalInterface
public interface NodeMatcher {
    boolean matches(ImmutableMap<String, Object> patternNode, ImmutableMap<String, Object> targetNode);
}
