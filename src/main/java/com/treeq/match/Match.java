package com.treeq.match;

import com.treeq.graph.NodeIndex;
import com.treeq.tree.SyntaxNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.primitive.ImmutableIntList;

import java.util.Map;
import java.util.TreeMap;

/**
 * One embedding of a pattern graph: {@code targets.get(p)} is the target index mapped to
 * pattern index {@code p}. Matches order lexicographically by target index, pattern index
 * by pattern index.
 */
public record Match(ImmutableIntList targets) implements Comparable<Match> {
    public int target(int patternIndex) {
        return targets.get(patternIndex);
    }

    public int size() {
        return targets.size();
    }

    public Map<Integer, Integer> asMap() {
        Map<Integer, Integer> mapping = new TreeMap<>();
        for (int p = 0; p < targets.size(); p++) {
            mapping.put(p, targets.get(p));
        }
        return mapping;
    }

    public ImmutableList<SyntaxNode> resolve(NodeIndex targetIndex) {
        return targets.collect(targetIndex::node);
    }

    @Override
    public int compareTo(Match other) {
        int shared = Math.min(size(), other.size());
        for (int p = 0; p < shared; p++) {
            int cmp = Integer.compare(targets.get(p), other.targets.get(p));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(size(), other.size());
    }

    @Override
    public String toString() {
        return asMap().toString();
    }
}
