package com.treeq.tree;

import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Immutable child to parent relation, keyed by structural identity.
 * Nodes never point at their parents; collections carry one of these instead.
 */
public final class ParentIndex {
    private static final ParentIndex EMPTY = new ParentIndex(Maps.immutable.empty());

    private final ImmutableMap<SyntaxNode, SyntaxNode> parents;

    private ParentIndex(ImmutableMap<SyntaxNode, SyntaxNode> parents) {
        this.parents = parents;
    }

    public static ParentIndex empty() {
        return EMPTY;
    }

    /**
     * Records the parent of every strict descendant of the given roots. The first
     * recorded parent of a node wins.
     */
    public static ParentIndex of(Iterable<SyntaxNode> roots) {
        MutableMap<SyntaxNode, SyntaxNode> parents = Maps.mutable.empty();
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        for (SyntaxNode root : roots) {
            stack.push(root);
        }
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            for (SyntaxNode child : node.children()) {
                if (!parents.containsKey(child)) {
                    parents.put(child, node);
                    stack.push(child);
                }
            }
        }
        return parents.isEmpty() ? EMPTY : new ParentIndex(parents.toImmutable());
    }

    static ParentIndex fromMap(MutableMap<SyntaxNode, SyntaxNode> parents) {
        return parents.isEmpty() ? EMPTY : new ParentIndex(parents.toImmutable());
    }

    public Optional<SyntaxNode> parentOf(SyntaxNode node) {
        return Optional.ofNullable(parents.get(node));
    }

    public boolean hasParent(SyntaxNode node) {
        return parents.containsKey(node);
    }

    public int depthOf(SyntaxNode node) {
        int depth = 0;
        SyntaxNode current = parents.get(node);
        while (current != null) {
            depth++;
            current = parents.get(current);
        }
        return depth;
    }

    /**
     * Union of both relations; entries of this index win on conflict.
     */
    public ParentIndex merge(ParentIndex other) {
        if (other.parents.isEmpty() || other == this) {
            return this;
        }
        if (parents.isEmpty()) {
            return other;
        }
        MutableMap<SyntaxNode, SyntaxNode> merged = Maps.mutable.ofMap(other.parents.castToMap());
        merged.putAll(parents.castToMap());
        return new ParentIndex(merged.toImmutable());
    }

    public int size() {
        return parents.size();
    }
}
