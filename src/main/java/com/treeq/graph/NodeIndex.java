package com.treeq.graph;

import com.treeq.error.IdentityInconsistencyException;
import com.treeq.tree.SyntaxNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.primitive.ImmutableObjectIntMap;
import org.eclipse.collections.api.map.primitive.MutableObjectIntMap;
import org.eclipse.collections.impl.factory.primitive.ObjectIntMaps;

/**
 * Bijection between the dense indices {@code [0, size)} of a projected graph and the nodes
 * present when it was built.
 */
public final class NodeIndex {
    private final ImmutableList<SyntaxNode> nodes;
    private final ImmutableObjectIntMap<SyntaxNode> indices;

    public NodeIndex(ImmutableList<SyntaxNode> nodes) {
        MutableObjectIntMap<SyntaxNode> positions = ObjectIntMaps.mutable.empty();
        for (int i = 0; i < nodes.size(); i++) {
            SyntaxNode node = nodes.get(i);
            if (positions.containsKey(node)) {
                throw new IdentityInconsistencyException("Node " + node + " appears at index "
                    + positions.get(node) + " and " + i);
            }
            positions.put(node, i);
        }
        this.nodes = nodes;
        this.indices = positions.toImmutable();
    }

    public SyntaxNode node(int index) {
        if (index < 0 || index >= nodes.size()) {
            throw new IndexOutOfBoundsException("No node at index " + index);
        }
        return nodes.get(index);
    }

    // -1 when absent
    public int indexOf(SyntaxNode node) {
        return indices.getIfAbsent(node, -1);
    }

    public boolean contains(SyntaxNode node) {
        return indices.containsKey(node);
    }

    public int size() {
        return nodes.size();
    }

    public ImmutableList<SyntaxNode> nodes() {
        return nodes;
    }
}
