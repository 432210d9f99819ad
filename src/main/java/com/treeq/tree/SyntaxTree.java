package com.treeq.tree;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.map.primitive.MutableObjectIntMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.primitive.IntLists;
import org.eclipse.collections.impl.factory.primitive.ObjectIntMaps;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Arena over a parsed tree: every node gets its pre-order position and parent relations
 * are held as indices, so nodes themselves stay free of back references.
 */
public final class SyntaxTree {
    private final ImmutableList<SyntaxNode> nodes;
    private final int[] parents;
    private final MutableObjectIntMap<SyntaxNode> positions;
    private final ParentIndex parentIndex;

    public SyntaxTree(SyntaxNode root) {
        MutableList<SyntaxNode> order = Lists.mutable.empty();
        MutableIntList parentOrder = IntLists.mutable.empty();
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        Deque<Integer> parentStack = new ArrayDeque<>();
        stack.push(root);
        parentStack.push(-1);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            int parent = parentStack.pop();
            int index = order.size();
            order.add(node);
            parentOrder.add(parent);
            ImmutableList<SyntaxNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
                parentStack.push(index);
            }
        }

        this.nodes = order.toImmutable();
        this.parents = new int[order.size()];
        this.positions = ObjectIntMaps.mutable.empty();
        MutableMap<SyntaxNode, SyntaxNode> parentMap = Maps.mutable.empty();
        for (int i = 0; i < parents.length; i++) {
            parents[i] = parentOrder.get(i);
            SyntaxNode node = nodes.get(i);
            if (!positions.containsKey(node)) {
                positions.put(node, i);
                if (parents[i] >= 0) {
                    parentMap.put(node, nodes.get(parents[i]));
                }
            }
        }
        this.parentIndex = ParentIndex.fromMap(parentMap);
    }

    public SyntaxNode root() {
        return nodes.get(0);
    }

    public int size() {
        return nodes.size();
    }

    public SyntaxNode node(int index) {
        return nodes.get(index);
    }

    /**
     * Pre-order index of the node's parent, or -1 for the root.
     */
    public int parentIndex(int index) {
        if (index < 0 || index >= parents.length) {
            throw new IndexOutOfBoundsException("No node at " + index);
        }
        return parents[index];
    }

    /**
     * Pre-order position of the first node structurally equal to {@code node}, or -1.
     */
    public int indexOf(SyntaxNode node) {
        return positions.getIfAbsent(node, -1);
    }

    public Optional<SyntaxNode> parentOf(SyntaxNode node) {
        int index = indexOf(node);
        if (index <= 0) {
            return Optional.empty();
        }
        return Optional.of(nodes.get(parents[index]));
    }

    public ImmutableList<SyntaxNode> preOrder() {
        return nodes;
    }

    public ParentIndex parentIndex() {
        return parentIndex;
    }
}
