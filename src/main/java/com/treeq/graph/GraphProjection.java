package com.treeq.graph;

import com.treeq.tree.SyntaxNode;

/**
 * A projected graph together with the bijection between its indices and the nodes it
 * was built from.
 */
public record GraphProjection(NodeGraph graph, NodeIndex index) {
    public SyntaxNode node(int graphIndex) {
        return index.node(graphIndex);
    }

    public int indexOf(SyntaxNode node) {
        return index.indexOf(node);
    }
}
