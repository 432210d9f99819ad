package com.treeq.tree;

/**
 * Builds the {@link NodeKind} for a freshly read node of one grammar type.
 * Implementations may reject the node by throwing {@link IllegalArgumentException}.
 */
@FunctionalInterface
public interface NodeKindFactory {
    NodeKind kindFor(SyntaxNode node);
}
