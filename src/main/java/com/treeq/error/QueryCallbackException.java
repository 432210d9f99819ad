package com.treeq.error;

import com.treeq.tree.SyntaxNode;

/**
 * A caller-supplied predicate, mapping or key function failed on a node.
 */
public class QueryCallbackException extends TreeQueryException {
    private final transient SyntaxNode node;

    public QueryCallbackException(String operation, SyntaxNode node, Throwable cause) {
        super(operation + " failed on " + node + ": " + cause.getMessage(), cause);
        this.node = node;
    }

    public SyntaxNode node() {
        return node;
    }
}
