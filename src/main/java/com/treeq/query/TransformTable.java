package com.treeq.query;

import com.treeq.tree.SyntaxNode;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Optional;
import java.util.function.Function;

/**
 * Dispatch table from grammar type to a node transformation. Types without an entry go
 * through the fallback, which keeps the node unchanged unless configured otherwise.
 * Intended as the argument of {@link NodeCollection#transform}.
 */
public final class TransformTable implements Function<SyntaxNode, Optional<SyntaxNode>> {
    private final ImmutableMap<String, Function<SyntaxNode, Optional<SyntaxNode>>> handlers;
    private final Function<SyntaxNode, Optional<SyntaxNode>> fallback;

    private TransformTable(ImmutableMap<String, Function<SyntaxNode, Optional<SyntaxNode>>> handlers,
                           Function<SyntaxNode, Optional<SyntaxNode>> fallback) {
        this.handlers = handlers;
        this.fallback = fallback;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<SyntaxNode> apply(SyntaxNode node) {
        return handlers.getIfAbsentValue(node.type(), fallback).apply(node);
    }

    public boolean handles(String type) {
        return handlers.containsKey(type);
    }

    public static final class Builder {
        private final MutableMap<String, Function<SyntaxNode, Optional<SyntaxNode>>> handlers = Maps.mutable.empty();
        private Function<SyntaxNode, Optional<SyntaxNode>> fallback = Optional::of;

        private Builder() {
        }

        public Builder on(String type, Function<SyntaxNode, Optional<SyntaxNode>> handler) {
            if (handlers.containsKey(type)) {
                throw new IllegalArgumentException("Handler already defined for " + type);
            }
            handlers.put(type, handler);
            return this;
        }

        /**
         * Drops every node of {@code type}.
         */
        public Builder drop(String type) {
            return on(type, node -> Optional.empty());
        }

        public Builder otherwise(Function<SyntaxNode, Optional<SyntaxNode>> handler) {
            this.fallback = handler;
            return this;
        }

        public TransformTable build() {
            return new TransformTable(handlers.toImmutable(), fallback);
        }
    }
}
