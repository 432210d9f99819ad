package com.treeq.tree;

import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Maps;

/**
 * Immutable mapping from grammar type name to the factory that builds (and validates) the
 * kind of nodes of that type. Built once and handed to whoever constructs nodes.
 */
public final class NodeKindRegistry {
    private static final NodeKindRegistry EMPTY = new NodeKindRegistry(Maps.immutable.empty());

    private final ImmutableMap<String, NodeKindFactory> factories;

    private NodeKindRegistry(ImmutableMap<String, NodeKindFactory> factories) {
        this.factories = factories;
    }

    public static NodeKindRegistry empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the kind for {@code node}; unregistered types get a kind tagged with the type name.
     */
    public NodeKind kindFor(SyntaxNode node) {
        NodeKindFactory factory = factories.get(node.type());
        if (factory == null) {
            return NodeKind.of(node.type());
        }
        NodeKind kind = factory.kindFor(node);
        if (kind == null) {
            throw new IllegalArgumentException("Kind factory for " + node.type() + " returned null");
        }
        return kind;
    }

    public boolean isRegistered(String type) {
        return factories.containsKey(type);
    }

    public int size() {
        return factories.size();
    }

    public static final class Builder {
        private final MutableMap<String, NodeKindFactory> factories = Maps.mutable.empty();

        private Builder() {
        }

        public Builder register(String type, NodeKindFactory factory) {
            if (factories.containsKey(type)) {
                throw new IllegalArgumentException("Kind already registered for " + type);
            }
            factories.put(type, factory);
            return this;
        }

        public Builder register(String type, String tag, String... capabilities) {
            NodeKind kind = NodeKind.of(tag, capabilities);
            return register(type, node -> kind);
        }

        public NodeKindRegistry build() {
            return new NodeKindRegistry(factories.toImmutable());
        }
    }
}
