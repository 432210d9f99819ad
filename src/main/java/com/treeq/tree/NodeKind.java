package com.treeq.tree;

import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Sets;

/**
 * Discriminator attached to every node: a tag plus the capabilities the node offers.
 * Kind predicates compare tags instead of relying on subclassing.
 */
public record NodeKind(String tag, ImmutableSet<String> capabilities) {
    public NodeKind {
        if (tag == null || tag.isEmpty()) {
            throw new IllegalArgumentException("Kind tag must not be empty");
        }
        capabilities = capabilities == null ? Sets.immutable.empty() : capabilities;
    }

    public static NodeKind of(String tag, String... capabilities) {
        return new NodeKind(tag, Sets.immutable.with(capabilities));
    }

    public boolean has(String capability) {
        return capabilities.contains(capability);
    }
}
