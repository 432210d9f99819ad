package com.treeq.graph;

import com.treeq.tree.SyntaxNode;

import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * How a node collection is turned into a graph. The edge predicate is evaluated over all
 * ordered pairs; the callbacks may be null.
 */
public record ProjectionOptions(boolean directed,
                                boolean includeSiblings,
                                BiPredicate<SyntaxNode, SyntaxNode> edgePredicate,
                                Function<SyntaxNode, Map<String, Object>> nodeAttributes,
                                BiFunction<SyntaxNode, SyntaxNode, Map<String, Object>> edgeAttributes) {

    private static final ProjectionOptions DEFAULTS = new ProjectionOptions(true, false, null, null, null);

    public static ProjectionOptions defaults() {
        return DEFAULTS;
    }

    public ProjectionOptions withDirected(boolean value) {
        return new ProjectionOptions(value, includeSiblings, edgePredicate, nodeAttributes, edgeAttributes);
    }

    public ProjectionOptions withSiblings(boolean value) {
        return new ProjectionOptions(directed, value, edgePredicate, nodeAttributes, edgeAttributes);
    }

    public ProjectionOptions withEdgePredicate(BiPredicate<SyntaxNode, SyntaxNode> value) {
        return new ProjectionOptions(directed, includeSiblings, value, nodeAttributes, edgeAttributes);
    }

    public ProjectionOptions withNodeAttributes(Function<SyntaxNode, Map<String, Object>> value) {
        return new ProjectionOptions(directed, includeSiblings, edgePredicate, value, edgeAttributes);
    }

    public ProjectionOptions withEdgeAttributes(BiFunction<SyntaxNode, SyntaxNode, Map<String, Object>> value) {
        return new ProjectionOptions(directed, includeSiblings, edgePredicate, nodeAttributes, value);
    }
}
