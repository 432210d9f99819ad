package com.treeq.graph;

import com.treeq.error.InvalidGraphOperationException;
import com.treeq.query.NodeCollection;
import com.treeq.tree.ParentIndex;
import com.treeq.tree.SyntaxNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.impl.factory.primitive.IntLists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Projects a node collection into a {@link NodeGraph}.
 *
 * <p>Indices follow the collection's materialized order. Edges come from, in order: recorded
 * parent to child relations between present nodes, sibling chains (optional) and the
 * caller's edge predicate (optional). A pair joined by an earlier rule keeps that edge.
 */
public class GraphBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(GraphBuilder.class);

    public static final String TYPE = "type";
    public static final String TEXT = "text";
    public static final String START_BYTE = "startByte";
    public static final String END_BYTE = "endByte";
    public static final String DEPTH = "depth";
    public static final String KIND = "kind";

    private final NodeCollection collection;

    public GraphBuilder(NodeCollection collection) {
        this.collection = collection;
    }

    public GraphProjection build(ProjectionOptions options) {
        ImmutableList<SyntaxNode> nodes = collection.toList();
        ParentIndex parents = collection.parents();
        NodeIndex index = new NodeIndex(nodes);
        NodeGraph.Builder graph = NodeGraph.builder(options.directed());

        for (int i = 0; i < nodes.size(); i++) {
            graph.addNode(nodeAttributes(i, nodes.get(i), parents, options));
        }

        int parentEdges = 0;
        for (int i = 0; i < nodes.size(); i++) {
            Optional<SyntaxNode> parent = parents.parentOf(nodes.get(i));
            int parentIndex = parent.map(index::indexOf).orElse(-1);
            if (parentIndex >= 0 && addEdge(graph, nodes, parentIndex, i, EdgeType.PARENT_CHILD, options)) {
                parentEdges++;
            }
        }

        int siblingEdges = options.includeSiblings() ? addSiblingChains(graph, nodes, parents, options) : 0;
        int customEdges = options.edgePredicate() != null ? addPredicateEdges(graph, nodes, options) : 0;

        LOGGER.debug("Projected {} nodes: {} parent, {} sibling, {} custom edges",
            nodes.size(), parentEdges, siblingEdges, customEdges);
        return new GraphProjection(graph.build(), index);
    }

    private Map<String, Object> nodeAttributes(int i, SyntaxNode node, ParentIndex parents, ProjectionOptions options) {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put(TYPE, node.type());
        attributes.put(TEXT, node.text());
        attributes.put(START_BYTE, node.startByte());
        attributes.put(END_BYTE, node.endByte());
        attributes.put(DEPTH, parents.depthOf(node));
        attributes.put(KIND, node.kind().tag());
        if (options.nodeAttributes() != null) {
            Map<String, Object> extra;
            try {
                extra = options.nodeAttributes().apply(node);
            } catch (RuntimeException e) {
                throw new InvalidGraphOperationException("Node attribute function failed", i, -1, e);
            }
            if (extra == null) {
                throw new InvalidGraphOperationException("Node attribute function returned null", i, -1);
            }
            attributes.putAll(extra);
        }
        return attributes;
    }

    private int addSiblingChains(NodeGraph.Builder graph, ImmutableList<SyntaxNode> nodes,
                                 ParentIndex parents, ProjectionOptions options) {
        Map<SyntaxNode, MutableIntList> byParent = new LinkedHashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            int child = i;
            parents.parentOf(nodes.get(i))
                .ifPresent(parent -> byParent.computeIfAbsent(parent, p -> IntLists.mutable.empty()).add(child));
        }
        int added = 0;
        for (MutableIntList children : byParent.values()) {
            List<Integer> ordered = new ArrayList<>();
            for (int k = 0; k < children.size(); k++) {
                ordered.add(children.get(k));
            }
            ordered.sort(Comparator.<Integer>comparingInt(c -> nodes.get(c).startByte()).thenComparingInt(c -> c));
            for (int k = 1; k < ordered.size(); k++) {
                if (addEdge(graph, nodes, ordered.get(k - 1), ordered.get(k), EdgeType.SIBLING, options)) {
                    added++;
                }
            }
        }
        return added;
    }

    private int addPredicateEdges(NodeGraph.Builder graph, ImmutableList<SyntaxNode> nodes, ProjectionOptions options) {
        int added = 0;
        for (int i = 0; i < nodes.size(); i++) {
            for (int j = options.directed() ? 0 : i + 1; j < nodes.size(); j++) {
                if (i == j) {
                    continue;
                }
                boolean holds;
                try {
                    holds = options.edgePredicate().test(nodes.get(i), nodes.get(j));
                } catch (RuntimeException e) {
                    throw new InvalidGraphOperationException("Edge predicate failed", i, j, e);
                }
                if (holds && addEdge(graph, nodes, i, j, EdgeType.CUSTOM, options)) {
                    added++;
                }
            }
        }
        return added;
    }

    private boolean addEdge(NodeGraph.Builder graph, ImmutableList<SyntaxNode> nodes,
                            int source, int target, EdgeType type, ProjectionOptions options) {
        if (graph.hasEdge(source, target)) {
            return false;
        }
        Map<String, Object> attributes = Map.of();
        if (options.edgeAttributes() != null) {
            try {
                attributes = options.edgeAttributes().apply(nodes.get(source), nodes.get(target));
            } catch (RuntimeException e) {
                throw new InvalidGraphOperationException("Edge attribute function failed", source, target, e);
            }
            if (attributes == null) {
                throw new InvalidGraphOperationException("Edge attribute function returned null", source, target);
            }
        }
        return graph.addEdge(source, target, type, attributes);
    }
}
