package com.treeq.query;

import com.treeq.error.IdentityInconsistencyException;
import com.treeq.error.QueryCallbackException;
import com.treeq.graph.GraphBuilder;
import com.treeq.graph.GraphProjection;
import com.treeq.graph.ProjectionOptions;
import com.treeq.predicate.NodePredicate;
import com.treeq.tree.ParentIndex;
import com.treeq.tree.SyntaxNode;
import com.treeq.tree.SyntaxTree;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Persistent, lazily filtered set of syntax nodes.
 *
 * <p>{@link #filter} only queues a predicate; the queue is applied conjunctively, in order,
 * whenever the collection is materialized ({@link #toList}, {@link #count}, {@link #first},
 * iteration). Materialization never changes the collection and can be repeated. Members are
 * deduplicated by structural identity and keep insertion order. Every operation returns a
 * new collection.
 */
public final class NodeCollection implements Iterable<SyntaxNode> {
    private static final Logger LOGGER = LoggerFactory.getLogger(NodeCollection.class);
    private static final NodeCollection EMPTY =
        new NodeCollection(Lists.immutable.empty(), Lists.immutable.empty(), ParentIndex.empty());

    private final ImmutableList<SyntaxNode> nodes;
    private final ImmutableList<NodePredicate> pending;
    private final ParentIndex parents;

    private NodeCollection(ImmutableList<SyntaxNode> nodes, ImmutableList<NodePredicate> pending, ParentIndex parents) {
        this.nodes = nodes;
        this.pending = pending;
        this.parents = parents;
    }

    public static NodeCollection empty() {
        return EMPTY;
    }

    public static NodeCollection fromTree(SyntaxTree tree) {
        // Zero-width nodes can repeat structurally within one tree
        return new NodeCollection(distinct(tree.preOrder()), Lists.immutable.empty(), tree.parentIndex());
    }

    public static NodeCollection fromTree(SyntaxNode root) {
        return fromTree(new SyntaxTree(root));
    }

    public static NodeCollection of(SyntaxNode... nodes) {
        return of(Lists.immutable.with(nodes));
    }

    /**
     * Collection over an explicit node list. Parent relations are recorded for every node
     * reachable below the listed ones.
     */
    public static NodeCollection of(Iterable<SyntaxNode> nodes) {
        ImmutableList<SyntaxNode> distinct = distinct(nodes);
        if (distinct.isEmpty()) {
            return EMPTY;
        }
        return new NodeCollection(distinct, Lists.immutable.empty(), ParentIndex.of(distinct));
    }

    private static ImmutableList<SyntaxNode> distinct(Iterable<SyntaxNode> nodes) {
        Set<SyntaxNode> seen = new LinkedHashSet<>();
        for (SyntaxNode node : nodes) {
            if (node == null) {
                throw new IllegalArgumentException("Collections cannot hold null nodes");
            }
            if (seen.add(node) && !seen.contains(node)) {
                throw new IdentityInconsistencyException("Node " + node + " is not found after insertion");
            }
        }
        return Lists.immutable.withAll(seen);
    }

    // ---- lazy filtering ----

    public NodeCollection filter(NodePredicate predicate) {
        return new NodeCollection(nodes, pending.newWith(predicate), parents);
    }

    public NodeCollection filterType(String typeName) {
        return filter(NodePredicate.type(typeName));
    }

    public NodeCollection filterText(String text, boolean exact) {
        return filter(exact ? NodePredicate.text(text) : NodePredicate.textContains(text));
    }

    public NodeCollection filterKind(String tag) {
        return filter(NodePredicate.kind(tag));
    }

    public NodeCollection where(Predicate<SyntaxNode> test) {
        return filter(NodePredicate.of(test));
    }

    public int pendingFilters() {
        return pending.size();
    }

    public ParentIndex parents() {
        return parents;
    }

    // ---- materialization ----

    private boolean survives(SyntaxNode node) {
        for (NodePredicate predicate : pending) {
            if (!predicate.matches(node)) {
                return false;
            }
        }
        return true;
    }

    public Stream<SyntaxNode> stream() {
        return nodes.castToList().stream().filter(this::survives);
    }

    public ImmutableList<SyntaxNode> toList() {
        if (pending.isEmpty()) {
            return nodes;
        }
        ImmutableList<SyntaxNode> result = nodes.select(this::survives);
        LOGGER.debug("Materialized {} of {} nodes through {} filters", result.size(), nodes.size(), pending.size());
        return result;
    }

    @Override
    public Iterator<SyntaxNode> iterator() {
        return stream().iterator();
    }

    public int count() {
        return pending.isEmpty() ? nodes.size() : nodes.count(this::survives);
    }

    public int count(NodePredicate predicate) {
        return filter(predicate).count();
    }

    public Optional<SyntaxNode> first() {
        return Optional.ofNullable(nodes.detect(this::survives));
    }

    public Optional<SyntaxNode> findFirst(NodePredicate predicate) {
        return filter(predicate).first();
    }

    public ImmutableList<SyntaxNode> findAll(NodePredicate predicate) {
        return filter(predicate).toList();
    }

    public boolean isEmpty() {
        return first().isEmpty();
    }

    public boolean contains(SyntaxNode node) {
        return nodes.contains(node) && survives(node);
    }

    public NodeCollection materialize() {
        return pending.isEmpty() ? this : new NodeCollection(toList(), Lists.immutable.empty(), parents);
    }

    // ---- set algebra, all by structural identity ----

    public NodeCollection union(NodeCollection other) {
        Set<SyntaxNode> result = new LinkedHashSet<>(toList().castToList());
        result.addAll(other.toList().castToList());
        return combined(result, other);
    }

    public NodeCollection intersection(NodeCollection other) {
        Set<SyntaxNode> right = new LinkedHashSet<>(other.toList().castToList());
        Set<SyntaxNode> result = new LinkedHashSet<>();
        for (SyntaxNode node : toList()) {
            if (right.contains(node)) {
                result.add(node);
            }
        }
        return combined(result, other);
    }

    public NodeCollection difference(NodeCollection other) {
        Set<SyntaxNode> result = new LinkedHashSet<>(toList().castToList());
        result.removeAll(new LinkedHashSet<>(other.toList().castToList()));
        return combined(result, other);
    }

    public NodeCollection symmetricDifference(NodeCollection other) {
        Set<SyntaxNode> left = new LinkedHashSet<>(toList().castToList());
        Set<SyntaxNode> right = new LinkedHashSet<>(other.toList().castToList());
        Set<SyntaxNode> result = new LinkedHashSet<>();
        for (SyntaxNode node : left) {
            if (!right.contains(node)) {
                result.add(node);
            }
        }
        for (SyntaxNode node : right) {
            if (!left.contains(node)) {
                result.add(node);
            }
        }
        return combined(result, other);
    }

    private NodeCollection combined(Set<SyntaxNode> members, NodeCollection other) {
        return new NodeCollection(distinct(members), Lists.immutable.empty(), parents.merge(other.parents));
    }

    // ---- transformation ----

    public NodeCollection map(Function<SyntaxNode, SyntaxNode> mapper) {
        MutableList<SyntaxNode> mapped = Lists.mutable.empty();
        for (SyntaxNode node : toList()) {
            SyntaxNode result = apply("map", mapper, node);
            if (result == null) {
                throw new QueryCallbackException("map", node, new NullPointerException("mapper returned null"));
            }
            mapped.add(result);
        }
        return of(mapped);
    }

    /**
     * Maps every node and drops the nodes for which the function has no value.
     */
    public NodeCollection transform(Function<SyntaxNode, Optional<SyntaxNode>> transformer) {
        MutableList<SyntaxNode> transformed = Lists.mutable.empty();
        for (SyntaxNode node : toList()) {
            Optional<SyntaxNode> result = apply("transform", transformer, node);
            if (result == null) {
                throw new QueryCallbackException("transform", node, new NullPointerException("transformer returned null"));
            }
            result.ifPresent(transformed::add);
        }
        return of(transformed);
    }

    /**
     * Partitions the materialized nodes by key. Groups appear in order of their first
     * member; members keep collection order.
     */
    public <K> Map<K, NodeCollection> groupBy(Function<SyntaxNode, K> keyFunction) {
        Map<K, MutableList<SyntaxNode>> groups = new LinkedHashMap<>();
        for (SyntaxNode node : toList()) {
            K key = apply("groupBy", keyFunction, node);
            groups.computeIfAbsent(key, k -> Lists.mutable.empty()).add(node);
        }
        Map<K, NodeCollection> result = new LinkedHashMap<>();
        groups.forEach((key, members) ->
            result.put(key, new NodeCollection(members.toImmutable(), Lists.immutable.empty(), parents)));
        return Collections.unmodifiableMap(result);
    }

    private static <R> R apply(String operation, Function<SyntaxNode, R> function, SyntaxNode node) {
        try {
            return function.apply(node);
        } catch (QueryCallbackException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new QueryCallbackException(operation, node, e);
        }
    }

    // ---- traversal ----

    /**
     * Strict descendants of every member, in pre-order, first occurrence kept.
     */
    public NodeCollection descendants() {
        MutableList<SyntaxNode> found = Lists.mutable.empty();
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        for (SyntaxNode node : toList()) {
            ImmutableList<SyntaxNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
            while (!stack.isEmpty()) {
                SyntaxNode current = stack.pop();
                found.add(current);
                ImmutableList<SyntaxNode> below = current.children();
                for (int i = below.size() - 1; i >= 0; i--) {
                    stack.push(below.get(i));
                }
            }
        }
        return new NodeCollection(distinct(found), Lists.immutable.empty(), parents.merge(ParentIndex.of(toList())));
    }

    /**
     * Other children of {@code of}'s recorded parent that are members of this collection,
     * in start-byte order. Empty when no parent is recorded for {@code of}.
     */
    public NodeCollection siblings(SyntaxNode of) {
        Optional<SyntaxNode> parent = parents.parentOf(of);
        if (parent.isEmpty()) {
            return EMPTY;
        }
        Set<SyntaxNode> members = new LinkedHashSet<>(toList().castToList());
        MutableList<SyntaxNode> siblings = Lists.mutable.empty();
        for (SyntaxNode child : parent.get().children()) {
            if (!child.equals(of) && members.contains(child)) {
                siblings.add(child);
            }
        }
        return new NodeCollection(distinct(siblings), Lists.immutable.empty(), parents);
    }

    // ---- graph projection ----

    public GraphProjection toGraph(ProjectionOptions options) {
        return new GraphBuilder(this).build(options);
    }

    public GraphProjection toGraph() {
        return toGraph(ProjectionOptions.defaults());
    }

    @Override
    public String toString() {
        return "NodeCollection[" + nodes.size() + " nodes, " + pending.size() + " pending filters]";
    }
}
