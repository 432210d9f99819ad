package com.treeq.graph;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.list.primitive.ImmutableIntList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.map.primitive.ImmutableLongIntMap;
import org.eclipse.collections.api.map.primitive.MutableLongIntMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.primitive.IntLists;
import org.eclipse.collections.impl.factory.primitive.LongIntMaps;

import java.util.Map;
import java.util.Optional;

/**
 * Immutable abstract graph over dense indices {@code [0, nodeCount)}.
 *
 * <p>Holds at most one edge per node pair (per ordered pair when directed) and no
 * self-loops. Nodes and edges carry attribute maps that matchers and analytics can read.
 */
public final class NodeGraph {
    private final boolean directed;
    private final ImmutableList<ImmutableMap<String, Object>> nodeAttributes;
    private final ImmutableList<Edge> edges;
    private final ImmutableLongIntMap edgeLookup;
    private final ImmutableIntList[] successors;
    private final ImmutableIntList[] predecessors;
    private final ImmutableIntList[] neighbors;

    private NodeGraph(boolean directed, ImmutableList<ImmutableMap<String, Object>> nodeAttributes,
                      ImmutableList<Edge> edges, ImmutableLongIntMap edgeLookup) {
        this.directed = directed;
        this.nodeAttributes = nodeAttributes;
        this.edges = edges;
        this.edgeLookup = edgeLookup;

        int n = nodeAttributes.size();
        MutableIntList[] out = new MutableIntList[n];
        MutableIntList[] in = new MutableIntList[n];
        for (int i = 0; i < n; i++) {
            out[i] = IntLists.mutable.empty();
            in[i] = IntLists.mutable.empty();
        }
        for (Edge edge : edges) {
            out[edge.source()].add(edge.target());
            in[edge.target()].add(edge.source());
            if (!directed) {
                out[edge.target()].add(edge.source());
                in[edge.source()].add(edge.target());
            }
        }
        this.successors = new ImmutableIntList[n];
        this.predecessors = new ImmutableIntList[n];
        this.neighbors = new ImmutableIntList[n];
        for (int i = 0; i < n; i++) {
            successors[i] = out[i].sortThis().toImmutable();
            predecessors[i] = in[i].sortThis().toImmutable();
            neighbors[i] = directed
                ? out[i].withAll(in[i]).distinct().sortThis().toImmutable()
                : successors[i];
        }
    }

    public static Builder builder(boolean directed) {
        return new Builder(directed);
    }

    public boolean isDirected() {
        return directed;
    }

    public int nodeCount() {
        return nodeAttributes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public ImmutableList<Edge> edges() {
        return edges;
    }

    public ImmutableMap<String, Object> nodeAttributes(int node) {
        checkNode(node);
        return nodeAttributes.get(node);
    }

    // Ascending; undirected graphs list every neighbour here and in predecessors
    public ImmutableIntList successors(int node) {
        checkNode(node);
        return successors[node];
    }

    public ImmutableIntList predecessors(int node) {
        checkNode(node);
        return predecessors[node];
    }

    public ImmutableIntList neighbors(int node) {
        checkNode(node);
        return neighbors[node];
    }

    public int outDegree(int node) {
        return successors(node).size();
    }

    public int inDegree(int node) {
        return predecessors(node).size();
    }

    public int degree(int node) {
        return directed ? outDegree(node) + inDegree(node) : successors(node).size();
    }

    public boolean hasEdge(int source, int target) {
        return edge(source, target).isPresent();
    }

    public Optional<Edge> edge(int source, int target) {
        checkNode(source);
        checkNode(target);
        int position = edgeLookup.getIfAbsent(key(directed, source, target), -1);
        return position < 0 ? Optional.empty() : Optional.of(edges.get(position));
    }

    private void checkNode(int node) {
        if (node < 0 || node >= nodeAttributes.size()) {
            throw new IndexOutOfBoundsException("No node " + node + " in graph of " + nodeAttributes.size());
        }
    }

    private static long key(boolean directed, int source, int target) {
        if (!directed && source > target) {
            return ((long) target << 32) | source;
        }
        return ((long) source << 32) | target;
    }

    public static final class Builder {
        private final boolean directed;
        private final MutableList<ImmutableMap<String, Object>> nodeAttributes = Lists.mutable.empty();
        private final MutableList<Edge> edges = Lists.mutable.empty();
        private final MutableLongIntMap lookup = LongIntMaps.mutable.empty();

        private Builder(boolean directed) {
            this.directed = directed;
        }

        public int addNode() {
            return addNode(Map.of());
        }

        public int addNode(Map<String, Object> attributes) {
            nodeAttributes.add(Maps.mutable.<String, Object>ofMap(attributes).toImmutable());
            return nodeAttributes.size() - 1;
        }

        public Builder addNodes(int count) {
            for (int i = 0; i < count; i++) {
                addNode();
            }
            return this;
        }

        public boolean addEdge(int source, int target) {
            return addEdge(source, target, EdgeType.CUSTOM, Map.of());
        }

        /**
         * Adds an edge unless the pair is already joined. Returns whether the edge was added.
         */
        public boolean addEdge(int source, int target, EdgeType type, Map<String, Object> attributes) {
            int n = nodeAttributes.size();
            if (source < 0 || source >= n || target < 0 || target >= n) {
                throw new IndexOutOfBoundsException("Edge (" + source + ", " + target + ") outside graph of " + n);
            }
            if (source == target) {
                throw new IllegalArgumentException("Self-loop on node " + source);
            }
            long key = key(directed, source, target);
            if (lookup.containsKey(key)) {
                return false;
            }
            lookup.put(key, edges.size());
            MutableMap<String, Object> merged = Maps.mutable.<String, Object>with(Edge.EDGE_TYPE, type.label());
            merged.putAll(attributes);
            int from = !directed && source > target ? target : source;
            int to = !directed && source > target ? source : target;
            edges.add(new Edge(from, to, type, merged.toImmutable()));
            return true;
        }

        public boolean hasEdge(int source, int target) {
            return lookup.containsKey(key(directed, source, target));
        }

        public NodeGraph build() {
            return new NodeGraph(directed, nodeAttributes.toImmutable(), edges.toImmutable(), lookup.toImmutable());
        }
    }
}
