package com.treeq.analytics;

import com.treeq.error.ResourceExhaustedException;
import com.treeq.graph.NodeGraph;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.list.primitive.ImmutableDoubleList;
import org.eclipse.collections.api.list.primitive.ImmutableIntList;
import org.eclipse.collections.api.list.primitive.MutableIntList;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.primitive.DoubleLists;
import org.eclipse.collections.impl.factory.primitive.IntLists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Path, cycle, component and centrality computations over a projected graph.
 *
 * <p>Traversals follow edge direction on directed graphs; components are weak. Every
 * result lists node indices in ascending order unless it is a path.
 */
public class GraphAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(GraphAnalyzer.class);

    private final NodeGraph graph;

    public GraphAnalyzer(NodeGraph graph) {
        this.graph = graph;
    }

    /**
     * Fewest-edges path from {@code source} to {@code target} by breadth-first search,
     * O(V+E). Ties are broken towards lower indices.
     */
    public Optional<ImmutableIntList> shortestPath(int source, int target) {
        checkNode(source);
        checkNode(target);
        int n = graph.nodeCount();
        int[] previous = new int[n];
        Arrays.fill(previous, -1);
        boolean[] seen = new boolean[n];
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(source);
        seen[source] = true;
        while (!queue.isEmpty()) {
            int current = queue.poll();
            if (current == target) {
                MutableIntList path = IntLists.mutable.empty();
                for (int at = target; at != -1; at = previous[at]) {
                    path.add(at);
                }
                return Optional.of(path.reverseThis().toImmutable());
            }
            ImmutableIntList next = graph.successors(current);
            for (int i = 0; i < next.size(); i++) {
                int neighbor = next.get(i);
                if (!seen[neighbor]) {
                    seen[neighbor] = true;
                    previous[neighbor] = current;
                    queue.add(neighbor);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Every simple path from {@code source} to {@code target} with at most
     * {@code budget.maxDepth()} edges. The count of such paths can be exponential; finding
     * more than {@code budget.maxPaths()} raises {@link ResourceExhaustedException}.
     */
    public ImmutableList<ImmutableIntList> allSimplePaths(int source, int target, PathBudget budget) {
        checkNode(source);
        checkNode(target);
        MutableList<ImmutableIntList> paths = Lists.mutable.empty();
        if (source == target) {
            return paths.toImmutable();
        }
        boolean[] onPath = new boolean[graph.nodeCount()];
        MutableIntList path = IntLists.mutable.with(source);
        onPath[source] = true;
        collectPaths(source, target, budget, path, onPath, paths);
        return paths.toImmutable();
    }

    private void collectPaths(int current, int target, PathBudget budget, MutableIntList path,
                              boolean[] onPath, MutableList<ImmutableIntList> paths) {
        if (path.size() - 1 >= budget.maxDepth()) {
            return;
        }
        ImmutableIntList next = graph.successors(current);
        for (int i = 0; i < next.size(); i++) {
            int neighbor = next.get(i);
            if (onPath[neighbor]) {
                continue;
            }
            path.add(neighbor);
            if (neighbor == target) {
                if (paths.size() == budget.maxPaths()) {
                    throw new ResourceExhaustedException("simple paths", budget.maxPaths());
                }
                paths.add(path.toImmutable());
            } else {
                onPath[neighbor] = true;
                collectPaths(neighbor, target, budget, path, onPath, paths);
                onPath[neighbor] = false;
            }
            path.removeAtIndex(path.size() - 1);
        }
    }

    // Weak components, ordered by lowest index
    public ImmutableList<ImmutableIntList> connectedComponents() {
        int n = graph.nodeCount();
        boolean[] seen = new boolean[n];
        MutableList<ImmutableIntList> components = Lists.mutable.empty();
        for (int start = 0; start < n; start++) {
            if (seen[start]) {
                continue;
            }
            MutableIntList component = IntLists.mutable.empty();
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(start);
            seen[start] = true;
            while (!queue.isEmpty()) {
                int current = queue.poll();
                component.add(current);
                ImmutableIntList adjacent = graph.neighbors(current);
                for (int i = 0; i < adjacent.size(); i++) {
                    int neighbor = adjacent.get(i);
                    if (!seen[neighbor]) {
                        seen[neighbor] = true;
                        queue.add(neighbor);
                    }
                }
            }
            components.add(component.sortThis().toImmutable());
        }
        return components.toImmutable();
    }

    /**
     * Strongly connected components (Tarjan), each ascending, ordered by their lowest index.
     * For undirected graphs these are the connected components.
     */
    public ImmutableList<ImmutableIntList> stronglyConnectedComponents() {
        if (!graph.isDirected()) {
            return connectedComponents();
        }
        int n = graph.nodeCount();
        int[] index = new int[n];
        int[] low = new int[n];
        int[] edgeCursor = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(index, -1);
        Deque<Integer> stack = new ArrayDeque<>();
        Deque<Integer> callStack = new ArrayDeque<>();
        MutableList<ImmutableIntList> components = Lists.mutable.empty();
        int counter = 0;

        for (int root = 0; root < n; root++) {
            if (index[root] >= 0) {
                continue;
            }
            callStack.push(root);
            index[root] = low[root] = counter++;
            stack.push(root);
            onStack[root] = true;
            while (!callStack.isEmpty()) {
                int v = callStack.peek();
                ImmutableIntList next = graph.successors(v);
                if (edgeCursor[v] < next.size()) {
                    int w = next.get(edgeCursor[v]++);
                    if (index[w] < 0) {
                        index[w] = low[w] = counter++;
                        stack.push(w);
                        onStack[w] = true;
                        callStack.push(w);
                    } else if (onStack[w]) {
                        low[v] = Math.min(low[v], index[w]);
                    }
                    continue;
                }
                callStack.pop();
                if (!callStack.isEmpty()) {
                    int parent = callStack.peek();
                    low[parent] = Math.min(low[parent], low[v]);
                }
                if (low[v] == index[v]) {
                    MutableIntList component = IntLists.mutable.empty();
                    int w;
                    do {
                        w = stack.pop();
                        onStack[w] = false;
                        component.add(w);
                    } while (w != v);
                    components.add(component.sortThis().toImmutable());
                }
            }
        }
        return components.sortThisBy(component -> component.get(0)).toImmutable();
    }

    /**
     * Cycles of the graph. Directed graphs report every strongly connected component of more
     * than one node; undirected graphs report one fundamental cycle per depth-first back edge,
     * as the path from the back edge's ancestor down to its descendant.
     */
    public ImmutableList<ImmutableIntList> findCycles() {
        if (graph.isDirected()) {
            return stronglyConnectedComponents().select(component -> component.size() > 1);
        }
        int n = graph.nodeCount();
        int[] parent = new int[n];
        int[] depth = new int[n];
        int[] edgeCursor = new int[n];
        Arrays.fill(depth, -1);
        MutableList<ImmutableIntList> cycles = Lists.mutable.empty();
        Deque<Integer> stack = new ArrayDeque<>();
        for (int root = 0; root < n; root++) {
            if (depth[root] >= 0) {
                continue;
            }
            depth[root] = 0;
            parent[root] = -1;
            stack.push(root);
            while (!stack.isEmpty()) {
                int v = stack.peek();
                ImmutableIntList adjacent = graph.neighbors(v);
                if (edgeCursor[v] == adjacent.size()) {
                    stack.pop();
                    continue;
                }
                int w = adjacent.get(edgeCursor[v]++);
                if (depth[w] < 0) {
                    depth[w] = depth[v] + 1;
                    parent[w] = v;
                    stack.push(w);
                } else if (w != parent[v] && depth[w] < depth[v]) {
                    MutableIntList cycle = IntLists.mutable.empty();
                    for (int at = v; at != w; at = parent[at]) {
                        cycle.add(at);
                    }
                    cycle.add(w);
                    cycles.add(cycle.reverseThis().toImmutable());
                }
            }
        }
        return cycles.toImmutable();
    }

    public boolean hasCycle() {
        return !findCycles().isEmpty();
    }

    /**
     * Topological order of a directed acyclic graph, choosing the lowest ready index first.
     *
     * @throws IllegalStateException for undirected graphs or graphs with cycles
     */
    public ImmutableIntList topologicalSort() {
        if (!graph.isDirected()) {
            throw new IllegalStateException("Topological sort requires a directed graph");
        }
        int n = graph.nodeCount();
        int[] remaining = new int[n];
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int v = 0; v < n; v++) {
            remaining[v] = graph.inDegree(v);
            if (remaining[v] == 0) {
                ready.add(v);
            }
        }
        MutableIntList order = IntLists.mutable.empty();
        while (!ready.isEmpty()) {
            int v = ready.poll();
            order.add(v);
            ImmutableIntList next = graph.successors(v);
            for (int i = 0; i < next.size(); i++) {
                if (--remaining[next.get(i)] == 0) {
                    ready.add(next.get(i));
                }
            }
        }
        if (order.size() != n) {
            throw new IllegalStateException("Graph contains cycles");
        }
        return order.toImmutable();
    }

    public ImmutableDoubleList degreeCentrality() {
        int n = graph.nodeCount();
        double[] scores = new double[n];
        if (n > 1) {
            for (int v = 0; v < n; v++) {
                scores[v] = graph.degree(v) / (double) (n - 1);
            }
        }
        return DoubleLists.immutable.with(scores);
    }

    /**
     * Normalized betweenness centrality (Brandes), O(V·E) time and O(V+E) space. Scores are
     * divided by {@code (N-1)(N-2)}; graphs of two nodes or fewer score zero.
     */
    public ImmutableDoubleList betweennessCentrality() {
        int n = graph.nodeCount();
        double[] scores = new double[n];
        for (int s = 0; s < n; s++) {
            Deque<Integer> visited = new ArrayDeque<>();
            MutableList<MutableIntList> predecessors = Lists.mutable.empty();
            for (int v = 0; v < n; v++) {
                predecessors.add(IntLists.mutable.empty());
            }
            double[] sigma = new double[n];
            int[] distance = new int[n];
            Arrays.fill(distance, -1);
            sigma[s] = 1;
            distance[s] = 0;
            Deque<Integer> queue = new ArrayDeque<>();
            queue.add(s);
            while (!queue.isEmpty()) {
                int v = queue.poll();
                visited.push(v);
                ImmutableIntList next = graph.successors(v);
                for (int i = 0; i < next.size(); i++) {
                    int w = next.get(i);
                    if (distance[w] < 0) {
                        distance[w] = distance[v] + 1;
                        queue.add(w);
                    }
                    if (distance[w] == distance[v] + 1) {
                        sigma[w] += sigma[v];
                        predecessors.get(w).add(v);
                    }
                }
            }
            double[] delta = new double[n];
            while (!visited.isEmpty()) {
                int w = visited.pop();
                MutableIntList before = predecessors.get(w);
                for (int i = 0; i < before.size(); i++) {
                    int v = before.get(i);
                    delta[v] += sigma[v] / sigma[w] * (1 + delta[w]);
                }
                if (w != s) {
                    scores[w] += delta[w];
                }
            }
        }
        if (n > 2) {
            double scale = 1.0 / ((n - 1) * (double) (n - 2));
            for (int v = 0; v < n; v++) {
                scores[v] *= scale;
            }
        } else {
            Arrays.fill(scores, 0);
        }
        return DoubleLists.immutable.with(scores);
    }

    public GraphMetrics graphMetrics() {
        int n = graph.nodeCount();
        int e = graph.edgeCount();
        double density = 0;
        if (n > 1) {
            double possible = (double) n * (n - 1);
            density = graph.isDirected() ? e / possible : 2.0 * e / possible;
        }
        int components = connectedComponents().size();
        GraphMetrics metrics = new GraphMetrics(n, e, density, components, components == 1, !hasCycle());
        LOGGER.debug("Computed {}", metrics);
        return metrics;
    }

    private void checkNode(int node) {
        if (node < 0 || node >= graph.nodeCount()) {
            throw new IndexOutOfBoundsException("No node " + node + " in graph of " + graph.nodeCount());
        }
    }
}
