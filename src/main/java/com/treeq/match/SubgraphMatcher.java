package com.treeq.match;

import com.treeq.error.InvalidGraphOperationException;
import com.treeq.error.ResourceExhaustedException;
import com.treeq.graph.Edge;
import com.treeq.graph.NodeGraph;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.list.primitive.ImmutableIntList;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.primitive.IntLists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Optional;

/**
 * Finds embeddings of a pattern graph in a target graph by state-space search with
 * feasibility pruning, in the manner of VF2.
 *
 * <p>Pattern nodes are visited in a fixed order: the lowest index first, then always the
 * lowest unvisited index adjacent to a visited node, falling back to the lowest unvisited
 * index for disconnected patterns. A pattern node with a visited neighbour only considers the
 * neighbours of that neighbour's image, honouring edge direction. Every pattern edge must be
 * present in the target (extra target edges are allowed), and the mapping is injective.
 *
 * <p>If either graph is undirected, both are matched as undirected graphs. Results are
 * returned in canonical order regardless of the search order.
 */
public class SubgraphMatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(SubgraphMatcher.class);

    public ImmutableList<Match> findMatches(NodeGraph pattern, NodeGraph target) {
        return findMatches(pattern, target, Matchers.anyNode(), Matchers.anyEdge(), MatchOptions.defaults());
    }

    public ImmutableList<Match> findMatches(NodeGraph pattern, NodeGraph target,
                                            NodeMatcher nodeMatcher, EdgeMatcher edgeMatcher) {
        return findMatches(pattern, target, nodeMatcher, edgeMatcher, MatchOptions.defaults());
    }

    public Optional<Match> findFirst(NodeGraph pattern, NodeGraph target,
                                     NodeMatcher nodeMatcher, EdgeMatcher edgeMatcher) {
        ImmutableList<Match> found = findMatches(pattern, target, nodeMatcher, edgeMatcher,
            MatchOptions.defaults().withFirstOnly(true));
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    public ImmutableList<Match> findMatches(NodeGraph pattern, NodeGraph target,
                                            NodeMatcher nodeMatcher, EdgeMatcher edgeMatcher,
                                            MatchOptions options) {
        if (pattern.nodeCount() == 0 || pattern.nodeCount() > target.nodeCount()) {
            return Lists.immutable.empty();
        }
        Search search = new Search(pattern, target,
            nodeMatcher != null ? nodeMatcher : Matchers.anyNode(),
            edgeMatcher != null ? edgeMatcher : Matchers.anyEdge(),
            options);
        search.extend(0);
        ImmutableList<Match> matches = search.found.sortThis().toImmutable();
        LOGGER.debug("Matched pattern of {} nodes into {} nodes: {} matches after {} states",
            pattern.nodeCount(), target.nodeCount(), matches.size(), search.states);
        return matches;
    }

    /**
     * Visiting order of pattern nodes; see the class documentation.
     */
    static int[] matchOrder(NodeGraph pattern) {
        int n = pattern.nodeCount();
        int[] order = new int[n];
        boolean[] placed = new boolean[n];
        boolean[] frontier = new boolean[n];
        for (int k = 0; k < n; k++) {
            int next = -1;
            for (int p = 0; p < n; p++) {
                if (!placed[p] && frontier[p]) {
                    next = p;
                    break;
                }
            }
            if (next < 0) {
                for (int p = 0; p < n; p++) {
                    if (!placed[p]) {
                        next = p;
                        break;
                    }
                }
            }
            order[k] = next;
            placed[next] = true;
            ImmutableIntList adjacent = pattern.neighbors(next);
            for (int i = 0; i < adjacent.size(); i++) {
                frontier[adjacent.get(i)] = true;
            }
        }
        return order;
    }

    private static final class Search {
        private final NodeGraph pattern;
        private final NodeGraph target;
        private final NodeMatcher nodeMatcher;
        private final EdgeMatcher edgeMatcher;
        private final MatchOptions options;
        private final boolean directed;
        private final int[] order;
        private final int[] anchors;
        private final int[] core;
        private final boolean[] used;
        private final MutableList<Match> found = Lists.mutable.empty();
        private long states;
        private boolean done;

        Search(NodeGraph pattern, NodeGraph target, NodeMatcher nodeMatcher, EdgeMatcher edgeMatcher,
               MatchOptions options) {
            this.pattern = pattern;
            this.target = target;
            this.nodeMatcher = nodeMatcher;
            this.edgeMatcher = edgeMatcher;
            this.options = options;
            this.directed = pattern.isDirected() && target.isDirected();
            this.order = matchOrder(pattern);
            this.anchors = anchors(order);
            this.core = new int[pattern.nodeCount()];
            this.used = new boolean[target.nodeCount()];
            Arrays.fill(core, -1);
        }

        // Earliest-visited pattern neighbour of each position, or -1
        private int[] anchors(int[] visitOrder) {
            int[] position = new int[visitOrder.length];
            for (int k = 0; k < visitOrder.length; k++) {
                position[visitOrder[k]] = k;
            }
            int[] result = new int[visitOrder.length];
            for (int k = 0; k < visitOrder.length; k++) {
                result[k] = -1;
                ImmutableIntList adjacent = pattern.neighbors(visitOrder[k]);
                for (int i = 0; i < adjacent.size(); i++) {
                    int q = adjacent.get(i);
                    if (position[q] < k && (result[k] < 0 || position[q] < position[result[k]])) {
                        result[k] = q;
                    }
                }
            }
            return result;
        }

        void extend(int depth) {
            if (depth == order.length) {
                found.add(new Match(IntLists.immutable.with(core.clone())));
                done = options.firstOnly();
                return;
            }
            int p = order[depth];
            int anchor = anchors[depth];
            if (anchor < 0) {
                for (int t = 0; t < target.nodeCount() && !done; t++) {
                    tryCandidate(depth, p, t);
                }
                return;
            }
            ImmutableIntList candidates = candidates(anchor, p);
            for (int i = 0; i < candidates.size() && !done; i++) {
                tryCandidate(depth, p, candidates.get(i));
            }
        }

        private ImmutableIntList candidates(int anchor, int p) {
            int image = core[anchor];
            if (!directed) {
                return target.neighbors(image);
            }
            return pattern.hasEdge(anchor, p) ? target.successors(image) : target.predecessors(image);
        }

        private void tryCandidate(int depth, int p, int t) {
            if (used[t]) {
                return;
            }
            if (++states > options.maxStates()) {
                throw new ResourceExhaustedException("match states", options.maxStates());
            }
            if (!feasible(p, t)) {
                return;
            }
            core[p] = t;
            used[t] = true;
            extend(depth + 1);
            core[p] = -1;
            used[t] = false;
        }

        private boolean feasible(int p, int t) {
            if (options.degreeLookahead() && !degreesCover(p, t)) {
                return false;
            }
            boolean nodeMatches;
            try {
                nodeMatches = nodeMatcher.matches(pattern.nodeAttributes(p), target.nodeAttributes(t));
            } catch (RuntimeException e) {
                throw new InvalidGraphOperationException("Node matcher failed for pattern/target", p, t, e);
            }
            if (!nodeMatches) {
                return false;
            }
            ImmutableIntList adjacent = pattern.neighbors(p);
            for (int i = 0; i < adjacent.size(); i++) {
                int q = adjacent.get(i);
                if (core[q] < 0) {
                    continue;
                }
                if (directed) {
                    if (!edgeCovered(p, q, t, core[q]) || !edgeCovered(q, p, core[q], t)) {
                        return false;
                    }
                } else if (!undirectedEdgeCovered(p, q, t, core[q])) {
                    return false;
                }
            }
            return true;
        }

        private boolean degreesCover(int p, int t) {
            if (directed) {
                return target.outDegree(t) >= pattern.outDegree(p) && target.inDegree(t) >= pattern.inDegree(p);
            }
            return target.neighbors(t).size() >= pattern.neighbors(p).size();
        }

        // A pattern edge p -> q, when present, needs a matching target edge t -> u
        private boolean edgeCovered(int p, int q, int t, int u) {
            Optional<Edge> patternEdge = pattern.edge(p, q);
            if (patternEdge.isEmpty()) {
                return true;
            }
            Optional<Edge> targetEdge = target.edge(t, u);
            return targetEdge.isPresent() && edgeMatches(patternEdge.get(), targetEdge.get(), p, q);
        }

        private boolean undirectedEdgeCovered(int p, int q, int t, int u) {
            Edge patternEdge = pattern.edge(p, q).orElseGet(() -> pattern.edge(q, p).orElseThrow());
            Optional<Edge> targetEdge = target.edge(t, u).or(() -> target.edge(u, t));
            return targetEdge.isPresent() && edgeMatches(patternEdge, targetEdge.get(), p, q);
        }

        private boolean edgeMatches(Edge patternEdge, Edge targetEdge, int p, int q) {
            try {
                return edgeMatcher.matches(patternEdge.attributes(), targetEdge.attributes());
            } catch (RuntimeException e) {
                throw new InvalidGraphOperationException("Edge matcher failed for pattern edge", p, q, e);
            }
        }
    }
}
