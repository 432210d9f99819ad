package com.treeq.match;

import com.treeq.TestTrees;
import com.treeq.error.InvalidGraphOperationException;
import com.treeq.error.ResourceExhaustedException;
import com.treeq.graph.Edge;
import com.treeq.graph.GraphProjection;
import com.treeq.graph.NodeGraph;
import com.treeq.graph.ProjectionOptions;
import com.treeq.query.NodeCollection;
import com.treeq.tree.SyntaxNode;
import com.treeq.tree.SyntaxTreeReader;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class SubgraphMatcherTest {
    private final SubgraphMatcher matcher = new SubgraphMatcher();

    private static NodeGraph chain(boolean directed, int nodes) {
        NodeGraph.Builder builder = NodeGraph.builder(directed).addNodes(nodes);
        for (int i = 1; i < nodes; i++) {
            builder.addEdge(i - 1, i);
        }
        return builder.build();
    }

    private static NodeGraph complete(int nodes) {
        NodeGraph.Builder builder = NodeGraph.builder(false).addNodes(nodes);
        for (int i = 0; i < nodes; i++) {
            for (int j = i + 1; j < nodes; j++) {
                builder.addEdge(i, j);
            }
        }
        return builder.build();
    }

    @Test
    public void testEdgeIntoChain() {
        ImmutableList<Match> matches = matcher.findMatches(chain(true, 2), chain(true, 3));

        assertEquals(2, matches.size());
        assertEquals(Map.of(0, 0, 1, 1), matches.get(0).asMap());
        assertEquals(Map.of(0, 1, 1, 2), matches.get(1).asMap());
    }

    @Test
    public void testMatchesAreSoundAndInjective() {
        NodeGraph pattern = chain(true, 3);
        NodeGraph.Builder builder = NodeGraph.builder(true).addNodes(5);
        builder.addEdge(0, 1);
        builder.addEdge(1, 2);
        builder.addEdge(1, 3);
        builder.addEdge(3, 4);
        builder.addEdge(2, 4);
        NodeGraph target = builder.build();

        ImmutableList<Match> matches = matcher.findMatches(pattern, target);

        assertEquals(4, matches.size());
        for (Match match : matches) {
            assertEquals(3, match.targets().distinct().size());
            for (Edge edge : pattern.edges()) {
                assertTrue(target.hasEdge(match.target(edge.source()), match.target(edge.target())), match.toString());
            }
        }
    }

    @Test
    public void testTrianglesInCompleteGraph() {
        assertEquals(24, matcher.findMatches(complete(3), complete(4)).size());
    }

    @Test
    public void testMatchesAreSortedCanonically() {
        ImmutableList<Match> matches = matcher.findMatches(complete(3), complete(4));

        assertEquals(matches.toSortedList().toImmutable(), matches);
        assertEquals(Lists.immutable.with(0, 1, 2), Lists.immutable.withAll(matches.get(0).asMap().values()));
    }

    @Test
    public void testPatternLargerThanTargetHasNoMatches() {
        assertTrue(matcher.findMatches(chain(true, 4), chain(true, 3)).isEmpty());
    }

    @Test
    public void testEmptyPatternHasNoMatches() {
        assertTrue(matcher.findMatches(NodeGraph.builder(true).build(), chain(true, 3)).isEmpty());
    }

    @Test
    public void testDisconnectedPattern() {
        NodeGraph pattern = NodeGraph.builder(true).addNodes(2).build();
        NodeGraph target = NodeGraph.builder(true).addNodes(3).build();

        assertEquals(6, matcher.findMatches(pattern, target).size());
    }

    @Test
    public void testMixedDirectednessMatchesUndirected() {
        ImmutableList<Match> matches = matcher.findMatches(chain(false, 2), chain(true, 3));

        assertEquals(4, matches.size());
        assertEquals(Map.of(0, 1, 1, 0), matches.get(1).asMap());
    }

    @Test
    public void testStateBudget() {
        MatchOptions options = MatchOptions.defaults().withMaxStates(3);

        ResourceExhaustedException error = assertThrows(ResourceExhaustedException.class,
            () -> matcher.findMatches(complete(3), complete(4), null, null, options));
        assertEquals(3, error.limit());
    }

    @Test
    public void testFirstOnly() {
        Optional<Match> first = matcher.findFirst(chain(true, 2), chain(true, 3), Matchers.anyNode(), Matchers.anyEdge());

        assertEquals(Map.of(0, 0, 1, 1), first.orElseThrow().asMap());
        assertTrue(matcher.findFirst(chain(true, 4), chain(true, 3), null, null).isEmpty());
    }

    @Test
    public void testDegreeLookaheadDoesNotChangeResults() {
        MatchOptions plain = MatchOptions.defaults().withDegreeLookahead(false);

        assertEquals(matcher.findMatches(complete(3), complete(5)),
            matcher.findMatches(complete(3), complete(5), null, null, plain));
    }

    @Test
    public void testSameTypeOnProjectedTrees() throws IOException {
        GraphProjection pattern = project("trees/call-pattern.json", false);
        GraphProjection target = NodeCollection.fromTree(TestTrees.callTree()).toGraph();

        ImmutableList<Match> matches = matcher.findMatches(pattern.graph(), target.graph(),
            Matchers.sameType(), Matchers.sameEdgeType());

        assertEquals(1, matches.size());
        ImmutableList<SyntaxNode> resolved = matches.get(0).resolve(target.index());
        assertEquals(Lists.immutable.with("call", "identifier", "argument_list"), resolved.collect(SyntaxNode::type));
        assertEquals("print", resolved.get(1).text());
    }

    @Test
    public void testEdgeTypesMustAgree() throws IOException {
        GraphProjection pattern = project("trees/call-pattern.json", true);
        NodeCollection nodes = NodeCollection.fromTree(TestTrees.callTree());

        assertTrue(matcher.findMatches(pattern.graph(), nodes.toGraph().graph(),
            Matchers.sameType(), Matchers.sameEdgeType()).isEmpty());
        assertEquals(1, matcher.findMatches(pattern.graph(),
            nodes.toGraph(ProjectionOptions.defaults().withSiblings(true)).graph(),
            Matchers.sameType(), Matchers.sameEdgeType()).size());
    }

    @Test
    public void testPatternWithoutTypeMatchesAnyNode() {
        NodeGraph.Builder builder = NodeGraph.builder(true);
        builder.addNode(Map.of("type", "argument_list"));
        builder.addNode();
        builder.addEdge(0, 1);

        ImmutableList<Match> matches = matcher.findMatches(builder.build(),
            NodeCollection.fromTree(TestTrees.callTree()).toGraph().graph(), Matchers.sameType(), null);

        assertEquals(5, matches.size());
    }

    @Test
    public void testFailingMatcherNamesPair() {
        NodeMatcher failing = (pattern, target) -> {
            throw new IllegalStateException("unreadable");
        };

        InvalidGraphOperationException error = assertThrows(InvalidGraphOperationException.class,
            () -> matcher.findMatches(chain(true, 2), chain(true, 3), failing, null));
        assertEquals(0, error.first());
        assertEquals(0, error.second());
    }

    @Test
    public void testMatchOrderFollowsFrontier() {
        NodeGraph.Builder builder = NodeGraph.builder(false).addNodes(4);
        builder.addEdge(0, 2);
        builder.addEdge(2, 1);
        int[] order = SubgraphMatcher.matchOrder(builder.build());

        assertArrayEquals(new int[] {0, 2, 1, 3}, order);
    }

    @Test
    public void testRejectsNonPositiveBudget() {
        assertThrows(IllegalArgumentException.class, () -> MatchOptions.defaults().withMaxStates(0));
    }

    private GraphProjection project(String resource, boolean siblings) throws IOException {
        try (InputStream input = new FileInputStream(TestTrees.resource(resource))) {
            return NodeCollection.fromTree(new SyntaxTreeReader().read(input))
                .toGraph(ProjectionOptions.defaults().withSiblings(siblings));
        }
    }
}
