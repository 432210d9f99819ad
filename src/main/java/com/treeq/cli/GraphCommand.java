package com.treeq.cli;

import com.treeq.analytics.GraphAnalyzer;
import com.treeq.graph.GraphProjection;
import com.treeq.graph.ProjectionOptions;
import com.treeq.output.OutputFormatter;
import com.treeq.predicate.PredicateParser;
import com.treeq.query.NodeCollection;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.primitive.ImmutableDoubleList;
import org.eclipse.collections.api.list.primitive.ImmutableIntList;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.util.Comparator;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.stream.IntStream;

@Command(name = "graph", mixinStandardHelpOptions = true,
         description = "Project a serialized syntax tree into a graph and print its metrics")
public class GraphCommand implements Callable<Integer> {
    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Serialized tree file (default: stdin)")
    private File inputFile;

    @Option(names = {"-f", "--filter"}, description = "Only project nodes matching this filter")
    private String filter;

    @Option(names = "--siblings", description = "Chain consecutive children of the same parent")
    private boolean includeSiblings = false;

    @Option(names = "--undirected", description = "Build an undirected graph")
    private boolean undirected = false;

    @Option(names = "--centrality", defaultValue = "0",
            description = "Print the N most central nodes by degree (default: ${DEFAULT-VALUE})")
    private int centralityTop;

    @Option(names = "--betweenness", description = "Rank by betweenness instead of degree centrality")
    private boolean betweenness = false;

    @Option(names = "--from", defaultValue = "-1", description = "Path source index")
    private int from;

    @Option(names = "--to", defaultValue = "-1", description = "Path target index")
    private int to;

    @Option(names = "--max-paths", defaultValue = SearchBudget.MAX_PATHS_DEFAULT,
            description = "Most simple paths enumerated (default: ${DEFAULT-VALUE})")
    private int maxPaths;

    @Option(names = "--max-depth", defaultValue = SearchBudget.MAX_DEPTH_DEFAULT,
            description = "Longest simple path enumerated, in edges (default: ${DEFAULT-VALUE})")
    private int maxDepth;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        try {
            if ((from >= 0) != (to >= 0)) {
                throw new IllegalArgumentException("--from and --to must be given together");
            }
            NodeCollection nodes = NodeCollection.fromTree(TreeInput.read(inputFile))
                .filter(new PredicateParser().parse(filter));
            GraphProjection projection = nodes.toGraph(ProjectionOptions.defaults()
                .withDirected(!undirected)
                .withSiblings(includeSiblings));
            GraphAnalyzer analyzer = new GraphAnalyzer(projection.graph());
            OutputFormatter formatter = new OutputFormatter(true);

            out.println(formatter.format(analyzer.graphMetrics()));

            if (centralityTop > 0) {
                ImmutableDoubleList scores = betweenness
                    ? analyzer.betweennessCentrality()
                    : analyzer.degreeCentrality();
                IntStream.range(0, scores.size())
                    .boxed()
                    .sorted(Comparator.<Integer>comparingDouble(i -> -scores.get(i)).thenComparingInt(i -> i))
                    .limit(centralityTop)
                    .forEach(i -> out.printf(Locale.ROOT, "%d\t%.4f\t%s%n", i, scores.get(i),
                        formatter.summary(projection.node(i), 40)));
            }

            if (from >= 0 && to >= 0) {
                SearchBudget budget = new SearchBudget(1, maxPaths, maxDepth);
                out.println("shortest: " + analyzer.shortestPath(from, to)
                    .map(ImmutableIntList::toString).orElse("none"));
                ImmutableList<ImmutableIntList> paths = analyzer.allSimplePaths(from, to, budget.toPathBudget());
                paths.forEach(path -> out.println("path: " + path));
            }
            return 0;
        } catch (Exception e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }
}
