package com.treeq.cli;

import com.treeq.graph.GraphProjection;
import com.treeq.graph.ProjectionOptions;
import com.treeq.match.Match;
import com.treeq.match.Matchers;
import com.treeq.match.SubgraphMatcher;
import com.treeq.output.OutputFormatter;
import com.treeq.predicate.PredicateParser;
import com.treeq.query.NodeCollection;
import com.treeq.tree.SyntaxNode;
import org.eclipse.collections.api.list.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "match", mixinStandardHelpOptions = true,
         description = "Find where the structure of a pattern tree occurs in a target tree")
public class MatchCommand implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(MatchCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Serialized pattern tree file")
    private File patternFile;

    @Parameters(index = "1", arity = "0..1", description = "Serialized target tree file (default: stdin)")
    private File inputFile;

    @Option(names = {"-f", "--filter"}, description = "Only match against target nodes matching this filter")
    private String filter;

    @Option(names = "--named-only", description = "Drop anonymous nodes from pattern and target")
    private boolean namedOnly = false;

    @Option(names = "--first", description = "Stop at the first match")
    private boolean firstOnly = false;

    @Option(names = "--max-states", defaultValue = SearchBudget.MAX_STATES_DEFAULT,
            description = "Search states tried before giving up (default: ${DEFAULT-VALUE})")
    private long maxStates;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        try {
            PredicateParser parser = new PredicateParser();
            NodeCollection patternNodes = NodeCollection.fromTree(TreeInput.read(patternFile));
            NodeCollection targetNodes = NodeCollection.fromTree(TreeInput.read(inputFile))
                .filter(parser.parse(filter));
            if (namedOnly) {
                patternNodes = patternNodes.filter(parser.parse("named"));
                targetNodes = targetNodes.filter(parser.parse("named"));
            }

            GraphProjection pattern = patternNodes.toGraph(ProjectionOptions.defaults());
            GraphProjection target = targetNodes.toGraph(ProjectionOptions.defaults());
            SearchBudget budget = new SearchBudget(maxStates, 1, 1);
            LOGGER.debug("Matching {} pattern nodes against {} target nodes",
                pattern.graph().nodeCount(), target.graph().nodeCount());

            ImmutableList<Match> matches = new SubgraphMatcher().findMatches(pattern.graph(), target.graph(),
                Matchers.sameType(), Matchers.sameEdgeType(), budget.toMatchOptions(firstOnly));

            OutputFormatter formatter = new OutputFormatter(false);
            for (Match match : matches) {
                out.println(formatter.format(match));
                ImmutableList<SyntaxNode> resolved = match.resolve(target.index());
                for (int p = 0; p < resolved.size(); p++) {
                    out.println("  " + p + " -> " + formatter.summary(resolved.get(p), 40));
                }
            }
            out.println(matches.size() + " match(es)");
            return 0;
        } catch (Exception e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }
}
