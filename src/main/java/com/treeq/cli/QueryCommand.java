package com.treeq.cli;

import com.treeq.output.OutputFormatter;
import com.treeq.predicate.NodePredicate;
import com.treeq.predicate.PredicateParser;
import com.treeq.query.NodeCollection;
import com.treeq.tree.SyntaxNode;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "query", mixinStandardHelpOptions = true,
         description = "Print the nodes of a serialized syntax tree that match a filter")
public class QueryCommand implements Callable<Integer> {
    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Node filter, e.g. 'type(call) & contains(print)'")
    private String filter;

    @Parameters(index = "1", arity = "0..1", description = "Serialized tree file (default: stdin)")
    private File inputFile;

    @Option(names = {"-c", "--compact-output"}, description = "Compact JSON output")
    private boolean compactOutput = false;

    @Option(names = {"-s", "--summary"}, description = "One line per node instead of JSON")
    private boolean summary = false;

    @Option(names = "--count", description = "Print only the number of matching nodes")
    private boolean countOnly = false;

    @Option(names = "--limit", defaultValue = "20", description = "Most nodes printed (default: ${DEFAULT-VALUE})")
    private int limit;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        try {
            NodePredicate predicate = new PredicateParser().parse(filter);
            NodeCollection matches = NodeCollection.fromTree(TreeInput.read(inputFile)).filter(predicate);

            if (countOnly) {
                out.println(matches.count());
                return 0;
            }

            OutputFormatter formatter = new OutputFormatter(!compactOutput, !summary);
            for (SyntaxNode node : matches.toList().take(limit)) {
                out.println(summary ? formatter.summary(node, 50) : formatter.format(node));
            }
            return 0;
        } catch (Exception e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }
}
