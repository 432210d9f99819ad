package com.treeq;

import com.treeq.cli.GraphCommand;
import com.treeq.cli.MatchCommand;
import com.treeq.cli.QueryCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(name = "treeq", mixinStandardHelpOptions = true, version = "1.0",
         description = "Query, project and match serialized syntax trees",
         subcommands = {QueryCommand.class, GraphCommand.class, MatchCommand.class})
public class TreeQ implements Callable<Integer> {
    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TreeQ()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return 1;
    }
}
