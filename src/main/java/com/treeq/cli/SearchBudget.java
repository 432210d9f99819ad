package com.treeq.cli;

import com.treeq.analytics.PathBudget;
import com.treeq.match.MatchOptions;

/**
 * Search limits resolved from command line options and their environment defaults.
 */
public record SearchBudget(long maxStates, int maxPaths, int maxDepth) {
    public static final String MAX_STATES_DEFAULT = "${env:TREEQ_MAX_STATES:-1000000}";
    public static final String MAX_PATHS_DEFAULT = "${env:TREEQ_MAX_PATHS:-1000}";
    public static final String MAX_DEPTH_DEFAULT = "${env:TREEQ_MAX_DEPTH:-32}";

    public MatchOptions toMatchOptions(boolean firstOnly) {
        return MatchOptions.defaults().withMaxStates(maxStates).withFirstOnly(firstOnly);
    }

    public PathBudget toPathBudget() {
        return PathBudget.of(maxDepth, maxPaths);
    }
}
