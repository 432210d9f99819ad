package com.treeq.match;

/**
 * Search settings for {@link SubgraphMatcher}.
 *
 * @param firstOnly       stop at the first complete mapping
 * @param maxStates       number of candidate extensions tried before giving up
 * @param degreeLookahead reject candidates whose degrees cannot cover the pattern node's
 */
public record MatchOptions(boolean firstOnly, long maxStates, boolean degreeLookahead) {
    private static final MatchOptions DEFAULTS = new MatchOptions(false, Long.MAX_VALUE, true);

    public MatchOptions {
        if (maxStates <= 0) {
            throw new IllegalArgumentException("maxStates must be positive: " + maxStates);
        }
    }

    public static MatchOptions defaults() {
        return DEFAULTS;
    }

    public MatchOptions withFirstOnly(boolean value) {
        return new MatchOptions(value, maxStates, degreeLookahead);
    }

    public MatchOptions withMaxStates(long value) {
        return new MatchOptions(firstOnly, value, degreeLookahead);
    }

    public MatchOptions withDegreeLookahead(boolean value) {
        return new MatchOptions(firstOnly, maxStates, value);
    }
}
