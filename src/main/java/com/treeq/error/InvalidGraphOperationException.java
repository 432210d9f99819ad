package com.treeq.error;

/**
 * A caller-supplied edge predicate, attribute function or matcher threw or returned an
 * inconsistent value. Identifies the offending pair of graph indices; {@code second} is
 * -1 when the callback concerned a single node.
 */
public class InvalidGraphOperationException extends TreeQueryException {
    private final int first;
    private final int second;

    public InvalidGraphOperationException(String message, int first, int second) {
        super(message + " " + describe(first, second));
        this.first = first;
        this.second = second;
    }

    public InvalidGraphOperationException(String message, int first, int second, Throwable cause) {
        super(message + " " + describe(first, second) + ": " + cause.getMessage(), cause);
        this.first = first;
        this.second = second;
    }

    private static String describe(int first, int second) {
        return second < 0 ? "at node " + first : "at pair (" + first + ", " + second + ")";
    }

    public int first() {
        return first;
    }

    public int second() {
        return second;
    }
}
