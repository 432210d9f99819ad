package com.treeq.error;

/**
 * Base class of the failures raised by queries, projections, matching and analytics.
 */
public class TreeQueryException extends RuntimeException {
    public TreeQueryException(String message) {
        super(message);
    }

    public TreeQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
