package com.treeq.error;

/**
 * A search or enumeration ran past its budget. Distinguishes "gave up" from an exhaustive
 * search that found nothing.
 */
public class ResourceExhaustedException extends TreeQueryException {
    private final String resource;
    private final long limit;

    public ResourceExhaustedException(String resource, long limit) {
        super(resource + " budget of " + limit + " exceeded");
        this.resource = resource;
        this.limit = limit;
    }

    public String resource() {
        return resource;
    }

    public long limit() {
        return limit;
    }
}
