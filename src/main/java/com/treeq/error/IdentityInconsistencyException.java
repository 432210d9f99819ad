package com.treeq.error;

/**
 * Structural equality and hashing disagree for a value, so set results would be undefined.
 */
public class IdentityInconsistencyException extends TreeQueryException {
    public IdentityInconsistencyException(String message) {
        super(message);
    }
}
