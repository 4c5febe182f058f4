package com.umitunal.elric.core;

/**
 * Result of a mutating job store operation.
 */
public enum StoreOutcome {
    ADDED,
    ALREADY_EXISTS,
    REPLACED,
    REMOVED,
    NOT_FOUND;

    public boolean isSuccess() {
        return this == ADDED || this == REPLACED || this == REMOVED;
    }
}
