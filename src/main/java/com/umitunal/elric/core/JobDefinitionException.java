package com.umitunal.elric.core;

/**
 * A job could not be constructed from what the caller supplied.
 * Jobs failing construction never reach a store or a queue.
 */
public class JobDefinitionException extends RuntimeException {

    public JobDefinitionException(String message) {
        super(message);
    }

    public JobDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
