package com.umitunal.elric.core;

/**
 * Thrown when starting a component that is already running.
 */
public class AlreadyRunningException extends IllegalStateException {

    public AlreadyRunningException(String message) {
        super(message);
    }
}
