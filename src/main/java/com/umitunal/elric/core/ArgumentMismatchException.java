package com.umitunal.elric.core;

/**
 * Positional or keyword arguments do not fit the callable's signature.
 */
public class ArgumentMismatchException extends JobDefinitionException {

    public ArgumentMismatchException(String message) {
        super(message);
    }
}
