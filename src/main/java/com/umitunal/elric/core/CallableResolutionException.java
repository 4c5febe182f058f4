package com.umitunal.elric.core;

/**
 * A callable reference is not known to the registry.
 */
public class CallableResolutionException extends JobDefinitionException {
    private final String reference;

    public CallableResolutionException(String reference) {
        super("No callable registered for reference: " + reference);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
