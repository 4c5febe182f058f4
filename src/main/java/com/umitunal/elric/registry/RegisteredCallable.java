package com.umitunal.elric.registry;

import java.util.Objects;

/**
 * A {@link JobFunction} together with the reference it is registered under and its signature.
 */
public final class RegisteredCallable {
    private final String reference;
    private final JobFunction function;
    private final FunctionSignature signature;

    public RegisteredCallable(String reference, JobFunction function, FunctionSignature signature) {
        this.reference = Objects.requireNonNull(reference, "reference");
        this.function = Objects.requireNonNull(function, "function");
        this.signature = Objects.requireNonNull(signature, "signature");
    }

    public String getReference() { return reference; }
    public JobFunction getFunction() { return function; }
    public FunctionSignature getSignature() { return signature; }

    @Override
    public String toString() {
        return "RegisteredCallable{" + reference + ", " + signature + "}";
    }
}
