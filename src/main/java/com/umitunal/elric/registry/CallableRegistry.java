package com.umitunal.elric.registry;

import com.umitunal.elric.core.CallableResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Explicit table of callables a job may reference by name.
 *
 * Populate it at startup; resolving a reference that was never registered fails with
 * {@link CallableResolutionException} instead of attempting any dynamic lookup.
 */
public class CallableRegistry {
    private static final Logger log = LoggerFactory.getLogger(CallableRegistry.class);

    private final Map<String, RegisteredCallable> byReference = new ConcurrentHashMap<>();
    private final Map<JobFunction, RegisteredCallable> byFunction = new ConcurrentHashMap<>();

    /**
     * Register a function under a reference.
     *
     * @throws IllegalStateException if the reference is already taken
     */
    public CallableRegistry register(String reference, JobFunction function, FunctionSignature signature) {
        RegisteredCallable callable = new RegisteredCallable(reference, function, signature);
        if (byReference.putIfAbsent(reference, callable) != null) {
            throw new IllegalStateException("Callable already registered: " + reference);
        }
        byFunction.putIfAbsent(function, callable);
        log.debug("Registered callable {} with {}", reference, signature);
        return this;
    }

    /**
     * Resolve a reference.
     *
     * @throws CallableResolutionException if nothing is registered under it
     */
    public RegisteredCallable resolve(String reference) {
        RegisteredCallable callable = reference == null ? null : byReference.get(reference);
        if (callable == null) {
            throw new CallableResolutionException(reference);
        }
        return callable;
    }

    /**
     * Find the registration of a function instance.
     */
    public Optional<RegisteredCallable> lookup(JobFunction function) {
        return Optional.ofNullable(byFunction.get(function));
    }

    public boolean contains(String reference) {
        return byReference.containsKey(reference);
    }

    public Set<String> references() {
        return Set.copyOf(byReference.keySet());
    }
}
