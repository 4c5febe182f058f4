package com.umitunal.elric.registry;

import com.umitunal.elric.core.ArgumentMismatchException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Declared parameters of a {@link JobFunction}, used to reject jobs whose
 * arguments could never bind before they are scheduled.
 *
 * Parameters are named and ordered. The first {@code requiredCount} must be bound,
 * either positionally or by keyword; the rest are optional. Extra positional values are
 * accepted only with var-args, unknown keywords only with var-keywords.
 */
public final class FunctionSignature {
    private final List<String> parameters;
    private final int requiredCount;
    private final boolean varArgs;
    private final boolean varKeywords;

    private FunctionSignature(List<String> parameters, int requiredCount,
                              boolean varArgs, boolean varKeywords) {
        this.parameters = Collections.unmodifiableList(parameters);
        this.requiredCount = requiredCount;
        this.varArgs = varArgs;
        this.varKeywords = varKeywords;
    }

    /**
     * Signature with the given required parameters and nothing else.
     */
    public static FunctionSignature of(String... required) {
        List<String> names = new ArrayList<>();
        for (String name : required) {
            if (names.contains(name)) {
                throw new IllegalArgumentException("Duplicate parameter: " + name);
            }
            names.add(name);
        }
        return new FunctionSignature(names, names.size(), false, false);
    }

    /**
     * Signature accepting any arguments.
     */
    public static FunctionSignature any() {
        return new FunctionSignature(new ArrayList<>(), 0, true, true);
    }

    public FunctionSignature withOptional(String... optional) {
        List<String> names = new ArrayList<>(parameters);
        for (String name : optional) {
            if (names.contains(name)) {
                throw new IllegalArgumentException("Duplicate parameter: " + name);
            }
            names.add(name);
        }
        return new FunctionSignature(names, requiredCount, varArgs, varKeywords);
    }

    public FunctionSignature withVarArgs() {
        return new FunctionSignature(new ArrayList<>(parameters), requiredCount, true, varKeywords);
    }

    public FunctionSignature withVarKeywords() {
        return new FunctionSignature(new ArrayList<>(parameters), requiredCount, varArgs, true);
    }

    /**
     * Verify that the arguments bind to this signature.
     *
     * @throws ArgumentMismatchException describing the first problem found
     */
    public void check(List<?> args, Map<String, ?> kwargs) {
        if (args.size() > parameters.size() && !varArgs) {
            throw new ArgumentMismatchException(String.format(
                    "Takes at most %d positional arguments (%d given)", parameters.size(), args.size()));
        }

        for (String key : kwargs.keySet()) {
            int index = parameters.indexOf(key);
            if (index >= 0 && index < args.size()) {
                throw new ArgumentMismatchException("Got multiple values for argument '" + key + "'");
            }
            if (index < 0 && !varKeywords) {
                throw new ArgumentMismatchException("Unexpected keyword argument '" + key + "'");
            }
        }

        List<String> missing = new ArrayList<>();
        for (int i = args.size(); i < requiredCount; i++) {
            String name = parameters.get(i);
            if (!kwargs.containsKey(name)) {
                missing.add(name);
            }
        }
        if (!missing.isEmpty()) {
            throw new ArgumentMismatchException("Missing required arguments: " + String.join(", ", missing));
        }
    }

    public List<String> getParameters() { return parameters; }
    public int getRequiredCount() { return requiredCount; }
    public boolean acceptsVarArgs() { return varArgs; }
    public boolean acceptsVarKeywords() { return varKeywords; }

    @Override
    public String toString() {
        return String.format("FunctionSignature{params=%s, required=%d, varArgs=%s, varKeywords=%s}",
                parameters, requiredCount, varArgs, varKeywords);
    }
}
