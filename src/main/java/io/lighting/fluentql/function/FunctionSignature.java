package io.lighting.fluentql.function;

import io.lighting.fluentql.types.Type;
import java.util.List;
import java.util.Objects;

/**
 * Registered description of a function or operator: its parameter type expressions and
 * the rule producing its return type. The name doubles as the key dialects render it by.
 */
public final class FunctionSignature {
    private final String name;
    private final List<Type> parameters;
    private final ReturnRule returnRule;

    private FunctionSignature(String name, List<Type> parameters, ReturnRule returnRule) {
        this.name = Objects.requireNonNull(name, "name");
        this.parameters = List.copyOf(Objects.requireNonNull(parameters, "parameters"));
        this.returnRule = Objects.requireNonNull(returnRule, "returnRule");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public static FunctionSignature of(String name, ReturnRule returnRule, Type... parameters) {
        Objects.requireNonNull(parameters, "parameters");
        return new FunctionSignature(name, List.of(parameters), returnRule);
    }

    public static FunctionSignature of(String name, ReturnRule returnRule, List<Type> parameters) {
        return new FunctionSignature(name, parameters, returnRule);
    }

    public String name() {
        return name;
    }

    public List<Type> parameters() {
        return parameters;
    }

    public int arity() {
        return parameters.size();
    }

    public ReturnRule returnRule() {
        return returnRule;
    }

    /**
     * Builds a call checked by the process-wide {@link FunctionRegistry#global() registry}.
     */
    public FunctionCall call(Object... arguments) {
        return FunctionRegistry.global().call(this, arguments);
    }

    @Override
    public String toString() {
        return name + parameters;
    }
}
