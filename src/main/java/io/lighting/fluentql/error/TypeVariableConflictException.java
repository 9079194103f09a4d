package io.lighting.fluentql.error;

import io.lighting.fluentql.types.Type;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class TypeVariableConflictException extends TypeCheckException {
    private final Type.Variable variable;
    private final List<Type> conflictingTypes;
    private final List<Integer> argumentIndices;

    public TypeVariableConflictException(
        String functionName,
        Type.Variable variable,
        List<Type> conflictingTypes,
        List<Integer> argumentIndices
    ) {
        super(
            functionName,
            "Arguments " + argumentIndices.stream().map(String::valueOf).collect(Collectors.joining(", "))
                + " of " + functionName + " must share type " + variable + ", found "
                + conflictingTypes.stream().map(Type::toString).collect(Collectors.joining(", "))
        );
        this.variable = Objects.requireNonNull(variable, "variable");
        this.conflictingTypes = List.copyOf(conflictingTypes);
        this.argumentIndices = List.copyOf(argumentIndices);
    }

    public Type.Variable variable() {
        return variable;
    }

    public List<Type> conflictingTypes() {
        return conflictingTypes;
    }

    public List<Integer> argumentIndices() {
        return argumentIndices;
    }
}
