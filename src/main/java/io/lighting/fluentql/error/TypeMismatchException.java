package io.lighting.fluentql.error;

import io.lighting.fluentql.types.Type;
import java.util.Objects;

public final class TypeMismatchException extends TypeCheckException {
    private final int argumentIndex;
    private final Type expected;
    private final Type actual;

    public TypeMismatchException(String functionName, int argumentIndex, Type expected, Type actual) {
        super(
            functionName,
            "Argument " + argumentIndex + " for " + functionName + ": expected " + expected + ", found " + actual
        );
        this.argumentIndex = argumentIndex;
        this.expected = Objects.requireNonNull(expected, "expected");
        this.actual = Objects.requireNonNull(actual, "actual");
    }

    public int argumentIndex() {
        return argumentIndex;
    }

    public Type expected() {
        return expected;
    }

    public Type actual() {
        return actual;
    }
}
