package io.lighting.fluentql.error;

import java.util.Objects;

/**
 * Raised when the arguments of a function call do not satisfy its signature.
 */
public abstract class TypeCheckException extends FluentSqlException {
    private final String functionName;

    protected TypeCheckException(String functionName, String message) {
        super(message);
        this.functionName = Objects.requireNonNull(functionName, "functionName");
    }

    /**
     * Name of the function, operator or clause being checked.
     */
    public String functionName() {
        return functionName;
    }
}
