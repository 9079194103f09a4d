package io.lighting.fluentql.error;

import io.lighting.fluentql.dsl.QueryCommand;
import java.util.Objects;

/**
 * Raised when a builder method is called on a query whose command does not allow it.
 */
public final class InvalidOperationException extends QueryBuildException {
    private final QueryCommand command;
    private final String method;

    public InvalidOperationException(QueryCommand command, String method) {
        this(command, method, null);
    }

    public InvalidOperationException(QueryCommand command, String method, String detail) {
        super(
            "Operation " + method + " is not allowed on a " + command + " query"
                + (detail == null ? "" : ": " + detail)
        );
        this.command = Objects.requireNonNull(command, "command");
        this.method = Objects.requireNonNull(method, "method");
    }

    public QueryCommand command() {
        return command;
    }

    public String method() {
        return method;
    }
}
