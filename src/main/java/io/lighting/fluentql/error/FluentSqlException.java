package io.lighting.fluentql.error;

/**
 * Base class of every error raised while building or compiling a statement.
 */
public class FluentSqlException extends RuntimeException {

    public FluentSqlException(String message) {
        super(message);
    }

    public FluentSqlException(String message, Throwable cause) {
        super(message, cause);
    }
}
