package io.lighting.fluentql.error;

import java.util.Objects;

/**
 * Raised when a statement cannot be rendered for a dialect.
 * <p>
 * Usually points at a gap in the dialect registration, or at a statement that was left
 * incomplete by the builder (a join without ON or USING, a select without a target).
 */
public class CompileException extends FluentSqlException {
    private final String dialectId;

    public CompileException(String dialectId, String message) {
        super(message + " (dialect: " + dialectId + ")");
        this.dialectId = Objects.requireNonNull(dialectId, "dialectId");
    }

    public String dialectId() {
        return dialectId;
    }
}
