package io.lighting.fluentql.error;

/**
 * Raised by the query builder when it is handed input it cannot place in the statement.
 */
public class QueryBuildException extends FluentSqlException {

    public QueryBuildException(String message) {
        super(message);
    }
}
