package io.lighting.fluentql.sql.ast;

import io.lighting.fluentql.types.Type;

/**
 * A typed value expression: a column, a literal, a function call or a sub-select.
 */
public interface Expr {
    Type type();

    /**
     * Wraps plain Java values into {@link Literal}s and passes expressions through.
     */
    static Expr of(Object value) {
        if (value instanceof Expr expr) {
            return expr;
        }
        return Literal.of(value);
    }
}
