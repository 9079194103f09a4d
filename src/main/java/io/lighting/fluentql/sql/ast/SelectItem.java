package io.lighting.fluentql.sql.ast;

import java.util.Objects;

public record SelectItem(Expr expr, String alias) {
    public SelectItem {
        Objects.requireNonNull(expr, "expr");
        if (alias != null && alias.isBlank()) {
            throw new IllegalArgumentException("alias must not be blank");
        }
    }

    public static SelectItem of(Expr expr) {
        return new SelectItem(expr, null);
    }

    public static SelectItem of(Expr expr, String alias) {
        return new SelectItem(expr, alias);
    }
}
