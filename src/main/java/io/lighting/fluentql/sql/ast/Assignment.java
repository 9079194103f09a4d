package io.lighting.fluentql.sql.ast;

import io.lighting.fluentql.dsl.Column;
import java.util.Objects;

public record Assignment(Column column, Expr value) {
    public Assignment {
        Objects.requireNonNull(column, "column");
        Objects.requireNonNull(value, "value");
    }
}
