package io.lighting.fluentql.sql.ast;

import io.lighting.fluentql.dsl.Table;
import io.lighting.fluentql.types.Type;
import java.util.Objects;

/**
 * Every column of one table, compiled as {@code table.*}.
 */
public record AllColumns(Table table) implements Expr {
    public AllColumns {
        Objects.requireNonNull(table, "table");
    }

    @Override
    public Type type() {
        return Type.collection(Type.ANY);
    }
}
