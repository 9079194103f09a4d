package io.lighting.fluentql.dsl;

import io.lighting.fluentql.function.Operand;
import io.lighting.fluentql.sql.ast.SelectItem;
import io.lighting.fluentql.types.Type;
import java.util.Objects;

/**
 * A column reference. Its type is always column-bound ({@code Collection[...]}).
 * <p>
 * The table reference is only used to qualify the name when a statement spans several tables.
 */
public final class Column implements Operand {
    private final String name;
    private final Type type;
    private final Table table;

    Column(String name, Type type, Table table) {
        this.name = Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        this.table = Objects.requireNonNull(table, "table");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Type inner = type.innerType();
        if (!(inner instanceof Type.Concrete) && !(inner instanceof Type.Any)) {
            throw new IllegalArgumentException("Column " + name + " must have a concrete type, found " + type);
        }
        this.type = Type.collection(inner);
    }

    public String name() {
        return name;
    }

    public Table table() {
        return table;
    }

    @Override
    public Type type() {
        return type;
    }

    public SelectItem as(String alias) {
        Objects.requireNonNull(alias, "alias");
        return SelectItem.of(this, alias);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Column column)) {
            return false;
        }
        return column.table == table && column.name.equals(name) && column.type.equals(type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(table), name, type);
    }

    @Override
    public String toString() {
        return table.name() + "." + name + ": " + type;
    }
}
