package io.lighting.fluentql.sql.ast;

import io.lighting.fluentql.dsl.Table;
import java.util.List;
import java.util.Objects;

/**
 * A join of {@link #table()} onto the statement. Except for CROSS joins exactly one of
 * {@link #on()} and {@link #using()} is set once the join is complete; a join with neither
 * is still pending.
 */
public record Join(JoinType type, Table table, Condition on, List<String> using) {
    public Join {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(table, "table");
        using = using == null ? null : List.copyOf(using);
        if (on != null && using != null) {
            throw new IllegalArgumentException("Join cannot have both ON and USING");
        }
        if (type == JoinType.CROSS && (on != null || using != null)) {
            throw new IllegalArgumentException("Cross join takes no join condition");
        }
    }

    public static Join pending(JoinType type, Table table) {
        return new Join(type, table, null, null);
    }

    public boolean isPending() {
        return type != JoinType.CROSS && on == null && using == null;
    }

    public Join withOn(Condition condition) {
        return new Join(type, table, condition, null);
    }

    public Join withUsing(List<String> columns) {
        return new Join(type, table, null, columns);
    }
}
