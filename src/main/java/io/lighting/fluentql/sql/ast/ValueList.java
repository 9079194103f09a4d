package io.lighting.fluentql.sql.ast;

import io.lighting.fluentql.types.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parenthesised list of literal values, such as the right side of {@code in}. Typed as a
 * collection of the values' common kind, or of {@link Type#ANY} when the kinds differ.
 */
public record ValueList(List<Literal> values) implements Expr {
    public ValueList {
        Objects.requireNonNull(values, "values");
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Value list must not be empty");
        }
        values = List.copyOf(values);
    }

    public static ValueList of(Iterable<?> values) {
        Objects.requireNonNull(values, "values");
        List<Literal> literals = new ArrayList<>();
        for (Object value : values) {
            literals.add(Literal.of(value));
        }
        return new ValueList(literals);
    }

    @Override
    public Type type() {
        Type common = null;
        for (Literal literal : values) {
            if (literal.type().isAny()) {
                continue;
            }
            if (common == null) {
                common = literal.type();
            } else if (!common.equals(literal.type())) {
                return Type.collection(Type.ANY);
            }
        }
        return Type.collection(common == null ? Type.ANY : common);
    }
}
