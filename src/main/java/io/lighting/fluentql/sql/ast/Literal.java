package io.lighting.fluentql.sql.ast;

import io.lighting.fluentql.types.Type;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Objects;

public record Literal(Object value, Type type) implements Expr {
    public Literal {
        Objects.requireNonNull(type, "type");
        if (type.isCollection()) {
            throw new IllegalArgumentException("Literal values are never column-bound");
        }
    }

    public static Literal of(Object value) {
        return new Literal(value, typeOf(value));
    }

    public static Type typeOf(Object value) {
        if (value == null) {
            return Type.ANY;
        }
        if (value instanceof Boolean) {
            return Type.BOOLEAN;
        }
        if (value instanceof Number) {
            return Type.NUMBER;
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return Type.STRING;
        }
        if (value instanceof LocalDate) {
            return Type.DATE;
        }
        if (value instanceof LocalTime) {
            return Type.TIME;
        }
        if (value instanceof LocalDateTime
            || value instanceof OffsetDateTime
            || value instanceof ZonedDateTime
            || value instanceof Instant) {
            return Type.DATETIME;
        }
        throw new IllegalArgumentException("Unsupported literal type: " + value.getClass().getName());
    }
}
