package io.lighting.fluentql.types;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Closed algebra of value types used to check function and operator calls.
 * <p>
 * {@link Concrete} is the only scalar leaf. {@link Collection} marks a column-bound value
 * (a column reference or a call producing one) as opposed to a literal scalar.
 * {@link Variable} and {@link Union} only appear in function signatures.
 */
public sealed interface Type permits Type.Any, Type.Concrete, Type.Collection, Type.Union, Type.Variable {

    Any ANY = new Any();
    Concrete BOOLEAN = new Concrete(Kind.BOOLEAN);
    Concrete NUMBER = new Concrete(Kind.NUMBER);
    Concrete STRING = new Concrete(Kind.STRING);
    Concrete DATE = new Concrete(Kind.DATE);
    Concrete TIME = new Concrete(Kind.TIME);
    Concrete DATETIME = new Concrete(Kind.DATETIME);

    static Concrete of(Kind kind) {
        return switch (Objects.requireNonNull(kind, "kind")) {
            case BOOLEAN -> BOOLEAN;
            case NUMBER -> NUMBER;
            case STRING -> STRING;
            case DATE -> DATE;
            case TIME -> TIME;
            case DATETIME -> DATETIME;
        };
    }

    static Collection collection(Type inner) {
        return new Collection(inner);
    }

    static Union union(Type... alternatives) {
        return new Union(List.of(alternatives));
    }

    static Variable variable(String id, Kind... bound) {
        Set<Kind> kinds = EnumSet.noneOf(Kind.class);
        kinds.addAll(List.of(bound));
        return new Variable(id, kinds);
    }

    default boolean isAny() {
        return this instanceof Any;
    }

    default boolean isCollection() {
        return this instanceof Collection;
    }

    /**
     * Strips one {@link Collection} layer; other types are returned as they are.
     */
    default Type innerType() {
        if (this instanceof Collection collection) {
            return collection.inner();
        }
        return this;
    }

    /**
     * Whether the type can be the result of a resolved call: a concrete kind, the wildcard,
     * or one of those wrapped once in {@link Collection}.
     */
    default boolean isResolved() {
        Type inner = innerType();
        return inner instanceof Concrete || inner instanceof Any;
    }

    enum Kind {
        BOOLEAN("Boolean"),
        NUMBER("Number"),
        STRING("String"),
        DATE("Date"),
        TIME("Time"),
        DATETIME("DateTime");

        private final String displayName;

        Kind(String displayName) {
            this.displayName = displayName;
        }

        public String displayName() {
            return displayName;
        }

        public static Kind parse(String name) {
            Objects.requireNonNull(name, "name");
            for (Kind kind : values()) {
                if (kind.displayName.equalsIgnoreCase(name.trim()) || kind.name().equalsIgnoreCase(name.trim())) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("Unknown type kind: " + name);
        }
    }

    record Any() implements Type {
        @Override
        public String toString() {
            return "Any";
        }
    }

    record Concrete(Kind kind) implements Type {
        public Concrete {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public String toString() {
            return kind.displayName();
        }
    }

    record Collection(Type inner) implements Type {
        public Collection {
            Objects.requireNonNull(inner, "inner");
        }

        @Override
        public String toString() {
            return "Collection[" + inner + "]";
        }
    }

    record Union(List<Type> alternatives) implements Type {
        public Union {
            Objects.requireNonNull(alternatives, "alternatives");
            if (alternatives.isEmpty()) {
                throw new IllegalArgumentException("Union must have at least one alternative");
            }
            alternatives = List.copyOf(alternatives);
        }

        @Override
        public String toString() {
            return alternatives.stream().map(Type::toString).collect(Collectors.joining(", ", "Union[", "]"));
        }
    }

    /**
     * Type variable constrained to a set of concrete kinds. An empty bound accepts every kind.
     */
    record Variable(String id, Set<Kind> bound) implements Type {
        public Variable {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(bound, "bound");
            if (id.isBlank()) {
                throw new IllegalArgumentException("id must not be blank");
            }
            bound = bound.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(bound));
        }

        public boolean accepts(Kind kind) {
            return bound.isEmpty() || bound.contains(kind);
        }

        @Override
        public String toString() {
            return id;
        }
    }
}
