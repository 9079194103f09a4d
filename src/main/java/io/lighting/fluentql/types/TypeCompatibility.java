package io.lighting.fluentql.types;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Table of concrete kinds accepted where another kind is expected.
 * <p>
 * Identical kinds are always compatible. Anything else, such as accepting a {@code DateTime}
 * where a {@code Date} is expected, has to be allowed explicitly when the table is built.
 */
public final class TypeCompatibility {
    private static final TypeCompatibility STRICT = new TypeCompatibility(new EnumMap<>(Type.Kind.class));

    private final Map<Type.Kind, Set<Type.Kind>> accepted;

    private TypeCompatibility(Map<Type.Kind, Set<Type.Kind>> accepted) {
        Map<Type.Kind, Set<Type.Kind>> copy = new EnumMap<>(Type.Kind.class);
        accepted.forEach((expected, actuals) -> copy.put(expected, Set.copyOf(actuals)));
        this.accepted = copy;
    }

    public static TypeCompatibility strict() {
        return STRICT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isCompatible(Type.Kind actual, Type.Kind expected) {
        Objects.requireNonNull(actual, "actual");
        Objects.requireNonNull(expected, "expected");
        if (actual == expected) {
            return true;
        }
        Set<Type.Kind> kinds = accepted.get(expected);
        return kinds != null && kinds.contains(actual);
    }

    public static final class Builder {
        private final Map<Type.Kind, Set<Type.Kind>> accepted = new EnumMap<>(Type.Kind.class);

        private Builder() {
        }

        /**
         * Accept {@code actual} values where {@code expected} is declared.
         */
        public Builder allow(Type.Kind actual, Type.Kind expected) {
            Objects.requireNonNull(actual, "actual");
            Objects.requireNonNull(expected, "expected");
            accepted.computeIfAbsent(expected, ignored -> EnumSet.noneOf(Type.Kind.class)).add(actual);
            return this;
        }

        public Builder allowBoth(Type.Kind first, Type.Kind second) {
            return allow(first, second).allow(second, first);
        }

        public TypeCompatibility build() {
            return new TypeCompatibility(accepted);
        }
    }
}
