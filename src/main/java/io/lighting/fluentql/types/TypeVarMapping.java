package io.lighting.fluentql.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolution of every type variable seen while matching one call.
 */
public final class TypeVarMapping {
    private static final TypeVarMapping EMPTY = new TypeVarMapping(Map.of());

    private final Map<Type.Variable, Binding> bindings;

    TypeVarMapping(Map<Type.Variable, Binding> bindings) {
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    public static TypeVarMapping empty() {
        return EMPTY;
    }

    public Optional<Binding> binding(Type.Variable variable) {
        Objects.requireNonNull(variable, "variable");
        return Optional.ofNullable(bindings.get(variable));
    }

    public Type resolve(Type.Variable variable) {
        Binding binding = bindings.get(Objects.requireNonNull(variable, "variable"));
        if (binding == null) {
            throw new IllegalStateException("Type variable " + variable + " was not bound by the call");
        }
        return binding.type();
    }

    public Map<Type.Variable, Binding> asMap() {
        return bindings;
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    /**
     * @param argumentIndices sorted positions of the arguments that bound the variable
     * @param type the single type the variable resolved to; {@link Type#ANY} when only wildcards bound it
     */
    public record Binding(List<Integer> argumentIndices, Type type) {
        public Binding {
            Objects.requireNonNull(argumentIndices, "argumentIndices");
            Objects.requireNonNull(type, "type");
            argumentIndices = List.copyOf(argumentIndices);
        }
    }
}
