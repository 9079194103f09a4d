package io.lighting.fluentql.function;

import io.lighting.fluentql.types.MatchResult;
import io.lighting.fluentql.types.Type;
import io.lighting.fluentql.types.TypeVarMapping;
import java.util.List;
import java.util.Objects;

/**
 * How a signature derives the type of a call from the result of matching its arguments.
 */
public sealed interface ReturnRule permits ReturnRule.Fixed, ReturnRule.Resolved {

    ReturnRule BOOLEAN = fixed(Type.BOOLEAN);
    ReturnRule NUMBER = fixed(Type.NUMBER);

    Type resolve(MatchResult match);

    static ReturnRule fixed(Type expression) {
        return new Fixed(expression);
    }

    static ReturnRule resolver(Resolver resolver) {
        return new Resolved(resolver);
    }

    /**
     * The variable's resolved type, wrapped in {@link Type.Collection} when any argument was column-bound.
     */
    static ReturnRule columnOf(Type.Variable variable) {
        Objects.requireNonNull(variable, "variable");
        return resolver((matchedTypes, mapping) -> {
            Type resolved = mapping.resolve(variable);
            for (Type matched : matchedTypes) {
                if (matched.isCollection()) {
                    return Type.collection(resolved);
                }
            }
            return resolved;
        });
    }

    /**
     * The type the argument at {@code index} was matched with.
     */
    static ReturnRule argument(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
        return resolver((matchedTypes, mapping) -> matchedTypes.get(index));
    }

    @FunctionalInterface
    interface Resolver {
        Type resolve(List<Type> matchedTypes, TypeVarMapping mapping);
    }

    /**
     * Return type expression whose variables are substituted after matching.
     */
    record Fixed(Type expression) implements ReturnRule {
        public Fixed {
            Objects.requireNonNull(expression, "expression");
        }

        @Override
        public Type resolve(MatchResult match) {
            return substitute(expression, match.mapping());
        }

        private static Type substitute(Type type, TypeVarMapping mapping) {
            if (type instanceof Type.Variable variable) {
                return mapping.resolve(variable);
            }
            if (type instanceof Type.Collection collection) {
                return Type.collection(substitute(collection.inner(), mapping).innerType());
            }
            if (type instanceof Type.Union) {
                throw new IllegalStateException("Return type must not be a union: " + type);
            }
            return type;
        }
    }

    record Resolved(Resolver resolver) implements ReturnRule {
        public Resolved {
            Objects.requireNonNull(resolver, "resolver");
        }

        @Override
        public Type resolve(MatchResult match) {
            return resolver.resolve(match.matchedTypes(), match.mapping());
        }
    }
}
