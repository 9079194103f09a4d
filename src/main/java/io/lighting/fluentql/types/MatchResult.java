package io.lighting.fluentql.types;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a successful match.
 *
 * @param matchedTypes one entry per parameter: the alternative the argument satisfied, with type
 *                     variables replaced by the argument's own type
 * @param mapping resolved type variables
 */
public record MatchResult(List<Type> matchedTypes, TypeVarMapping mapping) {
    public MatchResult {
        Objects.requireNonNull(matchedTypes, "matchedTypes");
        Objects.requireNonNull(mapping, "mapping");
        matchedTypes = List.copyOf(matchedTypes);
    }

    public boolean anyCollection() {
        return matchedTypes.stream().anyMatch(Type::isCollection);
    }
}
