package io.lighting.fluentql.types;

import io.lighting.fluentql.error.ArityException;
import io.lighting.fluentql.error.TypeCheckException;
import io.lighting.fluentql.error.TypeMismatchException;
import io.lighting.fluentql.error.TypeVariableConflictException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Unifies the declared parameter types of a signature with the types of the actual arguments.
 * <p>
 * Every parameter is checked on its own first. Type variable occurrences are only collected as
 * candidates during that pass and reconciled afterwards: all non-wildcard candidates of a
 * variable must be identical. No common supertype is ever inferred.
 * <p>
 * A bare {@link Type.Any} argument only comes from a {@code null} literal: it fits any scalar
 * parameter but never a {@link Type.Collection} one.
 * <p>
 * Instances are immutable and safe to share between threads.
 */
public final class TypeMatcher {
    private static final TypeMatcher STRICT = new TypeMatcher(TypeCompatibility.strict());

    private final TypeCompatibility compatibility;

    public TypeMatcher(TypeCompatibility compatibility) {
        this.compatibility = Objects.requireNonNull(compatibility, "compatibility");
    }

    public static TypeMatcher strict() {
        return STRICT;
    }

    public TypeCompatibility compatibility() {
        return compatibility;
    }

    public MatchResult match(String functionName, List<Type> expected, List<Type> actual) {
        Objects.requireNonNull(functionName, "functionName");
        Objects.requireNonNull(expected, "expected");
        Objects.requireNonNull(actual, "actual");
        if (expected.size() != actual.size()) {
            throw new ArityException(functionName, expected.size(), actual.size());
        }
        List<Candidate> candidates = new ArrayList<>();
        List<Type> matchedTypes = new ArrayList<>(expected.size());
        for (int i = 0; i < expected.size(); i++) {
            Type given = Objects.requireNonNull(actual.get(i), "actual type");
            if (!given.isResolved()) {
                throw new IllegalArgumentException("Argument types must be resolved, found " + given);
            }
            Type matched = resolve(expected.get(i), given, i, candidates);
            if (matched == null) {
                throw new TypeMismatchException(functionName, i, expected.get(i), given);
            }
            matchedTypes.add(matched);
        }
        return new MatchResult(matchedTypes, reconcile(functionName, candidates));
    }

    /**
     * Same as {@link #match} but reports failure as {@code false} instead of an exception.
     */
    public boolean matches(List<Type> expected, List<Type> actual) {
        try {
            match("match", expected, actual);
            return true;
        } catch (TypeCheckException ex) {
            return false;
        }
    }

    private Type resolve(Type expected, Type actual, int index, List<Candidate> candidates) {
        if (expected instanceof Type.Any) {
            return actual;
        }
        if (actual instanceof Type.Any) {
            return resolveWildcard(expected, index, candidates);
        }
        if (expected instanceof Type.Concrete concrete) {
            if (actual instanceof Type.Concrete given && compatibility.isCompatible(given.kind(), concrete.kind())) {
                return actual;
            }
            return null;
        }
        if (expected instanceof Type.Collection collection) {
            if (!(actual instanceof Type.Collection given)) {
                return null;
            }
            Type inner = resolve(collection.inner(), given.inner(), index, candidates);
            return inner == null ? null : Type.collection(inner);
        }
        if (expected instanceof Type.Variable variable) {
            Type scalar = actual.innerType();
            if (scalar instanceof Type.Any) {
                candidates.add(new Candidate(variable, index, Type.ANY));
                return actual;
            }
            if (scalar instanceof Type.Concrete given && accepts(variable, given.kind())) {
                candidates.add(new Candidate(variable, index, scalar));
                return actual;
            }
            return null;
        }
        if (expected instanceof Type.Union union) {
            for (Type alternative : union.alternatives()) {
                List<Candidate> attempt = new ArrayList<>();
                Type matched = resolve(alternative, actual, index, attempt);
                if (matched != null) {
                    candidates.addAll(attempt);
                    return matched;
                }
            }
            return null;
        }
        throw new IllegalArgumentException("Unsupported type expression: " + expected);
    }

    private Type resolveWildcard(Type expected, int index, List<Candidate> candidates) {
        if (expected instanceof Type.Concrete) {
            return expected;
        }
        if (expected instanceof Type.Variable variable) {
            candidates.add(new Candidate(variable, index, Type.ANY));
            return Type.ANY;
        }
        if (expected instanceof Type.Collection) {
            return null;
        }
        if (expected instanceof Type.Union union) {
            for (Type alternative : union.alternatives()) {
                List<Candidate> attempt = new ArrayList<>();
                Type matched = resolveWildcard(alternative, index, attempt);
                if (matched != null) {
                    candidates.addAll(attempt);
                    return matched;
                }
            }
            return null;
        }
        return Type.ANY;
    }

    private boolean accepts(Type.Variable variable, Type.Kind kind) {
        if (variable.bound().isEmpty()) {
            return true;
        }
        for (Type.Kind bound : variable.bound()) {
            if (compatibility.isCompatible(kind, bound)) {
                return true;
            }
        }
        return false;
    }

    private TypeVarMapping reconcile(String functionName, List<Candidate> candidates) {
        if (candidates.isEmpty()) {
            return TypeVarMapping.empty();
        }
        Map<Type.Variable, List<Candidate>> grouped = new LinkedHashMap<>();
        for (Candidate candidate : candidates) {
            grouped.computeIfAbsent(candidate.variable(), ignored -> new ArrayList<>()).add(candidate);
        }
        Map<Type.Variable, TypeVarMapping.Binding> bindings = new LinkedHashMap<>();
        for (Map.Entry<Type.Variable, List<Candidate>> entry : grouped.entrySet()) {
            TreeSet<Integer> indices = new TreeSet<>();
            List<Type> distinct = new ArrayList<>();
            for (Candidate candidate : entry.getValue()) {
                indices.add(candidate.argumentIndex());
                if (!candidate.type().isAny() && !distinct.contains(candidate.type())) {
                    distinct.add(candidate.type());
                }
            }
            if (distinct.size() > 1) {
                throw new TypeVariableConflictException(functionName, entry.getKey(), distinct, List.copyOf(indices));
            }
            Type resolved = distinct.isEmpty() ? Type.ANY : distinct.get(0);
            bindings.put(entry.getKey(), new TypeVarMapping.Binding(List.copyOf(indices), resolved));
        }
        return new TypeVarMapping(bindings);
    }

    private record Candidate(Type.Variable variable, int argumentIndex, Type type) {
    }
}
