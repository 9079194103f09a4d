package io.lighting.fluentql.function;

import io.lighting.fluentql.sql.ast.Expr;
import io.lighting.fluentql.types.MatchResult;
import io.lighting.fluentql.types.Type;
import io.lighting.fluentql.types.TypeMatcher;
import io.lighting.fluentql.types.TypeVarMapping;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Type-checked invocation of a {@link FunctionSignature}. Immutable; usable as an argument of
 * another call.
 */
public final class FunctionCall implements Operand {
    private final FunctionSignature signature;
    private final List<Expr> arguments;
    private final MatchResult match;
    private final Type type;

    private FunctionCall(FunctionSignature signature, List<Expr> arguments, MatchResult match, Type type) {
        this.signature = signature;
        this.arguments = arguments;
        this.match = match;
        this.type = type;
    }

    /**
     * Checks {@code arguments} against the signature and resolves the return type.
     *
     * @throws io.lighting.fluentql.error.TypeCheckException when the arguments do not fit the signature
     * @throws IllegalStateException when the signature's return rule yields an unresolved type
     */
    public static FunctionCall of(FunctionSignature signature, TypeMatcher matcher, List<?> arguments) {
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(matcher, "matcher");
        Objects.requireNonNull(arguments, "arguments");
        List<Expr> exprs = new ArrayList<>(arguments.size());
        List<Type> types = new ArrayList<>(arguments.size());
        for (Object argument : arguments) {
            Expr expr = Expr.of(argument);
            exprs.add(expr);
            types.add(expr.type());
        }
        MatchResult match = matcher.match(signature.name(), signature.parameters(), types);
        Type type = signature.returnRule().resolve(match);
        if (type == null || !type.isResolved()) {
            throw new IllegalStateException(
                "Return rule of " + signature.name() + " produced an unresolved type: " + type
            );
        }
        return new FunctionCall(signature, List.copyOf(exprs), match, type);
    }

    public FunctionSignature signature() {
        return signature;
    }

    public String name() {
        return signature.name();
    }

    public List<Expr> arguments() {
        return arguments;
    }

    public List<Type> matchedTypes() {
        return match.matchedTypes();
    }

    public TypeVarMapping mapping() {
        return match.mapping();
    }

    @Override
    public Type type() {
        return type;
    }

    @Override
    public String toString() {
        return signature.name() + arguments + " -> " + type;
    }
}
