package io.lighting.fluentql.sql.function;

import io.lighting.fluentql.sql.Fragment;
import io.lighting.fluentql.sql.Precedence;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Factories for the render rules dialects register per function name.
 */
public final class RenderRules {
    private RenderRules() {
    }

    /**
     * {@code left op right}. The left operand is parenthesized when it binds looser than the
     * operator, the right one also when it binds equally, so {@code a - (b - c)} keeps its
     * parentheses.
     */
    public static FunctionRenderer infix(String operator, int precedence) {
        Objects.requireNonNull(operator, "operator");
        return (dialect, name, args) -> {
            requireArity(name, args, 2);
            Fragment left = args.get(0).wrapIfBelow(precedence);
            Fragment right = args.get(1).wrapIfBelow(precedence + 1);
            return Fragment.of(left.sql() + " " + dialect.keyword(operator) + " " + right.sql(), precedence);
        };
    }

    /**
     * {@code name(a, b)} under the function's own name.
     */
    public static FunctionRenderer call() {
        return (dialect, name, args) -> Fragment.atom(callText(dialect.keyword(name.toLowerCase(Locale.ROOT)), args));
    }

    /**
     * {@code sqlName(a, b)}, for functions spelled differently in the dialect.
     */
    public static FunctionRenderer call(String sqlName) {
        Objects.requireNonNull(sqlName, "sqlName");
        return (dialect, name, args) -> Fragment.atom(callText(dialect.keyword(sqlName), args));
    }

    /**
     * Like {@link #call()}, rendering {@code name(*)} when there are no arguments.
     */
    public static FunctionRenderer callOrStar() {
        return (dialect, name, args) -> {
            String function = dialect.keyword(name.toLowerCase(Locale.ROOT));
            if (args.isEmpty()) {
                return Fragment.atom(function + "(*)");
            }
            return Fragment.atom(callText(function, args));
        };
    }

    /**
     * {@code op (x)}.
     */
    public static FunctionRenderer prefix(String operator) {
        Objects.requireNonNull(operator, "operator");
        return (dialect, name, args) -> {
            requireArity(name, args, 1);
            Fragment operand = args.get(0);
            String inner = operand.grouped() ? operand.sql() : "(" + operand.sql() + ")";
            return Fragment.of(dialect.keyword(operator) + " " + inner, Precedence.NOT);
        };
    }

    /**
     * {@code x suffix}, such as {@code x is null} or {@code x desc}.
     */
    public static FunctionRenderer postfix(String suffix) {
        Objects.requireNonNull(suffix, "suffix");
        return (dialect, name, args) -> {
            requireArity(name, args, 1);
            Fragment operand = args.get(0).wrapIfBelow(Precedence.ADDITIVE);
            return Fragment.of(operand.sql() + " " + dialect.keyword(suffix), Precedence.POSTFIX);
        };
    }

    /**
     * {@code x in (y)}; a right side that is already parenthesized is not wrapped twice.
     */
    public static FunctionRenderer in() {
        return (dialect, name, args) -> {
            requireArity(name, args, 2);
            Fragment left = args.get(0).wrapIfBelow(Precedence.ADDITIVE);
            Fragment right = args.get(1);
            String values = right.grouped() ? right.sql() : "(" + right.sql() + ")";
            return Fragment.of(left.sql() + " " + dialect.keyword("in") + " " + values, Precedence.COMPARISON);
        };
    }

    private static String callText(String function, List<Fragment> args) {
        StringBuilder sql = new StringBuilder();
        sql.append(function).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(args.get(i).sql());
        }
        sql.append(')');
        return sql.toString();
    }

    private static void requireArity(String name, List<Fragment> args, int arity) {
        if (args.size() != arity) {
            throw new IllegalArgumentException(
                "Render rule of " + name + " expects " + arity + " argument(s), got " + args.size()
            );
        }
    }
}
