package io.lighting.fluentql.sql.ast;

import java.util.Objects;

/**
 * Boolean expression tree of WHERE, ON and HAVING clauses.
 * <p>
 * Combinators compile in order without added parentheses; a {@link Group} is the only
 * node that compiles parenthesised.
 */
public sealed interface Condition permits Condition.Predicate, Condition.And, Condition.Or, Condition.Group {

    record Predicate(Expr expr) implements Condition {
        public Predicate {
            Objects.requireNonNull(expr, "expr");
        }
    }

    record And(Condition left, Condition right) implements Condition {
        public And {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record Or(Condition left, Condition right) implements Condition {
        public Or {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record Group(Condition inner) implements Condition {
        public Group {
            Objects.requireNonNull(inner, "inner");
        }
    }

    static Condition and(Condition root, Condition next) {
        return root == null ? next : new And(root, next);
    }

    static Condition or(Condition root, Condition next) {
        return root == null ? next : new Or(root, next);
    }
}
