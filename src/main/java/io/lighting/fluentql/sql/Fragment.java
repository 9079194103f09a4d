package io.lighting.fluentql.sql;

import java.util.Objects;

/**
 * Rendered SQL text of one expression together with how tightly it binds.
 * {@code grouped} marks text that is already enclosed in parentheses.
 */
public record Fragment(String sql, int precedence, boolean grouped) {
    public Fragment {
        Objects.requireNonNull(sql, "sql");
    }

    public static Fragment atom(String sql) {
        return new Fragment(sql, Precedence.ATOM, false);
    }

    public static Fragment of(String sql, int precedence) {
        return new Fragment(sql, precedence, false);
    }

    public static Fragment grouped(String sql) {
        return new Fragment(sql, Precedence.ATOM, true);
    }

    public Fragment parenthesized() {
        return grouped("(" + sql + ")");
    }

    /**
     * Parenthesizes the fragment when it binds looser than {@code precedence}.
     */
    public Fragment wrapIfBelow(int precedence) {
        return this.precedence < precedence ? parenthesized() : this;
    }
}
