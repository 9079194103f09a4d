package io.lighting.fluentql.sql;

/**
 * Binding strength of rendered fragments; higher binds tighter.
 */
public final class Precedence {
    public static final int OR = 1;
    public static final int AND = 2;
    public static final int NOT = 3;
    public static final int COMPARISON = 4;
    public static final int ADDITIVE = 5;
    public static final int MULTIPLICATIVE = 6;
    public static final int POSTFIX = 7;
    public static final int ATOM = 10;

    private Precedence() {
    }
}
