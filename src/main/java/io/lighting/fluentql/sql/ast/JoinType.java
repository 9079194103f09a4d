package io.lighting.fluentql.sql.ast;

public enum JoinType {
    INNER,
    OUTER,
    LEFT,
    RIGHT,
    CROSS
}
