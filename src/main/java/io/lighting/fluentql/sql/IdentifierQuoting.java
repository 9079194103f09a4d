package io.lighting.fluentql.sql;

public enum IdentifierQuoting {
    NEVER,
    ALWAYS,
    /**
     * Quote only identifiers found in the dialect's reserved word list.
     */
    RESERVED
}
