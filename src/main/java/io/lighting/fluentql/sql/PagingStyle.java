package io.lighting.fluentql.sql;

public enum PagingStyle {
    /**
     * {@code limit n offset m} after the order by clause.
     */
    LIMIT_OFFSET,
    /**
     * {@code offset m rows fetch first n rows only}.
     */
    FETCH_FIRST,
    /**
     * {@code select top n ...}; offsets are not expressible.
     */
    TOP
}
