package io.lighting.fluentql.dsl;

/**
 * Kind of a {@link Query}. The first six are statements; the last four scope the builders
 * handed to condition callbacks and only ever hold a condition tree. {@code JOIN} is the
 * scope of a join's own condition callback, {@code ON} that of a group nested in it.
 */
public enum QueryCommand {
    SELECT,
    INSERT,
    UPDATE,
    DELETE,
    CREATE,
    DROP,
    WHERE,
    ON,
    JOIN,
    HAVING;

    public boolean isStatement() {
        return ordinal() <= DROP.ordinal();
    }
}
