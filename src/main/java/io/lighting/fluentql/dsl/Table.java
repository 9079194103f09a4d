package io.lighting.fluentql.dsl;

import io.lighting.fluentql.error.QueryBuildException;
import io.lighting.fluentql.sql.ast.AllColumns;
import io.lighting.fluentql.types.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A table with an optional schema. Without a schema any column name resolves to a column of
 * type {@code Collection[Any]}; with one, only declared columns resolve.
 */
public final class Table {
    private final String name;
    private final String database;
    private final Map<String, Column> columns;

    private Table(String name, String database, Map<String, Type> schema) {
        this.name = Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (database != null && database.isBlank()) {
            throw new IllegalArgumentException("database must not be blank");
        }
        this.database = database;
        if (schema == null) {
            this.columns = null;
        } else {
            Map<String, Column> declared = new LinkedHashMap<>();
            schema.forEach((columnName, type) -> declared.put(columnName, new Column(columnName, type, this)));
            this.columns = Collections.unmodifiableMap(declared);
        }
    }

    public static Table of(String name) {
        return new Table(name, null, null);
    }

    /**
     * @param schema column name to type, in declaration order; types may be given bare or
     *               already wrapped in {@link Type.Collection}
     */
    public static Table of(String name, Map<String, Type> schema) {
        Objects.requireNonNull(schema, "schema");
        return new Table(name, null, new LinkedHashMap<>(schema));
    }

    public static Table of(String database, String name, Map<String, Type> schema) {
        Objects.requireNonNull(database, "database");
        return new Table(name, database, schema == null ? null : new LinkedHashMap<>(schema));
    }

    public String name() {
        return name;
    }

    public String database() {
        return database;
    }

    /**
     * Name qualified by the database, when one is set.
     */
    public String qualifiedName() {
        return database == null ? name : database + "." + name;
    }

    public boolean hasSchema() {
        return columns != null;
    }

    public Column column(String columnName) {
        Objects.requireNonNull(columnName, "columnName");
        if (columns == null) {
            return new Column(columnName, Type.ANY, this);
        }
        Column column = columns.get(columnName);
        if (column == null) {
            throw new QueryBuildException("Unknown column " + columnName + " in table " + qualifiedName());
        }
        return column;
    }

    public List<Column> columns() {
        if (columns == null) {
            return List.of();
        }
        return new ArrayList<>(columns.values());
    }

    public AllColumns all() {
        return new AllColumns(this);
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
