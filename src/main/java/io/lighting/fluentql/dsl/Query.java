package io.lighting.fluentql.dsl;

import io.lighting.fluentql.error.InvalidOperationException;
import io.lighting.fluentql.error.QueryBuildException;
import io.lighting.fluentql.error.TypeMismatchException;
import io.lighting.fluentql.function.FunctionCall;
import io.lighting.fluentql.function.FunctionRegistry;
import io.lighting.fluentql.function.Functions;
import io.lighting.fluentql.sql.Dialect;
import io.lighting.fluentql.sql.SqlCompiler;
import io.lighting.fluentql.sql.ast.AllColumns;
import io.lighting.fluentql.sql.ast.Assignment;
import io.lighting.fluentql.sql.ast.Condition;
import io.lighting.fluentql.sql.ast.Expr;
import io.lighting.fluentql.sql.ast.Join;
import io.lighting.fluentql.sql.ast.JoinType;
import io.lighting.fluentql.sql.ast.SelectItem;
import io.lighting.fluentql.sql.dialect.Dialects;
import io.lighting.fluentql.types.Type;
import io.lighting.fluentql.types.TypeMatcher;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Immutable SQL statement built step by step.
 * <p>
 * Every builder method returns a new instance and leaves the receiver untouched, so a partly
 * built query can serve as a template for several statements. Which methods are legal depends
 * on the {@link QueryCommand}; anything else raises {@link InvalidOperationException}.
 * <pre>{@code
 * Query query = Query.select(books.column("id"), books.column("title").as("book_title"))
 *     .from(books)
 *     .where(books.column("price").gt(100))
 *     .andWhere(q -> q.where(books.column("year").lt(1990)).orWhere(books.column("title").like("%cars%")));
 * String sql = query.compile(Dialects.generic());
 * }</pre>
 */
public final class Query implements Expr {
    private static final Set<QueryCommand> CONDITION_SCOPES =
        EnumSet.of(QueryCommand.WHERE, QueryCommand.ON, QueryCommand.HAVING);
    private static final Set<QueryCommand> WHERE_COMMANDS = EnumSet.of(
        QueryCommand.SELECT,
        QueryCommand.DELETE,
        QueryCommand.UPDATE,
        QueryCommand.WHERE,
        QueryCommand.ON,
        QueryCommand.HAVING
    );
    private static final Set<QueryCommand> SELECT_ONLY = EnumSet.of(QueryCommand.SELECT);

    private final QueryCommand command;
    private final Table target;
    private final boolean distinct;
    private final List<SelectItem> selectItems;
    private final List<Join> joins;
    private final Condition where;
    private final List<Expr> groupBy;
    private final Condition having;
    private final List<FunctionCall> orderBy;
    private final Integer limit;
    private final Integer offset;
    private final List<Column> insertColumns;
    private final List<List<Expr>> rows;
    private final List<Assignment> assignments;

    private Query(QueryCommand command, Table target) {
        this(new Draft(command, target));
    }

    private Query(Draft draft) {
        this.command = draft.command;
        this.target = draft.target;
        this.distinct = draft.distinct;
        this.selectItems = draft.selectItems;
        this.joins = draft.joins;
        this.where = draft.where;
        this.groupBy = draft.groupBy;
        this.having = draft.having;
        this.orderBy = draft.orderBy;
        this.limit = draft.limit;
        this.offset = draft.offset;
        this.insertColumns = draft.insertColumns;
        this.rows = draft.rows;
        this.assignments = draft.assignments;
    }

    /**
     * Starts a select. No entries means {@code select *}. Entries are columns, calls,
     * {@link Table#all()} markers, or {@link SelectItem}s carrying an alias.
     */
    public static Query select(Object... projection) {
        Objects.requireNonNull(projection, "projection");
        return select(Arrays.asList(projection));
    }

    public static Query select(List<?> projection) {
        Objects.requireNonNull(projection, "projection");
        Draft draft = new Draft(QueryCommand.SELECT, null);
        List<SelectItem> items = new ArrayList<>(projection.size());
        for (Object entry : projection) {
            items.add(toSelectItem(entry));
        }
        draft.selectItems = List.copyOf(items);
        return draft.build();
    }

    public static Query insert() {
        return new Query(QueryCommand.INSERT, null);
    }

    public static Query update(Table table) {
        return new Query(QueryCommand.UPDATE, Objects.requireNonNull(table, "table"));
    }

    public static Query delete() {
        return new Query(QueryCommand.DELETE, null);
    }

    /**
     * {@code create table} from the table's schema.
     */
    public static Query create(Table table) {
        Objects.requireNonNull(table, "table");
        if (!table.hasSchema() || table.columns().isEmpty()) {
            throw new QueryBuildException("Cannot create table " + table.qualifiedName() + " without a schema");
        }
        for (Column column : table.columns()) {
            if (column.type().innerType().isAny()) {
                throw new QueryBuildException("Column " + column.name() + " of " + table.qualifiedName()
                    + " needs a concrete type to be created");
            }
        }
        return new Query(QueryCommand.CREATE, table);
    }

    public static Query drop(Table table) {
        return new Query(QueryCommand.DROP, Objects.requireNonNull(table, "table"));
    }

    public Query from(Table table) {
        require("from", EnumSet.of(QueryCommand.SELECT, QueryCommand.DELETE));
        Draft next = new Draft(this);
        next.target = Objects.requireNonNull(table, "table");
        return next.build();
    }

    public Query into(Table table) {
        require("into", EnumSet.of(QueryCommand.INSERT));
        Draft next = new Draft(this);
        next.target = Objects.requireNonNull(table, "table");
        return next.build();
    }

    public Query columns(Column... columns) {
        require("columns", EnumSet.of(QueryCommand.INSERT));
        Objects.requireNonNull(columns, "columns");
        if (!rows.isEmpty()) {
            throw new QueryBuildException("Insert columns must be set before values");
        }
        Draft next = new Draft(this);
        next.insertColumns = List.of(columns);
        return next.build();
    }

    /**
     * Appends one row of values. Each value is checked against the type of its column.
     */
    public Query values(Object... values) {
        require("values", EnumSet.of(QueryCommand.INSERT));
        Objects.requireNonNull(values, "values");
        List<Column> columns = insertColumns.isEmpty() && target != null ? target.columns() : insertColumns;
        if (columns.isEmpty()) {
            throw new QueryBuildException("Insert needs explicit columns or a target table with a schema");
        }
        List<Expr> row = new ArrayList<>(values.length);
        for (Object value : values) {
            row.add(Expr.of(value));
        }
        List<Type> expected = new ArrayList<>(columns.size());
        for (Column column : columns) {
            expected.add(assignable(column));
        }
        matcher().match("values", expected, row.stream().map(Expr::type).toList());
        Draft next = new Draft(this);
        List<List<Expr>> nextRows = new ArrayList<>(rows);
        nextRows.add(List.copyOf(row));
        next.rows = List.copyOf(nextRows);
        if (insertColumns.isEmpty()) {
            next.insertColumns = List.copyOf(columns);
        }
        return next.build();
    }

    /**
     * Adds {@code column = value} to an update; the value must fit the column's type.
     */
    public Query set(Column column, Object value) {
        require("set", EnumSet.of(QueryCommand.UPDATE));
        Objects.requireNonNull(column, "column");
        Expr expr = Expr.of(value);
        matcher().match("set " + column.name(), List.of(assignable(column)), List.of(expr.type()));
        Draft next = new Draft(this);
        List<Assignment> nextAssignments = new ArrayList<>(assignments);
        nextAssignments.add(new Assignment(column, expr));
        next.assignments = List.copyOf(nextAssignments);
        return next.build();
    }

    public Query distinct() {
        require("distinct", SELECT_ONLY);
        Draft next = new Draft(this);
        next.distinct = true;
        return next.build();
    }

    public Query where(Expr predicate) {
        return andWhere(predicate);
    }

    public Query where(UnaryOperator<Query> group) {
        return andWhere(group);
    }

    public Query andWhere(Expr predicate) {
        require("andWhere", WHERE_COMMANDS);
        return withWhere(Condition.and(where, predicate("where", predicate)));
    }

    public Query andWhere(UnaryOperator<Query> group) {
        require("andWhere", WHERE_COMMANDS);
        return withWhere(Condition.and(where, group(whereScope(), group)));
    }

    public Query orWhere(Expr predicate) {
        require("orWhere", WHERE_COMMANDS);
        return withWhere(Condition.or(where, predicate("where", predicate)));
    }

    public Query orWhere(UnaryOperator<Query> group) {
        require("orWhere", WHERE_COMMANDS);
        return withWhere(Condition.or(where, group(whereScope(), group)));
    }

    public Query innerJoin(Table table) {
        return join("innerJoin", JoinType.INNER, table);
    }

    public Query outerJoin(Table table) {
        return join("outerJoin", JoinType.OUTER, table);
    }

    public Query leftJoin(Table table) {
        return join("leftJoin", JoinType.LEFT, table);
    }

    public Query rightJoin(Table table) {
        return join("rightJoin", JoinType.RIGHT, table);
    }

    public Query crossJoin(Table table) {
        return join("crossJoin", JoinType.CROSS, table);
    }

    /**
     * Joins {@code table} on the condition the callback builds with {@code on/andOn/orOn}
     * on the JOIN-scoped builder it is given.
     */
    public Query innerJoin(Table table, UnaryOperator<Query> condition) {
        return join("innerJoin", JoinType.INNER, table, condition);
    }

    public Query outerJoin(Table table, UnaryOperator<Query> condition) {
        return join("outerJoin", JoinType.OUTER, table, condition);
    }

    public Query leftJoin(Table table, UnaryOperator<Query> condition) {
        return join("leftJoin", JoinType.LEFT, table, condition);
    }

    public Query rightJoin(Table table, UnaryOperator<Query> condition) {
        return join("rightJoin", JoinType.RIGHT, table, condition);
    }

    /**
     * Sets the condition of the last join, or extends the condition inside a join callback or ON group.
     */
    public Query on(Expr predicate) {
        return andOn(predicate);
    }

    public Query on(UnaryOperator<Query> group) {
        return andOn(group);
    }

    public Query andOn(Expr predicate) {
        if (buildsJoinCondition()) {
            return withWhere(Condition.and(where, predicate("on", predicate)));
        }
        Join join = lastJoinForOn("andOn");
        return replaceLastJoin(join.withOn(Condition.and(join.on(), predicate("on", predicate))));
    }

    public Query andOn(UnaryOperator<Query> group) {
        if (buildsJoinCondition()) {
            return withWhere(Condition.and(where, group(QueryCommand.ON, group)));
        }
        Join join = lastJoinForOn("andOn");
        return replaceLastJoin(join.withOn(Condition.and(join.on(), group(QueryCommand.ON, group))));
    }

    public Query orOn(Expr predicate) {
        if (buildsJoinCondition()) {
            return withWhere(Condition.or(where, predicate("on", predicate)));
        }
        Join join = lastJoinForOn("orOn");
        return replaceLastJoin(join.withOn(Condition.or(join.on(), predicate("on", predicate))));
    }

    public Query orOn(UnaryOperator<Query> group) {
        if (buildsJoinCondition()) {
            return withWhere(Condition.or(where, group(QueryCommand.ON, group)));
        }
        Join join = lastJoinForOn("orOn");
        return replaceLastJoin(join.withOn(Condition.or(join.on(), group(QueryCommand.ON, group))));
    }

    /**
     * Joins the last joined table on equality of the named columns shared by both sides.
     */
    public Query using(String... columnNames) {
        require("using", SELECT_ONLY);
        Objects.requireNonNull(columnNames, "columnNames");
        if (columnNames.length == 0) {
            throw new QueryBuildException("USING needs at least one column name");
        }
        Join join = lastJoin("using");
        if (join.type() == JoinType.CROSS) {
            throw new InvalidOperationException(command, "using", "a cross join takes no join condition");
        }
        if (!join.isPending()) {
            throw new InvalidOperationException(command, "using", "the join condition is already set");
        }
        for (String columnName : columnNames) {
            Objects.requireNonNull(columnName, "columnName");
            if (columnName.isBlank()) {
                throw new IllegalArgumentException("columnName must not be blank");
            }
        }
        return replaceLastJoin(join.withUsing(List.of(columnNames)));
    }

    public Query groupBy(Object... expressions) {
        require("groupBy", SELECT_ONLY);
        Objects.requireNonNull(expressions, "expressions");
        List<Expr> items = new ArrayList<>(groupBy);
        for (Object expression : expressions) {
            if (!(expression instanceof Column) && !(expression instanceof FunctionCall)) {
                throw new QueryBuildException("Cannot group by " + expression + ": expected a column or function call");
            }
            items.add((Expr) expression);
        }
        Draft next = new Draft(this);
        next.groupBy = List.copyOf(items);
        return next.build();
    }

    public Query having(Expr predicate) {
        return andHaving(predicate);
    }

    public Query having(UnaryOperator<Query> group) {
        return andHaving(group);
    }

    public Query andHaving(Expr predicate) {
        if (command == QueryCommand.HAVING) {
            return withWhere(Condition.and(where, predicate("having", predicate)));
        }
        require("andHaving", SELECT_ONLY);
        return withHaving(Condition.and(having, predicate("having", predicate)));
    }

    public Query andHaving(UnaryOperator<Query> group) {
        if (command == QueryCommand.HAVING) {
            return withWhere(Condition.and(where, group(QueryCommand.HAVING, group)));
        }
        require("andHaving", SELECT_ONLY);
        return withHaving(Condition.and(having, group(QueryCommand.HAVING, group)));
    }

    public Query orHaving(Expr predicate) {
        if (command == QueryCommand.HAVING) {
            return withWhere(Condition.or(where, predicate("having", predicate)));
        }
        require("orHaving", SELECT_ONLY);
        return withHaving(Condition.or(having, predicate("having", predicate)));
    }

    public Query orHaving(UnaryOperator<Query> group) {
        if (command == QueryCommand.HAVING) {
            return withWhere(Condition.or(where, group(QueryCommand.HAVING, group)));
        }
        require("orHaving", SELECT_ONLY);
        return withHaving(Condition.or(having, group(QueryCommand.HAVING, group)));
    }

    /**
     * Appends sort keys: columns (sorted ascending) or {@code asc()}/{@code desc()} calls.
     */
    public Query orderBy(Object... items) {
        require("orderBy", SELECT_ONLY);
        Objects.requireNonNull(items, "items");
        List<FunctionCall> order = new ArrayList<>(orderBy);
        for (Object item : items) {
            if (item instanceof Column column) {
                order.add(Functions.asc(column));
            } else if (item instanceof FunctionCall call
                && (call.signature() == Functions.ASC || call.signature() == Functions.DESC)) {
                order.add(call);
            } else {
                throw new QueryBuildException("Cannot order by " + item + ": expected a column, asc() or desc()");
            }
        }
        Draft next = new Draft(this);
        next.orderBy = List.copyOf(order);
        return next.build();
    }

    public Query fetch(int count) {
        require("fetch", SELECT_ONLY);
        if (count < 0) {
            throw new IllegalArgumentException("fetch count must be >= 0");
        }
        Draft next = new Draft(this);
        next.limit = count;
        return next.build();
    }

    public Query skip(int count) {
        require("skip", SELECT_ONLY);
        if (count < 0) {
            throw new IllegalArgumentException("skip count must be >= 0");
        }
        Draft next = new Draft(this);
        next.offset = count;
        return next.build();
    }

    public String compile(Dialect dialect) {
        return new SqlCompiler(dialect).compile(this);
    }

    public String compile(String dialectName) {
        return compile(Dialects.get(dialectName));
    }

    public QueryCommand command() {
        return command;
    }

    public Table target() {
        return target;
    }

    /**
     * The target followed by every joined table, without repeats.
     */
    public List<Table> tables() {
        List<Table> tables = new ArrayList<>();
        if (target != null) {
            tables.add(target);
        }
        for (Join join : joins) {
            if (!tables.contains(join.table())) {
                tables.add(join.table());
            }
        }
        return tables;
    }

    public boolean isDistinct() {
        return distinct;
    }

    public List<SelectItem> selectItems() {
        return selectItems;
    }

    public List<Join> joins() {
        return joins;
    }

    public Condition where() {
        return where;
    }

    public List<Expr> groupBy() {
        return groupBy;
    }

    public Condition having() {
        return having;
    }

    public List<FunctionCall> orderBy() {
        return orderBy;
    }

    public Integer limit() {
        return limit;
    }

    public Integer offset() {
        return offset;
    }

    public List<Column> insertColumns() {
        return insertColumns;
    }

    public List<List<Expr>> rows() {
        return rows;
    }

    public List<Assignment> assignments() {
        return assignments;
    }

    /**
     * As an argument a select yields the values of its only projected expression.
     */
    @Override
    public Type type() {
        if (command == QueryCommand.SELECT && selectItems.size() == 1) {
            Expr expr = selectItems.get(0).expr();
            if (!(expr instanceof AllColumns)) {
                return Type.collection(expr.type().innerType());
            }
        }
        return Type.collection(Type.ANY);
    }

    @Override
    public String toString() {
        return command + " " + (target == null ? "<no target>" : target.qualifiedName());
    }

    private Query join(String method, JoinType type, Table table) {
        require(method, SELECT_ONLY);
        Objects.requireNonNull(table, "table");
        Draft next = new Draft(this);
        List<Join> nextJoins = new ArrayList<>(joins);
        nextJoins.add(Join.pending(type, table));
        next.joins = List.copyOf(nextJoins);
        return next.build();
    }

    private Query join(String method, JoinType type, Table table, UnaryOperator<Query> condition) {
        Query joined = join(method, type, table);
        Condition on = scoped(QueryCommand.JOIN, condition);
        return joined.replaceLastJoin(joined.lastJoin(method).withOn(on));
    }

    private boolean buildsJoinCondition() {
        return command == QueryCommand.ON || command == QueryCommand.JOIN;
    }

    private Join lastJoin(String method) {
        if (joins.isEmpty()) {
            throw new InvalidOperationException(command, method, "there is no join to attach a condition to");
        }
        return joins.get(joins.size() - 1);
    }

    private Join lastJoinForOn(String method) {
        require(method, SELECT_ONLY);
        Join join = lastJoin(method);
        if (join.type() == JoinType.CROSS) {
            throw new InvalidOperationException(command, method, "a cross join takes no join condition");
        }
        if (join.using() != null) {
            throw new InvalidOperationException(command, method, "the join already uses USING");
        }
        return join;
    }

    private Query replaceLastJoin(Join join) {
        Draft next = new Draft(this);
        List<Join> nextJoins = new ArrayList<>(joins);
        nextJoins.set(nextJoins.size() - 1, join);
        next.joins = List.copyOf(nextJoins);
        return next.build();
    }

    private Query withWhere(Condition condition) {
        Draft next = new Draft(this);
        next.where = condition;
        return next.build();
    }

    private Query withHaving(Condition condition) {
        Draft next = new Draft(this);
        next.having = condition;
        return next.build();
    }

    private QueryCommand whereScope() {
        return CONDITION_SCOPES.contains(command) ? command : QueryCommand.WHERE;
    }

    private void require(String method, Set<QueryCommand> allowed) {
        if (!allowed.contains(command)) {
            throw new InvalidOperationException(command, method);
        }
    }

    private static Condition group(QueryCommand scope, UnaryOperator<Query> group) {
        return new Condition.Group(scoped(scope, group));
    }

    /**
     * Runs the callback on a fresh builder of the given scope and returns the condition it built.
     */
    private static Condition scoped(QueryCommand scope, UnaryOperator<Query> callback) {
        Objects.requireNonNull(callback, "callback");
        Query built = callback.apply(new Query(scope, null));
        if (built == null || built.where == null) {
            throw new QueryBuildException(scope + " condition must not be empty");
        }
        if (built.command != scope) {
            throw new QueryBuildException(scope + " condition must be built on the builder it was given");
        }
        return built.where;
    }

    private static Condition predicate(String clause, Expr predicate) {
        Objects.requireNonNull(predicate, "predicate");
        Type inner = predicate.type().innerType();
        if (!inner.isAny() && !inner.equals(Type.BOOLEAN)) {
            throw new TypeMismatchException(
                clause,
                0,
                Type.union(Type.BOOLEAN, Type.collection(Type.BOOLEAN)),
                predicate.type()
            );
        }
        return new Condition.Predicate(predicate);
    }

    private static SelectItem toSelectItem(Object entry) {
        if (entry instanceof SelectItem item) {
            return item;
        }
        if (entry instanceof Expr expr) {
            return SelectItem.of(expr);
        }
        throw new QueryBuildException("Cannot select " + entry + ": expected a column, call or select item");
    }

    private static Type assignable(Column column) {
        Type inner = column.type().innerType();
        return Type.union(inner, Type.collection(inner));
    }

    private static TypeMatcher matcher() {
        return FunctionRegistry.global().matcher();
    }

    /**
     * Mutable working copy a builder step edits before freezing it into the next query.
     */
    private static final class Draft {
        private final QueryCommand command;
        private Table target;
        private boolean distinct;
        private List<SelectItem> selectItems = List.of();
        private List<Join> joins = List.of();
        private Condition where;
        private List<Expr> groupBy = List.of();
        private Condition having;
        private List<FunctionCall> orderBy = List.of();
        private Integer limit;
        private Integer offset;
        private List<Column> insertColumns = List.of();
        private List<List<Expr>> rows = List.of();
        private List<Assignment> assignments = List.of();

        private Draft(QueryCommand command, Table target) {
            this.command = command;
            this.target = target;
        }

        private Draft(Query source) {
            this.command = source.command;
            this.target = source.target;
            this.distinct = source.distinct;
            this.selectItems = source.selectItems;
            this.joins = source.joins;
            this.where = source.where;
            this.groupBy = source.groupBy;
            this.having = source.having;
            this.orderBy = source.orderBy;
            this.limit = source.limit;
            this.offset = source.offset;
            this.insertColumns = source.insertColumns;
            this.rows = source.rows;
            this.assignments = source.assignments;
        }

        private Query build() {
            return new Query(this);
        }
    }
}
