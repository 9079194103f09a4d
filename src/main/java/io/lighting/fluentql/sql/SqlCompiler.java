package io.lighting.fluentql.sql;

import io.lighting.fluentql.dsl.Column;
import io.lighting.fluentql.dsl.Query;
import io.lighting.fluentql.dsl.QueryCommand;
import io.lighting.fluentql.dsl.Table;
import io.lighting.fluentql.error.CompileException;
import io.lighting.fluentql.function.FunctionCall;
import io.lighting.fluentql.sql.ast.AllColumns;
import io.lighting.fluentql.sql.ast.Assignment;
import io.lighting.fluentql.sql.ast.Condition;
import io.lighting.fluentql.sql.ast.Expr;
import io.lighting.fluentql.sql.ast.Join;
import io.lighting.fluentql.sql.ast.Literal;
import io.lighting.fluentql.sql.ast.SelectItem;
import io.lighting.fluentql.sql.ast.ValueList;
import io.lighting.fluentql.types.Type;
import java.math.BigDecimal;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a {@link Query} into one line of SQL text for a {@link Dialect}.
 * <p>
 * Output is deterministic: compiling the same query twice yields identical text. Column names
 * are qualified with their table as soon as more than one table takes part in a statement, and
 * inside sub-selects for columns of tables the sub-select does not itself reference.
 */
public final class SqlCompiler {
    private static final Logger LOGGER = LoggerFactory.getLogger(SqlCompiler.class);

    private final Dialect dialect;
    private final CompileObserver observer;
    private final boolean alwaysQualify;

    public SqlCompiler(Dialect dialect) {
        this(dialect, CompileObserver.NOOP, false);
    }

    public SqlCompiler(Dialect dialect, CompileObserver observer) {
        this(dialect, observer, false);
    }

    public SqlCompiler(Dialect dialect, CompileObserver observer, boolean alwaysQualify) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.observer = Objects.requireNonNull(observer, "observer");
        this.alwaysQualify = alwaysQualify;
    }

    public Dialect dialect() {
        return dialect;
    }

    public String compile(Query query) {
        Objects.requireNonNull(query, "query");
        long start = System.nanoTime();
        String sql;
        try {
            sql = statement(query) + ";";
        } catch (CompileException ex) {
            LOGGER.debug("Failed to compile {} for dialect {}: {}", query.command(), dialect.id(), ex.getMessage());
            observer.onCompileError(query.command(), dialect.id(), ex);
            throw ex;
        }
        long elapsed = System.nanoTime() - start;
        LOGGER.debug("Compiled {} for dialect {}: {}", query.command(), dialect.id(), sql);
        observer.afterCompile(query.command(), dialect.id(), sql, elapsed);
        return sql;
    }

    /**
     * Renders a single expression, such as a function call, with bare column names.
     */
    public String compileExpression(Expr expr) {
        Objects.requireNonNull(expr, "expr");
        return expression(expr, Scope.UNQUALIFIED).sql();
    }

    private String statement(Query query) {
        QueryCommand command = query.command();
        if (!command.isStatement()) {
            throw new CompileException(dialect.id(), "A " + command + " sub-builder is not a statement");
        }
        if (!dialect.supports(command)) {
            throw new CompileException(dialect.id(), "Command " + command + " is not supported");
        }
        if (query.target() == null) {
            throw new CompileException(dialect.id(), command + " query must have a target");
        }
        Scope scope = scopeOf(query);
        return switch (command) {
            case SELECT -> select(query, scope);
            case INSERT -> insert(query, scope);
            case UPDATE -> update(query, scope);
            case DELETE -> delete(query, scope);
            case CREATE -> create(query);
            case DROP -> keyword("drop table") + " " + tableName(query.target());
            default -> throw new CompileException(dialect.id(), "Command " + command + " is not supported");
        };
    }

    private String select(Query query, Scope scope) {
        StringBuilder sql = new StringBuilder();
        sql.append(keyword("select"));
        if (query.isDistinct()) {
            sql.append(' ').append(keyword("distinct"));
        }
        PagingStyle paging = dialect.pagingStyle();
        if (paging == PagingStyle.TOP) {
            if (query.offset() != null) {
                throw new CompileException(dialect.id(), "Offset cannot be expressed with TOP paging");
            }
            if (query.limit() != null) {
                sql.append(' ').append(keyword("top")).append(' ').append(query.limit());
            }
        }
        sql.append(' ');
        appendProjection(query, scope, sql);
        sql.append(' ').append(keyword("from")).append(' ').append(tableName(query.target()));
        for (Join join : query.joins()) {
            sql.append(' ');
            appendJoin(join, scope, sql);
        }
        appendWhere(query, scope, sql);
        if (!query.groupBy().isEmpty()) {
            sql.append(' ').append(keyword("group by")).append(' ');
            appendExpressions(query.groupBy(), scope, sql);
        }
        if (query.having() != null) {
            sql.append(' ').append(keyword("having")).append(' ').append(condition(query.having(), scope));
        }
        if (!query.orderBy().isEmpty()) {
            sql.append(' ').append(keyword("order by")).append(' ');
            appendExpressions(query.orderBy(), scope, sql);
        }
        if (paging == PagingStyle.LIMIT_OFFSET) {
            if (query.limit() != null) {
                sql.append(' ').append(keyword("limit")).append(' ').append(query.limit());
            }
            if (query.offset() != null) {
                sql.append(' ').append(keyword("offset")).append(' ').append(query.offset());
            }
        } else if (paging == PagingStyle.FETCH_FIRST) {
            if (query.offset() != null) {
                sql.append(' ').append(keyword("offset")).append(' ').append(query.offset())
                    .append(' ').append(keyword("rows"));
            }
            if (query.limit() != null) {
                sql.append(' ').append(keyword("fetch first")).append(' ').append(query.limit())
                    .append(' ').append(keyword("rows only"));
            }
        }
        return sql.toString();
    }

    private String insert(Query query, Scope scope) {
        if (query.rows().isEmpty()) {
            throw new CompileException(dialect.id(), "Insert into " + query.target() + " has no values");
        }
        StringBuilder sql = new StringBuilder();
        sql.append(keyword("insert into")).append(' ').append(tableName(query.target())).append(" (");
        List<Column> columns = query.insertColumns();
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(dialect.quoteIdent(columns.get(i).name()));
        }
        sql.append(") ").append(keyword("values")).append(' ');
        for (int rowIndex = 0; rowIndex < query.rows().size(); rowIndex++) {
            if (rowIndex > 0) {
                sql.append(", ");
            }
            sql.append('(');
            appendExpressions(query.rows().get(rowIndex), scope, sql);
            sql.append(')');
        }
        return sql.toString();
    }

    private String update(Query query, Scope scope) {
        if (query.assignments().isEmpty()) {
            throw new CompileException(dialect.id(), "Update of " + query.target() + " sets no columns");
        }
        StringBuilder sql = new StringBuilder();
        sql.append(keyword("update")).append(' ').append(tableName(query.target()))
            .append(' ').append(keyword("set")).append(' ');
        for (int i = 0; i < query.assignments().size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            Assignment assignment = query.assignments().get(i);
            sql.append(dialect.quoteIdent(assignment.column().name()))
                .append(" = ")
                .append(expression(assignment.value(), scope).sql());
        }
        appendWhere(query, scope, sql);
        return sql.toString();
    }

    private String delete(Query query, Scope scope) {
        StringBuilder sql = new StringBuilder();
        sql.append(keyword("delete from")).append(' ').append(tableName(query.target()));
        appendWhere(query, scope, sql);
        return sql.toString();
    }

    private String create(Query query) {
        StringBuilder sql = new StringBuilder();
        sql.append(keyword("create table")).append(' ').append(tableName(query.target())).append(" (");
        List<Column> columns = query.target().columns();
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            Column column = columns.get(i);
            if (!(column.type().innerType() instanceof Type.Concrete concrete)) {
                throw new CompileException(dialect.id(), "Column " + column.name() + " has no concrete type");
            }
            sql.append(dialect.quoteIdent(column.name())).append(' ').append(dialect.typeName(concrete.kind()));
        }
        sql.append(')');
        return sql.toString();
    }

    private void appendProjection(Query query, Scope scope, StringBuilder sql) {
        List<SelectItem> items = query.selectItems();
        if (items.isEmpty()) {
            if (query.joins().isEmpty()) {
                sql.append('*');
                return;
            }
            List<Table> tables = query.tables();
            for (int i = 0; i < tables.size(); i++) {
                if (i > 0) {
                    sql.append(", ");
                }
                sql.append(dialect.quoteIdent(tables.get(i).name())).append(".*");
            }
            return;
        }
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            SelectItem item = items.get(i);
            sql.append(expression(item.expr(), scope).sql());
            if (item.alias() != null) {
                sql.append(' ').append(keyword("as")).append(' ').append(dialect.quoteIdent(item.alias()));
            }
        }
    }

    private void appendJoin(Join join, Scope scope, StringBuilder sql) {
        if (join.isPending()) {
            throw new CompileException(
                dialect.id(),
                join.type() + " join of " + join.table() + " needs an ON condition or USING columns"
            );
        }
        sql.append(dialect.joinKeyword(join.type())).append(' ').append(tableName(join.table()));
        if (join.on() != null) {
            sql.append(' ').append(keyword("on")).append(' ').append(condition(join.on(), scope));
        } else if (join.using() != null) {
            sql.append(' ').append(keyword("using")).append(" (");
            for (int i = 0; i < join.using().size(); i++) {
                if (i > 0) {
                    sql.append(", ");
                }
                sql.append(dialect.quoteIdent(join.using().get(i)));
            }
            sql.append(')');
        }
    }

    private void appendWhere(Query query, Scope scope, StringBuilder sql) {
        if (query.where() != null) {
            sql.append(' ').append(keyword("where")).append(' ').append(condition(query.where(), scope));
        }
    }

    private void appendExpressions(List<? extends Expr> expressions, Scope scope, StringBuilder sql) {
        for (int i = 0; i < expressions.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append(expression(expressions.get(i), scope).sql());
        }
    }

    private String condition(Condition condition, Scope scope) {
        if (condition instanceof Condition.Predicate predicate) {
            return expression(predicate.expr(), scope).wrapIfBelow(Precedence.AND).sql();
        }
        if (condition instanceof Condition.And and) {
            return condition(and.left(), scope) + " " + keyword("and") + " " + condition(and.right(), scope);
        }
        if (condition instanceof Condition.Or or) {
            return condition(or.left(), scope) + " " + keyword("or") + " " + condition(or.right(), scope);
        }
        if (condition instanceof Condition.Group group) {
            return "(" + condition(group.inner(), scope) + ")";
        }
        throw new CompileException(dialect.id(), "Unsupported condition: " + condition.getClass().getSimpleName());
    }

    private Fragment expression(Expr expr, Scope scope) {
        if (expr instanceof Column column) {
            return Fragment.atom(columnName(column, scope));
        }
        if (expr instanceof Literal literal) {
            return Fragment.atom(literal(literal.value()));
        }
        if (expr instanceof FunctionCall call) {
            List<Fragment> args = new ArrayList<>(call.arguments().size());
            for (Expr argument : call.arguments()) {
                args.add(expression(argument, scope));
            }
            return dialect.renderFunction(call.name(), args);
        }
        if (expr instanceof ValueList list) {
            StringBuilder sql = new StringBuilder("(");
            for (int i = 0; i < list.values().size(); i++) {
                if (i > 0) {
                    sql.append(", ");
                }
                sql.append(literal(list.values().get(i).value()));
            }
            return Fragment.grouped(sql.append(')').toString());
        }
        if (expr instanceof AllColumns all) {
            return Fragment.atom(dialect.quoteIdent(all.table().name()) + ".*");
        }
        if (expr instanceof Query subQuery) {
            if (subQuery.command() != QueryCommand.SELECT) {
                throw new CompileException(dialect.id(), "Only a select can be used as an expression");
            }
            return Fragment.grouped("(" + statement(subQuery) + ")");
        }
        throw new CompileException(dialect.id(), "Unsupported expression: " + expr.getClass().getSimpleName());
    }

    private String columnName(Column column, Scope scope) {
        String name = dialect.quoteIdent(column.name());
        if (scope.requiresQualifier(column.table())) {
            return dialect.quoteIdent(column.table().name()) + "." + name;
        }
        return name;
    }

    private String tableName(Table table) {
        String name = dialect.quoteIdent(table.name());
        if (table.database() == null) {
            return name;
        }
        return dialect.quoteIdent(table.database()) + "." + name;
    }

    private String literal(Object value) {
        if (value == null) {
            return keyword("null");
        }
        if (value instanceof Boolean bool) {
            return keyword(bool ? "true" : "false");
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return quote(value.toString());
        }
        if (value instanceof TemporalAccessor) {
            return quote(value.toString());
        }
        throw new CompileException(dialect.id(), "Unsupported literal: " + value.getClass().getName());
    }

    private String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }

    private String keyword(String keyword) {
        return dialect.keyword(keyword);
    }

    private Scope scopeOf(Query query) {
        List<Table> tables = query.tables();
        return new Scope(tables, alwaysQualify || tables.size() > 1);
    }

    /**
     * Tables visible to a statement. {@code tables == null} renders every column bare.
     */
    private record Scope(List<Table> tables, boolean qualify) {
        static final Scope UNQUALIFIED = new Scope(null, false);

        boolean requiresQualifier(Table table) {
            if (tables == null) {
                return false;
            }
            return qualify || !tables.contains(table);
        }
    }
}
