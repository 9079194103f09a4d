package io.lighting.fluentql.sql.dialect;

import io.lighting.fluentql.sql.Dialect;
import io.lighting.fluentql.sql.IdentifierQuoting;
import io.lighting.fluentql.sql.PagingStyle;
import io.lighting.fluentql.sql.Precedence;
import io.lighting.fluentql.sql.ast.JoinType;
import io.lighting.fluentql.sql.function.RenderRules;
import io.lighting.fluentql.types.Type;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide dialects by name.
 * <p>
 * The built-in dialects all derive from {@link #generic()}: lowercase keywords, no identifier
 * quoting and {@code limit/offset} paging. Custom dialects are registered during startup.
 */
public final class Dialects {
    private static final Logger LOGGER = LoggerFactory.getLogger(Dialects.class);

    private static final String[] RESERVED_WORDS = {
        "all", "and", "as", "asc", "between", "by", "case", "column", "create", "delete", "desc",
        "distinct", "drop", "else", "end", "false", "from", "group", "having", "in", "index", "insert",
        "into", "is", "join", "key", "like", "limit", "not", "null", "offset", "on", "or", "order",
        "primary", "select", "set", "table", "then", "true", "union", "update", "user", "using",
        "values", "when", "where"
    };

    private static final SqlDialect GENERIC = genericDialect();
    private static final SqlDialect ANSI = SqlDialect.extend(GENERIC, "ansi")
        .pagingStyle(PagingStyle.FETCH_FIRST)
        .joinKeyword(JoinType.OUTER, "full outer join")
        .build();
    private static final SqlDialect POSTGRES = SqlDialect.extend(GENERIC, "postgres")
        .quoting(IdentifierQuoting.RESERVED)
        .quotes("\"", "\"")
        .joinKeyword(JoinType.OUTER, "full outer join")
        .function("ilike", RenderRules.infix("ilike", Precedence.COMPARISON))
        .function("bitwisexor", RenderRules.infix("<>", Precedence.COMPARISON))
        .build();
    private static final SqlDialect MYSQL = SqlDialect.extend(GENERIC, "mysql")
        .quoting(IdentifierQuoting.RESERVED)
        .quotes("`", "`")
        .unsupportedJoin(JoinType.OUTER)
        .typeName(Type.Kind.DATETIME, "datetime")
        .typeName(Type.Kind.NUMBER, "decimal")
        .build();
    private static final SqlDialect SQLITE = SqlDialect.extend(GENERIC, "sqlite")
        .quoting(IdentifierQuoting.RESERVED)
        .quotes("\"", "\"")
        .joinKeyword(JoinType.OUTER, "full outer join")
        .typeName(Type.Kind.STRING, "text")
        .typeName(Type.Kind.DATE, "text")
        .typeName(Type.Kind.TIME, "text")
        .typeName(Type.Kind.DATETIME, "text")
        .typeName(Type.Kind.BOOLEAN, "integer")
        .build();
    private static final SqlDialect SQLSERVER = SqlDialect.extend(GENERIC, "sqlserver")
        .quoting(IdentifierQuoting.RESERVED)
        .quotes("[", "]")
        .pagingStyle(PagingStyle.TOP)
        .joinKeyword(JoinType.OUTER, "full outer join")
        .typeName(Type.Kind.BOOLEAN, "bit")
        .typeName(Type.Kind.STRING, "nvarchar(max)")
        .typeName(Type.Kind.DATETIME, "datetime2")
        .build();
    private static final SqlDialect ORACLE = SqlDialect.extend(GENERIC, "oracle")
        .quoting(IdentifierQuoting.RESERVED)
        .quotes("\"", "\"")
        .pagingStyle(PagingStyle.FETCH_FIRST)
        .joinKeyword(JoinType.OUTER, "full outer join")
        .typeName(Type.Kind.NUMBER, "number")
        .typeName(Type.Kind.STRING, "varchar2(4000)")
        .typeName(Type.Kind.BOOLEAN, "number(1)")
        .typeName(Type.Kind.TIME, "varchar2(8)")
        .build();

    private static final Map<String, Dialect> DIALECTS = new ConcurrentHashMap<>();

    static {
        register(GENERIC);
        register(ANSI);
        register(POSTGRES);
        register(MYSQL);
        register(SQLITE);
        register(SQLSERVER);
        register(ORACLE);
    }

    private Dialects() {
    }

    public static SqlDialect generic() {
        return GENERIC;
    }

    public static SqlDialect ansi() {
        return ANSI;
    }

    public static SqlDialect postgres() {
        return POSTGRES;
    }

    public static SqlDialect mysql() {
        return MYSQL;
    }

    public static SqlDialect sqlite() {
        return SQLITE;
    }

    public static SqlDialect sqlserver() {
        return SQLSERVER;
    }

    public static SqlDialect oracle() {
        return ORACLE;
    }

    /**
     * Registers the dialect under its id, replacing any earlier one.
     */
    public static void register(Dialect dialect) {
        Objects.requireNonNull(dialect, "dialect");
        Dialect previous = DIALECTS.put(normalize(dialect.id()), dialect);
        if (previous != null && previous != dialect) {
            LOGGER.debug("Replaced dialect {}", dialect.id());
        } else {
            LOGGER.debug("Registered dialect {}", dialect.id());
        }
    }

    public static Optional<Dialect> find(String id) {
        Objects.requireNonNull(id, "id");
        return Optional.ofNullable(DIALECTS.get(normalize(id)));
    }

    public static Dialect get(String id) {
        return find(id).orElseThrow(() -> new IllegalArgumentException("Unknown dialect: " + id));
    }

    public static Set<String> ids() {
        return new TreeSet<>(DIALECTS.keySet());
    }

    private static SqlDialect genericDialect() {
        return SqlDialect.builder("generic")
            .reservedWords(RESERVED_WORDS)
            .function("add", RenderRules.infix("+", Precedence.ADDITIVE))
            .function("subtract", RenderRules.infix("-", Precedence.ADDITIVE))
            .function("multiply", RenderRules.infix("*", Precedence.MULTIPLICATIVE))
            .function("divide", RenderRules.infix("/", Precedence.MULTIPLICATIVE))
            .function("modulo", RenderRules.infix("%", Precedence.MULTIPLICATIVE))
            .function("bitwiseand", RenderRules.infix("and", Precedence.AND))
            .function("bitwiseor", RenderRules.infix("or", Precedence.OR))
            .function("bitwisexor", RenderRules.infix("xor", Precedence.OR))
            .function("equals", RenderRules.infix("=", Precedence.COMPARISON))
            .function("notequal", RenderRules.infix("<>", Precedence.COMPARISON))
            .function("lessthan", RenderRules.infix("<", Precedence.COMPARISON))
            .function("lessthanorequal", RenderRules.infix("<=", Precedence.COMPARISON))
            .function("greaterthan", RenderRules.infix(">", Precedence.COMPARISON))
            .function("greaterthanorequal", RenderRules.infix(">=", Precedence.COMPARISON))
            .function("like", RenderRules.infix("like", Precedence.COMPARISON))
            .function("not", RenderRules.prefix("not"))
            .function("in", RenderRules.in())
            .function("isnull", RenderRules.postfix("is null"))
            .function("isnotnull", RenderRules.postfix("is not null"))
            .function("max", RenderRules.call())
            .function("min", RenderRules.call())
            .function("sum", RenderRules.call())
            .function("avg", RenderRules.call())
            .function("count", RenderRules.callOrStar())
            .function("asc", RenderRules.postfix("asc"))
            .function("desc", RenderRules.postfix("desc"))
            .joinKeyword(JoinType.INNER, "inner join")
            .joinKeyword(JoinType.OUTER, "outer join")
            .joinKeyword(JoinType.LEFT, "left join")
            .joinKeyword(JoinType.RIGHT, "right join")
            .joinKeyword(JoinType.CROSS, "cross join")
            .typeName(Type.Kind.BOOLEAN, "boolean")
            .typeName(Type.Kind.NUMBER, "numeric")
            .typeName(Type.Kind.STRING, "varchar")
            .typeName(Type.Kind.DATE, "date")
            .typeName(Type.Kind.TIME, "time")
            .typeName(Type.Kind.DATETIME, "timestamp")
            .build();
    }

    private static String normalize(String id) {
        return id.trim().toLowerCase(Locale.ROOT);
    }
}
