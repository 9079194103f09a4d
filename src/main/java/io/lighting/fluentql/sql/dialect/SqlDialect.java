package io.lighting.fluentql.sql.dialect;

import io.lighting.fluentql.dsl.QueryCommand;
import io.lighting.fluentql.error.CompileException;
import io.lighting.fluentql.sql.Dialect;
import io.lighting.fluentql.sql.IdentifierQuoting;
import io.lighting.fluentql.sql.PagingStyle;
import io.lighting.fluentql.sql.ast.JoinType;
import io.lighting.fluentql.sql.function.FunctionRenderer;
import io.lighting.fluentql.types.Type;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Dialect driven by lookup tables: render rules per function name, join keywords, type names,
 * identifier quoting, paging style and the supported statement commands.
 * <p>
 * Dialects are derived from one another with {@link #extend(Dialect, String)}, overriding only
 * the entries that differ.
 */
public final class SqlDialect implements Dialect {
    private final String id;
    private final Map<String, FunctionRenderer> renderers;
    private final Map<JoinType, String> joinKeywords;
    private final Map<Type.Kind, String> typeNames;
    private final Set<QueryCommand> commands;
    private final Set<String> reservedWords;
    private final IdentifierQuoting quoting;
    private final String quoteStart;
    private final String quoteEnd;
    private final PagingStyle pagingStyle;
    private final boolean uppercaseKeywords;

    private SqlDialect(Builder builder) {
        this.id = builder.id;
        this.renderers = Map.copyOf(builder.renderers);
        this.joinKeywords = new EnumMap<>(builder.joinKeywords);
        this.typeNames = new EnumMap<>(builder.typeNames);
        this.commands = EnumSet.copyOf(builder.commands);
        this.reservedWords = Set.copyOf(builder.reservedWords);
        this.quoting = builder.quoting;
        this.quoteStart = builder.quoteStart;
        this.quoteEnd = builder.quoteEnd;
        this.pagingStyle = builder.pagingStyle;
        this.uppercaseKeywords = builder.uppercaseKeywords;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Builder pre-filled with every table of {@code base}, to be stored under a new id.
     */
    public static Builder extend(Dialect base, String id) {
        Objects.requireNonNull(base, "base");
        if (!(base instanceof SqlDialect sqlDialect)) {
            throw new IllegalArgumentException("Only SqlDialect instances can be extended, got " + base.id());
        }
        return sqlDialect.toBuilder().id(id);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(id);
        builder.renderers.putAll(renderers);
        builder.joinKeywords.putAll(joinKeywords);
        builder.typeNames.putAll(typeNames);
        builder.commands.clear();
        builder.commands.addAll(commands);
        builder.reservedWords.addAll(reservedWords);
        builder.quoting = quoting;
        builder.quoteStart = quoteStart;
        builder.quoteEnd = quoteEnd;
        builder.pagingStyle = pagingStyle;
        builder.uppercaseKeywords = uppercaseKeywords;
        return builder;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String quoteIdent(String ident) {
        Objects.requireNonNull(ident, "ident");
        if (ident.isBlank()) {
            throw new IllegalArgumentException("ident must not be blank");
        }
        boolean quote = switch (quoting) {
            case NEVER -> false;
            case ALWAYS -> true;
            case RESERVED -> reservedWords.contains(ident.toLowerCase(Locale.ROOT));
        };
        return quote ? quoteStart + ident + quoteEnd : ident;
    }

    @Override
    public String keyword(String keyword) {
        Objects.requireNonNull(keyword, "keyword");
        return uppercaseKeywords ? keyword.toUpperCase(Locale.ROOT) : keyword;
    }

    @Override
    public String joinKeyword(JoinType type) {
        Objects.requireNonNull(type, "type");
        String keyword = joinKeywords.get(type);
        if (keyword == null) {
            throw new CompileException(id, "Join type " + type + " is not supported");
        }
        return keyword(keyword);
    }

    @Override
    public FunctionRenderer renderer(String functionName) {
        Objects.requireNonNull(functionName, "functionName");
        return renderers.get(normalize(functionName));
    }

    @Override
    public String typeName(Type.Kind kind) {
        Objects.requireNonNull(kind, "kind");
        String name = typeNames.get(kind);
        if (name == null) {
            throw new CompileException(id, "No column type name for " + kind.displayName());
        }
        return keyword(name);
    }

    @Override
    public PagingStyle pagingStyle() {
        return pagingStyle;
    }

    @Override
    public boolean supports(QueryCommand command) {
        return commands.contains(command);
    }

    public IdentifierQuoting quoting() {
        return quoting;
    }

    public boolean isUppercaseKeywords() {
        return uppercaseKeywords;
    }

    @Override
    public String toString() {
        return "SqlDialect[" + id + "]";
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    public static final class Builder {
        private String id;
        private final Map<String, FunctionRenderer> renderers = new HashMap<>();
        private final Map<JoinType, String> joinKeywords = new EnumMap<>(JoinType.class);
        private final Map<Type.Kind, String> typeNames = new EnumMap<>(Type.Kind.class);
        private final Set<QueryCommand> commands = EnumSet.noneOf(QueryCommand.class);
        private final Set<String> reservedWords = new HashSet<>();
        private IdentifierQuoting quoting = IdentifierQuoting.NEVER;
        private String quoteStart = "\"";
        private String quoteEnd = "\"";
        private PagingStyle pagingStyle = PagingStyle.LIMIT_OFFSET;
        private boolean uppercaseKeywords;

        private Builder(String id) {
            id(id);
            for (QueryCommand command : QueryCommand.values()) {
                if (command.isStatement()) {
                    commands.add(command);
                }
            }
        }

        public Builder id(String id) {
            Objects.requireNonNull(id, "id");
            if (id.isBlank()) {
                throw new IllegalArgumentException("id must not be blank");
            }
            this.id = id;
            return this;
        }

        public Builder function(String name, FunctionRenderer renderer) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(renderer, "renderer");
            renderers.put(normalize(name), renderer);
            return this;
        }

        public Builder withoutFunction(String name) {
            Objects.requireNonNull(name, "name");
            renderers.remove(normalize(name));
            return this;
        }

        public Builder joinKeyword(JoinType type, String keyword) {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(keyword, "keyword");
            joinKeywords.put(type, keyword);
            return this;
        }

        public Builder unsupportedJoin(JoinType type) {
            joinKeywords.remove(Objects.requireNonNull(type, "type"));
            return this;
        }

        public Builder typeName(Type.Kind kind, String name) {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(name, "name");
            typeNames.put(kind, name);
            return this;
        }

        public Builder unsupportedCommand(QueryCommand command) {
            commands.remove(Objects.requireNonNull(command, "command"));
            return this;
        }

        public Builder supportedCommand(QueryCommand command) {
            Objects.requireNonNull(command, "command");
            if (!command.isStatement()) {
                throw new IllegalArgumentException(command + " is not a statement command");
            }
            commands.add(command);
            return this;
        }

        public Builder quoting(IdentifierQuoting quoting) {
            this.quoting = Objects.requireNonNull(quoting, "quoting");
            return this;
        }

        public Builder quotes(String start, String end) {
            Objects.requireNonNull(start, "start");
            Objects.requireNonNull(end, "end");
            if (start.isBlank() || end.isBlank()) {
                throw new IllegalArgumentException("quote must not be blank");
            }
            this.quoteStart = start;
            this.quoteEnd = end;
            return this;
        }

        public Builder reservedWords(String... words) {
            Objects.requireNonNull(words, "words");
            Arrays.stream(words).map(SqlDialect::normalize).forEach(reservedWords::add);
            return this;
        }

        public Builder pagingStyle(PagingStyle pagingStyle) {
            this.pagingStyle = Objects.requireNonNull(pagingStyle, "pagingStyle");
            return this;
        }

        public Builder uppercaseKeywords(boolean uppercaseKeywords) {
            this.uppercaseKeywords = uppercaseKeywords;
            return this;
        }

        public SqlDialect build() {
            return new SqlDialect(this);
        }
    }
}
