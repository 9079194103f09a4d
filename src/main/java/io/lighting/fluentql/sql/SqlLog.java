package io.lighting.fluentql.sql;

import io.lighting.fluentql.dsl.QueryCommand;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CompileObserver} writing every compiled statement as one readable line.
 * <p>
 * Lines look like {@code SQL: [SELECT] select * from books;}. Output goes to SLF4J at INFO
 * unless another sink is configured. Instances are immutable and thread-safe.
 */
public final class SqlLog implements CompileObserver {
    private static final Logger LOGGER = LoggerFactory.getLogger(SqlLog.class);

    private final boolean enabled;
    private final boolean includeElapsed;
    private final boolean includeCommand;
    private final boolean includeDialect;
    private final boolean logErrors;
    private final String prefix;
    private final Consumer<String> sink;

    private SqlLog(Builder builder) {
        this.enabled = builder.enabled;
        this.includeElapsed = builder.includeElapsed;
        this.includeCommand = builder.includeCommand;
        this.includeDialect = builder.includeDialect;
        this.logErrors = builder.logErrors;
        this.prefix = builder.prefix;
        this.sink = builder.sink;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void afterCompile(QueryCommand command, String dialectId, String sql, long elapsedNanos) {
        if (!enabled) {
            return;
        }
        String line = header(command, dialectId) + sql;
        if (includeElapsed) {
            line = line + " | elapsed=" + elapsedNanos + "ns";
        }
        sink.accept(line);
    }

    @Override
    public void onCompileError(QueryCommand command, String dialectId, RuntimeException error) {
        if (!enabled || !logErrors) {
            return;
        }
        sink.accept(header(command, dialectId) + "failed: " + error.getMessage());
    }

    private String header(QueryCommand command, String dialectId) {
        StringBuilder out = new StringBuilder(prefix).append(' ');
        if (includeCommand) {
            out.append('[').append(command.name()).append("] ");
        }
        if (includeDialect) {
            out.append('(').append(dialectId).append(") ");
        }
        return out.toString();
    }

    public static final class Builder {
        private boolean enabled = true;
        private boolean includeElapsed = false;
        private boolean includeCommand = true;
        private boolean includeDialect = false;
        private boolean logErrors = true;
        private String prefix = "SQL:";
        private Consumer<String> sink = LOGGER::info;

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        /**
         * Appends the compile time in nanoseconds.
         */
        public Builder includeElapsed(boolean enabled) {
            this.includeElapsed = enabled;
            return this;
        }

        public Builder includeCommand(boolean enabled) {
            this.includeCommand = enabled;
            return this;
        }

        public Builder includeDialect(boolean enabled) {
            this.includeDialect = enabled;
            return this;
        }

        public Builder logErrors(boolean enabled) {
            this.logErrors = enabled;
            return this;
        }

        public Builder prefix(String prefix) {
            if (prefix == null || prefix.isBlank()) {
                throw new IllegalArgumentException("prefix must not be blank");
            }
            this.prefix = prefix;
            return this;
        }

        public Builder sink(Consumer<String> sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public SqlLog build() {
            return new SqlLog(this);
        }
    }
}
