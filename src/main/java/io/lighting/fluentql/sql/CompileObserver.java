package io.lighting.fluentql.sql;

import io.lighting.fluentql.dsl.QueryCommand;

public interface CompileObserver {
    CompileObserver NOOP = new CompileObserver() {
    };

    default void afterCompile(QueryCommand command, String dialectId, String sql, long elapsedNanos) {
    }

    default void onCompileError(QueryCommand command, String dialectId, RuntimeException error) {
    }
}
