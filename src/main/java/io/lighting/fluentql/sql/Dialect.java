package io.lighting.fluentql.sql;

import io.lighting.fluentql.dsl.QueryCommand;
import io.lighting.fluentql.error.CompileException;
import io.lighting.fluentql.error.UnresolvedFunctionRenderException;
import io.lighting.fluentql.sql.ast.JoinType;
import io.lighting.fluentql.sql.function.FunctionRenderer;
import io.lighting.fluentql.types.Type;
import java.util.List;
import java.util.Objects;

public interface Dialect {
    String id();

    String quoteIdent(String ident);

    /**
     * Spelling of a keyword or operator word, given in canonical lowercase.
     */
    String keyword(String keyword);

    /**
     * @throws CompileException when the dialect has no syntax for the join type
     */
    String joinKeyword(JoinType type);

    /**
     * Render rule for a function, or {@code null} when the dialect has none.
     */
    FunctionRenderer renderer(String functionName);

    String typeName(Type.Kind kind);

    PagingStyle pagingStyle();

    boolean supports(QueryCommand command);

    default Fragment renderFunction(String name, List<Fragment> args) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(args, "args");
        FunctionRenderer renderer = renderer(name);
        if (renderer == null) {
            throw new UnresolvedFunctionRenderException(id(), name);
        }
        return renderer.render(this, name, args);
    }
}
