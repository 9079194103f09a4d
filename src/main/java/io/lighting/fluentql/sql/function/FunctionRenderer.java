package io.lighting.fluentql.sql.function;

import io.lighting.fluentql.sql.Dialect;
import io.lighting.fluentql.sql.Fragment;
import java.util.List;

@FunctionalInterface
public interface FunctionRenderer {
    Fragment render(Dialect dialect, String name, List<Fragment> args);
}
