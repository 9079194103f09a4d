package io.lighting.fluentql.config;

import io.lighting.fluentql.function.FunctionRegistry;
import io.lighting.fluentql.sql.CompileObserver;
import io.lighting.fluentql.sql.Dialect;
import io.lighting.fluentql.sql.IdentifierQuoting;
import io.lighting.fluentql.sql.SqlCompiler;
import io.lighting.fluentql.sql.SqlLog;
import io.lighting.fluentql.sql.dialect.Dialects;
import io.lighting.fluentql.sql.dialect.SqlDialect;
import io.lighting.fluentql.types.Type;
import io.lighting.fluentql.types.TypeCompatibility;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PropertiesLoaderUtils;

/**
 * Configuration properties for fluentql.
 * <p>
 * Bound under the "fluentql" prefix, either by a Spring environment or from a
 * {@code fluentql.properties} classpath resource:
 * <pre>{@code
 * fluentql.dialect=postgres
 * fluentql.quoting=always
 * fluentql.uppercase-keywords=false
 * fluentql.compatible-types=DateTime->Date,Date->DateTime
 * fluentql.sql.log.enabled=true
 * fluentql.sql.log.prefix=SQL:
 * fluentql.sql.log.include-elapsed=false
 * }</pre>
 */
@ConfigurationProperties(prefix = FluentSqlProperties.PREFIX)
public class FluentSqlProperties {
    public static final String PREFIX = "fluentql";
    public static final String DEFAULT_RESOURCE = "fluentql.properties";
    private static final Logger LOGGER = LoggerFactory.getLogger(FluentSqlProperties.class);

    private String dialect = "generic";
    private IdentifierQuoting quoting;
    private boolean uppercaseKeywords = false;
    private List<String> compatibleTypes = new ArrayList<>();
    private SqlProperties sql = new SqlProperties();

    public static FluentSqlProperties load() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Binds a classpath resource; a missing resource yields the defaults.
     */
    public static FluentSqlProperties load(String resource) {
        Objects.requireNonNull(resource, "resource");
        Resource classpath = new ClassPathResource(resource);
        if (!classpath.exists()) {
            LOGGER.debug("No {} on the classpath, using defaults", resource);
            return new FluentSqlProperties();
        }
        try {
            return from(PropertiesLoaderUtils.loadProperties(classpath));
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to load " + resource, ex);
        }
    }

    public static FluentSqlProperties from(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        return bind(new Binder(new MapConfigurationPropertySource(properties)));
    }

    /**
     * Binds the "fluentql" prefix of any Spring property source, such as {@code Binder.get(environment)}.
     */
    public static FluentSqlProperties bind(Binder binder) {
        Objects.requireNonNull(binder, "binder");
        return binder.bind(PREFIX, Bindable.of(FluentSqlProperties.class)).orElseGet(FluentSqlProperties::new);
    }

    /**
     * The configured dialect with the quoting and keyword case overrides applied.
     */
    public Dialect resolveDialect() {
        Dialect base = Dialects.get(dialect);
        if (quoting == null && !uppercaseKeywords) {
            return base;
        }
        SqlDialect.Builder builder = SqlDialect.extend(base, base.id()).uppercaseKeywords(uppercaseKeywords);
        if (quoting != null) {
            builder.quoting(quoting);
        }
        return builder.build();
    }

    public TypeCompatibility typeCompatibility() {
        TypeCompatibility.Builder builder = TypeCompatibility.builder();
        for (String pair : compatibleTypes) {
            int arrow = pair.indexOf("->");
            if (arrow < 0) {
                throw new IllegalArgumentException("Expected Actual->Expected, got " + pair);
            }
            Type.Kind actual = Type.Kind.parse(pair.substring(0, arrow));
            Type.Kind expected = Type.Kind.parse(pair.substring(arrow + 2));
            builder.allow(actual, expected);
        }
        return builder.build();
    }

    public FunctionRegistry createRegistry() {
        return FunctionRegistry.standard(typeCompatibility());
    }

    public SqlCompiler createCompiler() {
        SqlLog log = sql.getLog().build(null);
        return new SqlCompiler(resolveDialect(), log == null ? CompileObserver.NOOP : log);
    }

    public String getDialect() {
        return dialect;
    }

    public void setDialect(String dialect) {
        if (dialect == null || dialect.isBlank()) {
            throw new IllegalArgumentException("dialect must not be blank");
        }
        this.dialect = dialect.trim();
    }

    public IdentifierQuoting getQuoting() {
        return quoting;
    }

    public void setQuoting(IdentifierQuoting quoting) {
        this.quoting = quoting;
    }

    public boolean isUppercaseKeywords() {
        return uppercaseKeywords;
    }

    public void setUppercaseKeywords(boolean uppercaseKeywords) {
        this.uppercaseKeywords = uppercaseKeywords;
    }

    public List<String> getCompatibleTypes() {
        return compatibleTypes;
    }

    public void setCompatibleTypes(List<String> compatibleTypes) {
        this.compatibleTypes = new ArrayList<>(Objects.requireNonNull(compatibleTypes, "compatibleTypes"));
    }

    public SqlProperties getSql() {
        return sql;
    }

    public void setSql(SqlProperties sql) {
        this.sql = Objects.requireNonNull(sql, "sql");
    }

    public static class SqlProperties {
        private SqlLogProperties log = new SqlLogProperties();

        public SqlLogProperties getLog() {
            return log;
        }

        public void setLog(SqlLogProperties log) {
            this.log = Objects.requireNonNull(log, "log");
        }
    }

    public static class SqlLogProperties {
        private boolean enabled = false;
        private boolean includeElapsed = false;
        private String prefix = "SQL:";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isIncludeElapsed() {
            return includeElapsed;
        }

        public void setIncludeElapsed(boolean includeElapsed) {
            this.includeElapsed = includeElapsed;
        }

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        /**
         * @param sink target of the log lines; {@code null} keeps the SLF4J default
         * @return {@code null} when logging is disabled
         */
        public SqlLog build(Consumer<String> sink) {
            if (!enabled) {
                return null;
            }
            SqlLog.Builder builder = SqlLog.builder()
                .includeElapsed(includeElapsed)
                .prefix(prefix);
            if (sink != null) {
                builder.sink(sink);
            }
            return builder.build();
        }
    }
}
