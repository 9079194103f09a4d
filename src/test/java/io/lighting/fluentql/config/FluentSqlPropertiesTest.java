package io.lighting.fluentql.config;

import io.lighting.fluentql.dsl.Query;
import io.lighting.fluentql.dsl.Table;
import io.lighting.fluentql.function.FunctionRegistry;
import io.lighting.fluentql.sql.Dialect;
import io.lighting.fluentql.sql.IdentifierQuoting;
import io.lighting.fluentql.sql.SqlCompiler;
import io.lighting.fluentql.sql.SqlLog;
import io.lighting.fluentql.sql.dialect.Dialects;
import io.lighting.fluentql.types.Type;
import io.lighting.fluentql.types.TypeCompatibility;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.BindException;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FluentSqlPropertiesTest {
    private final Table books = Table.of("books");

    @Test
    void defaultsUseGenericDialect() {
        FluentSqlProperties properties = new FluentSqlProperties();
        assertEquals("generic", properties.getDialect());
        assertSame(Dialects.generic(), properties.resolveDialect());
        assertFalse(properties.getSql().getLog().isEnabled());
        assertNull(properties.getSql().getLog().build(null));
    }

    @Test
    void readsPrefixedKeys() {
        Properties raw = new Properties();
        raw.setProperty("fluentql.dialect", "postgres");
        raw.setProperty("fluentql.quoting", "always");
        raw.setProperty("fluentql.uppercase-keywords", "true");
        raw.setProperty("fluentql.sql.log.enabled", "true");
        raw.setProperty("fluentql.sql.log.prefix", "fql:");
        raw.setProperty("fluentql.compatible-types", "DateTime->Date,Date->DateTime");
        raw.setProperty("unrelated.key", "ignored");

        FluentSqlProperties properties = FluentSqlProperties.from(raw);
        assertEquals("postgres", properties.getDialect());
        assertEquals(IdentifierQuoting.ALWAYS, properties.getQuoting());
        assertTrue(properties.isUppercaseKeywords());
        assertTrue(properties.getSql().getLog().isEnabled());
        assertEquals("fql:", properties.getSql().getLog().getPrefix());
        assertEquals(List.of("DateTime->Date", "Date->DateTime"), properties.getCompatibleTypes());
        assertTrue(properties.typeCompatibility().isCompatible(Type.Kind.DATE, Type.Kind.DATETIME));
    }

    @Test
    void bindsAnySpringPropertySource() {
        Map<String, String> source = Map.of(
            "fluentql.dialect", "mysql",
            "fluentql.sql.log.include-elapsed", "true"
        );
        FluentSqlProperties properties = FluentSqlProperties.bind(new Binder(new MapConfigurationPropertySource(source)));
        assertEquals("mysql", properties.getDialect());
        assertTrue(properties.getSql().getLog().isIncludeElapsed());
        assertFalse(properties.getSql().getLog().isEnabled());
    }

    @Test
    void emptySourceYieldsDefaults() {
        FluentSqlProperties properties = FluentSqlProperties.from(new Properties());
        assertEquals("generic", properties.getDialect());
        assertTrue(properties.getCompatibleTypes().isEmpty());
    }

    @Test
    void invalidValuesFailToBind() {
        Properties raw = new Properties();
        raw.setProperty("fluentql.quoting", "sometimes");
        assertThrows(BindException.class, () -> FluentSqlProperties.from(raw));
    }

    @Test
    void resolvedDialectAppliesOverrides() {
        FluentSqlProperties properties = new FluentSqlProperties();
        properties.setDialect("postgres");
        properties.setQuoting(IdentifierQuoting.ALWAYS);
        properties.setUppercaseKeywords(true);
        Dialect dialect = properties.resolveDialect();
        assertEquals("postgres", dialect.id());
        assertEquals(
            "SELECT \"title\" FROM \"books\";",
            Query.select(books.column("title")).from(books).compile(dialect)
        );
    }

    @Test
    void compatibilityPairsAreOneWay() {
        FluentSqlProperties properties = new FluentSqlProperties();
        properties.setCompatibleTypes(List.of("DateTime->Date"));
        TypeCompatibility compatibility = properties.typeCompatibility();
        assertTrue(compatibility.isCompatible(Type.Kind.DATETIME, Type.Kind.DATE));
        assertFalse(compatibility.isCompatible(Type.Kind.DATE, Type.Kind.DATETIME));

        FunctionRegistry registry = properties.createRegistry();
        assertTrue(registry.contains("equals"));
        assertTrue(registry.matcher().compatibility().isCompatible(Type.Kind.DATETIME, Type.Kind.DATE));

        properties.setCompatibleTypes(List.of("DateTime=Date"));
        assertThrows(IllegalArgumentException.class, properties::typeCompatibility);
    }

    @Test
    void compilerLogsWhenEnabled() {
        FluentSqlProperties properties = new FluentSqlProperties();
        properties.getSql().getLog().setEnabled(true);
        List<String> lines = new ArrayList<>();
        SqlLog log = properties.getSql().getLog().build(lines::add);
        assertNotNull(log);
        new SqlCompiler(properties.resolveDialect(), log).compile(Query.select().from(books));
        assertEquals(List.of("SQL: [SELECT] select * from books;"), lines);

        SqlCompiler compiler = properties.createCompiler();
        assertEquals("select * from books;", compiler.compile(Query.select().from(books)));
    }

    @Test
    void loadsClasspathResource() {
        FluentSqlProperties properties = FluentSqlProperties.load();
        assertEquals("sqlite", properties.getDialect());
        assertTrue(properties.getSql().getLog().isEnabled());
        assertEquals(List.of("DateTime->Date"), properties.getCompatibleTypes());
        assertEquals("sqlite", properties.createCompiler().dialect().id());
    }

    @Test
    void missingResourceYieldsDefaults() {
        FluentSqlProperties properties = FluentSqlProperties.load("missing-fluentql.properties");
        assertEquals("generic", properties.getDialect());
        assertNull(properties.getQuoting());
    }

    @Test
    void rejectsBlankDialect() {
        assertThrows(IllegalArgumentException.class, () -> new FluentSqlProperties().setDialect(" "));
    }
}
