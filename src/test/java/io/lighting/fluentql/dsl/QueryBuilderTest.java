package io.lighting.fluentql.dsl;

import io.lighting.fluentql.error.InvalidOperationException;
import io.lighting.fluentql.error.QueryBuildException;
import io.lighting.fluentql.error.TypeMismatchException;
import io.lighting.fluentql.error.TypeVariableConflictException;
import io.lighting.fluentql.sql.ast.Condition;
import io.lighting.fluentql.sql.ast.Join;
import io.lighting.fluentql.sql.ast.JoinType;
import io.lighting.fluentql.types.Type;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryBuilderTest {
    private final Table books = Table.of("books");
    private final Table authors = Table.of("authors");

    @Test
    void builderCallsNeverMutateTheReceiver() {
        Query base = Query.select().from(books);
        Query filtered = base.where(books.column("price").gt(100));
        Query limited = base.fetch(10);

        assertNotSame(base, filtered);
        assertNull(base.where());
        assertNull(base.limit());
        assertNull(filtered.limit());
        assertEquals(10, limited.limit());
        assertNull(limited.where());
    }

    @Test
    void stateIsHeldInFinalFields() {
        for (Field field : Query.class.getDeclaredFields()) {
            if (!Modifier.isStatic(field.getModifiers())) {
                assertTrue(Modifier.isFinal(field.getModifiers()), field.getName() + " must be final");
            }
        }
    }

    @Test
    void whereAndsOntoExistingRoot() {
        Query query = Query.select().from(books)
            .where(books.column("a").gt(1))
            .where(books.column("b").gt(2))
            .orWhere(books.column("c").gt(3));
        Condition.Or root = assertInstanceOf(Condition.Or.class, query.where());
        assertInstanceOf(Condition.And.class, root.left());
        assertInstanceOf(Condition.Predicate.class, root.right());
    }

    @Test
    void callbackBuildsGroup() {
        Query query = Query.select().from(books)
            .where(q -> q.where(books.column("a").gt(1)).orWhere(books.column("b").lt(2)));
        Condition.Group group = assertInstanceOf(Condition.Group.class, query.where());
        assertInstanceOf(Condition.Or.class, group.inner());
    }

    @Test
    void callbackReceivesScopedSubBuilder() {
        Query.select().from(books).where(q -> {
            assertEquals(QueryCommand.WHERE, q.command());
            return q.where(books.column("a").isNull());
        });
        Query.select().from(books).groupBy(books.column("a")).having(q -> {
            assertEquals(QueryCommand.HAVING, q.command());
            return q.having(books.column("a").count().gt(1));
        });
    }

    @Test
    void emptyGroupIsRejected() {
        assertThrows(QueryBuildException.class, () -> Query.select().from(books).where(q -> q));
    }

    @Test
    void subBuilderRejectsStatementMethods() {
        InvalidOperationException ex = assertThrows(
            InvalidOperationException.class,
            () -> Query.select().from(books).where(q -> q.fetch(1))
        );
        assertEquals(QueryCommand.WHERE, ex.command());
        assertEquals("fetch", ex.method());
    }

    @Test
    void methodsAreLegalOnlyForTheirCommands() {
        InvalidOperationException groupBy = assertThrows(
            InvalidOperationException.class,
            () -> Query.delete().from(books).groupBy(books.column("a"))
        );
        assertEquals(QueryCommand.DELETE, groupBy.command());
        assertEquals("groupBy", groupBy.method());

        assertThrows(InvalidOperationException.class, () -> Query.delete().from(books).innerJoin(authors));
        assertThrows(InvalidOperationException.class, () -> Query.delete().from(books).fetch(1));
        assertThrows(InvalidOperationException.class, () -> Query.delete().from(books).distinct());
        assertThrows(InvalidOperationException.class, () -> Query.delete().from(books).orderBy(books.column("a")));
        assertThrows(InvalidOperationException.class, () -> Query.drop(books).where(books.column("a").isNull()));
        assertThrows(InvalidOperationException.class, () -> Query.insert().from(books));
        assertThrows(InvalidOperationException.class, () -> Query.select().into(books));
        assertThrows(InvalidOperationException.class, () -> Query.select().set(books.column("a"), 1));
        assertThrows(
            InvalidOperationException.class,
            () -> Query.delete().from(books).having(books.column("a").isNull())
        );
    }

    @Test
    void joinsCollectConditions() {
        Query query = Query.select().from(books)
            .leftJoin(authors)
            .on(books.column("author_id").eq(authors.column("id")))
            .andOn(authors.column("active").eq(true));
        Join join = query.joins().get(0);
        assertEquals(JoinType.LEFT, join.type());
        assertInstanceOf(Condition.And.class, join.on());
        assertEquals(List.of(books, authors), query.tables());
    }

    @Test
    void joinCallbackRunsOnJoinScopedBuilder() {
        List<QueryCommand> seen = new ArrayList<>();
        Query query = Query.select().from(books).innerJoin(authors, j -> {
            seen.add(j.command());
            return j.on(books.column("author_id").eq(authors.column("id")))
                .andOn(authors.column("active").eq(true));
        });
        assertEquals(List.of(QueryCommand.JOIN), seen);
        Join join = query.joins().get(0);
        assertEquals(JoinType.INNER, join.type());
        assertFalse(join.isPending());
        assertInstanceOf(Condition.And.class, join.on());
    }

    @Test
    void joinCallbackOnlyBuildsConditions() {
        Query base = Query.select().from(books);
        assertThrows(QueryBuildException.class, () -> base.leftJoin(authors, j -> j));
        assertThrows(
            InvalidOperationException.class,
            () -> base.leftJoin(authors, j -> j.where(authors.column("active").eq(true)))
        );
        assertThrows(InvalidOperationException.class, () -> base.leftJoin(authors, j -> j.using("id")));
        assertThrows(
            QueryBuildException.class,
            () -> base.leftJoin(authors, j -> Query.select().from(authors).where(authors.column("a").isNull()))
        );
    }

    @Test
    void crossJoinTakesNoCondition() {
        Query crossed = Query.select().from(books).crossJoin(authors);
        assertThrows(InvalidOperationException.class, () -> crossed.on(books.column("a").eq(authors.column("a"))));
        assertThrows(InvalidOperationException.class, () -> crossed.using("a"));
    }

    @Test
    void onWithoutJoinIsInvalid() {
        assertThrows(
            InvalidOperationException.class,
            () -> Query.select().from(books).on(books.column("a").isNull())
        );
    }

    @Test
    void usingAndOnAreExclusive() {
        Query using = Query.select().from(books).leftJoin(authors).using("author_id");
        assertThrows(InvalidOperationException.class, () -> using.on(books.column("a").eq(authors.column("a"))));
        Query on = Query.select().from(books).leftJoin(authors).on(books.column("a").eq(authors.column("a")));
        assertThrows(InvalidOperationException.class, () -> on.using("a"));
    }

    @Test
    void predicatesMustBeBoolean() {
        TypeMismatchException ex = assertThrows(
            TypeMismatchException.class,
            () -> Query.select().from(books).where(books.column("price").add(1))
        );
        assertEquals("where", ex.functionName());
        assertEquals(0, ex.argumentIndex());
    }

    @Test
    void orderByAcceptsColumnsAndDirections() {
        Query query = Query.select().from(books).orderBy(books.column("a"), books.column("b").desc());
        assertEquals("asc", query.orderBy().get(0).name());
        assertEquals("desc", query.orderBy().get(1).name());
        assertThrows(QueryBuildException.class, () -> Query.select().from(books).orderBy("a"));
        assertThrows(QueryBuildException.class, () -> Query.select().from(books).orderBy(books.column("a").add(20)));
    }

    @Test
    void pagingArgumentsMustNotBeNegative() {
        assertThrows(IllegalArgumentException.class, () -> Query.select().from(books).fetch(-1));
        assertThrows(IllegalArgumentException.class, () -> Query.select().from(books).skip(-1));
    }

    @Test
    void schemaTablesOnlyResolveDeclaredColumns() {
        Table typed = Table.of("books", Map.of("id", Type.NUMBER));
        assertEquals(Type.collection(Type.NUMBER), typed.column("id").type());
        assertThrows(QueryBuildException.class, () -> typed.column("missing"));
        assertEquals(Type.collection(Type.ANY), books.column("whatever").type());
    }

    @Test
    void insertValuesAreTypeChecked() {
        Table typed = Table.of("books", schema());
        Query insert = Query.insert().into(typed).values(1, "Cars", true);
        assertEquals(3, insert.insertColumns().size());
        assertEquals(1, insert.rows().size());

        assertThrows(TypeMismatchException.class, () -> Query.insert().into(typed).values("one", "Cars", true));
        assertThrows(
            io.lighting.fluentql.error.ArityException.class,
            () -> Query.insert().into(typed).values(1, "Cars")
        );
        assertThrows(QueryBuildException.class, () -> Query.insert().into(books).values(1));
    }

    @Test
    void updateAssignmentsAreTypeChecked() {
        Table typed = Table.of("books", schema());
        Query update = Query.update(typed).set(typed.column("title"), "Cars").where(typed.column("id").eq(1));
        assertEquals(1, update.assignments().size());
        assertThrows(TypeMismatchException.class, () -> Query.update(typed).set(typed.column("id"), "x"));
        assertThrows(
            TypeVariableConflictException.class,
            () -> Query.update(typed).where(typed.column("id").eq("x"))
        );
    }

    @Test
    void createRequiresConcreteSchema() {
        assertThrows(QueryBuildException.class, () -> Query.create(books));
        Table partlyTyped = Table.of("t", Map.of("a", Type.ANY));
        assertThrows(QueryBuildException.class, () -> Query.create(partlyTyped));
        assertEquals(QueryCommand.CREATE, Query.create(Table.of("t", schema())).command());
    }

    @Test
    void singleColumnSelectIsTypedByItsColumn() {
        Table typed = Table.of("books", schema());
        assertEquals(Type.collection(Type.NUMBER), Query.select(typed.column("id")).from(typed).type());
        assertEquals(Type.collection(Type.ANY), Query.select().from(typed).type());
        assertTrue(Query.select(typed.column("id")).from(typed).type().isCollection());
    }

    private static Map<String, Type> schema() {
        Map<String, Type> schema = new LinkedHashMap<>();
        schema.put("id", Type.NUMBER);
        schema.put("title", Type.STRING);
        schema.put("available", Type.BOOLEAN);
        return schema;
    }
}
