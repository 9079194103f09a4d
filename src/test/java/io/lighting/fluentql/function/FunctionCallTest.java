package io.lighting.fluentql.function;

import io.lighting.fluentql.dsl.Column;
import io.lighting.fluentql.dsl.Table;
import io.lighting.fluentql.error.ArityException;
import io.lighting.fluentql.error.TypeMismatchException;
import io.lighting.fluentql.error.TypeVariableConflictException;
import io.lighting.fluentql.sql.ast.Literal;
import io.lighting.fluentql.types.Type;
import io.lighting.fluentql.types.TypeMatcher;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FunctionCallTest {
    private final Table books = Table.of("books", Map.of(
        "price", Type.NUMBER,
        "title", Type.STRING,
        "published", Type.DATE,
        "available", Type.BOOLEAN
    ));
    private final Column price = books.column("price");
    private final Column title = books.column("title");

    @Test
    void arithmeticOnColumnStaysColumnBound() {
        FunctionCall call = price.add(10);
        assertEquals(Type.collection(Type.NUMBER), call.type());
        assertEquals(List.of(Type.collection(Type.NUMBER), Type.NUMBER), call.matchedTypes());
    }

    @Test
    void arithmeticOnLiteralsIsScalar() {
        FunctionCall call = Functions.divide(10, 100);
        assertEquals(Type.NUMBER, call.type());
        assertInstanceOf(Literal.class, call.arguments().get(0));
    }

    @Test
    void stringConcatenationUsesStringBinding() {
        assertEquals(Type.collection(Type.STRING), title.add("!").type());
    }

    @Test
    void mixedArithmeticOperandsConflict() {
        TypeVariableConflictException ex = assertThrows(TypeVariableConflictException.class, () -> price.add("x"));
        assertEquals("add", ex.functionName());
    }

    @Test
    void comparisonReturnsBoolean() {
        assertEquals(Type.BOOLEAN, price.gt(100).type());
        assertEquals(Type.BOOLEAN, books.column("published").eq(LocalDate.of(2020, 1, 1)).type());
    }

    @Test
    void comparisonOfDifferentKindsConflicts() {
        assertThrows(TypeVariableConflictException.class, () -> price.eq("100"));
    }

    @Test
    void logicalOperatorRejectsNonBooleanSecondArgument() {
        TypeMismatchException ex = assertThrows(TypeMismatchException.class, () -> Functions.and(true, "yes"));
        assertEquals(1, ex.argumentIndex());
    }

    @Test
    void likeRequiresStrings() {
        assertEquals(Type.BOOLEAN, title.like("%cars%").type());
        TypeMismatchException ex = assertThrows(TypeMismatchException.class, () -> price.like("%1%"));
        assertEquals(0, ex.argumentIndex());
    }

    @Test
    void aggregatesResolveFromColumnType() {
        assertEquals(Type.NUMBER, price.max().type());
        assertEquals(Type.STRING, title.min().type());
        assertEquals(Type.NUMBER, price.sum().type());
        assertEquals(Type.NUMBER, title.count().type());
        assertEquals(Type.NUMBER, Functions.count().type());
        assertThrows(TypeMismatchException.class, () -> title.sum());
    }

    @Test
    void aggregateOfLiteralIsRejected() {
        assertThrows(TypeMismatchException.class, () -> Functions.max(10));
    }

    @Test
    void aggregateOfNullIsRejected() {
        assertThrows(TypeMismatchException.class, () -> Functions.max(null));
        assertThrows(TypeMismatchException.class, () -> Functions.sum(null));
        assertThrows(TypeMismatchException.class, () -> Functions.count(null));
    }

    @Test
    void orderingKeepsColumnType() {
        assertEquals(price.type(), price.desc().type());
        assertEquals(title.type(), title.asc().type());
    }

    @Test
    void inAcceptsValueListsAndColumns() {
        assertEquals(Type.BOOLEAN, price.in(1, 2, 3).type());
        assertEquals(Type.BOOLEAN, price.in(List.of(5, 6)).type());
        assertThrows(TypeVariableConflictException.class, () -> price.in("a", "b"));
    }

    @Test
    void callsNest() {
        FunctionCall nested = price.multiply(2).add(price).ge(100).and(books.column("available"));
        assertEquals(Type.BOOLEAN, nested.type());
        assertEquals("bitwiseand", nested.name());
    }

    @Test
    void customSignatureWithResolver() {
        FunctionSignature coalesce = FunctionSignature.of(
            "coalesce",
            ReturnRule.argument(1),
            Type.collection(Type.ANY),
            Type.ANY
        );
        FunctionCall call = FunctionCall.of(coalesce, TypeMatcher.strict(), List.of(title, "n/a"));
        assertEquals(Type.STRING, call.type());
        assertThrows(ArityException.class, () -> FunctionCall.of(coalesce, TypeMatcher.strict(), List.of(title)));
    }

    @Test
    void resolverReturningUnresolvedTypeIsDefinitionError() {
        FunctionSignature broken = FunctionSignature.of(
            "broken",
            ReturnRule.resolver((matched, mapping) -> Type.union(Type.NUMBER, Type.STRING)),
            Type.NUMBER
        );
        assertThrows(IllegalStateException.class, () -> FunctionCall.of(broken, TypeMatcher.strict(), List.of(1)));
    }

    @Test
    void callsAreImmutable() {
        FunctionCall call = price.add(1);
        assertThrows(UnsupportedOperationException.class, () -> call.arguments().clear());
    }
}
