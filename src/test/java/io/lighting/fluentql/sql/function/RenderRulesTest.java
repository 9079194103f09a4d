package io.lighting.fluentql.sql.function;

import io.lighting.fluentql.sql.Fragment;
import io.lighting.fluentql.sql.Precedence;
import io.lighting.fluentql.sql.dialect.Dialects;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RenderRulesTest {
    private static final Fragment A = Fragment.atom("a");
    private static final Fragment B = Fragment.atom("b");
    private static final Fragment SUM = Fragment.of("a + b", Precedence.ADDITIVE);

    @Test
    void infixWrapsLooserOperands() {
        FunctionRenderer multiply = RenderRules.infix("*", Precedence.MULTIPLICATIVE);
        Fragment out = multiply.render(Dialects.generic(), "multiply", List.of(SUM, A));
        assertEquals("(a + b) * a", out.sql());
        assertEquals(Precedence.MULTIPLICATIVE, out.precedence());
    }

    @Test
    void infixKeepsRightParenthesesAtEqualPrecedence() {
        FunctionRenderer subtract = RenderRules.infix("-", Precedence.ADDITIVE);
        assertEquals("a + b - a", subtract.render(Dialects.generic(), "subtract", List.of(SUM, A)).sql());
        assertEquals("a - (a + b)", subtract.render(Dialects.generic(), "subtract", List.of(A, SUM)).sql());
    }

    @Test
    void callRendersArgumentsInOrder() {
        assertEquals("coalesce(a, b)", RenderRules.call().render(Dialects.generic(), "COALESCE", List.of(A, B)).sql());
        assertEquals("nvl(a, b)", RenderRules.call("nvl").render(Dialects.oracle(), "coalesce", List.of(A, B)).sql());
        assertEquals("count(*)", RenderRules.callOrStar().render(Dialects.generic(), "count", List.of()).sql());
    }

    @Test
    void functionNamesIgnoreDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals("min(a)", RenderRules.call().render(Dialects.generic(), "MIN", List.of(A)).sql());
            assertEquals("count(*)", RenderRules.callOrStar().render(Dialects.generic(), "COUNT", List.of()).sql());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void prefixDoesNotDoubleParentheses() {
        FunctionRenderer not = RenderRules.prefix("not");
        assertEquals("not (a + b)", not.render(Dialects.generic(), "not", List.of(SUM)).sql());
        assertEquals("not (a)", not.render(Dialects.generic(), "not", List.of(Fragment.grouped("(a)"))).sql());
    }

    @Test
    void inAcceptsGroupedRightSide() {
        FunctionRenderer in = RenderRules.in();
        assertEquals("a in (b)", in.render(Dialects.generic(), "in", List.of(A, B)).sql());
        Fragment out = in.render(Dialects.generic(), "in", List.of(A, Fragment.grouped("(1, 2)")));
        assertEquals("a in (1, 2)", out.sql());
        assertTrue(out.precedence() < Precedence.ATOM);
    }

    @Test
    void wrongArgumentCountIsRejected() {
        assertThrows(
            IllegalArgumentException.class,
            () -> RenderRules.postfix("is null").render(Dialects.generic(), "isnull", List.of(A, B))
        );
    }
}
