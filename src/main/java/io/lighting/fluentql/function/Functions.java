package io.lighting.fluentql.function;

import io.lighting.fluentql.sql.ast.ValueList;
import io.lighting.fluentql.types.Type;
import java.util.List;

/**
 * Built-in operator and aggregate signatures, and shortcuts that build checked calls of them.
 */
public final class Functions {
    private static final Type.Variable ARITHMETIC = Type.variable("T", Type.Kind.NUMBER, Type.Kind.STRING);
    private static final Type ARITHMETIC_OPERAND = Type.union(ARITHMETIC, Type.collection(ARITHMETIC));
    private static final Type.Variable COMPARABLE = Type.variable("T");
    private static final Type COMPARABLE_OPERAND = Type.union(COMPARABLE, Type.collection(COMPARABLE));
    private static final Type BOOLEAN_OPERAND = Type.union(Type.BOOLEAN, Type.collection(Type.BOOLEAN));
    private static final Type STRING_OPERAND = Type.union(Type.STRING, Type.collection(Type.STRING));
    private static final Type.Variable AGGREGATED = Type.variable("T");

    public static final FunctionSignature ADD = arithmetic("add");
    public static final FunctionSignature SUBTRACT = arithmetic("subtract");
    public static final FunctionSignature MULTIPLY = arithmetic("multiply");
    public static final FunctionSignature DIVIDE = arithmetic("divide");
    public static final FunctionSignature MODULO = arithmetic("modulo");

    public static final FunctionSignature BITWISE_AND = logical("bitwiseand");
    public static final FunctionSignature BITWISE_OR = logical("bitwiseor");
    public static final FunctionSignature BITWISE_XOR = logical("bitwisexor");

    public static final FunctionSignature EQUALS = comparison("equals");
    public static final FunctionSignature NOT_EQUAL = comparison("notequal");
    public static final FunctionSignature LESS_THAN = comparison("lessthan");
    public static final FunctionSignature LESS_THAN_OR_EQUAL = comparison("lessthanorequal");
    public static final FunctionSignature GREATER_THAN = comparison("greaterthan");
    public static final FunctionSignature GREATER_THAN_OR_EQUAL = comparison("greaterthanorequal");

    public static final FunctionSignature NOT = FunctionSignature.of("not", ReturnRule.BOOLEAN, BOOLEAN_OPERAND);
    public static final FunctionSignature LIKE =
        FunctionSignature.of("like", ReturnRule.BOOLEAN, STRING_OPERAND, STRING_OPERAND);
    public static final FunctionSignature IN =
        FunctionSignature.of("in", ReturnRule.BOOLEAN, COMPARABLE_OPERAND, Type.collection(COMPARABLE));
    public static final FunctionSignature IS_NULL = FunctionSignature.of("isnull", ReturnRule.BOOLEAN, Type.ANY);
    public static final FunctionSignature IS_NOT_NULL =
        FunctionSignature.of("isnotnull", ReturnRule.BOOLEAN, Type.ANY);

    public static final FunctionSignature MAX =
        FunctionSignature.of("max", ReturnRule.fixed(AGGREGATED), Type.collection(AGGREGATED));
    public static final FunctionSignature MIN =
        FunctionSignature.of("min", ReturnRule.fixed(AGGREGATED), Type.collection(AGGREGATED));
    public static final FunctionSignature SUM =
        FunctionSignature.of("sum", ReturnRule.NUMBER, Type.collection(Type.NUMBER));
    public static final FunctionSignature AVG =
        FunctionSignature.of("avg", ReturnRule.NUMBER, Type.collection(Type.NUMBER));
    public static final FunctionSignature COUNT =
        FunctionSignature.of("count", ReturnRule.NUMBER, Type.collection(Type.ANY));
    public static final FunctionSignature COUNT_ALL = FunctionSignature.of("count", ReturnRule.NUMBER);

    public static final FunctionSignature ASC =
        FunctionSignature.of("asc", ReturnRule.argument(0), Type.collection(Type.ANY));
    public static final FunctionSignature DESC =
        FunctionSignature.of("desc", ReturnRule.argument(0), Type.collection(Type.ANY));

    public static final List<FunctionSignature> BUILT_INS = List.of(
        ADD, SUBTRACT, MULTIPLY, DIVIDE, MODULO,
        BITWISE_AND, BITWISE_OR, BITWISE_XOR,
        EQUALS, NOT_EQUAL, LESS_THAN, LESS_THAN_OR_EQUAL, GREATER_THAN, GREATER_THAN_OR_EQUAL,
        NOT, LIKE, IN, IS_NULL, IS_NOT_NULL,
        MAX, MIN, SUM, AVG, COUNT, COUNT_ALL,
        ASC, DESC
    );

    private Functions() {
    }

    public static FunctionCall add(Object left, Object right) {
        return call(ADD, left, right);
    }

    public static FunctionCall subtract(Object left, Object right) {
        return call(SUBTRACT, left, right);
    }

    public static FunctionCall multiply(Object left, Object right) {
        return call(MULTIPLY, left, right);
    }

    public static FunctionCall divide(Object left, Object right) {
        return call(DIVIDE, left, right);
    }

    public static FunctionCall modulo(Object left, Object right) {
        return call(MODULO, left, right);
    }

    public static FunctionCall and(Object left, Object right) {
        return call(BITWISE_AND, left, right);
    }

    public static FunctionCall or(Object left, Object right) {
        return call(BITWISE_OR, left, right);
    }

    public static FunctionCall xor(Object left, Object right) {
        return call(BITWISE_XOR, left, right);
    }

    public static FunctionCall eq(Object left, Object right) {
        return call(EQUALS, left, right);
    }

    public static FunctionCall ne(Object left, Object right) {
        return call(NOT_EQUAL, left, right);
    }

    public static FunctionCall lt(Object left, Object right) {
        return call(LESS_THAN, left, right);
    }

    public static FunctionCall le(Object left, Object right) {
        return call(LESS_THAN_OR_EQUAL, left, right);
    }

    public static FunctionCall gt(Object left, Object right) {
        return call(GREATER_THAN, left, right);
    }

    public static FunctionCall ge(Object left, Object right) {
        return call(GREATER_THAN_OR_EQUAL, left, right);
    }

    public static FunctionCall not(Object operand) {
        return call(NOT, operand);
    }

    public static FunctionCall like(Object value, Object pattern) {
        return call(LIKE, value, pattern);
    }

    public static FunctionCall in(Object value, Object values) {
        return call(IN, value, values);
    }

    /**
     * {@code value in (v1, v2, ...)} over literal values.
     */
    public static FunctionCall in(Object value, Iterable<?> values) {
        return call(IN, value, ValueList.of(values));
    }

    public static FunctionCall isNull(Object operand) {
        return call(IS_NULL, operand);
    }

    public static FunctionCall isNotNull(Object operand) {
        return call(IS_NOT_NULL, operand);
    }

    public static FunctionCall max(Object operand) {
        return call(MAX, operand);
    }

    public static FunctionCall min(Object operand) {
        return call(MIN, operand);
    }

    public static FunctionCall sum(Object operand) {
        return call(SUM, operand);
    }

    public static FunctionCall avg(Object operand) {
        return call(AVG, operand);
    }

    public static FunctionCall count(Object operand) {
        return call(COUNT, operand);
    }

    public static FunctionCall count() {
        return call(COUNT_ALL);
    }

    public static FunctionCall asc(Object operand) {
        return call(ASC, operand);
    }

    public static FunctionCall desc(Object operand) {
        return call(DESC, operand);
    }

    private static FunctionCall call(FunctionSignature signature, Object... arguments) {
        return FunctionRegistry.global().call(signature, arguments);
    }

    private static FunctionSignature arithmetic(String name) {
        return FunctionSignature.of(name, ReturnRule.columnOf(ARITHMETIC), ARITHMETIC_OPERAND, ARITHMETIC_OPERAND);
    }

    private static FunctionSignature comparison(String name) {
        return FunctionSignature.of(name, ReturnRule.BOOLEAN, COMPARABLE_OPERAND, COMPARABLE_OPERAND);
    }

    private static FunctionSignature logical(String name) {
        return FunctionSignature.of(name, ReturnRule.BOOLEAN, BOOLEAN_OPERAND, BOOLEAN_OPERAND);
    }
}
