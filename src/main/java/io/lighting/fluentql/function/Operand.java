package io.lighting.fluentql.function;

import io.lighting.fluentql.sql.ast.Expr;
import java.util.Arrays;

/**
 * Explicit operator methods shared by columns and function calls. Each method builds a
 * type-checked {@link FunctionCall}; plain Java values are taken as literals.
 */
public interface Operand extends Expr {

    default FunctionCall add(Object other) {
        return Functions.add(this, other);
    }

    default FunctionCall subtract(Object other) {
        return Functions.subtract(this, other);
    }

    default FunctionCall multiply(Object other) {
        return Functions.multiply(this, other);
    }

    default FunctionCall divide(Object other) {
        return Functions.divide(this, other);
    }

    default FunctionCall modulo(Object other) {
        return Functions.modulo(this, other);
    }

    default FunctionCall and(Object other) {
        return Functions.and(this, other);
    }

    default FunctionCall or(Object other) {
        return Functions.or(this, other);
    }

    default FunctionCall xor(Object other) {
        return Functions.xor(this, other);
    }

    default FunctionCall eq(Object other) {
        return Functions.eq(this, other);
    }

    default FunctionCall ne(Object other) {
        return Functions.ne(this, other);
    }

    default FunctionCall lt(Object other) {
        return Functions.lt(this, other);
    }

    default FunctionCall le(Object other) {
        return Functions.le(this, other);
    }

    default FunctionCall gt(Object other) {
        return Functions.gt(this, other);
    }

    default FunctionCall ge(Object other) {
        return Functions.ge(this, other);
    }

    default FunctionCall not() {
        return Functions.not(this);
    }

    default FunctionCall like(Object pattern) {
        return Functions.like(this, pattern);
    }

    /**
     * Membership in a column, a sub-select or a single value list expression.
     */
    default FunctionCall in(Expr values) {
        return Functions.in(this, values);
    }

    default FunctionCall in(Iterable<?> values) {
        return Functions.in(this, values);
    }

    default FunctionCall in(Object... values) {
        return Functions.in(this, Arrays.asList(values));
    }

    default FunctionCall isNull() {
        return Functions.isNull(this);
    }

    default FunctionCall isNotNull() {
        return Functions.isNotNull(this);
    }

    default FunctionCall max() {
        return Functions.max(this);
    }

    default FunctionCall min() {
        return Functions.min(this);
    }

    default FunctionCall sum() {
        return Functions.sum(this);
    }

    default FunctionCall avg() {
        return Functions.avg(this);
    }

    default FunctionCall count() {
        return Functions.count(this);
    }

    default FunctionCall asc() {
        return Functions.asc(this);
    }

    default FunctionCall desc() {
        return Functions.desc(this);
    }
}
