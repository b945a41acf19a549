package org.finos.legend.ql.plan;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

/**
 * Static factories for building expression trees.
 *
 * Every factory returns a new node and never touches its arguments, so
 * sub-trees can be shared freely between expressions.
 *
 * <pre>
 * import static org.finos.legend.ql.plan.Expressions.*;
 *
 * and(gt(col("age"), lit(30)), like(col("name"), lit("J%")))
 * as("bonus", add(col("salary"), lit(1000)))
 * </pre>
 */
public final class Expressions {

    private Expressions() {
    }

    // ==================== Leaves ====================

    public static ColumnReference col(String name) {
        return new ColumnReference(name);
    }

    public static List<ColumnReference> cols(String... names) {
        return Arrays.stream(names).map(ColumnReference::new).toList();
    }

    public static Literal lit(int value) {
        return Literal.integer(value);
    }

    public static Literal lit(long value) {
        return Literal.bigint(value);
    }

    public static Literal lit(double value) {
        return Literal.decimal(value);
    }

    public static Literal lit(String value) {
        return Literal.string(value);
    }

    public static Literal lit(boolean value) {
        return Literal.bool(value);
    }

    public static Literal lit(LocalDate value) {
        return Literal.date(value);
    }

    public static Literal lit(LocalDateTime value) {
        return Literal.dateTime(value);
    }

    public static ListLiteral list(Literal... elements) {
        return ListLiteral.of(elements);
    }

    // ==================== Comparison ====================

    public static BinaryExpression eq(Expression left, Expression right) {
        return new BinaryExpression(Operator.EQUALS, left, right);
    }

    public static BinaryExpression ne(Expression left, Expression right) {
        return new BinaryExpression(Operator.NOT_EQUALS, left, right);
    }

    public static BinaryExpression lt(Expression left, Expression right) {
        return new BinaryExpression(Operator.LESS_THAN, left, right);
    }

    public static BinaryExpression le(Expression left, Expression right) {
        return new BinaryExpression(Operator.LESS_THAN_OR_EQUALS, left, right);
    }

    public static BinaryExpression gt(Expression left, Expression right) {
        return new BinaryExpression(Operator.GREATER_THAN, left, right);
    }

    public static BinaryExpression ge(Expression left, Expression right) {
        return new BinaryExpression(Operator.GREATER_THAN_OR_EQUALS, left, right);
    }

    public static BinaryExpression like(Expression left, Expression pattern) {
        return new BinaryExpression(Operator.LIKE, left, pattern);
    }

    public static UnaryExpression isNull(Expression operand) {
        return new UnaryExpression(Operator.IS_NULL, operand);
    }

    public static UnaryExpression isNotNull(Expression operand) {
        return new UnaryExpression(Operator.IS_NOT_NULL, operand);
    }

    public static BinaryExpression in(Expression left, ListLiteral values) {
        return new BinaryExpression(Operator.IN, left, values);
    }

    public static BinaryExpression notIn(Expression left, ListLiteral values) {
        return new BinaryExpression(Operator.NOT_IN, left, values);
    }

    // ==================== Logical ====================

    public static BinaryExpression and(Expression left, Expression right) {
        return new BinaryExpression(Operator.AND, left, right);
    }

    public static BinaryExpression or(Expression left, Expression right) {
        return new BinaryExpression(Operator.OR, left, right);
    }

    public static UnaryExpression not(Expression operand) {
        return new UnaryExpression(Operator.NOT, operand);
    }

    // ==================== Arithmetic / bitwise ====================

    public static BinaryExpression add(Expression left, Expression right) {
        return new BinaryExpression(Operator.ADD, left, right);
    }

    public static BinaryExpression subtract(Expression left, Expression right) {
        return new BinaryExpression(Operator.SUBTRACT, left, right);
    }

    public static BinaryExpression multiply(Expression left, Expression right) {
        return new BinaryExpression(Operator.MULTIPLY, left, right);
    }

    public static BinaryExpression divide(Expression left, Expression right) {
        return new BinaryExpression(Operator.DIVIDE, left, right);
    }

    public static BinaryExpression mod(Expression left, Expression right) {
        return new BinaryExpression(Operator.MODULO, left, right);
    }

    public static BinaryExpression pow(Expression left, Expression right) {
        return new BinaryExpression(Operator.POWER, left, right);
    }

    public static BinaryExpression bitAnd(Expression left, Expression right) {
        return new BinaryExpression(Operator.BITWISE_AND, left, right);
    }

    public static BinaryExpression bitOr(Expression left, Expression right) {
        return new BinaryExpression(Operator.BITWISE_OR, left, right);
    }

    // ==================== Functions ====================

    public static FunctionExpression count(Expression argument) {
        return FunctionExpression.of(FunctionExpression.Function.COUNT, argument);
    }

    public static FunctionExpression sum(Expression argument) {
        return FunctionExpression.of(FunctionExpression.Function.SUM, argument);
    }

    public static FunctionExpression avg(Expression argument) {
        return FunctionExpression.of(FunctionExpression.Function.AVG, argument);
    }

    public static FunctionExpression min(Expression argument) {
        return FunctionExpression.of(FunctionExpression.Function.MIN, argument);
    }

    public static FunctionExpression max(Expression argument) {
        return FunctionExpression.of(FunctionExpression.Function.MAX, argument);
    }

    public static FunctionExpression modulo(Expression dividend, Expression divisor) {
        return FunctionExpression.of(FunctionExpression.Function.MODULO, dividend, divisor);
    }

    public static FunctionExpression power(Expression base, Expression exponent) {
        return FunctionExpression.of(FunctionExpression.Function.POWER, base, exponent);
    }

    // ==================== Structure ====================

    public static AliasExpression as(String alias, Expression expression) {
        return new AliasExpression(alias, expression);
    }

    public static ConditionalExpression ifThenElse(Expression test, Expression then, Expression otherwise) {
        return new ConditionalExpression(test, then, otherwise);
    }

    public static OrderExpression asc(Expression expression) {
        return OrderExpression.asc(expression);
    }

    public static OrderExpression desc(Expression expression) {
        return OrderExpression.desc(expression);
    }

    public static OrderExpression asc(String column) {
        return OrderExpression.asc(col(column));
    }

    public static OrderExpression desc(String column) {
        return OrderExpression.desc(col(column));
    }
}
