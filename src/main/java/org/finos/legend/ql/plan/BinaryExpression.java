package org.finos.legend.ql.plan;

import java.util.Objects;

/**
 * Applies a binary operator to two operands (e.g., age > 30, salary + 1000).
 *
 * @param operator The binary operator
 * @param left     The left operand
 * @param right    The right operand
 */
public record BinaryExpression(
        Operator operator,
        Expression left,
        Expression right) implements Expression {

    public BinaryExpression {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
        if (operator.isUnary()) {
            throw new IllegalArgumentException(operator + " is not a binary operator");
        }
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " " + right + ")";
    }
}
