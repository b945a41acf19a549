package org.finos.legend.ql.plan;

import java.util.Objects;

/**
 * Applies a unary operator (not, is null, is not null) to an operand.
 *
 * @param operator The unary operator
 * @param operand  The operand
 */
public record UnaryExpression(
        Operator operator,
        Expression operand) implements Expression {

    public UnaryExpression {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(operand, "Operand cannot be null");
        if (!operator.isUnary()) {
            throw new IllegalArgumentException(operator + " is not a unary operator");
        }
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitUnary(this);
    }
}
