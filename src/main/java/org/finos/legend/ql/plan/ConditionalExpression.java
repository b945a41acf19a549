package org.finos.legend.ql.plan;

import java.util.Objects;

/**
 * Represents {@code if(test, then, else)}.
 *
 * @param test      The boolean condition
 * @param then      Value when the condition holds
 * @param otherwise Value when it does not
 */
public record ConditionalExpression(
        Expression test,
        Expression then,
        Expression otherwise) implements Expression {

    public ConditionalExpression {
        Objects.requireNonNull(test, "Test cannot be null");
        Objects.requireNonNull(then, "Then branch cannot be null");
        Objects.requireNonNull(otherwise, "Else branch cannot be null");
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitConditional(this);
    }
}
