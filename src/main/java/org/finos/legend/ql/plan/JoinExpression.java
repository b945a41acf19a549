package org.finos.legend.ql.plan;

import java.util.Objects;

/**
 * The ON condition of a join.
 *
 * @param condition Boolean predicate over the columns of both sides
 */
public record JoinExpression(Expression condition) implements Expression {

    public JoinExpression {
        Objects.requireNonNull(condition, "Join condition cannot be null");
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitJoin(this);
    }
}
