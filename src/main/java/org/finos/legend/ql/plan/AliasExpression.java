package org.finos.legend.ql.plan;

import java.util.Objects;

/**
 * Names the result of an expression.
 *
 * Used for computed columns ({@code (salary + 1000) as bonus}), aggregate
 * selections and renames ({@code id as employee_id}).
 *
 * @param alias      The output column name
 * @param expression The aliased expression
 */
public record AliasExpression(
        String alias,
        Expression expression) implements Expression {

    public AliasExpression {
        Objects.requireNonNull(alias, "Alias cannot be null");
        Objects.requireNonNull(expression, "Expression cannot be null");

        if (alias.isBlank()) {
            throw new IllegalArgumentException("Alias cannot be blank");
        }
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitAlias(this);
    }

    @Override
    public String toString() {
        return expression + " as " + alias;
    }
}
