package org.finos.legend.ql.plan;

import java.util.Objects;

/**
 * A single sort key with its direction.
 *
 * @param direction The sort direction
 * @param expression The expression to sort by
 */
public record OrderExpression(
        SortDirection direction,
        Expression expression) implements Expression {

    /**
     * Sort direction for sort().
     */
    public enum SortDirection {
        ASC("asc"),
        DESC("desc");

        private final String pure;

        SortDirection(String pure) {
            this.pure = pure;
        }

        public String toPure() {
            return pure;
        }
    }

    public OrderExpression {
        Objects.requireNonNull(direction, "Direction cannot be null");
        Objects.requireNonNull(expression, "Expression cannot be null");
    }

    public static OrderExpression asc(Expression expression) {
        return new OrderExpression(SortDirection.ASC, expression);
    }

    public static OrderExpression desc(Expression expression) {
        return new OrderExpression(SortDirection.DESC, expression);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitOrder(this);
    }
}
