package org.finos.legend.ql.plan;

import java.util.List;
import java.util.Objects;

/**
 * A list of literal values, the right-hand side of {@code in} and
 * {@code notIn}.
 *
 * @param elements The literal elements, in order
 */
public record ListLiteral(List<Literal> elements) implements Expression {

    public ListLiteral {
        Objects.requireNonNull(elements, "Elements cannot be null");
        elements = List.copyOf(elements);
    }

    public static ListLiteral of(Literal... elements) {
        return new ListLiteral(List.of(elements));
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitListLiteral(this);
    }
}
