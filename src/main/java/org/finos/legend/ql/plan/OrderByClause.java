package org.finos.legend.ql.plan;

import java.util.List;
import java.util.Objects;

/**
 * Sorts the relation.
 *
 * @param ordering The sort keys, most significant first
 */
public record OrderByClause(List<OrderExpression> ordering) implements Clause {

    public OrderByClause {
        Objects.requireNonNull(ordering, "Ordering cannot be null");
        ordering = List.copyOf(ordering);
    }

    @Override
    public <T> T accept(ClauseVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
