package org.finos.legend.ql.plan;

import java.util.Objects;

/**
 * Keeps the rows matching a boolean condition.
 *
 * @param condition The filter condition expression
 */
public record FilterClause(Expression condition) implements Clause {

    public FilterClause {
        Objects.requireNonNull(condition, "Condition cannot be null");
    }

    @Override
    public <T> T accept(ClauseVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
