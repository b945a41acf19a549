package org.finos.legend.ql.plan;

import java.util.List;
import java.util.Objects;

/**
 * Projects the relation onto the given columns, in the given order.
 *
 * Pure: ->project([id, name, age])
 *
 * @param columns The columns to keep
 */
public record SelectClause(List<ColumnReference> columns) implements Clause {

    public SelectClause {
        Objects.requireNonNull(columns, "Columns cannot be null");
        columns = List.copyOf(columns);
    }

    @Override
    public <T> T accept(ClauseVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
