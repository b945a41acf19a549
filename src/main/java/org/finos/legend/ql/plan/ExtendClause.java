package org.finos.legend.ql.plan;

import java.util.List;
import java.util.Objects;

/**
 * Adds computed columns to the end of the relation.
 *
 * Pure: ->extend([(salary + 1000) as bonus])
 *
 * @param columns One aliased expression per new column
 */
public record ExtendClause(List<AliasExpression> columns) implements Clause {

    public ExtendClause {
        Objects.requireNonNull(columns, "Columns cannot be null");
        columns = List.copyOf(columns);
    }

    @Override
    public <T> T accept(ClauseVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
