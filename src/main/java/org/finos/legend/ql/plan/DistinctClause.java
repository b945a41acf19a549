package org.finos.legend.ql.plan;

import java.util.List;
import java.util.Objects;

/**
 * Removes duplicate rows.
 *
 * Two forms:
 * - distinct() - all columns
 * - distinct([col1, col2]) - specific columns
 *
 * @param columns The columns to keep; empty means all columns
 */
public record DistinctClause(List<ColumnReference> columns) implements Clause {

    public DistinctClause {
        Objects.requireNonNull(columns, "Columns cannot be null");
        columns = List.copyOf(columns);
    }

    public static DistinctClause all() {
        return new DistinctClause(List.of());
    }

    public boolean isAllColumns() {
        return columns.isEmpty();
    }

    @Override
    public <T> T accept(ClauseVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
