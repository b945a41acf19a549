package org.finos.legend.ql.plan;

/**
 * Skips the first {@code count} rows.
 *
 * Pure: ->drop(n)
 *
 * @param count Number of rows to skip
 */
public record OffsetClause(int count) implements Clause {

    @Override
    public <T> T accept(ClauseVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
