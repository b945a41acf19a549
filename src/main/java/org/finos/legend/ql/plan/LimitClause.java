package org.finos.legend.ql.plan;

/**
 * Keeps at most {@code count} rows.
 *
 * Pure: ->take(n)
 *
 * @param count Maximum number of rows
 */
public record LimitClause(int count) implements Clause {

    @Override
    public <T> T accept(ClauseVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
