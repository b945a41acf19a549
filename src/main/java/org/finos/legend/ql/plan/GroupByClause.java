package org.finos.legend.ql.plan;

import java.util.Objects;

/**
 * Aggregates the relation.
 *
 * Pure: ->groupBy([department_id], [department_id, avg(salary) as avg_salary])
 *
 * @param grouping Keys, selections and optional having predicate
 */
public record GroupByClause(GroupByExpression grouping) implements Clause {

    public GroupByClause {
        Objects.requireNonNull(grouping, "Grouping cannot be null");
    }

    @Override
    public <T> T accept(ClauseVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
