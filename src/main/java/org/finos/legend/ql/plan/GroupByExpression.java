package org.finos.legend.ql.plan;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Payload of a groupBy: grouping keys, output selections and an optional
 * having predicate.
 *
 * Example Pure:
 * ->groupBy([department_id], [department_id, avg(salary) as avg_salary])
 *
 * Selections are either key columns or aggregate calls (bare or aliased).
 * The having predicate is evaluated against the aggregated output, so it can
 * only reference keys and selection aliases.
 *
 * @param selections The output columns of the aggregation
 * @param keys       The grouping columns
 * @param having     Post-aggregation predicate, may be null
 */
public record GroupByExpression(
        List<Expression> selections,
        List<ColumnReference> keys,
        Expression having) implements Expression {

    public GroupByExpression {
        Objects.requireNonNull(selections, "Selections cannot be null");
        Objects.requireNonNull(keys, "Keys cannot be null");
        selections = List.copyOf(selections);
        keys = List.copyOf(keys);
    }

    /**
     * Constructor for a grouping without a having predicate.
     */
    public GroupByExpression(List<Expression> selections, List<ColumnReference> keys) {
        this(selections, keys, null);
    }

    /**
     * Returns the having predicate if present.
     */
    public Optional<Expression> optionalHaving() {
        return Optional.ofNullable(having);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitGroupBy(this);
    }
}
