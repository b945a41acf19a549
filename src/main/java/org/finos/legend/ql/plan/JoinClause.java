package org.finos.legend.ql.plan;

import org.finos.legend.ql.store.Table;

import java.util.Objects;

/**
 * Joins the relation with another table.
 *
 * Pure: ->join(test.departments, INNER, (department_id == id))
 *
 * The joined table's schema travels with the clause so the condition can be
 * resolved against both sides; renderers only need {@link #from()}.
 *
 * @param table     The other side of the join
 * @param joinType  The type of join
 * @param condition The join condition
 */
public record JoinClause(
        Table table,
        JoinType joinType,
        JoinExpression condition) implements Clause {

    public JoinClause {
        Objects.requireNonNull(table, "Joined table cannot be null");
        Objects.requireNonNull(joinType, "Join type cannot be null");
        Objects.requireNonNull(condition, "Join condition cannot be null");
    }

    /**
     * Creates an INNER join.
     */
    public static JoinClause inner(Table table, Expression condition) {
        return new JoinClause(table, JoinType.INNER, new JoinExpression(condition));
    }

    /**
     * Creates a LEFT OUTER join.
     */
    public static JoinClause leftOuter(Table table, Expression condition) {
        return new JoinClause(table, JoinType.LEFT_OUTER, new JoinExpression(condition));
    }

    /**
     * @return The joined table as a from clause
     */
    public FromClause from() {
        return FromClause.of(table);
    }

    @Override
    public <T> T accept(ClauseVisitor<T> visitor) {
        return visitor.visit(this);
    }

    /**
     * Types of join supported by the Pure relation backend.
     */
    public enum JoinType {
        INNER("INNER"),
        LEFT_OUTER("LEFT_OUTER");

        private final String pure;

        JoinType(String pure) {
            this.pure = pure;
        }

        public String toPure() {
            return pure;
        }
    }
}
