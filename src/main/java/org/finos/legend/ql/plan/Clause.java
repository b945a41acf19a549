package org.finos.legend.ql.plan;

/**
 * Sealed interface representing one stage of a query pipeline.
 *
 * The hierarchy models the relational operations a pipeline can chain:
 * - FromClause: the source table (always the first clause)
 * - SelectClause: column projection
 * - ExtendClause: computed columns
 * - RenameClause: column renaming
 * - FilterClause: row filtering
 * - GroupByClause: aggregation
 * - OrderByClause: sorting
 * - LimitClause / OffsetClause: row window
 * - DistinctClause: duplicate elimination
 * - JoinClause: join with another table
 */
public sealed interface Clause
        permits FromClause, SelectClause, ExtendClause, RenameClause, FilterClause, GroupByClause, OrderByClause,
        LimitClause, OffsetClause, DistinctClause, JoinClause {

    /**
     * Accept method for the visitor pattern.
     *
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this clause
     */
    <T> T accept(ClauseVisitor<T> visitor);
}
