package org.finos.legend.ql.plan;

/**
 * Visitor interface for traversing pipeline clauses.
 *
 * @param <T> The return type of the visitor methods
 */
public interface ClauseVisitor<T> {

    T visit(FromClause from);

    T visit(SelectClause select);

    T visit(ExtendClause extend);

    T visit(RenameClause rename);

    T visit(FilterClause filter);

    T visit(GroupByClause groupBy);

    T visit(OrderByClause orderBy);

    T visit(LimitClause limit);

    T visit(OffsetClause offset);

    T visit(DistinctClause distinct);

    T visit(JoinClause join);
}
