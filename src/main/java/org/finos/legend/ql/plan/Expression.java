package org.finos.legend.ql.plan;

/**
 * Sealed interface representing expressions in a query pipeline.
 * Expressions are used in filters, projections, computed columns,
 * aggregations, orderings and join conditions.
 *
 * Includes:
 * - ColumnReference: reference to a column of the current schema
 * - Literal / ListLiteral: constant values
 * - UnaryExpression / BinaryExpression: operator applications
 * - FunctionExpression: aggregate and scalar function calls
 * - AliasExpression: names a computed or renamed column
 * - ConditionalExpression: if(test, then, else)
 * - OrderExpression, GroupByExpression, JoinExpression: clause payloads
 *
 * Expression trees are immutable and never hold schema types; types are
 * computed against a schema snapshot when a clause is appended.
 */
public sealed interface Expression
        permits ColumnReference, Literal, ListLiteral, UnaryExpression, BinaryExpression, FunctionExpression,
        AliasExpression, ConditionalExpression, OrderExpression, GroupByExpression, JoinExpression {

    /**
     * Accept method for the expression visitor pattern.
     *
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this expression
     */
    <T> T accept(ExpressionVisitor<T> visitor);
}
