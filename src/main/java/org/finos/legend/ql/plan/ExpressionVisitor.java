package org.finos.legend.ql.plan;

/**
 * Visitor interface for traversing Expression trees.
 *
 * @param <T> The return type of the visitor methods
 */
public interface ExpressionVisitor<T> {

    /**
     * Visit a column reference expression.
     */
    T visitColumnReference(ColumnReference columnRef);

    /**
     * Visit a literal expression.
     */
    T visitLiteral(Literal literal);

    /**
     * Visit a list literal ([elem1, elem2, ...]).
     */
    T visitListLiteral(ListLiteral listLiteral);

    /**
     * Visit a unary operator application (not, is null, is not null).
     */
    T visitUnary(UnaryExpression unary);

    /**
     * Visit a binary operator application.
     */
    T visitBinary(BinaryExpression binary);

    /**
     * Visit a function call expression.
     */
    T visitFunctionCall(FunctionExpression functionCall);

    /**
     * Visit an aliased expression.
     */
    T visitAlias(AliasExpression alias);

    /**
     * Visit a conditional expression.
     */
    T visitConditional(ConditionalExpression conditional);

    /**
     * Visit an ordering specification.
     */
    T visitOrder(OrderExpression order);

    /**
     * Visit a grouping specification.
     */
    T visitGroupBy(GroupByExpression groupBy);

    /**
     * Visit a join condition.
     */
    T visitJoin(JoinExpression join);
}
