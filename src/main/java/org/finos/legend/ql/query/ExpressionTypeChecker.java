package org.finos.legend.ql.query;

import org.finos.legend.ql.plan.AliasExpression;
import org.finos.legend.ql.plan.BinaryExpression;
import org.finos.legend.ql.plan.ColumnReference;
import org.finos.legend.ql.plan.ConditionalExpression;
import org.finos.legend.ql.plan.Expression;
import org.finos.legend.ql.plan.ExpressionVisitor;
import org.finos.legend.ql.plan.FunctionExpression;
import org.finos.legend.ql.plan.GroupByExpression;
import org.finos.legend.ql.plan.JoinExpression;
import org.finos.legend.ql.plan.ListLiteral;
import org.finos.legend.ql.plan.Literal;
import org.finos.legend.ql.plan.Operator;
import org.finos.legend.ql.plan.OrderExpression;
import org.finos.legend.ql.plan.UnaryExpression;
import org.finos.legend.ql.store.ColumnType;
import org.finos.legend.ql.store.Table;

import java.util.Objects;

/**
 * Computes the type of an expression against a schema snapshot, enforcing
 * the operator and function legality rules.
 *
 * Column references must exist in the schema ({@link UnknownColumnException});
 * ill-typed operator or function applications raise
 * {@link QueryTypeException}. Instances are cheap and single-use per clause.
 *
 * Aggregate calls are legal only where rows are being aggregated (extend and
 * groupBy selections); row-level clauses build a checker that rejects them.
 */
public final class ExpressionTypeChecker implements ExpressionVisitor<ColumnType> {

    private final Table schema;
    private final String clause;
    private final boolean aggregatesAllowed;

    // Depth of enclosing aggregate calls; aggregates may not nest
    private int aggregateDepth;

    public ExpressionTypeChecker(Table schema, String clause) {
        this(schema, clause, true);
    }

    public ExpressionTypeChecker(Table schema, String clause, boolean aggregatesAllowed) {
        this.schema = Objects.requireNonNull(schema, "Schema cannot be null");
        this.clause = Objects.requireNonNull(clause, "Clause cannot be null");
        this.aggregatesAllowed = aggregatesAllowed;
    }

    /**
     * @return The type the expression evaluates to
     */
    public ColumnType typeOf(Expression expression) {
        return expression.accept(this);
    }

    /**
     * Checks that the expression is a predicate.
     *
     * @throws QueryTypeException if it does not evaluate to BOOLEAN
     */
    public void requireBoolean(Expression expression, String what) {
        ColumnType type = typeOf(expression);
        if (type != ColumnType.BOOLEAN) {
            throw new QueryTypeException(what, clause,
                    "The " + what + " of " + clause + " must be BOOLEAN but was " + type);
        }
    }

    @Override
    public ColumnType visitColumnReference(ColumnReference columnRef) {
        return schema.findColumn(columnRef.name())
                .orElseThrow(() -> new UnknownColumnException(columnRef.name(), clause, schema))
                .type();
    }

    @Override
    public ColumnType visitLiteral(Literal literal) {
        return literal.type();
    }

    @Override
    public ColumnType visitListLiteral(ListLiteral listLiteral) {
        if (listLiteral.elements().isEmpty()) {
            throw new QueryTypeException("[]", clause, "A value list cannot be empty");
        }
        ColumnType result = listLiteral.elements().get(0).type();
        for (Literal element : listLiteral.elements()) {
            if (!element.type().isComparableWith(result)) {
                throw new QueryTypeException(String.valueOf(element.value()), clause,
                        "Value list mixes " + result + " and " + element.type());
            }
            if (result.isNumeric()) {
                result = result.widen(element.type());
            }
        }
        return result;
    }

    @Override
    public ColumnType visitUnary(UnaryExpression unary) {
        Operator operator = unary.operator();
        if (operator == Operator.NOT) {
            ColumnType operand = typeOf(unary.operand());
            if (operand != ColumnType.BOOLEAN) {
                throw operatorError(operator, "requires a BOOLEAN operand but got " + operand);
            }
            return ColumnType.BOOLEAN;
        }
        // IS_NULL / IS_NOT_NULL
        if (!(unary.operand() instanceof ColumnReference)) {
            throw operatorError(operator, "applies to columns only");
        }
        typeOf(unary.operand());
        return ColumnType.BOOLEAN;
    }

    @Override
    public ColumnType visitBinary(BinaryExpression binary) {
        Operator operator = binary.operator();
        return switch (operator.category()) {
            case COMPARISON -> checkComparison(binary);
            case LOGICAL -> {
                ColumnType left = typeOf(binary.left());
                ColumnType right = typeOf(binary.right());
                if (left != ColumnType.BOOLEAN || right != ColumnType.BOOLEAN) {
                    throw operatorError(operator, "requires BOOLEAN operands but got " + left + " and " + right);
                }
                yield ColumnType.BOOLEAN;
            }
            case ARITHMETIC -> {
                ColumnType left = typeOf(binary.left());
                ColumnType right = typeOf(binary.right());
                if (!left.isNumeric() || !right.isNumeric()) {
                    throw operatorError(operator, "requires numeric operands but got " + left + " and " + right);
                }
                yield left.widen(right);
            }
            case BITWISE -> {
                ColumnType left = typeOf(binary.left());
                ColumnType right = typeOf(binary.right());
                if (!left.isIntegral() || !right.isIntegral()) {
                    throw operatorError(operator,
                            "requires INTEGER or LONG operands but got " + left + " and " + right);
                }
                yield left.widen(right);
            }
        };
    }

    private ColumnType checkComparison(BinaryExpression binary) {
        Operator operator = binary.operator();
        ColumnType left = typeOf(binary.left());

        if (operator == Operator.LIKE) {
            if (left != ColumnType.STRING) {
                throw operatorError(operator, "requires a STRING operand but got " + left);
            }
            if (!(binary.right() instanceof Literal pattern) || pattern.type() != ColumnType.STRING) {
                throw operatorError(operator, "requires a STRING literal pattern");
            }
            return ColumnType.BOOLEAN;
        }

        if (operator == Operator.IN || operator == Operator.NOT_IN) {
            if (!(binary.right() instanceof ListLiteral values)) {
                throw operatorError(operator, "requires a value list on the right");
            }
            ColumnType elements = typeOf(values);
            if (!left.isComparableWith(elements)) {
                throw operatorError(operator, "cannot match " + left + " against " + elements + " values");
            }
            return ColumnType.BOOLEAN;
        }

        ColumnType right = typeOf(binary.right());
        if (!left.isComparableWith(right)) {
            throw operatorError(operator, "cannot compare " + left + " with " + right);
        }
        if (left == ColumnType.BOOLEAN && operator.isOrderingComparison()) {
            throw operatorError(operator, "cannot order BOOLEAN values");
        }
        return ColumnType.BOOLEAN;
    }

    @Override
    public ColumnType visitFunctionCall(FunctionExpression functionCall) {
        FunctionExpression.Function function = functionCall.function();
        String name = function.pureName();
        if (functionCall.arguments().size() != function.arity()) {
            throw new QueryTypeException(name, clause,
                    name + "() takes " + function.arity() + " argument(s) but got "
                            + functionCall.arguments().size());
        }
        if (function.isAggregate() && !aggregatesAllowed) {
            throw new QueryTypeException(name, clause, "Aggregate " + name + "() is not allowed in " + clause);
        }
        if (function.isAggregate() && aggregateDepth > 0) {
            throw new QueryTypeException(name, clause, "Aggregate " + name + "() cannot be nested in another aggregate");
        }

        if (function.isAggregate()) {
            aggregateDepth++;
        }
        try {
            return switch (function) {
                case COUNT -> {
                    typeOf(functionCall.arguments().get(0));
                    yield ColumnType.LONG;
                }
                case SUM -> requireNumeric(name, functionCall.arguments().get(0));
                case AVG -> {
                    requireNumeric(name, functionCall.arguments().get(0));
                    yield ColumnType.DOUBLE;
                }
                case MIN, MAX -> {
                    ColumnType argument = typeOf(functionCall.arguments().get(0));
                    if (argument == ColumnType.BOOLEAN) {
                        throw new QueryTypeException(name, clause, name + "() cannot be applied to BOOLEAN");
                    }
                    yield argument;
                }
                case MODULO, POWER -> {
                    ColumnType first = requireNumeric(name, functionCall.arguments().get(0));
                    ColumnType second = requireNumeric(name, functionCall.arguments().get(1));
                    yield first.widen(second);
                }
            };
        } finally {
            if (function.isAggregate()) {
                aggregateDepth--;
            }
        }
    }

    private ColumnType requireNumeric(String function, Expression argument) {
        ColumnType type = typeOf(argument);
        if (!type.isNumeric()) {
            throw new QueryTypeException(function, clause, function + "() requires a numeric argument but got " + type);
        }
        return type;
    }

    @Override
    public ColumnType visitAlias(AliasExpression alias) {
        return typeOf(alias.expression());
    }

    @Override
    public ColumnType visitConditional(ConditionalExpression conditional) {
        ColumnType test = typeOf(conditional.test());
        if (test != ColumnType.BOOLEAN) {
            throw new QueryTypeException("if", clause, "if() test must be BOOLEAN but was " + test);
        }
        ColumnType then = typeOf(conditional.then());
        ColumnType otherwise = typeOf(conditional.otherwise());
        if (then == otherwise) {
            return then;
        }
        if (!then.isComparableWith(otherwise)) {
            throw new QueryTypeException("if", clause, "if() branches disagree: " + then + " and " + otherwise);
        }
        if (then.isNumeric()) {
            return then.widen(otherwise);
        }
        // Mixed DATE / DATETIME branches
        return ColumnType.DATETIME;
    }

    @Override
    public ColumnType visitOrder(OrderExpression order) {
        return typeOf(order.expression());
    }

    @Override
    public ColumnType visitGroupBy(GroupByExpression groupBy) {
        throw new QueryTypeException("groupBy", clause, "A grouping specification is not a value");
    }

    @Override
    public ColumnType visitJoin(JoinExpression join) {
        return typeOf(join.condition());
    }

    private QueryTypeException operatorError(Operator operator, String detail) {
        return new QueryTypeException(operator.symbol(), clause, "Operator '" + operator.symbol() + "' " + detail);
    }
}
