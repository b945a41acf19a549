package org.finos.legend.ql.transpiler;

import org.finos.legend.ql.plan.AliasExpression;
import org.finos.legend.ql.plan.BinaryExpression;
import org.finos.legend.ql.plan.Clause;
import org.finos.legend.ql.plan.ClauseVisitor;
import org.finos.legend.ql.plan.ColumnReference;
import org.finos.legend.ql.plan.ConditionalExpression;
import org.finos.legend.ql.plan.DistinctClause;
import org.finos.legend.ql.plan.Expression;
import org.finos.legend.ql.plan.ExpressionVisitor;
import org.finos.legend.ql.plan.ExtendClause;
import org.finos.legend.ql.plan.FilterClause;
import org.finos.legend.ql.plan.FromClause;
import org.finos.legend.ql.plan.FunctionExpression;
import org.finos.legend.ql.plan.GroupByClause;
import org.finos.legend.ql.plan.GroupByExpression;
import org.finos.legend.ql.plan.JoinClause;
import org.finos.legend.ql.plan.JoinExpression;
import org.finos.legend.ql.plan.LimitClause;
import org.finos.legend.ql.plan.ListLiteral;
import org.finos.legend.ql.plan.Literal;
import org.finos.legend.ql.plan.OffsetClause;
import org.finos.legend.ql.plan.OrderByClause;
import org.finos.legend.ql.plan.OrderExpression;
import org.finos.legend.ql.plan.RenameClause;
import org.finos.legend.ql.plan.SelectClause;
import org.finos.legend.ql.plan.UnaryExpression;
import org.finos.legend.ql.query.BackendUnsupportedException;
import org.finos.legend.ql.query.Pipeline;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a pipeline as Pure relation text.
 *
 * The from clause renders as {@code database.table}; every later clause
 * appends {@code \n->op(args)} in pipeline order:
 *
 * <pre>
 * company.employees
 * ->project([id, name, age])
 * ->filter((age > 30))
 * ->take(5)
 * </pre>
 *
 * The generator is stateless, so one instance can render any number of
 * pipelines concurrently.
 */
public final class PureRelationGenerator
        implements QueryRenderer, ClauseVisitor<String>, ExpressionVisitor<String> {

    public static final PureRelationGenerator INSTANCE = new PureRelationGenerator();

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    @Override
    public String name() {
        return "Pure relation";
    }

    @Override
    public String render(Pipeline pipeline) {
        StringBuilder sb = new StringBuilder(pipeline.from().accept(this));
        List<Clause> clauses = pipeline.clauses();
        for (int i = 1; i < clauses.size(); i++) {
            sb.append(clauses.get(i).accept(this));
        }
        return sb.toString();
    }

    /**
     * Renders the text one clause contributes after the source.
     */
    public String renderSuffix(Clause clause) {
        return clause.accept(this);
    }

    /**
     * Renders a single expression.
     */
    public String renderExpression(Expression expression) {
        return expression.accept(this);
    }

    // ==================== Clause visitors ====================

    @Override
    public String visit(FromClause from) {
        return from.database() + "." + from.table();
    }

    @Override
    public String visit(SelectClause select) {
        return suffix("project", "[" + join(select.columns()) + "]");
    }

    @Override
    public String visit(ExtendClause extend) {
        return suffix("extend", "[" + join(extend.columns()) + "]");
    }

    @Override
    public String visit(RenameClause rename) {
        return suffix("rename", "[" + join(rename.renames()) + "]");
    }

    @Override
    public String visit(FilterClause filter) {
        return suffix("filter", filter.condition().accept(this));
    }

    @Override
    public String visit(GroupByClause groupBy) {
        return suffix("groupBy", groupBy.grouping().accept(this));
    }

    @Override
    public String visit(OrderByClause orderBy) {
        return suffix("sort", "[" + join(orderBy.ordering()) + "]");
    }

    @Override
    public String visit(LimitClause limit) {
        return suffix("take", String.valueOf(limit.count()));
    }

    @Override
    public String visit(OffsetClause offset) {
        return suffix("drop", String.valueOf(offset.count()));
    }

    @Override
    public String visit(DistinctClause distinct) {
        throw new BackendUnsupportedException("distinct", name());
    }

    @Override
    public String visit(JoinClause join) {
        return suffix("join", join.from().accept(this)
                + ", " + join.joinType().toPure()
                + ", " + join.condition().accept(this));
    }

    private static String suffix(String operation, String arguments) {
        return "\n->" + operation + "(" + arguments + ")";
    }

    private String join(List<? extends Expression> expressions) {
        return expressions.stream()
                .map(e -> e.accept(this))
                .collect(Collectors.joining(", "));
    }

    // ==================== Expression visitors ====================

    @Override
    public String visitColumnReference(ColumnReference columnRef) {
        return columnRef.name();
    }

    @Override
    public String visitLiteral(Literal literal) {
        return switch (literal.type()) {
            case INTEGER, LONG, DOUBLE, BOOLEAN -> String.valueOf(literal.value());
            case STRING -> "'" + ((String) literal.value()).replace("\\", "\\\\").replace("'", "\\'") + "'";
            case DATE -> "%" + DATE_FORMAT.format((LocalDate) literal.value()) + "%";
            case DATETIME -> "%" + DATE_TIME_FORMAT.format((LocalDateTime) literal.value()) + "%";
        };
    }

    @Override
    public String visitListLiteral(ListLiteral listLiteral) {
        return "[" + join(listLiteral.elements()) + "]";
    }

    @Override
    public String visitUnary(UnaryExpression unary) {
        String operand = unary.operand().accept(this);
        return switch (unary.operator()) {
            case NOT -> "not(" + operand + ")";
            case IS_NULL, IS_NOT_NULL -> "(" + operand + " " + unary.operator().symbol() + ")";
            default -> throw new BackendUnsupportedException("unary " + unary.operator(), name());
        };
    }

    @Override
    public String visitBinary(BinaryExpression binary) {
        String left = binary.left().accept(this);
        String right = binary.right().accept(this);
        if (binary.operator().rendersAsCall()) {
            return binary.operator().symbol() + "(" + left + ", " + right + ")";
        }
        return "(" + left + " " + binary.operator().symbol() + " " + right + ")";
    }

    @Override
    public String visitFunctionCall(FunctionExpression functionCall) {
        return functionCall.function().pureName() + "(" + join(functionCall.arguments()) + ")";
    }

    @Override
    public String visitAlias(AliasExpression alias) {
        return alias.expression().accept(this) + " as " + alias.alias();
    }

    @Override
    public String visitConditional(ConditionalExpression conditional) {
        return "if(" + conditional.test().accept(this)
                + ", " + conditional.then().accept(this)
                + ", " + conditional.otherwise().accept(this) + ")";
    }

    @Override
    public String visitOrder(OrderExpression order) {
        return order.direction().toPure();
    }

    @Override
    public String visitGroupBy(GroupByExpression groupBy) {
        String result = "[" + join(groupBy.keys()) + "], [" + join(groupBy.selections()) + "]";
        return groupBy.optionalHaving()
                .map(having -> result + ", " + having.accept(this))
                .orElse(result);
    }

    @Override
    public String visitJoin(JoinExpression join) {
        return join.condition().accept(this);
    }
}
