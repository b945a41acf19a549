package org.finos.legend.ql.query;

import org.finos.legend.ql.plan.AliasExpression;
import org.finos.legend.ql.plan.Clause;
import org.finos.legend.ql.plan.ClauseVisitor;
import org.finos.legend.ql.plan.ColumnReference;
import org.finos.legend.ql.plan.DistinctClause;
import org.finos.legend.ql.plan.Expression;
import org.finos.legend.ql.plan.ExtendClause;
import org.finos.legend.ql.plan.FilterClause;
import org.finos.legend.ql.plan.FromClause;
import org.finos.legend.ql.plan.FunctionExpression;
import org.finos.legend.ql.plan.GroupByClause;
import org.finos.legend.ql.plan.GroupByExpression;
import org.finos.legend.ql.plan.JoinClause;
import org.finos.legend.ql.plan.LimitClause;
import org.finos.legend.ql.plan.OffsetClause;
import org.finos.legend.ql.plan.OrderByClause;
import org.finos.legend.ql.plan.OrderExpression;
import org.finos.legend.ql.plan.RenameClause;
import org.finos.legend.ql.plan.SelectClause;
import org.finos.legend.ql.store.Column;
import org.finos.legend.ql.store.Table;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Validates a clause against the current schema snapshot and computes the
 * snapshot that follows it.
 *
 * Resolution either returns the next schema or throws a
 * {@link QueryException}; it never modifies the input schema.
 *
 * Clause names used in errors are the Pure relation operation names
 * (project, extend, rename, filter, groupBy, sort, take, drop, distinct, join).
 */
public final class ClauseResolver implements ClauseVisitor<Table> {

    private final Table current;

    public ClauseResolver(Table current) {
        this.current = Objects.requireNonNull(current, "Current schema cannot be null");
    }

    /**
     * Resolves a clause against the current schema.
     *
     * @param clause The clause to validate
     * @return The schema after applying the clause
     */
    public Table resolve(Clause clause) {
        return clause.accept(this);
    }

    // ==================== Clause visitors ====================

    @Override
    public Table visit(FromClause from) {
        throw new QueryConfigException(from.toString(), "from",
                "A pipeline has exactly one from clause and it is always the first");
    }

    @Override
    public Table visit(SelectClause select) {
        return current.withColumns(pickColumns(select.columns(), "project"));
    }

    @Override
    public Table visit(ExtendClause extend) {
        requireNonEmpty(extend.columns(), "extend");
        ExpressionTypeChecker checker = new ExpressionTypeChecker(current, "extend");
        Set<String> names = new HashSet<>(current.columnNames());
        List<Column> columns = new ArrayList<>(current.columns());
        for (AliasExpression column : extend.columns()) {
            if (!names.add(column.alias())) {
                throw new DuplicateAliasException(column.alias(), "extend");
            }
            columns.add(new Column(column.alias(), checker.typeOf(column.expression())));
        }
        return current.withColumns(columns);
    }

    @Override
    public Table visit(RenameClause rename) {
        requireNonEmpty(rename.renames(), "rename");
        Map<String, String> renames = new HashMap<>();
        for (AliasExpression pair : rename.renames()) {
            String source = ((ColumnReference) pair.expression()).name();
            if (!current.hasColumn(source)) {
                throw new UnknownColumnException(source, "rename", current);
            }
            if (renames.put(source, pair.alias()) != null) {
                throw new DuplicateAliasException(source, "rename",
                        "Column '" + source + "' is renamed more than once");
            }
        }

        Set<String> names = new HashSet<>();
        List<Column> columns = new ArrayList<>(current.columns().size());
        for (Column column : current.columns()) {
            String target = renames.getOrDefault(column.name(), column.name());
            if (!names.add(target)) {
                throw new DuplicateAliasException(target, "rename");
            }
            columns.add(column.renamed(target));
        }
        return current.withColumns(columns);
    }

    @Override
    public Table visit(FilterClause filter) {
        new ExpressionTypeChecker(current, "filter", false).requireBoolean(filter.condition(), "condition");
        return current;
    }

    @Override
    public Table visit(GroupByClause groupBy) {
        GroupByExpression grouping = groupBy.grouping();
        requireNonEmpty(grouping.selections(), "groupBy");

        Set<String> keys = new HashSet<>();
        for (ColumnReference key : grouping.keys()) {
            if (!current.hasColumn(key.name())) {
                throw new UnknownColumnException(key.name(), "groupBy", current);
            }
            keys.add(key.name());
        }

        ExpressionTypeChecker checker = new ExpressionTypeChecker(current, "groupBy");
        Set<String> names = new HashSet<>();
        List<Column> columns = new ArrayList<>();
        for (int i = 0; i < grouping.selections().size(); i++) {
            Column column = resolveSelection(grouping.selections().get(i), i, keys, checker);
            if (!names.add(column.name())) {
                throw new DuplicateAliasException(column.name(), "groupBy");
            }
            columns.add(column);
        }
        Table aggregated = current.withColumns(columns);

        grouping.optionalHaving().ifPresent(having -> checkHaving(having, aggregated));
        return aggregated;
    }

    private void checkHaving(Expression having, Table aggregated) {
        try {
            new ExpressionTypeChecker(aggregated, "groupBy", false).requireBoolean(having, "having");
        } catch (UnknownColumnException e) {
            if (current.hasColumn(e.subject())) {
                throw new InvalidAggregateReferenceException(e.subject(), "groupBy",
                        "having references '" + e.subject() + "', which is not part of the grouped output "
                                + aggregated.columnNames());
            }
            throw e;
        }
    }

    private Column resolveSelection(Expression selection, int position, Set<String> keys,
            ExpressionTypeChecker checker) {
        if (selection instanceof ColumnReference ref) {
            if (!current.hasColumn(ref.name())) {
                throw new UnknownColumnException(ref.name(), "groupBy", current);
            }
            if (!keys.contains(ref.name())) {
                throw new InvalidAggregateReferenceException(ref.name(), "groupBy",
                        "Selection '" + ref.name() + "' is neither a grouping key nor an aggregate");
            }
            return current.getColumn(ref.name());
        }

        String name = "col" + (position + 1);
        Expression value = selection;
        if (selection instanceof AliasExpression alias) {
            name = alias.alias();
            value = alias.expression();
        }
        if (value instanceof ColumnReference ref && keys.contains(ref.name())) {
            return current.getColumn(ref.name()).renamed(name);
        }
        if (!(value instanceof FunctionExpression call) || !call.isAggregate()) {
            throw new InvalidAggregateReferenceException(name, "groupBy",
                    "Selection '" + name + "' must be a grouping key or an aggregate call");
        }
        return new Column(name, checker.typeOf(call));
    }

    @Override
    public Table visit(OrderByClause orderBy) {
        requireNonEmpty(orderBy.ordering(), "sort");
        ExpressionTypeChecker checker = new ExpressionTypeChecker(current, "sort", false);
        for (OrderExpression order : orderBy.ordering()) {
            checker.typeOf(order);
        }
        return current;
    }

    @Override
    public Table visit(LimitClause limit) {
        requireNonNegative(limit.count(), "take");
        return current;
    }

    @Override
    public Table visit(OffsetClause offset) {
        requireNonNegative(offset.count(), "drop");
        return current;
    }

    @Override
    public Table visit(DistinctClause distinct) {
        if (distinct.isAllColumns()) {
            return current;
        }
        return current.withColumns(pickColumns(distinct.columns(), "distinct"));
    }

    @Override
    public Table visit(JoinClause join) {
        Table other = join.table();
        // Collisions are reported before the condition is looked at
        for (Column column : other.columns()) {
            if (current.hasColumn(column.name())) {
                throw new DuplicateAliasException(column.name(), "join",
                        "Column '" + column.name() + "' exists in both " + current.qualifiedName()
                                + " and " + other.qualifiedName() + "; rename it before joining");
            }
        }

        List<Column> columns = new ArrayList<>(current.columns());
        columns.addAll(other.columns());
        Table joined = current.withColumns(columns);
        new ExpressionTypeChecker(joined, "join", false).requireBoolean(join.condition(), "condition");
        return joined;
    }

    // ==================== Helpers ====================

    private List<Column> pickColumns(List<ColumnReference> refs, String clause) {
        requireNonEmpty(refs, clause);
        Set<String> seen = new HashSet<>();
        List<Column> columns = new ArrayList<>(refs.size());
        for (ColumnReference ref : refs) {
            Column column = current.findColumn(ref.name())
                    .orElseThrow(() -> new UnknownColumnException(ref.name(), clause, current));
            if (!seen.add(ref.name())) {
                throw new DuplicateAliasException(ref.name(), clause,
                        "Column '" + ref.name() + "' is listed more than once in " + clause);
            }
            columns.add(column);
        }
        return columns;
    }

    private static void requireNonEmpty(List<?> items, String clause) {
        if (items.isEmpty()) {
            throw new QueryConfigException("[]", clause, clause + " requires at least one column");
        }
    }

    private static void requireNonNegative(int count, String clause) {
        if (count < 0) {
            throw new QueryConfigException(String.valueOf(count), clause,
                    clause + " requires a non-negative row count but got " + count);
        }
    }
}
