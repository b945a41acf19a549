package org.finos.legend.ql.query;

import org.finos.legend.ql.execution.BoundQuery;
import org.finos.legend.ql.execution.QueryRuntime;
import org.finos.legend.ql.plan.AliasExpression;
import org.finos.legend.ql.plan.Clause;
import org.finos.legend.ql.plan.ColumnReference;
import org.finos.legend.ql.plan.DistinctClause;
import org.finos.legend.ql.plan.Expression;
import org.finos.legend.ql.plan.Expressions;
import org.finos.legend.ql.plan.ExtendClause;
import org.finos.legend.ql.plan.FilterClause;
import org.finos.legend.ql.plan.GroupByClause;
import org.finos.legend.ql.plan.GroupByExpression;
import org.finos.legend.ql.plan.JoinClause;
import org.finos.legend.ql.plan.JoinExpression;
import org.finos.legend.ql.plan.LimitClause;
import org.finos.legend.ql.plan.OffsetClause;
import org.finos.legend.ql.plan.OrderByClause;
import org.finos.legend.ql.plan.OrderExpression;
import org.finos.legend.ql.plan.RenameClause;
import org.finos.legend.ql.plan.SelectClause;
import org.finos.legend.ql.store.Database;
import org.finos.legend.ql.store.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Fluent builder over a {@link Pipeline}.
 *
 * Each call validates one clause and, on success, moves the query to the
 * longer pipeline. A rejected call throws a {@link QueryException} and leaves
 * the query exactly as it was, so the caller can inspect or keep building
 * from the last valid state.
 *
 * <pre>
 * Query.from(employees)
 *         .select("name", "salary", "age")
 *         .filter(gt(col("age"), lit(30)))
 *         .orderBy(desc("salary"))
 *         .limit(10);
 * </pre>
 *
 * Not thread-safe; the pipelines it produces are.
 */
public final class Query {

    private static final Logger LOGGER = LoggerFactory.getLogger(Query.class);

    private Pipeline pipeline;

    private Query(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public static Query from(Table table) {
        return new Query(Pipeline.from(table));
    }

    /**
     * Starts a query on a table registered in a database.
     *
     * @throws IllegalArgumentException if the database has no such table
     */
    public static Query from(Database database, String tableName) {
        return from(database.table(tableName));
    }

    public Query select(String... columns) {
        return select(Expressions.cols(columns));
    }

    public Query select(List<ColumnReference> columns) {
        return append(new SelectClause(columns));
    }

    public Query extend(AliasExpression... columns) {
        return extend(List.of(columns));
    }

    public Query extend(List<AliasExpression> columns) {
        return append(new ExtendClause(columns));
    }

    public Query rename(String column, String newName) {
        return rename(Map.of(column, newName));
    }

    /**
     * Renames several columns at once. Pass an ordered map for a
     * deterministic rendering order.
     */
    public Query rename(Map<String, String> renames) {
        List<AliasExpression> pairs = new ArrayList<>(renames.size());
        renames.forEach((column, newName) -> pairs.add(Expressions.as(newName, Expressions.col(column))));
        return append(new RenameClause(pairs));
    }

    public Query filter(Expression condition) {
        return append(new FilterClause(condition));
    }

    public Query groupBy(List<? extends Expression> selections, List<ColumnReference> keys) {
        return groupBy(selections, keys, null);
    }

    /**
     * @param having Predicate over the grouped output, or null
     */
    public Query groupBy(List<? extends Expression> selections, List<ColumnReference> keys, Expression having) {
        return append(new GroupByClause(new GroupByExpression(List.copyOf(selections), keys, having)));
    }

    public Query orderBy(OrderExpression... ordering) {
        return append(new OrderByClause(List.of(ordering)));
    }

    public Query limit(int limit) {
        return append(new LimitClause(limit));
    }

    public Query offset(int offset) {
        return append(new OffsetClause(offset));
    }

    /**
     * Skips {@code offset} rows then keeps at most {@code limit}. Both values
     * are validated before either clause is appended.
     */
    public Query limit(int offset, int limit) {
        Pipeline next = pipeline.append(new OffsetClause(offset)).append(new LimitClause(limit));
        LOGGER.debug("Appended drop({}) and take({}) to {}", offset, limit, pipeline.from());
        pipeline = next;
        return this;
    }

    public Query distinct(String... columns) {
        return append(new DistinctClause(Expressions.cols(columns)));
    }

    public Query join(Table other, Expression condition) {
        return join(other, JoinClause.JoinType.INNER, condition);
    }

    public Query leftJoin(Table other, Expression condition) {
        return join(other, JoinClause.JoinType.LEFT_OUTER, condition);
    }

    public Query join(Table other, JoinClause.JoinType joinType, Expression condition) {
        return append(new JoinClause(other, joinType, new JoinExpression(condition)));
    }

    /**
     * Appends an already-built clause, with the same validation as the fluent
     * methods.
     */
    public Query append(Clause clause) {
        Objects.requireNonNull(clause, "Clause cannot be null");
        try {
            pipeline = pipeline.append(clause);
        } catch (QueryException e) {
            LOGGER.debug("Rejected {} on {}: {}", clause.getClass().getSimpleName(), pipeline.from(), e.getMessage());
            throw e;
        }
        LOGGER.debug("Appended {}; schema is now {}", clause.getClass().getSimpleName(),
                pipeline.currentSchema().columns());
        return this;
    }

    /**
     * @return The validated pipeline built so far
     */
    public Pipeline pipeline() {
        return pipeline;
    }

    /**
     * @return The schema after the last accepted clause
     */
    public Table schema() {
        return pipeline.currentSchema();
    }

    /**
     * Binds the current pipeline to a runtime. Later calls on this query do
     * not affect the returned binding.
     */
    public BoundQuery bind(QueryRuntime runtime) {
        return new BoundQuery(runtime, pipeline);
    }
}
