package org.finos.legend.ql.plan;

import org.finos.legend.ql.store.Table;

import java.util.Objects;

/**
 * The source table of a pipeline, or the right side of a join.
 *
 * @param database The database name
 * @param table    The table name
 */
public record FromClause(
        String database,
        String table) implements Clause {

    public FromClause {
        Objects.requireNonNull(database, "Database cannot be null");
        Objects.requireNonNull(table, "Table cannot be null");
    }

    public static FromClause of(Table table) {
        return new FromClause(table.database(), table.name());
    }

    @Override
    public <T> T accept(ClauseVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return database + "." + table;
    }
}
