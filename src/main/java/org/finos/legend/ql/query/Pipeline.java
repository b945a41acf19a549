package org.finos.legend.ql.query;

import org.finos.legend.ql.plan.Clause;
import org.finos.legend.ql.plan.FromClause;
import org.finos.legend.ql.store.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An immutable, validated sequence of clauses plus the schema snapshot that
 * holds after each of them.
 *
 * Invariants:
 * - clauses[0] is the only {@link FromClause}
 * - schemas[0] is the source table
 * - schemas[i] is clauses[i] applied to schemas[i-1]
 *
 * {@link #append(Clause)} is the only way to grow a pipeline. It validates
 * the clause and returns a new pipeline; on failure it throws and the
 * receiver is unchanged, so a failed append needs no rollback.
 */
public final class Pipeline {

    private final List<Clause> clauses;
    private final List<Table> schemas;

    private Pipeline(List<Clause> clauses, List<Table> schemas) {
        this.clauses = List.copyOf(clauses);
        this.schemas = List.copyOf(schemas);
    }

    /**
     * Starts a pipeline reading from a table.
     */
    public static Pipeline from(Table table) {
        Objects.requireNonNull(table, "Table cannot be null");
        return new Pipeline(List.of(FromClause.of(table)), List.of(table));
    }

    /**
     * Validates a clause against the current schema and returns a pipeline
     * with the clause appended.
     *
     * @throws QueryException if the clause is invalid for the current schema
     */
    public Pipeline append(Clause clause) {
        Objects.requireNonNull(clause, "Clause cannot be null");
        Table next = new ClauseResolver(currentSchema()).resolve(clause);

        List<Clause> newClauses = new ArrayList<>(clauses.size() + 1);
        newClauses.addAll(clauses);
        newClauses.add(clause);
        List<Table> newSchemas = new ArrayList<>(schemas.size() + 1);
        newSchemas.addAll(schemas);
        newSchemas.add(next);
        return new Pipeline(newClauses, newSchemas);
    }

    /**
     * @return Unmodifiable list of clauses, from clause first
     */
    public List<Clause> clauses() {
        return clauses;
    }

    /**
     * @return Unmodifiable list of schema snapshots, one per clause
     */
    public List<Table> schemas() {
        return schemas;
    }

    public FromClause from() {
        return (FromClause) clauses.get(0);
    }

    /**
     * @return The schema of the source table
     */
    public Table sourceSchema() {
        return schemas.get(0);
    }

    /**
     * @return The schema after the last clause
     */
    public Table currentSchema() {
        return schemas.get(schemas.size() - 1);
    }

    public int size() {
        return clauses.size();
    }

    @Override
    public String toString() {
        return "Pipeline" + clauses;
    }
}
