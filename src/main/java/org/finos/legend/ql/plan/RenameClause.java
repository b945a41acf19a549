package org.finos.legend.ql.plan;

import java.util.List;
import java.util.Objects;

/**
 * Renames columns in place.
 *
 * Pure: ->rename([id as employee_id, name as employee_name])
 *
 * @param renames Each entry aliases a {@link ColumnReference} to its new name
 */
public record RenameClause(List<AliasExpression> renames) implements Clause {

    public RenameClause {
        Objects.requireNonNull(renames, "Renames cannot be null");
        for (AliasExpression rename : renames) {
            if (!(rename.expression() instanceof ColumnReference)) {
                throw new IllegalArgumentException("Rename source must be a column reference: " + rename);
            }
        }
        renames = List.copyOf(renames);
    }

    @Override
    public <T> T accept(ClauseVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
