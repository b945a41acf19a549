package org.finos.legend.ql.plan;

import java.util.Objects;

/**
 * Represents a reference to a column by name.
 *
 * The name is resolved against the schema snapshot current at the point the
 * owning clause is appended.
 *
 * @param name The column name
 */
public record ColumnReference(String name) implements Expression {

    public ColumnReference {
        Objects.requireNonNull(name, "Column name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be blank");
        }
    }

    public static ColumnReference of(String name) {
        return new ColumnReference(name);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitColumnReference(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
