package org.finos.legend.ql.store;

import java.util.Objects;

/**
 * Represents a column of a table schema.
 *
 * @param name The column name, unique within its table
 * @param type The semantic type of the column values
 */
public record Column(
        String name,
        ColumnType type
) {
    public Column {
        Objects.requireNonNull(name, "Column name cannot be null");
        Objects.requireNonNull(type, "Column type cannot be null");

        if (name.isBlank()) {
            throw new IllegalArgumentException("Column name cannot be blank");
        }
    }

    /**
     * Factory for a column.
     */
    public static Column of(String name, ColumnType type) {
        return new Column(name, type);
    }

    /**
     * @return A copy of this column under a new name
     */
    public Column renamed(String newName) {
        return new Column(newName, type);
    }

    @Override
    public String toString() {
        return name + ":" + type;
    }
}
