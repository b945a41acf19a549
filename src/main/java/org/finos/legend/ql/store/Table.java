package org.finos.legend.ql.store;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Represents a table schema: a database-qualified name and an ordered list
 * of columns.
 *
 * Tables are immutable. Every clause of a query produces a new Table value
 * (a schema snapshot) rather than changing an existing one.
 *
 * @param database The owning database name
 * @param name The table name
 * @param columns Immutable, ordered list of columns
 */
public record Table(
        String database,
        String name,
        List<Column> columns
) {
    public Table {
        Objects.requireNonNull(database, "Database cannot be null");
        Objects.requireNonNull(name, "Table name cannot be null");
        Objects.requireNonNull(columns, "Columns cannot be null");

        if (database.isBlank()) {
            throw new IllegalArgumentException("Database name cannot be blank");
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("Table name cannot be blank");
        }

        Set<String> seen = new HashSet<>();
        for (Column column : columns) {
            if (!seen.add(column.name())) {
                throw new IllegalArgumentException(
                        "Duplicate column '" + column.name() + "' in table " + database + "." + name);
            }
        }

        // Ensure immutability
        columns = List.copyOf(columns);
    }

    /**
     * Registers a table from an ordered mapping of column name to type.
     * Iteration order of the map is the column order.
     */
    public static Table of(String database, String name, Map<String, ColumnType> columns) {
        List<Column> list = new ArrayList<>(columns.size());
        columns.forEach((columnName, type) -> list.add(new Column(columnName, type)));
        return new Table(database, name, list);
    }

    /**
     * @return The qualified table name as rendered by the Pure relation backend
     */
    public String qualifiedName() {
        return database + "." + name;
    }

    /**
     * Finds a column by name.
     *
     * @param columnName The column name to search for
     * @return Optional containing the column if found
     */
    public Optional<Column> findColumn(String columnName) {
        return columns.stream()
                .filter(c -> c.name().equals(columnName))
                .findFirst();
    }

    /**
     * @param columnName The column name to look up
     * @return The column
     * @throws IllegalArgumentException if column not found
     */
    public Column getColumn(String columnName) {
        return findColumn(columnName)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Column '" + columnName + "' not found in table " + qualifiedName()));
    }

    public boolean hasColumn(String columnName) {
        return findColumn(columnName).isPresent();
    }

    /**
     * @return Column names in schema order
     */
    public List<String> columnNames() {
        return columns.stream().map(Column::name).toList();
    }

    /**
     * Derives a snapshot with the same identity and a different column list.
     */
    public Table withColumns(List<Column> newColumns) {
        return new Table(database, name, newColumns);
    }

    @Override
    public String toString() {
        return qualifiedName() + columns;
    }
}
