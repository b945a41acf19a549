package org.finos.legend.ql.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A named catalog of tables.
 *
 * @param name   The database name
 * @param tables The registered tables, each owned by this database
 */
public record Database(
        String name,
        List<Table> tables) {

    public Database {
        Objects.requireNonNull(name, "Database name cannot be null");
        Objects.requireNonNull(tables, "Tables cannot be null");
        for (Table table : tables) {
            if (!table.database().equals(name)) {
                throw new IllegalArgumentException(
                        "Table " + table.qualifiedName() + " does not belong to database " + name);
            }
        }
        tables = List.copyOf(tables);
    }

    /**
     * Registers several tables at once. Both map levels are iterated in order.
     *
     * @param name   The database name
     * @param tables Table name to (column name to type)
     */
    public static Database of(String name, Map<String, Map<String, ColumnType>> tables) {
        List<Table> list = new ArrayList<>(tables.size());
        tables.forEach((tableName, columns) -> list.add(Table.of(name, tableName, columns)));
        return new Database(name, list);
    }

    public Optional<Table> findTable(String tableName) {
        return tables.stream()
                .filter(t -> t.name().equals(tableName))
                .findFirst();
    }

    /**
     * @throws IllegalArgumentException if no table of that name is registered
     */
    public Table table(String tableName) {
        return findTable(tableName)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Table '" + tableName + "' not found in database " + name));
    }
}
