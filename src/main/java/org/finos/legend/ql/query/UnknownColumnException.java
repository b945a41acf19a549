package org.finos.legend.ql.query;

import org.finos.legend.ql.store.Table;

/**
 * A clause references a column absent from the current schema snapshot.
 */
public class UnknownColumnException extends QueryException {

    public UnknownColumnException(String column, String clause, Table schema) {
        super(ErrorKind.UNKNOWN_COLUMN, column, clause,
                "Unknown column '" + column + "' in " + clause + "; available columns: " + schema.columnNames());
    }
}
