package org.finos.legend.ql.query;

/**
 * A new or renamed column collides with an existing column name.
 */
public class DuplicateAliasException extends QueryException {

    public DuplicateAliasException(String alias, String clause) {
        super(ErrorKind.DUPLICATE_ALIAS, alias, clause,
                "Column '" + alias + "' already exists in " + clause);
    }

    public DuplicateAliasException(String alias, String clause, String message) {
        super(ErrorKind.DUPLICATE_ALIAS, alias, clause, message);
    }
}
