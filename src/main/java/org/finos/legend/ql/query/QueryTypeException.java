package org.finos.legend.ql.query;

/**
 * An operator or function was applied to operand types outside its
 * legality table.
 */
public class QueryTypeException extends QueryException {

    public QueryTypeException(String subject, String clause, String message) {
        super(ErrorKind.TYPE_ERROR, subject, clause, message);
    }
}
