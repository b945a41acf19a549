package org.finos.legend.ql.query;

/**
 * A scalar argument is out of its domain (negative limit or offset, empty
 * column list, misplaced from clause).
 */
public class QueryConfigException extends QueryException {

    public QueryConfigException(String subject, String clause, String message) {
        super(ErrorKind.CONFIG_ERROR, subject, clause, message);
    }
}
