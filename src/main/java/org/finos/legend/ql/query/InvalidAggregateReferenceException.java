package org.finos.legend.ql.query;

/**
 * A groupBy selection or having predicate references a column that is
 * neither a grouping key nor an aggregate.
 */
public class InvalidAggregateReferenceException extends QueryException {

    public InvalidAggregateReferenceException(String column, String clause, String message) {
        super(ErrorKind.INVALID_AGGREGATE_REFERENCE, column, clause, message);
    }
}
