package org.finos.legend.ql.query;

/**
 * Classifies why a query could not be built or rendered.
 */
public enum ErrorKind {
    UNKNOWN_COLUMN,
    TYPE_ERROR,
    DUPLICATE_ALIAS,
    INVALID_AGGREGATE_REFERENCE,
    CONFIG_ERROR,
    BACKEND_UNSUPPORTED
}
