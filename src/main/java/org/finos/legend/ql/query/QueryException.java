package org.finos.legend.ql.query;

import java.util.Objects;

/**
 * Base exception for query construction and rendering failures.
 *
 * Carries the error kind, the offending name or value, and the clause in
 * which the problem was detected.
 */
public class QueryException extends RuntimeException {

    private final ErrorKind kind;
    private final String subject;
    private final String clause;

    public QueryException(ErrorKind kind, String subject, String clause, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "Error kind cannot be null");
        this.subject = subject;
        this.clause = clause;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * @return The offending column, alias, value or node name
     */
    public String subject() {
        return subject;
    }

    /**
     * @return The clause (Pure operation name) being appended or rendered
     */
    public String clause() {
        return clause;
    }
}
