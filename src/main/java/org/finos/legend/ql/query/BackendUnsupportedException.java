package org.finos.legend.ql.query;

/**
 * A renderer met a clause or expression kind it has no mapping for.
 * This is the only error raised while rendering.
 */
public class BackendUnsupportedException extends QueryException {

    public BackendUnsupportedException(String nodeKind, String backend) {
        super(ErrorKind.BACKEND_UNSUPPORTED, nodeKind, null,
                "Unsupported node for " + backend + " backend: " + nodeKind);
    }
}
