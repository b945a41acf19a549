package org.finos.legend.ql.execution;

import org.finos.legend.ql.query.Pipeline;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A pipeline bound to the runtime that will render or execute it.
 *
 * @param runtime  The target runtime
 * @param pipeline The validated pipeline
 */
public record BoundQuery(
        QueryRuntime runtime,
        Pipeline pipeline) {

    public BoundQuery {
        Objects.requireNonNull(runtime, "Runtime cannot be null");
        Objects.requireNonNull(pipeline, "Pipeline cannot be null");
    }

    public String executableToString() {
        return runtime.executableToString(pipeline);
    }

    /**
     * @throws UnsupportedOperationException if the runtime cannot execute
     */
    public List<Map<String, Object>> eval() {
        return runtime.execute(pipeline);
    }
}
