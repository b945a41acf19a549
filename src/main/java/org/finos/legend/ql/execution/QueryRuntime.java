package org.finos.legend.ql.execution;

import org.finos.legend.ql.query.Pipeline;

import java.util.List;
import java.util.Map;

/**
 * A target a pipeline can be bound to.
 *
 * Every runtime can render a pipeline to its executable text. Running the
 * text against live data belongs to runtimes backed by an engine; the
 * default {@link #execute(Pipeline)} refuses.
 */
public interface QueryRuntime {

    /**
     * @return The text this runtime would execute for the pipeline
     */
    String executableToString(Pipeline pipeline);

    /**
     * Executes the pipeline and returns its rows, each a column-name to value
     * map in schema order.
     *
     * @throws UnsupportedOperationException if the runtime cannot execute
     */
    default List<Map<String, Object>> execute(Pipeline pipeline) {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not support execution");
    }
}
