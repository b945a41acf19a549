package org.finos.legend.ql.transpiler;

import org.finos.legend.ql.query.Pipeline;

/**
 * Turns a validated pipeline into backend text.
 *
 * Implementations must be read-only over the pipeline and must not
 * re-validate it; they may only fail with
 * {@link org.finos.legend.ql.query.BackendUnsupportedException}.
 */
public interface QueryRenderer {

    /**
     * @return The backend name (e.g., "Pure relation")
     */
    String name();

    /**
     * Renders a pipeline.
     *
     * @param pipeline The pipeline to render
     * @return The backend text
     */
    String render(Pipeline pipeline);
}
