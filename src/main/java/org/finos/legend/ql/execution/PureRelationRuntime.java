package org.finos.legend.ql.execution;

import org.finos.legend.ql.query.Pipeline;
import org.finos.legend.ql.transpiler.PureRelationGenerator;
import org.finos.legend.ql.transpiler.QueryRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runtime that renders pipelines as Pure relation text without executing
 * them.
 */
public final class PureRelationRuntime implements QueryRuntime {

    private static final Logger LOGGER = LoggerFactory.getLogger(PureRelationRuntime.class);

    private final QueryRenderer renderer;

    public PureRelationRuntime() {
        this(PureRelationGenerator.INSTANCE);
    }

    public PureRelationRuntime(QueryRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "Renderer cannot be null");
    }

    @Override
    public String executableToString(Pipeline pipeline) {
        String text = renderer.render(pipeline);
        LOGGER.debug("Rendered {} clause(s) from {} with {} backend", pipeline.size(), pipeline.from(),
                renderer.name());
        return text;
    }
}
