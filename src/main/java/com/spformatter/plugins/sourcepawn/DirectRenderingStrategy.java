package com.spformatter.plugins.sourcepawn;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.spformatter.plugins.sourcepawn.render.Renderer;
import com.spformatter.util.LoggerUtil;

/**
 * Renders an error-free tree.
 */
public class DirectRenderingStrategy implements FormattingStrategy {
    private static final Logger logger = LoggerUtil.getLogger(DirectRenderingStrategy.class);

    private final Renderer renderer;

    public DirectRenderingStrategy(Renderer renderer) {
        this.renderer = renderer;
    }

    @Override
    public boolean accepts(FormattingRequest request) {
        return request.getTree() != null && !request.getTree().hasError();
    }

    @Override
    public Optional<String> apply(FormattingRequest request) {
        try {
            return Optional.of(renderer.renderDocument(request.getTree().getRoot()));
        } catch (RuntimeException e) {
            logger.log(Level.FINE, "Direct rendering failed", e);
            return Optional.empty();
        }
    }

    @Override
    public FormatOutcome.Strategy kind() {
        return FormatOutcome.Strategy.DIRECT;
    }
}
