package com.spformatter.plugins.sourcepawn;

import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.spformatter.plugins.sourcepawn.recovery.RecoveryFailedException;
import com.spformatter.plugins.sourcepawn.render.Renderer;
import com.spformatter.util.LoggerUtil;

/**
 * Renders a malformed tree, rebuilding the misclassified shapes the renderer knows about.
 * Gives up on the first error node it cannot account for.
 */
public class RecoveryStrategy implements FormattingStrategy {
    private static final Logger logger = LoggerUtil.getLogger(RecoveryStrategy.class);

    private final Renderer renderer;

    public RecoveryStrategy(Renderer renderer) {
        this.renderer = renderer;
    }

    @Override
    public boolean accepts(FormattingRequest request) {
        return request.getTree() != null && request.getTree().hasError();
    }

    @Override
    public Optional<String> apply(FormattingRequest request) {
        try {
            String text = renderer.renderDocument(request.getTree().getRoot());
            return text.isBlank() ? Optional.empty() : Optional.of(text);
        } catch (RecoveryFailedException e) {
            logger.fine(() -> "Recovery gave up: " + e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            logger.log(Level.FINE, "Recovery failed unexpectedly", e);
            return Optional.empty();
        }
    }

    @Override
    public FormatOutcome.Strategy kind() {
        return FormatOutcome.Strategy.RECOVERY;
    }
}
