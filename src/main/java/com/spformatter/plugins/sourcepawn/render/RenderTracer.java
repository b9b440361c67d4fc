package com.spformatter.plugins.sourcepawn.render;

import java.util.logging.Level;
import java.util.logging.Logger;

import com.spformatter.syntax.Point;
import com.spformatter.syntax.SyntaxNode;

/**
 * Optional callback invoked after each node is rendered.
 */
@FunctionalInterface
public interface RenderTracer {
    RenderTracer NONE = (node, indent, output) -> { };

    void onRendered(SyntaxNode node, int indent, String output);

    /**
     * A tracer that writes one FINEST record per rendered node.
     */
    static RenderTracer logging(Logger logger) {
        return (node, indent, output) -> {
            if (!logger.isLoggable(Level.FINEST)) {
                return;
            }
            Point start = node.getStartPoint();
            String preview = output.length() > 60 ? output.substring(0, 60) + "..." : output;
            logger.finest(node.getKind() + " [" + (start.getRow() + 1) + ":" + (start.getColumn() + 1)
                    + "] indent=" + indent + " -> " + preview.replace("\n", "\\n"));
        };
    }
}
