package com.spformatter.plugins.sourcepawn.diagnostics;

import java.util.ArrayList;
import java.util.List;

import com.spformatter.api.error.SyntaxError;
import com.spformatter.syntax.NodeKind;
import com.spformatter.syntax.Point;
import com.spformatter.syntax.SyntaxNode;
import com.spformatter.syntax.SyntaxTree;

/**
 * Collects the error and missing nodes of a tree as {@link SyntaxError} records, in document order.
 */
public class DiagnosticsCollector {
    private static final int CONTEXT_LINES = 1;
    private static final String MARKER = ">>> ";
    private static final String NO_MARKER = "    ";

    public List<SyntaxError> collectErrors(SyntaxTree tree, String source) {
        List<SyntaxError> errors = new ArrayList<>();
        if (tree == null) {
            return errors;
        }
        String[] lines = source.split("\n", -1);
        _collect(tree.getRoot(), lines, errors);
        return errors;
    }

    private static void _collect(SyntaxNode node, String[] lines, List<SyntaxError> errors) {
        if (node.isError()) {
            errors.add(_record(node, _errorMessage(node), lines));
        } else if (node.isMissing()) {
            errors.add(_record(node, "Missing syntax element: expected '" + node.getKind() + "'", lines));
        }
        // an error node's own children are reported only when they are themselves malformed
        for (SyntaxNode child : node.getChildren()) {
            if (child.hasError()) {
                _collect(child, lines, errors);
            }
        }
    }

    private static String _errorMessage(SyntaxNode node) {
        String text = _abbreviate(node.getText());
        if (node.getChildCount() == 1 && node.getChild(0).is(NodeKind.STRING_LITERAL)) {
            return "Unterminated string literal " + text;
        }
        if (node.getChildCount() == 1 && node.getChild(0).is(NodeKind.CHAR_LITERAL)) {
            return "Unterminated character literal " + text;
        }
        return "Syntax error at '" + text + "'";
    }

    private static SyntaxError _record(SyntaxNode node, String message, String[] lines) {
        Point start = node.getStartPoint();
        Point end = node.isMissing() ? start : node.getEndPoint();
        int endByte = node.isMissing() ? node.getStartByte() : node.getEndByte();
        return SyntaxError.builder()
                .message(message)
                .nodeKind(node.getKind())
                .start(start.getRow() + 1, start.getColumn() + 1)
                .end(end.getRow() + 1, end.getColumn() + 1)
                .byteRange(node.getStartByte(), endByte)
                .missing(node.isMissing())
                .context(buildContext(lines, start.getRow(), end.getRow()))
                .build();
    }

    /**
     * Numbered source lines around the error, the first offending line marked.
     */
    static String buildContext(String[] lines, int startRow, int endRow) {
        int from = Math.max(0, startRow - CONTEXT_LINES);
        int to = Math.min(lines.length - 1, endRow + CONTEXT_LINES);
        StringBuilder sb = new StringBuilder();
        for (int i = from; i <= to; i++) {
            sb.append(String.format("%03d| ", i + 1))
                    .append(i == startRow ? MARKER : NO_MARKER)
                    .append(lines[i])
                    .append('\n');
        }
        return sb.toString();
    }

    private static String _abbreviate(String text) {
        String stripped = text.strip();
        String firstLine = stripped.lines().findFirst().orElse("");
        if (firstLine.length() > 40) {
            return firstLine.substring(0, 40) + "...";
        }
        return firstLine.length() < stripped.length() ? firstLine + "..." : firstLine;
    }
}
