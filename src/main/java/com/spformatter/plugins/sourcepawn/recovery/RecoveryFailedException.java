package com.spformatter.plugins.sourcepawn.recovery;

import com.spformatter.syntax.SyntaxNode;

/**
 * A malformed subtree could not be rebuilt. Always handled inside the strategy chain.
 */
public class RecoveryFailedException extends RuntimeException {

    public RecoveryFailedException(String message) {
        super(message);
    }

    public RecoveryFailedException(String message, SyntaxNode node) {
        super(message + " (" + node.getKind() + " at " + _position(node) + ")");
    }

    private static String _position(SyntaxNode node) {
        return (node.getStartPoint().getRow() + 1) + ":" + (node.getStartPoint().getColumn() + 1);
    }
}
