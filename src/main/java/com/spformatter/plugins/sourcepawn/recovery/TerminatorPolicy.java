package com.spformatter.plugins.sourcepawn.recovery;

import java.util.List;

import com.spformatter.plugins.sourcepawn.parser.Lexer;
import com.spformatter.plugins.sourcepawn.parser.Token;
import com.spformatter.plugins.sourcepawn.parser.TokenType;
import com.spformatter.syntax.NodeKind;
import com.spformatter.syntax.SyntaxNode;

/**
 * Drops a trailing {@code ;} the formatter added to input that was only an expression
 * and had none. Comments after the last code token are not looked at.
 */
public final class TerminatorPolicy {

    private TerminatorPolicy() {
    }

    /**
     * @param original the input as given
     * @param root     root of the input's own parse
     * @param formatted output of a formatting strategy
     */
    public static String apply(String original, SyntaxNode root, String formatted) {
        if (root == null || _isTerminator(_lastCodeToken(original))) {
            return formatted;
        }
        Token last = _lastCodeToken(formatted);
        if (!_isTerminator(last) || !isExpressionOnly(root)) {
            return formatted;
        }
        return formatted.substring(0, last.getStart()) + formatted.substring(last.getEnd()).stripTrailing();
    }

    private static Token _lastCodeToken(String text) {
        List<Token> tokens = new Lexer(text).tokenize();
        for (int i = tokens.size() - 1; i >= 0; i--) {
            Token token = tokens.get(i);
            if (!token.isEof() && token.getType() != TokenType.COMMENT) {
                return token;
            }
        }
        return null;
    }

    private static boolean _isTerminator(Token token) {
        return token != null && token.is(";");
    }

    /**
     * True when every top-level item is what the grammar makes of a bare expression: an error
     * token, a declaration-like run of names, or a call.
     */
    public static boolean isExpressionOnly(SyntaxNode root) {
        boolean any = false;
        for (SyntaxNode child : root.getChildren()) {
            if (child.is(NodeKind.COMMENT)) {
                continue;
            }
            if (!_isExpressionLike(child)) {
                return false;
            }
            any = true;
        }
        return any;
    }

    private static boolean _isExpressionLike(SyntaxNode node) {
        return switch (node.getNodeKind()) {
            case ERROR, GLOBAL_VARIABLE_DECLARATION, OLD_GLOBAL_VARIABLE_DECLARATION,
                    ASSIGNMENT_EXPRESSION, BINARY_EXPRESSION, CALL_EXPRESSION, ARRAY_INDEXED_ACCESS,
                    UPDATE_EXPRESSION, EXPRESSION_STATEMENT -> true;
            case FUNCTION_DECLARATION -> _isBareCall(node);
            case FUNCTION_DEFINITION -> MisclassificationRecovery.isCallShape(node);
            default -> false;
        };
    }

    private static boolean _isBareCall(SyntaxNode declaration) {
        if (declaration.findChild(NodeKind.TYPE).isPresent() || declaration.getChildCount() == 0) {
            return false;
        }
        SyntaxNode first = declaration.getChild(0);
        return first.is(NodeKind.IDENTIFIER);
    }
}
