package com.spformatter.plugins.sourcepawn.recovery;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import com.spformatter.plugins.sourcepawn.parser.Lexer;
import com.spformatter.plugins.sourcepawn.parser.Token;
import com.spformatter.plugins.sourcepawn.parser.TokenType;
import com.spformatter.plugins.sourcepawn.render.Renderer;
import com.spformatter.syntax.NodeKind;
import com.spformatter.syntax.SyntaxNode;
import com.spformatter.util.LoggerUtil;

/**
 * Rebuilds statements the grammar could only place at file scope as something else.
 *
 * <p>A control statement written outside a function surfaces as a function definition named
 * after its keyword, its header wrapped in an error node. A call such as
 * {@code Foo(Bar(x), 1);} surfaces as a definition with a truncated parameter list followed by
 * loose tokens, and a call with literal arguments such as {@code Foo(1, 2);} as a prototype
 * whose parameter list holds error nodes. A prefix operator in front of a name, as in
 * {@code ++i;}, surfaces as an error token followed by a global declaration. Each shape is recognised structurally and re-emitted
 * as the statement it was meant to be. Any other error node fails the render.
 */
public class MisclassificationRecovery {
    private static final Logger logger = LoggerUtil.getLogger(MisclassificationRecovery.class);

    private static final Set<String> CONTROL_KEYWORDS = Set.of("if", "else", "for", "while", "switch", "do");
    private static final Set<String> PREFIX_TOKENS = Set.of("++", "--", "!", "(");

    private final Renderer renderer;

    public MisclassificationRecovery(Renderer renderer) {
        this.renderer = renderer;
    }

    /**
     * True for a function definition or prototype that is really a control statement or a call.
     */
    public boolean isMisclassified(SyntaxNode node) {
        return _controlKeyword(node).isPresent() || isCallShape(node) || isDeclaredCallShape(node);
    }

    /**
     * True when {@code node} continues the statement rendered for {@code previous}: an
     * {@code else} after an {@code if}, or the {@code while(...);} tail of a {@code do}.
     */
    public boolean isContinuation(SyntaxNode node, SyntaxNode previous) {
        if (previous == null) {
            return false;
        }
        Optional<String> keyword = _controlKeyword(node);
        Optional<String> previousKeyword = _controlKeyword(previous);
        if (keyword.isEmpty() || previousKeyword.isEmpty()) {
            return false;
        }
        if (keyword.get().equals("else")) {
            return previousKeyword.get().equals("if")
                    || (previousKeyword.get().equals("else") && _isElseIf(previous));
        }
        return keyword.get().equals("while") && _hasEmptyBody(node) && previousKeyword.get().equals("do");
    }

    /**
     * Renders a misclassified definition, or returns empty for a genuine function.
     *
     * @throws RecoveryFailedException when the shape matches but cannot be rebuilt
     */
    public Optional<String> renderMisclassified(SyntaxNode node, int indent) {
        Optional<String> keyword = _controlKeyword(node);
        if (keyword.isPresent()) {
            logger.fine(() -> "Rebuilding '" + keyword.get() + "' statement at " + node.getStartPoint());
            return Optional.of(_renderControl(node, keyword.get(), indent));
        }
        if (isCallShape(node)) {
            logger.fine(() -> "Rebuilding call at " + node.getStartPoint());
            return Optional.of(_renderCall(node, indent));
        }
        if (isDeclaredCallShape(node)) {
            logger.fine(() -> "Rebuilding call with literal arguments at " + node.getStartPoint());
            SyntaxNode params = node.getChild(1);
            return Optional.of(_joinCall(node, params.getEndOffset(), node, indent));
        }
        return Optional.empty();
    }

    /**
     * Merges a lone prefix token with the declaration that follows it, e.g. {@code ++} and
     * {@code i;} into {@code ++i;}.
     */
    public Optional<String> tryPrefixPattern(SyntaxNode error, SyntaxNode next, int indent) {
        if (!error.isError() || error.getChildCount() != 1 || !PREFIX_TOKENS.contains(error.getChild(0).getKind())) {
            return Optional.empty();
        }
        if (!next.is(NodeKind.GLOBAL_VARIABLE_DECLARATION) && !next.is(NodeKind.OLD_GLOBAL_VARIABLE_DECLARATION)) {
            return Optional.empty();
        }
        if (!_onlyMissingTerminator(next)) {
            return Optional.empty();
        }
        List<SyntaxNode> content = _withoutTerminator(next);
        if (content.isEmpty()) {
            return Optional.empty();
        }
        String source = error.getText() + " " + _slice(content);
        List<String> pieces = _retokenize(source);
        if (pieces == null) {
            return Optional.empty();
        }
        String joined = renderer.getJoiner().join(pieces);
        return Optional.of(renderer.indent(indent) + joined + renderer.terminator(next));
    }

    /**
     * The failure for an error node outside the recognised shapes.
     */
    public RecoveryFailedException syntaxError(SyntaxNode node) {
        String text = node.getText().strip();
        return new RecoveryFailedException("Syntax error at '" + _abbreviate(text) + "'", node);
    }

    // ---------------------------------------------------------------- control statements

    private String _renderControl(SyntaxNode node, String keyword, int indent) {
        SyntaxNode header = node.findChild(NodeKind.PARAMETER_DECLARATIONS).orElse(null);
        SyntaxNode body = _body(node);
        boolean elseIf = _isElseIf(node);

        if (body == null) {
            throw new RecoveryFailedException("'" + keyword + "' without a body", node);
        }
        if (keyword.equals("do") || keyword.equals("else") && !elseIf) {
            return renderer.indent(indent) + keyword + renderer.renderControlBody(body, indent);
        }

        List<SyntaxNode> inner = _headerContents(header, node, keyword);
        String effective = elseIf ? "if" : keyword;
        String condition;
        if (effective.equals("for")) {
            condition = renderer.renderForHeader(inner, indent);
        } else {
            if (inner.size() != 1) {
                throw new RecoveryFailedException("Malformed '" + effective + "' condition", node);
            }
            condition = renderer.render(inner.get(0), indent);
        }

        String prefix = elseIf ? renderer.indent(indent) + "else " + renderer.controlHeader("if", condition, 0)
                : renderer.controlHeader(effective, condition, indent);
        if (effective.equals("switch")) {
            if (!body.is(NodeKind.BLOCK)) {
                throw new RecoveryFailedException("switch without a case block", node);
            }
            return prefix + renderer.renderSwitchBlock(body, indent);
        }
        if (body.isToken(";") && !effective.equals("while")) {
            throw new RecoveryFailedException("'" + effective + "' with an empty body", node);
        }
        return prefix + renderer.renderControlBody(body, indent);
    }

    private static List<SyntaxNode> _headerContents(SyntaxNode header, SyntaxNode node, String keyword) {
        if (header == null || header.getChildCount() < 2) {
            throw new RecoveryFailedException("'" + keyword + "' without a condition", node);
        }
        SyntaxNode close = header.getChild(header.getChildCount() - 1);
        if (!close.isToken(")") || close.isMissing()) {
            throw new RecoveryFailedException("Unclosed '" + keyword + "' condition", node);
        }
        SyntaxNode wrapped = header.getChild(1);
        if (!wrapped.isError() || wrapped.getChildCount() == 0) {
            throw new RecoveryFailedException("Empty '" + keyword + "' condition", node);
        }
        return wrapped.getChildren();
    }

    /**
     * The keyword a misclassified control statement was named after.
     */
    private static Optional<String> _controlKeyword(SyntaxNode node) {
        if (!node.is(NodeKind.FUNCTION_DEFINITION) || node.getChildCount() == 0) {
            return Optional.empty();
        }
        SyntaxNode first = node.getChild(0);
        if (!first.is(NodeKind.IDENTIFIER) || !CONTROL_KEYWORDS.contains(first.getText())) {
            return Optional.empty();
        }
        return Optional.of(first.getText());
    }

    private static boolean _isElseIf(SyntaxNode node) {
        return node.getChildCount() > 1 && node.getChild(1).is(NodeKind.IDENTIFIER)
                && node.getChild(1).getText().equals("if");
    }

    private static SyntaxNode _body(SyntaxNode node) {
        SyntaxNode last = node.getChild(node.getChildCount() - 1);
        if (last.is(NodeKind.IDENTIFIER) || last.is(NodeKind.PARAMETER_DECLARATIONS)) {
            return null;
        }
        return last;
    }

    private static boolean _hasEmptyBody(SyntaxNode node) {
        SyntaxNode body = _body(node);
        return body != null && body.isToken(";");
    }

    // ---------------------------------------------------------------- calls

    /**
     * A definition whose parameter list was cut short and followed by loose tokens.
     */
    static boolean isCallShape(SyntaxNode node) {
        if (!node.is(NodeKind.FUNCTION_DEFINITION) || node.getChildCount() != 3) {
            return false;
        }
        SyntaxNode params = node.getChild(1);
        SyntaxNode statement = node.getChild(2);
        if (!node.getChild(0).is(NodeKind.IDENTIFIER) || !params.is(NodeKind.PARAMETER_DECLARATIONS)
                || !statement.is(NodeKind.EXPRESSION_STATEMENT)) {
            return false;
        }
        return params.getChildCount() > 0 && params.getChild(params.getChildCount() - 1).isMissing();
    }

    /**
     * A prototype without a return type at file scope whose parameter list holds error nodes:
     * what the grammar makes of a call with literal arguments.
     */
    static boolean isDeclaredCallShape(SyntaxNode node) {
        if (!node.is(NodeKind.FUNCTION_DECLARATION) || node.getChildCount() < 2
                || !node.getChild(0).is(NodeKind.IDENTIFIER)) {
            return false;
        }
        SyntaxNode params = node.getChild(1);
        if (!params.is(NodeKind.PARAMETER_DECLARATIONS)) {
            return false;
        }
        for (SyntaxNode child : params.getChildren()) {
            if (child.isError()) {
                return true;
            }
        }
        return false;
    }

    private String _renderCall(SyntaxNode node, int indent) {
        SyntaxNode params = node.getChild(1);
        SyntaxNode statement = node.getChild(2);
        List<SyntaxNode> content = _withoutTerminator(statement);
        int end = content.isEmpty() ? params.getEndOffset() : content.get(content.size() - 1).getEndOffset();
        return _joinCall(node, end, statement, indent);
    }

    /**
     * Re-lexes the call from the opening parenthesis up to {@code end} and joins it again.
     */
    private String _joinCall(SyntaxNode node, int end, SyntaxNode terminated, int indent) {
        SyntaxNode name = node.getChild(0);
        SyntaxNode params = node.getChild(1);
        String source = node.getText().substring(params.getStartOffset() - node.getStartOffset(),
                end - node.getStartOffset());

        List<String> pieces = _retokenize(source);
        if (pieces == null) {
            throw new RecoveryFailedException("Call contains tokens that cannot be rejoined", node);
        }
        if (!_balanced(pieces)) {
            throw new RecoveryFailedException("Unbalanced parentheses in call", node);
        }
        pieces.add(0, name.getText());
        return renderer.indent(indent) + renderer.getJoiner().join(pieces) + renderer.terminator(terminated);
    }

    private static boolean _balanced(List<String> pieces) {
        int depth = 0;
        for (String piece : pieces) {
            if (piece.equals("(") || piece.equals("[")) {
                depth++;
            } else if (piece.equals(")") || piece.equals("]")) {
                depth--;
                if (depth < 0) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    // ---------------------------------------------------------------- helpers

    /**
     * Token texts of {@code source}, or {@code null} when it holds comments or unknown characters.
     */
    private static List<String> _retokenize(String source) {
        List<String> pieces = new ArrayList<>();
        for (Token token : new Lexer(source).tokenize()) {
            if (token.isEof()) {
                break;
            }
            if (token.getType() == TokenType.COMMENT || token.getType() == TokenType.UNKNOWN
                    || token.getType() == TokenType.PREPROCESSOR) {
                return null;
            }
            pieces.add(token.getText());
        }
        return pieces;
    }

    private static boolean _onlyMissingTerminator(SyntaxNode declaration) {
        for (SyntaxNode child : declaration.getChildren()) {
            if (child.isToken(";")) {
                continue;
            }
            if (child.hasError()) {
                return false;
            }
        }
        return true;
    }

    private static List<SyntaxNode> _withoutTerminator(SyntaxNode node) {
        List<SyntaxNode> content = new ArrayList<>();
        for (SyntaxNode child : node.getChildren()) {
            if (!child.isToken(";") && !child.is(NodeKind.COMMENT)) {
                content.add(child);
            }
        }
        return content;
    }

    private static String _slice(List<SyntaxNode> nodes) {
        StringBuilder sb = new StringBuilder();
        for (SyntaxNode node : nodes) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(node.getText());
        }
        return sb.toString();
    }

    private static String _abbreviate(String text) {
        String firstLine = text.lines().findFirst().orElse("");
        return firstLine.length() > 40 ? firstLine.substring(0, 40) + "..." : firstLine;
    }
}
