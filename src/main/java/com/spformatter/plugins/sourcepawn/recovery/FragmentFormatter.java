package com.spformatter.plugins.sourcepawn.recovery;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

import com.spformatter.plugins.sourcepawn.FormatOutcome;
import com.spformatter.plugins.sourcepawn.FormattingRequest;
import com.spformatter.plugins.sourcepawn.FormattingStrategy;
import com.spformatter.plugins.sourcepawn.parser.Lexer;
import com.spformatter.plugins.sourcepawn.parser.Token;
import com.spformatter.plugins.sourcepawn.parser.TokenType;
import com.spformatter.plugins.sourcepawn.render.Renderer;
import com.spformatter.syntax.NodeKind;
import com.spformatter.syntax.SourceParser;
import com.spformatter.syntax.SyntaxNode;
import com.spformatter.syntax.SyntaxTree;
import com.spformatter.util.LoggerUtil;

/**
 * Formats input that is not a complete file, such as a bare expression, by embedding it in
 * each {@link FragmentTemplate} in turn. The first wrapping that parses cleanly is rendered
 * and the fragment is cut back out of the tree by its character span.
 */
public class FragmentFormatter implements FormattingStrategy {
    private static final Logger logger = LoggerUtil.getLogger(FragmentFormatter.class);

    private static final Pattern CONTROL_START = Pattern.compile("^(if|for|while|switch)\\b");

    private final Renderer renderer;

    public FragmentFormatter(Renderer renderer) {
        this.renderer = renderer;
    }

    @Override
    public boolean accepts(FormattingRequest request) {
        return request.getParser() != null;
    }

    @Override
    public FormatOutcome.Strategy kind() {
        return FormatOutcome.Strategy.FRAGMENT;
    }

    @Override
    public Optional<String> apply(FormattingRequest request) {
        try {
            return formatFragment(request.getSource(), request.getParser());
        } catch (RuntimeException e) {
            logger.log(Level.FINE, "Fragment formatting failed", e);
            return Optional.empty();
        }
    }

    /**
     * Formats {@code source} as a fragment. A trailing {@code ;} in the input is kept, and
     * comments before or after the code are put back around the formatted text.
     */
    public Optional<String> formatFragment(String source, SourceParser parser) {
        String stripped = source.strip();
        List<Token> tokens = new Lexer(stripped).tokenize();
        int first = 0;
        int last = tokens.size() - 2;
        while (first <= last && tokens.get(first).getType() == TokenType.COMMENT) {
            first++;
        }
        while (last >= first && tokens.get(last).getType() == TokenType.COMMENT) {
            last--;
        }
        if (first > last) {
            return Optional.empty();
        }
        boolean terminated = tokens.get(last).is(";");
        int codeEnd = terminated ? tokens.get(last).getStart() : tokens.get(last).getEnd();
        String fragment = stripped.substring(tokens.get(first).getStart(), codeEnd).stripTrailing();
        if (fragment.isEmpty()) {
            return Optional.empty();
        }
        if (CONTROL_START.matcher(fragment).find()) {
            logger.fine("Control statement is not a fragment; skipping wrappers");
            return Optional.empty();
        }

        for (FragmentTemplate template : FragmentTemplate.values()) {
            Optional<String> formatted = _tryTemplate(template, fragment, parser);
            if (formatted.isPresent()) {
                logger.fine(() -> "Fragment formatted through " + template);
                String text = renderer.getNormalizer().normalize(formatted.get());
                return Optional.of(_withComments(stripped, tokens, first, last, terminated ? text + ";" : text));
            }
        }
        return Optional.empty();
    }

    /**
     * Puts the comments outside {@code tokens[first..last]} back around {@code code}. A comment
     * that was on its own line stays on its own line.
     */
    private static String _withComments(String source, List<Token> tokens, int first, int last, String code) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < first; i++) {
            Token comment = tokens.get(i);
            sb.append(comment.getText()).append(_separator(source, comment, tokens.get(i + 1)));
        }
        sb.append(code);
        for (int i = last + 1; i < tokens.size() - 1; i++) {
            Token comment = tokens.get(i);
            sb.append(_separator(source, tokens.get(i - 1), comment)).append(comment.getText());
        }
        return sb.toString();
    }

    private static String _separator(String source, Token before, Token after) {
        return source.substring(before.getEnd(), after.getStart()).indexOf('\n') >= 0 ? "\n" : " ";
    }

    private Optional<String> _tryTemplate(FragmentTemplate template, String fragment, SourceParser parser) {
        String wrapped = template.wrap(fragment);
        try (SyntaxTree tree = parser.parse(wrapped)) {
            if (tree == null || tree.hasError()) {
                return Optional.empty();
            }
            int start = template.fragmentOffset();
            int end = start + fragment.length();
            SyntaxNode root = tree.getRoot();
            return switch (template) {
                case VARIABLE_INITIALIZER -> _extractSpan(root, start, end);
                case FUNCTION_STATEMENT -> _extractStatements(root, start, end);
                case CALL_ARGUMENT -> {
                    Optional<String> single = _extractSpan(root, start, end);
                    yield single.isPresent() ? single : _extractArguments(root, start, end);
                }
            };
        } catch (RecoveryFailedException e) {
            logger.log(Level.FINE, "Template " + template + " rendered with errors", e);
            return Optional.empty();
        }
    }

    /**
     * The outermost named node spanning exactly the fragment, rendered inline.
     */
    private Optional<String> _extractSpan(SyntaxNode root, int start, int end) {
        SyntaxNode match = _findSpan(root, start, end);
        if (match == null) {
            return Optional.empty();
        }
        return Optional.of(renderer.render(match, 0));
    }

    private static SyntaxNode _findSpan(SyntaxNode node, int start, int end) {
        if (node.getStartOffset() > start || node.getEndOffset() < end) {
            return null;
        }
        if (node.isNamed() && !node.is(NodeKind.SOURCE_FILE)
                && node.getStartOffset() == start && node.getEndOffset() == end) {
            return node;
        }
        for (SyntaxNode child : node.getChildren()) {
            SyntaxNode found = _findSpan(child, start, end);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * Statements of the wrapper body that start inside the fragment, one per line, with the
     * wrapper's final terminator removed.
     */
    private Optional<String> _extractStatements(SyntaxNode root, int start, int end) {
        SyntaxNode body = _wrapperBody(root);
        if (body == null) {
            return Optional.empty();
        }
        List<SyntaxNode> statements = new ArrayList<>();
        for (SyntaxNode statement : Renderer.blockContents(body)) {
            if (statement.getStartOffset() >= start && statement.getStartOffset() < end) {
                statements.add(statement);
            }
        }
        if (statements.isEmpty()) {
            return Optional.empty();
        }
        String text = renderer.renderLines(statements, 0).stripTrailing();
        if (text.endsWith(";")) {
            text = text.substring(0, text.length() - 1);
        }
        return Optional.of(text);
    }

    /**
     * Arguments of the wrapper's call, without the parentheses.
     */
    private Optional<String> _extractArguments(SyntaxNode root, int start, int end) {
        SyntaxNode arguments = _findArguments(root, start, end);
        if (arguments == null) {
            return Optional.empty();
        }
        String rendered = renderer.renderArguments(arguments, 0);
        return Optional.of(rendered.substring(1, rendered.length() - 1));
    }

    private static SyntaxNode _findArguments(SyntaxNode node, int start, int end) {
        if (node.is(NodeKind.CALL_ARGUMENTS) && node.getChildCount() >= 2
                && node.getChild(0).getEndOffset() == start
                && node.getChild(node.getChildCount() - 1).getStartOffset() == end) {
            return node;
        }
        for (SyntaxNode child : node.getChildren()) {
            SyntaxNode found = _findArguments(child, start, end);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static SyntaxNode _wrapperBody(SyntaxNode root) {
        for (SyntaxNode child : root.getChildren()) {
            if (child.is(NodeKind.FUNCTION_DEFINITION)) {
                return child.findChild(NodeKind.BLOCK).orElse(null);
            }
        }
        return null;
    }
}
