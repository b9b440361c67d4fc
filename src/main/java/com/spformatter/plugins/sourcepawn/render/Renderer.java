package com.spformatter.plugins.sourcepawn.render;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.spformatter.config.FormattingOptions;
import com.spformatter.plugins.sourcepawn.recovery.MisclassificationRecovery;
import com.spformatter.plugins.sourcepawn.recovery.RecoveryFailedException;
import com.spformatter.plugins.sourcepawn.spacing.OperatorSpacingNormalizer;
import com.spformatter.syntax.NodeKind;
import com.spformatter.syntax.SyntaxNode;

/**
 * Converts a SourcePawn syntax tree into formatted text.
 *
 * <p>Rendering dispatches on {@link NodeKind}. Statement kinds return their lines already
 * indented to the requested level; expression kinds return inline text and only use the
 * level for multi-line array literals. Kinds without a rule fall back to joining their
 * children through {@link TokenJoiner}.
 *
 * <p>Error nodes, missing named nodes and missing brackets raise {@link RecoveryFailedException},
 * except for the shapes {@link MisclassificationRecovery} knows how to rebuild. Comments kept
 * inside an expression or declarator are printed next to the operand they sit beside.
 */
public class Renderer {
    private static final Set<String> CLOSERS = Set.of("{", "}", "(", ")", "[", "]");

    private final FormattingOptions options;
    private final OperatorSpacingNormalizer normalizer;
    private final TokenJoiner joiner;
    private final RenderTracer tracer;
    private final MisclassificationRecovery recovery;

    public Renderer(FormattingOptions options) {
        this(options, RenderTracer.NONE);
    }

    public Renderer(FormattingOptions options, RenderTracer tracer) {
        this.options = options;
        this.tracer = tracer;
        this.normalizer = new OperatorSpacingNormalizer(options.isSpaceAroundOperators());
        this.joiner = new TokenJoiner(options, normalizer);
        this.recovery = new MisclassificationRecovery(this);
    }

    /**
     * Renders a whole file: re-sectioned top level, operator spacing post-pass, lines joined with "\n".
     */
    public String renderDocument(SyntaxNode root) {
        String laidOut = new SourceFileLayout(this).render(root);
        return SourceFileLayout.capBlankLines(normalizer.normalize(laidOut), options.getMaxConsecutiveEmptyLines());
    }

    public String render(SyntaxNode node, int indent) {
        if (!node.is(NodeKind.SOURCE_FILE)) {
            for (SyntaxNode child : node.getChildren()) {
                if (child.isError()) {
                    throw recovery.syntaxError(child);
                }
                _requirePresent(child);
            }
        }
        String output = _dispatch(node, indent);
        tracer.onRendered(node, indent, output);
        return output;
    }

    private String _dispatch(SyntaxNode node, int indent) {
        if (node.isError()) {
            throw recovery.syntaxError(node);
        }
        if (node.isMissing()) {
            return _renderMissing(node);
        }
        return switch (node.getNodeKind()) {
            case SOURCE_FILE -> new SourceFileLayout(this).render(node);
            case COMMENT -> indent(indent) + node.getText();
            case PREPROC_INCLUDE, PREPROC_TRYINCLUDE, PREPROC_DEFINE, PREPROC_UNDEFINE, PREPROC_PRAGMA,
                    PREPROC_IF, PREPROC_ELSEIF, PREPROC_ELSE, PREPROC_ENDIF, PREPROC_DIRECTIVE ->
                    _renderPreprocessor(node);
            case ENUM_STRUCT, METHODMAP, TYPEDEF, TYPESET, FUNCTAG, FUNCENUM, STRUCT -> indent(indent) + node.getText();

            case FUNCTION_DEFINITION -> _renderFunctionDefinition(node, indent);
            case FUNCTION_DECLARATION -> _renderFunctionDeclaration(node, indent);
            case PARAMETER_DECLARATIONS -> _renderParameters(node, indent);
            case PARAMETER_DECLARATION, VARIABLE_DECLARATION, OLD_VARIABLE_DECLARATION, ENUM_ENTRY ->
                    _renderDeclarator(node, indent);
            case REST_PARAMETER -> _joinWords(_renderChildren(node, indent));
            case TYPE -> _renderConcatenated(node);
            case DIMENSION -> "[]";
            case FIXED_DIMENSION -> _renderFixedDimension(node, indent);
            case GLOBAL_VARIABLE_DECLARATION, OLD_GLOBAL_VARIABLE_DECLARATION,
                    VARIABLE_DECLARATION_STATEMENT, OLD_VARIABLE_DECLARATION_STATEMENT ->
                    indent(indent) + renderDeclaration(node, indent, true);
            case ENUM -> _renderEnum(node, indent);

            case BLOCK -> indent(indent) + renderBlock(node, indent);
            case EXPRESSION_STATEMENT -> _renderExpressionStatement(node, indent);
            case CONDITION_STATEMENT -> _renderCondition(node, indent);
            case FOR_STATEMENT -> _renderFor(node, indent);
            case WHILE_STATEMENT -> _renderWhile(node, indent);
            case DO_WHILE_STATEMENT -> _renderDoWhile(node, indent);
            case SWITCH_STATEMENT -> _renderSwitch(node, indent);
            case SWITCH_CASE -> _renderSwitchCase(node, indent);
            case RETURN_STATEMENT -> _renderKeywordStatement(node, indent, "return");
            case BREAK_STATEMENT -> indent(indent) + "break" + terminator(node);
            case CONTINUE_STATEMENT -> indent(indent) + "continue" + terminator(node);
            case DELETE_STATEMENT -> _renderKeywordStatement(node, indent, "delete");

            case ASSIGNMENT_EXPRESSION, BINARY_EXPRESSION -> _renderBinary(node, indent);
            case UNARY_EXPRESSION -> _renderUnary(node, indent);
            case UPDATE_EXPRESSION -> _renderConcatenated(node, indent);
            case TERNARY_EXPRESSION -> _renderTernary(node, indent);
            case CALL_EXPRESSION -> _renderConcatenated(node, indent);
            case CALL_ARGUMENTS -> renderArguments(node, indent);
            case ARRAY_INDEXED_ACCESS -> _renderIndexedAccess(node, indent);
            case FIELD_ACCESS, SCOPE_ACCESS -> _renderConcatenated(node, indent);
            case PARENTHESIZED_EXPRESSION -> _renderParenthesized(node, indent);
            case COMMA_EXPRESSION -> _renderComma(node, indent);
            case VIEW_AS -> _renderViewAs(node, indent);
            case SIZEOF_EXPRESSION -> _renderSizeof(node, indent);
            case NEW_EXPRESSION -> _renderNew(node, indent);
            case ARRAY_LITERAL -> _renderArrayLiteral(node, indent);

            case IDENTIFIER, NUMBER_LITERAL, STRING_LITERAL, CHAR_LITERAL, BOOL_LITERAL, NULL, THIS,
                    BUILTIN_TYPE, VISIBILITY, PREPROC_ARG -> node.getText();
            case TOKEN -> node.getKind();
            default -> _renderGeneric(node, indent);
        };
    }

    // ---------------------------------------------------------------- shared helpers

    public FormattingOptions getOptions() {
        return options;
    }

    public OperatorSpacingNormalizer getNormalizer() {
        return normalizer;
    }

    public TokenJoiner getJoiner() {
        return joiner;
    }

    MisclassificationRecovery getRecovery() {
        return recovery;
    }

    public String indent(int level) {
        return options.indent(level);
    }

    /**
     * Blank lines to keep for a gap of {@code sourceGap} empty source lines.
     */
    public int blankLinesFor(int sourceGap) {
        if (!options.isPreserveEmptyLines() || sourceGap <= 0) {
            return 0;
        }
        return Math.min(sourceGap, options.getMaxConsecutiveEmptyLines());
    }

    /**
     * The statement terminator to emit for a node, following the semicolon options.
     */
    public String terminator(SyntaxNode node) {
        if (options.isRequireSemicolons()) {
            return ";";
        }
        if (options.isRemoveOptionalSemicolons()) {
            return "";
        }
        return hasRealTerminator(node) ? ";" : "";
    }

    public static boolean hasRealTerminator(SyntaxNode node) {
        for (SyntaxNode child : node.getChildren()) {
            if (child.isToken(";") && !child.isMissing()) {
                return true;
            }
        }
        return false;
    }

    /**
     * {@code keyword(inner)} at the given level, honoring the space-before-paren option.
     */
    public String controlHeader(String keyword, String inner, int indent) {
        return indent(indent) + keyword + (options.isSpaceBeforeOpenParen() ? " " : "") + "(" + inner + ")";
    }

    /**
     * Body of a control construct, placed after its header. A single statement is wrapped in braces.
     */
    public String renderControlBody(SyntaxNode body, int indent) {
        if (body.isToken(";")) {
            return ";";
        }
        if (body.is(NodeKind.BLOCK)) {
            return attachBlock(renderBlock(body, indent), indent);
        }
        String inner = render(body, indent + 1);
        return attachBlock("{\n" + inner + "\n" + indent(indent) + "}", indent);
    }

    /**
     * Places an opening brace on its own line or at the end of the header line.
     */
    public String attachBlock(String block, int indent) {
        if (options.isNewLineAfterOpenBrace()) {
            return "\n" + indent(indent) + block;
        }
        return " " + block;
    }

    /**
     * Text after the keyword joining a construct to its continuation, e.g. {@code } else}.
     */
    public String continuationSeparator(int indent) {
        return options.isNewLineAfterOpenBrace() ? "\n" + indent(indent) : " ";
    }

    /**
     * {@code {...}} with contents one level deeper and the closing brace at {@code indent}.
     */
    public String renderBlock(SyntaxNode block, int indent) {
        List<SyntaxNode> inner = blockContents(block);
        if (inner.isEmpty()) {
            return "{\n" + indent(indent) + "}";
        }
        return "{\n" + renderLines(inner, indent + 1) + "\n" + indent(indent) + "}";
    }

    /**
     * Children of a braced node without its braces.
     */
    public static List<SyntaxNode> blockContents(SyntaxNode block) {
        List<SyntaxNode> inner = new ArrayList<>(block.getChildren());
        if (!inner.isEmpty() && inner.get(0).isToken("{")) {
            _requirePresent(inner.remove(0));
        }
        if (!inner.isEmpty() && inner.get(inner.size() - 1).isToken("}")) {
            _requirePresent(inner.remove(inner.size() - 1));
        }
        return inner;
    }

    /**
     * A bracket the parser had to invent cannot be printed: it would change the program.
     */
    private static void _requirePresent(SyntaxNode node) {
        if (node.isMissing() && !node.isNamed() && CLOSERS.contains(node.getKind())) {
            throw new RecoveryFailedException("Missing '" + node.getKind() + "'", node);
        }
    }

    /**
     * Renders statements one per line. Source blank lines are kept up to the configured maximum,
     * and a comment on the same row as the preceding statement stays at the end of its line.
     */
    public String renderLines(List<SyntaxNode> nodes, int indent) {
        List<String> lines = new ArrayList<>();
        SyntaxNode previous = null;
        for (SyntaxNode node : nodes) {
            if (previous != null && node.is(NodeKind.COMMENT) && _trails(previous, node) && !lines.isEmpty()) {
                int last = lines.size() - 1;
                lines.set(last, lines.get(last) + " " + node.getText());
                previous = node;
                continue;
            }
            if (previous != null) {
                int gap = node.getStartPoint().getRow() - previous.getEndPoint().getRow() - 1;
                for (int i = 0; i < blankLinesFor(gap); i++) {
                    lines.add("");
                }
            }
            String text = render(node, indent);
            if (_needsInjectedTerminator(node, text)) {
                text = text + ";";
            }
            lines.add(text);
            previous = node;
        }
        return String.join("\n", lines);
    }

    private static boolean _trails(SyntaxNode previous, SyntaxNode comment) {
        return comment.getStartPoint().getRow() == previous.getEndPoint().getRow()
                && comment.getStartOffset() >= previous.getEndOffset();
    }

    /**
     * A bare call, assignment or update left without a terminator gets one when semicolons are required.
     */
    private boolean _needsInjectedTerminator(SyntaxNode node, String text) {
        if (!options.isRequireSemicolons() || !node.is(NodeKind.EXPRESSION_STATEMENT)) {
            return false;
        }
        String trimmed = text.stripTrailing();
        if (trimmed.endsWith(";") || trimmed.endsWith("}")) {
            return false;
        }
        return trimmed.endsWith(")") || trimmed.endsWith("++") || trimmed.endsWith("--") || trimmed.contains("=");
    }

    // ---------------------------------------------------------------- preprocessor

    private String _renderPreprocessor(SyntaxNode node) {
        String directive = node.getChild(0).getKind();
        Optional<SyntaxNode> argument = node.findChild(NodeKind.PREPROC_ARG);
        return argument.map(arg -> directive + " " + arg.getText().strip()).orElse(directive);
    }

    // ---------------------------------------------------------------- functions

    private String _renderFunctionDefinition(SyntaxNode node, int indent) {
        Optional<String> misclassified = recovery.renderMisclassified(node, indent);
        if (misclassified.isPresent()) {
            return misclassified.get();
        }
        Optional<SyntaxNode> body = node.findChild(NodeKind.BLOCK);
        if (body.isEmpty()) {
            throw new RecoveryFailedException("Function definition without a body", node);
        }
        String signature = _renderSignature(node, indent);
        String compact = _tryCompact(node, signature, body.get(), indent);
        if (compact != null) {
            return compact;
        }
        return indent(indent) + signature + attachBlock(renderBlock(body.get(), indent), indent);
    }

    /**
     * Single-line rendering for a function that was written on one line and still fits.
     */
    private String _tryCompact(SyntaxNode function, String signature, SyntaxNode body, int indent) {
        if (function.isMultiLine() || function.getText().length() > options.getMaxLineLength()) {
            return null;
        }
        List<String> statements = new ArrayList<>();
        for (SyntaxNode statement : blockContents(body)) {
            statements.add(render(statement, 0));
        }
        String content = statements.isEmpty() ? "{}" : "{ " + String.join(" ", statements) + " }";
        String compact = indent(indent) + signature + " " + content;
        if (compact.contains("\n") || compact.length() > options.getMaxLineLength() || compact.contains("//")) {
            return null;
        }
        return compact;
    }

    private String _renderFunctionDeclaration(SyntaxNode node, int indent) {
        Optional<String> misclassified = recovery.renderMisclassified(node, indent);
        if (misclassified.isPresent()) {
            return misclassified.get();
        }
        boolean typed = node.findChild(NodeKind.TYPE).isPresent();
        boolean external = node.getChildCount() > 0 && (node.getChild(0).isToken("native")
                || node.getChild(0).isToken("forward"));
        if (!typed && !external && !hasRealTerminator(node)) {
            // a call written at file scope, e.g. "foo(x)"; not a prototype
            throw new RecoveryFailedException("Prototype without return type or terminator", node);
        }
        return indent(indent) + _renderSignature(node, indent) + terminator(node);
    }

    /**
     * Modifiers, return type, name and parameter list.
     */
    private String _renderSignature(SyntaxNode node, int indent) {
        List<String> words = new ArrayList<>();
        String parameters = "";
        for (SyntaxNode child : node.getChildren()) {
            if (child.is(NodeKind.PARAMETER_DECLARATIONS)) {
                parameters = render(child, indent);
                break;
            }
            if (child.is(NodeKind.COMMENT) || child.isToken(";")) {
                continue;
            }
            words.add(render(child, indent));
        }
        return _joinWords(words) + parameters;
    }

    private String _renderParameters(SyntaxNode node, int indent) {
        return _renderParenthesizedList(node, indent);
    }

    // ---------------------------------------------------------------- declarations

    /**
     * Variable declaration without indentation. The terminator is left off for {@code for} headers.
     */
    public String renderDeclaration(SyntaxNode node, int indent, boolean withTerminator) {
        List<String> words = new ArrayList<>();
        List<String> declarators = new ArrayList<>();
        for (SyntaxNode child : node.getChildren()) {
            if (child.is(NodeKind.VARIABLE_DECLARATION) || child.is(NodeKind.OLD_VARIABLE_DECLARATION)) {
                declarators.add(render(child, indent));
            } else if (child.isToken(",") || child.isToken(";") || child.is(NodeKind.COMMENT)) {
                continue;
            } else {
                words.add(render(child, indent));
            }
        }
        String prefix = _joinWords(words);
        if (!prefix.isEmpty() && !prefix.endsWith(":")) {
            prefix = prefix + " ";
        }
        return prefix + String.join(_comma(), declarators) + (withTerminator ? terminator(node) : "");
    }

    /**
     * {@code [tag] name[dims] [= value]} for variables, parameters and enum entries.
     */
    private String _renderDeclarator(SyntaxNode node, int indent) {
        InlineComments comments = new InlineComments(node, indent);
        StringBuilder sb = new StringBuilder();
        for (SyntaxNode child : node.getChildren()) {
            if (child.is(NodeKind.COMMENT)) {
                continue;
            }
            if (child.isToken("=")) {
                sb.append(_assign());
            } else if (child.isToken("const")) {
                sb.append("const ");
            } else if (child.isToken("&")) {
                sb.append('&');
            } else if (child.is(NodeKind.TYPE)) {
                String type = comments.wrap(child, render(child, indent));
                sb.append(type);
                if (!type.endsWith(":")) {
                    sb.append(' ');
                }
            } else {
                sb.append(comments.wrap(child, render(child, indent)));
            }
        }
        return sb.toString();
    }

    private String _renderFixedDimension(SyntaxNode node, int indent) {
        SyntaxNode size = _firstNamed(node);
        return size == null ? "[]" : "[" + _bracketPad(render(size, indent)) + "]";
    }

    private String _renderEnum(SyntaxNode node, int indent) {
        List<String> words = new ArrayList<>();
        SyntaxNode entries = null;
        for (SyntaxNode child : node.getChildren()) {
            if (child.is(NodeKind.ENUM_ENTRIES)) {
                entries = child;
            } else if (!child.isToken(";") && !child.is(NodeKind.COMMENT)) {
                words.add(render(child, indent));
            }
        }
        String header = indent(indent) + _joinWords(words);
        if (entries == null) {
            return header + terminator(node);
        }
        String trailer = hasRealTerminator(node) ? ";" : "";
        return header + attachBlock(_renderEnumEntries(entries, indent), indent) + trailer;
    }

    private String _renderEnumEntries(SyntaxNode entries, int indent) {
        List<SyntaxNode> inner = blockContents(entries);
        if (inner.isEmpty()) {
            return "{\n" + indent(indent) + "}";
        }
        List<String> lines = new ArrayList<>();
        SyntaxNode previous = null;
        for (int i = 0; i < inner.size(); i++) {
            SyntaxNode child = inner.get(i);
            if (child.isToken(",")) {
                continue;
            }
            if (child.is(NodeKind.COMMENT) && previous != null && !lines.isEmpty()
                    && child.getStartPoint().getRow() == previous.getEndPoint().getRow()) {
                int last = lines.size() - 1;
                lines.set(last, lines.get(last) + " " + child.getText());
                previous = child;
                continue;
            }
            if (previous != null) {
                int gap = child.getStartPoint().getRow() - previous.getEndPoint().getRow() - 1;
                for (int b = 0; b < blankLinesFor(gap); b++) {
                    lines.add("");
                }
            }
            String line;
            if (child.is(NodeKind.COMMENT)) {
                line = render(child, indent + 1);
            } else {
                line = indent(indent + 1) + render(child, indent + 1);
                if (_nextNonComment(inner, i + 1).filter(n -> n.isToken(",")).isPresent()) {
                    line = line + ",";
                }
            }
            lines.add(line);
            previous = child;
        }
        return "{\n" + String.join("\n", lines) + "\n" + indent(indent) + "}";
    }

    // ---------------------------------------------------------------- statements

    private String _renderExpressionStatement(SyntaxNode node, int indent) {
        SyntaxNode expression = _firstNamed(node);
        if (expression == null) {
            return indent(indent) + terminator(node);
        }
        return indent(indent) + render(expression, indent) + terminator(node);
    }

    private String _renderKeywordStatement(SyntaxNode node, int indent, String keyword) {
        SyntaxNode value = _firstNamed(node);
        String text = value == null ? keyword : keyword + " " + render(value, indent);
        return indent(indent) + text + terminator(node);
    }

    private String _renderCondition(SyntaxNode node, int indent) {
        SyntaxNode condition = null;
        SyntaxNode consequence = null;
        SyntaxNode alternative = null;
        boolean sawElse = false;
        for (SyntaxNode child : node.getChildren()) {
            if (child.isToken("if") || child.isToken("(") || child.isToken(")")) {
                continue;
            }
            if (child.isToken("else")) {
                sawElse = true;
            } else if (condition == null) {
                condition = child;
            } else if (!sawElse) {
                consequence = child;
            } else {
                alternative = child;
            }
        }
        if (condition == null || consequence == null) {
            throw new RecoveryFailedException("Incomplete if statement", node);
        }
        StringBuilder sb = new StringBuilder();
        sb.append(controlHeader("if", render(condition, indent), indent));
        sb.append(renderControlBody(consequence, indent));
        if (alternative != null) {
            sb.append(continuationSeparator(indent)).append("else");
            if (alternative.is(NodeKind.CONDITION_STATEMENT)) {
                sb.append(' ').append(render(alternative, indent).stripLeading());
            } else {
                sb.append(renderControlBody(alternative, indent));
            }
        }
        return sb.toString();
    }

    private String _renderFor(SyntaxNode node, int indent) {
        List<SyntaxNode> header = new ArrayList<>();
        SyntaxNode body = null;
        boolean inHeader = false;
        for (SyntaxNode child : node.getChildren()) {
            if (child.isToken("for")) {
                continue;
            }
            if (child.isToken("(") && !inHeader && body == null && header.isEmpty()) {
                inHeader = true;
            } else if (child.isToken(")") && inHeader) {
                inHeader = false;
            } else if (inHeader) {
                header.add(child);
            } else {
                body = child;
            }
        }
        if (body == null) {
            throw new RecoveryFailedException("for statement without a body", node);
        }
        return controlHeader("for", renderForHeader(header, indent), indent) + renderControlBody(body, indent);
    }

    /**
     * {@code init; condition; update} from header nodes separated by {@code ;} tokens.
     */
    public String renderForHeader(List<SyntaxNode> header, int indent) {
        String[] parts = {"", "", ""};
        int slot = 0;
        for (SyntaxNode child : header) {
            if (child.isToken(";")) {
                slot++;
            } else if (slot < parts.length && !child.is(NodeKind.COMMENT)) {
                boolean declaration = child.is(NodeKind.VARIABLE_DECLARATION_STATEMENT)
                        || child.is(NodeKind.OLD_VARIABLE_DECLARATION_STATEMENT);
                parts[slot] = declaration ? renderDeclaration(child, indent, false) : render(child, indent);
            }
        }
        String gap = options.isSpaceAfterSemicolon() ? " " : "";
        return parts[0] + ";" + (parts[1].isEmpty() ? "" : gap + parts[1])
                + ";" + (parts[2].isEmpty() ? "" : gap + parts[2]);
    }

    private String _renderWhile(SyntaxNode node, int indent) {
        List<SyntaxNode> parts = _significantChildren(node, "while");
        if (parts.size() < 2) {
            throw new RecoveryFailedException("Incomplete while statement", node);
        }
        return controlHeader("while", render(parts.get(0), indent), indent) + renderControlBody(parts.get(1), indent);
    }

    private String _renderDoWhile(SyntaxNode node, int indent) {
        List<SyntaxNode> parts = _significantChildren(node, "do", "while");
        if (parts.size() < 2) {
            throw new RecoveryFailedException("Incomplete do-while statement", node);
        }
        String tail = controlHeader("while", render(parts.get(1), indent), 0) + terminator(node);
        return indent(indent) + "do" + renderControlBody(parts.get(0), indent)
                + continuationSeparator(indent) + tail;
    }

    private String _renderSwitch(SyntaxNode node, int indent) {
        SyntaxNode condition = null;
        List<SyntaxNode> cases = new ArrayList<>();
        boolean inBody = false;
        for (SyntaxNode child : node.getChildren()) {
            if (child.isToken("{")) {
                inBody = true;
            } else if (inBody && !child.isToken("}")) {
                cases.add(child);
            } else if (!inBody && condition == null && child.isNamed()) {
                condition = child;
            }
        }
        if (condition == null) {
            throw new RecoveryFailedException("switch without a condition", node);
        }
        return controlHeader("switch", render(condition, indent), indent)
                + attachBlock(_renderSwitchBody(cases, indent), indent);
    }

    /**
     * A switch body given as a block of cases, placed after its header.
     */
    public String renderSwitchBlock(SyntaxNode block, int indent) {
        return attachBlock(_renderSwitchBody(blockContents(block), indent), indent);
    }

    private String _renderSwitchBody(List<SyntaxNode> cases, int indent) {
        if (cases.isEmpty()) {
            return "{\n" + indent(indent) + "}";
        }
        return "{\n" + renderLines(cases, indent + 1) + "\n" + indent(indent) + "}";
    }

    private String _renderSwitchCase(SyntaxNode node, int indent) {
        List<String> values = new ArrayList<>();
        List<SyntaxNode> statements = new ArrayList<>();
        boolean isDefault = false;
        boolean inBody = false;
        for (SyntaxNode child : node.getChildren()) {
            if (inBody) {
                statements.add(child);
            } else if (child.isToken("default")) {
                isDefault = true;
            } else if (child.isToken(":")) {
                inBody = true;
            } else if (child.isNamed()) {
                values.add(render(child, indent));
            }
        }
        String label = indent(indent) + (isDefault ? "default:" : "case " + String.join(_comma(), values) + ":");
        if (statements.isEmpty()) {
            return label;
        }
        if (statements.size() == 1 && statements.get(0).is(NodeKind.BLOCK)) {
            return label + attachBlock(renderBlock(statements.get(0), indent), indent);
        }
        return label + "\n" + renderLines(statements, indent + 1);
    }

    // ---------------------------------------------------------------- expressions

    private String _renderBinary(SyntaxNode node, int indent) {
        List<SyntaxNode> parts = _code(node);
        if (parts.size() < 3) {
            throw new RecoveryFailedException("Incomplete " + node.getKind(), node);
        }
        InlineComments comments = new InlineComments(node, indent);
        String left = comments.wrap(parts.get(0), render(parts.get(0), indent));
        String op = parts.get(1).getKind();
        String right = comments.wrap(parts.get(2), render(parts.get(2), indent));
        if (options.isSpaceAroundOperators()) {
            return left + " " + op + " " + right;
        }
        String before = _clashes(left, op) ? " " : "";
        String after = _clashes(op, right) ? " " : "";
        return left + before + op + after + right;
    }

    private String _renderUnary(SyntaxNode node, int indent) {
        List<SyntaxNode> parts = _code(node);
        if (parts.size() < 2) {
            throw new RecoveryFailedException("Incomplete unary expression", node);
        }
        InlineComments comments = new InlineComments(node, indent);
        String op = parts.get(0).getKind();
        String operand = comments.wrap(parts.get(1), render(parts.get(1), indent));
        // keeps "- -x" from reading as a decrement
        return _clashes(op, operand) ? op + " " + operand : op + operand;
    }

    /**
     * True when gluing the two pieces would create {@code ++} or {@code --}.
     */
    private static boolean _clashes(String first, String second) {
        if (first.isEmpty() || second.isEmpty()) {
            return false;
        }
        char last = first.charAt(first.length() - 1);
        return (last == '-' || last == '+') && second.charAt(0) == last;
    }

    private String _renderTernary(SyntaxNode node, int indent) {
        List<SyntaxNode> operands = _operands(node);
        if (operands.size() < 3) {
            throw new RecoveryFailedException("Incomplete ternary expression", node);
        }
        InlineComments comments = new InlineComments(node, indent);
        return comments.render(operands.get(0)) + " ? " + comments.render(operands.get(1))
                + " : " + comments.render(operands.get(2));
    }

    public String renderArguments(SyntaxNode node, int indent) {
        return _renderParenthesizedList(node, indent);
    }

    /**
     * {@code (a, b, c)} for argument and parameter lists.
     */
    private String _renderParenthesizedList(SyntaxNode node, int indent) {
        InlineComments comments = new InlineComments(node, indent);
        List<String> items = new ArrayList<>();
        for (SyntaxNode operand : _operands(node)) {
            items.add(comments.render(operand));
        }
        return "(" + String.join(_comma(), items) + comments.unattached() + ")";
    }

    private String _renderParenthesized(SyntaxNode node, int indent) {
        SyntaxNode inner = _firstNamed(node);
        if (inner == null) {
            throw new RecoveryFailedException("Empty parentheses", node);
        }
        return "(" + new InlineComments(node, indent).render(inner) + ")";
    }

    private String _renderComma(SyntaxNode node, int indent) {
        List<SyntaxNode> operands = _operands(node);
        if (operands.size() < 2) {
            throw new RecoveryFailedException("Incomplete comma expression", node);
        }
        InlineComments comments = new InlineComments(node, indent);
        return comments.render(operands.get(0)) + _comma() + comments.render(operands.get(1));
    }

    private String _renderIndexedAccess(SyntaxNode node, int indent) {
        List<SyntaxNode> operands = _operands(node);
        if (operands.size() < 2) {
            throw new RecoveryFailedException("Incomplete array access", node);
        }
        InlineComments comments = new InlineComments(node, indent);
        return comments.render(operands.get(0)) + "[" + _bracketPad(comments.render(operands.get(1))) + "]";
    }

    private String _renderViewAs(SyntaxNode node, int indent) {
        List<SyntaxNode> operands = _operands(node);
        if (operands.size() < 2) {
            throw new RecoveryFailedException("Incomplete view_as", node);
        }
        InlineComments comments = new InlineComments(node, indent);
        return "view_as<" + comments.render(operands.get(0)) + ">(" + comments.render(operands.get(1)) + ")";
    }

    private String _renderSizeof(SyntaxNode node, int indent) {
        List<SyntaxNode> parts = _code(node);
        if (parts.size() < 2) {
            throw new RecoveryFailedException("sizeof without an operand", node);
        }
        SyntaxNode operand = parts.get(1);
        String text = new InlineComments(node, indent).render(operand);
        return operand.is(NodeKind.PARENTHESIZED_EXPRESSION) && text.startsWith("(")
                ? "sizeof" + text : "sizeof " + text;
    }

    private String _renderNew(SyntaxNode node, int indent) {
        InlineComments comments = new InlineComments(node, indent);
        StringBuilder sb = new StringBuilder("new ");
        for (SyntaxNode child : _code(node)) {
            if (!child.isToken("new")) {
                sb.append(comments.render(child));
            }
        }
        return sb.toString();
    }

    private String _renderArrayLiteral(SyntaxNode node, int indent) {
        List<SyntaxNode> entries = _operands(node);
        if (entries.isEmpty()) {
            return "{" + new InlineComments(node, indent).unattached() + "}";
        }
        if (!node.isMultiLine()) {
            InlineComments comments = new InlineComments(node, indent);
            List<String> rendered = new ArrayList<>();
            for (SyntaxNode entry : entries) {
                rendered.add(comments.render(entry));
            }
            return "{" + String.join(_comma(), rendered) + "}";
        }
        List<SyntaxNode> code = _code(node);
        boolean trailingComma = code.size() >= 2 && code.get(code.size() - 2).isToken(",");
        StringBuilder sb = new StringBuilder("{");
        SyntaxNode previous = null;
        int written = 0;
        for (SyntaxNode child : node.getChildren()) {
            if (child.is(NodeKind.COMMENT)) {
                // a comment on the row of the previous entry stays on its line
                if (previous != null && child.getStartPoint().getRow() == previous.getEndPoint().getRow()) {
                    sb.append(' ');
                } else {
                    sb.append('\n').append(indent(indent + 1));
                }
                sb.append(child.getText());
                previous = child;
            } else if (child.isNamed()) {
                written++;
                sb.append('\n').append(indent(indent + 1)).append(render(child, indent + 1));
                if (written < entries.size() || trailingComma) {
                    sb.append(',');
                }
                previous = child;
            }
        }
        return sb.append('\n').append(indent(indent)).append('}').toString();
    }

    /**
     * Children glued together with no separator, e.g. {@code Float:}, {@code a.b}, {@code f(x)}.
     */
    private String _renderConcatenated(SyntaxNode node, int indent) {
        InlineComments comments = new InlineComments(node, indent);
        StringBuilder sb = new StringBuilder();
        for (SyntaxNode child : _code(node)) {
            sb.append(comments.render(child));
        }
        String loose = comments.unattached();
        return loose.isEmpty() ? sb.toString() : sb + " " + loose.strip();
    }

    private String _renderConcatenated(SyntaxNode node) {
        return _renderConcatenated(node, 0);
    }

    private String _renderGeneric(SyntaxNode node, int indent) {
        return joiner.join(_renderChildren(node, indent));
    }

    private List<String> _renderChildren(SyntaxNode node, int indent) {
        List<String> pieces = new ArrayList<>();
        for (SyntaxNode child : node.getChildren()) {
            pieces.add(render(child, indent));
        }
        return pieces;
    }

    private String _renderMissing(SyntaxNode node) {
        if (node.isNamed()) {
            throw new RecoveryFailedException("Missing " + node.getKind(), node);
        }
        _requirePresent(node);
        return node.getKind();
    }

    // ---------------------------------------------------------------- small utilities

    private String _comma() {
        return options.isSpaceAfterComma() ? ", " : ",";
    }

    private String _assign() {
        return options.isSpaceAroundOperators() ? " = " : "=";
    }

    private String _bracketPad(String inner) {
        return options.isSpaceInArrayBrackets() && !inner.isEmpty() ? " " + inner + " " : inner;
    }

    /**
     * Words separated by spaces; an old-style tag such as {@code Float:} stays glued to what follows.
     */
    private static String _joinWords(List<String> words) {
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            if (sb.length() > 0 && sb.charAt(sb.length() - 1) != ':' && sb.charAt(sb.length() - 1) != '&') {
                sb.append(' ');
            }
            sb.append(word);
        }
        return sb.toString();
    }

    /**
     * Children other than comments.
     */
    private static List<SyntaxNode> _code(SyntaxNode node) {
        List<SyntaxNode> code = new ArrayList<>();
        for (SyntaxNode child : node.getChildren()) {
            if (!child.is(NodeKind.COMMENT)) {
                code.add(child);
            }
        }
        return code;
    }

    /**
     * Named children other than comments.
     */
    private static List<SyntaxNode> _operands(SyntaxNode node) {
        List<SyntaxNode> operands = new ArrayList<>();
        for (SyntaxNode child : node.getChildren()) {
            if (child.isNamed() && !child.is(NodeKind.COMMENT)) {
                operands.add(child);
            }
        }
        return operands;
    }

    private static boolean _isLineComment(SyntaxNode comment) {
        return comment.getText().startsWith("//");
    }

    private static SyntaxNode _firstNamed(SyntaxNode node) {
        for (SyntaxNode child : node.getChildren()) {
            if (child.isNamed() && !child.is(NodeKind.COMMENT)) {
                return child;
            }
        }
        return null;
    }

    /**
     * Named children, skipping keyword tokens, parentheses and terminators.
     */
    private static List<SyntaxNode> _significantChildren(SyntaxNode node, String... keywords) {
        List<SyntaxNode> result = new ArrayList<>();
        outer:
        for (SyntaxNode child : node.getChildren()) {
            for (String keyword : keywords) {
                if (child.isToken(keyword)) {
                    continue outer;
                }
            }
            if (child.isToken("(") || child.isToken(")") || child.is(NodeKind.COMMENT)) {
                continue;
            }
            if (child.isToken(";") && result.size() >= 2) {
                continue;
            }
            result.add(child);
        }
        return result;
    }

    private static Optional<SyntaxNode> _nextNonComment(List<SyntaxNode> nodes, int from) {
        for (int i = from; i < nodes.size(); i++) {
            if (!nodes.get(i).is(NodeKind.COMMENT)) {
                return Optional.of(nodes.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * Comments found between the operands of one node. A comment directly after an operand
     * trails it; otherwise it leads the next operand. A line comment prefers the next operand,
     * so the code that follows it is moved onto a new line. Comments in a node without
     * operands, such as an empty argument list, are unattached.
     */
    private final class InlineComments {
        private final Map<SyntaxNode, List<SyntaxNode>> leading = new IdentityHashMap<>();
        private final Map<SyntaxNode, List<SyntaxNode>> trailing = new IdentityHashMap<>();
        private final List<SyntaxNode> loose = new ArrayList<>();
        private final int indent;

        InlineComments(SyntaxNode node, int indent) {
            this.indent = indent;
            List<SyntaxNode> children = node.getChildren();
            for (int i = 0; i < children.size(); i++) {
                SyntaxNode comment = children.get(i);
                if (!comment.is(NodeKind.COMMENT)) {
                    continue;
                }
                SyntaxNode previous = _neighbour(children, i, -1, false);
                SyntaxNode next = _neighbour(children, i, 1, true);
                if (previous != null && previous.isNamed() && (next == null || !_isLineComment(comment))) {
                    trailing.computeIfAbsent(previous, k -> new ArrayList<>()).add(comment);
                } else if (next != null) {
                    leading.computeIfAbsent(next, k -> new ArrayList<>()).add(comment);
                } else {
                    SyntaxNode last = _neighbour(children, i, -1, true);
                    if (last != null) {
                        trailing.computeIfAbsent(last, k -> new ArrayList<>()).add(comment);
                    } else {
                        loose.add(comment);
                    }
                }
            }
        }

        /**
         * The nearest non-comment child in {@code step} direction; with {@code named} set, the nearest operand.
         */
        private SyntaxNode _neighbour(List<SyntaxNode> children, int from, int step, boolean named) {
            for (int i = from + step; i >= 0 && i < children.size(); i += step) {
                SyntaxNode child = children.get(i);
                if (child.is(NodeKind.COMMENT)) {
                    continue;
                }
                if (!named || child.isNamed()) {
                    return child;
                }
            }
            return null;
        }

        String render(SyntaxNode operand) {
            return wrap(operand, Renderer.this.render(operand, indent));
        }

        String wrap(SyntaxNode operand, String text) {
            if (leading.isEmpty() && trailing.isEmpty()) {
                return text;
            }
            StringBuilder sb = new StringBuilder();
            for (SyntaxNode comment : leading.getOrDefault(operand, List.of())) {
                sb.append(comment.getText()).append(_isLineComment(comment) ? _continuation() : " ");
            }
            sb.append(text);
            for (SyntaxNode comment : trailing.getOrDefault(operand, List.of())) {
                sb.append(' ').append(comment.getText());
                if (_isLineComment(comment)) {
                    sb.append(_continuation());
                }
            }
            return sb.toString();
        }

        String unattached() {
            StringBuilder sb = new StringBuilder();
            for (SyntaxNode comment : loose) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(comment.getText());
                if (_isLineComment(comment)) {
                    sb.append(_continuation());
                }
            }
            return sb.toString();
        }

        private String _continuation() {
            return "\n" + indent(indent + 1);
        }
    }
}
