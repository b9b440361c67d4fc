package com.spformatter.plugins.sourcepawn.parser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.spformatter.syntax.ParseFailureException;
import com.spformatter.syntax.SourceText;
import com.spformatter.syntax.SyntaxNode;

/**
 * Recursive-descent rendition of the SourcePawn grammar. Node kinds follow the
 * grammar's production names, and error recovery reproduces the grammar's
 * characteristic shapes: control keywords at file scope become function
 * definitions, and unparseable tokens become {@code ERROR} nodes.
 *
 * <p>Comments skipped inside an expression or declarator are kept as children of that node at
 * their source position. Elsewhere they become siblings of the statement they interrupt.
 *
 * <p>One instance parses one token stream.
 */
class SourcePawnGrammar {
    static final Set<String> CONTROL_KEYWORDS = Set.of("if", "else", "for", "while", "switch", "do");
    static final Set<String> BUILTIN_TYPES = Set.of("int", "float", "bool", "char", "void", "any");

    private static final Set<String> MODIFIERS = Set.of("public", "stock", "static", "const", "new", "decl");
    private static final Set<String> VERBATIM_KEYWORDS =
            Set.of("methodmap", "typedef", "typeset", "functag", "funcenum", "struct");
    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
            "=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", ">>>=");
    private static final Map<String, Integer> BINARY_PRECEDENCE = Map.ofEntries(
            Map.entry("||", 1), Map.entry("&&", 2), Map.entry("|", 3), Map.entry("^", 4),
            Map.entry("&", 5), Map.entry("==", 6), Map.entry("!=", 6),
            Map.entry("<", 7), Map.entry("<=", 7), Map.entry(">", 7), Map.entry(">=", 7),
            Map.entry("<<", 8), Map.entry(">>", 8), Map.entry(">>>", 8),
            Map.entry("+", 9), Map.entry("-", 9),
            Map.entry("*", 10), Map.entry("/", 10), Map.entry("%", 10));
    private static final Set<String> INLINE_COMMENT_KINDS = Set.of(
            "assignment_expression", "binary_expression", "unary_expression", "update_expression",
            "ternary_expression", "call_expression", "call_arguments", "array_indexed_access",
            "field_access", "scope_access", "parenthesized_expression", "comma_expression",
            "view_as", "sizeof_expression", "new_expression", "array_literal",
            "parameter_declarations", "parameter_declaration", "variable_declaration",
            "old_variable_declaration", "enum_entry");

    /** Blocks, bodies and nested operands deeper than this abort the parse. */
    static final int MAX_NESTING = 200;

    private final SourceText src;
    private final List<Token> tokens;
    private int pos = 0;
    private int lastEnd = 0;
    private final List<Token> skippedComments = new ArrayList<>();
    private int depth = 0;

    SourcePawnGrammar(SourceText src, List<Token> tokens) {
        this.src = src;
        this.tokens = tokens;
    }

    SyntaxNode parseSourceFile() {
        List<SyntaxNode> kids = new ArrayList<>();
        while (true) {
            _flushComments(kids);
            if (_peek().isEof()) {
                break;
            }
            int before = pos;
            kids.add(_parseTopLevelItem());
            _flushSkipped(kids);
            if (pos == before) {
                kids.add(_errorToken());
            }
        }
        return SyntaxNode.spanning(src, "source_file", kids, 0, src.length());
    }

    // ---------------------------------------------------------------- top level

    private SyntaxNode _parseTopLevelItem() {
        Token t = _peek();
        if (t.getType() == TokenType.PREPROCESSOR) {
            return _parsePreprocessor(_next());
        }
        if (t.is(";")) {
            return _token(_next());
        }
        if (t.getType() != TokenType.IDENTIFIER) {
            return _errorToken();
        }
        switch (t.getText()) {
            case "native":
            case "forward":
                return _parseNativeOrForward();
            case "enum":
                return _peek(1).is("struct") ? _parseVerbatim("enum_struct") : _parseEnum();
            case "if":
            case "else":
            case "for":
            case "while":
            case "switch":
            case "do":
                return _parseMisplacedControl();
            case "return":
            case "break":
            case "continue":
            case "case":
            case "default":
            case "delete":
                return _errorToken();
            default:
                if (VERBATIM_KEYWORDS.contains(t.getText())) {
                    return _parseVerbatim(t.getText());
                }
                return _parseTopLevelDeclaration();
        }
    }

    private SyntaxNode _parseTopLevelDeclaration() {
        List<SyntaxNode> kids = new ArrayList<>();
        boolean oldStyle = false;
        while (_peek().getType() == TokenType.IDENTIFIER && MODIFIERS.contains(_peek().getText())) {
            Token modifier = _next();
            if (modifier.is("new") || modifier.is("decl")) {
                kids.add(_token(modifier));
                oldStyle = true;
            } else {
                kids.add(_leaf("visibility", modifier));
            }
        }

        if (oldStyle) {
            _parseOldDeclarators(kids);
            _terminate(kids);
            return _branch("old_global_variable_declaration", kids);
        }

        boolean typed = false;
        if (_looksLikeNewType()) {
            kids.add(_parseType());
            typed = true;
        } else if (_looksLikeOldTag()) {
            kids.add(_parseOldTag());
        }

        Token name = _peek();
        if (name.getType() != TokenType.IDENTIFIER) {
            kids.add(_errorUntilStatementEnd());
            if (_peek().is(";")) {
                kids.add(_token(_next()));
            }
            return _branch("global_variable_declaration", kids);
        }

        if (_peek(1).is("(")) {
            kids.add(_leaf("identifier", _next()));
            return _parseFunctionRest(kids);
        }

        if (typed) {
            _parseNewDeclarators(kids);
            _terminate(kids);
            return _branch("global_variable_declaration", kids);
        }

        Token following = _peek(1);
        boolean bare = kids.isEmpty();
        if (bare && !following.isEof() && !following.isNewlineBefore()
                && !(following.is("=") || following.is(";") || following.is(",") || following.is("["))) {
            return _errorToken();
        }
        _parseOldDeclarators(kids);
        _terminate(kids);
        return _branch("old_global_variable_declaration", kids);
    }

    private SyntaxNode _parseFunctionRest(List<SyntaxNode> kids) {
        SyntaxNode params = _parseParameterDeclarations();
        kids.add(params);
        boolean truncated = params.getChildCount() > 0
                && params.getChild(params.getChildCount() - 1).isMissing();

        if (_peek().is("{")) {
            kids.add(_parseBlock());
            return _branch("function_definition", kids);
        }
        if (_peek().is(";")) {
            kids.add(_token(_next()));
            return _branch("function_declaration", kids);
        }
        if (truncated && !_peek().isEof() && !_peek().isNewlineBefore()) {
            kids.add(_parseLooseExpressionStatement());
            return _branch("function_definition", kids);
        }
        _terminate(kids);
        return _branch("function_declaration", kids);
    }

    private SyntaxNode _parseNativeOrForward() {
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_token(_next()));
        if (_looksLikeNewType()) {
            kids.add(_parseType());
        } else if (_looksLikeOldTag()) {
            kids.add(_parseOldTag());
        }
        if (_peek().getType() == TokenType.IDENTIFIER) {
            kids.add(_leaf("identifier", _next()));
        } else {
            kids.add(_missing("identifier", true));
        }
        if (_peek().is("(")) {
            kids.add(_parseParameterDeclarations());
        }
        _terminate(kids);
        return _branch("function_declaration", kids);
    }

    /**
     * A control keyword at file scope: the grammar only accepts declarations here, so the
     * construct surfaces as a function definition named after the keyword, with its header
     * wrapped in an error node.
     */
    private SyntaxNode _parseMisplacedControl() {
        List<SyntaxNode> kids = new ArrayList<>();
        Token keyword = _next();
        kids.add(_leaf("identifier", keyword));
        String effective = keyword.getText();
        if (keyword.is("else") && _peek().is("if")) {
            kids.add(_leaf("identifier", _next()));
            effective = "if";
        }

        if (_peek().is("(") && !effective.equals("else") && !effective.equals("do")) {
            List<SyntaxNode> header = new ArrayList<>();
            header.add(_token(_next()));
            List<SyntaxNode> inner = new ArrayList<>();
            if (!_peek().is(")")) {
                if (effective.equals("for")) {
                    _parseForHeader(inner);
                } else {
                    inner.add(_parseExpression(true));
                }
            }
            if (!inner.isEmpty()) {
                header.add(SyntaxNode.error(src, inner, lastEnd));
            }
            _expect(header, ")");
            kids.add(_branch("parameter_declarations", header));
        }

        if (effective.equals("while") && _peek().is(";")) {
            kids.add(_token(_next()));
        } else if (_peek().is("{")) {
            kids.add(effective.equals("switch") ? _parseSwitchBody() : _parseBlock());
        } else if (!_peek().isEof()) {
            kids.add(_parseStatement());
        }
        return _branch("function_definition", kids);
    }

    private SyntaxNode _parseLooseExpressionStatement() {
        List<SyntaxNode> kids = new ArrayList<>();
        List<SyntaxNode> loose = new ArrayList<>();
        int depth = 0;
        while (!_peek().isEof()) {
            Token t = _peek();
            if (depth <= 0 && (t.is(";") || (t.isNewlineBefore() && !loose.isEmpty()))) {
                break;
            }
            if (t.is("(") || t.is("[") || t.is("{")) {
                depth++;
            } else if (t.is(")") || t.is("]") || t.is("}")) {
                depth--;
            }
            loose.add(_token(_next()));
        }
        if (!loose.isEmpty()) {
            kids.add(SyntaxNode.error(src, loose, lastEnd));
        }
        _terminate(kids);
        return _branch("expression_statement", kids);
    }

    private SyntaxNode _parseEnum() {
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_token(_next()));
        if (_peek().getType() == TokenType.IDENTIFIER) {
            kids.add(_leaf("identifier", _next()));
        }
        if (_peek().is(":")) {
            kids.add(_token(_next()));
        }
        if (!_peek().is("{")) {
            kids.add(_errorUntil("{"));
        }
        if (_peek().is("{")) {
            kids.add(_parseEnumEntries());
        }
        if (_peek().is(";")) {
            kids.add(_token(_next()));
        }
        return _branch("enum", kids);
    }

    private SyntaxNode _parseEnumEntries() {
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_token(_next()));
        while (true) {
            _flushComments(kids);
            Token t = _peek();
            if (t.is("}")) {
                kids.add(_token(_next()));
                break;
            }
            if (t.isEof()) {
                kids.add(_missing("}", false));
                break;
            }
            if (t.is(",")) {
                kids.add(_token(_next()));
                continue;
            }
            if (t.getType() != TokenType.IDENTIFIER) {
                kids.add(_errorToken());
                continue;
            }
            List<SyntaxNode> entry = new ArrayList<>();
            if (_looksLikeOldTag()) {
                entry.add(_parseOldTag());
            }
            entry.add(_leaf("identifier", _next()));
            while (_peek().is("[")) {
                entry.add(_parseFixedDimension());
            }
            if (_peek().is("=")) {
                entry.add(_token(_next()));
                entry.add(_parseAssignment());
            }
            kids.add(_branch("enum_entry", entry));
            _flushSkipped(kids);
        }
        return _branch("enum_entries", kids);
    }

    /**
     * Consumes a declaration the formatter keeps verbatim: up to the matching closing brace,
     * or a terminator at depth zero.
     */
    private SyntaxNode _parseVerbatim(String kind) {
        List<SyntaxNode> kids = new ArrayList<>();
        int depth = 0;
        boolean sawBrace = false;
        while (pos < tokens.size() && !tokens.get(pos).isEof()) {
            Token t = tokens.get(pos++);
            kids.add(t.getType() == TokenType.COMMENT ? _leaf("comment", t) : _token(t));
            lastEnd = t.getEnd();
            if (t.is("{")) {
                depth++;
                sawBrace = true;
            } else if (t.is("}")) {
                depth--;
                if (depth <= 0 && sawBrace) {
                    break;
                }
            } else if (t.is(";") && depth == 0) {
                return _branch(kind, kids);
            }
        }
        if (_peek().is(";")) {
            kids.add(_token(_next()));
        }
        return _branch(kind, kids);
    }

    // ---------------------------------------------------------------- preprocessor

    private SyntaxNode _parsePreprocessor(Token t) {
        String text = t.getText();
        int i = 1;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        int nameStart = i;
        while (i < text.length() && Character.isLetter(text.charAt(i))) {
            i++;
        }
        String name = text.substring(nameStart, i);
        int argStart = i;
        while (argStart < text.length() && Character.isWhitespace(text.charAt(argStart))) {
            argStart++;
        }

        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(SyntaxNode.leaf(src, "#" + name, false, t.getStart(), t.getStart() + i));
        if (argStart < text.length()) {
            kids.add(SyntaxNode.leaf(src, "preproc_arg", true, t.getStart() + argStart, t.getEnd()));
        }
        return _branch(_directiveKind(name), kids);
    }

    private static String _directiveKind(String name) {
        return switch (name) {
            case "include" -> "preproc_include";
            case "tryinclude" -> "preproc_tryinclude";
            case "define" -> "preproc_define";
            case "undef" -> "preproc_undefine";
            case "pragma" -> "preproc_pragma";
            case "if", "ifdef", "ifndef" -> "preproc_if";
            case "elseif", "elif" -> "preproc_elseif";
            case "else" -> "preproc_else";
            case "endif" -> "preproc_endif";
            default -> "preproc_directive";
        };
    }

    // ---------------------------------------------------------------- types and declarators

    private boolean _looksLikeNewType() {
        Token t = _peek();
        if (t.getType() != TokenType.IDENTIFIER) {
            return false;
        }
        if (BUILTIN_TYPES.contains(t.getText())) {
            return !_peek(1).is(":");
        }
        Token next = _peek(1);
        if (next.getType() == TokenType.IDENTIFIER) {
            return true;
        }
        return next.is("[") && _peek(2).is("]");
    }

    private boolean _looksLikeOldTag() {
        return _peek().getType() == TokenType.IDENTIFIER && _peek(1).is(":") && !_peek(1).isNewlineBefore();
    }

    private SyntaxNode _parseType() {
        List<SyntaxNode> kids = new ArrayList<>();
        Token t = _next();
        kids.add(_leaf(BUILTIN_TYPES.contains(t.getText()) ? "builtin_type" : "identifier", t));
        while (_peek().is("[") && _peek(1).is("]")) {
            List<SyntaxNode> dim = new ArrayList<>();
            dim.add(_token(_next()));
            dim.add(_token(_next()));
            kids.add(_branch("dimension", dim));
        }
        return _branch("type", kids);
    }

    private SyntaxNode _parseOldTag() {
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_leaf("identifier", _next()));
        kids.add(_token(_next()));
        return _branch("type", kids);
    }

    private void _parseNewDeclarators(List<SyntaxNode> kids) {
        kids.add(_parseDeclarator("variable_declaration", false));
        while (_peek().is(",")) {
            kids.add(_token(_next()));
            kids.add(_parseDeclarator("variable_declaration", false));
        }
    }

    private void _parseOldDeclarators(List<SyntaxNode> kids) {
        kids.add(_parseDeclarator("old_variable_declaration", true));
        while (_peek().is(",")) {
            kids.add(_token(_next()));
            kids.add(_parseDeclarator("old_variable_declaration", true));
        }
    }

    private SyntaxNode _parseDeclarator(String kind, boolean allowTag) {
        List<SyntaxNode> kids = new ArrayList<>();
        if (allowTag && _looksLikeOldTag()) {
            kids.add(_parseOldTag());
        }
        if (_peek().getType() == TokenType.IDENTIFIER) {
            kids.add(_leaf("identifier", _next()));
        } else {
            kids.add(_missing("identifier", true));
        }
        while (_peek().is("[")) {
            kids.add(_parseFixedDimension());
        }
        if (_peek().is("=")) {
            kids.add(_token(_next()));
            kids.add(_parseAssignment());
        }
        return _branch(kind, kids);
    }

    private SyntaxNode _parseFixedDimension() {
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_token(_next()));
        if (!_peek().is("]")) {
            kids.add(_parseExpression(false));
        }
        _expect(kids, "]");
        return _branch("fixed_dimension", kids);
    }

    private SyntaxNode _parseParameterDeclarations() {
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_token(_next()));
        if (_peek().is(")")) {
            kids.add(_token(_next()));
            return _branch("parameter_declarations", kids);
        }
        while (true) {
            Token t = _peek();
            if (t.is("...")) {
                List<SyntaxNode> rest = new ArrayList<>();
                rest.add(_token(_next()));
                kids.add(_branch("rest_parameter", rest));
            } else if (BUILTIN_TYPES.contains(t.getText()) && _peek(1).is("...")) {
                List<SyntaxNode> rest = new ArrayList<>();
                rest.add(_parseType());
                rest.add(_token(_next()));
                kids.add(_branch("rest_parameter", rest));
            } else if (t.getType() == TokenType.IDENTIFIER || t.is("&")) {
                kids.add(_parseParameter());
            } else {
                kids.add(_errorUntilAny(",", ")"));
            }

            if (_peek().is(",")) {
                kids.add(_token(_next()));
                continue;
            }
            if (_peek().is(")")) {
                kids.add(_token(_next()));
                break;
            }
            kids.add(_missing(")", false));
            break;
        }
        return _branch("parameter_declarations", kids);
    }

    private SyntaxNode _parseParameter() {
        List<SyntaxNode> kids = new ArrayList<>();
        if (_peek().is("const")) {
            kids.add(_token(_next()));
        }
        Token t = _peek();
        Token next = _peek(1);
        if (t.getType() == TokenType.IDENTIFIER
                && (BUILTIN_TYPES.contains(t.getText()) && !next.is(":")
                || next.getType() == TokenType.IDENTIFIER || next.is("&")
                || (next.is("[") && _peek(2).is("]")))) {
            kids.add(_parseType());
        } else if (_looksLikeOldTag()) {
            kids.add(_parseOldTag());
        }
        if (_peek().is("&")) {
            kids.add(_token(_next()));
        }
        if (_peek().getType() == TokenType.IDENTIFIER) {
            kids.add(_leaf("identifier", _next()));
        } else {
            kids.add(_missing("identifier", true));
        }
        while (_peek().is("[")) {
            kids.add(_parseFixedDimension());
        }
        if (_peek().is("=")) {
            kids.add(_token(_next()));
            kids.add(_parseAssignment());
        }
        return _branch("parameter_declaration", kids);
    }

    // ---------------------------------------------------------------- statements

    private SyntaxNode _parseBlock() {
        _enter();
        try {
            return _parseBlockContents();
        } finally {
            depth--;
        }
    }

    private SyntaxNode _parseBlockContents() {
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_token(_next()));
        while (true) {
            _flushComments(kids);
            Token t = _peek();
            if (t.is("}")) {
                kids.add(_token(_next()));
                break;
            }
            if (t.isEof()) {
                kids.add(_missing("}", false));
                break;
            }
            int before = pos;
            kids.add(_parseStatement());
            _flushSkipped(kids);
            if (pos == before) {
                kids.add(_errorToken());
            }
        }
        return _branch("block", kids);
    }

    private SyntaxNode _parseStatement() {
        Token t = _peek();
        if (t.getType() == TokenType.PREPROCESSOR) {
            return _parsePreprocessor(_next());
        }
        if (t.is("{")) {
            return _parseBlock();
        }
        if (t.is(";")) {
            return _token(_next());
        }
        if (t.getType() == TokenType.IDENTIFIER) {
            switch (t.getText()) {
                case "if":
                    return _parseIf();
                case "for":
                    return _parseFor();
                case "while":
                    return _parseWhile();
                case "do":
                    return _parseDoWhile();
                case "switch":
                    return _parseSwitch();
                case "return":
                    return _parseReturn();
                case "break":
                    return _parseKeywordStatement("break_statement");
                case "continue":
                    return _parseKeywordStatement("continue_statement");
                case "delete":
                    return _parseDelete();
                case "case":
                case "default":
                case "else":
                    return _errorToken();
                default:
                    break;
            }
            if (_looksLikeLocalDeclaration()) {
                SyntaxNode declaration = _parseLocalDeclaration();
                return declaration;
            }
        }
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_parseExpression(true));
        _terminate(kids);
        return _branch("expression_statement", kids);
    }

    private boolean _looksLikeLocalDeclaration() {
        Token t = _peek();
        if (t.is("new") || t.is("decl") || t.is("static") || t.is("const")) {
            return true;
        }
        return _looksLikeNewType();
    }

    private SyntaxNode _parseLocalDeclaration() {
        SyntaxNode declaration = _parseDeclarationWithoutTerminator();
        List<SyntaxNode> kids = new ArrayList<>(declaration.getChildren());
        _terminate(kids);
        return _branch(declaration.getKind(), kids);
    }

    private SyntaxNode _parseDeclarationWithoutTerminator() {
        List<SyntaxNode> kids = new ArrayList<>();
        boolean oldStyle = false;
        while (_peek().is("new") || _peek().is("decl") || _peek().is("static") || _peek().is("const")) {
            Token modifier = _next();
            oldStyle |= modifier.is("new") || modifier.is("decl");
            kids.add(_token(modifier));
        }
        if (!oldStyle && _looksLikeNewType()) {
            kids.add(_parseType());
            _parseNewDeclarators(kids);
            return _branch("variable_declaration_statement", kids);
        }
        _parseOldDeclarators(kids);
        return _branch("old_variable_declaration_statement", kids);
    }

    private SyntaxNode _parseIf() {
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_token(_next()));
        _parseParenthesizedCondition(kids);
        kids.add(_parseBody());
        if (_peek().is("else")) {
            kids.add(_token(_next()));
            kids.add(_parseBody());
        }
        return _branch("condition_statement", kids);
    }

    private SyntaxNode _parseFor() {
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_token(_next()));
        _expect(kids, "(");
        _parseForHeader(kids);
        _expect(kids, ")");
        kids.add(_parseBody());
        return _branch("for_statement", kids);
    }

    /**
     * Reads {@code init; condition; update} into {@code kids}, including both separators.
     */
    private void _parseForHeader(List<SyntaxNode> kids) {
        if (!_peek().is(";")) {
            kids.add(_looksLikeLocalDeclaration() ? _parseDeclarationWithoutTerminator() : _parseExpression(true));
        }
        _expect(kids, ";");
        if (!_peek().is(";")) {
            kids.add(_parseExpression(true));
        }
        _expect(kids, ";");
        if (!_peek().is(")")) {
            kids.add(_parseExpression(true));
        }
    }

    private SyntaxNode _parseWhile() {
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_token(_next()));
        _parseParenthesizedCondition(kids);
        kids.add(_parseBody());
        return _branch("while_statement", kids);
    }

    private SyntaxNode _parseDoWhile() {
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_token(_next()));
        kids.add(_parseBody());
        _expect(kids, "while");
        _parseParenthesizedCondition(kids);
        _terminate(kids);
        return _branch("do_while_statement", kids);
    }

    private SyntaxNode _parseSwitch() {
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_token(_next()));
        _parseParenthesizedCondition(kids);
        if (_peek().is("{")) {
            SyntaxNode body = _parseSwitchBody();
            kids.addAll(body.getChildren());
        } else {
            kids.add(_missing("{", false));
        }
        return _branch("switch_statement", kids);
    }

    /**
     * Parses {@code { case ...: ... }} into a block whose statements are switch cases.
     */
    private SyntaxNode _parseSwitchBody() {
        _enter();
        try {
            return _parseSwitchCases();
        } finally {
            depth--;
        }
    }

    private SyntaxNode _parseSwitchCases() {
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_token(_next()));
        while (true) {
            _flushComments(kids);
            Token t = _peek();
            if (t.is("}")) {
                kids.add(_token(_next()));
                break;
            }
            if (t.isEof()) {
                kids.add(_missing("}", false));
                break;
            }
            if (t.is("case") || t.is("default")) {
                kids.add(_parseSwitchCase());
            } else {
                kids.add(_errorToken());
            }
        }
        return _branch("block", kids);
    }

    private SyntaxNode _parseSwitchCase() {
        List<SyntaxNode> kids = new ArrayList<>();
        Token label = _next();
        kids.add(_token(label));
        if (label.is("case")) {
            kids.add(_parseTernary());
            while (_peek().is(",")) {
                kids.add(_token(_next()));
                kids.add(_parseTernary());
            }
        }
        _expect(kids, ":");
        while (true) {
            _flushComments(kids);
            Token t = _peek();
            if (t.isEof() || t.is("}") || t.is("case") || t.is("default")) {
                break;
            }
            int before = pos;
            kids.add(_parseStatement());
            _flushSkipped(kids);
            if (pos == before) {
                kids.add(_errorToken());
            }
        }
        return _branch("switch_case", kids);
    }

    private SyntaxNode _parseReturn() {
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_token(_next()));
        Token t = _peek();
        if (!t.is(";") && !t.is("}") && !t.isEof() && !t.isNewlineBefore()) {
            kids.add(_parseExpression(true));
        }
        _terminate(kids);
        return _branch("return_statement", kids);
    }

    private SyntaxNode _parseKeywordStatement(String kind) {
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_token(_next()));
        _terminate(kids);
        return _branch(kind, kids);
    }

    private SyntaxNode _parseDelete() {
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_token(_next()));
        kids.add(_parseExpression(false));
        _terminate(kids);
        return _branch("delete_statement", kids);
    }

    private void _parseParenthesizedCondition(List<SyntaxNode> kids) {
        _expect(kids, "(");
        kids.add(_parseExpression(true));
        _expect(kids, ")");
    }

    private SyntaxNode _parseBody() {
        if (_peek().isEof()) {
            return _missing(";", false);
        }
        if (_peek().is("{")) {
            return _parseBlock();
        }
        _enter();
        try {
            return _parseStatement();
        } finally {
            depth--;
        }
    }

    // ---------------------------------------------------------------- expressions

    private SyntaxNode _parseExpression(boolean allowComma) {
        SyntaxNode left = _parseAssignment();
        if (!allowComma) {
            return left;
        }
        while (_peek().is(",")) {
            List<SyntaxNode> kids = new ArrayList<>();
            kids.add(left);
            kids.add(_token(_next()));
            kids.add(_parseAssignment());
            left = _branch("comma_expression", kids);
        }
        return left;
    }

    private SyntaxNode _parseAssignment() {
        SyntaxNode left = _parseTernary();
        Token t = _peek();
        if (t.getType() == TokenType.OPERATOR && ASSIGNMENT_OPERATORS.contains(t.getText())) {
            List<SyntaxNode> kids = new ArrayList<>();
            kids.add(left);
            kids.add(_token(_next()));
            kids.add(_parseAssignment());
            return _branch("assignment_expression", kids);
        }
        return left;
    }

    private SyntaxNode _parseTernary() {
        SyntaxNode condition = _parseBinary(1);
        if (!_peek().is("?")) {
            return condition;
        }
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(condition);
        kids.add(_token(_next()));
        kids.add(_parseAssignment());
        _expect(kids, ":");
        kids.add(_parseAssignment());
        return _branch("ternary_expression", kids);
    }

    private SyntaxNode _parseBinary(int minPrecedence) {
        SyntaxNode left = _parseUnary();
        while (true) {
            Token t = _peek();
            Integer precedence = t.getType() == TokenType.OPERATOR ? BINARY_PRECEDENCE.get(t.getText()) : null;
            if (precedence == null || precedence < minPrecedence) {
                return left;
            }
            List<SyntaxNode> kids = new ArrayList<>();
            kids.add(left);
            kids.add(_token(_next()));
            kids.add(_parseBinary(precedence + 1));
            left = _branch("binary_expression", kids);
        }
    }

    private SyntaxNode _parseUnary() {
        _enter();
        try {
            return _parseUnaryOperand();
        } finally {
            depth--;
        }
    }

    private SyntaxNode _parseUnaryOperand() {
        Token t = _peek();
        if (t.is("!") || t.is("~") || t.is("-") || t.is("+")) {
            List<SyntaxNode> kids = new ArrayList<>();
            kids.add(_token(_next()));
            kids.add(_parseUnary());
            return _branch("unary_expression", kids);
        }
        if (t.is("++") || t.is("--")) {
            List<SyntaxNode> kids = new ArrayList<>();
            kids.add(_token(_next()));
            kids.add(_parseUnary());
            return _branch("update_expression", kids);
        }
        if (t.is("sizeof")) {
            List<SyntaxNode> kids = new ArrayList<>();
            kids.add(_token(_next()));
            kids.add(_parseUnary());
            return _branch("sizeof_expression", kids);
        }
        if (t.is("new")) {
            return _parseNewExpression();
        }
        return _parsePostfix();
    }

    private SyntaxNode _parseNewExpression() {
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_token(_next()));
        if (_peek().getType() == TokenType.IDENTIFIER) {
            Token type = _next();
            kids.add(_leaf(BUILTIN_TYPES.contains(type.getText()) ? "builtin_type" : "identifier", type));
        } else {
            kids.add(_missing("identifier", true));
        }
        if (_peek().is("(")) {
            kids.add(_parseCallArguments());
        } else {
            while (_peek().is("[")) {
                kids.add(_parseFixedDimension());
            }
        }
        return _branch("new_expression", kids);
    }

    private SyntaxNode _parsePostfix() {
        SyntaxNode expression = _parsePrimary();
        if (expression.isMissing()) {
            return expression;
        }
        while (true) {
            Token t = _peek();
            List<SyntaxNode> kids = new ArrayList<>();
            if (t.is("(")) {
                kids.add(expression);
                kids.add(_parseCallArguments());
                expression = _branch("call_expression", kids);
            } else if (t.is("[")) {
                kids.add(expression);
                kids.add(_token(_next()));
                kids.add(_parseExpression(false));
                _expect(kids, "]");
                expression = _branch("array_indexed_access", kids);
            } else if (t.is(".") || t.is("::")) {
                kids.add(expression);
                kids.add(_token(_next()));
                if (_peek().getType() == TokenType.IDENTIFIER) {
                    kids.add(_leaf("identifier", _next()));
                } else {
                    kids.add(_missing("identifier", true));
                }
                expression = _branch(t.is(".") ? "field_access" : "scope_access", kids);
            } else if ((t.is("++") || t.is("--")) && !t.isNewlineBefore()) {
                kids.add(expression);
                kids.add(_token(_next()));
                expression = _branch("update_expression", kids);
            } else {
                return expression;
            }
        }
    }

    private SyntaxNode _parseCallArguments() {
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_token(_next()));
        if (!_peek().is(")")) {
            kids.add(_parseAssignment());
            while (_peek().is(",")) {
                kids.add(_token(_next()));
                kids.add(_parseAssignment());
            }
        }
        _expect(kids, ")");
        return _branch("call_arguments", kids);
    }

    private SyntaxNode _parsePrimary() {
        Token t = _peek();
        switch (t.getType()) {
            case NUMBER:
                return _leaf("number_literal", _next());
            case STRING:
                return _literal("string_literal");
            case CHAR:
                return _literal("char_literal");
            case IDENTIFIER:
                return _parseIdentifierPrimary();
            default:
                break;
        }
        if (t.is("(")) {
            List<SyntaxNode> kids = new ArrayList<>();
            kids.add(_token(_next()));
            kids.add(_parseExpression(true));
            _expect(kids, ")");
            return _branch("parenthesized_expression", kids);
        }
        if (t.is("{")) {
            return _parseArrayLiteral();
        }
        return _missing("identifier", true);
    }

    /**
     * A string or character literal; one without its closing quote is wrapped in an error node.
     */
    private SyntaxNode _literal(String kind) {
        Token t = _next();
        SyntaxNode literal = _leaf(kind, t);
        if (t.isTerminated()) {
            return literal;
        }
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(literal);
        return SyntaxNode.error(src, kids, lastEnd);
    }

    private SyntaxNode _parseIdentifierPrimary() {
        Token t = _peek();
        switch (t.getText()) {
            case "true":
            case "false":
                return _leaf("bool_literal", _next());
            case "null":
                return _leaf("null", _next());
            case "this":
                return _leaf("this", _next());
            case "view_as":
                if (_peek(1).is("<")) {
                    return _parseViewAs();
                }
                break;
            default:
                break;
        }
        return _leaf("identifier", _next());
    }

    private SyntaxNode _parseViewAs() {
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_token(_next()));
        kids.add(_token(_next()));
        if (_peek().getType() == TokenType.IDENTIFIER) {
            kids.add(_parseType());
        } else {
            kids.add(_missing("type", true));
        }
        _expect(kids, ">");
        _expect(kids, "(");
        kids.add(_parseExpression(true));
        _expect(kids, ")");
        return _branch("view_as", kids);
    }

    private SyntaxNode _parseArrayLiteral() {
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_token(_next()));
        while (!_peek().is("}") && !_peek().isEof()) {
            int before = pos;
            kids.add(_parseAssignment());
            if (_peek().is(",")) {
                kids.add(_token(_next()));
            } else if (pos == before || !_peek().is("}")) {
                break;
            }
        }
        _expect(kids, "}");
        return _branch("array_literal", kids);
    }

    // ---------------------------------------------------------------- recovery helpers

    /**
     * Adds the statement terminator. A terminator that is absent before a line break, a
     * closing brace or the end of input becomes a missing node at the end of the previous
     * token; anything else left on the line is swallowed into an error node.
     */
    private void _terminate(List<SyntaxNode> kids) {
        Token t = _peek();
        if (t.is(";")) {
            kids.add(_token(_next()));
            return;
        }
        if (t.isEof() || t.isNewlineBefore() || t.is("}")) {
            kids.add(_missing(";", false));
            return;
        }
        kids.add(_errorUntilStatementEnd());
        if (_peek().is(";")) {
            kids.add(_token(_next()));
        }
    }

    private SyntaxNode _errorUntilStatementEnd() {
        List<SyntaxNode> kids = new ArrayList<>();
        int depth = 0;
        while (!_peek().isEof()) {
            Token t = _peek();
            if (depth <= 0 && (t.is(";") || t.is("}") || (t.isNewlineBefore() && !kids.isEmpty()))) {
                break;
            }
            if (t.is("(") || t.is("[") || t.is("{")) {
                depth++;
            } else if (t.is(")") || t.is("]") || t.is("}")) {
                depth--;
            }
            kids.add(_token(_next()));
        }
        return SyntaxNode.error(src, kids, lastEnd);
    }

    private SyntaxNode _errorUntil(String stop) {
        List<SyntaxNode> kids = new ArrayList<>();
        while (!_peek().isEof() && !_peek().is(stop)) {
            kids.add(_token(_next()));
        }
        return SyntaxNode.error(src, kids, lastEnd);
    }

    /**
     * Collects tokens up to one of the stop tokens at nesting depth zero, or a brace or
     * terminator that ends the enclosing construct.
     */
    private SyntaxNode _errorUntilAny(String firstStop, String secondStop) {
        List<SyntaxNode> kids = new ArrayList<>();
        int depth = 0;
        while (!_peek().isEof()) {
            Token t = _peek();
            if (depth == 0 && (t.is(firstStop) || t.is(secondStop) || t.is("{") || t.is(";"))) {
                break;
            }
            if (t.is("(") || t.is("[")) {
                depth++;
            } else if (t.is(")") || t.is("]")) {
                depth--;
            }
            kids.add(_token(_next()));
        }
        return SyntaxNode.error(src, kids, lastEnd);
    }

    private SyntaxNode _errorToken() {
        List<SyntaxNode> kids = new ArrayList<>();
        kids.add(_token(_next()));
        return SyntaxNode.error(src, kids, lastEnd);
    }

    private void _expect(List<SyntaxNode> kids, String text) {
        if (_peek().is(text)) {
            kids.add(_token(_next()));
        } else {
            kids.add(_missing(text, false));
        }
    }

    // ---------------------------------------------------------------- token plumbing

    private Token _peek() {
        return _peek(0);
    }

    private Token _peek(int ahead) {
        int index = pos;
        int seen = 0;
        while (index < tokens.size()) {
            Token t = tokens.get(index);
            if (t.getType() != TokenType.COMMENT) {
                if (seen == ahead) {
                    return t;
                }
                seen++;
            }
            index++;
        }
        return tokens.get(tokens.size() - 1);
    }

    private Token _next() {
        while (tokens.get(pos).getType() == TokenType.COMMENT) {
            skippedComments.add(tokens.get(pos));
            pos++;
        }
        Token t = tokens.get(pos);
        if (!t.isEof()) {
            pos++;
            lastEnd = t.getEnd();
        }
        return t;
    }

    /**
     * Emits comments skipped inside the previous item, then comments waiting at the cursor.
     */
    private void _flushComments(List<SyntaxNode> kids) {
        _flushSkipped(kids);
        while (pos < tokens.size() && tokens.get(pos).getType() == TokenType.COMMENT) {
            Token comment = tokens.get(pos++);
            lastEnd = comment.getEnd();
            kids.add(_leaf("comment", comment));
        }
    }

    private void _flushSkipped(List<SyntaxNode> kids) {
        for (Token comment : skippedComments) {
            kids.add(_leaf("comment", comment));
        }
        skippedComments.clear();
    }

    private SyntaxNode _token(Token t) {
        return SyntaxNode.leaf(src, t.getText(), false, t.getStart(), t.getEnd());
    }

    private SyntaxNode _leaf(String kind, Token t) {
        return SyntaxNode.leaf(src, kind, true, t.getStart(), t.getEnd());
    }

    private SyntaxNode _missing(String kind, boolean named) {
        return SyntaxNode.missing(src, kind, named, lastEnd);
    }

    private SyntaxNode _branch(String kind, List<SyntaxNode> kids) {
        if (!skippedComments.isEmpty() && INLINE_COMMENT_KINDS.contains(kind)) {
            return SyntaxNode.branch(src, kind, _mergeInnerComments(kids), lastEnd);
        }
        return SyntaxNode.branch(src, kind, kids, lastEnd);
    }

    /**
     * Moves skipped comments that fall between two of {@code kids} into the list at their source position.
     */
    private List<SyntaxNode> _mergeInnerComments(List<SyntaxNode> kids) {
        List<SyntaxNode> merged = new ArrayList<>(kids);
        Iterator<Token> pending = skippedComments.iterator();
        while (pending.hasNext()) {
            Token comment = pending.next();
            int slot = _gapIndex(merged, comment);
            if (slot > 0) {
                merged.add(slot, _leaf("comment", comment));
                pending.remove();
            }
        }
        return merged;
    }

    private static int _gapIndex(List<SyntaxNode> kids, Token comment) {
        for (int i = 1; i < kids.size(); i++) {
            if (kids.get(i - 1).getEndOffset() <= comment.getStart()
                    && comment.getEnd() <= kids.get(i).getStartOffset()) {
                return i;
            }
        }
        return -1;
    }

    private void _enter() {
        if (++depth > MAX_NESTING) {
            int line = src.pointAt(_peek().getStart()).getRow() + 1;
            throw new ParseFailureException("Source nests deeper than " + MAX_NESTING + " levels at line " + line);
        }
    }
}
