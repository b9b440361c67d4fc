package com.spformatter.plugins.sourcepawn.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Splits SourcePawn source into tokens. Comments and preprocessor lines are kept as tokens.
 */
public class Lexer {
    /** Longest first so that munching picks the longest operator. */
    static final String[] OPERATORS = {
            ">>>=", "<<=", ">>=", ">>>", "...",
            "::", "==", "!=", "<=", ">=", "&&", "||", "++", "--",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<", ">>",
            "+", "-", "*", "/", "%", "=", "<", ">", "!", "~", "&", "|", "^",
            "?", ":", ";", ",", ".", "(", ")", "[", "]", "{", "}"
    };

    private static final List<String> OPERATOR_LIST = Collections.unmodifiableList(Arrays.asList(OPERATORS));

    private final String source;
    private int pos = 0;
    private boolean newlineSeen = true;

    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Operator lexemes, longest first.
     */
    public static List<String> operators() {
        return OPERATOR_LIST;
    }

    /**
     * Tokenizes the whole source; the last token is always {@link TokenType#EOF}.
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            _skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.EOF, "", source.length(), source.length(), newlineSeen));
                return tokens;
            }
            tokens.add(_nextToken());
        }
    }

    private void _skipWhitespace() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\n') {
                newlineSeen = true;
            } else if (!Character.isWhitespace(c)) {
                return;
            }
            pos++;
        }
    }

    private Token _nextToken() {
        boolean newline = newlineSeen;
        newlineSeen = false;
        int start = pos;
        char c = source.charAt(pos);

        if (c == '#' && _atLineStart(start)) {
            _readPreprocessorLine();
            int end = _trimTrailingSpace(start, pos);
            return new Token(TokenType.PREPROCESSOR, source.substring(start, end), start, end, newline);
        }
        if (c == '/' && _peek(1) == '/') {
            while (pos < source.length() && source.charAt(pos) != '\n') {
                pos++;
            }
            int end = _trimTrailingSpace(start, pos);
            return new Token(TokenType.COMMENT, source.substring(start, end), start, end, newline);
        }
        if (c == '/' && _peek(1) == '*') {
            int close = source.indexOf("*/", pos + 2);
            pos = close < 0 ? source.length() : close + 2;
            return new Token(TokenType.COMMENT, source.substring(start, pos), start, pos, newline);
        }
        if (c == '"' || c == '\'') {
            boolean closed = _readQuoted(c);
            TokenType type = c == '"' ? TokenType.STRING : TokenType.CHAR;
            return new Token(type, source.substring(start, pos), start, pos, newline, closed);
        }
        if (Character.isDigit(c)) {
            _readNumber();
            return new Token(TokenType.NUMBER, source.substring(start, pos), start, pos, newline);
        }
        if (Character.isLetter(c) || c == '_') {
            while (pos < source.length()
                    && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
            return new Token(TokenType.IDENTIFIER, source.substring(start, pos), start, pos, newline);
        }
        for (String op : OPERATORS) {
            if (source.startsWith(op, pos)) {
                pos += op.length();
                return new Token(TokenType.OPERATOR, op, start, pos, newline);
            }
        }
        pos++;
        return new Token(TokenType.UNKNOWN, source.substring(start, pos), start, pos, newline);
    }

    private boolean _atLineStart(int offset) {
        for (int i = offset - 1; i >= 0; i--) {
            char c = source.charAt(i);
            if (c == '\n') {
                return true;
            }
            if (!Character.isWhitespace(c)) {
                return false;
            }
        }
        return true;
    }

    private void _readPreprocessorLine() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\n') {
                int back = _trimTrailingSpace(0, pos);
                if (back > 0 && source.charAt(back - 1) == '\\') {
                    pos++;
                    continue;
                }
                return;
            }
            pos++;
        }
    }

    /**
     * Reads a quoted literal. A backslash at the end of a line continues the literal on the next one.
     *
     * @return false when the line or the input ends before the closing quote
     */
    private boolean _readQuoted(char quote) {
        pos++;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\\' && pos + 1 < source.length()) {
                boolean crlf = source.charAt(pos + 1) == '\r' && _peek(2) == '\n';
                pos += crlf ? 3 : 2;
                continue;
            }
            if (c == '\n') {
                return false;
            }
            pos++;
            if (c == quote) {
                return true;
            }
        }
        return false;
    }

    private void _readNumber() {
        if (source.charAt(pos) == '0' && pos + 1 < source.length()
                && "xXbBoO".indexOf(source.charAt(pos + 1)) >= 0) {
            pos += 2;
            while (pos < source.length()
                    && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
            return;
        }
        _readDigits();
        if (_peek(0) == '.' && Character.isDigit(_peek(1))) {
            pos++;
            _readDigits();
        }
        if ((_peek(0) == 'e' || _peek(0) == 'E')
                && (Character.isDigit(_peek(1))
                || ((_peek(1) == '-' || _peek(1) == '+') && Character.isDigit(_peek(2))))) {
            pos += 2;
            _readDigits();
        }
    }

    private void _readDigits() {
        while (pos < source.length() && (Character.isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
            pos++;
        }
    }

    private char _peek(int ahead) {
        int index = pos + ahead;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private int _trimTrailingSpace(int floor, int end) {
        while (end > floor && (source.charAt(end - 1) == ' ' || source.charAt(end - 1) == '\t'
                || source.charAt(end - 1) == '\r')) {
            end--;
        }
        return end;
    }
}
