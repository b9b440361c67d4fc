package com.spformatter.plugins.sourcepawn.spacing;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.spformatter.plugins.sourcepawn.parser.Lexer;

/**
 * Text-level pass that puts one space around binary and assignment operators and
 * glues prefix and postfix {@code ++}, {@code --} and unary {@code !} to their operand.
 *
 * <p>String and character literals, comments and preprocessor lines are masked
 * before either stage runs, so their contents are never touched. {@code &}, {@code |},
 * {@code ^}, {@code <} and {@code >} are never spaced: they also appear in grouped bitwise
 * idioms and in {@code view_as<T>} type arguments.
 */
public final class OperatorSpacingNormalizer {

    /** Operators that get surrounding spaces, in the order their rules are applied. */
    public static final List<String> SPACED_OPERATORS = List.of(
            "<<", ">>", "==", "!=", "<=", ">=", "&&", "||",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
            "+", "-", "*", "/", "%", "=");

    /** A single-character operator is not spaced when the text holds one of these containing it. */
    static final List<String> CONFLICTING_OPERATORS = List.of(
            "&&", "||", "++", "--", "<<", ">>", "==", "!=", "<=", ">=",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=");

    private static final Set<String> UNARY_CONTEXT_WORDS = Set.of("return", "case");
    private static final String OPERATOR_CHARS = "+-*/%=<>!&|^~";
    private static final String UNARY_CONTEXT_CHARS = "([,{?:;";
    private static final char MASK_START = '\uE000';
    private static final char MASK_END = '\uE001';

    private final boolean insertSpacing;

    public OperatorSpacingNormalizer(boolean insertSpacing) {
        this.insertSpacing = insertSpacing;
    }

    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        List<String> masked = new ArrayList<>();
        String code = _mask(text, masked);
        if (insertSpacing) {
            code = _insertSpacing(code);
        }
        code = _removeSpacing(code);
        return _unmask(code, masked);
    }

    // ---------------------------------------------------------------- insertion

    private static String _insertSpacing(String code) {
        Set<Character> suppressed = _conflictingCharacters(code);
        StringBuilder out = new StringBuilder(code.length() + 16);
        int i = 0;
        while (i < code.length()) {
            String op = _operatorAt(code, i);
            if (op == null) {
                out.append(code.charAt(i++));
                continue;
            }
            if (_shouldSpace(code, i, op, suppressed)) {
                if (out.length() > 0 && !Character.isWhitespace(out.charAt(out.length() - 1))) {
                    out.append(' ');
                }
                out.append(op);
                int after = i + op.length();
                if (after < code.length() && !Character.isWhitespace(code.charAt(after))) {
                    out.append(' ');
                }
            } else {
                out.append(op);
            }
            i += op.length();
        }
        return out.toString();
    }

    private static boolean _shouldSpace(String code, int at, String op, Set<Character> suppressed) {
        if (!SPACED_OPERATORS.contains(op)) {
            return false;
        }
        if (op.length() == 1) {
            if (suppressed.contains(op.charAt(0))) {
                return false;
            }
            if ((op.equals("+") || op.equals("-")) && (_isUnaryPosition(code, at) || _isExponentSign(code, at))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Characters of single-character operators that also occur inside a multi-character
     * operator present in the text.
     */
    private static Set<Character> _conflictingCharacters(String code) {
        Set<Character> result = new HashSet<>();
        for (String multi : CONFLICTING_OPERATORS) {
            if (code.contains(multi)) {
                for (char c : multi.toCharArray()) {
                    result.add(c);
                }
            }
        }
        return result;
    }

    private static boolean _isUnaryPosition(String code, int at) {
        int i = at - 1;
        while (i >= 0 && (code.charAt(i) == ' ' || code.charAt(i) == '\t')) {
            i--;
        }
        if (i < 0 || code.charAt(i) == '\n' || code.charAt(i) == '\r') {
            return true;
        }
        char prev = code.charAt(i);
        if (OPERATOR_CHARS.indexOf(prev) >= 0 || UNARY_CONTEXT_CHARS.indexOf(prev) >= 0) {
            return true;
        }
        if (_isWordChar(prev)) {
            int end = i + 1;
            while (i >= 0 && _isWordChar(code.charAt(i))) {
                i--;
            }
            return UNARY_CONTEXT_WORDS.contains(code.substring(i + 1, end));
        }
        return false;
    }

    /**
     * True for the sign of a decimal exponent such as {@code 1e-5}.
     */
    private static boolean _isExponentSign(String code, int at) {
        if (at < 2 || at + 1 >= code.length() || !Character.isDigit(code.charAt(at + 1))) {
            return false;
        }
        char e = code.charAt(at - 1);
        if (e != 'e' && e != 'E') {
            return false;
        }
        int start = at - 1;
        while (start > 0 && (_isWordChar(code.charAt(start - 1)) || code.charAt(start - 1) == '.')) {
            start--;
        }
        String number = code.substring(start, at - 1);
        return !number.isEmpty() && Character.isDigit(number.charAt(0))
                && !number.startsWith("0x") && !number.startsWith("0X");
    }

    // ---------------------------------------------------------------- removal

    private static String _removeSpacing(String code) {
        StringBuilder out = new StringBuilder(code.length());
        int i = 0;
        while (i < code.length()) {
            String op = _operatorAt(code, i);
            if (op == null) {
                char c = code.charAt(i);
                if ((c == ' ' || c == '\t') && _gluesToFollowingPostfix(code, i, out)) {
                    i = _skipBlanks(code, i, false);
                    continue;
                }
                out.append(c);
                i++;
                continue;
            }
            out.append(op);
            i += op.length();
            boolean glue = false;
            if (op.equals("++") || op.equals("--")) {
                glue = !_previousIsOperand(out, out.length() - op.length());
            } else if (op.equals("!")) {
                glue = true;
            }
            if (glue) {
                int next = _skipBlanks(code, i, true);
                if (next > i && next < code.length() && (_isWordChar(code.charAt(next)) || code.charAt(next) == '(')) {
                    i = next;
                }
            }
        }
        return out.toString();
    }

    /**
     * Whitespace between an operand and a postfix {@code ++}/{@code --} that no word follows.
     */
    private static boolean _gluesToFollowingPostfix(String code, int at, StringBuilder out) {
        if (out.length() == 0) {
            return false;
        }
        char prev = out.charAt(out.length() - 1);
        if (!_isWordChar(prev) && prev != ')' && prev != ']') {
            return false;
        }
        int next = _skipBlanks(code, at, false);
        String op = _operatorAt(code, next);
        if (!"++".equals(op) && !"--".equals(op)) {
            return false;
        }
        int after = next + 2;
        return after >= code.length() || !_isWordChar(code.charAt(after));
    }

    private static boolean _previousIsOperand(CharSequence text, int opStart) {
        int i = opStart - 1;
        while (i >= 0 && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i--;
        }
        if (i < 0) {
            return false;
        }
        char prev = text.charAt(i);
        return _isWordChar(prev) || prev == ')' || prev == ']';
    }

    private static int _skipBlanks(String code, int from, boolean crossLines) {
        int i = from;
        while (i < code.length()) {
            char c = code.charAt(i);
            if (c == ' ' || c == '\t' || (crossLines && (c == '\n' || c == '\r'))) {
                i++;
            } else {
                break;
            }
        }
        return i;
    }

    // ---------------------------------------------------------------- masking

    private static String _mask(String text, List<String> masked) {
        StringBuilder out = new StringBuilder(text.length());
        boolean lineStart = true;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            int end = -1;
            if (c == '#' && lineStart) {
                end = _preprocessorEnd(text, i);
            } else if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '/') {
                end = text.indexOf('\n', i);
                end = end < 0 ? text.length() : end;
            } else if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '*') {
                int close = text.indexOf("*/", i + 2);
                end = close < 0 ? text.length() : close + 2;
            } else if (c == '"' || c == '\'') {
                end = _quotedEnd(text, i);
            }

            if (end > i) {
                out.append(MASK_START).append(masked.size()).append(MASK_END);
                masked.add(text.substring(i, end));
                i = end;
                lineStart = false;
                continue;
            }
            if (c == '\n') {
                lineStart = true;
            } else if (!Character.isWhitespace(c)) {
                lineStart = false;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    private static int _preprocessorEnd(String text, int from) {
        int i = from;
        while (i < text.length()) {
            int newline = text.indexOf('\n', i);
            if (newline < 0) {
                return text.length();
            }
            String line = text.substring(i, newline).stripTrailing();
            if (!line.endsWith("\\")) {
                return newline;
            }
            i = newline + 1;
        }
        return text.length();
    }

    private static int _quotedEnd(String text, int from) {
        char quote = text.charAt(from);
        int i = from + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            // a backslash before a line break continues the literal
            if (c == '\\' && i + 1 < text.length()) {
                i += 2;
                continue;
            }
            if (c == '\n') {
                return i;
            }
            i++;
            if (c == quote) {
                return i;
            }
        }
        return i;
    }

    private static String _unmask(String code, List<String> masked) {
        if (masked.isEmpty()) {
            return code;
        }
        StringBuilder out = new StringBuilder(code.length() + 64);
        int i = 0;
        while (i < code.length()) {
            char c = code.charAt(i);
            if (c == MASK_START) {
                int close = code.indexOf(MASK_END, i);
                int index = Integer.parseInt(code.substring(i + 1, close));
                out.append(masked.get(index));
                i = close + 1;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    // ---------------------------------------------------------------- helpers

    private static String _operatorAt(String code, int at) {
        if (at >= code.length() || OPERATOR_CHARS.indexOf(code.charAt(at)) < 0) {
            return null;
        }
        for (String op : Lexer.operators()) {
            if (code.startsWith(op, at)) {
                return op;
            }
        }
        return null;
    }

    private static boolean _isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
