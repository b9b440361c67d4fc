package com.spformatter.plugins.sourcepawn.render;

import java.util.List;
import java.util.Set;

import com.spformatter.config.FormattingOptions;
import com.spformatter.plugins.sourcepawn.parser.Lexer;
import com.spformatter.plugins.sourcepawn.spacing.OperatorSpacingNormalizer;

/**
 * Joins rendered pieces with heuristic spacing. Used for constructs without a dedicated
 * rendering rule and for token runs rebuilt from error nodes.
 */
public class TokenJoiner {
    private static final Set<String> PAREN_KEYWORDS = Set.of(
            "if", "for", "while", "switch", "return", "case", "else", "do", "delete");
    private static final Set<String> CONTROL_KEYWORDS = Set.of("if", "for", "while", "switch");
    private static final Set<String> PREFIX_OPERATORS = Set.of("!", "~");
    private static final Set<String> INCREMENTS = Set.of("++", "--");
    private static final Set<String> SIGNS = Set.of("-", "+");
    private static final Set<String> OPERAND_KEYWORDS = Set.of("return", "case");

    private final FormattingOptions options;
    private final OperatorSpacingNormalizer normalizer;

    public TokenJoiner(FormattingOptions options, OperatorSpacingNormalizer normalizer) {
        this.options = options;
        this.normalizer = normalizer;
    }

    public String join(List<String> pieces) {
        StringBuilder out = new StringBuilder();
        boolean inTernary = false;
        String prev = null;
        String beforePrev = null;
        for (String piece : pieces) {
            if (piece == null || piece.isEmpty()) {
                continue;
            }
            if (prev != null) {
                out.append(_separator(beforePrev, prev, piece, inTernary));
            }
            if (piece.equals("?")) {
                inTernary = true;
            }
            out.append(piece);
            beforePrev = prev;
            prev = piece;
        }
        return normalizer.normalize(out.toString());
    }

    private String _separator(String beforePrev, String prev, String cur, boolean inTernary) {
        // "=" after an operator piece re-forms a split operator such as "==" or "+="
        if (cur.equals("=") && _isOperator(prev) && Lexer.operators().contains(prev + cur)) {
            return "";
        }
        if (PREFIX_OPERATORS.contains(prev)) {
            return "";
        }
        if (INCREMENTS.contains(prev) && !_isOperand(beforePrev)) {
            return "";
        }
        if (INCREMENTS.contains(cur) && _endsOperand(prev)) {
            return "";
        }
        if (SIGNS.contains(prev) && _isUnarySign(beforePrev)) {
            return "";
        }
        if (cur.startsWith("[") || cur.equals("]") || prev.endsWith("[")) {
            return "";
        }
        if (prev.endsWith("(") || cur.equals(")")) {
            return "";
        }
        if (cur.equals("<") || cur.equals(">") || prev.equals("<") || prev.equals(">")) {
            return "";
        }
        if (cur.equals("(")) {
            if (CONTROL_KEYWORDS.contains(prev)) {
                return options.isSpaceBeforeOpenParen() ? " " : "";
            }
            if (prev.equals(",")) {
                return options.isSpaceAfterComma() ? " " : "";
            }
            boolean afterOperator = _isOperator(prev) && !prev.equals(")") && !prev.equals("]");
            return PAREN_KEYWORDS.contains(prev) || afterOperator ? " " : "";
        }
        if (cur.equals(".") || cur.equals("::") || prev.equals(".") || prev.equals("::")) {
            return "";
        }
        if (cur.equals(";") || cur.equals(",")) {
            return "";
        }
        if (prev.equals(",")) {
            return options.isSpaceAfterComma() ? " " : "";
        }
        if (cur.equals("?") || prev.equals("?")) {
            return " ";
        }
        if (cur.equals(":") || prev.equals(":")) {
            // old-style tags such as Float:x stay glued outside a ternary
            return inTernary ? " " : "";
        }
        return " ";
    }

    private static boolean _isUnarySign(String beforeSign) {
        if (beforeSign == null) {
            return true;
        }
        if (OPERAND_KEYWORDS.contains(beforeSign)) {
            return true;
        }
        if (INCREMENTS.contains(beforeSign)) {
            return false;
        }
        return !_endsOperand(beforeSign);
    }

    private static boolean _isOperand(String piece) {
        return piece != null && _endsOperand(piece);
    }

    private static boolean _endsOperand(String piece) {
        char last = piece.charAt(piece.length() - 1);
        return Character.isLetterOrDigit(last) || last == '_' || last == ')' || last == ']'
                || last == '"' || last == '\'';
    }

    private static boolean _isOperator(String piece) {
        return Lexer.operators().contains(piece);
    }
}
