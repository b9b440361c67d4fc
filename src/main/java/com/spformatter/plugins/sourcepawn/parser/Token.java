package com.spformatter.plugins.sourcepawn.parser;

/**
 * A lexical token with its character span.
 */
public final class Token {
    private final TokenType type;
    private final String text;
    private final int start;
    private final int end;
    private final boolean newlineBefore;
    private final boolean terminated;

    public Token(TokenType type, String text, int start, int end, boolean newlineBefore) {
        this(type, text, start, end, newlineBefore, true);
    }

    public Token(TokenType type, String text, int start, int end, boolean newlineBefore, boolean terminated) {
        this.type = type;
        this.text = text;
        this.start = start;
        this.end = end;
        this.newlineBefore = newlineBefore;
        this.terminated = terminated;
    }

    public TokenType getType() { return type; }
    public String getText() { return text; }
    public int getStart() { return start; }
    public int getEnd() { return end; }

    /**
     * True when a line break separates this token from the previous one, or it is the first token.
     */
    public boolean isNewlineBefore() { return newlineBefore; }

    /**
     * False for a string or character literal that reached the end of its line without a closing quote.
     */
    public boolean isTerminated() { return terminated; }

    public boolean is(String value) {
        return (type == TokenType.OPERATOR || type == TokenType.IDENTIFIER) && text.equals(value);
    }

    public boolean isEof() {
        return type == TokenType.EOF;
    }

    @Override
    public String toString() {
        return type + "'" + text + "'@" + start;
    }
}
