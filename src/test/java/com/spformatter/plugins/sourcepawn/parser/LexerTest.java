package com.spformatter.plugins.sourcepawn.parser;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

class LexerTest {

    private static List<String> texts(String source) {
        return new Lexer(source).tokenize().stream()
                .filter(t -> !t.isEof())
                .map(Token::getText)
                .collect(Collectors.toList());
    }

    @Test
    void testLongestOperatorWins() {
        assertThat(texts("a>>>=b<<=c==d")).containsExactly("a", ">>>=", "b", "<<=", "c", "==", "d");
        assertThat(texts("i++ + ++j")).containsExactly("i", "++", "+", "++", "j");
    }

    @Test
    void testLastTokenIsEof() {
        List<Token> tokens = new Lexer("x").tokenize();
        assertThat(tokens).hasSize(2);
        assertThat(tokens.get(1).isEof()).isTrue();
        assertThat(new Lexer("").tokenize()).singleElement().matches(Token::isEof);
    }

    @Test
    void testCommentsAndPreprocessorAreSingleTokens() {
        List<Token> tokens = new Lexer("#include <sourcemod>\nint x; // trailing\n/* block\n comment */").tokenize();
        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.PREPROCESSOR);
        assertThat(tokens.get(0).getText()).isEqualTo("#include <sourcemod>");
        assertThat(tokens.get(4).getType()).isEqualTo(TokenType.COMMENT);
        assertThat(tokens.get(4).getText()).isEqualTo("// trailing");
        assertThat(tokens.get(5).getType()).isEqualTo(TokenType.COMMENT);
        assertThat(tokens.get(5).getText()).isEqualTo("/* block\n comment */");
    }

    @Test
    void testHashInsideLineIsNotPreprocessor() {
        List<Token> tokens = new Lexer("x # y").tokenize();
        assertThat(tokens.get(1).getType()).isEqualTo(TokenType.UNKNOWN);
    }

    @Test
    void testPreprocessorLineContinuation() {
        List<Token> tokens = new Lexer("#define MAX(%1) \\\n  (%1 * 2)\nint y;").tokenize();
        assertThat(tokens.get(0).getText()).isEqualTo("#define MAX(%1) \\\n  (%1 * 2)");
        assertThat(tokens.get(1).getText()).isEqualTo("int");
    }

    @Test
    void testStringsKeepEscapesAndOperators() {
        List<Token> tokens = new Lexer("Format(\"a+b \\\"q\\\"\", 'c')").tokenize();
        assertThat(tokens.get(2).getType()).isEqualTo(TokenType.STRING);
        assertThat(tokens.get(2).getText()).isEqualTo("\"a+b \\\"q\\\"\"");
        assertThat(tokens.get(4).getType()).isEqualTo(TokenType.CHAR);
    }

    @Test
    void testNumbers() {
        assertThat(texts("0xFF 1.5 2e-3 1_000")).containsExactly("0xFF", "1.5", "2e-3", "1_000");
    }

    @Test
    void testNewlineFlag() {
        List<Token> tokens = new Lexer("a b\nc").tokenize();
        assertThat(tokens.get(0).isNewlineBefore()).isTrue();
        assertThat(tokens.get(1).isNewlineBefore()).isFalse();
        assertThat(tokens.get(2).isNewlineBefore()).isTrue();
    }

    @Test
    void testTokenSpans() {
        Token token = new Lexer("  foo").tokenize().get(0);
        assertThat(token.getStart()).isEqualTo(2);
        assertThat(token.getEnd()).isEqualTo(5);
        assertThat(token.is("foo")).isTrue();
    }

    @Test
    void testUnterminatedStringStopsAtLineEnd() {
        List<Token> tokens = new Lexer("x = \"abc;\nint y;").tokenize();
        assertThat(tokens.get(2).getType()).isEqualTo(TokenType.STRING);
        assertThat(tokens.get(2).getText()).isEqualTo("\"abc;");
        assertThat(tokens.get(2).isTerminated()).isFalse();
        assertThat(tokens.get(3).getText()).isEqualTo("int");
        assertThat(tokens.get(3).isNewlineBefore()).isTrue();
    }

    @Test
    void testUnterminatedCharAtEndOfInput() {
        List<Token> tokens = new Lexer("'a").tokenize();
        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.CHAR);
        assertThat(tokens.get(0).isTerminated()).isFalse();
    }

    @Test
    void testBackslashNewlineContinuesString() {
        List<Token> tokens = new Lexer("s = \"abc\\\ndef\" + t").tokenize();
        assertThat(tokens.get(2).getText()).isEqualTo("\"abc\\\ndef\"");
        assertThat(tokens.get(2).isTerminated()).isTrue();
        assertThat(tokens.get(3).getText()).isEqualTo("+");
        assertThat(new Lexer("\"abc\\\r\ndef\"").tokenize().get(0).isTerminated()).isTrue();
    }
}
