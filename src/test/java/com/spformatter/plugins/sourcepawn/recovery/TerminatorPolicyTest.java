package com.spformatter.plugins.sourcepawn.recovery;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.spformatter.plugins.sourcepawn.parser.SourcePawnParser;
import com.spformatter.syntax.SyntaxTree;

class TerminatorPolicyTest {

    private SourcePawnParser parser;

    @BeforeEach
    void setUp() {
        parser = new SourcePawnParser();
    }

    @AfterEach
    void tearDown() {
        parser.close();
    }

    @Test
    void testDropsAddedSemicolon() {
        try (SyntaxTree tree = parser.parse("x")) {
            assertThat(TerminatorPolicy.apply("x", tree.getRoot(), "x;")).isEqualTo("x");
        }
    }

    @Test
    void testKeepsSemicolonPresentInInput() {
        try (SyntaxTree tree = parser.parse("x;")) {
            assertThat(TerminatorPolicy.apply("x;", tree.getRoot(), "x;")).isEqualTo("x;");
        }
    }

    @Test
    void testKeepsFunctionOutput() {
        String source = "void F()\n{\n}";
        try (SyntaxTree tree = parser.parse(source)) {
            assertThat(TerminatorPolicy.isExpressionOnly(tree.getRoot())).isFalse();
            assertThat(TerminatorPolicy.apply(source, tree.getRoot(), "void F()\n{\n};")).isEqualTo("void F()\n{\n};");
        }
    }

    @Test
    void testWithoutTree() {
        assertThat(TerminatorPolicy.apply("x", null, "x;")).isEqualTo("x;");
    }

    @Test
    void testCommentOnlyIsNotAnExpression() {
        try (SyntaxTree tree = parser.parse("// note")) {
            assertThat(TerminatorPolicy.isExpressionOnly(tree.getRoot())).isFalse();
        }
    }

    @Test
    void testDropsAddedSemicolonBeforeTrailingComment() {
        String source = "foo(1) // c";
        try (SyntaxTree tree = parser.parse(source)) {
            assertThat(TerminatorPolicy.apply(source, tree.getRoot(), "foo(1); // c")).isEqualTo("foo(1) // c");
        }
    }

    @Test
    void testKeepsSemicolonFollowedByCommentInInput() {
        String source = "foo(1); // c";
        try (SyntaxTree tree = parser.parse(source)) {
            assertThat(TerminatorPolicy.apply(source, tree.getRoot(), "foo(1); // c")).isEqualTo("foo(1); // c");
        }
    }
}
