package com.spformatter.plugins.sourcepawn.recovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.spformatter.config.FormattingOptions;
import com.spformatter.plugins.sourcepawn.parser.SourcePawnParser;
import com.spformatter.plugins.sourcepawn.render.Renderer;
import com.spformatter.syntax.SyntaxNode;
import com.spformatter.syntax.SyntaxTree;

class MisclassificationRecoveryTest {

    private SourcePawnParser parser;
    private Renderer renderer;
    private MisclassificationRecovery recovery;

    @BeforeEach
    void setUp() {
        parser = new SourcePawnParser();
        renderer = new Renderer(FormattingOptions.defaults());
        recovery = new MisclassificationRecovery(renderer);
    }

    @AfterEach
    void tearDown() {
        parser.close();
    }

    private String render(String source) {
        try (SyntaxTree tree = parser.parse(source)) {
            return renderer.renderDocument(tree.getRoot());
        }
    }

    private SyntaxNode firstItem(SyntaxTree tree) {
        return tree.getRoot().getChild(0);
    }

    @Test
    void testDetectsMisplacedControlStatement() {
        try (SyntaxTree tree = parser.parse("if(x>0){y();}")) {
            assertThat(recovery.isMisclassified(firstItem(tree))).isTrue();
        }
    }

    @Test
    void testGenuineFunctionIsNotMisclassified() {
        try (SyntaxTree tree = parser.parse("void F()\n{\n}")) {
            SyntaxNode function = firstItem(tree);
            assertThat(recovery.isMisclassified(function)).isFalse();
            assertThat(recovery.renderMisclassified(function, 0)).isEmpty();
        }
    }

    @Test
    void testDetectsCallShape() {
        try (SyntaxTree tree = parser.parse("Foo(GetClientTeam(client), 100);")) {
            assertThat(MisclassificationRecovery.isCallShape(firstItem(tree))).isTrue();
        }
    }

    @Test
    void testRebuildsIfStatement() {
        assertThat(render("if(x>0){y();}")).isEqualTo("if(x > 0)\n{\n    y();\n}");
    }

    @Test
    void testRebuildsIfElse() {
        assertThat(render("if(a){b();}else{c();}")).isEqualTo("if(a)\n{\n    b();\n}\nelse\n{\n    c();\n}");
    }

    @Test
    void testRebuildsNestedCall() {
        assertThat(render("Foo(GetClientTeam(client), 100);")).isEqualTo("Foo(GetClientTeam(client), 100);");
    }

    @Test
    void testMergesPrefixIncrement() {
        assertThat(render("++i;")).isEqualTo("++i;");
    }

    @Test
    void testUnrecognisedErrorFailsTheRender() {
        try (SyntaxTree tree = parser.parse("}}}")) {
            SyntaxNode root = tree.getRoot();
            assertThatThrownBy(() -> renderer.renderDocument(root))
                    .isInstanceOf(RecoveryFailedException.class)
                    .hasMessageContaining("Syntax error at");
        }
    }

    @Test
    void testDetectsCallWithLiteralArguments() {
        try (SyntaxTree tree = parser.parse("Foo(1, \"two\");")) {
            SyntaxNode call = firstItem(tree);
            assertThat(MisclassificationRecovery.isDeclaredCallShape(call)).isTrue();
            assertThat(recovery.isMisclassified(call)).isTrue();
        }
    }

    @Test
    void testPrototypeIsNotACall() {
        try (SyntaxTree tree = parser.parse("Foo(int a, int b);")) {
            assertThat(MisclassificationRecovery.isDeclaredCallShape(firstItem(tree))).isFalse();
        }
    }

    @Test
    void testRebuildsCallWithLiteralArguments() {
        assertThat(render("Foo(1,\"two\");")).isEqualTo("Foo(1, \"two\");");
    }

    @Test
    void testCallBetweenStatementsIsRebuilt() {
        assertThat(render("if(a){b();}\nfoo(1,2);")).isEqualTo("if(a)\n{\n    b();\n}\nfoo(1, 2);");
    }

    @Test
    void testSyntaxErrorNamesTheOffendingText() {
        try (SyntaxTree tree = parser.parse("}}}")) {
            RecoveryFailedException failure = recovery.syntaxError(firstItem(tree));
            assertThat(failure).hasMessageStartingWith("Syntax error at '}'").hasMessageEndingWith("at 1:1)");
        }
    }
}
