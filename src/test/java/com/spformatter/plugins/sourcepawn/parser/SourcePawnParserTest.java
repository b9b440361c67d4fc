package com.spformatter.plugins.sourcepawn.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.spformatter.syntax.NodeKind;
import com.spformatter.syntax.ParseFailureException;
import com.spformatter.syntax.SyntaxNode;
import com.spformatter.syntax.SyntaxTree;

class SourcePawnParserTest {
    private SourcePawnParser parser;

    @BeforeEach
    void setup() {
        parser = new SourcePawnParser();
    }

    @AfterEach
    void tearDown() {
        parser.close();
    }

    private static List<String> kinds(SyntaxNode node) {
        return node.getChildren().stream().map(SyntaxNode::getKind).collect(Collectors.toList());
    }

    @Test
    void testCleanPluginParsesWithoutErrors() {
        String source = "#include <sourcemod>\n"
                + "\n"
                + "int g_Count = 0;\n"
                + "\n"
                + "public void OnPluginStart()\n"
                + "{\n"
                + "    for (int i = 0; i < 10; i++)\n"
                + "    {\n"
                + "        g_Count += i;\n"
                + "    }\n"
                + "}\n";
        try (SyntaxTree tree = parser.parse(source)) {
            assertThat(tree.hasError()).isFalse();
            assertThat(kinds(tree.getRoot())).containsExactly(
                    "preproc_include", "global_variable_declaration", "function_definition");
            SyntaxNode function = tree.getRoot().getChild(2);
            SyntaxNode body = function.findChild(NodeKind.BLOCK).orElseThrow();
            assertThat(body.getChild(1).getNodeKind()).isEqualTo(NodeKind.FOR_STATEMENT);
        }
    }

    @Test
    void testEmptySourceYieldsNoTree() {
        assertThat(parser.parse("")).isNull();
        assertThat(parser.parse(null)).isNull();
    }

    @Test
    void testMissingTerminatorBeforeLineBreak() {
        try (SyntaxTree tree = parser.parse("int x = 5\nint y = 10;")) {
            SyntaxNode first = tree.getRoot().getChild(0);
            SyntaxNode terminator = first.getChild(first.getChildCount() - 1);
            assertThat(terminator.isMissing()).isTrue();
            assertThat(terminator.getKind()).isEqualTo(";");
            assertThat(terminator.getStartOffset()).isEqualTo(9);
            assertThat(tree.getRoot().getChild(1).hasError()).isFalse();
        }
    }

    @Test
    void testControlStatementAtFileScopeBecomesFunctionDefinition() {
        try (SyntaxTree tree = parser.parse("if(x>0){y();}")) {
            SyntaxNode node = tree.getRoot().getChild(0);
            assertThat(node.getNodeKind()).isEqualTo(NodeKind.FUNCTION_DEFINITION);
            assertThat(kinds(node)).containsExactly("identifier", "parameter_declarations", "block");
            SyntaxNode header = node.getChild(1);
            assertThat(header.getChild(1).isError()).isTrue();
            assertThat(header.getChild(1).getChild(0).getNodeKind()).isEqualTo(NodeKind.BINARY_EXPRESSION);
        }
    }

    @Test
    void testElseIfKeepsBothKeywords() {
        try (SyntaxTree tree = parser.parse("if(a){b();}else if(c){d();}")) {
            SyntaxNode elseIf = tree.getRoot().getChild(1);
            assertThat(elseIf.getChild(0).getText()).isEqualTo("else");
            assertThat(elseIf.getChild(1).getText()).isEqualTo("if");
        }
    }

    @Test
    void testCallAtFileScopeBecomesTruncatedDefinition() {
        try (SyntaxTree tree = parser.parse("Foo(GetClientTeam(client), 100);")) {
            SyntaxNode node = tree.getRoot().getChild(0);
            assertThat(node.getNodeKind()).isEqualTo(NodeKind.FUNCTION_DEFINITION);
            assertThat(kinds(node)).containsExactly("identifier", "parameter_declarations", "expression_statement");
            SyntaxNode params = node.getChild(1);
            assertThat(params.getChild(params.getChildCount() - 1).isMissing()).isTrue();
            assertThat(node.getChild(2).getChild(0).isError()).isTrue();
        }
    }

    @Test
    void testStrayTokensBecomeErrorNodes() {
        try (SyntaxTree tree = parser.parse("a+b")) {
            List<SyntaxNode> children = tree.getRoot().getChildren();
            assertThat(children.get(0).isError()).isTrue();
            assertThat(children.get(0).getText()).isEqualTo("a");
            assertThat(children.get(1).isError()).isTrue();
            assertThat(children.get(2).getNodeKind()).isEqualTo(NodeKind.OLD_GLOBAL_VARIABLE_DECLARATION);
        }
    }

    @Test
    void testCommentsStayInTree() {
        try (SyntaxTree tree = parser.parse("// header\nint x; // note\n")) {
            assertThat(kinds(tree.getRoot())).containsExactly("comment", "global_variable_declaration", "comment");
        }
    }

    @Test
    void testVerbatimDeclarations() {
        try (SyntaxTree tree = parser.parse("methodmap Foo < Handle {\n  public Foo() {}\n}\nint x;")) {
            assertThat(kinds(tree.getRoot())).containsExactly("methodmap", "global_variable_declaration");
        }
    }

    @Test
    void testOldStyleDeclarations() {
        try (SyntaxTree tree = parser.parse("new Float:g_Speed = 1.0;\nnew String:g_Name[32];")) {
            assertThat(tree.hasError()).isFalse();
            assertThat(kinds(tree.getRoot())).containsOnly("old_global_variable_declaration");
        }
    }

    @Test
    void testSwitchCases() {
        String source = "void f(int x)\n{\n    switch (x)\n    {\n        case 1, 2:\n            g();\n"
                + "        default:\n            h();\n    }\n}";
        try (SyntaxTree tree = parser.parse(source)) {
            assertThat(tree.hasError()).isFalse();
            SyntaxNode body = tree.getRoot().getChild(0).findChild(NodeKind.BLOCK).orElseThrow();
            SyntaxNode switchStatement = body.getChild(1);
            assertThat(switchStatement.findChildren(NodeKind.SWITCH_CASE)).hasSize(2);
        }
    }

    @Test
    void testParseCountAndClose() {
        parser.parse("int x;").close();
        parser.parse("int y;").close();
        assertThat(parser.getParseCount()).isEqualTo(2);

        parser.close();
        assertThat(parser.isClosed()).isTrue();
        assertThatThrownBy(() -> parser.parse("int z;"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testClosedTreeRejectsAccess() {
        SyntaxTree tree = parser.parse("int x;");
        tree.close();
        assertThat(tree.isClosed()).isTrue();
        assertThatThrownBy(tree::getRoot).isInstanceOf(IllegalStateException.class);
    }

    private static SyntaxNode find(SyntaxNode node, NodeKind kind) {
        if (node.is(kind)) {
            return node;
        }
        for (SyntaxNode child : node.getChildren()) {
            SyntaxNode found = find(child, kind);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    @Test
    void testUnterminatedStringBecomesErrorNode() {
        try (SyntaxTree tree = parser.parse("int x = \"abc;\nint y;")) {
            assertThat(tree.hasError()).isTrue();
            SyntaxNode error = find(tree.getRoot(), NodeKind.ERROR);
            assertThat(error).isNotNull();
            assertThat(kinds(error)).containsExactly("string_literal");
            assertThat(error.getText()).isEqualTo("\"abc;");
            assertThat(kinds(tree.getRoot()))
                    .containsExactly("global_variable_declaration", "global_variable_declaration");
        }
    }

    @Test
    void testDeepNestingFailsWithParseFailure() {
        String source = "void F()\n{\n" + "if(a){\n".repeat(300) + "}\n".repeat(300) + "}\n";

        assertThatThrownBy(() -> parser.parse(source))
                .isInstanceOf(ParseFailureException.class)
                .hasMessageContaining("nests deeper than " + SourcePawnGrammar.MAX_NESTING);
    }

    @Test
    void testDeepParenthesesFailWithParseFailure() {
        String source = "int x = " + "(".repeat(1000) + "1" + ")".repeat(1000) + ";";

        assertThatThrownBy(() -> parser.parse(source)).isInstanceOf(ParseFailureException.class);
    }

    @Test
    void testModerateNestingParses() {
        String source = "void F()\n{\n" + "if(a){\n".repeat(100) + "}\n".repeat(100) + "}\n";
        try (SyntaxTree tree = parser.parse(source)) {
            assertThat(tree.hasError()).isFalse();
        }
    }

    @Test
    void testCommentInsideArgumentsKeepsItsPosition() {
        try (SyntaxTree tree = parser.parse("void F()\n{\n    foo(/* unused */ 0, x);\n}\n")) {
            assertThat(tree.hasError()).isFalse();
            SyntaxNode body = tree.getRoot().getChild(0).findChild(NodeKind.BLOCK).orElseThrow();
            assertThat(kinds(body)).containsExactly("{", "expression_statement", "}");
            SyntaxNode arguments = find(body, NodeKind.CALL_ARGUMENTS);
            assertThat(kinds(arguments)).containsExactly("(", "comment", "number_literal", ",", "identifier", ")");
        }
    }

    @Test
    void testCommentInsideBinaryExpressionKeepsItsPosition() {
        try (SyntaxTree tree = parser.parse("int x = a + /* c */ b;")) {
            assertThat(kinds(tree.getRoot())).containsExactly("global_variable_declaration");
            SyntaxNode sum = find(tree.getRoot(), NodeKind.BINARY_EXPRESSION);
            assertThat(kinds(sum)).containsExactly("identifier", "+", "comment", "identifier");
        }
    }
}
