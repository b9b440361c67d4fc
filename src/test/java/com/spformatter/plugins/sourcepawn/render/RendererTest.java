package com.spformatter.plugins.sourcepawn.render;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.spformatter.config.FormattingOptions;
import com.spformatter.plugins.sourcepawn.parser.SourcePawnParser;
import com.spformatter.syntax.NodeKind;
import com.spformatter.syntax.SyntaxTree;

class RendererTest {

    private SourcePawnParser parser;

    @BeforeEach
    void setUp() {
        parser = new SourcePawnParser();
    }

    @AfterEach
    void tearDown() {
        parser.close();
    }

    private String render(String source, Renderer renderer) {
        try (SyntaxTree tree = parser.parse(source)) {
            return renderer.renderDocument(tree.getRoot());
        }
    }

    private String render(String source, FormattingOptions options) {
        return render(source, new Renderer(options));
    }

    @Test
    void testForLoop() {
        String source = "void F()\n{\nfor(int i=0;i<10;i++){x++;}\n}";

        assertThat(render(source, FormattingOptions.defaults())).isEqualTo(
                "void F()\n{\n    for(int i = 0; i < 10; i++)\n    {\n        x++;\n    }\n}");
    }

    @Test
    void testElseIfChain() {
        String source = "void F()\n{\nif(a){b();}else if(c){d();}else{e();}\n}";

        assertThat(render(source, FormattingOptions.defaults())).isEqualTo(
                "void F()\n{\n"
                        + "    if(a)\n    {\n        b();\n    }\n"
                        + "    else if(c)\n    {\n        d();\n    }\n"
                        + "    else\n    {\n        e();\n    }\n"
                        + "}");
    }

    @Test
    void testSameLineBraces() {
        FormattingOptions options = FormattingOptions.builder().newLineAfterOpenBrace(false).build();

        assertThat(render("void F()\n{\nx();\n}", options)).isEqualTo("void F() {\n    x();\n}");
    }

    @Test
    void testTabIndentation() {
        FormattingOptions options = FormattingOptions.builder().useTabs(true).build();

        assertThat(render("void F()\n{\nx();\n}", options)).isEqualTo("void F()\n{\n\tx();\n}");
    }

    @Test
    void testSingleLineFunctionStaysCompact() {
        assertThat(render("void F() { x(); }", FormattingOptions.defaults())).isEqualTo("void F() { x(); }");
    }

    @Test
    void testTracerSeesRenderedNodes() {
        List<NodeKind> kinds = new ArrayList<>();
        List<String> statements = new ArrayList<>();
        Renderer renderer = new Renderer(FormattingOptions.defaults(), (node, indent, output) -> {
            kinds.add(node.getNodeKind());
            if (node.is(NodeKind.EXPRESSION_STATEMENT)) {
                statements.add(output);
            }
        });

        render("void F()\n{\nx();\n}", renderer);

        assertThat(kinds).contains(NodeKind.FUNCTION_DEFINITION, NodeKind.CALL_EXPRESSION);
        assertThat(statements).containsExactly("    x();");
    }

    @Test
    void testLoggingTracer() {
        Logger logger = Logger.getLogger("spformatter.render.test");
        logger.setUseParentHandlers(false);
        logger.setLevel(Level.FINEST);
        List<String> messages = new ArrayList<>();
        Handler handler = new Handler() {
            @Override
            public void publish(LogRecord record) {
                messages.add(record.getMessage());
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };
        logger.addHandler(handler);
        try {
            render("int g = 1;", new Renderer(FormattingOptions.defaults(), RenderTracer.logging(logger)));
        } finally {
            logger.removeHandler(handler);
        }

        assertThat(messages).anyMatch(message -> message.startsWith("global_variable_declaration [1:1] indent=0"));
    }

    @Test
    void testCommentsInsideMultiLineArrayLiteral() {
        String source = "int g[] = {\n1, // one\n/* two */\n2\n};";

        assertThat(render(source, FormattingOptions.defaults()))
                .contains("{\n    1, // one\n    /* two */\n    2\n};");
    }

    @Test
    void testCommentInEmptyArgumentList() {
        String source = "void F()\n{\n    foo(/* none */);\n}";

        assertThat(render(source, FormattingOptions.defaults())).isEqualTo(source);
    }

    @Test
    void testCommentTrailingParameter() {
        String source = "void F(int a /* first */, int b)\n{\n}";

        assertThat(render(source, FormattingOptions.defaults())).startsWith("void F(int a /* first */, int b)");
    }
}
