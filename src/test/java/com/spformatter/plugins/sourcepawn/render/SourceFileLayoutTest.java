package com.spformatter.plugins.sourcepawn.render;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.spformatter.config.FormattingOptions;
import com.spformatter.plugins.sourcepawn.parser.SourcePawnParser;
import com.spformatter.syntax.SyntaxTree;

class SourceFileLayoutTest {

    private SourcePawnParser parser;

    @BeforeEach
    void setUp() {
        parser = new SourcePawnParser();
    }

    @AfterEach
    void tearDown() {
        parser.close();
    }

    private String layout(String source, FormattingOptions options) {
        try (SyntaxTree tree = parser.parse(source)) {
            return new Renderer(options).renderDocument(tree.getRoot());
        }
    }

    @Test
    void testCapBlankLines() {
        assertThat(SourceFileLayout.capBlankLines("a\n\n\n\n\nb", 2)).isEqualTo("a\n\n\nb");
        assertThat(SourceFileLayout.capBlankLines("a\n\nb", 0)).isEqualTo("a\nb");
    }

    @Test
    void testCapBlankLinesTrimsEdgesAndTrailingWhitespace() {
        assertThat(SourceFileLayout.capBlankLines("\n\nx;   \ny;\t\n\n", 2)).isEqualTo("x;\ny;");
    }

    @Test
    void testSectionsAreReordered() {
        String source = "public void A() {}\nint g = 1;\n#include <sourcemod>";

        assertThat(layout(source, FormattingOptions.defaults()))
                .isEqualTo("#include <sourcemod>\n\nint g = 1;\n\npublic void A() {}");
    }

    @Test
    void testBlankLinesBetweenDeclarationsAreCapped() {
        String source = "int a = 1;\n\n\n\n\n\nint b = 2;";

        assertThat(layout(source, FormattingOptions.defaults())).isEqualTo("int a = 1;\n\n\nint b = 2;");
    }

    @Test
    void testFunctionsAreSeparated() {
        String source = "void A()\n{\n}\nvoid B()\n{\n}";

        assertThat(layout(source, FormattingOptions.defaults())).isEqualTo("void A()\n{\n}\n\nvoid B()\n{\n}");
    }

    @Test
    void testSortedIncludes() {
        String source = "#include <sdktools>\n#include <clientprefs>\n#include <sourcemod>";
        FormattingOptions options = FormattingOptions.builder().sortIncludes(true).build();

        assertThat(layout(source, options))
                .isEqualTo("#include <clientprefs>\n#include <sdktools>\n#include <sourcemod>");
    }

    @Test
    void testIncludesKeepSourceOrderByDefault() {
        String source = "#include <sdktools>\n#include <clientprefs>";

        assertThat(layout(source, FormattingOptions.defaults())).isEqualTo(source);
    }

    @Test
    void testTrailingCommentStaysOnItsLine() {
        String source = "int g = 1; // counter";

        assertThat(layout(source, FormattingOptions.defaults())).isEqualTo("int g = 1; // counter");
    }
}
