package com.spformatter.plugins.sourcepawn.diagnostics;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.spformatter.api.error.SyntaxError;
import com.spformatter.plugins.sourcepawn.parser.SourcePawnParser;
import com.spformatter.syntax.SyntaxTree;

class DiagnosticsCollectorTest {

    private SourcePawnParser parser;
    private DiagnosticsCollector collector;

    @BeforeEach
    void setUp() {
        parser = new SourcePawnParser();
        collector = new DiagnosticsCollector();
    }

    @AfterEach
    void tearDown() {
        parser.close();
    }

    private List<SyntaxError> collect(String source) {
        try (SyntaxTree tree = parser.parse(source)) {
            return collector.collectErrors(tree, source);
        }
    }

    @Test
    void testMissingSemicolon() {
        List<SyntaxError> errors = collect("int x = 5\nint y = 10;");

        assertThat(errors).hasSize(1);
        SyntaxError error = errors.get(0);
        assertThat(error.isMissing()).isTrue();
        assertThat(error.getStartLine()).isEqualTo(1);
        assertThat(error.getStartColumn()).isEqualTo(10);
        assertThat(error.getEndLine()).isEqualTo(1);
        assertThat(error.getStartByte()).isEqualTo(9);
        assertThat(error.getEndByte()).isEqualTo(9);
        assertThat(error.getMessage()).isEqualTo("Missing syntax element: expected ';'");
        assertThat(error.getContext()).isEqualTo("001| >>> int x = 5\n002|     int y = 10;\n");
    }

    @Test
    void testStrayBracesAreReportedInOrder() {
        List<SyntaxError> errors = collect("}}}");

        assertThat(errors).hasSize(3);
        assertThat(errors).allSatisfy(error -> {
            assertThat(error.isMissing()).isFalse();
            assertThat(error.getMessage()).isEqualTo("Syntax error at '}'");
        });
        assertThat(errors).extracting(SyntaxError::getStartColumn).containsExactly(1, 2, 3);
    }

    @Test
    void testCleanSourceHasNoErrors() {
        assertThat(collect("public void OnPluginStart()\n{\n    PrintToServer(\"hi\");\n}")).isEmpty();
    }

    @Test
    void testNullTree() {
        assertThat(collector.collectErrors(null, "")).isEmpty();
    }

    @Test
    void testContextWindow() {
        String[] lines = {"a", "b", "c", "d"};

        assertThat(DiagnosticsCollector.buildContext(lines, 0, 0)).isEqualTo("001| >>> a\n002|     b\n");
        assertThat(DiagnosticsCollector.buildContext(lines, 2, 2))
                .isEqualTo("002|     b\n003| >>> c\n004|     d\n");
    }
}
