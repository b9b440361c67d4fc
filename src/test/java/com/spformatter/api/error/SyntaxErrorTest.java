package com.spformatter.api.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SyntaxErrorTest {

    private static SyntaxError.Builder missingSemicolon() {
        return SyntaxError.builder()
                .message("Missing syntax element: expected ';'")
                .nodeKind(";")
                .start(1, 10)
                .end(1, 10)
                .byteRange(9, 9)
                .missing(true);
    }

    @Test
    void testToString() {
        assertThat(missingSemicolon().build().toString())
                .isEqualTo("[Missing] Line 1:10 - Missing syntax element: expected ';'");
        assertThat(missingSemicolon().missing(false).message("Syntax error at '}'").build().toString())
                .isEqualTo("[Error] Line 1:10 - Syntax error at '}'");
    }

    @Test
    void testDetailedDescription() {
        String description = missingSemicolon().context("001| >>> int x = 5\n").build().getDetailedDescription();

        assertThat(description).contains("Node Type: ;");
        assertThat(description).contains("Position: Line 1, Column 10 to Line 1, Column 10");
        assertThat(description).contains("Byte Range: 9 to 9");
        assertThat(description).endsWith("Context:\n001| >>> int x = 5\n");
    }

    @Test
    void testDetailedDescriptionWithoutContext() {
        assertThat(missingSemicolon().build().getDetailedDescription()).doesNotContain("Context:");
    }

    @Test
    void testFormatterErrorFromSyntaxError() {
        FormatterError error = FormatterError.fromSyntaxError(Severity.ERROR, missingSemicolon().build(), "Add it");

        assertThat(error.getSeverity()).isEqualTo(Severity.ERROR);
        assertThat(error.getLine()).isEqualTo(1);
        assertThat(error.getColumn()).isEqualTo(10);
        assertThat(error.getSuggestion()).isEqualTo("Add it");
    }
}
