package com.spformatter.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.spformatter.api.error.FormatterError;
import com.spformatter.api.error.Severity;
import com.spformatter.api.error.SyntaxError;

class ErrorFormatterTest {

    private final ErrorFormatter plain = new ErrorFormatter(false);

    @Test
    void testFormatError() {
        FormatterError error = new FormatterError(Severity.WARNING, "Source has syntax errors", 3, 7);

        assertThat(plain.formatError(error)).isEqualTo("WARNING: Source has syntax errors (3:7)");
    }

    @Test
    void testFormatErrorWithSuggestion() {
        FormatterError error = new FormatterError(Severity.ERROR, "Missing ';'", 1, 10, "Add a semicolon");

        assertThat(plain.formatError(error)).isEqualTo("ERROR: Missing ';' (1:10)\n  Suggestion: Add a semicolon");
    }

    @Test
    void testFormatSyntaxError() {
        SyntaxError error = SyntaxError.builder()
                .message("Missing syntax element: expected ';'")
                .start(1, 10)
                .missing(true)
                .context("001| >>> int x = 5\n002|     int y = 10;\n")
                .build();

        assertThat(plain.formatSyntaxError(error))
                .startsWith("Missing 1:10 - Missing syntax element: expected ';'")
                .contains("\n    001| >>> int x = 5")
                .contains("\n    002|     int y = 10;");
    }

    @Test
    void testColorize() {
        ErrorFormatter colored = new ErrorFormatter(true);

        assertThat(colored.colorize(ErrorFormatter.ANSI_RED, "x"))
                .isEqualTo(ErrorFormatter.ANSI_RED + "x" + ErrorFormatter.ANSI_RESET);
        assertThat(plain.colorize(ErrorFormatter.ANSI_RED, "x")).isEqualTo("x");
    }

    @Test
    void testErrorSummary() {
        Map<Path, List<FormatterError>> errors = new LinkedHashMap<>();
        errors.put(Path.of("a.sp"), List.of(
                new FormatterError(Severity.ERROR, "e1", 1, 1),
                new FormatterError(Severity.ERROR, "e2", 2, 1),
                new FormatterError(Severity.INFO, "i", 3, 1)));
        errors.put(Path.of("b.sp"), List.of());

        String summary = plain.formatErrorSummary(errors);

        assertThat(summary).contains("a.sp: 2 errors, 1 info");
        assertThat(summary).doesNotContain("b.sp");
        assertThat(summary).endsWith("Total: 2 errors, 1 info");
    }

    @Test
    void testEmptySummary() {
        assertThat(plain.formatErrorSummary(Map.of())).endsWith("Total: no issues");
    }

    @Test
    void testGroupBySeverity() {
        Map<Severity, List<FormatterError>> grouped = plain.groupBySeverity(List.of(
                new FormatterError(Severity.WARNING, "w", 1, 1),
                new FormatterError(Severity.INFO, "i", 1, 1),
                new FormatterError(Severity.INFO, "j", 1, 1)));

        assertThat(grouped.get(Severity.INFO)).hasSize(2);
        assertThat(grouped.get(Severity.WARNING)).hasSize(1);
    }
}
