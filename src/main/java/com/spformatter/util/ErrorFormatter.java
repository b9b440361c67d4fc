package com.spformatter.util;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.spformatter.api.error.FormatterError;
import com.spformatter.api.error.Severity;
import com.spformatter.api.error.SyntaxError;

/**
 * Renders formatter errors and syntax errors for the terminal.
 */
public class ErrorFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_CYAN = "\u001B[36m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private static final String CONTEXT_MARKER = ">>> ";

    private final boolean useColors;

    /**
     * @param useColors whether to emit ANSI color codes
     */
    public ErrorFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    public String formatError(FormatterError error) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (error.getSeverity()) {
            case FATAL -> colorize(ANSI_RED, "FATAL");
            case ERROR -> colorize(ANSI_RED, "ERROR");
            case WARNING -> colorize(ANSI_YELLOW, "WARNING");
            case INFO -> colorize(ANSI_BLUE, "INFO");
        };

        sb.append(severityStr).append(": ");
        sb.append(error.getMessage());
        sb.append(" (").append(error.getLine()).append(':').append(error.getColumn()).append(')');

        if (error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(error.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * Formats a syntax error with its context window; the offending line is highlighted.
     */
    public String formatSyntaxError(SyntaxError error) {
        StringBuilder sb = new StringBuilder();
        String label = error.isMissing() ? "Missing" : "Error";
        sb.append(colorize(ANSI_RED, label)).append(' ')
                .append(colorize(ANSI_BOLD, error.getStartLine() + ":" + error.getStartColumn()))
                .append(" - ").append(error.getMessage());

        if (!error.getContext().isEmpty()) {
            for (String line : error.getContext().split("\n", -1)) {
                sb.append("\n    ");
                sb.append(line.contains(CONTEXT_MARKER) ? colorize(ANSI_YELLOW, line) : colorize(ANSI_CYAN, line));
            }
        }
        return sb.toString();
    }

    /**
     * Creates a per-file count of errors by severity.
     */
    public String formatErrorSummary(Map<Path, List<FormatterError>> fileErrors) {
        StringBuilder sb = new StringBuilder();

        sb.append(colorize(ANSI_BOLD, "Error Summary:\n"));

        long[] totals = new long[Severity.values().length];

        for (Map.Entry<Path, List<FormatterError>> entry : fileErrors.entrySet()) {
            List<FormatterError> errors = entry.getValue();
            if (errors.isEmpty()) {
                continue;
            }

            Map<Severity, Long> counts = errors.stream()
                    .collect(Collectors.groupingBy(FormatterError::getSeverity, Collectors.counting()));
            counts.forEach((severity, count) -> totals[severity.ordinal()] += count);

            sb.append(entry.getKey().getFileName()).append(": ")
                    .append(_joinCounts(counts.getOrDefault(Severity.FATAL, 0L),
                            counts.getOrDefault(Severity.ERROR, 0L),
                            counts.getOrDefault(Severity.WARNING, 0L),
                            counts.getOrDefault(Severity.INFO, 0L)))
                    .append('\n');
        }

        sb.append("\nTotal: ").append(_joinCounts(totals[Severity.FATAL.ordinal()],
                totals[Severity.ERROR.ordinal()],
                totals[Severity.WARNING.ordinal()],
                totals[Severity.INFO.ordinal()]));
        return sb.toString();
    }

    private String _joinCounts(long fatals, long errors, long warnings, long infos) {
        StringBuilder sb = new StringBuilder();
        if (fatals > 0) {
            sb.append(colorize(ANSI_RED, fatals + " fatal")).append(", ");
        }
        if (errors > 0) {
            sb.append(colorize(ANSI_RED, errors + " errors")).append(", ");
        }
        if (warnings > 0) {
            sb.append(colorize(ANSI_YELLOW, warnings + " warnings")).append(", ");
        }
        if (infos > 0) {
            sb.append(colorize(ANSI_BLUE, infos + " info")).append(", ");
        }
        if (sb.length() >= 2) {
            sb.setLength(sb.length() - 2);
        } else {
            sb.append("no issues");
        }
        return sb.toString();
    }

    public Map<Severity, List<FormatterError>> groupBySeverity(List<FormatterError> errors) {
        return errors.stream().collect(Collectors.groupingBy(FormatterError::getSeverity));
    }

    /**
     * Applies ANSI color to text if colors are enabled.
     */
    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }
}
