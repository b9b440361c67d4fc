package com.spformatter.api.error;

/**
 * Represents a problem reported for one file.
 */
public class FormatterError {
    private final Severity severity;
    private final String message;
    private final int line;
    private final int column;
    private final String suggestion;

    public FormatterError(Severity severity, String message, int line, int column) {
        this(severity, message, line, column, null);
    }

    public FormatterError(Severity severity, String message, int line, int column, String suggestion) {
        this.severity = severity;
        this.message = message;
        this.line = line;
        this.column = column;
        this.suggestion = suggestion;
    }

    public static FormatterError fromSyntaxError(Severity severity, SyntaxError error, String suggestion) {
        return new FormatterError(severity, error.getMessage(), error.getStartLine(), error.getStartColumn(),
                suggestion);
    }

    // Getters
    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getSuggestion() { return suggestion; }
}
