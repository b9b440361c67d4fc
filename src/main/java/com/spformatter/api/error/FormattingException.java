package com.spformatter.api.error;

import java.util.List;

/**
 * No formatting strategy could produce output. Carries the syntax errors of the input.
 */
public class FormattingException extends RuntimeException {
    private final List<SyntaxError> syntaxErrors;

    public FormattingException(String message, List<SyntaxError> syntaxErrors) {
        super(message);
        this.syntaxErrors = List.copyOf(syntaxErrors);
    }

    public List<SyntaxError> getSyntaxErrors() {
        return syntaxErrors;
    }
}
