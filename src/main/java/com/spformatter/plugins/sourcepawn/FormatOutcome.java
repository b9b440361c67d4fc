package com.spformatter.plugins.sourcepawn;

import java.util.List;

import com.spformatter.api.error.SyntaxError;

/**
 * Formatted text together with the strategy that produced it and the syntax errors of the input.
 */
public final class FormatOutcome {

    public enum Strategy {
        DIRECT,
        RECOVERY,
        FRAGMENT
    }

    private final String text;
    private final Strategy strategy;
    private final List<SyntaxError> syntaxErrors;

    public FormatOutcome(String text, Strategy strategy, List<SyntaxError> syntaxErrors) {
        this.text = text;
        this.strategy = strategy;
        this.syntaxErrors = List.copyOf(syntaxErrors);
    }

    public String getText() {
        return text;
    }

    public Strategy getStrategy() {
        return strategy;
    }

    public List<SyntaxError> getSyntaxErrors() {
        return syntaxErrors;
    }

    /**
     * True when the text was rebuilt from a malformed parse.
     */
    public boolean isRecovered() {
        return strategy != Strategy.DIRECT;
    }
}
