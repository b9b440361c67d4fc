package com.spformatter.api;

import java.util.ArrayList;
import java.util.List;

import com.spformatter.api.error.FormatterError;
import com.spformatter.api.error.Severity;

/**
 * Result of formatting one file.
 */
public class FormatterResult {
    private final boolean successful;
    private final String formattedCode;
    private final List<FormatterError> errors;
    private final boolean recovered;

    private FormatterResult(Builder builder) {
        this.successful = builder.successful;
        this.formattedCode = builder.formattedCode;
        this.errors = List.copyOf(builder.errors);
        this.recovered = builder.recovered;
    }

    public boolean isSuccessful() {
        return successful;
    }

    public String getFormattedCode() {
        return formattedCode;
    }

    public List<FormatterError> getErrors() {
        return errors;
    }

    /**
     * True when the output was produced from a malformed parse.
     */
    public boolean isRecovered() {
        return recovered;
    }

    public boolean hasErrorsAtLeast(Severity severity) {
        return errors.stream().anyMatch(e -> e.getSeverity().ordinal() <= severity.ordinal());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean successful;
        private String formattedCode;
        private List<FormatterError> errors = new ArrayList<>();
        private boolean recovered;

        public Builder successful(boolean successful) {
            this.successful = successful;
            return this;
        }

        public Builder formattedCode(String formattedCode) {
            this.formattedCode = formattedCode;
            return this;
        }

        public Builder addError(FormatterError error) {
            this.errors.add(error);
            return this;
        }

        public Builder errors(List<FormatterError> errors) {
            this.errors = new ArrayList<>(errors);
            return this;
        }

        public Builder recovered(boolean recovered) {
            this.recovered = recovered;
            return this;
        }

        public FormatterResult build() {
            return new FormatterResult(this);
        }
    }
}
