package com.spformatter.api.error;

/**
 * A syntax error found in a parse tree. Lines and columns are 1-based.
 * Instances are immutable and only used for reporting.
 */
public final class SyntaxError {
    private final String message;
    private final String nodeKind;
    private final int startLine;
    private final int startColumn;
    private final int endLine;
    private final int endColumn;
    private final int startByte;
    private final int endByte;
    private final boolean missing;
    private final String context;

    private SyntaxError(Builder builder) {
        this.message = builder.message;
        this.nodeKind = builder.nodeKind;
        this.startLine = builder.startLine;
        this.startColumn = builder.startColumn;
        this.endLine = builder.endLine;
        this.endColumn = builder.endColumn;
        this.startByte = builder.startByte;
        this.endByte = builder.endByte;
        this.missing = builder.missing;
        this.context = builder.context;
    }

    public String getMessage() { return message; }
    public String getNodeKind() { return nodeKind; }
    public int getStartLine() { return startLine; }
    public int getStartColumn() { return startColumn; }
    public int getEndLine() { return endLine; }
    public int getEndColumn() { return endColumn; }
    public int getStartByte() { return startByte; }
    public int getEndByte() { return endByte; }
    public boolean isMissing() { return missing; }
    public String getContext() { return context; }

    public String getDetailedDescription() {
        StringBuilder sb = new StringBuilder();
        sb.append(this).append('\n');
        sb.append("Node Type: ").append(nodeKind).append('\n');
        sb.append("Position: Line ").append(startLine).append(", Column ").append(startColumn)
                .append(" to Line ").append(endLine).append(", Column ").append(endColumn).append('\n');
        sb.append("Byte Range: ").append(startByte).append(" to ").append(endByte).append('\n');
        if (context != null && !context.isEmpty()) {
            sb.append("Context:\n").append(context);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "[" + (missing ? "Missing" : "Error") + "] Line " + startLine + ":" + startColumn + " - " + message;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String message = "";
        private String nodeKind = "";
        private int startLine;
        private int startColumn;
        private int endLine;
        private int endColumn;
        private int startByte;
        private int endByte;
        private boolean missing;
        private String context = "";

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder nodeKind(String nodeKind) {
            this.nodeKind = nodeKind;
            return this;
        }

        public Builder start(int line, int column) {
            this.startLine = line;
            this.startColumn = column;
            return this;
        }

        public Builder end(int line, int column) {
            this.endLine = line;
            this.endColumn = column;
            return this;
        }

        public Builder byteRange(int startByte, int endByte) {
            this.startByte = startByte;
            this.endByte = endByte;
            return this;
        }

        public Builder missing(boolean missing) {
            this.missing = missing;
            return this;
        }

        public Builder context(String context) {
            this.context = context;
            return this;
        }

        public SyntaxError build() {
            return new SyntaxError(this);
        }
    }
}
