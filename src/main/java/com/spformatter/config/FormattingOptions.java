package com.spformatter.config;

/**
 * Immutable formatting options for one formatter instance.
 */
public final class FormattingOptions {
    private final int indentSize;
    private final boolean useTabs;
    private final boolean spaceAfterComma;
    private final boolean spaceAroundOperators;
    private final boolean spaceBeforeOpenParen;
    private final boolean spaceAfterSemicolon;
    private final boolean spaceInArrayBrackets;
    private final boolean newLineAfterOpenBrace;
    private final int maxLineLength;
    private final boolean preserveEmptyLines;
    private final int maxConsecutiveEmptyLines;
    private final boolean sortIncludes;
    private final boolean newLineAfterIncludes;
    private final int linesBetweenFunctions;
    private final boolean requireSemicolons;
    private final boolean removeOptionalSemicolons;
    private final String lineEnding;

    private FormattingOptions(Builder builder) {
        this.indentSize = builder.indentSize;
        this.useTabs = builder.useTabs;
        this.spaceAfterComma = builder.spaceAfterComma;
        this.spaceAroundOperators = builder.spaceAroundOperators;
        this.spaceBeforeOpenParen = builder.spaceBeforeOpenParen;
        this.spaceAfterSemicolon = builder.spaceAfterSemicolon;
        this.spaceInArrayBrackets = builder.spaceInArrayBrackets;
        this.newLineAfterOpenBrace = builder.newLineAfterOpenBrace;
        this.maxLineLength = builder.maxLineLength;
        this.preserveEmptyLines = builder.preserveEmptyLines;
        this.maxConsecutiveEmptyLines = builder.maxConsecutiveEmptyLines;
        this.sortIncludes = builder.sortIncludes;
        this.newLineAfterIncludes = builder.newLineAfterIncludes;
        this.linesBetweenFunctions = builder.linesBetweenFunctions;
        this.requireSemicolons = builder.requireSemicolons;
        this.removeOptionalSemicolons = builder.removeOptionalSemicolons;
        this.lineEnding = builder.lineEnding;
    }

    public static FormattingOptions defaults() {
        return new Builder().build();
    }

    /**
     * Maps the configuration sections onto options. Missing keys keep their defaults.
     */
    public static FormattingOptions fromConfig(FormatterConfig config) {
        FormattingOptions d = defaults();
        return new Builder()
                .indentSize(config.getGeneralConfig("indentSize", d.indentSize))
                .useTabs(config.getGeneralConfig("useTabs", d.useTabs))
                .maxLineLength(config.getGeneralConfig("maxLineLength", d.maxLineLength))
                .lineEnding(_resolveLineEnding(config.getGeneralConfig("lineEnding", "lf")))
                .spaceAfterComma(config.getSectionConfig(FormatterConfig.SPACING, "spaceAfterComma", d.spaceAfterComma))
                .spaceAroundOperators(config.getSectionConfig(FormatterConfig.SPACING, "spaceAroundOperators",
                        d.spaceAroundOperators))
                .spaceBeforeOpenParen(config.getSectionConfig(FormatterConfig.SPACING, "spaceBeforeOpenParen",
                        d.spaceBeforeOpenParen))
                .spaceAfterSemicolon(config.getSectionConfig(FormatterConfig.SPACING, "spaceAfterSemicolon",
                        d.spaceAfterSemicolon))
                .spaceInArrayBrackets(config.getSectionConfig(FormatterConfig.SPACING, "spaceInArrayBrackets",
                        d.spaceInArrayBrackets))
                .newLineAfterOpenBrace(config.getSectionConfig(FormatterConfig.BRACES, "newLineAfterOpenBrace",
                        d.newLineAfterOpenBrace))
                .preserveEmptyLines(config.getSectionConfig(FormatterConfig.BLANK_LINES, "preserveEmptyLines",
                        d.preserveEmptyLines))
                .maxConsecutiveEmptyLines(config.getSectionConfig(FormatterConfig.BLANK_LINES,
                        "maxConsecutiveEmptyLines", d.maxConsecutiveEmptyLines))
                .linesBetweenFunctions(config.getSectionConfig(FormatterConfig.BLANK_LINES, "linesBetweenFunctions",
                        d.linesBetweenFunctions))
                .sortIncludes(config.getSectionConfig(FormatterConfig.INCLUDES, "sortIncludes", d.sortIncludes))
                .newLineAfterIncludes(config.getSectionConfig(FormatterConfig.INCLUDES, "newLineAfterIncludes",
                        d.newLineAfterIncludes))
                .requireSemicolons(config.getSectionConfig(FormatterConfig.SEMICOLONS, "requireSemicolons",
                        d.requireSemicolons))
                .removeOptionalSemicolons(config.getSectionConfig(FormatterConfig.SEMICOLONS,
                        "removeOptionalSemicolons", d.removeOptionalSemicolons))
                .build();
    }

    private static String _resolveLineEnding(String name) {
        switch (name.toLowerCase()) {
            case "crlf":
                return "\r\n";
            case "cr":
                return "\r";
            case "system":
                return System.lineSeparator();
            default:
                return "\n";
        }
    }

    /**
     * One indentation unit.
     */
    public String indentUnit() {
        return useTabs ? "\t" : " ".repeat(indentSize);
    }

    public String indent(int level) {
        return level <= 0 ? "" : indentUnit().repeat(level);
    }

    public int getIndentSize() { return indentSize; }
    public boolean isUseTabs() { return useTabs; }
    public boolean isSpaceAfterComma() { return spaceAfterComma; }
    public boolean isSpaceAroundOperators() { return spaceAroundOperators; }
    public boolean isSpaceBeforeOpenParen() { return spaceBeforeOpenParen; }
    public boolean isSpaceAfterSemicolon() { return spaceAfterSemicolon; }
    public boolean isSpaceInArrayBrackets() { return spaceInArrayBrackets; }
    public boolean isNewLineAfterOpenBrace() { return newLineAfterOpenBrace; }
    public int getMaxLineLength() { return maxLineLength; }
    public boolean isPreserveEmptyLines() { return preserveEmptyLines; }
    public int getMaxConsecutiveEmptyLines() { return maxConsecutiveEmptyLines; }
    public boolean isSortIncludes() { return sortIncludes; }
    public boolean isNewLineAfterIncludes() { return newLineAfterIncludes; }
    public int getLinesBetweenFunctions() { return linesBetweenFunctions; }
    public boolean isRequireSemicolons() { return requireSemicolons; }
    public boolean isRemoveOptionalSemicolons() { return removeOptionalSemicolons; }
    public String getLineEnding() { return lineEnding; }

    public Builder toBuilder() {
        return new Builder()
                .indentSize(indentSize)
                .useTabs(useTabs)
                .spaceAfterComma(spaceAfterComma)
                .spaceAroundOperators(spaceAroundOperators)
                .spaceBeforeOpenParen(spaceBeforeOpenParen)
                .spaceAfterSemicolon(spaceAfterSemicolon)
                .spaceInArrayBrackets(spaceInArrayBrackets)
                .newLineAfterOpenBrace(newLineAfterOpenBrace)
                .maxLineLength(maxLineLength)
                .preserveEmptyLines(preserveEmptyLines)
                .maxConsecutiveEmptyLines(maxConsecutiveEmptyLines)
                .sortIncludes(sortIncludes)
                .newLineAfterIncludes(newLineAfterIncludes)
                .linesBetweenFunctions(linesBetweenFunctions)
                .requireSemicolons(requireSemicolons)
                .removeOptionalSemicolons(removeOptionalSemicolons)
                .lineEnding(lineEnding);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int indentSize = 4;
        private boolean useTabs = false;
        private boolean spaceAfterComma = true;
        private boolean spaceAroundOperators = true;
        private boolean spaceBeforeOpenParen = false;
        private boolean spaceAfterSemicolon = true;
        private boolean spaceInArrayBrackets = false;
        private boolean newLineAfterOpenBrace = true;
        private int maxLineLength = 120;
        private boolean preserveEmptyLines = true;
        private int maxConsecutiveEmptyLines = 2;
        private boolean sortIncludes = false;
        private boolean newLineAfterIncludes = true;
        private int linesBetweenFunctions = 1;
        private boolean requireSemicolons = true;
        private boolean removeOptionalSemicolons = false;
        private String lineEnding = "\n";

        public Builder indentSize(int indentSize) { this.indentSize = indentSize; return this; }
        public Builder useTabs(boolean useTabs) { this.useTabs = useTabs; return this; }
        public Builder spaceAfterComma(boolean v) { this.spaceAfterComma = v; return this; }
        public Builder spaceAroundOperators(boolean v) { this.spaceAroundOperators = v; return this; }
        public Builder spaceBeforeOpenParen(boolean v) { this.spaceBeforeOpenParen = v; return this; }
        public Builder spaceAfterSemicolon(boolean v) { this.spaceAfterSemicolon = v; return this; }
        public Builder spaceInArrayBrackets(boolean v) { this.spaceInArrayBrackets = v; return this; }
        public Builder newLineAfterOpenBrace(boolean v) { this.newLineAfterOpenBrace = v; return this; }
        public Builder maxLineLength(int v) { this.maxLineLength = v; return this; }
        public Builder preserveEmptyLines(boolean v) { this.preserveEmptyLines = v; return this; }
        public Builder maxConsecutiveEmptyLines(int v) { this.maxConsecutiveEmptyLines = v; return this; }
        public Builder sortIncludes(boolean v) { this.sortIncludes = v; return this; }
        public Builder newLineAfterIncludes(boolean v) { this.newLineAfterIncludes = v; return this; }
        public Builder linesBetweenFunctions(int v) { this.linesBetweenFunctions = v; return this; }
        public Builder requireSemicolons(boolean v) { this.requireSemicolons = v; return this; }
        public Builder removeOptionalSemicolons(boolean v) { this.removeOptionalSemicolons = v; return this; }

        public Builder lineEnding(String lineEnding) {
            if (lineEnding == null || lineEnding.isEmpty()) {
                throw new IllegalArgumentException("lineEnding must not be empty");
            }
            this.lineEnding = lineEnding;
            return this;
        }

        public FormattingOptions build() {
            if (indentSize < 1) {
                throw new IllegalArgumentException("indentSize must be positive: " + indentSize);
            }
            if (maxConsecutiveEmptyLines < 0 || linesBetweenFunctions < 0) {
                throw new IllegalArgumentException("Blank line counts must not be negative");
            }
            return new FormattingOptions(this);
        }
    }
}
