package com.spformatter.plugins.sourcepawn.recovery;

/**
 * Wrappers that embed a fragment into a complete file, tried in declaration order.
 */
public enum FragmentTemplate {
    /** The fragment as the value of a variable. */
    VARIABLE_INITIALIZER("int dummy = ", ";"),
    /** The fragment as statements inside a function body. */
    FUNCTION_STATEMENT("void dummy() { ", "; }"),
    /** The fragment as the argument list of a call. */
    CALL_ARGUMENT("void dummy() { func(", "); }");

    private final String prefix;
    private final String suffix;

    FragmentTemplate(String prefix, String suffix) {
        this.prefix = prefix;
        this.suffix = suffix;
    }

    public String wrap(String fragment) {
        return prefix + fragment + suffix;
    }

    /**
     * Offset of the fragment inside the wrapped text.
     */
    public int fragmentOffset() {
        return prefix.length();
    }
}
