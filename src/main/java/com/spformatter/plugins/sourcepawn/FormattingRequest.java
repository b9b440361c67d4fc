package com.spformatter.plugins.sourcepawn;

import com.spformatter.syntax.SourceParser;
import com.spformatter.syntax.SyntaxTree;

/**
 * Input of one formatting call: the normalized source, its tree, and the parser for
 * strategies that need to parse derived text.
 */
public final class FormattingRequest {
    private final String source;
    private final SyntaxTree tree;
    private final SourceParser parser;

    public FormattingRequest(String source, SyntaxTree tree, SourceParser parser) {
        this.source = source;
        this.tree = tree;
        this.parser = parser;
    }

    public String getSource() {
        return source;
    }

    public SyntaxTree getTree() {
        return tree;
    }

    public SourceParser getParser() {
        return parser;
    }
}
