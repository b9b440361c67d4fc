package com.spformatter.syntax;

/**
 * Result of one parse call. The tree must not outlive the formatting call that produced it.
 */
public final class SyntaxTree implements AutoCloseable {
    private final SourceText source;
    private final SyntaxNode root;
    private volatile boolean closed = false;

    public SyntaxTree(SourceText source, SyntaxNode root) {
        this.source = source;
        this.root = root;
    }

    public SyntaxNode getRoot() {
        ensureOpen();
        return root;
    }

    public String getSource() {
        ensureOpen();
        return source.getText();
    }

    public boolean hasError() {
        return getRoot().hasError();
    }

    public boolean isClosed() {
        return closed;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Syntax tree has been released");
        }
    }

    @Override
    public void close() {
        closed = true;
    }
}
