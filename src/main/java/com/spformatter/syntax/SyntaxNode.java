package com.spformatter.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable concrete syntax tree node. A node's span covers the spans of its
 * children in source order; leaves own no children.
 */
public final class SyntaxNode {
    public static final String ERROR_KIND = "ERROR";

    private final SourceText source;
    private final String kind;
    private final NodeKind nodeKind;
    private final boolean named;
    private final boolean error;
    private final boolean missing;
    private final int startOffset;
    private final int endOffset;
    private final List<SyntaxNode> children;
    private final boolean hasError;

    private SyntaxNode(SourceText source, String kind, boolean named, boolean error, boolean missing,
                       int startOffset, int endOffset, List<SyntaxNode> children) {
        this.source = source;
        this.kind = kind;
        this.nodeKind = NodeKind.of(kind, named);
        this.named = named;
        this.error = error;
        this.missing = missing;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));

        boolean anyError = error || missing;
        for (SyntaxNode child : children) {
            anyError |= child.hasError;
        }
        this.hasError = anyError;
    }

    /**
     * Creates a leaf covering {@code [start, end)}.
     */
    public static SyntaxNode leaf(SourceText source, String kind, boolean named, int start, int end) {
        return new SyntaxNode(source, kind, named, false, false, start, end, List.of());
    }

    /**
     * Creates a zero-width placeholder for a required token the input lacks.
     */
    public static SyntaxNode missing(SourceText source, String kind, boolean named, int offset) {
        return new SyntaxNode(source, kind, named, false, true, offset, offset, List.of());
    }

    public static SyntaxNode branch(SourceText source, String kind, List<SyntaxNode> children, int fallbackOffset) {
        if (children.isEmpty()) {
            return new SyntaxNode(source, kind, true, false, false, fallbackOffset, fallbackOffset, children);
        }
        return new SyntaxNode(source, kind, true, false, false,
                _minStart(children), _maxEnd(children), children);
    }

    /**
     * Creates a branch with an explicit span, used for the root which covers the whole text.
     */
    public static SyntaxNode spanning(SourceText source, String kind, List<SyntaxNode> children, int start, int end) {
        return new SyntaxNode(source, kind, true, false, false, start, end, children);
    }

    public static SyntaxNode error(SourceText source, List<SyntaxNode> children, int fallbackOffset) {
        int start = children.isEmpty() ? fallbackOffset : _minStart(children);
        int end = children.isEmpty() ? fallbackOffset : _maxEnd(children);
        return new SyntaxNode(source, ERROR_KIND, true, true, false, start, end, children);
    }

    private static int _minStart(List<SyntaxNode> children) {
        int start = Integer.MAX_VALUE;
        for (SyntaxNode child : children) {
            start = Math.min(start, child.startOffset);
        }
        return start;
    }

    private static int _maxEnd(List<SyntaxNode> children) {
        int end = 0;
        for (SyntaxNode child : children) {
            end = Math.max(end, child.endOffset);
        }
        return end;
    }

    public String getKind() { return kind; }
    public NodeKind getNodeKind() { return nodeKind; }
    public boolean isNamed() { return named; }
    public boolean isError() { return error; }
    public boolean isMissing() { return missing; }
    public boolean hasError() { return hasError; }
    public List<SyntaxNode> getChildren() { return children; }
    public int getChildCount() { return children.size(); }
    public int getStartOffset() { return startOffset; }
    public int getEndOffset() { return endOffset; }

    public SyntaxNode getChild(int index) {
        return children.get(index);
    }

    public String getText() {
        return source.slice(startOffset, endOffset);
    }

    public Point getStartPoint() {
        return source.pointAt(startOffset);
    }

    public Point getEndPoint() {
        return source.pointAt(endOffset);
    }

    public int getStartByte() {
        return source.byteOffset(startOffset);
    }

    public int getEndByte() {
        return source.byteOffset(endOffset);
    }

    public boolean is(NodeKind candidate) {
        return nodeKind == candidate;
    }

    /**
     * True for an anonymous token with the given text, e.g. {@code "("} or {@code "else"}.
     */
    public boolean isToken(String text) {
        return !named && kind.equals(text);
    }

    public boolean isMultiLine() {
        return getText().indexOf('\n') >= 0;
    }

    public Optional<SyntaxNode> findChild(NodeKind candidate) {
        for (SyntaxNode child : children) {
            if (child.nodeKind == candidate) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    public List<SyntaxNode> findChildren(NodeKind candidate) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode child : children) {
            if (child.nodeKind == candidate) {
                result.add(child);
            }
        }
        return result;
    }

    public List<SyntaxNode> getNamedChildren() {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode child : children) {
            if (child.named) {
                result.add(child);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        String flag = error ? " (ERROR)" : missing ? " (MISSING)" : "";
        return kind + flag + " " + getStartPoint() + "-" + getEndPoint();
    }
}
