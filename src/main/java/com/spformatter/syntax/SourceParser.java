package com.spformatter.syntax;

/**
 * Boundary to a grammar-based parser producing a concrete syntax tree.
 * Implementations are not required to be reentrant.
 */
public interface SourceParser extends AutoCloseable {

    /**
     * Parses the source text.
     *
     * @return the tree, or {@code null} for empty input. Malformed input still yields a
     *         tree with error and missing nodes.
     * @throws ParseFailureException when the grammar cannot produce any tree
     * @throws IllegalStateException when the parser has been closed
     */
    SyntaxTree parse(String source);

    @Override
    void close();
}
