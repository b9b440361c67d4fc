package com.spformatter.syntax;

/**
 * The grammar could not produce a tree at all. Distinct from a tree that contains errors.
 */
public class ParseFailureException extends RuntimeException {

    public ParseFailureException(String message) {
        super(message);
    }

    public ParseFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
