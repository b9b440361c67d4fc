package com.spformatter.plugins.sourcepawn.parser;

public enum TokenType {
    IDENTIFIER,
    NUMBER,
    STRING,
    CHAR,
    COMMENT,
    PREPROCESSOR,
    OPERATOR,
    UNKNOWN,
    EOF
}
