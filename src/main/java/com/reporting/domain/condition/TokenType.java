package com.reporting.domain.condition;

/**
 * Token types for condition expressions.
 */
public enum TokenType {
    // Identifiers and literals
    IDENT,
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,

    // Delimiters
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    COMMA,

    // Logical operators
    AND,
    OR,
    NOT,

    // Comparison operators
    EQ,
    NE,
    GT,
    GTE,
    LT,
    LTE,

    // Collection operators
    IN,
    CONTAINS,

    // Existence operators
    EXISTS,
    IS_NULL,

    EOF
}
