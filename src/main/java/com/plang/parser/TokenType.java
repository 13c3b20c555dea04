package com.plang.parser;

/**
 * Token types for PLang source.
 */
public enum TokenType {
    // Identifiers and literals
    IDENT,
    STRING,
    INTEGER,
    FLOAT,
    BOOLEAN,
    NULL,

    // Delimiters
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    COMMA,
    COLON,
    SEMICOLON,

    // Declarations and statements
    POLICY,
    WHEN,
    THEN,
    ELSE,

    // Actions
    ALLOW,
    DENY,
    ROUTE,
    ESCALATE,

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

    // Membership
    IN,

    // Special
    EOF
}
