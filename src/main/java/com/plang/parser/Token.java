package com.plang.parser;

/**
 * Represents a token in PLang source.
 *
 * @param type    Token type
 * @param text    Original text
 * @param literal Parsed literal value (for strings, numbers, booleans)
 * @param line    1-based line in the source
 * @param column  1-based column in the source
 */
public record Token(TokenType type, String text, Object literal, int line, int column) {

    @Override
    public String toString() {
        if (literal != null) {
            return type + "(" + literal + ")";
        }
        return type + "(" + text + ")";
    }
}
