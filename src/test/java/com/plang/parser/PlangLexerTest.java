package com.plang.parser;

import com.plang.exception.ParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PlangLexer.
 */
class PlangLexerTest {

    @Test
    @DisplayName("Should tokenize a policy header with line and column")
    void shouldTokenizeHeader() {
        List<Token> tokens = new PlangLexer("policy p: SAFETY {\n  deny\n}").tokenize();

        assertEquals(TokenType.POLICY, tokens.get(0).type());
        assertEquals(TokenType.IDENT, tokens.get(1).type());
        assertEquals("p", tokens.get(1).text());
        assertEquals(TokenType.COLON, tokens.get(2).type());
        assertEquals(TokenType.IDENT, tokens.get(3).type());
        assertEquals(TokenType.LBRACE, tokens.get(4).type());

        Token deny = tokens.get(5);
        assertEquals(TokenType.DENY, deny.type());
        assertEquals(2, deny.line());
        assertEquals(3, deny.column());

        assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).type());
    }

    @ParameterizedTest
    @CsvSource({
            "==, EQ",
            "=, EQ",
            "!=, NE",
            ">, GT",
            ">=, GTE",
            "<, LT",
            "<=, LTE"
    })
    @DisplayName("Should tokenize comparison operators")
    void shouldTokenizeOperators(String text, TokenType expected) {
        List<Token> tokens = new PlangLexer(text).tokenize();
        assertEquals(expected, tokens.get(0).type());
        assertEquals(2, tokens.size());
    }

    @Test
    @DisplayName("Keywords are case-insensitive")
    void keywordsAreCaseInsensitive() {
        List<Token> tokens = new PlangLexer("WHEN When when").tokenize();
        assertEquals(TokenType.WHEN, tokens.get(0).type());
        assertEquals(TokenType.WHEN, tokens.get(1).type());
        assertEquals(TokenType.WHEN, tokens.get(2).type());
    }

    @Test
    @DisplayName("Should read numbers, strings and booleans with literals")
    void shouldReadLiterals() {
        List<Token> tokens = new PlangLexer("42 -7 0.75 'it\\'s' \"a\\nb\" true null").tokenize();

        assertEquals(TokenType.INTEGER, tokens.get(0).type());
        assertEquals(42L, tokens.get(0).literal());
        assertEquals(-7L, tokens.get(1).literal());
        assertEquals(TokenType.FLOAT, tokens.get(2).type());
        assertEquals(0.75, tokens.get(2).literal());
        assertEquals("it's", tokens.get(3).text());
        assertEquals("a\nb", tokens.get(4).text());
        assertEquals(TokenType.BOOLEAN, tokens.get(5).type());
        assertEquals(Boolean.TRUE, tokens.get(5).literal());
        assertEquals(TokenType.NULL, tokens.get(6).type());
    }

    @Test
    @DisplayName("Dotted names form a single identifier")
    void dottedIdentifier() {
        List<Token> tokens = new PlangLexer("user_profile.tier").tokenize();
        assertEquals(TokenType.IDENT, tokens.get(0).type());
        assertEquals("user_profile.tier", tokens.get(0).text());
    }

    @Test
    @DisplayName("Should skip hash and slash comments")
    void shouldSkipComments() {
        List<Token> tokens = new PlangLexer("# header\nallow // trailing\n").tokenize();
        assertEquals(2, tokens.size());
        assertEquals(TokenType.ALLOW, tokens.get(0).type());
        assertEquals(2, tokens.get(0).line());
    }

    @Test
    @DisplayName("Should report unexpected characters with position")
    void shouldRejectUnexpectedCharacter() {
        ParseException e = assertThrows(ParseException.class, () -> new PlangLexer("allow\n  @").tokenize());
        assertEquals(2, e.getLine());
        assertEquals(3, e.getColumn());
        assertTrue(e.getMessage().contains("Unexpected character '@'"));
    }

    @Test
    @DisplayName("Should reject unterminated strings")
    void shouldRejectUnterminatedString() {
        ParseException e = assertThrows(ParseException.class, () -> new PlangLexer("deny \"oops").tokenize());
        assertTrue(e.getMessage().contains("Unterminated string"));
        assertEquals(6, e.getColumn());
    }

    @Test
    @DisplayName("A lone '!' is not an operator")
    void shouldRejectLoneBang() {
        assertThrows(ParseException.class, () -> new PlangLexer("a ! b").tokenize());
    }
}
