package com.plang.parser;

import com.plang.exception.ParseException;

import java.util.ArrayList;
import java.util.List;

import static com.plang.parser.GrammarConfig.*;

/**
 * Tokenizer for PLang source.
 * Converts input text into a sequence of tokens, tracking line and column.
 * Comments run from '#' or '//' to the end of the line.
 */
public final class PlangLexer {

    private final String input;
    private final int length;
    private int pos;
    private int line;
    private int column;

    public PlangLexer(String input) {
        this.input = input == null ? "" : input;
        this.length = this.input.length();
        this.pos = 0;
        this.line = 1;
        this.column = 1;
    }

    /**
     * Tokenize the input.
     *
     * @return List of tokens, always terminated by EOF
     * @throws ParseException on an unexpected character, bad number or unterminated string
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (!isAtEnd()) {
            char c = peek();

            // Skip whitespace
            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            // Skip comments
            if (c == Operators.HASH || (c == Operators.SLASH && peekNext() == Operators.SLASH)) {
                while (!isAtEnd() && peek() != Operators.NEWLINE) {
                    advance();
                }
                continue;
            }

            int startLine = line;
            int startColumn = column;

            switch (c) {
                case Operators.LEFT_PAREN -> tokens.add(single(TokenType.LPAREN, startLine, startColumn));
                case Operators.RIGHT_PAREN -> tokens.add(single(TokenType.RPAREN, startLine, startColumn));
                case Operators.LEFT_BRACKET -> tokens.add(single(TokenType.LBRACKET, startLine, startColumn));
                case Operators.RIGHT_BRACKET -> tokens.add(single(TokenType.RBRACKET, startLine, startColumn));
                case Operators.LEFT_BRACE -> tokens.add(single(TokenType.LBRACE, startLine, startColumn));
                case Operators.RIGHT_BRACE -> tokens.add(single(TokenType.RBRACE, startLine, startColumn));
                case Operators.COMMA -> tokens.add(single(TokenType.COMMA, startLine, startColumn));
                case Operators.COLON -> tokens.add(single(TokenType.COLON, startLine, startColumn));
                case Operators.SEMICOLON -> tokens.add(single(TokenType.SEMICOLON, startLine, startColumn));
                case Operators.EQUALS -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.EQ, "==", null, startLine, startColumn));
                    } else {
                        tokens.add(new Token(TokenType.EQ, "=", null, startLine, startColumn));
                    }
                }
                case Operators.NOT_EQUALS -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.NE, "!=", null, startLine, startColumn));
                    } else {
                        throw error("Unexpected '!'", startLine, startColumn);
                    }
                }
                case Operators.GREATER -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.GTE, ">=", null, startLine, startColumn));
                    } else {
                        tokens.add(new Token(TokenType.GT, ">", null, startLine, startColumn));
                    }
                }
                case Operators.LESS -> {
                    advance();
                    if (match(Operators.EQUALS)) {
                        tokens.add(new Token(TokenType.LTE, "<=", null, startLine, startColumn));
                    } else {
                        tokens.add(new Token(TokenType.LT, "<", null, startLine, startColumn));
                    }
                }
                case Operators.QUOTE_DOUBLE, Operators.QUOTE_SINGLE -> tokens.add(readString());
                default -> {
                    if (isIdentifierStart(c)) {
                        tokens.add(readIdentifierOrKeyword());
                    } else if (isNumberStart(c)) {
                        tokens.add(readNumber());
                    } else {
                        throw error("Unexpected character '" + c + "'", startLine, startColumn);
                    }
                }
            }
        }

        tokens.add(new Token(TokenType.EOF, "", null, line, column));
        return tokens;
    }

    private Token single(TokenType type, int startLine, int startColumn) {
        char c = advance();
        return new Token(type, String.valueOf(c), null, startLine, startColumn);
    }

    private Token readIdentifierOrKeyword() {
        int start = pos;
        int startLine = line;
        int startColumn = column;

        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }

        String text = input.substring(start, pos);
        String upper = text.toUpperCase();

        // Check if it's a keyword
        TokenType keywordType = KEYWORDS.get(upper);
        if (keywordType != null) {
            Object literal = null;
            if (keywordType == TokenType.BOOLEAN) {
                literal = BOOLEAN_VALUES.get(upper);
            }
            return new Token(keywordType, text, literal, startLine, startColumn);
        }

        // Regular identifier
        return new Token(TokenType.IDENT, text, text, startLine, startColumn);
    }

    private Token readNumber() {
        int start = pos;
        int startLine = line;
        int startColumn = column;

        if (peek() == Operators.MINUS) {
            advance();
            if (isAtEnd() || !Character.isDigit(peek())) {
                throw error("Unexpected character '-'", startLine, startColumn);
            }
        }

        while (!isAtEnd() && Character.isDigit(peek())) {
            advance();
        }

        boolean fractional = false;
        if (!isAtEnd() && peek() == Operators.DOT && Character.isDigit(peekNext())) {
            fractional = true;
            advance();
            while (!isAtEnd() && Character.isDigit(peek())) {
                advance();
            }
        }

        String text = input.substring(start, pos);

        try {
            if (fractional) {
                return new Token(TokenType.FLOAT, text, Double.parseDouble(text), startLine, startColumn);
            }
            return new Token(TokenType.INTEGER, text, Long.parseLong(text), startLine, startColumn);
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + text + "'", startLine, startColumn);
        }
    }

    private Token readString() {
        int startLine = line;
        int startColumn = column;
        char quote = advance();
        StringBuilder sb = new StringBuilder();

        while (!isAtEnd() && peek() != quote) {
            char c = advance();

            if (c == Operators.BACKSLASH && !isAtEnd()) {
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }

        if (isAtEnd()) {
            throw error("Unterminated string", startLine, startColumn);
        }

        advance(); // closing quote
        return new Token(TokenType.STRING, sb.toString(), sb.toString(), startLine, startColumn);
    }

    private boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == Operators.UNDERSCORE;
    }

    private boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c)
                || c == Operators.UNDERSCORE
                || c == Operators.DOT;
    }

    private boolean isNumberStart(char c) {
        return Character.isDigit(c) || c == Operators.MINUS;
    }

    private char advance() {
        char c = input.charAt(pos++);
        if (c == Operators.NEWLINE) {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || input.charAt(pos) != expected) {
            return false;
        }
        advance();
        return true;
    }

    private char peek() {
        return input.charAt(pos);
    }

    private char peekNext() {
        return pos + 1 < length ? input.charAt(pos + 1) : '\0';
    }

    private boolean isAtEnd() {
        return pos >= length;
    }

    private ParseException error(String message, int atLine, int atColumn) {
        return new ParseException(atLine, atColumn, message);
    }
}
