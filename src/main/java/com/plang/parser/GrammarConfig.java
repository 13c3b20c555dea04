package com.plang.parser;

import com.plang.governance.ActionType;
import com.plang.governance.GovernanceCategory;

import java.util.Map;

/**
 * Fixed keyword vocabulary of PLang.
 * Keywords are matched case-insensitively and are not extensible at parse time.
 */
public final class GrammarConfig {

    private GrammarConfig() {
    }

    /**
     * Reserved keywords mapped to token types.
     */
    public static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            // Declarations and statements
            Map.entry("POLICY", TokenType.POLICY),
            Map.entry("WHEN", TokenType.WHEN),
            Map.entry("THEN", TokenType.THEN),
            Map.entry("ELSE", TokenType.ELSE),

            // Actions
            Map.entry("ALLOW", TokenType.ALLOW),
            Map.entry("DENY", TokenType.DENY),
            Map.entry("ROUTE", TokenType.ROUTE),
            Map.entry("ESCALATE", TokenType.ESCALATE),

            // Logical
            Map.entry("AND", TokenType.AND),
            Map.entry("OR", TokenType.OR),
            Map.entry("NOT", TokenType.NOT),
            Map.entry("IN", TokenType.IN),

            // Literals
            Map.entry("TRUE", TokenType.BOOLEAN),
            Map.entry("FALSE", TokenType.BOOLEAN),
            Map.entry("NULL", TokenType.NULL)
    );

    /**
     * Action keywords mapped to the action they emit.
     */
    public static final Map<TokenType, ActionType> ACTIONS = Map.of(
            TokenType.ALLOW, ActionType.ALLOW,
            TokenType.DENY, ActionType.DENY,
            TokenType.ROUTE, ActionType.ROUTE,
            TokenType.ESCALATE, ActionType.ESCALATE
    );

    /**
     * Category keywords. Categories are read as identifiers in the policy header
     * and looked up here, so an unknown category gets a precise error.
     */
    public static final Map<String, GovernanceCategory> CATEGORIES = Map.of(
            "SAFETY", GovernanceCategory.SAFETY,
            "PRIVACY", GovernanceCategory.PRIVACY,
            "OPERATIONAL", GovernanceCategory.OPERATIONAL,
            "ROUTING", GovernanceCategory.ROUTING,
            "CUSTOM", GovernanceCategory.CUSTOM
    );

    /**
     * Boolean literal values.
     */
    public static final Map<String, Boolean> BOOLEAN_VALUES = Map.of(
            "TRUE", true,
            "FALSE", false
    );

    /**
     * Contextual words: plain identifiers everywhere except where the grammar expects them.
     */
    public static final String PRIORITY = "priority";
    public static final String TO = "to";

    /**
     * Operator symbols.
     */
    public static final class Operators {
        public static final char LEFT_PAREN = '(';
        public static final char RIGHT_PAREN = ')';
        public static final char LEFT_BRACKET = '[';
        public static final char RIGHT_BRACKET = ']';
        public static final char LEFT_BRACE = '{';
        public static final char RIGHT_BRACE = '}';
        public static final char COMMA = ',';
        public static final char COLON = ':';
        public static final char SEMICOLON = ';';
        public static final char EQUALS = '=';
        public static final char NOT_EQUALS = '!';
        public static final char GREATER = '>';
        public static final char LESS = '<';
        public static final char QUOTE_DOUBLE = '"';
        public static final char QUOTE_SINGLE = '\'';
        public static final char BACKSLASH = '\\';
        public static final char DOT = '.';
        public static final char MINUS = '-';
        public static final char UNDERSCORE = '_';
        public static final char HASH = '#';
        public static final char SLASH = '/';
        public static final char NEWLINE = '\n';

        private Operators() {
        }
    }
}
