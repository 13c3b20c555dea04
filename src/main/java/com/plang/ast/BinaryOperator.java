package com.plang.ast;

/**
 * Binary operators allowed in conditions.
 */
public enum BinaryOperator {
    OR("or"),
    AND("and"),
    EQ("=="),
    NE("!="),
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<="),
    IN("in");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
