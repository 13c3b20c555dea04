package com.plang.exception;

/**
 * Exception thrown when PLang source is malformed.
 * Always fatal to the compile attempt that raised it; nothing is partially applied.
 */
public class ParseException extends PlangException {

    private final int line;
    private final int column;

    public ParseException(int line, int column, String message) {
        super("Parse error at line " + line + ", column " + column + ": " + message);
        this.line = line;
        this.column = column;
    }

    /**
     * 1-based line of the offending token or character.
     */
    public int getLine() {
        return line;
    }

    /**
     * 1-based column of the offending token or character.
     */
    public int getColumn() {
        return column;
    }
}
