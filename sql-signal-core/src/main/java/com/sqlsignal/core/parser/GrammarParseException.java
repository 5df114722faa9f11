package com.sqlsignal.core.parser;

/**
 * Raised when the primary grammar rejects a unit.
 *
 * <p>The message carries only a position ({@code line L:C}), never token text.
 */
public class GrammarParseException extends RuntimeException {

    private final int line;
    private final int column;

    public GrammarParseException(int line, int column, Throwable cause) {
        super("line " + line + ":" + column, cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
