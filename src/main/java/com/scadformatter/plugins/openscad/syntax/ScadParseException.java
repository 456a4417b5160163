package com.scadformatter.plugins.openscad.syntax;

/**
 * The source could not be turned into a syntax tree at all.
 */
public class ScadParseException extends Exception {
    private final int line;
    private final int column;

    public ScadParseException(String message, int line, int column) {
        super(message + " at " + (line + 1) + ":" + (column + 1));
        this.line = line;
        this.column = column;
    }

    /** 0-based line of the problem. */
    public int getLine() {
        return line;
    }

    /** 0-based column of the problem. */
    public int getColumn() {
        return column;
    }
}
