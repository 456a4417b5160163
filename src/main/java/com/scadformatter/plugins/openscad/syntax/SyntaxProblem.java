package com.scadformatter.plugins.openscad.syntax;

/**
 * A recoverable syntax error; the statement it belongs to became an
 * {@link NodeKind#ERROR} node.
 */
public final class SyntaxProblem {
    private final String message;
    private final int line;
    private final int column;

    public SyntaxProblem(String message, int line, int column) {
        this.message = message;
        this.line = line;
        this.column = column;
    }

    public String getMessage() {
        return message;
    }

    /** 0-based line. */
    public int getLine() {
        return line;
    }

    /** 0-based column. */
    public int getColumn() {
        return column;
    }

    @Override
    public String toString() {
        return message + " at " + (line + 1) + ":" + (column + 1);
    }
}
