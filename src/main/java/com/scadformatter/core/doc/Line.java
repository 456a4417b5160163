package com.scadformatter.core.doc;

/**
 * A potential line break.
 */
public final class Line extends Doc {

    public enum Kind {
        /** Nothing when flat, newline plus indentation when broken. */
        SOFT,
        /** A single space when flat, newline plus indentation when broken. */
        LINE,
        /** Always a newline plus indentation; breaks every enclosing group. */
        HARD,
        /** Always a newline to column zero; ignored by fits checks. */
        LITERAL
    }

    static final Line SOFT = new Line(Kind.SOFT);
    static final Line LINE = new Line(Kind.LINE);
    static final Line HARD = new Line(Kind.HARD);
    static final Line LITERAL = new Line(Kind.LITERAL);

    private final Kind kind;

    private Line(Kind kind) {
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public Type getType() {
        return Type.LINE;
    }

    @Override
    public boolean hasForcedBreak() {
        return kind == Kind.HARD;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + "line";
    }
}
