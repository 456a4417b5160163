package com.scadformatter.core.doc;

/**
 * Raises the indentation of line breaks inside it by one unit.
 */
public final class Indent extends Doc {
    private final Doc contents;

    Indent(Doc contents) {
        this.contents = contents;
    }

    public Doc getContents() {
        return contents;
    }

    @Override
    public Type getType() {
        return Type.INDENT;
    }

    @Override
    public boolean hasForcedBreak() {
        return contents.hasForcedBreak();
    }

    @Override
    public String toString() {
        return "indent(" + contents + ")";
    }
}
