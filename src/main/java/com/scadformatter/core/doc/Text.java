package com.scadformatter.core.doc;

/**
 * Literal, unbreakable content.
 */
public final class Text extends Doc {
    private final String value;

    Text(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public Type getType() {
        return Type.TEXT;
    }

    @Override
    public boolean hasForcedBreak() {
        return false;
    }

    @Override
    public String toString() {
        return '"' + value.replace("\n", "\\n") + '"';
    }
}
