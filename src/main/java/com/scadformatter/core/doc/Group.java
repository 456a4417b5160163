package com.scadformatter.core.doc;

/**
 * A fitting boundary. The lines directly inside a group, down to but not
 * including nested groups, are all flat or all broken.
 */
public final class Group extends Doc {
    private final Doc contents;
    private final String id;
    private final boolean broken;

    Group(Doc contents, String id) {
        this.contents = contents;
        this.id = id;
        this.broken = contents.hasForcedBreak();
    }

    public Doc getContents() {
        return contents;
    }

    /**
     * Optional label, only used when dumping a Doc tree.
     */
    public String getId() {
        return id;
    }

    /**
     * True when a hard line inside makes the flat layout impossible.
     */
    public boolean isBroken() {
        return broken;
    }

    @Override
    public Type getType() {
        return Type.GROUP;
    }

    @Override
    public boolean hasForcedBreak() {
        return broken;
    }

    @Override
    public String toString() {
        return "group" + (id != null ? "#" + id : "") + "(" + contents + ")";
    }
}
