package com.scadformatter.core.doc;

/**
 * A node of the layout algebra. Docs describe what to print and where a line
 * may break; {@link DocRenderer} decides which breaks are taken.
 *
 * <p>Docs are immutable and built bottom-up, so every node knows at
 * construction time whether it contains a forced break. A {@link Group} that
 * contains one is broken before any fits check is made.
 */
public abstract class Doc {

    public enum Type {
        TEXT,
        CONCAT,
        LINE,
        INDENT,
        GROUP
    }

    Doc() {
    }

    public abstract Type getType();

    /**
     * Whether a hard line is reachable from this node. Literal lines do not
     * count: they never influence a group's decision.
     */
    public abstract boolean hasForcedBreak();
}
