package com.scadformatter.core.doc;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Sequential composition.
 */
public final class Concat extends Doc {
    private final List<Doc> parts;
    private final boolean forcedBreak;

    Concat(List<Doc> parts) {
        this.parts = List.copyOf(parts);
        this.forcedBreak = this.parts.stream().anyMatch(Doc::hasForcedBreak);
    }

    public List<Doc> getParts() {
        return parts;
    }

    @Override
    public Type getType() {
        return Type.CONCAT;
    }

    @Override
    public boolean hasForcedBreak() {
        return forcedBreak;
    }

    @Override
    public String toString() {
        return parts.stream().map(Doc::toString).collect(Collectors.joining(", ", "[", "]"));
    }
}
