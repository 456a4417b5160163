package com.scadformatter.core.doc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builders for the layout algebra.
 */
public final class Docs {
    private static final Text EMPTY = new Text("");

    private Docs() {
    }

    public static Doc text(String value) {
        return value.isEmpty() ? EMPTY : new Text(value);
    }

    public static Doc empty() {
        return EMPTY;
    }

    public static Doc concat(Doc... parts) {
        return concat(Arrays.asList(parts));
    }

    public static Doc concat(List<Doc> parts) {
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return new Concat(parts);
    }

    public static Doc softline() {
        return Line.SOFT;
    }

    public static Doc line() {
        return Line.LINE;
    }

    public static Doc hardline() {
        return Line.HARD;
    }

    public static Doc literalline() {
        return Line.LITERAL;
    }

    public static Doc indent(Doc contents) {
        return new Indent(contents);
    }

    public static Doc indent(Doc... contents) {
        return new Indent(concat(contents));
    }

    public static Doc group(Doc contents) {
        return new Group(contents, null);
    }

    public static Doc group(Doc contents, String id) {
        return new Group(contents, id);
    }

    public static Doc join(Doc separator, List<Doc> parts) {
        List<Doc> result = new ArrayList<>(parts.size() * 2);
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) {
                result.add(separator);
            }
            result.add(parts.get(i));
        }
        return concat(result);
    }

    /**
     * Text that may span several lines. Continuation lines are attached with
     * literal lines so they keep their own leading whitespace.
     */
    public static Doc verbatim(String value) {
        String normalized = value.replace("\r\n", "\n");
        if (normalized.indexOf('\n') < 0) {
            return text(normalized);
        }
        String[] lines = normalized.split("\n", -1);
        List<Doc> parts = new ArrayList<>(lines.length * 2);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                parts.add(literalline());
            }
            parts.add(text(lines[i]));
        }
        return concat(parts);
    }
}
