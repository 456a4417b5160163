package com.scadformatter.core.doc;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import com.scadformatter.api.FormatOptions;

/**
 * Resolves every line of a {@link Doc} to flat or broken and serializes the
 * result. Works from an explicit stack, so nesting depth is bounded only by
 * memory.
 *
 * <p>A group is printed flat when its flattened contents fit in the rest of
 * the current line. Only the group's own contents are measured; whatever
 * follows the group on the same line is not.
 */
public class DocRenderer {

    private enum Mode { FLAT, BREAK }

    private static final class Command {
        final int indent;
        final Mode mode;
        final Doc doc;

        Command(int indent, Mode mode, Doc doc) {
            this.indent = indent;
            this.mode = mode;
            this.doc = doc;
        }
    }

    private final FormatOptions options;
    private final String indentUnit;
    private final int indentUnitWidth;

    public DocRenderer(FormatOptions options) {
        this.options = options;
        this.indentUnit = options.isUseTabs() ? "\t" : " ".repeat(options.getIndentSize());
        this.indentUnitWidth = options.getIndentSize();
    }

    /**
     * Renders a document. The result ends with exactly one newline, or is empty
     * when the document prints nothing but whitespace.
     */
    public String render(Doc doc) {
        StringBuilder out = new StringBuilder();
        int column = 0;

        Deque<Command> stack = new ArrayDeque<>();
        stack.push(new Command(0, Mode.BREAK, doc));

        while (!stack.isEmpty()) {
            Command cmd = stack.pop();

            switch (cmd.doc.getType()) {
                case TEXT -> {
                    String value = ((Text) cmd.doc).getValue();
                    out.append(value);
                    column = advance(column, value);
                }
                case CONCAT -> {
                    List<Doc> parts = ((Concat) cmd.doc).getParts();
                    for (int i = parts.size() - 1; i >= 0; i--) {
                        stack.push(new Command(cmd.indent, cmd.mode, parts.get(i)));
                    }
                }
                case INDENT -> stack.push(
                        new Command(cmd.indent + 1, cmd.mode, ((Indent) cmd.doc).getContents()));
                case GROUP -> {
                    Group group = (Group) cmd.doc;
                    Mode mode;
                    if (group.isBroken()) {
                        mode = Mode.BREAK;
                    } else if (cmd.mode == Mode.FLAT) {
                        mode = Mode.FLAT;
                    } else {
                        mode = fits(group.getContents(), options.getPrintWidth() - column)
                                ? Mode.FLAT
                                : Mode.BREAK;
                    }
                    stack.push(new Command(cmd.indent, mode, group.getContents()));
                }
                case LINE -> {
                    Line.Kind kind = ((Line) cmd.doc).getKind();
                    if (kind == Line.Kind.LITERAL) {
                        out.append('\n');
                        column = 0;
                    } else if (kind == Line.Kind.HARD || cmd.mode == Mode.BREAK) {
                        trimTrailingWhitespace(out);
                        out.append('\n');
                        out.append(indentUnit.repeat(cmd.indent));
                        column = cmd.indent * indentUnitWidth;
                    } else if (kind == Line.Kind.LINE) {
                        out.append(' ');
                        column++;
                    }
                }
            }
        }

        return finish(out);
    }

    /**
     * Measures {@code doc} printed flat against the remaining width.
     */
    private boolean fits(Doc doc, int remaining) {
        Deque<Doc> stack = new ArrayDeque<>();
        stack.push(doc);

        while (!stack.isEmpty()) {
            if (remaining < 0) {
                return false;
            }
            Doc current = stack.pop();

            switch (current.getType()) {
                case TEXT -> {
                    String value = ((Text) current).getValue();
                    if (value.indexOf('\n') >= 0) {
                        return false;
                    }
                    remaining -= value.codePointCount(0, value.length());
                }
                case CONCAT -> {
                    List<Doc> parts = ((Concat) current).getParts();
                    for (int i = parts.size() - 1; i >= 0; i--) {
                        stack.push(parts.get(i));
                    }
                }
                case INDENT -> stack.push(((Indent) current).getContents());
                case GROUP -> {
                    Group group = (Group) current;
                    if (group.isBroken()) {
                        return false;
                    }
                    stack.push(group.getContents());
                }
                case LINE -> {
                    switch (((Line) current).getKind()) {
                        case SOFT -> {
                        }
                        case LINE -> remaining--;
                        case HARD, LITERAL -> {
                            return remaining >= 0;
                        }
                    }
                }
            }
        }
        return remaining >= 0;
    }

    private int advance(int column, String value) {
        int newline = value.lastIndexOf('\n');
        if (newline < 0) {
            return column + value.codePointCount(0, value.length());
        }
        return value.codePointCount(newline + 1, value.length());
    }

    private static void trimTrailingWhitespace(StringBuilder out) {
        int end = out.length();
        while (end > 0 && (out.charAt(end - 1) == ' ' || out.charAt(end - 1) == '\t')) {
            end--;
        }
        out.setLength(end);
    }

    private static String finish(StringBuilder out) {
        int end = out.length();
        while (end > 0 && Character.isWhitespace(out.charAt(end - 1))) {
            end--;
        }
        if (end == 0) {
            return "";
        }
        out.setLength(end);
        return out.append('\n').toString();
    }
}
