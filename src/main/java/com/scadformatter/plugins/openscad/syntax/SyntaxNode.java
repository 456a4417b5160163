package com.scadformatter.plugins.openscad.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable node of an OpenSCAD syntax tree.
 *
 * <p>Leaves ({@link NodeKind#IDENTIFIER}, {@link NodeKind#NUMBER},
 * {@link NodeKind#COMMENT}, {@link NodeKind#ERROR} and the like) carry their
 * exact source text. Interior nodes carry ordered children and name the
 * important ones as fields, e.g. {@code condition} or {@code body}.
 */
public final class SyntaxNode {
    private final NodeKind kind;
    private final SourceSpan span;
    private final String text;
    private final List<SyntaxNode> children;
    private final Map<String, SyntaxNode> fields;

    private SyntaxNode(Builder builder) {
        this.kind = builder.kind;
        this.span = builder.span;
        this.text = builder.text;
        this.children = List.copyOf(builder.children);
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
    }

    public static SyntaxNode leaf(NodeKind kind, String text, SourceSpan span) {
        return builder(kind).text(text).span(span).build();
    }

    public NodeKind getKind() {
        return kind;
    }

    public SourceSpan getSpan() {
        return span;
    }

    /**
     * Source text of a leaf, or {@code null} for interior nodes.
     */
    public String getText() {
        return text;
    }

    public List<SyntaxNode> getChildren() {
        return children;
    }

    /**
     * Named child, or {@code null} when the field is absent.
     */
    public SyntaxNode getField(String name) {
        return fields.get(name);
    }

    public boolean hasField(String name) {
        return fields.containsKey(name);
    }

    public boolean is(NodeKind other) {
        return kind == other;
    }

    public int getStartLine() {
        return span.getStartLine();
    }

    public int getEndLine() {
        return span.getEndLine();
    }

    /**
     * Children of the given kind, in source order.
     */
    public List<SyntaxNode> childrenOfKind(NodeKind childKind) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode child : children) {
            if (child.kind == childKind) {
                result.add(child);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb, 0);
        return sb.toString();
    }

    private void appendTo(StringBuilder sb, int depth) {
        sb.append("  ".repeat(depth)).append(kind.getGrammarName());
        if (text != null) {
            sb.append(' ').append(text.replace("\n", "\\n"));
        }
        sb.append('\n');
        for (SyntaxNode child : children) {
            child.appendTo(sb, depth + 1);
        }
    }

    public static Builder builder(NodeKind kind) {
        return new Builder(kind);
    }

    public static class Builder {
        private final NodeKind kind;
        private SourceSpan span;
        private String text;
        private final List<SyntaxNode> children = new ArrayList<>();
        private final Map<String, SyntaxNode> fields = new LinkedHashMap<>();

        private Builder(NodeKind kind) {
            this.kind = kind;
        }

        public Builder span(SourceSpan span) {
            this.span = span;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder child(SyntaxNode child) {
            children.add(child);
            return this;
        }

        public Builder children(List<SyntaxNode> nodes) {
            children.addAll(nodes);
            return this;
        }

        /**
         * Adds a child and names it.
         */
        public Builder field(String name, SyntaxNode child) {
            children.add(child);
            fields.put(name, child);
            return this;
        }

        public SyntaxNode build() {
            if (span == null) {
                throw new IllegalStateException("Node " + kind + " has no span");
            }
            return new SyntaxNode(this);
        }
    }
}
