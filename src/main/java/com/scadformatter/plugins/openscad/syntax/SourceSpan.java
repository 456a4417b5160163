package com.scadformatter.plugins.openscad.syntax;

/**
 * Location of a node in the source text. Offsets are 0-based character
 * indices, end exclusive; lines and columns are 0-based.
 */
public final class SourceSpan {
    private final int startOffset;
    private final int endOffset;
    private final int startLine;
    private final int endLine;
    private final int startColumn;

    public SourceSpan(int startOffset, int endOffset, int startLine, int endLine, int startColumn) {
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.startLine = startLine;
        this.endLine = endLine;
        this.startColumn = startColumn;
    }

    /**
     * The smallest span covering both arguments.
     */
    public static SourceSpan cover(SourceSpan first, SourceSpan last) {
        return new SourceSpan(first.startOffset, last.endOffset, first.startLine, last.endLine, first.startColumn);
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getEndOffset() {
        return endOffset;
    }

    public int getStartLine() {
        return startLine;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getStartColumn() {
        return startColumn;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SourceSpan)) {
            return false;
        }
        SourceSpan other = (SourceSpan) obj;
        return startOffset == other.startOffset && endOffset == other.endOffset
                && startLine == other.startLine && endLine == other.endLine
                && startColumn == other.startColumn;
    }

    @Override
    public int hashCode() {
        int result = startOffset;
        result = 31 * result + endOffset;
        result = 31 * result + startLine;
        result = 31 * result + endLine;
        result = 31 * result + startColumn;
        return result;
    }

    @Override
    public String toString() {
        return "[" + startOffset + ".." + endOffset + ", lines " + (startLine + 1) + "-" + (endLine + 1) + "]";
    }
}
