package com.scadformatter.plugins.openscad.syntax;

/**
 * A lexical token with its location.
 */
public final class Token {
    private final TokenType type;
    private final String text;
    private final SourceSpan span;

    public Token(TokenType type, String text, SourceSpan span) {
        this.type = type;
        this.text = text;
        this.span = span;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public SourceSpan getSpan() {
        return span;
    }

    public boolean isComment() {
        return type == TokenType.LINE_COMMENT || type == TokenType.BLOCK_COMMENT;
    }

    public boolean is(String symbolOrWord) {
        return (type == TokenType.SYMBOL || type == TokenType.IDENTIFIER) && text.equals(symbolOrWord);
    }

    @Override
    public String toString() {
        return "Token [type=" + type + ", text=" + text + ", span=" + span + "]";
    }
}
