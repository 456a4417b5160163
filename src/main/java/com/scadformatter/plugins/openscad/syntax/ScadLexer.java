package com.scadformatter.plugins.openscad.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits OpenSCAD source into tokens. Comments are returned as tokens too,
 * so the parser can place them in the tree.
 *
 * <p>Keywords are not distinguished here: {@code module}, {@code if} and
 * friends come out as identifiers and the parser tells them apart.
 */
public class ScadLexer {

    static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_]*");
    static final Pattern HEX_NUMBER = Pattern.compile("0[xX][0-9A-Fa-f]+");
    static final Pattern NUMBER = Pattern.compile(
            "(?:[0-9]+(?:\\.[0-9]*)?|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?");

    static final String[] TWO_CHAR_SYMBOLS = {"<=", ">=", "==", "!=", "&&", "||"};
    static final String SINGLE_CHAR_SYMBOLS = "()[]{},;=:?.!#%*+-/^<>";

    private final String source;
    private int pos;
    private int line;
    private int lineStart;

    public ScadLexer(String source) {
        this.source = source;
    }

    /**
     * Reads every token. The last token is always {@link TokenType#EOF}.
     */
    public List<Token> tokenize() throws ScadParseException {
        List<Token> tokens = new ArrayList<>();
        Token previousCode = null;

        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.EOF, "",
                        new SourceSpan(pos, pos, line, line, pos - lineStart)));
                return tokens;
            }

            Token token;
            if (previousCode != null && previousCode.getType() == TokenType.IDENTIFIER
                    && (previousCode.getText().equals("use") || previousCode.getText().equals("include"))
                    && source.charAt(pos) == '<' && includePathEnd() > 0) {
                token = readIncludePath();
            } else {
                token = readToken();
            }

            tokens.add(token);
            if (!token.isComment()) {
                previousCode = token;
            }
        }
    }

    private Token readToken() throws ScadParseException {
        char c = source.charAt(pos);

        if (source.startsWith("//", pos)) {
            int end = source.indexOf('\n', pos);
            if (end < 0) {
                end = source.length();
            }
            // a CR before the newline belongs to the line break, not the comment
            if (end > pos && source.charAt(end - 1) == '\r') {
                end--;
            }
            return take(TokenType.LINE_COMMENT, end);
        }
        if (source.startsWith("/*", pos)) {
            int close = source.indexOf("*/", pos + 2);
            if (close < 0) {
                throw error("Unterminated block comment");
            }
            return take(TokenType.BLOCK_COMMENT, close + 2);
        }
        if (c == '"') {
            return readString();
        }

        Matcher hex = HEX_NUMBER.matcher(source).region(pos, source.length());
        if (hex.lookingAt()) {
            return take(TokenType.NUMBER, hex.end());
        }
        Matcher number = NUMBER.matcher(source).region(pos, source.length());
        if (number.lookingAt()) {
            return take(TokenType.NUMBER, number.end());
        }
        Matcher identifier = IDENTIFIER.matcher(source).region(pos, source.length());
        if (identifier.lookingAt()) {
            return take(TokenType.IDENTIFIER, identifier.end());
        }

        for (String symbol : TWO_CHAR_SYMBOLS) {
            if (source.startsWith(symbol, pos)) {
                return take(TokenType.SYMBOL, pos + 2);
            }
        }
        if (SINGLE_CHAR_SYMBOLS.indexOf(c) >= 0) {
            return take(TokenType.SYMBOL, pos + 1);
        }

        throw error("Unexpected character '" + c + "'");
    }

    private Token readString() throws ScadParseException {
        int i = pos + 1;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '"') {
                return take(TokenType.STRING, i + 1);
            }
            i++;
        }
        throw error("Unterminated string literal");
    }

    /**
     * End offset (exclusive) of a {@code <path>} starting at the cursor, or -1
     * when the angle bracket is not closed on the same line.
     */
    private int includePathEnd() {
        for (int i = pos + 1; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '>') {
                return i + 1;
            }
            if (c == '\n') {
                return -1;
            }
        }
        return -1;
    }

    private Token readIncludePath() {
        return take(TokenType.INCLUDE_PATH, includePathEnd());
    }

    private Token take(TokenType type, int end) {
        int startOffset = pos;
        int startLine = line;
        int startColumn = pos - lineStart;
        for (int i = pos; i < end; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        pos = end;
        return new Token(type, source.substring(startOffset, end),
                new SourceSpan(startOffset, end, startLine, line, startColumn));
    }

    private void skipWhitespace() {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '\n') {
                line++;
                lineStart = pos + 1;
            } else if (!Character.isWhitespace(c) && c != '\uFEFF') {
                return;
            }
            pos++;
        }
    }

    private ScadParseException error(String message) {
        return new ScadParseException(message, line, pos - lineStart);
    }
}
