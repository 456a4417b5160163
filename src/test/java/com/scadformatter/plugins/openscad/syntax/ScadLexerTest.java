package com.scadformatter.plugins.openscad.syntax;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ScadLexerTest {

    private static List<Token> lex(String source) throws ScadParseException {
        return new ScadLexer(source).tokenize();
    }

    private static List<String> texts(List<Token> tokens) {
        return tokens.stream()
                .filter(token -> token.getType() != TokenType.EOF)
                .map(Token::getText)
                .collect(Collectors.toList());
    }

    @Test
    void splitsCallIntoTokens() throws Exception {
        List<Token> tokens = lex("cube([10,10,10]);");

        assertThat(texts(tokens)).containsExactly("cube", "(", "[", "10", ",", "10", ",", "10", "]", ")", ";");
        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.IDENTIFIER);
        assertThat(tokens.get(3).getType()).isEqualTo(TokenType.NUMBER);
        assertThat(tokens.get(tokens.size() - 1).getType()).isEqualTo(TokenType.EOF);
    }

    @Test
    void readsNumberForms() throws Exception {
        List<Token> tokens = lex("1.5e3 .5 0x1F 2. 7");

        assertThat(texts(tokens)).containsExactly("1.5e3", ".5", "0x1F", "2.", "7");
        assertThat(tokens.subList(0, 5)).allMatch(token -> token.getType() == TokenType.NUMBER);
    }

    @Test
    void prefersTwoCharacterOperators() throws Exception {
        assertThat(texts(lex("a<=b&&c!=d||e>=f==g"))).containsExactly(
                "a", "<=", "b", "&&", "c", "!=", "d", "||", "e", ">=", "f", "==", "g");
    }

    @Test
    void readsSpecialVariablesAsIdentifiers() throws Exception {
        List<Token> tokens = lex("$fn=32;");

        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.IDENTIFIER);
        assertThat(tokens.get(0).getText()).isEqualTo("$fn");
    }

    @Test
    void readsIncludePathOnlyAfterUseOrInclude() throws Exception {
        List<Token> use = lex("use <lib/shapes.scad>");
        List<Token> comparison = lex("x < y > z");

        assertThat(use.get(1).getType()).isEqualTo(TokenType.INCLUDE_PATH);
        assertThat(use.get(1).getText()).isEqualTo("<lib/shapes.scad>");
        assertThat(texts(comparison)).containsExactly("x", "<", "y", ">", "z");
    }

    @Test
    void keepsCommentsWithTheirLines() throws Exception {
        List<Token> tokens = lex("// hi  \n/* a\nb */ x");

        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.LINE_COMMENT);
        assertThat(tokens.get(0).getText()).isEqualTo("// hi  ");
        assertThat(tokens.get(1).getType()).isEqualTo(TokenType.BLOCK_COMMENT);
        assertThat(tokens.get(1).getSpan().getStartLine()).isEqualTo(1);
        assertThat(tokens.get(1).getSpan().getEndLine()).isEqualTo(2);
        assertThat(tokens.get(2).getSpan().getStartColumn()).isEqualTo(5);
    }

    @Test
    void readsStringsWithEscapesAndNewlines() throws Exception {
        List<Token> tokens = lex("s = \"a\\\"b\nc\";");

        assertThat(tokens.get(2).getType()).isEqualTo(TokenType.STRING);
        assertThat(tokens.get(2).getText()).isEqualTo("\"a\\\"b\nc\"");
        assertThat(tokens.get(3).getSpan().getStartLine()).isEqualTo(1);
    }

    @Test
    void rejectsUnterminatedString() {
        Throwable thrown = catchThrowable(() -> lex("x = \"abc"));

        assertThat(thrown).isInstanceOf(ScadParseException.class).hasMessageContaining("Unterminated string");
    }

    @Test
    void rejectsUnterminatedBlockComment() {
        Throwable thrown = catchThrowable(() -> lex("/* open"));

        assertThat(thrown).isInstanceOf(ScadParseException.class).hasMessageContaining("Unterminated block comment");
    }

    @Test
    void reportsPositionOfUnknownCharacter() {
        Throwable thrown = catchThrowable(() -> lex("cube();\n  @"));

        assertThat(thrown).isInstanceOf(ScadParseException.class);
        ScadParseException e = (ScadParseException) thrown;
        assertThat(e.getLine()).isEqualTo(1);
        assertThat(e.getColumn()).isEqualTo(2);
    }
}
