package com.scadformatter.plugins.openscad;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import java.util.ArrayList;
import java.util.List;

import com.scadformatter.api.FormatOptions;
import com.scadformatter.api.FormatterResult;
import com.scadformatter.api.error.FormatterError;
import com.scadformatter.api.error.Severity;
import com.scadformatter.plugins.openscad.syntax.ScadLexer;
import com.scadformatter.plugins.openscad.syntax.ScadSyntaxProvider;
import com.scadformatter.plugins.openscad.syntax.Token;
import com.scadformatter.plugins.openscad.syntax.TokenType;
import org.junit.jupiter.api.Test;

class ScadFormatterTest {

    private static final String SAMPLE = String.join("\n",
            "// bracket",
            "use <MCAD/boxes.scad>",
            "$fn=48;",
            "module bracket(w=20,h=30,t=3){ // outer",
            "  difference(){",
            "    cube([w,t,h]);  // plate",
            "    for(z=[h/4:h/2:h]) translate([w/2,-1,z]) rotate([-90,0,0]) cylinder(d=4,h=t+2);",
            "  }",
            "}",
            "",
            "",
            "y=- -1;",
            "pts=[for(i=[0:5]) [cos(i*60),sin(i*60)]];",
            "if(len(pts)>3){ bracket(); } else { % sphere(1); }",
            "");

    private final ScadFormatter formatter = new ScadFormatter(ScadSyntaxProvider.init());

    @Test
    void formatsWithDefaults() {
        assertThat(formatter.format("cube([10,10,10]);")).isEqualTo("cube([10, 10, 10]);\n");
    }

    @Test
    void formattingIsIdempotent() {
        String once = formatter.format(SAMPLE);
        String twice = formatter.format(once);

        assertThat(once).isNotEqualTo(SAMPLE);
        assertThat(twice).isEqualTo(once);
    }

    @Test
    void keepsEveryTokenAndComment() throws Exception {
        String formatted = formatter.format(SAMPLE);

        assertThat(texts(formatted, false)).isEqualTo(texts(SAMPLE, false));
        assertThat(texts(formatted, true)).isEqualTo(texts(SAMPLE, true));
    }

    @Test
    void outputEndsWithSingleNewline() {
        String formatted = formatter.format(SAMPLE);

        assertThat(formatted).endsWith("}\n").doesNotEndWith("\n\n");
        assertThat(formatted).doesNotContain(" \n");
    }

    @Test
    void emptySourceFormatsToEmpty() {
        assertThat(formatter.format("")).isEmpty();
        assertThat(formatter.format("\n\n   \n")).isEmpty();
    }

    @Test
    void syntaxErrorsLeaveSourceUnchanged() {
        String source = "cube(;";
        FormatterResult result = formatter.formatDetailed(source, FormatOptions.defaults());

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isSameAs(source);
        assertThat(result.getErrors()).hasSize(1);
        FormatterError error = result.getErrors().get(0);
        assertThat(error.getSeverity()).isEqualTo(Severity.ERROR);
        assertThat(error.getLine()).isEqualTo(1);
        assertThat(error.getSuggestion()).contains("formatWithSyntaxErrors");
    }

    @Test
    void formatsAroundSyntaxErrorsWhenAllowed() {
        FormatOptions options = FormatOptions.builder().formatWithSyntaxErrors(true).build();

        assertThat(formatter.format("x = ;\ncube([1,2]);", options)).isEqualTo("x = ;\ncube([1, 2]);\n");
    }

    @Test
    void lexicalErrorsAreFatal() {
        String source = "s = \"unterminated;\ncube(1);";
        FormatterResult result = formatter.formatDetailed(source, FormatOptions.defaults());

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isEqualTo(source);
        assertThat(result.getErrors()).extracting(FormatterError::getSeverity).containsExactly(Severity.FATAL);
    }

    @Test
    void nullSourceIsReportedNotThrown() {
        FormatterResult result = formatter.formatDetailed(null, FormatOptions.defaults());

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isNull();
        assertThat(result.getErrors()).extracting(FormatterError::getSeverity).containsExactly(Severity.FATAL);
    }

    @Test
    void providerFailureFailsOpen() {
        ScadFormatter broken = new ScadFormatter(source -> {
            throw new IllegalStateException("boom");
        });
        FormatterResult result = broken.formatDetailed("cube(1);", FormatOptions.defaults());

        assertThat(result.isSuccessful()).isFalse();
        assertThat(result.getFormattedCode()).isEqualTo("cube(1);");
        assertThat(result.getErrors().get(0).getMessage()).contains("boom");
    }

    @Test
    void neverThrowsOnArbitraryInput() {
        List<String> inputs = List.of(
                "}}}", "((((", "module", "if", "x = [1:", "/* open", "\"", "a = 1 +;",
                "for (i = [0:3]) ", "function f() =", "use <", "\uFEFFcube(1);", "cube(1);\r\n// crlf\r\n",
                "x = " + "(".repeat(20000) + "1" + ")".repeat(20000) + ";");

        for (String input : inputs) {
            assertThatCode(() -> assertThat(formatter.format(input)).isNotNull())
                    .as("input %s", input.length() > 40 ? input.substring(0, 40) : input)
                    .doesNotThrowAnyException();
        }
    }

    @Test
    void normalizesCrlfOutsideVerbatimText() {
        assertThat(formatter.format("a();\r\nb();\r\n")).isEqualTo("a();\nb();\n");
    }

    private static List<String> texts(String source, boolean comments) throws Exception {
        List<String> result = new ArrayList<>();
        for (Token token : new ScadLexer(source).tokenize()) {
            if (token.getType() != TokenType.EOF && token.isComment() == comments) {
                result.add(token.getText());
            }
        }
        return result;
    }
}
