package com.scadformatter.plugins.openscad.printer;

import static org.assertj.core.api.Assertions.assertThat;

import com.scadformatter.api.FormatOptions;
import com.scadformatter.core.doc.DocRenderer;
import com.scadformatter.plugins.openscad.syntax.ScadSyntaxProvider;
import com.scadformatter.plugins.openscad.syntax.SyntaxTree;
import org.junit.jupiter.api.Test;

class ScadPrinterTest {

    private final ScadPrinter printer = new ScadPrinter();

    private String print(String source) throws Exception {
        return print(source, FormatOptions.defaults());
    }

    private String print(String source, FormatOptions options) throws Exception {
        SyntaxTree tree = ScadSyntaxProvider.init().parse(source);
        return new DocRenderer(options).render(printer.print(tree));
    }

    @Test
    void spacesArgumentsAndVectors() throws Exception {
        assertThat(print("cube([10,10,10]);")).isEqualTo("cube([10, 10, 10]);\n");
        assertThat(print("cylinder(h=10,r=2,$fn=30);")).isEqualTo("cylinder(h = 10, r = 2, $fn = 30);\n");
    }

    @Test
    void spacesOperators() throws Exception {
        assertThat(print("x=-1;")).isEqualTo("x = -1;\n");
        assertThat(print("function f(x)=x*2;")).isEqualTo("function f(x) = x * 2;\n");
        assertThat(print("m=a>1?b:c;")).isEqualTo("m = a > 1 ? b : c;\n");
    }

    @Test
    void separatesRepeatedSigns() throws Exception {
        assertThat(print("y = - -1;")).isEqualTo("y = - -1;\n");
        assertThat(print("y = + +x;")).isEqualTo("y = + +x;\n");
        assertThat(print("y = -+1;")).isEqualTo("y = -+1;\n");
        assertThat(print("y = !!x;")).isEqualTo("y = !!x;\n");
    }

    @Test
    void indentsIfBody() throws Exception {
        assertThat(print("if (x>5) cube(1);")).isEqualTo("if (x > 5)\n    cube(1);\n");
    }

    @Test
    void keepsElseOnClosingBraceLine() throws Exception {
        assertThat(print("if(a){b();}else{c();}"))
                .isEqualTo("if (a) {\n    b();\n} else {\n    c();\n}\n");
    }

    @Test
    void chainsElseIf() throws Exception {
        assertThat(print("if(a) b(); else if(c) d(); else e();"))
                .isEqualTo("if (a)\n    b();\nelse if (c)\n    d();\nelse\n    e();\n");
    }

    @Test
    void keepsTransformOnSameLine() throws Exception {
        assertThat(print("translate([0,0,1]) cube(1);")).isEqualTo("translate([0, 0, 1]) cube(1);\n");
        assertThat(print("translate([0,0,1]){cube(1);sphere(2);}"))
                .isEqualTo("translate([0, 0, 1]) {\n    cube(1);\n    sphere(2);\n}\n");
    }

    @Test
    void printsEmptyBlockCompactly() throws Exception {
        assertThat(print("for(i=[0:10]){}")).isEqualTo("for (i = [0:10]) {}\n");
    }

    @Test
    void printsModifiersAndLetCalls() throws Exception {
        assertThat(print("# cube(1);")).isEqualTo("#cube(1);\n");
        assertThat(print("let(a=1) cube(a);")).isEqualTo("let(a = 1) cube(a);\n");
    }

    @Test
    void collapsesBlankLines() throws Exception {
        assertThat(print("a();\n\n\n\nb();")).isEqualTo("a();\n\nb();\n");
        assertThat(print("a();\n// note\nb();")).isEqualTo("a();\n// note\nb();\n");
    }

    @Test
    void keepsTrailingComments() throws Exception {
        assertThat(print("cube(1);   // unit")).isEqualTo("cube(1); // unit\n");
        assertThat(print("translate([1,0,0]) // move\n    cube(1);"))
                .isEqualTo("translate([1, 0, 0]) // move\n    cube(1);\n");
    }

    @Test
    void keepsCommentOnOpeningBraceLine() throws Exception {
        String expected = "module m() { // c\n    cube(1);\n\n    sphere(1);\n}\n";

        assertThat(print("module m() { // c\ncube(1);\n\nsphere(1);\n}")).isEqualTo(expected);
        assertThat(print(expected)).isEqualTo(expected);
        assertThat(print("if (a) { /* x */ b(); }")).isEqualTo("if (a) { /* x */\n    b();\n}\n");
        assertThat(print("module m() { // only\n}")).isEqualTo("module m() { // only\n}\n");
    }

    @Test
    void keepsCommentBelowOpeningBraceOnItsOwnLine() throws Exception {
        assertThat(print("module m() {\n// c\ncube(1);\n}")).isEqualTo("module m() {\n    // c\n    cube(1);\n}\n");
    }

    @Test
    void breaksListAroundLineComments() throws Exception {
        String source = "cube([\n1, // x\n2, // y\n3 // z\n]);";

        assertThat(print(source)).isEqualTo(
                "cube(\n"
                        + "    [\n"
                        + "        1, // x\n"
                        + "        2, // y\n"
                        + "        3 // z\n"
                        + "    ]\n"
                        + ");\n");
    }

    @Test
    void wrapsLongArgumentListOnePerLine() throws Exception {
        String source = "make_part(width_parameter, height_parameter, depth_parameter, "
                + "wall_thickness, corner_radius, fillet_size);";

        assertThat(print(source)).isEqualTo(
                "make_part(\n"
                        + "    width_parameter,\n"
                        + "    height_parameter,\n"
                        + "    depth_parameter,\n"
                        + "    wall_thickness,\n"
                        + "    corner_radius,\n"
                        + "    fillet_size\n"
                        + ");\n");
    }

    @Test
    void honoursPrintWidth() throws Exception {
        FormatOptions narrow = FormatOptions.builder().printWidth(40).build();

        assertThat(print("cube([10, 20, 30, 40, 50, 60, 70, 80, 90]);", narrow))
                .isEqualTo("cube(\n    [10, 20, 30, 40, 50, 60, 70, 80, 90]\n);\n");
    }

    @Test
    void keepsCallFlatWhenItEndsAtPrintWidth() throws Exception {
        String first = "a".repeat(38);
        String second = "b".repeat(37);
        // the call ends in column 80; its semicolon is not part of the group
        String source = "f(" + first + ", " + second + ");";

        assertThat(print(source)).isEqualTo(source + "\n");
        assertThat(print(source, FormatOptions.builder().printWidth(79).build()))
                .isEqualTo("f(\n    " + first + ",\n    " + second + "\n);\n");
    }

    @Test
    void indentsWithTabs() throws Exception {
        FormatOptions tabs = FormatOptions.builder().useTabs(true).build();

        assertThat(print("module a(){cube(1);}", tabs)).isEqualTo("module a() {\n\tcube(1);\n}\n");
        assertThat(print("module a(){for(i=[0:2]){cube(i);}}", tabs))
                .isEqualTo("module a() {\n\tfor (i = [0:2]) {\n\t\tcube(i);\n\t}\n}\n");
    }

    @Test
    void printsSyntaxErrorsVerbatim() throws Exception {
        assertThat(print("x = ;\ncube([1,2]);")).isEqualTo("x = ;\ncube([1, 2]);\n");
    }

    @Test
    void keepsMultiLineStringsUntouched() throws Exception {
        assertThat(print("echo(\"a\n  b\");")).isEqualTo("echo(\"a\n  b\");\n");
    }

    @Test
    void emptySourcePrintsNothing() throws Exception {
        assertThat(print("")).isEmpty();
        assertThat(print("  \n\t\n")).isEmpty();
    }
}
