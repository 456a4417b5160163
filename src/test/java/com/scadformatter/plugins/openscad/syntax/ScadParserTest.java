package com.scadformatter.plugins.openscad.syntax;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ScadParserTest {

    private final SyntaxProvider provider = ScadSyntaxProvider.init();

    private SyntaxNode firstStatement(String source) throws ScadParseException {
        SyntaxTree tree = provider.parse(source);
        assertThat(tree.hasErrors()).as("problems: %s", tree.getProblems()).isFalse();
        return tree.getRoot().getChildren().get(0);
    }

    @Test
    void initReturnsSharedHandle() {
        assertThat(ScadSyntaxProvider.init()).isSameAs(provider);
    }

    @Test
    void respectsOperatorPrecedence() throws Exception {
        SyntaxNode assignment = firstStatement("x = 1 + 2 * 3;");
        SyntaxNode value = assignment.getField("value");

        assertThat(assignment.getKind()).isEqualTo(NodeKind.ASSIGNMENT);
        assertThat(value.getKind()).isEqualTo(NodeKind.BINARY_EXPRESSION);
        assertThat(value.getField("operator").getText()).isEqualTo("+");
        assertThat(value.getField("right").getField("operator").getText()).isEqualTo("*");
    }

    @Test
    void unaryMinusAppliesToPower() throws Exception {
        SyntaxNode value = firstStatement("y = -2 ^ 2;").getField("value");

        assertThat(value.getKind()).isEqualTo(NodeKind.UNARY_EXPRESSION);
        assertThat(value.getField("operand").getField("operator").getText()).isEqualTo("^");
    }

    @Test
    void ternaryIsRightAssociative() throws Exception {
        SyntaxNode value = firstStatement("z = a ? 1 : b ? 2 : 3;").getField("value");

        assertThat(value.getKind()).isEqualTo(NodeKind.TERNARY_EXPRESSION);
        assertThat(value.getField("alternative").getKind()).isEqualTo(NodeKind.TERNARY_EXPRESSION);
    }

    @Test
    void callWithBodyBecomesTransformChain() throws Exception {
        SyntaxNode chain = firstStatement("translate([1,0,0]) rotate(45) cube(1);");

        assertThat(chain.getKind()).isEqualTo(NodeKind.TRANSFORM_CHAIN);
        assertThat(chain.getField("call").getField("name").getText()).isEqualTo("translate");
        assertThat(chain.getField("body").getKind()).isEqualTo(NodeKind.TRANSFORM_CHAIN);
        assertThat(chain.getField("body").getField("body").getKind()).isEqualTo(NodeKind.MODULE_CALL);
    }

    @Test
    void parsesIfElse() throws Exception {
        SyntaxNode statement = firstStatement("if (a) b(); else { c(); }");

        assertThat(statement.getKind()).isEqualTo(NodeKind.IF_STATEMENT);
        assertThat(statement.getField("condition").getText()).isEqualTo("a");
        assertThat(statement.getField("consequence").getKind()).isEqualTo(NodeKind.MODULE_CALL);
        assertThat(statement.getField("alternative").getKind()).isEqualTo(NodeKind.BLOCK);
    }

    @Test
    void parsesDeclarations() throws Exception {
        SyntaxTree tree = provider.parse("module m(a, b = 2) cube(a);\nfunction f(x) = x * 2;");
        List<SyntaxNode> statements = tree.getRoot().getChildren();

        SyntaxNode module = statements.get(0);
        assertThat(module.getKind()).isEqualTo(NodeKind.MODULE_DECLARATION);
        assertThat(module.getField("parameters").getChildren()).hasSize(2);
        assertThat(module.getField("parameters").getChildren().get(1).hasField("default")).isTrue();

        SyntaxNode function = statements.get(1);
        assertThat(function.getKind()).isEqualTo(NodeKind.FUNCTION_DECLARATION);
        assertThat(function.getField("value").getKind()).isEqualTo(NodeKind.BINARY_EXPRESSION);
    }

    @Test
    void distinguishesRangesFromVectors() throws Exception {
        SyntaxNode range = firstStatement("r = [0:2:10];").getField("value");
        SyntaxNode vector = firstStatement("v = [0, 2, 10,];").getField("value");

        assertThat(range.getKind()).isEqualTo(NodeKind.RANGE);
        assertThat(range.getField("step").getText()).isEqualTo("2");
        assertThat(vector.getKind()).isEqualTo(NodeKind.VECTOR_LITERAL);
        assertThat(vector.getChildren()).hasSize(3);
    }

    @Test
    void parsesListComprehension() throws Exception {
        SyntaxNode vector = firstStatement("v = [for (i = [0:3]) if (i % 2 == 0) i, each [7, 8]];")
                .getField("value");

        assertThat(vector.getChildren()).extracting(SyntaxNode::getKind)
                .containsExactly(NodeKind.FOR_CLAUSE, NodeKind.EACH_CLAUSE);
        assertThat(vector.getChildren().get(0).getField("body").getKind()).isEqualTo(NodeKind.IF_CLAUSE);
    }

    @Test
    void parsesSpecialExpressions() throws Exception {
        SyntaxTree tree = provider.parse(
                "a = let(x = 1) x;\nb = assert(a > 0) a;\nc = echo(a) a;\nd = function(x) x + 1;\ne = p.x;");
        List<SyntaxNode> statements = tree.getRoot().getChildren();

        assertThat(statements).extracting(node -> node.getField("value").getKind()).containsExactly(
                NodeKind.LET_EXPRESSION,
                NodeKind.ASSERT_EXPRESSION,
                NodeKind.ECHO_EXPRESSION,
                NodeKind.FUNCTION_LITERAL,
                NodeKind.DOT_INDEX_EXPRESSION);
    }

    @Test
    void keepsModifierAndUseStatements() throws Exception {
        SyntaxTree tree = provider.parse("use <a.scad>\n#cube(1);");
        List<SyntaxNode> statements = tree.getRoot().getChildren();

        assertThat(statements.get(0).getKind()).isEqualTo(NodeKind.USE_STATEMENT);
        assertThat(statements.get(0).getField("path").getText()).isEqualTo("<a.scad>");
        assertThat(statements.get(1).getKind()).isEqualTo(NodeKind.MODIFIER_CHAIN);
        assertThat(statements.get(1).getField("modifier").getText()).isEqualTo("#");
    }

    @Test
    void placesCommentInsideArgumentList() throws Exception {
        SyntaxNode arguments = firstStatement("cube(1 /* c */);").getField("arguments");

        assertThat(arguments.getChildren()).extracting(SyntaxNode::getKind)
                .containsExactly(NodeKind.NUMBER, NodeKind.COMMENT);
    }

    @Test
    void hoistsCommentOutOfExpression() throws Exception {
        SyntaxTree tree = provider.parse("x = 1 + /* two */ 2;");

        assertThat(tree.getRoot().getChildren()).extracting(SyntaxNode::getKind)
                .containsExactly(NodeKind.ASSIGNMENT, NodeKind.COMMENT);
    }

    @Test
    void movesCommentsOutOfRanges() throws Exception {
        SyntaxNode arguments = firstStatement("f([/* r */ 0:5]);").getField("arguments");

        assertThat(arguments.getChildren()).extracting(SyntaxNode::getKind)
                .containsExactly(NodeKind.RANGE, NodeKind.COMMENT);
        assertThat(arguments.getChildren().get(1).getText()).isEqualTo("/* r */");
    }

    @Test
    void recoversFromBrokenStatement() throws Exception {
        SyntaxTree tree = provider.parse("x = ;\nsphere(1);");
        List<SyntaxNode> statements = tree.getRoot().getChildren();

        assertThat(tree.hasErrors()).isTrue();
        assertThat(tree.getProblems()).hasSize(1);
        assertThat(tree.getProblems().get(0).getLine()).isZero();
        assertThat(statements.get(0).getKind()).isEqualTo(NodeKind.ERROR);
        assertThat(statements.get(0).getText()).isEqualTo("x = ;");
        assertThat(statements.get(1).getKind()).isEqualTo(NodeKind.MODULE_CALL);
    }

    @Test
    void recoversInsideBlock() throws Exception {
        SyntaxTree tree = provider.parse("module m() {\n  x = ;\n  cube(1);\n}");
        SyntaxNode block = tree.getRoot().getChildren().get(0).getField("body");

        assertThat(tree.getProblems()).hasSize(1);
        assertThat(block.getChildren()).extracting(SyntaxNode::getKind)
                .containsExactly(NodeKind.ERROR, NodeKind.MODULE_CALL);
    }

    @Test
    void errorNodeKeepsCommentsItSwallowed() throws Exception {
        SyntaxTree tree = provider.parse("foo(1, /* keep */ 2 +);\n// after\nbar();");
        List<SyntaxNode> statements = tree.getRoot().getChildren();

        assertThat(statements.get(0).getKind()).isEqualTo(NodeKind.ERROR);
        assertThat(statements.get(0).getText()).isEqualTo("foo(1, /* keep */ 2 +);");
        assertThat(statements).extracting(SyntaxNode::getKind)
                .containsExactly(NodeKind.ERROR, NodeKind.COMMENT, NodeKind.MODULE_CALL);
    }

    @Test
    void lexicalProblemsThrow() {
        assertThatThrownBy(() -> provider.parse("cube(1); @"))
                .isInstanceOf(ScadParseException.class);
    }

    @Test
    void spansTrackLines() throws Exception {
        SyntaxTree tree = provider.parse("a();\n\nb(\n  1\n);");
        SyntaxNode second = tree.getRoot().getChildren().get(1);

        assertThat(second.getStartLine()).isEqualTo(2);
        assertThat(second.getEndLine()).isEqualTo(4);
        assertThat(tree.getSource()).startsWith("a();");
    }
}
