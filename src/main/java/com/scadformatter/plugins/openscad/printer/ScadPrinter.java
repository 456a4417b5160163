package com.scadformatter.plugins.openscad.printer;

import static com.scadformatter.core.doc.Docs.concat;
import static com.scadformatter.core.doc.Docs.group;
import static com.scadformatter.core.doc.Docs.hardline;
import static com.scadformatter.core.doc.Docs.indent;
import static com.scadformatter.core.doc.Docs.join;
import static com.scadformatter.core.doc.Docs.line;
import static com.scadformatter.core.doc.Docs.softline;
import static com.scadformatter.core.doc.Docs.text;
import static com.scadformatter.core.doc.Docs.verbatim;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import com.scadformatter.core.doc.Doc;
import com.scadformatter.plugins.openscad.syntax.NodeKind;
import com.scadformatter.plugins.openscad.syntax.SyntaxNode;
import com.scadformatter.plugins.openscad.syntax.SyntaxTree;
import com.scadformatter.util.LoggerUtil;

/**
 * Converts an OpenSCAD syntax tree into a layout document.
 *
 * <p>Every {@link NodeKind} has a rule in {@link #toDoc(SyntaxNode)}; the
 * switch is exhaustive, so a new kind does not compile until it is handled.
 * The printer is stateless and may be shared.
 */
public class ScadPrinter {
    private static final Logger logger = LoggerUtil.getLogger(ScadPrinter.class);

    public Doc print(SyntaxTree tree) {
        return toDoc(tree.getRoot());
    }

    public Doc toDoc(SyntaxNode node) {
        return switch (node.getKind()) {
            case SOURCE_FILE -> printStatementList(node.getChildren());
            case USE_STATEMENT -> concat(
                    text(node.getField("keyword").getText()), text(" "), toDoc(node.getField("path")));
            case MODULE_DECLARATION -> printModuleDeclaration(node);
            case FUNCTION_DECLARATION -> printFunctionDeclaration(node);
            case PARAMETERS, ARGUMENTS -> printList("(", ")", node.getChildren());
            case PARAMETER -> node.hasField("default")
                    ? concat(toDoc(node.getField("name")), text(" = "), toDoc(node.getField("default")))
                    : toDoc(node.getField("name"));
            case BLOCK -> printBlock(node);
            case TRANSFORM_CHAIN -> printTransformChain(node);
            case MODULE_CALL -> concat(toDoc(node.getField("name")), toDoc(node.getField("arguments")));
            case MODIFIER_CHAIN -> concat(
                    toDoc(node.getField("modifier")), printStatement(node.getField("statement")));
            case IF_STATEMENT -> printIfStatement(node);
            case FOR_STATEMENT -> printForStatement(node);
            case ASSIGNMENT -> concat(toDoc(node.getField("name")), text(" = "), toDoc(node.getField("value")));
            case EMPTY_STATEMENT -> text(";");

            case BINARY_EXPRESSION -> concat(
                    toDoc(node.getField("left")),
                    text(" "), toDoc(node.getField("operator")), text(" "),
                    toDoc(node.getField("right")));
            case UNARY_EXPRESSION -> printUnary(node);
            case TERNARY_EXPRESSION -> group(concat(
                    toDoc(node.getField("condition")),
                    indent(
                            line(), text("? "), toDoc(node.getField("consequence")),
                            line(), text(": "), toDoc(node.getField("alternative")))));
            case PARENTHESIZED_EXPRESSION -> concat(text("("), toDoc(node.getField("expression")), text(")"));
            case FUNCTION_CALL -> concat(toDoc(node.getField("function")), toDoc(node.getField("arguments")));
            case INDEX_EXPRESSION -> concat(
                    toDoc(node.getField("value")), text("["), toDoc(node.getField("index")), text("]"));
            case DOT_INDEX_EXPRESSION -> concat(
                    toDoc(node.getField("value")), text("."), toDoc(node.getField("member")));
            case LET_EXPRESSION, ASSERT_EXPRESSION, ECHO_EXPRESSION -> concat(
                    toDoc(node.getField("keyword")), toDoc(node.getField("arguments")),
                    text(" "), toDoc(node.getField("body")));
            case FUNCTION_LITERAL -> concat(
                    text("function"), toDoc(node.getField("parameters")), text(" "), toDoc(node.getField("body")));
            case VECTOR_LITERAL -> printList("[", "]", node.getChildren());
            case RANGE -> printRange(node);
            case FOR_CLAUSE -> concat(
                    text("for "), toDoc(node.getField("bindings")), text(" "), toDoc(node.getField("body")));
            case IF_CLAUSE -> printIfClause(node);
            case EACH_CLAUSE -> concat(text("each "), toDoc(node.getField("value")));

            case IDENTIFIER, NUMBER, BOOLEAN, UNDEF, OPERATOR, MODIFIER, KEYWORD, INCLUDE_PATH -> text(node.getText());
            // strings may span lines; their bytes are never touched
            case STRING -> verbatim(node.getText());
            case COMMENT -> printComment(node);
            case ERROR -> printError(node);
        };
    }

    /**
     * A statement as it appears in a file or block, with its terminating
     * semicolon where one belongs.
     */
    Doc printStatement(SyntaxNode node) {
        Doc doc = toDoc(node);
        return needsSemicolon(node) ? concat(doc, text(";")) : doc;
    }

    private static boolean needsSemicolon(SyntaxNode node) {
        return switch (node.getKind()) {
            case MODULE_CALL, ASSIGNMENT, FUNCTION_DECLARATION -> true;
            default -> false;
        };
    }

    // ---------------------------------------------------------------- statements

    private Doc printStatementList(List<SyntaxNode> items) {
        return printStatementList(items, null);
    }

    /**
     * Statements one per line with at most one blank line kept between them.
     * When {@code previous} is given the list continues after it and starts
     * on a new line.
     */
    private Doc printStatementList(List<SyntaxNode> items, SyntaxNode previous) {
        List<Doc> parts = new ArrayList<>();

        for (SyntaxNode item : items) {
            if (item.is(NodeKind.EMPTY_STATEMENT)) {
                continue;
            }
            if (previous != null) {
                if (item.is(NodeKind.COMMENT) && item.getStartLine() <= previous.getEndLine()) {
                    parts.add(printTrailingComment(item));
                    previous = item;
                    continue;
                }
                parts.add(hardline());
                if (item.getStartLine() - previous.getEndLine() > 1) {
                    parts.add(hardline());
                }
            }
            parts.add(printStatement(item));
            previous = item;
        }
        return concat(parts);
    }

    /**
     * A comment on the line of the opening brace stays on that line.
     */
    private Doc printBlock(SyntaxNode node) {
        List<SyntaxNode> children = node.getChildren();
        boolean empty = children.stream().allMatch(child -> child.is(NodeKind.EMPTY_STATEMENT));
        if (empty) {
            return text("{}");
        }

        SyntaxNode first = children.get(0);
        if (first.is(NodeKind.COMMENT) && first.getStartLine() == node.getStartLine()) {
            return concat(
                    text("{"), printTrailingComment(first),
                    indent(printStatementList(children.subList(1, children.size()), first)),
                    hardline(), text("}"));
        }
        return concat(text("{"), indent(hardline(), printStatementList(children)), hardline(), text("}"));
    }

    private Doc printModuleDeclaration(SyntaxNode node) {
        SyntaxNode parameters = node.getField("parameters");
        Doc head = concat(text("module "), toDoc(node.getField("name")), toDoc(parameters));
        return printBody(head, parameters.getEndLine(), headComments(node), node.getField("body"), true);
    }

    private Doc printFunctionDeclaration(SyntaxNode node) {
        return concat(
                text("function "), toDoc(node.getField("name")), toDoc(node.getField("parameters")),
                text(" ="),
                group(indent(line(), toDoc(node.getField("value")))));
    }

    private Doc printTransformChain(SyntaxNode node) {
        SyntaxNode call = node.getField("call");
        return printBody(toDoc(call), call.getEndLine(), headComments(node), node.getField("body"), true);
    }

    private Doc printForStatement(SyntaxNode node) {
        SyntaxNode bindings = node.getField("bindings");
        Doc head = concat(text("for "), toDoc(bindings));
        return printBody(head, bindings.getEndLine(), headComments(node), node.getField("body"), false);
    }

    private Doc printIfStatement(SyntaxNode node) {
        SyntaxNode condition = node.getField("condition");
        SyntaxNode consequence = node.getField("consequence");
        SyntaxNode alternative = node.getField("alternative");

        Doc head = concat(text("if ("), toDoc(condition), text(")"));
        List<SyntaxNode> comments = node.childrenOfKind(NodeKind.COMMENT);
        Doc ifPart = printBody(head, condition.getEndLine(),
                commentsBefore(comments, consequence.getSpan().getStartOffset()), consequence, false);
        if (alternative == null) {
            return ifPart;
        }

        SyntaxNode elseKeyword = node.getField("else");
        List<SyntaxNode> beforeElse = commentsBetween(comments,
                consequence.getSpan().getEndOffset(), elseKeyword.getSpan().getStartOffset());
        List<SyntaxNode> afterElse = commentsBetween(comments,
                elseKeyword.getSpan().getEndOffset(), alternative.getSpan().getStartOffset());

        List<Doc> parts = new ArrayList<>();
        parts.add(ifPart);
        int previousLine = consequence.getEndLine();
        for (SyntaxNode comment : beforeElse) {
            parts.add(comment.getStartLine() <= previousLine ? printTrailingComment(comment)
                    : concat(hardline(), printComment(comment)));
            previousLine = comment.getEndLine();
        }
        if (beforeElse.isEmpty() && consequence.is(NodeKind.BLOCK)) {
            parts.add(text(" else"));
        } else {
            parts.add(hardline());
            parts.add(text("else"));
        }

        if (alternative.is(NodeKind.IF_STATEMENT) && afterElse.isEmpty()) {
            parts.add(text(" "));
            parts.add(printStatement(alternative));
        } else {
            parts.add(printBody(text(""), elseKeyword.getEndLine(), afterElse, alternative, false));
        }
        return concat(parts);
    }

    /**
     * Places a body after its head.
     *
     * <p>A block stays on the head's line and an empty statement becomes
     * {@code ;}. Any other statement goes on its own indented line, except in
     * a call chain where it stays on the head's line if it started there.
     */
    private Doc printBody(Doc head, int headEndLine, List<SyntaxNode> comments, SyntaxNode body,
            boolean keepSameLine) {
        if (comments.isEmpty()) {
            if (body.is(NodeKind.BLOCK)) {
                return concat(head, text(" "), printBlock(body));
            }
            if (body.is(NodeKind.EMPTY_STATEMENT)) {
                return concat(head, text(";"));
            }
            if (keepSameLine && body.getStartLine() <= headEndLine) {
                return concat(head, text(" "), printStatement(body));
            }
            return concat(head, indent(hardline(), printStatement(body)));
        }

        List<Doc> tail = new ArrayList<>();
        int previousLine = headEndLine;
        for (SyntaxNode comment : comments) {
            tail.add(comment.getStartLine() <= previousLine ? printTrailingComment(comment)
                    : concat(hardline(), printComment(comment)));
            previousLine = comment.getEndLine();
        }
        if (body.is(NodeKind.BLOCK) || body.is(NodeKind.EMPTY_STATEMENT)) {
            return concat(head, concat(tail), hardline(), printStatement(body));
        }
        return concat(head, indent(concat(tail), hardline(), printStatement(body)));
    }

    private static List<SyntaxNode> headComments(SyntaxNode node) {
        return node.childrenOfKind(NodeKind.COMMENT);
    }

    private static List<SyntaxNode> commentsBefore(List<SyntaxNode> comments, int offset) {
        return commentsBetween(comments, -1, offset);
    }

    private static List<SyntaxNode> commentsBetween(List<SyntaxNode> comments, int from, int to) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode comment : comments) {
            int start = comment.getSpan().getStartOffset();
            if (start >= from && start < to) {
                result.add(comment);
            }
        }
        return result;
    }

    // ---------------------------------------------------------------- expressions

    /**
     * Comma separated items between brackets. The group prints on one line
     * when it fits, otherwise one item per line one level deeper. A line
     * comment forces the line after it to break.
     */
    private Doc printList(String open, String close, List<SyntaxNode> items) {
        if (items.isEmpty()) {
            return text(open + close);
        }

        if (items.stream().noneMatch(item -> item.is(NodeKind.COMMENT))) {
            List<Doc> docs = new ArrayList<>(items.size());
            for (SyntaxNode item : items) {
                docs.add(toDoc(item));
            }
            return group(concat(
                    text(open),
                    indent(softline(), join(concat(text(","), line()), docs)),
                    softline(),
                    text(close)));
        }

        int lastElement = -1;
        for (int i = 0; i < items.size(); i++) {
            if (!items.get(i).is(NodeKind.COMMENT)) {
                lastElement = i;
            }
        }

        List<Doc> inner = new ArrayList<>();
        inner.add(softline());
        SyntaxNode previous = null;
        boolean commaPending = false;

        for (int i = 0; i < items.size(); i++) {
            SyntaxNode item = items.get(i);
            if (item.is(NodeKind.COMMENT)) {
                if (commaPending && i < lastElement) {
                    inner.add(text(","));
                    commaPending = false;
                }
                if (previous != null && item.getStartLine() <= previous.getEndLine()) {
                    inner.add(text(" "));
                } else if (previous != null) {
                    inner.add(hardline());
                }
                inner.add(printComment(item));
            } else {
                if (previous != null) {
                    if (commaPending) {
                        inner.add(text(","));
                    }
                    inner.add(isLineComment(previous) ? hardline() : line());
                }
                inner.add(toDoc(item));
                commaPending = true;
            }
            previous = item;
        }

        return group(concat(
                text(open),
                indent(concat(inner)),
                isLineComment(previous) ? hardline() : softline(),
                text(close)));
    }

    /**
     * Keeps {@code - -x} apart so it does not read as a decrement.
     */
    private Doc printUnary(SyntaxNode node) {
        SyntaxNode operator = node.getField("operator");
        SyntaxNode operand = node.getField("operand");
        boolean signed = operator.getText().equals("-") || operator.getText().equals("+");
        if (signed && operand.is(NodeKind.UNARY_EXPRESSION)
                && operand.getField("operator").getText().equals(operator.getText())) {
            return concat(toDoc(operator), text(" "), toDoc(operand));
        }
        return concat(toDoc(operator), toDoc(operand));
    }

    private Doc printRange(SyntaxNode node) {
        List<Doc> parts = new ArrayList<>();
        parts.add(text("["));
        parts.add(toDoc(node.getField("start")));
        if (node.hasField("step")) {
            parts.add(text(":"));
            parts.add(toDoc(node.getField("step")));
        }
        parts.add(text(":"));
        parts.add(toDoc(node.getField("end")));
        parts.add(text("]"));
        return concat(parts);
    }

    private Doc printIfClause(SyntaxNode node) {
        Doc ifPart = concat(
                text("if ("), toDoc(node.getField("condition")), text(") "), toDoc(node.getField("consequence")));
        if (!node.hasField("alternative")) {
            return ifPart;
        }
        return concat(ifPart, text(" else "), toDoc(node.getField("alternative")));
    }

    // ---------------------------------------------------------------- leaves

    private static Doc printComment(SyntaxNode comment) {
        if (isLineComment(comment)) {
            return text(comment.getText().stripTrailing());
        }
        return verbatim(comment.getText());
    }

    private static Doc printTrailingComment(SyntaxNode comment) {
        return concat(text(" "), printComment(comment));
    }

    private static boolean isLineComment(SyntaxNode node) {
        return node != null && node.is(NodeKind.COMMENT) && node.getText().startsWith("//");
    }

    private static Doc printError(SyntaxNode node) {
        logger.warning("Emitting unparsed source verbatim at line " + (node.getStartLine() + 1));
        return verbatim(node.getText());
    }
}
