package com.scadformatter.plugins.openscad.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for OpenSCAD.
 *
 * <p>Comment tokens are kept aside and placed into the nearest statement list,
 * argument list, parameter list or vector at the point where the parser next
 * looks for an item. A comment inside an expression therefore lands right
 * after the element that contained it.
 *
 * <p>A statement that does not parse becomes an {@link NodeKind#ERROR} node
 * holding its exact source text, and parsing resumes after it.
 */
class ScadParser {

    private static final Set<String> MODIFIERS = Set.of("!", "#", "%", "*");

    private static final String[][] BINARY_LEVELS = {
            {"||"},
            {"&&"},
            {"==", "!="},
            {"<", "<=", ">", ">="},
            {"+", "-"},
            {"*", "/", "%"},
    };

    private interface ElementParser {
        SyntaxNode parse();
    }

    /**
     * Unwinds to the enclosing statement when a statement cannot be parsed.
     */
    private static final class ParseError extends RuntimeException {
        private final transient Token at;

        ParseError(String message, Token at) {
            super(message, null, false, false);
            this.at = at;
        }
    }

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Token> comments = new ArrayList<>();
    private final List<SyntaxProblem> problems = new ArrayList<>();
    // comments already taken off the stream whose owner could not hold them
    private final List<Token> carried = new ArrayList<>();
    private int pos;
    private int commentPos;

    ScadParser(String source, List<Token> allTokens) {
        this.source = source;
        for (Token token : allTokens) {
            if (token.isComment()) {
                comments.add(token);
            } else {
                tokens.add(token);
            }
        }
    }

    SyntaxTree parse() {
        List<SyntaxNode> items = new ArrayList<>();
        while (true) {
            drainComments(items);
            if (peek().getType() == TokenType.EOF) {
                break;
            }
            items.add(parseStatementRecovering(false));
        }
        drainComments(items);

        SyntaxNode root = SyntaxNode.builder(NodeKind.SOURCE_FILE)
                .span(new SourceSpan(0, source.length(), 0, peek().getSpan().getEndLine(), 0))
                .children(items)
                .build();
        return new SyntaxTree(root, source, problems);
    }

    // ---------------------------------------------------------------- statements

    private SyntaxNode parseStatementRecovering(boolean insideBlock) {
        int savedPos = pos;
        int savedCommentPos = commentPos;
        List<Token> savedCarried = new ArrayList<>(carried);
        int savedProblems = problems.size();
        Token start = peek();
        try {
            return parseStatement();
        } catch (ParseError e) {
            pos = savedPos;
            commentPos = savedCommentPos;
            carried.clear();
            carried.addAll(savedCarried);
            problems.subList(savedProblems, problems.size()).clear();
            problems.add(new SyntaxProblem(e.getMessage(),
                    e.at.getSpan().getStartLine(), e.at.getSpan().getStartColumn()));

            skipStatement(insideBlock);
            if (pos == savedPos) {
                advance();
            }
            Token end = previous();
            while (commentPos < comments.size()
                    && comments.get(commentPos).getSpan().getStartOffset() < end.getSpan().getEndOffset()) {
                commentPos++;
            }
            SourceSpan span = SourceSpan.cover(start.getSpan(), end.getSpan());
            return SyntaxNode.leaf(NodeKind.ERROR,
                    source.substring(span.getStartOffset(), span.getEndOffset()), span);
        }
    }

    /**
     * Skips to the end of a broken statement: a {@code ;} outside brackets or
     * the {@code }} closing a balanced block. A {@code }} that closes the
     * enclosing block is left in place.
     */
    private void skipStatement(boolean insideBlock) {
        int depth = 0;
        while (peek().getType() != TokenType.EOF) {
            Token token = peek();
            if (isSymbol(token, "(") || isSymbol(token, "[") || isSymbol(token, "{")) {
                depth++;
                advance();
            } else if (isSymbol(token, ")") || isSymbol(token, "]") || isSymbol(token, "}")) {
                if (depth == 0) {
                    if (insideBlock && isSymbol(token, "}")) {
                        return;
                    }
                    advance();
                    if (isSymbol(token, "}")) {
                        return;
                    }
                } else {
                    depth--;
                    advance();
                    if (depth == 0 && isSymbol(token, "}")) {
                        return;
                    }
                }
            } else if (depth == 0 && isSymbol(token, ";")) {
                advance();
                return;
            } else {
                advance();
            }
        }
    }

    private SyntaxNode parseStatement() {
        Token token = peek();

        if (isSymbol(token, ";")) {
            advance();
            return SyntaxNode.leaf(NodeKind.EMPTY_STATEMENT, ";", token.getSpan());
        }
        if (isSymbol(token, "{")) {
            return parseBlock();
        }
        if (token.getType() == TokenType.SYMBOL && MODIFIERS.contains(token.getText())) {
            advance();
            SyntaxNode modifier = SyntaxNode.leaf(NodeKind.MODIFIER, token.getText(), token.getSpan());
            SyntaxNode statement = parseStatement();
            return SyntaxNode.builder(NodeKind.MODIFIER_CHAIN)
                    .span(SourceSpan.cover(token.getSpan(), statement.getSpan()))
                    .field("modifier", modifier)
                    .field("statement", statement)
                    .build();
        }
        if (token.getType() != TokenType.IDENTIFIER) {
            throw new ParseError("Expected a statement but found '" + token.getText() + "'", token);
        }

        switch (token.getText()) {
            case "module":
                return parseModuleDeclaration();
            case "function":
                if (peekAt(1).getType() == TokenType.IDENTIFIER) {
                    return parseFunctionDeclaration();
                }
                throw new ParseError("Expected a function name", peekAt(1));
            case "use":
            case "include":
                return parseUseStatement();
            case "if":
                return parseIfStatement();
            case "for":
                return parseForStatement();
            default:
                break;
        }

        if (isSymbol(peekAt(1), "=")) {
            return parseAssignmentStatement();
        }
        if (isSymbol(peekAt(1), "(")) {
            return parseModuleCallStatement();
        }
        throw new ParseError("Unexpected '" + token.getText() + "'", token);
    }

    private SyntaxNode parseBlock() {
        Token open = expectSymbol("{");
        List<SyntaxNode> items = new ArrayList<>();
        while (true) {
            drainComments(items);
            if (isSymbol(peek(), "}")) {
                break;
            }
            if (peek().getType() == TokenType.EOF) {
                throw new ParseError("Unclosed '{'", open);
            }
            items.add(parseStatementRecovering(true));
        }
        Token close = expectSymbol("}");
        return SyntaxNode.builder(NodeKind.BLOCK)
                .span(SourceSpan.cover(open.getSpan(), close.getSpan()))
                .children(items)
                .build();
    }

    private SyntaxNode parseModuleDeclaration() {
        Token start = peek();
        SyntaxNode keyword = keyword("module");
        SyntaxNode name = identifier();
        SyntaxNode parameters = parseParameters();

        SyntaxNode.Builder builder = SyntaxNode.builder(NodeKind.MODULE_DECLARATION)
                .child(keyword)
                .field("name", name)
                .field("parameters", parameters);
        SyntaxNode body = parseBody(builder);
        return builder.field("body", body)
                .span(SourceSpan.cover(start.getSpan(), body.getSpan()))
                .build();
    }

    private SyntaxNode parseFunctionDeclaration() {
        Token start = peek();
        SyntaxNode keyword = keyword("function");
        SyntaxNode name = identifier();
        SyntaxNode parameters = parseParameters();
        expectSymbol("=");
        SyntaxNode value = parseExpression();
        Token end = expectSymbol(";");
        return SyntaxNode.builder(NodeKind.FUNCTION_DECLARATION)
                .span(SourceSpan.cover(start.getSpan(), end.getSpan()))
                .child(keyword)
                .field("name", name)
                .field("parameters", parameters)
                .field("value", value)
                .build();
    }

    private SyntaxNode parseUseStatement() {
        Token start = peek();
        SyntaxNode keyword = keyword(start.getText());
        Token path = peek();
        if (path.getType() != TokenType.INCLUDE_PATH) {
            throw new ParseError("Expected <path> after '" + start.getText() + "'", path);
        }
        advance();
        return SyntaxNode.builder(NodeKind.USE_STATEMENT)
                .span(SourceSpan.cover(start.getSpan(), path.getSpan()))
                .field("keyword", keyword)
                .field("path", SyntaxNode.leaf(NodeKind.INCLUDE_PATH, path.getText(), path.getSpan()))
                .build();
    }

    private SyntaxNode parseIfStatement() {
        Token start = peek();
        SyntaxNode.Builder builder = SyntaxNode.builder(NodeKind.IF_STATEMENT).child(keyword("if"));
        expectSymbol("(");
        builder.field("condition", parseExpression());
        expectSymbol(")");

        SyntaxNode consequence = parseBody(builder);
        builder.field("consequence", consequence);
        SyntaxNode last = consequence;

        if (isWord(peek(), "else")) {
            drainComments(builder);
            builder.field("else", keyword("else"));
            SyntaxNode alternative = parseBody(builder);
            builder.field("alternative", alternative);
            last = alternative;
        }
        return builder.span(SourceSpan.cover(start.getSpan(), last.getSpan())).build();
    }

    private SyntaxNode parseForStatement() {
        Token start = peek();
        SyntaxNode.Builder builder = SyntaxNode.builder(NodeKind.FOR_STATEMENT).child(keyword("for"));
        builder.field("bindings", parseArguments());
        SyntaxNode body = parseBody(builder);
        return builder.field("body", body)
                .span(SourceSpan.cover(start.getSpan(), body.getSpan()))
                .build();
    }

    private SyntaxNode parseAssignmentStatement() {
        Token start = peek();
        SyntaxNode name = identifier();
        expectSymbol("=");
        SyntaxNode value = parseExpression();
        Token end = expectSymbol(";");
        return SyntaxNode.builder(NodeKind.ASSIGNMENT)
                .span(SourceSpan.cover(start.getSpan(), end.getSpan()))
                .field("name", name)
                .field("value", value)
                .build();
    }

    /**
     * {@code name(args);} or {@code name(args) statement}. The second form is
     * a transform chain whose head is a module call without a semicolon.
     */
    private SyntaxNode parseModuleCallStatement() {
        Token start = peek();
        SyntaxNode name = identifier();
        SyntaxNode arguments = parseArguments();

        if (isSymbol(peek(), ";")) {
            Token end = advance();
            return SyntaxNode.builder(NodeKind.MODULE_CALL)
                    .span(SourceSpan.cover(start.getSpan(), end.getSpan()))
                    .field("name", name)
                    .field("arguments", arguments)
                    .build();
        }

        SyntaxNode call = SyntaxNode.builder(NodeKind.MODULE_CALL)
                .span(SourceSpan.cover(start.getSpan(), previous().getSpan()))
                .field("name", name)
                .field("arguments", arguments)
                .build();
        SyntaxNode.Builder builder = SyntaxNode.builder(NodeKind.TRANSFORM_CHAIN).field("call", call);
        SyntaxNode body = parseBody(builder);
        return builder.field("body", body)
                .span(SourceSpan.cover(start.getSpan(), body.getSpan()))
                .build();
    }

    /**
     * Parses the statement that a declaration, call, if or for applies to.
     * Comments between the head and the statement become children of the
     * owner so they stay in front of the body.
     */
    private SyntaxNode parseBody(SyntaxNode.Builder owner) {
        drainComments(owner);
        if (peek().getType() == TokenType.EOF) {
            throw new ParseError("Expected a statement before end of file", peek());
        }
        return parseStatement();
    }

    // ---------------------------------------------------------------- lists

    private SyntaxNode parseArguments() {
        return parseDelimited(NodeKind.ARGUMENTS, "(", ")", this::parseArgument);
    }

    private SyntaxNode parseParameters() {
        return parseDelimited(NodeKind.PARAMETERS, "(", ")", this::parseParameter);
    }

    private SyntaxNode parseDelimited(NodeKind kind, String open, String close, ElementParser element) {
        Token start = expectSymbol(open);
        List<SyntaxNode> items = new ArrayList<>();
        drainComments(items);
        if (!isSymbol(peek(), close)) {
            items.add(element.parse());
            drainComments(items);
            if (isSymbol(peek(), ",")) {
                advance();
                parseRemainingElements(items, close, element);
            }
        }
        drainComments(items);
        Token end = expectSymbol(close);
        return SyntaxNode.builder(kind)
                .span(SourceSpan.cover(start.getSpan(), end.getSpan()))
                .children(items)
                .build();
    }

    /**
     * Continues a comma separated list just after a comma. A trailing comma
     * is accepted and dropped.
     */
    private void parseRemainingElements(List<SyntaxNode> items, String close, ElementParser element) {
        while (true) {
            drainComments(items);
            if (isSymbol(peek(), close)) {
                return;
            }
            items.add(element.parse());
            drainComments(items);
            if (!isSymbol(peek(), ",")) {
                return;
            }
            advance();
        }
    }

    private SyntaxNode parseArgument() {
        if (peek().getType() == TokenType.IDENTIFIER && isSymbol(peekAt(1), "=")) {
            Token start = peek();
            SyntaxNode name = identifier();
            expectSymbol("=");
            SyntaxNode value = parseExpression();
            return SyntaxNode.builder(NodeKind.ASSIGNMENT)
                    .span(SourceSpan.cover(start.getSpan(), value.getSpan()))
                    .field("name", name)
                    .field("value", value)
                    .build();
        }
        return parseExpression();
    }

    private SyntaxNode parseParameter() {
        Token start = peek();
        SyntaxNode name = identifier();
        SyntaxNode.Builder builder = SyntaxNode.builder(NodeKind.PARAMETER).field("name", name);
        SourceSpan span = name.getSpan();
        if (isSymbol(peek(), "=")) {
            advance();
            SyntaxNode value = parseExpression();
            builder.field("default", value);
            span = SourceSpan.cover(start.getSpan(), value.getSpan());
        }
        return builder.span(span).build();
    }

    // ---------------------------------------------------------------- expressions

    SyntaxNode parseExpression() {
        SyntaxNode condition = parseBinary(0);
        if (!isSymbol(peek(), "?")) {
            return condition;
        }
        advance();
        SyntaxNode consequence = parseExpression();
        expectSymbol(":");
        SyntaxNode alternative = parseExpression();
        return SyntaxNode.builder(NodeKind.TERNARY_EXPRESSION)
                .span(SourceSpan.cover(condition.getSpan(), alternative.getSpan()))
                .field("condition", condition)
                .field("consequence", consequence)
                .field("alternative", alternative)
                .build();
    }

    private SyntaxNode parseBinary(int level) {
        if (level == BINARY_LEVELS.length) {
            return parseUnary();
        }
        SyntaxNode left = parseBinary(level + 1);
        while (isOneOf(peek(), BINARY_LEVELS[level])) {
            SyntaxNode operator = operator();
            SyntaxNode right = parseBinary(level + 1);
            left = binary(left, operator, right);
        }
        return left;
    }

    private SyntaxNode parseUnary() {
        Token token = peek();
        if (isSymbol(token, "!") || isSymbol(token, "-") || isSymbol(token, "+")) {
            SyntaxNode operator = operator();
            SyntaxNode operand = parseUnary();
            return SyntaxNode.builder(NodeKind.UNARY_EXPRESSION)
                    .span(SourceSpan.cover(token.getSpan(), operand.getSpan()))
                    .field("operator", operator)
                    .field("operand", operand)
                    .build();
        }
        return parsePower();
    }

    private SyntaxNode parsePower() {
        SyntaxNode base = parsePostfix();
        if (!isSymbol(peek(), "^")) {
            return base;
        }
        SyntaxNode operator = operator();
        // right associative, and the exponent may carry its own sign
        SyntaxNode exponent = parseUnary();
        return binary(base, operator, exponent);
    }

    private SyntaxNode parsePostfix() {
        SyntaxNode expression = parsePrimary();
        while (true) {
            if (isSymbol(peek(), "(")) {
                SyntaxNode arguments = parseArguments();
                expression = SyntaxNode.builder(NodeKind.FUNCTION_CALL)
                        .span(SourceSpan.cover(expression.getSpan(), arguments.getSpan()))
                        .field("function", expression)
                        .field("arguments", arguments)
                        .build();
            } else if (isSymbol(peek(), "[")) {
                advance();
                SyntaxNode index = parseExpression();
                Token end = expectSymbol("]");
                expression = SyntaxNode.builder(NodeKind.INDEX_EXPRESSION)
                        .span(SourceSpan.cover(expression.getSpan(), end.getSpan()))
                        .field("value", expression)
                        .field("index", index)
                        .build();
            } else if (isSymbol(peek(), ".")) {
                advance();
                SyntaxNode member = identifier();
                expression = SyntaxNode.builder(NodeKind.DOT_INDEX_EXPRESSION)
                        .span(SourceSpan.cover(expression.getSpan(), member.getSpan()))
                        .field("value", expression)
                        .field("member", member)
                        .build();
            } else {
                return expression;
            }
        }
    }

    private SyntaxNode parsePrimary() {
        Token token = peek();
        switch (token.getType()) {
            case NUMBER:
                advance();
                return SyntaxNode.leaf(NodeKind.NUMBER, token.getText(), token.getSpan());
            case STRING:
                advance();
                return SyntaxNode.leaf(NodeKind.STRING, token.getText(), token.getSpan());
            case IDENTIFIER:
                return parseWordPrimary(token);
            case SYMBOL:
                if (token.is("(")) {
                    advance();
                    SyntaxNode inner = parseExpression();
                    Token end = expectSymbol(")");
                    return SyntaxNode.builder(NodeKind.PARENTHESIZED_EXPRESSION)
                            .span(SourceSpan.cover(token.getSpan(), end.getSpan()))
                            .field("expression", inner)
                            .build();
                }
                if (token.is("[")) {
                    return parseVectorOrRange();
                }
                break;
            default:
                break;
        }
        throw new ParseError("Expected an expression but found '" + token.getText() + "'", token);
    }

    private SyntaxNode parseWordPrimary(Token token) {
        String word = token.getText();
        boolean called = isSymbol(peekAt(1), "(");

        if (word.equals("true") || word.equals("false")) {
            advance();
            return SyntaxNode.leaf(NodeKind.BOOLEAN, word, token.getSpan());
        }
        if (word.equals("undef")) {
            advance();
            return SyntaxNode.leaf(NodeKind.UNDEF, word, token.getSpan());
        }
        if (word.equals("let") && called) {
            return parseLet(false);
        }
        if (word.equals("function") && called) {
            SyntaxNode keyword = keyword("function");
            SyntaxNode parameters = parseParameters();
            SyntaxNode body = parseExpression();
            return SyntaxNode.builder(NodeKind.FUNCTION_LITERAL)
                    .span(SourceSpan.cover(token.getSpan(), body.getSpan()))
                    .child(keyword)
                    .field("parameters", parameters)
                    .field("body", body)
                    .build();
        }
        if ((word.equals("assert") || word.equals("echo")) && called) {
            SyntaxNode name = identifier();
            SyntaxNode arguments = parseArguments();
            if (!canStartExpression(peek())) {
                return SyntaxNode.builder(NodeKind.FUNCTION_CALL)
                        .span(SourceSpan.cover(token.getSpan(), arguments.getSpan()))
                        .field("function", name)
                        .field("arguments", arguments)
                        .build();
            }
            SyntaxNode body = parseExpression();
            NodeKind kind = word.equals("assert") ? NodeKind.ASSERT_EXPRESSION : NodeKind.ECHO_EXPRESSION;
            return SyntaxNode.builder(kind)
                    .span(SourceSpan.cover(token.getSpan(), body.getSpan()))
                    .field("keyword", SyntaxNode.leaf(NodeKind.KEYWORD, word, token.getSpan()))
                    .field("arguments", arguments)
                    .field("body", body)
                    .build();
        }
        return identifier();
    }

    /**
     * {@code let(args) body}; inside a vector the body may itself be a
     * comprehension clause.
     */
    private SyntaxNode parseLet(boolean listElement) {
        Token start = peek();
        SyntaxNode keyword = keyword("let");
        SyntaxNode arguments = parseArguments();
        SyntaxNode body = listElement ? parseListElement() : parseExpression();
        return SyntaxNode.builder(NodeKind.LET_EXPRESSION)
                .span(SourceSpan.cover(start.getSpan(), body.getSpan()))
                .field("keyword", keyword)
                .field("arguments", arguments)
                .field("body", body)
                .build();
    }

    private SyntaxNode parseVectorOrRange() {
        Token start = expectSymbol("[");
        List<SyntaxNode> items = new ArrayList<>();
        drainComments(items);

        if (!isSymbol(peek(), "]")) {
            SyntaxNode first = parseListElement();
            if (!isClause(first) && isSymbol(peek(), ":")) {
                // a range has no list to hold comments, so they move on
                for (SyntaxNode comment : items) {
                    carried.add(commentToken(comment));
                }
                return parseRangeRest(start, first);
            }
            items.add(first);
            drainComments(items);
            if (isSymbol(peek(), ",")) {
                advance();
                parseRemainingElements(items, "]", this::parseListElement);
            }
        }
        drainComments(items);
        Token end = expectSymbol("]");
        return SyntaxNode.builder(NodeKind.VECTOR_LITERAL)
                .span(SourceSpan.cover(start.getSpan(), end.getSpan()))
                .children(items)
                .build();
    }

    private SyntaxNode parseRangeRest(Token start, SyntaxNode first) {
        expectSymbol(":");
        SyntaxNode second = parseExpression();
        SyntaxNode.Builder builder = SyntaxNode.builder(NodeKind.RANGE).field("start", first);
        if (isSymbol(peek(), ":")) {
            advance();
            SyntaxNode third = parseExpression();
            builder.field("step", second).field("end", third);
        } else {
            builder.field("end", second);
        }
        Token end = expectSymbol("]");
        return builder.span(SourceSpan.cover(start.getSpan(), end.getSpan())).build();
    }

    private SyntaxNode parseListElement() {
        Token token = peek();
        boolean called = isSymbol(peekAt(1), "(");

        if (isWord(token, "for") && called) {
            SyntaxNode keyword = keyword("for");
            SyntaxNode bindings = parseArguments();
            SyntaxNode body = parseListElement();
            return SyntaxNode.builder(NodeKind.FOR_CLAUSE)
                    .span(SourceSpan.cover(token.getSpan(), body.getSpan()))
                    .child(keyword)
                    .field("bindings", bindings)
                    .field("body", body)
                    .build();
        }
        if (isWord(token, "if") && called) {
            SyntaxNode.Builder builder = SyntaxNode.builder(NodeKind.IF_CLAUSE).child(keyword("if"));
            expectSymbol("(");
            builder.field("condition", parseExpression());
            expectSymbol(")");
            SyntaxNode consequence = parseListElement();
            builder.field("consequence", consequence);
            SyntaxNode last = consequence;
            if (isWord(peek(), "else")) {
                builder.child(keyword("else"));
                last = parseListElement();
                builder.field("alternative", last);
            }
            return builder.span(SourceSpan.cover(token.getSpan(), last.getSpan())).build();
        }
        if (isWord(token, "each")) {
            SyntaxNode keyword = keyword("each");
            SyntaxNode value = parseListElement();
            return SyntaxNode.builder(NodeKind.EACH_CLAUSE)
                    .span(SourceSpan.cover(token.getSpan(), value.getSpan()))
                    .child(keyword)
                    .field("value", value)
                    .build();
        }
        if (isWord(token, "let") && called) {
            return parseLet(true);
        }
        return parseExpression();
    }

    private static boolean isClause(SyntaxNode node) {
        return node.is(NodeKind.FOR_CLAUSE) || node.is(NodeKind.IF_CLAUSE) || node.is(NodeKind.EACH_CLAUSE)
                || (node.is(NodeKind.LET_EXPRESSION) && isClause(node.getField("body")));
    }

    private static boolean canStartExpression(Token token) {
        switch (token.getType()) {
            case NUMBER:
            case STRING:
                return true;
            case IDENTIFIER:
                return !token.getText().equals("else");
            case SYMBOL:
                return token.is("(") || token.is("[") || token.is("!") || token.is("-") || token.is("+");
            default:
                return false;
        }
    }

    private static SyntaxNode binary(SyntaxNode left, SyntaxNode operator, SyntaxNode right) {
        return SyntaxNode.builder(NodeKind.BINARY_EXPRESSION)
                .span(SourceSpan.cover(left.getSpan(), right.getSpan()))
                .field("left", left)
                .field("operator", operator)
                .field("right", right)
                .build();
    }

    // ---------------------------------------------------------------- comments

    private void drainComments(List<SyntaxNode> into) {
        int before = peek().getSpan().getStartOffset();
        for (Token token : carried) {
            into.add(commentNode(token));
        }
        carried.clear();
        while (commentPos < comments.size()
                && comments.get(commentPos).getSpan().getStartOffset() < before) {
            into.add(commentNode(comments.get(commentPos++)));
        }
    }

    private void drainComments(SyntaxNode.Builder owner) {
        List<SyntaxNode> drained = new ArrayList<>();
        drainComments(drained);
        owner.children(drained);
    }

    private static SyntaxNode commentNode(Token token) {
        return SyntaxNode.leaf(NodeKind.COMMENT, token.getText(), token.getSpan());
    }

    private static Token commentToken(SyntaxNode comment) {
        TokenType type = comment.getText().startsWith("//") ? TokenType.LINE_COMMENT : TokenType.BLOCK_COMMENT;
        return new Token(type, comment.getText(), comment.getSpan());
    }

    // ---------------------------------------------------------------- tokens

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    private Token previous() {
        return tokens.get(pos - 1);
    }

    private Token advance() {
        Token token = tokens.get(pos);
        if (token.getType() != TokenType.EOF) {
            pos++;
        }
        return token;
    }

    private Token expectSymbol(String symbol) {
        Token token = peek();
        if (!isSymbol(token, symbol)) {
            String found = token.getType() == TokenType.EOF ? "end of file" : "'" + token.getText() + "'";
            throw new ParseError("Expected '" + symbol + "' but found " + found, token);
        }
        return advance();
    }

    private SyntaxNode keyword(String word) {
        Token token = peek();
        if (!isWord(token, word)) {
            throw new ParseError("Expected '" + word + "'", token);
        }
        advance();
        return SyntaxNode.leaf(NodeKind.KEYWORD, word, token.getSpan());
    }

    private SyntaxNode identifier() {
        Token token = peek();
        if (token.getType() != TokenType.IDENTIFIER) {
            throw new ParseError("Expected an identifier but found '" + token.getText() + "'", token);
        }
        advance();
        return SyntaxNode.leaf(NodeKind.IDENTIFIER, token.getText(), token.getSpan());
    }

    private SyntaxNode operator() {
        Token token = advance();
        return SyntaxNode.leaf(NodeKind.OPERATOR, token.getText(), token.getSpan());
    }

    private static boolean isSymbol(Token token, String symbol) {
        return token.getType() == TokenType.SYMBOL && token.getText().equals(symbol);
    }

    private static boolean isWord(Token token, String word) {
        return token.getType() == TokenType.IDENTIFIER && token.getText().equals(word);
    }

    private static boolean isOneOf(Token token, String[] symbols) {
        if (token.getType() != TokenType.SYMBOL) {
            return false;
        }
        for (String symbol : symbols) {
            if (token.getText().equals(symbol)) {
                return true;
            }
        }
        return false;
    }
}
