package com.scadformatter.plugins.openscad.syntax;

/**
 * Every kind of node the OpenSCAD parser can produce.
 */
public enum NodeKind {
    SOURCE_FILE("source_file"),

    // statements
    USE_STATEMENT("use_statement"),
    MODULE_DECLARATION("module_declaration"),
    FUNCTION_DECLARATION("function_declaration"),
    BLOCK("block"),
    TRANSFORM_CHAIN("transform_chain"),
    MODULE_CALL("module_call"),
    MODIFIER_CHAIN("modifier_chain"),
    IF_STATEMENT("if_statement"),
    FOR_STATEMENT("for_statement"),
    ASSIGNMENT("assignment"),
    EMPTY_STATEMENT("empty_statement"),

    // lists
    PARAMETERS("parameters"),
    PARAMETER("parameter"),
    ARGUMENTS("arguments"),

    // expressions
    BINARY_EXPRESSION("binary_expression"),
    UNARY_EXPRESSION("unary_expression"),
    TERNARY_EXPRESSION("ternary_expression"),
    PARENTHESIZED_EXPRESSION("parenthesized_expression"),
    FUNCTION_CALL("function_call"),
    INDEX_EXPRESSION("index_expression"),
    DOT_INDEX_EXPRESSION("dot_index_expression"),
    LET_EXPRESSION("let_expression"),
    ASSERT_EXPRESSION("assert_expression"),
    ECHO_EXPRESSION("echo_expression"),
    FUNCTION_LITERAL("function_literal"),
    VECTOR_LITERAL("vector_literal"),
    RANGE("range"),
    FOR_CLAUSE("for_clause"),
    IF_CLAUSE("if_clause"),
    EACH_CLAUSE("each_clause"),

    // leaves
    IDENTIFIER("identifier"),
    NUMBER("number"),
    STRING("string"),
    BOOLEAN("boolean"),
    UNDEF("undef"),
    OPERATOR("operator"),
    MODIFIER("modifier"),
    KEYWORD("keyword"),
    INCLUDE_PATH("include_path"),
    COMMENT("comment"),

    /** Source the parser could not make sense of, kept byte for byte. */
    ERROR("error");

    private final String grammarName;

    NodeKind(String grammarName) {
        this.grammarName = grammarName;
    }

    public String getGrammarName() {
        return grammarName;
    }

    /**
     * Kinds that may stand as a statement in a file or block.
     */
    public boolean isStatement() {
        return switch (this) {
            case USE_STATEMENT, MODULE_DECLARATION, FUNCTION_DECLARATION, BLOCK, TRANSFORM_CHAIN,
                    MODULE_CALL, MODIFIER_CHAIN, IF_STATEMENT, FOR_STATEMENT, ASSIGNMENT,
                    EMPTY_STATEMENT, ERROR -> true;
            default -> false;
        };
    }
}
