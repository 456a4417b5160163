package com.scadformatter.plugins.openscad.syntax;

public enum TokenType {
    IDENTIFIER,
    NUMBER,
    STRING,
    // the <...> argument of use and include
    INCLUDE_PATH,
    LINE_COMMENT,
    BLOCK_COMMENT,
    // operators and punctuation
    SYMBOL,
    EOF
}
