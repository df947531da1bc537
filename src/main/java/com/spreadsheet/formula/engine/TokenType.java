package com.spreadsheet.formula.engine;

/**
 * Kinds of token produced by the {@link Tokenizer}.
 */
public enum TokenType {
    NUMBER,
    STRING,
    CELL_REF,
    RANGE_REF,
    FUNCTION,
    LPAREN,
    RPAREN,
    COMMA,
    COLON,
    OPERATOR,
    COMPARISON,
    CONCAT,
    EOF
}
