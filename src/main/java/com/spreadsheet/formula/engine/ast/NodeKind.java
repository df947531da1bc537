package com.spreadsheet.formula.engine.ast;

/**
 * Enumerates the kinds of expression tree node.
 */
public enum NodeKind {
    NUMBER,
    STRING,
    CELL_REF,
    RANGE_REF,
    UNARY,
    BINARY,
    FUNCTION_CALL
}
