package com.spreadsheet.formula.exceptions;

/**
 * Thrown by the parser when a formula's tokens don't form a valid expression
 * (unexpected token, unmatched parenthesis, trailing input).
 * The engine turns it into #VALUE!; it never reaches callers of evaluate.
 */
public class FormulaParseException extends RuntimeException {
    public FormulaParseException(String message) {
        super(message);
    }
}
