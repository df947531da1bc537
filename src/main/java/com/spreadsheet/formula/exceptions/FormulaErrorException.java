package com.spreadsheet.formula.exceptions;

import com.spreadsheet.formula.models.FormulaError;

/**
 * Thrown inside the evaluator when a sub-expression produces an error,
 * e.g. coercing "abc" to a number. The enclosing function call or the
 * top-level evaluate catches it and returns the carried error as a value.
 */
public class FormulaErrorException extends RuntimeException {
    private final FormulaError error;

    public FormulaErrorException(FormulaError error) {
        super(error.getSentinel(), null, false, false);
        this.error = error;
    }

    public FormulaError getError() {
        return error;
    }
}
