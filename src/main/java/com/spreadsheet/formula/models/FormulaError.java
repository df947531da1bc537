package com.spreadsheet.formula.models;

import java.util.Optional;

/**
 * The five error results a formula can produce.
 * Each has a fixed sentinel string, which is what callers see.
 */
public enum FormulaError {
    REF("#REF!"),
    VALUE("#VALUE!"),
    DIV_ZERO("#DIV/0!"),
    NAME("#NAME?"),
    CIRCULAR("#CIRC!");

    private final String sentinel;

    FormulaError(String sentinel) {
        this.sentinel = sentinel;
    }

    public String getSentinel() {
        return sentinel;
    }

    /**
     * Looks up the error whose sentinel is exactly the given text.
     */
    public static Optional<FormulaError> fromSentinel(String text) {
        for (FormulaError error : values()) {
            if (error.sentinel.equals(text)) {
                return Optional.of(error);
            }
        }
        return Optional.empty();
    }

    public static boolean isSentinel(String text) {
        return fromSentinel(text).isPresent();
    }
}
