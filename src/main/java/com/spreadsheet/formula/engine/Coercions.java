package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.models.FormulaError;
import com.spreadsheet.formula.models.Value;

import java.util.regex.Pattern;

/**
 * Conversions between numbers and text used by operators and functions.
 * Failures are signalled with {@link FormulaErrorException}.
 */
public final class Coercions {

    // Optional sign, digits with optional fraction (or a bare fraction), optional exponent
    private static final Pattern NUMERIC = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private Coercions() {
    }

    /**
     * Parses numeric-looking text (surrounding whitespace allowed).
     * Returns null for blank or non-numeric text.
     */
    public static Double parseNumber(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty() || !NUMERIC.matcher(trimmed).matches()) {
            return null;
        }
        return Double.parseDouble(trimmed);
    }

    /**
     * Interprets stored cell data that isn't a formula:
     * numbers become numbers, an exact error sentinel becomes that error, the rest is text.
     */
    public static Value fromData(String raw) {
        Double number = parseNumber(raw);
        if (number != null) {
            return Value.number(number);
        }
        return FormulaError.fromSentinel(raw)
                .map(Value::error)
                .orElseGet(() -> Value.text(raw));
    }

    /**
     * Number coercion: blank text is 0, numeric text is parsed,
     * errors and other text throw.
     */
    public static double toNumber(Value value) {
        switch (value.getType()) {
            case NUMBER:
                return value.getNumber();
            case ERROR:
                throw new FormulaErrorException(value.getError());
            default:
                String text = value.getText();
                if (text.trim().isEmpty()) {
                    return 0;
                }
                Double parsed = parseNumber(text);
                if (parsed == null) {
                    throw new FormulaErrorException(FormulaError.VALUE);
                }
                return parsed;
        }
    }

    /**
     * Text coercion: numbers use their display form, errors throw.
     */
    public static String toText(Value value) {
        if (value.isError()) {
            throw new FormulaErrorException(value.getError());
        }
        return value.toString();
    }

    /**
     * The number a value stands for when it is a number or non-blank numeric text;
     * null otherwise. Used where text and numbers are compared or counted.
     */
    public static Double numericValue(Value value) {
        if (value.isNumber()) {
            return value.getNumber();
        }
        if (value.isText()) {
            return parseNumber(value.getText());
        }
        return null;
    }

    /**
     * Condition test used by IF: non-zero numbers, and text other than "" and "0".
     */
    public static boolean isTruthy(Value value) {
        if (value.isNumber()) {
            return value.getNumber() != 0;
        }
        if (value.isError()) {
            throw new FormulaErrorException(value.getError());
        }
        String text = value.getText();
        return !text.isEmpty() && !text.equals("0");
    }
}
