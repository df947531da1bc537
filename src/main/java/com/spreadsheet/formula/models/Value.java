package com.spreadsheet.formula.models;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;

/**
 * Result of evaluating a formula or resolving a cell.
 * Holds exactly one of:
 * - a number (double)
 * - a text string (the empty string stands for a blank cell)
 * - an error (one of the five sentinels)
 */
public final class Value {

    public static final Value EMPTY = new Value(ValueType.TEXT, 0, "", null);
    public static final Value TRUE = number(1);
    public static final Value FALSE = number(0);

    private final ValueType type;
    private final double number;
    private final String text;
    private final FormulaError error;

    private Value(ValueType type, double number, String text, FormulaError error) {
        this.type = type;
        this.number = number;
        this.text = text;
        this.error = error;
    }

    public static Value number(double number) {
        return new Value(ValueType.NUMBER, number, null, null);
    }

    public static Value text(String text) {
        if (text == null || text.isEmpty()) {
            return EMPTY;
        }
        return new Value(ValueType.TEXT, 0, text, null);
    }

    public static Value error(FormulaError error) {
        return new Value(ValueType.ERROR, 0, null, Objects.requireNonNull(error));
    }

    public static Value bool(boolean condition) {
        return condition ? TRUE : FALSE;
    }

    public ValueType getType() {
        return type;
    }

    public boolean isNumber() {
        return type == ValueType.NUMBER;
    }

    public boolean isText() {
        return type == ValueType.TEXT;
    }

    public boolean isError() {
        return type == ValueType.ERROR;
    }

    /**
     * True for the empty text value, i.e. a blank cell.
     */
    public boolean isBlank() {
        return type == ValueType.TEXT && text.isEmpty();
    }

    public double getNumber() {
        if (type != ValueType.NUMBER) {
            throw new IllegalStateException("Not a number: " + this);
        }
        return number;
    }

    public String getText() {
        if (type != ValueType.TEXT) {
            throw new IllegalStateException("Not text: " + this);
        }
        return text;
    }

    public FormulaError getError() {
        if (type != ValueType.ERROR) {
            throw new IllegalStateException("Not an error: " + this);
        }
        return error;
    }

    /**
     * The value as callers outside the engine see it:
     * a Double for numbers, the text itself, or the error sentinel string.
     */
    public Object toExternal() {
        switch (type) {
            case NUMBER:
                return number;
            case ERROR:
                return error.getSentinel();
            default:
                return text;
        }
    }

    /**
     * Renders a number the way it shows in a cell: integers without a
     * fraction ("3", not "3.0"), others in their shortest decimal form.
     */
    public static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value == 0) {
            return "0";
        }
        double abs = Math.abs(value);
        if (abs >= 1e21 || abs < 1e-6) {
            // Exponent form: 1.0E21 -> 1e+21, 1.5E-7 -> 1.5e-7
            String repr = Double.toString(value).toLowerCase(Locale.ROOT);
            int e = repr.indexOf('e');
            String mantissa = repr.substring(0, e);
            String exponent = repr.substring(e + 1);
            if (mantissa.endsWith(".0")) {
                mantissa = mantissa.substring(0, mantissa.length() - 2);
            }
            if (!exponent.startsWith("-")) {
                exponent = "+" + exponent;
            }
            return mantissa + "e" + exponent;
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Value)) {
            return false;
        }
        Value other = (Value) o;
        return type == other.type
                && Double.compare(number, other.number) == 0
                && Objects.equals(text, other.text)
                && error == other.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, number, text, error);
    }

    @Override
    public String toString() {
        switch (type) {
            case NUMBER:
                return formatNumber(number);
            case ERROR:
                return error.getSentinel();
            default:
                return text;
        }
    }
}
