package com.spreadsheet.formula.models;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Enumerates display formats a cell can carry:
 * PLAIN, NUMBER, CURRENCY, PERCENT, DATE.
 */
public enum CellFormat {
    PLAIN,
    NUMBER,
    CURRENCY,
    PERCENT,
    DATE;

    /**
     * Allows case-insensitive JSON input.
     * For example, "currency" -> CURRENCY. A missing or unknown format is PLAIN,
     * so the value is shown as it is.
     */
    @JsonCreator
    public static CellFormat fromValue(String value) {
        if (value == null) {
            return PLAIN;
        }
        String name = value.trim().toUpperCase(Locale.ROOT);
        for (CellFormat format : values()) {
            if (format.name().equals(name)) {
                return format;
            }
        }
        return PLAIN;
    }
}
