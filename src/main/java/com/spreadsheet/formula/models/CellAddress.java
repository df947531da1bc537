package com.spreadsheet.formula.models;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable address of a single spreadsheet cell.
 * Rows and columns are both 1-based: "A1" is row 1, column 1
 * and "AB12" is row 12, column 28.
 */
public final class CellAddress {

    private final int row;
    private final int column;

    private CellAddress(int row, int column) {
        this.row = row;
        this.column = column;
    }

    /**
     * Builds an address from 1-based row and column numbers.
     */
    public static CellAddress of(int row, int column) {
        if (row < 1 || column < 1) {
            throw new IllegalArgumentException("Row and column must be positive, got " + row + "," + column);
        }
        return new CellAddress(row, column);
    }

    /**
     * Parses "B12" style identifiers (case-insensitive).
     * Returns empty for anything that isn't letters followed by digits,
     * and for a zero row.
     */
    public static Optional<CellAddress> parse(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        String upper = text.toUpperCase(Locale.ROOT);

        int i = 0;
        long column = 0;
        while (i < upper.length() && upper.charAt(i) >= 'A' && upper.charAt(i) <= 'Z') {
            column = column * 26 + (upper.charAt(i) - 'A' + 1);
            if (column > Integer.MAX_VALUE) {
                return Optional.empty();
            }
            i++;
        }
        // At least one letter is required
        if (i == 0 || i == upper.length()) {
            return Optional.empty();
        }

        long row = 0;
        while (i < upper.length()) {
            char c = upper.charAt(i);
            if (c < '0' || c > '9') {
                return Optional.empty();
            }
            row = row * 10 + (c - '0');
            if (row > Integer.MAX_VALUE) {
                return Optional.empty();
            }
            i++;
        }
        if (row == 0) {
            return Optional.empty();
        }
        return Optional.of(new CellAddress((int) row, (int) column));
    }

    /**
     * Canonical identifier for the given 1-based row and column, e.g. (12, 2) -> "B12".
     */
    public static String cellId(int row, int column) {
        return of(row, column).toString();
    }

    /**
     * Converts a 1-based column number to its letters: 1 -> "A", 27 -> "AA".
     */
    public static String columnLabel(int column) {
        StringBuilder label = new StringBuilder();
        int n = column;
        while (n > 0) {
            int rem = (n - 1) % 26;
            label.insert(0, (char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return label.toString();
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellAddress)) {
            return false;
        }
        CellAddress other = (CellAddress) o;
        return row == other.row && column == other.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column);
    }

    @Override
    public String toString() {
        return columnLabel(column) + row;
    }
}
