package com.spreadsheet.formula.models;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A rectangle of cells given by two corners, e.g. "A1:B3".
 * The corners are normalized on construction so "B3:A1"
 * describes the same rectangle as "A1:B3".
 */
public final class CellRange {

    private final CellAddress topLeft;
    private final CellAddress bottomRight;

    private CellRange(CellAddress topLeft, CellAddress bottomRight) {
        this.topLeft = topLeft;
        this.bottomRight = bottomRight;
    }

    /**
     * Builds the rectangle spanned by two corners, in any order.
     */
    public static CellRange of(CellAddress first, CellAddress second) {
        CellAddress topLeft = CellAddress.of(
                Math.min(first.getRow(), second.getRow()),
                Math.min(first.getColumn(), second.getColumn()));
        CellAddress bottomRight = CellAddress.of(
                Math.max(first.getRow(), second.getRow()),
                Math.max(first.getColumn(), second.getColumn()));
        return new CellRange(topLeft, bottomRight);
    }

    /**
     * Parses "A1:B3". Returns empty unless there are exactly two valid corners.
     */
    public static Optional<CellRange> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String[] parts = text.split(":", -1);
        if (parts.length != 2) {
            return Optional.empty();
        }
        Optional<CellAddress> first = CellAddress.parse(parts[0]);
        Optional<CellAddress> second = CellAddress.parse(parts[1]);
        if (first.isEmpty() || second.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(of(first.get(), second.get()));
    }

    /**
     * Expands a range string into its cell ids, row by row.
     * An unparseable range expands to an empty list.
     */
    public static List<String> expandRange(String text) {
        return parse(text)
                .map(CellRange::expand)
                .orElse(Collections.emptyList());
    }

    /**
     * All cell ids of the rectangle in row-major order:
     * "A1:B3" -> [A1, B1, A2, B2, A3, B3].
     */
    public List<String> expand() {
        List<String> cells = new ArrayList<>();
        int rows = rowCount();
        int columns = columnCount();
        // Offsets rather than coordinates, so a corner at Integer.MAX_VALUE can't overflow the loop
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                cells.add(CellAddress.cellId(topLeft.getRow() + i, topLeft.getColumn() + j));
            }
        }
        return cells;
    }

    public boolean contains(CellAddress address) {
        return address.getRow() >= topLeft.getRow() && address.getRow() <= bottomRight.getRow()
                && address.getColumn() >= topLeft.getColumn() && address.getColumn() <= bottomRight.getColumn();
    }

    public int rowCount() {
        return bottomRight.getRow() - topLeft.getRow() + 1;
    }

    public int columnCount() {
        return bottomRight.getColumn() - topLeft.getColumn() + 1;
    }

    /**
     * Number of cells in the rectangle, as a long since rows times columns can exceed an int.
     */
    public long cellCount() {
        return (long) rowCount() * columnCount();
    }

    public CellAddress getTopLeft() {
        return topLeft;
    }

    public CellAddress getBottomRight() {
        return bottomRight;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange other = (CellRange) o;
        return topLeft.equals(other.topLeft) && bottomRight.equals(other.bottomRight);
    }

    @Override
    public int hashCode() {
        return Objects.hash(topLeft, bottomRight);
    }

    @Override
    public String toString() {
        return topLeft + ":" + bottomRight;
    }
}
