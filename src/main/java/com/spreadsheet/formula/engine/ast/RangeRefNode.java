package com.spreadsheet.formula.engine.ast;

/**
 * Reference to a rectangle of cells as written, e.g. "A1:B5".
 * Kept as text so functions like INDEX can read the corners.
 */
public final class RangeRefNode extends Node {
    private final String range;

    public RangeRefNode(String range) {
        this.range = range;
    }

    public String getRange() {
        return range;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.RANGE_REF;
    }

    @Override
    public String toString() {
        return range;
    }
}
