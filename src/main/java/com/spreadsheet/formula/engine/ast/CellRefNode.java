package com.spreadsheet.formula.engine.ast;

/**
 * Reference to a single cell, e.g. "B12" (stored uppercased).
 */
public final class CellRefNode extends Node {
    private final String ref;

    public CellRefNode(String ref) {
        this.ref = ref;
    }

    public String getRef() {
        return ref;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CELL_REF;
    }

    @Override
    public String toString() {
        return ref;
    }
}
