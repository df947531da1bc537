package com.spreadsheet.formula.engine.ast;

public final class NumberNode extends Node {
    private final double value;

    public NumberNode(double value) {
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.NUMBER;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
