package com.spreadsheet.formula.engine.ast;

public final class StringNode extends Node {
    private final String value;

    public StringNode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.STRING;
    }

    @Override
    public String toString() {
        return "\"" + value + "\"";
    }
}
