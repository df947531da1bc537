package com.spreadsheet.formula.engine.ast;

/**
 * Infix operator with two operands: arithmetic (+ - * / ^),
 * concatenation (&) or comparison (= <> < > <= >=).
 */
public final class BinaryNode extends Node {
    private final String operator;
    private final Node left;
    private final Node right;

    public BinaryNode(String operator, Node left, Node right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public String getOperator() {
        return operator;
    }

    public Node getLeft() {
        return left;
    }

    public Node getRight() {
        return right;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.BINARY;
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
