package com.spreadsheet.formula.engine.ast;

/**
 * Prefix operator applied to one operand. Only "-" is produced by the parser;
 * a unary "+" is dropped while parsing.
 */
public final class UnaryNode extends Node {
    private final String operator;
    private final Node operand;

    public UnaryNode(String operator, Node operand) {
        this.operator = operator;
        this.operand = operand;
    }

    public String getOperator() {
        return operator;
    }

    public Node getOperand() {
        return operand;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.UNARY;
    }

    @Override
    public String toString() {
        return "(" + operator + operand + ")";
    }
}
