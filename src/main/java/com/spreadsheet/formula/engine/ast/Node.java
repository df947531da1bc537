package com.spreadsheet.formula.engine.ast;

/**
 * Base of the immutable expression tree built by the parser.
 * Each subclass reports its {@link NodeKind} so the evaluator can switch on it.
 */
public abstract class Node {

    public abstract NodeKind getKind();
}
