package com.spreadsheet.formula.engine.ast;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Call of a named function with its argument expressions, unevaluated.
 */
public final class FunctionCallNode extends Node {
    private final String name;
    private final List<Node> arguments;

    public FunctionCallNode(String name, List<Node> arguments) {
        this.name = name;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    public String getName() {
        return name;
    }

    public List<Node> getArguments() {
        return arguments;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.FUNCTION_CALL;
    }

    @Override
    public String toString() {
        return name + arguments.stream().map(Node::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
