package com.spreadsheet.formula.engine.functions;

/**
 * A named built-in function with the number of arguments it accepts.
 */
public final class FunctionDefinition {

    // maxArgs value for functions taking any number of arguments
    public static final int VARIADIC = Integer.MAX_VALUE;

    private final String name;
    private final int minArgs;
    private final int maxArgs;
    private final BuiltinFunction body;

    public FunctionDefinition(String name, int minArgs, int maxArgs, BuiltinFunction body) {
        this.name = name;
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
        this.body = body;
    }

    public boolean acceptsArgumentCount(int count) {
        return count >= minArgs && count <= maxArgs;
    }

    public String getName() {
        return name;
    }

    public int getMinArgs() {
        return minArgs;
    }

    public int getMaxArgs() {
        return maxArgs;
    }

    public BuiltinFunction getBody() {
        return body;
    }
}
