package com.spreadsheet.formula.models;

/**
 * Result of POST /formula/evaluate, e.g.
 * { "value": 14.0, "type": "NUMBER", "error": false }
 * or
 * { "value": "#DIV/0!", "type": "ERROR", "error": true }
 */
public class EvaluateFormulaResponse {
    private final Object value;
    private final ValueType type;
    private final boolean error;

    public EvaluateFormulaResponse(Object value, ValueType type, boolean error) {
        this.value = value;
        this.type = type;
        this.error = error;
    }

    public static EvaluateFormulaResponse from(Value value) {
        return new EvaluateFormulaResponse(value.toExternal(), value.getType(), value.isError());
    }

    public Object getValue() {
        return value;
    }

    public ValueType getType() {
        return type;
    }

    public boolean isError() {
        return error;
    }
}
