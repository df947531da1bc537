package com.spreadsheet.formula.engine.functions;

import com.spreadsheet.formula.engine.Coercions;
import com.spreadsheet.formula.engine.EvaluationContext;
import com.spreadsheet.formula.engine.ast.Node;
import com.spreadsheet.formula.models.FormulaError;
import com.spreadsheet.formula.models.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SUM, AVERAGE, COUNT, COUNTA, MIN and MAX over the flattened argument list.
 * Blanks and non-numeric text are skipped; numeric text counts as a number.
 */
final class AggregateFunctions {

    private AggregateFunctions() {
    }

    static Value sum(List<Node> args, EvaluationContext context) {
        List<Value> values = context.flatten(args);
        Optional<Value> error = firstError(values);
        if (error.isPresent()) {
            return error.get();
        }
        double total = 0;
        for (double n : collectNumbers(values)) {
            total += n;
        }
        return Value.number(total);
    }

    static Value average(List<Node> args, EvaluationContext context) {
        List<Value> values = context.flatten(args);
        Optional<Value> error = firstError(values);
        if (error.isPresent()) {
            return error.get();
        }
        List<Double> numbers = collectNumbers(values);
        if (numbers.isEmpty()) {
            return Value.error(FormulaError.DIV_ZERO);
        }
        double total = 0;
        for (double n : numbers) {
            total += n;
        }
        return Value.number(total / numbers.size());
    }

    // Errors are not numbers, so they are simply not counted
    static Value count(List<Node> args, EvaluationContext context) {
        return Value.number(collectNumbers(context.flatten(args)).size());
    }

    static Value countA(List<Node> args, EvaluationContext context) {
        int count = 0;
        for (Value v : context.flatten(args)) {
            if (!v.isBlank()) {
                count++;
            }
        }
        return Value.number(count);
    }

    static Value min(List<Node> args, EvaluationContext context) {
        return extremum(args, context, true);
    }

    static Value max(List<Node> args, EvaluationContext context) {
        return extremum(args, context, false);
    }

    private static Value extremum(List<Node> args, EvaluationContext context, boolean lowest) {
        List<Value> values = context.flatten(args);
        Optional<Value> error = firstError(values);
        if (error.isPresent()) {
            return error.get();
        }
        List<Double> numbers = collectNumbers(values);
        if (numbers.isEmpty()) {
            return Value.number(0);
        }
        double result = numbers.get(0);
        for (double n : numbers) {
            result = lowest ? Math.min(result, n) : Math.max(result, n);
        }
        return Value.number(result);
    }

    static Optional<Value> firstError(List<Value> values) {
        return values.stream().filter(Value::isError).findFirst();
    }

    static List<Double> collectNumbers(List<Value> values) {
        List<Double> numbers = new ArrayList<>();
        for (Value v : values) {
            Double n = Coercions.numericValue(v);
            if (n != null) {
                numbers.add(n);
            }
        }
        return numbers;
    }
}
