package com.spreadsheet.formula.engine.functions;

import com.spreadsheet.formula.engine.Coercions;
import com.spreadsheet.formula.engine.EvaluationContext;
import com.spreadsheet.formula.engine.ast.Node;
import com.spreadsheet.formula.models.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * IF, AND, OR, NOT and IFERROR. Results are 1 for true and 0 for false.
 */
final class LogicalFunctions {

    private static final Logger log = LoggerFactory.getLogger(LogicalFunctions.class);

    private LogicalFunctions() {
    }

    /**
     * IF(condition, then, [else=""]). Only the chosen branch is evaluated.
     */
    static Value ifFunction(List<Node> args, EvaluationContext context) {
        Value condition = context.evaluateOrThrow(args.get(0));
        if (Coercions.isTruthy(condition)) {
            return context.evaluate(args.get(1));
        }
        return args.size() == 3 ? context.evaluate(args.get(2)) : Value.EMPTY;
    }

    // Anything that isn't a non-zero number, blanks and text included, makes AND false
    static Value and(List<Node> args, EvaluationContext context) {
        for (Value v : context.flatten(args)) {
            if (v.isError()) {
                return v;
            }
            Double n = Coercions.numericValue(v);
            if (n == null || n == 0) {
                return Value.FALSE;
            }
        }
        return Value.TRUE;
    }

    static Value or(List<Node> args, EvaluationContext context) {
        for (Value v : context.flatten(args)) {
            if (v.isError()) {
                return v;
            }
            Double n = Coercions.numericValue(v);
            if (n != null && n != 0) {
                return Value.TRUE;
            }
        }
        return Value.FALSE;
    }

    static Value not(List<Node> args, EvaluationContext context) {
        return Value.bool(context.evaluateNumber(args.get(0)) == 0);
    }

    /**
     * IFERROR(value, fallback): the fallback replaces an error result
     * or any failure while evaluating the first argument.
     */
    static Value ifError(List<Node> args, EvaluationContext context) {
        Value value;
        try {
            value = context.evaluate(args.get(0));
        } catch (RuntimeException e) {
            log.debug("IFERROR caught a failure in its first argument", e);
            return context.evaluate(args.get(1));
        }
        if (value.isError()) {
            return context.evaluate(args.get(1));
        }
        return value;
    }
}
