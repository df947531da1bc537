package com.spreadsheet.formula.engine.functions;

import com.spreadsheet.formula.engine.EvaluationContext;
import com.spreadsheet.formula.engine.ast.Node;
import com.spreadsheet.formula.models.FormulaError;
import com.spreadsheet.formula.models.Value;

import java.util.List;

/**
 * ABS, ROUND, FLOOR, CEILING, MOD, POWER and SQRT.
 */
final class MathFunctions {

    // From 2^52 on every double is a whole number
    private static final double WHOLE_NUMBER_LIMIT = 4503599627370496.0;

    private MathFunctions() {
    }

    static Value abs(List<Node> args, EvaluationContext context) {
        return Value.number(Math.abs(context.evaluateNumber(args.get(0))));
    }

    /**
     * ROUND(value, [digits=0]); halves round up, negative digits round left of the point.
     */
    static Value round(List<Node> args, EvaluationContext context) {
        double num = context.evaluateNumber(args.get(0));
        double digits = args.size() == 2 ? context.evaluateNumber(args.get(1)) : 0;
        double factor = Math.pow(10, digits);
        return Value.number(roundHalfUp(num * factor) / factor);
    }

    static Value floor(List<Node> args, EvaluationContext context) {
        double num = context.evaluateNumber(args.get(0));
        if (args.size() == 2) {
            double significance = context.evaluateNumber(args.get(1));
            if (significance == 0) {
                return Value.error(FormulaError.DIV_ZERO);
            }
            return Value.number(Math.floor(num / significance) * significance);
        }
        return Value.number(Math.floor(num));
    }

    static Value ceiling(List<Node> args, EvaluationContext context) {
        double num = context.evaluateNumber(args.get(0));
        if (args.size() == 2) {
            double significance = context.evaluateNumber(args.get(1));
            if (significance == 0) {
                return Value.error(FormulaError.DIV_ZERO);
            }
            return Value.number(Math.ceil(num / significance) * significance);
        }
        return Value.number(Math.ceil(num));
    }

    /**
     * MOD(a, b); the result takes the sign of the divisor, so MOD(-1, 3) is 2.
     */
    static Value mod(List<Node> args, EvaluationContext context) {
        double a = context.evaluateNumber(args.get(0));
        double b = context.evaluateNumber(args.get(1));
        if (b == 0) {
            return Value.error(FormulaError.DIV_ZERO);
        }
        return Value.number(((a % b) + b) % b);
    }

    static Value power(List<Node> args, EvaluationContext context) {
        double base = context.evaluateNumber(args.get(0));
        double exponent = context.evaluateNumber(args.get(1));
        return Value.number(Math.pow(base, exponent));
    }

    static Value sqrt(List<Node> args, EvaluationContext context) {
        double num = context.evaluateNumber(args.get(0));
        if (num < 0) {
            return Value.error(FormulaError.VALUE);
        }
        return Value.number(Math.sqrt(num));
    }

    static double roundHalfUp(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || Math.abs(value) >= WHOLE_NUMBER_LIMIT) {
            return value;
        }
        return Math.round(value);
    }
}
