package com.spreadsheet.formula.engine.functions;

import com.spreadsheet.formula.engine.Coercions;
import com.spreadsheet.formula.engine.EvaluationContext;
import com.spreadsheet.formula.engine.NumberFormats;
import com.spreadsheet.formula.engine.ast.Node;
import com.spreadsheet.formula.models.FormulaError;
import com.spreadsheet.formula.models.Value;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * CONCATENATE, UPPER, LOWER, LEN, LEFT, RIGHT, MID, TRIM, SUBSTITUTE and TEXT.
 * Character positions are 1-based.
 */
final class TextFunctions {

    private TextFunctions() {
    }

    static Value concatenate(List<Node> args, EvaluationContext context) {
        List<Value> values = context.flatten(args);
        Optional<Value> error = AggregateFunctions.firstError(values);
        if (error.isPresent()) {
            return error.get();
        }
        StringBuilder joined = new StringBuilder();
        for (Value v : values) {
            joined.append(Coercions.toText(v));
        }
        return Value.text(joined.toString());
    }

    static Value upper(List<Node> args, EvaluationContext context) {
        return Value.text(context.evaluateText(args.get(0)).toUpperCase(Locale.ROOT));
    }

    static Value lower(List<Node> args, EvaluationContext context) {
        return Value.text(context.evaluateText(args.get(0)).toLowerCase(Locale.ROOT));
    }

    static Value len(List<Node> args, EvaluationContext context) {
        return Value.number(context.evaluateText(args.get(0)).length());
    }

    static Value left(List<Node> args, EvaluationContext context) {
        String s = context.evaluateText(args.get(0));
        double n = args.size() == 2 ? context.evaluateNumber(args.get(1)) : 1;
        return Value.text(s.substring(0, clamp(n, s.length())));
    }

    static Value right(List<Node> args, EvaluationContext context) {
        String s = context.evaluateText(args.get(0));
        double n = args.size() == 2 ? context.evaluateNumber(args.get(1)) : 1;
        return Value.text(s.substring(clamp(s.length() - n, s.length())));
    }

    /**
     * MID(text, start, length) with a 1-based start.
     */
    static Value mid(List<Node> args, EvaluationContext context) {
        String s = context.evaluateText(args.get(0));
        double start = context.evaluateNumber(args.get(1));
        double length = context.evaluateNumber(args.get(2));
        if (start < 1 || length < 0) {
            return Value.error(FormulaError.VALUE);
        }
        int from = clamp(start - 1, s.length());
        int to = clamp(start - 1 + length, s.length());
        return Value.text(s.substring(from, to));
    }

    /**
     * Trims both ends and collapses inner runs of whitespace to one space.
     */
    static Value trim(List<Node> args, EvaluationContext context) {
        return Value.text(context.evaluateText(args.get(0)).trim().replaceAll("\\s+", " "));
    }

    /**
     * SUBSTITUTE(text, old, new, [occurrence]); without an occurrence every match is replaced.
     */
    static Value substitute(List<Node> args, EvaluationContext context) {
        String text = context.evaluateText(args.get(0));
        String oldText = context.evaluateText(args.get(1));
        String newText = context.evaluateText(args.get(2));

        if (args.size() == 4) {
            double occurrence = context.evaluateNumber(args.get(3));
            if (occurrence < 1) {
                return Value.error(FormulaError.VALUE);
            }
            if (oldText.isEmpty()) {
                return Value.text(text);
            }
            int count = 0;
            int idx = -1;
            int searchFrom = 0;
            while (count < occurrence) {
                idx = text.indexOf(oldText, searchFrom);
                if (idx == -1) {
                    return Value.text(text);
                }
                count++;
                searchFrom = idx + 1;
            }
            return Value.text(text.substring(0, idx) + newText + text.substring(idx + oldText.length()));
        }
        if (oldText.isEmpty()) {
            return Value.text(text);
        }
        return Value.text(text.replace(oldText, newText));
    }

    /**
     * TEXT(value, format) for a handful of number, percent and date patterns.
     * Unknown patterns give the plain number.
     */
    static Value text(List<Node> args, EvaluationContext context) {
        Value value = context.evaluateOrThrow(args.get(0));
        String format = context.evaluateText(args.get(1)).toLowerCase(Locale.ROOT);
        double num = Coercions.toNumber(value);

        switch (format) {
            case "0":
            case "#":
                return Value.text(Value.formatNumber(MathFunctions.roundHalfUp(num)));
            case "0.00":
            case "#.##":
                return Value.text(NumberFormats.fixed(num, 2));
            case "0.0":
            case "#.#":
                return Value.text(NumberFormats.fixed(num, 1));
            case "#,##0":
                return Value.text(NumberFormats.grouped(num, 0));
            case "#,##0.00":
                return Value.text(NumberFormats.grouped(num, 2));
            case "0%":
                return Value.text(NumberFormats.fixed(num * 100, 0) + "%");
            case "0.00%":
                return Value.text(NumberFormats.fixed(num * 100, 2) + "%");
            case "mm/dd/yyyy":
            case "m/d/yyyy":
                return Value.text(NumberFormats.usDate(NumberFormats.toDate(num)));
            default:
                return Value.text(Value.formatNumber(num));
        }
    }

    /**
     * Truncates a character position toward zero and clamps it to [0, length].
     */
    private static int clamp(double position, int length) {
        if (Double.isNaN(position) || position <= 0) {
            return 0;
        }
        if (position >= length) {
            return length;
        }
        return (int) position;
    }
}
