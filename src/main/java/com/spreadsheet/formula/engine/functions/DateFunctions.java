package com.spreadsheet.formula.engine.functions;

import com.spreadsheet.formula.engine.EvaluationContext;
import com.spreadsheet.formula.engine.NumberFormats;
import com.spreadsheet.formula.engine.ast.Node;
import com.spreadsheet.formula.models.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * TODAY, NOW, YEAR, MONTH and DAY over day serials (days since 1970-01-01 UTC).
 */
final class DateFunctions {

    private DateFunctions() {
    }

    static Value today(List<Node> args, EvaluationContext context) {
        return Value.number(LocalDate.now(context.getClock()).toEpochDay());
    }

    static Value now(List<Node> args, EvaluationContext context) {
        return Value.number((double) context.getClock().millis() / NumberFormats.MILLIS_PER_DAY);
    }

    static Value year(List<Node> args, EvaluationContext context) {
        return Value.number(decode(args, context).getYear());
    }

    static Value month(List<Node> args, EvaluationContext context) {
        return Value.number(decode(args, context).getMonthValue());
    }

    static Value day(List<Node> args, EvaluationContext context) {
        return Value.number(decode(args, context).getDayOfMonth());
    }

    private static LocalDate decode(List<Node> args, EvaluationContext context) {
        return NumberFormats.toDate(context.evaluateNumber(args.get(0)));
    }
}
