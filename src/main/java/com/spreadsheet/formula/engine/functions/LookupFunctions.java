package com.spreadsheet.formula.engine.functions;

import com.spreadsheet.formula.engine.EvaluationContext;
import com.spreadsheet.formula.engine.ast.Node;
import com.spreadsheet.formula.engine.ast.NodeKind;
import com.spreadsheet.formula.engine.ast.RangeRefNode;
import com.spreadsheet.formula.models.CellRange;
import com.spreadsheet.formula.models.FormulaError;
import com.spreadsheet.formula.models.Value;

import java.util.List;
import java.util.Optional;

/**
 * INDEX(range, row, [column=1]).
 */
final class LookupFunctions {

    private LookupFunctions() {
    }

    /**
     * Picks the cell at 1-based (row, column) offsets from the range's top-left corner.
     * The first argument has to be written as a range, e.g. INDEX(A1:C5, 2, 3).
     */
    static Value index(List<Node> args, EvaluationContext context) {
        if (args.get(0).getKind() != NodeKind.RANGE_REF) {
            return Value.error(FormulaError.VALUE);
        }
        Optional<CellRange> range = CellRange.parse(((RangeRefNode) args.get(0)).getRange());
        if (range.isEmpty()) {
            return Value.error(FormulaError.REF);
        }

        double row = context.evaluateNumber(args.get(1));
        double column = args.size() == 3 ? context.evaluateNumber(args.get(2)) : 1;
        if (Double.isNaN(row) || Double.isNaN(column) || row < 1 || column < 1) {
            return Value.error(FormulaError.VALUE);
        }
        if (row >= range.get().rowCount() + 1 || column >= range.get().columnCount() + 1) {
            return Value.error(FormulaError.REF);
        }
        return context.resolveOffset(range.get(), (int) row, (int) column);
    }
}
