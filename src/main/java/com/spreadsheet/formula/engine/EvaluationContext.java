package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.engine.ast.Node;
import com.spreadsheet.formula.engine.ast.NodeKind;
import com.spreadsheet.formula.engine.ast.RangeRefNode;
import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.CellRange;
import com.spreadsheet.formula.models.FormulaError;
import com.spreadsheet.formula.models.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * State of one top-level evaluation:
 * - the accessor used to read raw cell text
 * - the cycle guard: ids of cells whose formulas are being evaluated on the current call stack
 * - the limits and clock the engine was configured with
 * Not thread-safe; every evaluate call gets its own context.
 */
public class EvaluationContext {

    private static final Logger log = LoggerFactory.getLogger(EvaluationContext.class);

    private final Evaluator evaluator;
    private final CellAccessor accessor;
    private final Set<String> resolving;
    private final int maxCellDepth;
    private final long maxRangeCells;
    private final Clock clock;

    public EvaluationContext(Evaluator evaluator, CellAccessor accessor, Set<String> resolving,
                             int maxCellDepth, long maxRangeCells, Clock clock) {
        this.evaluator = evaluator;
        this.accessor = accessor;
        this.resolving = resolving;
        this.maxCellDepth = maxCellDepth;
        this.maxRangeCells = maxRangeCells;
        this.clock = clock;
    }

    /**
     * Evaluates a sub-expression. Errors come back as error values.
     */
    public Value evaluate(Node node) {
        return evaluator.evaluate(node, this);
    }

    /**
     * Evaluates a sub-expression and throws if it produced an error,
     * so function bodies can stop at the first error.
     */
    public Value evaluateOrThrow(Node node) {
        Value value = evaluate(node);
        if (value.isError()) {
            throw new FormulaErrorException(value.getError());
        }
        return value;
    }

    public double evaluateNumber(Node node) {
        return Coercions.toNumber(evaluate(node));
    }

    public String evaluateText(Node node) {
        return Coercions.toText(evaluate(node));
    }

    /**
     * Resolves a cell to its value, evaluating its formula if it has one.
     * A cell already being evaluated further up the stack resolves to #CIRC!.
     */
    public Value resolveCell(String cellId) {
        if (resolving.contains(cellId)) {
            return Value.error(FormulaError.CIRCULAR);
        }
        String raw = accessor.getRawValue(cellId);
        if (raw == null || raw.isEmpty()) {
            return Value.EMPTY;
        }
        if (!raw.startsWith("=")) {
            return Coercions.fromData(raw);
        }
        if (resolving.size() >= maxCellDepth) {
            log.debug("Cell reference chain deeper than {} at {}", maxCellDepth, cellId);
            return Value.error(FormulaError.VALUE);
        }

        resolving.add(cellId);
        try {
            return evaluator.evaluateFormula(raw.substring(1), this);
        } finally {
            resolving.remove(cellId);
        }
    }

    /**
     * Resolves every cell of a range in row-major order.
     * A malformed range, or one with more cells than the configured limit, yields a single #REF!.
     */
    public List<Value> resolveRange(String range) {
        Optional<CellRange> parsed = CellRange.parse(range);
        if (parsed.isEmpty()) {
            return Collections.singletonList(Value.error(FormulaError.REF));
        }
        if (parsed.get().cellCount() > maxRangeCells) {
            log.debug("Range {} has {} cells, limit is {}", range, parsed.get().cellCount(), maxRangeCells);
            return Collections.singletonList(Value.error(FormulaError.REF));
        }
        List<Value> values = new ArrayList<>();
        for (String cellId : parsed.get().expand()) {
            values.add(resolveCell(cellId));
        }
        return values;
    }

    /**
     * Evaluates arguments into one flat list: a range argument contributes every cell,
     * any other argument contributes its single value.
     */
    public List<Value> flatten(List<Node> args) {
        List<Value> result = new ArrayList<>();
        for (Node arg : args) {
            if (arg.getKind() == NodeKind.RANGE_REF) {
                result.addAll(resolveRange(((RangeRefNode) arg).getRange()));
            } else {
                result.add(evaluate(arg));
            }
        }
        return result;
    }

    /**
     * Resolves the cell at a 1-based offset inside a range, used by INDEX.
     */
    public Value resolveOffset(CellRange range, int rowOffset, int columnOffset) {
        if (rowOffset > range.rowCount() || columnOffset > range.columnCount()) {
            return Value.error(FormulaError.REF);
        }
        CellAddress target = CellAddress.of(
                range.getTopLeft().getRow() + rowOffset - 1,
                range.getTopLeft().getColumn() + columnOffset - 1);
        return resolveCell(target.toString());
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Ids of the cells currently being evaluated.
     */
    public Set<String> getResolving() {
        return Collections.unmodifiableSet(resolving);
    }
}
