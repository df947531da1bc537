package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.models.FormulaError;
import com.spreadsheet.formula.models.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Entry point of the formula engine.
 * Turns a cell's raw text into a value, reading other cells through a {@link CellAccessor}.
 * The engine holds no per-call state, so one instance can serve concurrent callers;
 * each call gets its own cycle guard.
 */
public class FormulaEngine {

    private static final Logger log = LoggerFactory.getLogger(FormulaEngine.class);

    public static final int DEFAULT_MAX_CELL_DEPTH = 1000;
    public static final long DEFAULT_MAX_RANGE_CELLS = 100_000L;

    private final Evaluator evaluator;
    private final int maxCellDepth;
    private final long maxRangeCells;
    private final Clock clock;

    public FormulaEngine() {
        this(DEFAULT_MAX_CELL_DEPTH, Parser.DEFAULT_MAX_DEPTH, Clock.systemUTC());
    }

    public FormulaEngine(int maxCellDepth, int maxExpressionDepth, Clock clock) {
        this(maxCellDepth, maxExpressionDepth, DEFAULT_MAX_RANGE_CELLS, clock);
    }

    /**
     * @param maxCellDepth longest chain of formula cells resolved before #VALUE!
     * @param maxExpressionDepth deepest expression nesting the parser accepts
     * @param maxRangeCells largest range, in cells, a formula may read; bigger ranges give #REF!
     * @param clock source of TODAY() and NOW()
     */
    public FormulaEngine(int maxCellDepth, int maxExpressionDepth, long maxRangeCells, Clock clock) {
        this.evaluator = new Evaluator(maxExpressionDepth);
        this.maxCellDepth = maxCellDepth;
        this.maxRangeCells = maxRangeCells;
        this.clock = clock;
    }

    /**
     * Evaluates raw cell text.
     * Text not starting with "=" is data: numeric text becomes a number, the rest stays text.
     * Never throws; failures come back as one of the error values.
     */
    public Value evaluate(String formula, CellAccessor accessor) {
        return evaluate(formula, accessor, new LinkedHashSet<>());
    }

    /**
     * Same as {@link #evaluate(String, CellAccessor)} with a caller-supplied cycle guard.
     * The set must not be shared with another evaluation running at the same time.
     */
    public Value evaluate(String formula, CellAccessor accessor, Set<String> resolving) {
        if (formula == null) {
            return Value.EMPTY;
        }
        String trimmed = formula.trim();
        if (!trimmed.startsWith("=")) {
            return Coercions.fromData(trimmed);
        }

        EvaluationContext context =
                new EvaluationContext(evaluator, accessor, resolving, maxCellDepth, maxRangeCells, clock);
        try {
            return evaluator.evaluateFormula(trimmed.substring(1), context);
        } catch (FormulaErrorException e) {
            return Value.error(e.getError());
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("Evaluation of '{}' failed unexpectedly", trimmed, e);
            return Value.error(FormulaError.VALUE);
        }
    }

    /**
     * Evaluates the content of a stored cell. The cell is already in the cycle guard,
     * so a formula that refers back to it gives #CIRC!.
     */
    public Value evaluateCell(String cellId, CellAccessor accessor) {
        Set<String> resolving = new LinkedHashSet<>();
        resolving.add(cellId);
        return evaluate(accessor.getRawValue(cellId), accessor, resolving);
    }
}
