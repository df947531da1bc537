package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.models.FormulaError;
import com.spreadsheet.formula.models.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of formula evaluation against an in-memory map of cells.
 */
class FormulaEngineTest {

    private FormulaEngine engine;
    private Map<String, String> cells;

    @BeforeEach
    void setUp() {
        engine = new FormulaEngine();
        cells = new HashMap<>();
    }

    private Value eval(String formula) {
        return engine.evaluate(formula, cells::get);
    }

    private static Value num(double n) {
        return Value.number(n);
    }

    private static Value err(FormulaError error) {
        return Value.error(error);
    }

    @Test
    void testOperatorPrecedence() {
        assertEquals(num(14), eval("=2+3*4"));
        assertEquals(num(20), eval("=(2+3)*4"));
        assertEquals(num(512), eval("=2^3^2"));
        assertEquals(num(-5), eval("=2-3-4"));
    }

    /**
     * Unary minus sits below "^" in the grammar: -2^2 is (-2)^2.
     */
    @Test
    void testUnaryMinusAndPower() {
        assertEquals(num(4), eval("=-2^2"));
        assertEquals(num(-4), eval("=-(2^2)"));
        assertEquals(num(0.25), eval("=2^-2"));
    }

    @Test
    void testDivisionByZero() {
        assertEquals(err(FormulaError.DIV_ZERO), eval("=5/0"));
        assertEquals(err(FormulaError.DIV_ZERO), eval("=MOD(5,0)"));
        assertEquals(err(FormulaError.DIV_ZERO), eval("=5/A1"));
    }

    @Test
    void testTwoCellCycleIsDetected() {
        cells.put("A1", "=B1");
        cells.put("B1", "=A1");
        assertEquals(err(FormulaError.CIRCULAR), eval(cells.get("A1")));
        assertEquals(err(FormulaError.CIRCULAR), engine.evaluateCell("A1", cells::get));
    }

    @Test
    void testSelfReferenceIsDetected() {
        cells.put("A1", "=A1+1");
        assertEquals(err(FormulaError.CIRCULAR), engine.evaluateCell("A1", cells::get));
        cells.put("B1", "=SUM(B1:B3)");
        assertEquals(err(FormulaError.CIRCULAR), engine.evaluateCell("B1", cells::get));
    }

    @Test
    void testCycleGuardIsEmptyAfterEvaluation() {
        cells.put("A1", "=B1+C1");
        cells.put("B1", "=C1");
        cells.put("C1", "=B1");
        Set<String> guard = new LinkedHashSet<>();
        assertEquals(err(FormulaError.CIRCULAR), engine.evaluate("=A1", cells::get, guard));
        assertTrue(guard.isEmpty());
    }

    @Test
    void testRepeatedReferencesAreNotCycles() {
        cells.put("A1", "=B1+B1");
        cells.put("B1", "3");
        assertEquals(num(6), eval("=A1"));

        // Diamond: two paths to the same cell
        cells.put("C1", "=D1+E1");
        cells.put("D1", "=F1");
        cells.put("E1", "=F1*2");
        cells.put("F1", "2");
        assertEquals(num(6), eval("=C1"));
    }

    @Test
    void testErrorsAreAbsorbing() {
        assertEquals(err(FormulaError.NAME), eval("=1+NOFUNC()"));
        assertEquals(err(FormulaError.NAME), eval("=-NOFUNC()"));
        assertEquals(err(FormulaError.DIV_ZERO), eval("=\"x\"&1/0"));
        assertEquals(err(FormulaError.DIV_ZERO), eval("=1/0=1"));
        cells.put("A1", "=1/0");
        assertEquals(err(FormulaError.DIV_ZERO), eval("=A1*2+SQRT(-1)"));
    }

    @Test
    void testStringComparisons() {
        assertEquals(num(0), eval("=\"10\"<\"9\""));
        assertEquals(num(0), eval("=\"b\"<\"a\""));
        assertEquals(num(1), eval("=\"a\"<\"b\""));
        assertEquals(num(1), eval("=\"ABC\"=\"abc\""));
        assertEquals(num(1), eval("=\"abc\"<>\"abd\""));
        assertEquals(num(1), eval("=A1=\"\""));
        assertEquals(num(1), eval("=2>=2"));
    }

    @Test
    void testSumOverMixedRange() {
        cells.put("A1", "5");
        cells.put("A2", "x");
        cells.put("A3", "");
        assertEquals(num(5), eval("=SUM(A1:A3)"));
    }

    @Test
    void testIfErrorRecovers() {
        assertEquals(num(99), eval("=IFERROR(1/0, 99)"));
    }

    @Test
    void testUnknownCharactersAreTolerated() {
        assertEquals(num(3), eval("=1 + 2"));
        assertEquals(num(3), eval("=1 @+ 2"));
        assertEquals(num(3), eval("=1 + 2;"));
    }

    @Test
    void testPlainValues() {
        assertEquals(num(42), eval("42"));
        assertEquals(num(3.5), eval(" 3.5 "));
        assertEquals(Value.text("hello"), eval("hello"));
        assertEquals(Value.EMPTY, eval(""));
        assertEquals(Value.EMPTY, eval(null));
        assertEquals(err(FormulaError.REF), eval("#REF!"));
    }

    @Test
    void testMalformedFormulasAreValueErrors() {
        assertEquals(err(FormulaError.VALUE), eval("="));
        assertEquals(err(FormulaError.VALUE), eval("=(1+2"));
        assertEquals(err(FormulaError.VALUE), eval("=1 2"));
        assertEquals(err(FormulaError.VALUE), eval("=SUM(1,"));
    }

    @Test
    void testConcatenation() {
        assertEquals(Value.text("a1b"), eval("=\"a\"&1&\"b\""));
        assertEquals(Value.text("2.5%"), eval("=5/2&\"%\""));
        cells.put("A1", "x");
        assertEquals(Value.text("x"), eval("=A1&A2"));
    }

    @Test
    void testArithmeticCoercion() {
        assertEquals(err(FormulaError.VALUE), eval("=1+\"a\""));
        assertEquals(num(3), eval("=1+\"2\""));
        assertEquals(num(1), eval("=A9+1"));
        assertEquals(num(2), eval("=TRUE+TRUE"));
        cells.put("A1", "abc");
        assertEquals(err(FormulaError.VALUE), eval("=A1*2"));
        assertEquals(err(FormulaError.VALUE), eval("=-\"abc\""));
    }

    @Test
    void testFormulaChain() {
        cells.put("A1", "=A2*2");
        cells.put("A2", "=A3+1");
        cells.put("A3", "4");
        assertEquals(num(10), eval("=A1"));
    }

    @Test
    void testRangeAsScalarIsFirstCell() {
        cells.put("A1", "7");
        cells.put("A2", "8");
        assertEquals(num(7), eval("=A1:A3"));
        assertEquals(num(7), eval("=B3:A1"));
    }

    @Test
    void testInvalidCellIsRefError() {
        assertEquals(err(FormulaError.REF), eval("=A0"));
        assertEquals(err(FormulaError.REF), eval("=SUM(A0:A3)"));
    }

    @Test
    void testFunctionNamesAndArity() {
        assertEquals(num(3), eval("=sum(1,2)"));
        assertEquals(err(FormulaError.NAME), eval("=FOO(1,2,3)"));
        assertEquals(err(FormulaError.VALUE), eval("=ABS(1,2)"));
        assertEquals(err(FormulaError.VALUE), eval("=ABS()"));
    }

    @Test
    void testDeepCellChainResolves() {
        for (int row = 1; row <= 500; row++) {
            cells.put("A" + row, "=A" + (row + 1) + "+1");
        }
        cells.put("A501", "0");
        assertEquals(num(500), eval("=A1"));
    }

    @Test
    void testCellDepthLimit() {
        FormulaEngine limited = new FormulaEngine(3, Parser.DEFAULT_MAX_DEPTH, Clock.systemUTC());
        cells.put("A1", "=A2");
        cells.put("A2", "=A3");
        cells.put("A3", "=A4");
        cells.put("A4", "=A5");
        cells.put("A5", "1");
        assertEquals(err(FormulaError.VALUE), limited.evaluate("=A1", cells::get));
        assertEquals(num(1), eval("=A1"));
    }

    @Test
    void testRangeSizeLimit() {
        FormulaEngine limited =
                new FormulaEngine(FormulaEngine.DEFAULT_MAX_CELL_DEPTH, Parser.DEFAULT_MAX_DEPTH, 6, Clock.systemUTC());
        cells.put("A1", "1");
        cells.put("B3", "2");
        assertEquals(num(3), limited.evaluate("=SUM(A1:B3)", cells::get));
        assertEquals(err(FormulaError.REF), limited.evaluate("=SUM(A1:B4)", cells::get));
        assertEquals(err(FormulaError.REF), limited.evaluate("=AVERAGE(A1:C3)", cells::get));
        // COUNTA counts errors, so an oversized range shows up as one entry
        assertEquals(num(1), limited.evaluate("=COUNTA(A1:Z100)", cells::get));
        assertEquals(num(99), limited.evaluate("=IFERROR(SUM(A1:Z100),99)", cells::get));
    }

    /**
     * Ranges of billions of cells are refused up front instead of being expanded.
     */
    @Test
    void testHugeRangesAreRefErrors() {
        assertEquals(err(FormulaError.REF), eval("=MAX(A1:Z400000)"));
        // COUNT skips errors, so it sees nothing to count
        assertEquals(num(0), eval("=COUNT(A1:Z400000)"));
        assertEquals(err(FormulaError.REF), eval("=SUM(A1:XFD1048576)"));
        assertEquals(err(FormulaError.REF), eval("=SUM(A1:A2147483647)"));
    }

    @Test
    void testRangeAtLastRow() {
        assertEquals(num(0), eval("=SUM(A2147483647:A2147483647)"));
        cells.put("B2147483647", "4");
        assertEquals(num(4), eval("=SUM(A2147483647:B2147483647)"));
    }

    /**
     * Absurd nesting must come back as an error, never as an exception.
     */
    @Test
    void testPathologicalNestingNeverThrows() {
        assertEquals(err(FormulaError.VALUE), eval("=" + "(".repeat(10000) + "1" + ")".repeat(10000)));
        assertEquals(err(FormulaError.VALUE), eval("=" + "-".repeat(5000) + "1"));
        assertEquals(err(FormulaError.VALUE), eval("=" + "2^".repeat(5000) + "1"));
    }

    @Test
    void testAccessorReturningNullIsBlank() {
        assertEquals(num(0), engine.evaluate("=A1+0", id -> null));
    }

    /**
     * Two threads evaluating overlapping cells each get their own cycle guard.
     */
    @Test
    void testConcurrentEvaluations() throws InterruptedException {
        cells.put("A1", "=B1+1");
        cells.put("B1", "=C1*2");
        cells.put("C1", "5");
        AtomicReference<Value> first = new AtomicReference<>();
        AtomicReference<Value> second = new AtomicReference<>();

        Thread t1 = new Thread(() -> {
            for (int i = 0; i < 200; i++) {
                first.set(eval("=A1+B1"));
            }
        });
        Thread t2 = new Thread(() -> {
            for (int i = 0; i < 200; i++) {
                second.set(eval("=B1*A1"));
            }
        });

        t1.start();
        t2.start();
        t1.join();
        t2.join();

        assertEquals(num(21), first.get());
        assertEquals(num(110), second.get());
    }
}
