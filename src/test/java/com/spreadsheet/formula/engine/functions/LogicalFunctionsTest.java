package com.spreadsheet.formula.engine.functions;

import com.spreadsheet.formula.engine.FormulaEngine;
import com.spreadsheet.formula.models.FormulaError;
import com.spreadsheet.formula.models.Value;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogicalFunctionsTest {

    private final FormulaEngine engine = new FormulaEngine();

    private Value eval(String formula) {
        return engine.evaluate(formula, id -> null);
    }

    @Test
    void testIf() {
        assertEquals(Value.text("n"), eval("=IF(1>2,\"y\",\"n\")"));
        assertEquals(Value.text("y"), eval("=IF(\"abc\",\"y\",\"n\")"));
        assertEquals(Value.text("n"), eval("=IF(\"0\",\"y\",\"n\")"));
        assertEquals(Value.EMPTY, eval("=IF(0,\"y\")"));
        assertEquals(Value.error(FormulaError.DIV_ZERO), eval("=IF(1/0,1,2)"));
    }

    /**
     * The branch not taken is never evaluated, so its error never surfaces.
     */
    @Test
    void testIfEvaluatesOnlyChosenBranch() {
        assertEquals(Value.number(5), eval("=IF(1,5,1/0)"));
        assertEquals(Value.number(6), eval("=IF(0,NOPE(),6)"));
    }

    @Test
    void testAnd() {
        assertEquals(Value.TRUE, eval("=AND(1,2>1)"));
        assertEquals(Value.FALSE, eval("=AND(1,0)"));
        assertEquals(Value.FALSE, eval("=AND(1,\"x\")"));
        assertEquals(Value.FALSE, eval("=AND(1,A9)"));
        assertEquals(Value.error(FormulaError.DIV_ZERO), eval("=AND(1,1/0)"));
    }

    @Test
    void testOr() {
        assertEquals(Value.TRUE, eval("=OR(0,A9,1)"));
        assertEquals(Value.FALSE, eval("=OR(0,\"x\")"));
        assertEquals(Value.error(FormulaError.DIV_ZERO), eval("=OR(1/0,1)"));
    }

    @Test
    void testNot() {
        assertEquals(Value.TRUE, eval("=NOT(0)"));
        assertEquals(Value.FALSE, eval("=NOT(5)"));
        assertEquals(Value.error(FormulaError.VALUE), eval("=NOT(\"x\")"));
    }

    @Test
    void testIfError() {
        assertEquals(Value.number(5), eval("=IFERROR(5,0)"));
        assertEquals(Value.text("x"), eval("=IFERROR(NOPE(),\"x\")"));
        assertEquals(Value.number(0), eval("=IFERROR(SQRT(-1),0)"));
    }

    @Test
    void testAndOrNeedArguments() {
        assertEquals(Value.error(FormulaError.VALUE), eval("=AND()"));
        assertEquals(Value.error(FormulaError.VALUE), eval("=OR()"));
    }
}
