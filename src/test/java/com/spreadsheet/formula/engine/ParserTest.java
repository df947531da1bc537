package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.exceptions.FormulaParseException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

    private static String parse(String formula) {
        return Parser.parse(Tokenizer.tokenize(formula), Parser.DEFAULT_MAX_DEPTH).toString();
    }

    @Test
    void testMultiplicationBindsTighterThanAddition() {
        assertEquals("(2.0 + (3.0 * 4.0))", parse("2+3*4"));
        assertEquals("((2.0 - 3.0) - 4.0)", parse("2-3-4"));
    }

    @Test
    void testPowerIsRightAssociative() {
        assertEquals("(2.0 ^ (3.0 ^ 2.0))", parse("2^3^2"));
    }

    /**
     * The unary minus is parsed below "^", so -2^2 is (-2)^2.
     */
    @Test
    void testUnaryMinusBindsTighterThanPower() {
        assertEquals("((-2.0) ^ 2.0)", parse("-2^2"));
        assertEquals("(-(-3.0))", parse("--3"));
    }

    @Test
    void testUnaryPlusIsDropped() {
        assertEquals("5.0", parse("+5"));
        assertEquals("(1.0 - 5.0)", parse("1-+5"));
    }

    @Test
    void testComparisonAndConcatenationPrecedence() {
        assertEquals("((A1 & \"x\") = (1.0 + 2.0))", parse("A1&\"x\"=1+2"));
    }

    @Test
    void testFunctionCalls() {
        assertEquals("SUM(1.0, A1:B2, \"x\")", parse("SUM(1, A1:B2, \"x\")"));
        assertEquals("TODAY()", parse("TODAY()"));
        assertEquals("IF((A1 > 0.0), ABS(A1), 0.0)", parse("IF(A1>0,ABS(A1),0)"));
    }

    @Test
    void testNumberUsesLongestValidPrefix() {
        assertEquals("1.2", parse("1.2.3"));
    }

    @Test
    void testMalformedInputFails() {
        assertThrows(FormulaParseException.class, () -> parse("(1+2"));
        assertThrows(FormulaParseException.class, () -> parse("1 2"));
        assertThrows(FormulaParseException.class, () -> parse(")"));
        assertThrows(FormulaParseException.class, () -> parse(""));
        assertThrows(FormulaParseException.class, () -> parse("SUM(1,)"));
        assertThrows(FormulaParseException.class, () -> parse("A1:"));
        assertThrows(FormulaParseException.class, () -> parse("1+"));
    }

    @Test
    void testNestingLimit() {
        assertEquals("1.0", Parser.parse(Tokenizer.tokenize("((1))"), 5).toString());
        assertThrows(FormulaParseException.class,
                () -> Parser.parse(Tokenizer.tokenize("((((((1))))))"), 5));
    }
}
