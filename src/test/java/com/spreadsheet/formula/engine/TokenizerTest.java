package com.spreadsheet.formula.engine;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

    private static Token t(TokenType type, String text) {
        return new Token(type, text);
    }

    @Test
    void testFunctionRangeAndOperators() {
        List<Token> tokens = Tokenizer.tokenize("SUM(A1:B2)*1.5");
        assertEquals(Arrays.asList(
                t(TokenType.FUNCTION, "SUM"),
                t(TokenType.LPAREN, "("),
                t(TokenType.RANGE_REF, "A1:B2"),
                t(TokenType.RPAREN, ")"),
                t(TokenType.OPERATOR, "*"),
                t(TokenType.NUMBER, "1.5"),
                Token.END), tokens);
    }

    @Test
    void testReferencesAreUppercased() {
        assertEquals(Arrays.asList(
                t(TokenType.CELL_REF, "A1"),
                t(TokenType.OPERATOR, "+"),
                t(TokenType.RANGE_REF, "B2:C3"),
                Token.END), Tokenizer.tokenize("a1 + b2:c3"));
    }

    @Test
    void testStringEscapes() {
        assertEquals(t(TokenType.STRING, "he said \"hi\""), Tokenizer.tokenize("\"he said \\\"hi\\\"\"").get(0));
        // No special meaning for \n: the backslash is dropped, the n is kept
        assertEquals(t(TokenType.STRING, "anb"), Tokenizer.tokenize("\"a\\nb\"").get(0));
    }

    @Test
    void testUnterminatedStringRunsToEnd() {
        assertEquals(Arrays.asList(t(TokenType.STRING, "abc + 1"), Token.END), Tokenizer.tokenize("\"abc + 1"));
    }

    @Test
    void testComparisonOperators() {
        List<Token> tokens = Tokenizer.tokenize(">=1<=2<>3<4>5=6");
        assertEquals(Arrays.asList(
                t(TokenType.COMPARISON, ">="), t(TokenType.NUMBER, "1"),
                t(TokenType.COMPARISON, "<="), t(TokenType.NUMBER, "2"),
                t(TokenType.COMPARISON, "<>"), t(TokenType.NUMBER, "3"),
                t(TokenType.COMPARISON, "<"), t(TokenType.NUMBER, "4"),
                t(TokenType.COMPARISON, ">"), t(TokenType.NUMBER, "5"),
                t(TokenType.COMPARISON, "="), t(TokenType.NUMBER, "6"),
                Token.END), tokens);
    }

    @Test
    void testBooleansBecomeNumbers() {
        assertEquals(Arrays.asList(
                t(TokenType.NUMBER, "1"), t(TokenType.CONCAT, "&"), t(TokenType.NUMBER, "0"), Token.END),
                Tokenizer.tokenize("TRUE&false"));
    }

    @Test
    void testUnknownCharactersAreSkipped() {
        assertEquals(Arrays.asList(
                t(TokenType.NUMBER, "1"), t(TokenType.NUMBER, "2"), t(TokenType.NUMBER, "3"), Token.END),
                Tokenizer.tokenize("1 $ 2 # 3"));
    }

    @Test
    void testColonWithoutSecondCellStaysSeparate() {
        assertEquals(Arrays.asList(
                t(TokenType.CELL_REF, "A1"), t(TokenType.COLON, ":"), t(TokenType.FUNCTION, "FOO"), Token.END),
                Tokenizer.tokenize("A1:foo"));
    }

    @Test
    void testNumberScanning() {
        assertEquals(t(TokenType.NUMBER, ".5"), Tokenizer.tokenize(".5").get(0));
        assertEquals(t(TokenType.NUMBER, "1.2.3"), Tokenizer.tokenize("1.2.3").get(0));
    }

    @Test
    void testIdentifierClassification() {
        // Letters followed by digits is always a cell, even if a function is meant
        assertEquals(t(TokenType.CELL_REF, "LOG10"), Tokenizer.tokenize("LOG10").get(0));
        assertEquals(t(TokenType.FUNCTION, "MY_FUNC"), Tokenizer.tokenize("my_func(1)").get(0));
        assertEquals(t(TokenType.FUNCTION, "_X"), Tokenizer.tokenize("_x").get(0));
    }

    @Test
    void testEmptyInput() {
        assertEquals(Collections.singletonList(Token.END), Tokenizer.tokenize(""));
        assertEquals(Collections.singletonList(Token.END), Tokenizer.tokenize(null));
    }
}
