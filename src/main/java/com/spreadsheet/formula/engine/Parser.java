package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.engine.ast.BinaryNode;
import com.spreadsheet.formula.engine.ast.CellRefNode;
import com.spreadsheet.formula.engine.ast.FunctionCallNode;
import com.spreadsheet.formula.engine.ast.Node;
import com.spreadsheet.formula.engine.ast.NumberNode;
import com.spreadsheet.formula.engine.ast.RangeRefNode;
import com.spreadsheet.formula.engine.ast.StringNode;
import com.spreadsheet.formula.engine.ast.UnaryNode;
import com.spreadsheet.formula.exceptions.FormulaParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser turning a token list into an expression tree.
 * Precedence, lowest first:
 * comparison, concatenation (&amp;), + -, * /, ^ (right-associative), unary + -.
 */
public class Parser {

    public static final int DEFAULT_MAX_DEPTH = 200;

    private final List<Token> tokens;
    private final int maxDepth;
    private int pos;
    private int depth;

    public Parser(List<Token> tokens) {
        this(tokens, DEFAULT_MAX_DEPTH);
    }

    public Parser(List<Token> tokens, int maxDepth) {
        this.tokens = tokens;
        this.maxDepth = maxDepth;
    }

    /**
     * Parses a whole formula body. Throws FormulaParseException if the tokens
     * don't form one complete expression.
     */
    public static Node parse(List<Token> tokens, int maxDepth) {
        return new Parser(tokens, maxDepth).parse();
    }

    public Node parse() {
        Node node = parseComparison();
        if (peek().getType() != TokenType.EOF) {
            throw new FormulaParseException("Unexpected trailing token: " + peek());
        }
        return node;
    }

    private Node parseComparison() {
        enter();
        try {
            Node left = parseConcatenation();
            while (peek().getType() == TokenType.COMPARISON) {
                String op = advance().getText();
                Node right = parseConcatenation();
                left = new BinaryNode(op, left, right);
            }
            return left;
        } finally {
            depth--;
        }
    }

    private Node parseConcatenation() {
        Node left = parseAddSub();
        while (peek().getType() == TokenType.CONCAT) {
            advance();
            Node right = parseAddSub();
            left = new BinaryNode("&", left, right);
        }
        return left;
    }

    private Node parseAddSub() {
        Node left = parseMulDiv();
        while (peekOperator("+") || peekOperator("-")) {
            String op = advance().getText();
            Node right = parseMulDiv();
            left = new BinaryNode(op, left, right);
        }
        return left;
    }

    private Node parseMulDiv() {
        Node left = parsePower();
        while (peekOperator("*") || peekOperator("/")) {
            String op = advance().getText();
            Node right = parsePower();
            left = new BinaryNode(op, left, right);
        }
        return left;
    }

    // 2^3^2 == 2^(3^2)
    private Node parsePower() {
        Node base = parseUnary();
        if (peekOperator("^")) {
            advance();
            enter();
            try {
                Node exponent = parsePower();
                return new BinaryNode("^", base, exponent);
            } finally {
                depth--;
            }
        }
        return base;
    }

    private Node parseUnary() {
        if (peekOperator("+") || peekOperator("-")) {
            String op = advance().getText();
            enter();
            try {
                Node operand = parseUnary();
                return op.equals("+") ? operand : new UnaryNode("-", operand);
            } finally {
                depth--;
            }
        }
        return parsePrimary();
    }

    private Node parsePrimary() {
        Token tok = peek();
        switch (tok.getType()) {
            case NUMBER:
                advance();
                return new NumberNode(parseNumber(tok.getText()));
            case STRING:
                advance();
                return new StringNode(tok.getText());
            case RANGE_REF:
                advance();
                return new RangeRefNode(tok.getText());
            case CELL_REF:
                advance();
                return new CellRefNode(tok.getText());
            case FUNCTION:
                return parseFunctionCall();
            case LPAREN:
                advance();
                Node inner = parseComparison();
                expect(TokenType.RPAREN);
                return inner;
            default:
                throw new FormulaParseException("Unexpected token: " + tok);
        }
    }

    private Node parseFunctionCall() {
        String name = advance().getText();
        expect(TokenType.LPAREN);
        List<Node> args = new ArrayList<>();
        if (peek().getType() != TokenType.RPAREN) {
            args.add(parseComparison());
            while (peek().getType() == TokenType.COMMA) {
                advance();
                args.add(parseComparison());
            }
        }
        expect(TokenType.RPAREN);
        return new FunctionCallNode(name, args);
    }

    /**
     * Reads the longest prefix that is a valid decimal, so "1.2.3" is 1.2.
     */
    static double parseNumber(String text) {
        int end = 0;
        boolean seenDot = false;
        while (end < text.length()) {
            char c = text.charAt(end);
            if (c == '.') {
                if (seenDot) {
                    break;
                }
                seenDot = true;
            } else if (c < '0' || c > '9') {
                break;
            }
            end++;
        }
        try {
            return Double.parseDouble(text.substring(0, end));
        } catch (NumberFormatException e) {
            throw new FormulaParseException("Invalid number: " + text);
        }
    }

    private void enter() {
        if (++depth > maxDepth) {
            throw new FormulaParseException("Expression nested deeper than " + maxDepth);
        }
    }

    private boolean peekOperator(String op) {
        return peek().is(TokenType.OPERATOR, op);
    }

    private Token peek() {
        return pos < tokens.size() ? tokens.get(pos) : Token.END;
    }

    private Token advance() {
        Token t = peek();
        pos++;
        return t;
    }

    private Token expect(TokenType type) {
        Token t = advance();
        if (t.getType() != type) {
            throw new FormulaParseException("Expected " + type + " but got " + t);
        }
        return t;
    }
}
