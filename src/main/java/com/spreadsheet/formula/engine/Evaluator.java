package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.engine.ast.BinaryNode;
import com.spreadsheet.formula.engine.ast.CellRefNode;
import com.spreadsheet.formula.engine.ast.FunctionCallNode;
import com.spreadsheet.formula.engine.ast.Node;
import com.spreadsheet.formula.engine.ast.NumberNode;
import com.spreadsheet.formula.engine.ast.RangeRefNode;
import com.spreadsheet.formula.engine.ast.StringNode;
import com.spreadsheet.formula.engine.ast.UnaryNode;
import com.spreadsheet.formula.engine.functions.FunctionDefinition;
import com.spreadsheet.formula.engine.functions.FunctionTable;
import com.spreadsheet.formula.exceptions.FormulaErrorException;
import com.spreadsheet.formula.exceptions.FormulaParseException;
import com.spreadsheet.formula.models.CellAddress;
import com.spreadsheet.formula.models.CellRange;
import com.spreadsheet.formula.models.FormulaError;
import com.spreadsheet.formula.models.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Tree-walking evaluator.
 * Once a sub-expression yields an error, every enclosing operator returns that same error.
 */
public class Evaluator {

    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    private final int maxExpressionDepth;

    public Evaluator(int maxExpressionDepth) {
        this.maxExpressionDepth = maxExpressionDepth;
    }

    /**
     * Tokenizes, parses and evaluates a formula body (without the "=").
     * A formula that fails to parse is #VALUE!.
     */
    public Value evaluateFormula(String body, EvaluationContext context) {
        Node ast;
        try {
            ast = Parser.parse(Tokenizer.tokenize(body), maxExpressionDepth);
        } catch (FormulaParseException e) {
            log.debug("Could not parse formula '{}': {}", body, e.getMessage());
            return Value.error(FormulaError.VALUE);
        }
        return evaluate(ast, context);
    }

    /**
     * Evaluates one node. Coercion failures inside it come back as error values.
     */
    public Value evaluate(Node node, EvaluationContext context) {
        try {
            return evaluateNode(node, context);
        } catch (FormulaErrorException e) {
            return Value.error(e.getError());
        }
    }

    private Value evaluateNode(Node node, EvaluationContext context) {
        switch (node.getKind()) {
            case NUMBER:
                return Value.number(((NumberNode) node).getValue());
            case STRING:
                return Value.text(((StringNode) node).getValue());
            case CELL_REF:
                return evaluateCellRef((CellRefNode) node, context);
            case RANGE_REF:
                return evaluateRangeAsScalar((RangeRefNode) node, context);
            case UNARY:
                return evaluateUnary((UnaryNode) node, context);
            case BINARY:
                return evaluateBinary((BinaryNode) node, context);
            case FUNCTION_CALL:
                return evaluateFunctionCall((FunctionCallNode) node, context);
            default:
                return Value.error(FormulaError.VALUE);
        }
    }

    private Value evaluateCellRef(CellRefNode node, EvaluationContext context) {
        // "A0" passes the tokenizer's pattern but is not a cell
        if (CellAddress.parse(node.getRef()).isEmpty()) {
            return Value.error(FormulaError.REF);
        }
        return context.resolveCell(node.getRef());
    }

    // A range used as a plain value stands for its first cell
    private Value evaluateRangeAsScalar(RangeRefNode node, EvaluationContext context) {
        Optional<CellRange> range = CellRange.parse(node.getRange());
        if (range.isEmpty()) {
            return Value.error(FormulaError.REF);
        }
        return context.resolveCell(range.get().getTopLeft().toString());
    }

    private Value evaluateUnary(UnaryNode node, EvaluationContext context) {
        Value operand = context.evaluate(node.getOperand());
        if (operand.isError()) {
            return operand;
        }
        if (node.getOperator().equals("-")) {
            return Value.number(-Coercions.toNumber(operand));
        }
        return operand;
    }

    private Value evaluateBinary(BinaryNode node, EvaluationContext context) {
        Value left = context.evaluate(node.getLeft());
        if (left.isError()) {
            return left;
        }
        Value right = context.evaluate(node.getRight());
        if (right.isError()) {
            return right;
        }

        String op = node.getOperator();
        switch (op) {
            case "&":
                return Value.text(Coercions.toText(left) + Coercions.toText(right));
            case "=":
            case "<>":
            case "<":
            case ">":
            case "<=":
            case ">=":
                return Value.bool(compare(op, left, right));
            default:
                return arithmetic(op, Coercions.toNumber(left), Coercions.toNumber(right));
        }
    }

    /**
     * Numeric comparison when both sides are numbers or numeric text,
     * otherwise case-insensitive text comparison.
     */
    private boolean compare(String op, Value left, Value right) {
        Double leftNumber = Coercions.numericValue(left);
        Double rightNumber = Coercions.numericValue(right);
        if (leftNumber != null && rightNumber != null) {
            double l = leftNumber;
            double r = rightNumber;
            switch (op) {
                case "=":
                    return l == r;
                case "<>":
                    return l != r;
                case "<":
                    return l < r;
                case ">":
                    return l > r;
                case "<=":
                    return l <= r;
                default:
                    return l >= r;
            }
        }
        int cmp = Coercions.toText(left).toLowerCase(Locale.ROOT)
                .compareTo(Coercions.toText(right).toLowerCase(Locale.ROOT));
        switch (op) {
            case "=":
                return cmp == 0;
            case "<>":
                return cmp != 0;
            case "<":
                return cmp < 0;
            case ">":
                return cmp > 0;
            case "<=":
                return cmp <= 0;
            default:
                return cmp >= 0;
        }
    }

    private Value arithmetic(String op, double left, double right) {
        switch (op) {
            case "+":
                return Value.number(left + right);
            case "-":
                return Value.number(left - right);
            case "*":
                return Value.number(left * right);
            case "/":
                if (right == 0) {
                    return Value.error(FormulaError.DIV_ZERO);
                }
                return Value.number(left / right);
            case "^":
                return Value.number(Math.pow(left, right));
            default:
                return Value.error(FormulaError.VALUE);
        }
    }

    private Value evaluateFunctionCall(FunctionCallNode node, EvaluationContext context) {
        String name = node.getName().toUpperCase(Locale.ROOT);
        Optional<FunctionDefinition> definition = FunctionTable.lookup(name);
        if (definition.isEmpty()) {
            return Value.error(FormulaError.NAME);
        }
        List<Node> args = node.getArguments();
        if (!definition.get().acceptsArgumentCount(args.size())) {
            return Value.error(FormulaError.VALUE);
        }
        try {
            return definition.get().getBody().apply(args, context);
        } catch (FormulaErrorException e) {
            return Value.error(e.getError());
        }
    }
}
