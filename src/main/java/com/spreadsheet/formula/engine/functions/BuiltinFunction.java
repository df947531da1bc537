package com.spreadsheet.formula.engine.functions;

import com.spreadsheet.formula.engine.EvaluationContext;
import com.spreadsheet.formula.engine.ast.Node;
import com.spreadsheet.formula.models.Value;

import java.util.List;

/**
 * Body of a built-in function. Receives the argument expressions unevaluated,
 * so a range argument can be expanded instead of being reduced to one cell.
 * May throw FormulaErrorException to stop with an error.
 */
@FunctionalInterface
public interface BuiltinFunction {

    Value apply(List<Node> args, EvaluationContext context);
}
