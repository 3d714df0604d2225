package com.cellgraph.app.formula;

import com.cellgraph.app.models.CellAddress;
import com.cellgraph.app.models.CellValue;

/**
 * Renders a formula tree back to text as seen from its home cell.
 * Parentheses are emitted only where operator precedence needs them,
 * so parsing the output gives back an equal tree.
 */
public final class FormulaFormatter implements ExpressionVisitor<String> {

    private final CellAddress home;

    private FormulaFormatter(CellAddress home) {
        this.home = home;
    }

    public static String format(Expression expression, CellAddress home) {
        return expression.accept(new FormulaFormatter(home));
    }

    @Override
    public String visitNumber(NumberLiteral number) {
        return CellValue.formatNumber(number.getValue());
    }

    @Override
    public String visitReference(CellReference reference) {
        return reference.getTarget().render(home);
    }

    @Override
    public String visitRange(CellRange range) {
        return range.getStart().render(home) + ":" + range.getEnd().render(home);
    }

    @Override
    public String visitBinary(BinaryOperation operation) {
        Operator op = operation.getOperator();
        String left = operation.getLeft().accept(this);
        String right = operation.getRight().accept(this);
        if (needsParentheses(operation.getLeft(), op.getPrecedence(), false)) {
            left = "(" + left + ")";
        }
        if (needsParentheses(operation.getRight(), op.getPrecedence(), true)) {
            right = "(" + right + ")";
        }
        return left + op.getSymbol() + right;
    }

    @Override
    public String visitRangeFunction(RangeFunction function) {
        return function.getType().name() + "(" + function.getRange().accept(this) + ")";
    }

    @Override
    public String visitDelay(DelayFunction delay) {
        return "SLEEP(" + delay.getDuration().accept(this) + ")";
    }

    // the parser is left-associative, so an equal-precedence right child must keep its parentheses
    private static boolean needsParentheses(Expression child, int parentPrecedence, boolean rightSide) {
        if (!(child instanceof BinaryOperation)) {
            return false;
        }
        int childPrecedence = ((BinaryOperation) child).getOperator().getPrecedence();
        return childPrecedence < parentPrecedence || (rightSide && childPrecedence == parentPrecedence);
    }
}
