package com.cellgraph.app.services;

import com.cellgraph.app.formula.BinaryOperation;
import com.cellgraph.app.formula.CellRange;
import com.cellgraph.app.formula.CellReference;
import com.cellgraph.app.formula.DelayFunction;
import com.cellgraph.app.formula.Expression;
import com.cellgraph.app.formula.ExpressionVisitor;
import com.cellgraph.app.formula.NumberLiteral;
import com.cellgraph.app.formula.RangeFunction;
import com.cellgraph.app.models.CellAddress;
import com.cellgraph.app.models.CellValue;
import com.cellgraph.app.models.ErrorKind;
import com.cellgraph.app.models.Sheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Evaluates a formula tree against the current cached values of a sheet.
 * A formula always yields a NUMBER or an ERROR; failures are values, never exceptions.
 */
@Component
public class FormulaEvaluator {

    private static final Logger log = LoggerFactory.getLogger(FormulaEvaluator.class);

    private final Sleeper sleeper;

    public FormulaEvaluator(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    /**
     * @param home the cell the formula lives in; relative references resolve against it
     */
    public CellValue evaluate(Sheet sheet, CellAddress home, Expression formula) {
        return formula.accept(new Evaluation(sheet, home));
    }

    private class Evaluation implements ExpressionVisitor<CellValue> {
        private final Sheet sheet;
        private final CellAddress home;

        Evaluation(Sheet sheet, CellAddress home) {
            this.sheet = sheet;
            this.home = home;
        }

        @Override
        public CellValue visitNumber(NumberLiteral number) {
            return CellValue.number(number.getValue());
        }

        @Override
        public CellValue visitReference(CellReference reference) {
            CellAddress target = reference.getTarget().resolve(home);
            if (!sheet.contains(target)) {
                return CellValue.error(ErrorKind.RANGE_ERROR);
            }
            CellValue value = sheet.getStore().get(target).getValue();
            switch (value.getType()) {
                case NUMBER:
                    return value;
                case EMPTY:
                    return CellValue.number(0);
                case TEXT:
                    return CellValue.error(ErrorKind.TYPE_MISMATCH);
                case ERROR:
                    return CellValue.error(ErrorKind.BAD_REF);
                default:
                    throw new IllegalStateException("Unknown value type " + value.getType());
            }
        }

        @Override
        public CellValue visitRange(CellRange range) {
            // a bare range has no single value
            return CellValue.error(ErrorKind.TYPE_MISMATCH);
        }

        @Override
        public CellValue visitBinary(BinaryOperation operation) {
            CellValue left = operation.getLeft().accept(this);
            if (left.isError()) {
                return left;
            }
            CellValue right = operation.getRight().accept(this);
            if (right.isError()) {
                return right;
            }
            double x = left.getNumber();
            double y = right.getNumber();
            switch (operation.getOperator()) {
                case ADD:
                    return CellValue.number(x + y);
                case SUBTRACT:
                    return CellValue.number(x - y);
                case MULTIPLY:
                    return CellValue.number(x * y);
                case DIVIDE:
                    if (y == 0) {
                        return CellValue.error(ErrorKind.DIV_BY_ZERO);
                    }
                    return CellValue.number(x / y);
                default:
                    throw new IllegalStateException("Unknown operator " + operation.getOperator());
            }
        }

        @Override
        public CellValue visitRangeFunction(RangeFunction function) {
            CellAddress start = function.getRange().getStart().resolve(home);
            CellAddress end = function.getRange().getEnd().resolve(home);
            if (!sheet.contains(start) || !sheet.contains(end)) {
                return CellValue.error(ErrorKind.RANGE_ERROR);
            }
            return RangeAggregator.aggregate(function.getType(), sheet.getStore().range(start, end));
        }

        @Override
        public CellValue visitDelay(DelayFunction delay) {
            CellValue duration = delay.getDuration().accept(this);
            if (duration.isError()) {
                return duration;
            }
            double seconds = duration.getNumber();
            if (seconds > 0) {
                try {
                    sleeper.sleep(seconds);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("SLEEP({}) in {} was interrupted", CellValue.formatNumber(seconds), home);
                }
            }
            return duration;
        }
    }
}
