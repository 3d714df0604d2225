package com.cellgraph.app.services;

import com.cellgraph.app.formula.AbsCell;
import com.cellgraph.app.formula.BinaryOperation;
import com.cellgraph.app.formula.CellRange;
import com.cellgraph.app.formula.CellReference;
import com.cellgraph.app.formula.CellReferenceTarget;
import com.cellgraph.app.formula.DelayFunction;
import com.cellgraph.app.formula.Expression;
import com.cellgraph.app.formula.ExpressionVisitor;
import com.cellgraph.app.formula.NumberLiteral;
import com.cellgraph.app.formula.RangeFunction;
import com.cellgraph.app.formula.RelCell;
import com.cellgraph.app.models.CellAddress;
import org.springframework.stereotype.Component;

/**
 * Re-anchors a copied formula at its paste destination.
 * A relative reference is resolved at the source and re-expressed from the destination so it
 * keeps its displacement: "=A1+B1" copied from C1 reads "=B5+C5" when pasted at D5.
 * Absolute references are left as they are.
 */
@Component
public class ReferenceTransformer {

    public Expression transformForPaste(Expression source, CellAddress sourceHome, CellAddress destinationHome) {
        return source.accept(new Rebase(sourceHome, destinationHome));
    }

    private static class Rebase implements ExpressionVisitor<Expression> {
        private final CellAddress sourceHome;
        private final CellAddress destinationHome;

        Rebase(CellAddress sourceHome, CellAddress destinationHome) {
            this.sourceHome = sourceHome;
            this.destinationHome = destinationHome;
        }

        private CellReferenceTarget rebase(CellReferenceTarget target) {
            if (target instanceof AbsCell) {
                return target;
            }
            RelCell relative = (RelCell) target;
            CellAddress absolute = relative.resolve(sourceHome);
            CellAddress shifted = absolute.offset(
                    destinationHome.getRow() - sourceHome.getRow(),
                    destinationHome.getColumn() - sourceHome.getColumn());
            return RelCell.between(destinationHome, shifted);
        }

        @Override
        public Expression visitNumber(NumberLiteral number) {
            return number;
        }

        @Override
        public Expression visitReference(CellReference reference) {
            return new CellReference(rebase(reference.getTarget()));
        }

        @Override
        public Expression visitRange(CellRange range) {
            return new CellRange(rebase(range.getStart()), rebase(range.getEnd()));
        }

        @Override
        public Expression visitBinary(BinaryOperation operation) {
            return new BinaryOperation(operation.getOperator(),
                    operation.getLeft().accept(this),
                    operation.getRight().accept(this));
        }

        @Override
        public Expression visitRangeFunction(RangeFunction function) {
            return new RangeFunction(function.getType(), (CellRange) function.getRange().accept(this));
        }

        @Override
        public Expression visitDelay(DelayFunction delay) {
            return new DelayFunction(delay.getDuration().accept(this));
        }
    }
}
