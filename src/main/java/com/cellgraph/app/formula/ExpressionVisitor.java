package com.cellgraph.app.formula;

public interface ExpressionVisitor<R> {

    R visitNumber(NumberLiteral number);

    R visitReference(CellReference reference);

    R visitRange(CellRange range);

    R visitBinary(BinaryOperation operation);

    R visitRangeFunction(RangeFunction function);

    R visitDelay(DelayFunction delay);
}
