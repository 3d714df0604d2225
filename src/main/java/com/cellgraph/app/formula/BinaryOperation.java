package com.cellgraph.app.formula;

import java.util.Objects;

public final class BinaryOperation extends Expression {

    private final Operator operator;
    private final Expression left;
    private final Expression right;

    public BinaryOperation(Operator operator, Expression left, Expression right) {
        this.operator = Objects.requireNonNull(operator);
        this.left = Objects.requireNonNull(left);
        this.right = Objects.requireNonNull(right);
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BinaryOperation)) {
            return false;
        }
        BinaryOperation that = (BinaryOperation) o;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
