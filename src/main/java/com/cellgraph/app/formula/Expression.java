package com.cellgraph.app.formula;

/**
 * Root of the parsed formula tree.
 * Consumers dispatch through {@link ExpressionVisitor} so every node kind is handled explicitly.
 */
public abstract class Expression {

    public abstract <R> R accept(ExpressionVisitor<R> visitor);
}
