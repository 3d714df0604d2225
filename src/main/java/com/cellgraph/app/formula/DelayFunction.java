package com.cellgraph.app.formula;

import java.util.Objects;

/**
 * SLEEP(expr): waits for the argument's number of seconds, then yields the argument unchanged.
 */
public final class DelayFunction extends Expression {

    private final Expression duration;

    public DelayFunction(Expression duration) {
        this.duration = Objects.requireNonNull(duration);
    }

    public Expression getDuration() {
        return duration;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitDelay(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DelayFunction && duration.equals(((DelayFunction) o).duration);
    }

    @Override
    public int hashCode() {
        return Objects.hash("SLEEP", duration);
    }

    @Override
    public String toString() {
        return "SLEEP(" + duration + ")";
    }
}
