package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.format.ExpressionFormatter;

import java.util.List;
import java.util.Objects;

/**
 * Quotient of two expressions. Evaluation fails when the divisor evaluates to exactly zero.
 *
 * @param left The dividend
 * @param right The divisor
 */
public record Divide(Expression left, Expression right) implements Expression {

    public Divide {
        Objects.requireNonNull(left, "Left cannot be null");
        Objects.requireNonNull(right, "Right cannot be null");
    }

    @Override
    public List<Expression> children() {
        return List.of(left, right);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return ExpressionFormatter.format(this);
    }
}
