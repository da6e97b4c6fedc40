package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.format.ExpressionFormatter;

import java.util.List;
import java.util.Objects;

/**
 * Product of two expressions. Negation is represented as (-1) * operand.
 *
 * @param left The left factor
 * @param right The right factor
 */
public record Multiply(Expression left, Expression right) implements Expression {

    public Multiply {
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
