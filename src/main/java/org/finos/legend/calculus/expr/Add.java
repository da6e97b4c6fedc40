package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.format.ExpressionFormatter;

import java.util.List;
import java.util.Objects;

/**
 * Sum of two expressions: left + right
 *
 * @param left The left operand
 * @param right The right operand
 */
public record Add(Expression left, Expression right) implements Expression {

    public Add {
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
