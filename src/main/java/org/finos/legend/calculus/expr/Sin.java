package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.format.ExpressionFormatter;

import java.util.Objects;

/**
 * Sine of an angle in radians.
 */
public record Sin(Expression operand) implements UnaryExpression {

    public Sin {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public Sin withOperand(Expression operand) {
        return new Sin(operand);
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
