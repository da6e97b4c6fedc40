package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.format.ExpressionFormatter;

import java.util.Objects;

/**
 * Cube root. Defined for negative operands.
 */
public record Cbrt(Expression operand) implements UnaryExpression {

    public Cbrt {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public Cbrt withOperand(Expression operand) {
        return new Cbrt(operand);
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
