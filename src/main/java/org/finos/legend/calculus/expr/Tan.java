package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.format.ExpressionFormatter;

import java.util.Objects;

/**
 * Tangent of an angle in radians.
 */
public record Tan(Expression operand) implements UnaryExpression {

    public Tan {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public Tan withOperand(Expression operand) {
        return new Tan(operand);
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
