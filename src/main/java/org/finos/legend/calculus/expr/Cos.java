package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.format.ExpressionFormatter;

import java.util.Objects;

/**
 * Cosine of an angle in radians.
 */
public record Cos(Expression operand) implements UnaryExpression {

    public Cos {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public Cos withOperand(Expression operand) {
        return new Cos(operand);
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
