package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.format.ExpressionFormatter;

import java.util.Objects;

/**
 * Converts an angle in degrees to radians. Renders as its operand.
 */
public record ToRadians(Expression operand) implements UnaryExpression {

    public ToRadians {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public ToRadians withOperand(Expression operand) {
        return new ToRadians(operand);
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
