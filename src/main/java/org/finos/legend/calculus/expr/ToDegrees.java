package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.format.ExpressionFormatter;

import java.util.Objects;

/**
 * Converts an angle in radians to degrees. Renders as its operand.
 */
public record ToDegrees(Expression operand) implements UnaryExpression {

    public ToDegrees {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public ToDegrees withOperand(Expression operand) {
        return new ToDegrees(operand);
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
