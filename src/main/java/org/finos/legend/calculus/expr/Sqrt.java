package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.format.ExpressionFormatter;

import java.util.Objects;

/**
 * Square root.
 */
public record Sqrt(Expression operand) implements UnaryExpression {

    public Sqrt {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public Sqrt withOperand(Expression operand) {
        return new Sqrt(operand);
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
