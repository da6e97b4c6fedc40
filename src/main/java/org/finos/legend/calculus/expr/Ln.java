package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.format.ExpressionFormatter;

import java.util.Objects;

/**
 * Natural logarithm.
 */
public record Ln(Expression operand) implements UnaryExpression {

    public Ln {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public Ln withOperand(Expression operand) {
        return new Ln(operand);
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
