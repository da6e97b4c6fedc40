package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.format.ExpressionFormatter;

import java.util.Objects;

/**
 * Natural exponential, e^operand.
 */
public record Exp(Expression operand) implements UnaryExpression {

    public Exp {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public Exp withOperand(Expression operand) {
        return new Exp(operand);
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
