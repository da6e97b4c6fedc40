package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.format.ExpressionFormatter;

import java.util.Objects;

/**
 * Binary logarithm (base 2).
 */
public record Ld(Expression operand) implements UnaryExpression {

    public Ld {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public Ld withOperand(Expression operand) {
        return new Ld(operand);
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
