package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.format.ExpressionFormatter;

import java.util.Objects;

public record Atan(Expression operand) implements UnaryExpression {

    public Atan {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public Atan withOperand(Expression operand) {
        return new Atan(operand);
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
