package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.format.ExpressionFormatter;

import java.util.Objects;

public record Acos(Expression operand) implements UnaryExpression {

    public Acos {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public Acos withOperand(Expression operand) {
        return new Acos(operand);
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
