package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.format.ExpressionFormatter;

import java.util.Objects;

public record Asin(Expression operand) implements UnaryExpression {

    public Asin {
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    @Override
    public Asin withOperand(Expression operand) {
        return new Asin(operand);
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
