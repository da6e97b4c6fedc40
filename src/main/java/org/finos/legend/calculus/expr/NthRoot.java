package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.format.ExpressionFormatter;

import java.util.Objects;

/**
 * Real root of arbitrary integer degree, evaluated by Newton iteration.
 *
 * @param operand The radicand
 * @param degree  The root degree, at least 2
 */
public record NthRoot(Expression operand, int degree) implements UnaryExpression {

    public NthRoot {
        Objects.requireNonNull(operand, "Operand cannot be null");
        if (degree < 2) {
            throw new IllegalArgumentException("Root degree must be at least 2, was " + degree);
        }
    }

    @Override
    public NthRoot withOperand(Expression operand) {
        return new NthRoot(operand, degree);
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
