package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.format.ExpressionFormatter;

import java.util.List;
import java.util.Objects;

/**
 * Logarithm of value to an arbitrary base, evaluated by change of base.
 *
 * @param value The argument of the logarithm
 * @param base The base of the logarithm
 */
public record Log(Expression value, Expression base) implements Expression {

    public Log {
        Objects.requireNonNull(value, "Value cannot be null");
        Objects.requireNonNull(base, "Base cannot be null");
    }

    @Override
    public List<Expression> children() {
        return List.of(value, base);
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
