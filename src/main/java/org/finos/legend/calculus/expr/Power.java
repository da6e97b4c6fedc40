package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.format.ExpressionFormatter;

import java.util.List;
import java.util.Objects;

/**
 * Exponentiation: base^exponent
 *
 * @param base The base
 * @param exponent The exponent
 */
public record Power(Expression base, Expression exponent) implements Expression {

    public Power {
        Objects.requireNonNull(base, "Base cannot be null");
        Objects.requireNonNull(exponent, "Exponent cannot be null");
    }

    @Override
    public List<Expression> children() {
        return List.of(base, exponent);
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
