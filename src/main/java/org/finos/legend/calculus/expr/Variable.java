package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.format.ExpressionFormatter;

import java.util.List;

/**
 * An unbound input slot, resolved by name at evaluation time.
 *
 * @param symbol The variable name
 */
public record Variable(char symbol) implements Expression {

    public static final char DEFAULT_SYMBOL = 'x';

    public static final Variable X = new Variable(DEFAULT_SYMBOL);

    @Override
    public List<Expression> children() {
        return List.of();
    }

    @Override
    public boolean isConstant() {
        return false;
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
