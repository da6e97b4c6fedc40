package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.format.ExpressionFormatter;

import java.util.List;

/**
 * A finite real literal.
 *
 * Frequently used values are cached; {@link #of(double)} hands out the cached
 * instance so rewrite rules can short-circuit on identity.
 *
 * @param value The literal value, never NaN or infinite
 */
public record Constant(double value) implements Expression {

    public static final Constant ZERO = new Constant(0);
    public static final Constant ONE = new Constant(1);
    public static final Constant TWO = new Constant(2);
    public static final Constant THREE = new Constant(3);
    public static final Constant MINUS_ONE = new Constant(-1);
    public static final Constant E = new Constant(Math.E);
    public static final Constant PI = new Constant(Math.PI);

    private static final Constant[] CACHED = {ZERO, ONE, TWO, THREE, MINUS_ONE, E, PI};

    public Constant {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Constant must be finite: " + value);
        }
    }

    public static Constant of(double value) {
        // -0.0 == 0.0, so negative zero collapses onto ZERO here
        for (Constant cached : CACHED) {
            if (cached.value == value) {
                return cached;
            }
        }
        return new Constant(value);
    }

    /**
     * @return ln(2), computed on first use
     */
    public static Constant lnTwo() {
        return LnTwoHolder.LN_TWO;
    }

    public boolean is(double other) {
        return value == other;
    }

    public boolean isInteger() {
        return value % 1.0 == 0.0;
    }

    @Override
    public List<Expression> children() {
        return List.of();
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return ExpressionFormatter.format(this);
    }

    private static final class LnTwoHolder {
        private static final Constant LN_TWO = new Constant(Math.log(2));
    }
}
