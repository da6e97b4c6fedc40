package org.finos.legend.calculus.expr;

/**
 * Static factories for leaf expressions, intended for static import:
 * <pre>
 * variable('x').pow(2).plus(constant(3).multiply(variable('x')))
 * </pre>
 */
public final class Expressions {

    private Expressions() {
    }

    public static Constant constant(double value) {
        return Constant.of(value);
    }

    public static Variable variable(char symbol) {
        return symbol == Variable.DEFAULT_SYMBOL ? Variable.X : new Variable(symbol);
    }

    /**
     * @return The variable {@code x}
     */
    public static Variable x() {
        return Variable.X;
    }
}
