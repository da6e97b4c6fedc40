package org.finos.legend.calculus.format;

import org.finos.legend.calculus.expr.*;

/**
 * Renders expression trees as algebraic text.
 *
 * Parentheses are only emitted where operator precedence requires them.
 * Products of a coefficient or variable with a variable (or a power of one)
 * are juxtaposed: {@code 2x}, {@code xy}, {@code 3x^2}. A factor of -1 renders
 * as a leading minus sign.
 */
public final class ExpressionFormatter implements ExpressionVisitor<String> {

    private static final ExpressionFormatter INSTANCE = new ExpressionFormatter();

    private static final int ADDITIVE = 1;
    private static final int MULTIPLICATIVE = 2;
    private static final int POWER = 3;
    private static final int ATOM = 4;

    private ExpressionFormatter() {
    }

    public static String format(Expression expression) {
        return expression.accept(INSTANCE);
    }

    /**
     * Integer valued numbers print without a decimal point; pi and e print by name.
     */
    public static String formatNumber(double value) {
        if (value == Math.PI) {
            return "π";
        }
        if (value == Math.E) {
            return "e";
        }
        if (value % 1.0 == 0.0 && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    // ==================== Leaves ====================

    @Override
    public String visit(Constant constant) {
        return formatNumber(constant.value());
    }

    @Override
    public String visit(Variable variable) {
        return String.valueOf(variable.symbol());
    }

    // ==================== Binary ====================

    @Override
    public String visit(Add add) {
        return wrap(add.left(), ADDITIVE) + " + " + wrap(add.right(), ADDITIVE);
    }

    @Override
    public String visit(Subtract subtract) {
        return wrap(subtract.left(), ADDITIVE) + " - " + wrap(subtract.right(), MULTIPLICATIVE);
    }

    @Override
    public String visit(Multiply multiply) {
        if (multiply.left() instanceof Constant c && c.is(-1)) {
            return "-" + wrap(multiply.right(), MULTIPLICATIVE);
        }
        if (isJuxtaposed(multiply)) {
            return multiply.left().accept(this) + multiply.right().accept(this);
        }
        return wrap(multiply.left(), MULTIPLICATIVE) + " * " + wrap(multiply.right(), MULTIPLICATIVE);
    }

    @Override
    public String visit(Divide divide) {
        return wrap(divide.left(), MULTIPLICATIVE) + " / " + wrap(divide.right(), POWER);
    }

    @Override
    public String visit(Power power) {
        return wrap(power.base(), ATOM) + "^" + wrap(power.exponent(), POWER);
    }

    @Override
    public String visit(Log log) {
        return "log" + wrap(log.base(), ATOM) + "(" + format(log.value()) + ")";
    }

    // ==================== Unary ====================

    @Override
    public String visit(Ln ln) {
        return call("ln", ln);
    }

    @Override
    public String visit(Ld ld) {
        return call("ld", ld);
    }

    @Override
    public String visit(Exp exp) {
        return call("exp", exp);
    }

    @Override
    public String visit(Sqrt sqrt) {
        return call("sqrt", sqrt);
    }

    @Override
    public String visit(Cbrt cbrt) {
        return call("cbrt", cbrt);
    }

    @Override
    public String visit(NthRoot root) {
        return call("root" + root.degree(), root);
    }

    @Override
    public String visit(Sin sin) {
        return call("sin", sin);
    }

    @Override
    public String visit(Asin asin) {
        return call("asin", asin);
    }

    @Override
    public String visit(Cos cos) {
        return call("cos", cos);
    }

    @Override
    public String visit(Acos acos) {
        return call("acos", acos);
    }

    @Override
    public String visit(Tan tan) {
        return call("tan", tan);
    }

    @Override
    public String visit(Atan atan) {
        return call("atan", atan);
    }

    // Angle conversions are transparent in text

    @Override
    public String visit(ToRadians toRadians) {
        return format(toRadians.operand());
    }

    @Override
    public String visit(ToDegrees toDegrees) {
        return format(toDegrees.operand());
    }

    // ==================== Helpers ====================

    private String call(String name, UnaryExpression function) {
        return name + "(" + format(function.operand()) + ")";
    }

    private String wrap(Expression child, int minimumPrecedence) {
        String text = format(child);
        return precedence(child) < minimumPrecedence ? "(" + text + ")" : text;
    }

    private static int precedence(Expression expression) {
        if (expression instanceof ToRadians toRadians) {
            return precedence(toRadians.operand());
        }
        if (expression instanceof ToDegrees toDegrees) {
            return precedence(toDegrees.operand());
        }
        if (expression instanceof Add || expression instanceof Subtract) {
            return ADDITIVE;
        }
        if (expression instanceof Multiply || expression instanceof Divide) {
            return MULTIPLICATIVE;
        }
        if (expression instanceof Constant c && c.value() < 0) {
            return MULTIPLICATIVE;
        }
        if (expression instanceof Power) {
            return POWER;
        }
        return ATOM;
    }

    private static boolean isJuxtaposed(Multiply multiply) {
        return endsInSymbol(multiply.left()) && isMonomialFactor(multiply.right());
    }

    private static boolean endsInSymbol(Expression left) {
        if (left instanceof Constant c) {
            return !c.is(Math.E) && !c.is(Math.PI);
        }
        if (left instanceof Multiply product) {
            return isJuxtaposed(product) && product.right() instanceof Variable;
        }
        return left instanceof Variable;
    }

    private static boolean isMonomialFactor(Expression right) {
        if (right instanceof Multiply product) {
            return product.left() instanceof Variable && isJuxtaposed(product);
        }
        if (right instanceof Power power) {
            return power.base() instanceof Variable
                    && power.exponent() instanceof Constant exponent
                    && exponent.value() >= 0;
        }
        return right instanceof Variable;
    }
}
