package org.finos.legend.calculus.transform;

import org.finos.legend.calculus.expr.*;

import static org.finos.legend.calculus.expr.Constant.MINUS_ONE;
import static org.finos.legend.calculus.expr.Constant.ONE;
import static org.finos.legend.calculus.expr.Constant.THREE;
import static org.finos.legend.calculus.expr.Constant.TWO;
import static org.finos.legend.calculus.expr.Constant.ZERO;

/**
 * Builds the symbolic derivative of an expression with respect to one symbol.
 *
 * The result is not simplified; {@link Expression#differentiate(char)} runs
 * the {@link Simplifier} over it.
 */
public final class Differentiator implements ExpressionVisitor<Expression> {

    private final char symbol;

    public Differentiator(char symbol) {
        this.symbol = symbol;
    }

    public Expression differentiate(Expression expression) {
        return expression.accept(this);
    }

    /**
     * @return true if the symbol occurs anywhere in the expression
     */
    public boolean dependsOn(Expression expression) {
        if (expression instanceof Variable variable) {
            return variable.symbol() == symbol;
        }
        for (Expression child : expression.children()) {
            if (dependsOn(child)) {
                return true;
            }
        }
        return false;
    }

    // ==================== Leaves ====================

    @Override
    public Expression visit(Constant constant) {
        return ZERO;
    }

    @Override
    public Expression visit(Variable variable) {
        return variable.symbol() == symbol ? ONE : ZERO;
    }

    // ==================== Binary ====================

    @Override
    public Expression visit(Add add) {
        return new Add(differentiate(add.left()), differentiate(add.right()));
    }

    @Override
    public Expression visit(Subtract subtract) {
        return new Subtract(differentiate(subtract.left()), differentiate(subtract.right()));
    }

    /**
     * Product rule: (ab)' = a'b + ab'
     */
    @Override
    public Expression visit(Multiply multiply) {
        Expression a = multiply.left();
        Expression b = multiply.right();
        return new Add(
                new Multiply(differentiate(a), b),
                new Multiply(a, differentiate(b)));
    }

    /**
     * Quotient rule: (a/b)' = (a'b - ab') / b^2
     */
    @Override
    public Expression visit(Divide divide) {
        Expression a = divide.left();
        Expression b = divide.right();
        return new Divide(
                new Subtract(new Multiply(differentiate(a), b), new Multiply(a, differentiate(b))),
                new Power(b, TWO));
    }

    @Override
    public Expression visit(Power power) {
        Expression base = power.base();
        Expression exponent = power.exponent();
        if (!dependsOn(exponent)) {
            // n * b^(n-1) * b'
            return new Multiply(
                    new Multiply(exponent, new Power(base, new Subtract(exponent, ONE))),
                    differentiate(base));
        }
        if (!dependsOn(base)) {
            // b^e * ln(b) * e'
            return new Multiply(
                    new Multiply(power, new Ln(base)),
                    differentiate(exponent));
        }
        // b^e * (e' ln(b) + e b' / b)
        return new Multiply(
                power,
                new Add(
                        new Multiply(differentiate(exponent), new Ln(base)),
                        new Divide(new Multiply(exponent, differentiate(base)), base)));
    }

    /**
     * The base is treated as fixed: log_b(v)' = v' / (v ln(b))
     */
    @Override
    public Expression visit(Log log) {
        Expression value = log.value();
        return new Divide(differentiate(value), new Multiply(value, new Ln(log.base())));
    }

    // ==================== Unary ====================

    @Override
    public Expression visit(Ln ln) {
        Expression v = ln.operand();
        return new Divide(differentiate(v), v);
    }

    @Override
    public Expression visit(Ld ld) {
        return differentiate(new Divide(new Ln(ld.operand()), Constant.lnTwo()));
    }

    @Override
    public Expression visit(Exp exp) {
        return new Multiply(exp, differentiate(exp.operand()));
    }

    @Override
    public Expression visit(Sqrt sqrt) {
        return new Divide(differentiate(sqrt.operand()), new Multiply(TWO, sqrt));
    }

    @Override
    public Expression visit(Cbrt cbrt) {
        return new Divide(differentiate(cbrt.operand()), new Multiply(THREE, new Power(cbrt, TWO)));
    }

    /**
     * root_n(v)' = v' / (n * root_n(v)^(n-1))
     */
    @Override
    public Expression visit(NthRoot root) {
        int n = root.degree();
        return new Divide(
                differentiate(root.operand()),
                new Multiply(Constant.of(n), new Power(root, Constant.of(n - 1))));
    }

    @Override
    public Expression visit(Sin sin) {
        Expression v = sin.operand();
        return new Multiply(new Cos(v), differentiate(v));
    }

    @Override
    public Expression visit(Asin asin) {
        Expression v = asin.operand();
        return new Divide(differentiate(v), new Sqrt(new Subtract(ONE, new Power(v, TWO))));
    }

    @Override
    public Expression visit(Cos cos) {
        Expression v = cos.operand();
        return new Multiply(new Multiply(MINUS_ONE, new Sin(v)), differentiate(v));
    }

    @Override
    public Expression visit(Acos acos) {
        Expression v = acos.operand();
        return new Divide(
                new Multiply(MINUS_ONE, differentiate(v)),
                new Sqrt(new Subtract(ONE, new Power(v, TWO))));
    }

    @Override
    public Expression visit(Tan tan) {
        Expression v = tan.operand();
        return new Divide(differentiate(v), new Power(new Cos(v), TWO));
    }

    @Override
    public Expression visit(Atan atan) {
        Expression v = atan.operand();
        return new Divide(differentiate(v), new Add(ONE, new Power(v, TWO)));
    }

    // Angle conversions are linear scales

    @Override
    public Expression visit(ToRadians toRadians) {
        return new ToRadians(differentiate(toRadians.operand()));
    }

    @Override
    public Expression visit(ToDegrees toDegrees) {
        return new ToDegrees(differentiate(toDegrees.operand()));
    }
}
