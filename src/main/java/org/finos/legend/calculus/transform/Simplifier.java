package org.finos.legend.calculus.transform;

import org.finos.legend.calculus.expr.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;

import static org.finos.legend.calculus.expr.Constant.E;
import static org.finos.legend.calculus.expr.Constant.MINUS_ONE;
import static org.finos.legend.calculus.expr.Constant.ONE;
import static org.finos.legend.calculus.expr.Constant.TWO;
import static org.finos.legend.calculus.expr.Constant.ZERO;
import static org.finos.legend.calculus.transform.StructuralEquality.equivalent;

/**
 * Rewrites expression trees toward a canonical reduced form.
 *
 * Each visit is one bottom-up pass: operands are simplified first, a node
 * whose operands are all constant is folded to its value, and otherwise the
 * first matching rewrite rule for the node type is applied. {@link #simplify}
 * repeats passes until the tree stops changing.
 *
 * Canonical choices:
 * <ul>
 * <li>constants move to the front of sums and products</li>
 * <li>negation is {@code -1 * v}</li>
 * <li>constant factors distribute over sums, non-constant common factors are
 * extracted from sums</li>
 * </ul>
 */
public final class Simplifier implements ExpressionVisitor<Expression> {

    private static final Logger LOG = LoggerFactory.getLogger(Simplifier.class);

    public static final String MAX_PASSES_PROPERTY = "legend.calculus.simplify.maxPasses";

    public static final int DEFAULT_MAX_PASSES = Integer.getInteger(MAX_PASSES_PROPERTY, 64);

    public static final Simplifier DEFAULT = new Simplifier(DEFAULT_MAX_PASSES);

    private static final double HALF_PI = Math.PI / 2;

    private final int maxPasses;

    public Simplifier(int maxPasses) {
        if (maxPasses <= 0) {
            throw new IllegalArgumentException("Pass limit must be positive");
        }
        this.maxPasses = maxPasses;
    }

    public int maxPasses() {
        return maxPasses;
    }

    /**
     * Applies rewrite passes until a fixed point is reached or the pass limit
     * is exhausted.
     *
     * @param expression The expression to simplify, left unchanged
     * @return The simplified expression
     */
    public Expression simplify(Expression expression) {
        Expression current = expression;
        for (int pass = 1; pass <= maxPasses; pass++) {
            Expression next = current.accept(this);
            if (next.equals(current)) {
                LOG.trace("Simplified {} to {} in {} pass(es)", expression, next, pass);
                return next;
            }
            LOG.trace("Pass {}: {} -> {}", pass, current, next);
            current = next;
        }
        LOG.warn("No fixed point for {} after {} passes, returning {}", expression, maxPasses, current);
        return current;
    }

    // ==================== Leaves ====================

    @Override
    public Expression visit(Constant constant) {
        return Constant.of(constant.value());
    }

    @Override
    public Expression visit(Variable variable) {
        return variable;
    }

    // ==================== Binary ====================

    @Override
    public Expression visit(Add add) {
        Expression a = add.left().accept(this);
        Expression b = add.right().accept(this);
        Expression folded = fold(new Add(a, b));
        if (folded instanceof Constant) {
            return folded;
        }
        if (is(a, 0)) {
            return b;
        }
        if (is(b, 0)) {
            return a;
        }
        Expression merged = mergeLikeTerms(a, b, false);
        if (merged != null) {
            return merged;
        }
        Expression factored = extractCommonFactor(a, b);
        if (factored != null) {
            return factored;
        }
        if (b instanceof Constant && !(a instanceof Constant)) {
            return new Add(b, a);
        }
        if (a instanceof Constant ca && b instanceof Add sum && sum.left() instanceof Constant cb) {
            Expression constant = fold(new Add(ca, cb));
            if (constant instanceof Constant) {
                return new Add(constant, sum.right());
            }
        }
        if (!(a instanceof Constant) && b instanceof Add sum && sum.left() instanceof Constant c) {
            return new Add(c, new Add(a, sum.right()));
        }
        if (a instanceof Add sum && sum.left() instanceof Constant c) {
            return new Add(c, new Add(sum.right(), b));
        }
        return new Add(a, b);
    }

    @Override
    public Expression visit(Subtract subtract) {
        Expression a = subtract.left().accept(this);
        Expression b = subtract.right().accept(this);
        Expression folded = fold(new Subtract(a, b));
        if (folded instanceof Constant) {
            return folded;
        }
        if (equivalent(a, b)) {
            return ZERO;
        }
        if (is(b, 0)) {
            return a;
        }
        if (is(a, 0)) {
            return new Multiply(MINUS_ONE, b);
        }
        if (b instanceof Constant c && c.value() < 0) {
            return new Add(a, Constant.of(-c.value()));
        }
        Expression negated = negationOperand(b);
        if (negated != null) {
            return new Add(a, negated);
        }
        Expression merged = mergeLikeTerms(a, b, true);
        if (merged != null) {
            return merged;
        }
        return new Subtract(a, b);
    }

    @Override
    public Expression visit(Multiply multiply) {
        Expression a = multiply.left().accept(this);
        Expression b = multiply.right().accept(this);
        Expression folded = fold(new Multiply(a, b));
        if (folded instanceof Constant) {
            return folded;
        }
        if (is(a, 0) || is(b, 0)) {
            return ZERO;
        }
        if (is(a, 1)) {
            return b;
        }
        if (is(b, 1)) {
            return a;
        }
        if (b instanceof Constant && !(a instanceof Constant)) {
            return new Multiply(b, a);
        }
        if (a instanceof Constant ca && b instanceof Multiply product && product.left() instanceof Constant cb) {
            Expression constant = fold(new Multiply(ca, cb));
            if (constant instanceof Constant) {
                return new Multiply(constant, product.right());
            }
        }
        if (!(a instanceof Constant) && b instanceof Multiply product && product.left() instanceof Constant c) {
            return new Multiply(c, new Multiply(a, product.right()));
        }
        if (a instanceof Multiply product && product.left() instanceof Constant c && !(b instanceof Constant)) {
            return new Multiply(c, new Multiply(product.right(), b));
        }
        if (a instanceof Constant c && b instanceof Add sum) {
            return new Add(new Multiply(c, sum.left()), new Multiply(c, sum.right()));
        }
        if (equivalent(a, b)) {
            return new Power(a, TWO);
        }
        if (a instanceof Power pa && b instanceof Power pb && equivalent(pa.base(), pb.base())) {
            return new Power(pa.base(), new Add(pa.exponent(), pb.exponent()));
        }
        if (a instanceof Power pa && equivalent(pa.base(), b)) {
            return new Power(b, new Add(pa.exponent(), ONE));
        }
        if (b instanceof Power pb && equivalent(pb.base(), a)) {
            return new Power(a, new Add(pb.exponent(), ONE));
        }
        return new Multiply(a, b);
    }

    @Override
    public Expression visit(Divide divide) {
        Expression a = divide.left().accept(this);
        Expression b = divide.right().accept(this);
        Expression folded = fold(new Divide(a, b));
        if (folded instanceof Constant) {
            return folded;
        }
        if (is(b, 0)) {
            return new Divide(a, b);
        }
        if (is(a, 0)) {
            return ZERO;
        }
        if (is(b, 1)) {
            return a;
        }
        if (equivalent(a, b)) {
            return ONE;
        }
        if (is(b, -1)) {
            return new Multiply(MINUS_ONE, a);
        }
        if (a instanceof Multiply numerator) {
            if (equivalent(numerator.left(), b)) {
                return numerator.right();
            }
            if (equivalent(numerator.right(), b)) {
                return numerator.left();
            }
        }
        if (b instanceof Multiply denominator) {
            if (equivalent(denominator.left(), a)) {
                return new Divide(ONE, denominator.right());
            }
            if (equivalent(denominator.right(), a)) {
                return new Divide(ONE, denominator.left());
            }
        }
        if (a instanceof Power pa && b instanceof Power pb && equivalent(pa.base(), pb.base())) {
            return new Power(pa.base(), new Subtract(pa.exponent(), pb.exponent()));
        }
        if (a instanceof Power pa && equivalent(pa.base(), b)) {
            return new Power(b, new Subtract(pa.exponent(), ONE));
        }
        if (b instanceof Power pb && equivalent(pb.base(), a)) {
            return new Power(a, new Subtract(ONE, pb.exponent()));
        }
        if (a instanceof Multiply numerator && b instanceof Multiply denominator) {
            Expression cancelled = crossCancel(numerator, denominator);
            if (cancelled != null) {
                return cancelled;
            }
        }
        if (b instanceof Constant) {
            Expression reciprocal = fold(new Divide(ONE, b));
            if (reciprocal instanceof Constant) {
                return new Multiply(reciprocal, a);
            }
        }
        return new Divide(a, b);
    }

    @Override
    public Expression visit(Power power) {
        Expression base = power.base().accept(this);
        Expression exponent = power.exponent().accept(this);
        Expression folded = fold(new Power(base, exponent));
        if (folded instanceof Constant) {
            return folded;
        }
        if (is(exponent, 0) && !is(base, 0)) {
            return ONE;
        }
        if (is(exponent, 1)) {
            return base;
        }
        if (is(base, 1)) {
            return ONE;
        }
        if (is(base, 0)) {
            OptionalDouble value = ConstantFolder.valueOf(exponent);
            if (value.isPresent() && value.getAsDouble() > 0) {
                return ZERO;
            }
        }
        if (base instanceof Power inner) {
            return new Power(inner.base(), new Multiply(inner.exponent(), exponent));
        }
        if (is(base, Math.E) && exponent instanceof Ln ln) {
            return ln.operand();
        }
        return new Power(base, exponent);
    }

    @Override
    public Expression visit(Log log) {
        Expression value = log.value().accept(this);
        Expression base = log.base().accept(this);
        Expression folded = fold(new Log(value, base));
        if (folded instanceof Constant) {
            return folded;
        }
        if (equivalent(value, base)) {
            return ONE;
        }
        return new Log(value, base);
    }

    // ==================== Logarithm and exponential ====================

    @Override
    public Expression visit(Ln ln) {
        Expression v = ln.operand().accept(this);
        if (is(v, 1)) {
            return ZERO;
        }
        if (is(v, Math.E)) {
            return ONE;
        }
        Expression folded = fold(new Ln(v));
        if (folded instanceof Constant) {
            return folded;
        }
        if (v instanceof Exp exp) {
            return exp.operand();
        }
        if (v instanceof Power power) {
            return new Multiply(power.exponent(), new Ln(power.base()));
        }
        if (v instanceof Multiply product) {
            return new Add(new Ln(product.left()), new Ln(product.right()));
        }
        if (v instanceof Divide quotient) {
            return new Subtract(new Ln(quotient.left()), new Ln(quotient.right()));
        }
        return new Ln(v);
    }

    @Override
    public Expression visit(Ld ld) {
        return simplifyOperand(ld);
    }

    @Override
    public Expression visit(Exp exp) {
        Expression v = exp.operand().accept(this);
        if (is(v, 1)) {
            return E;
        }
        if (is(v, 0)) {
            return ONE;
        }
        Expression folded = fold(new Exp(v));
        if (folded instanceof Constant) {
            return folded;
        }
        if (v instanceof Ln ln) {
            return ln.operand();
        }
        if (v instanceof Multiply product) {
            if (product.right() instanceof Ln ln) {
                return new Power(ln.operand(), product.left());
            }
            if (product.left() instanceof Ln ln) {
                return new Power(ln.operand(), product.right());
            }
        }
        return new Exp(v);
    }

    // ==================== Roots ====================

    @Override
    public Expression visit(Sqrt sqrt) {
        Expression v = sqrt.operand().accept(this);
        if (is(v, 0) || is(v, 1)) {
            return v;
        }
        Expression folded = fold(new Sqrt(v));
        if (folded instanceof Constant) {
            return folded;
        }
        if (v instanceof Power power && is(power.exponent(), 2)) {
            return power.base();
        }
        return new Sqrt(v);
    }

    @Override
    public Expression visit(Cbrt cbrt) {
        Expression v = cbrt.operand().accept(this);
        if (is(v, 0) || is(v, 1) || is(v, -1)) {
            return v;
        }
        Expression folded = fold(new Cbrt(v));
        if (folded instanceof Constant) {
            return folded;
        }
        if (v instanceof Power power && is(power.exponent(), 3)) {
            return power.base();
        }
        return new Cbrt(v);
    }

    @Override
    public Expression visit(NthRoot root) {
        int n = root.degree();
        Expression v = root.operand().accept(this);
        if (is(v, 0) || is(v, 1) || (n % 2 == 1 && is(v, -1))) {
            return v;
        }
        Expression folded = fold(new NthRoot(v, n));
        if (folded instanceof Constant) {
            return folded;
        }
        if (v instanceof Power power && is(power.exponent(), n)) {
            return power.base();
        }
        return new NthRoot(v, n);
    }

    // ==================== Trigonometry ====================

    @Override
    public Expression visit(Sin sin) {
        Expression v = sin.operand().accept(this);
        if (is(v, 0) || is(v, Math.PI)) {
            return ZERO;
        }
        if (is(v, HALF_PI)) {
            return ONE;
        }
        Expression folded = fold(new Sin(v));
        if (folded instanceof Constant) {
            return folded;
        }
        Expression negated = negationOperand(v);
        if (negated != null) {
            return new Multiply(MINUS_ONE, new Sin(negated));
        }
        return new Sin(v);
    }

    @Override
    public Expression visit(Cos cos) {
        Expression v = cos.operand().accept(this);
        if (is(v, 0)) {
            return ONE;
        }
        if (is(v, Math.PI)) {
            return MINUS_ONE;
        }
        if (is(v, HALF_PI)) {
            return ZERO;
        }
        Expression folded = fold(new Cos(v));
        if (folded instanceof Constant) {
            return folded;
        }
        Expression negated = negationOperand(v);
        if (negated != null) {
            return new Cos(negated);
        }
        return new Cos(v);
    }

    @Override
    public Expression visit(Tan tan) {
        return simplifyOperand(tan);
    }

    @Override
    public Expression visit(Asin asin) {
        return simplifyOperand(asin);
    }

    @Override
    public Expression visit(Acos acos) {
        return simplifyOperand(acos);
    }

    @Override
    public Expression visit(Atan atan) {
        return simplifyOperand(atan);
    }

    @Override
    public Expression visit(ToRadians toRadians) {
        return simplifyOperand(toRadians);
    }

    @Override
    public Expression visit(ToDegrees toDegrees) {
        return simplifyOperand(toDegrees);
    }

    // ==================== Helpers ====================

    private Expression simplifyOperand(UnaryExpression function) {
        return fold(function.withOperand(function.operand().accept(this)));
    }

    private static Expression fold(Expression expression) {
        OptionalDouble value = ConstantFolder.valueOf(expression);
        return value.isPresent() ? Constant.of(value.getAsDouble()) : expression;
    }

    private static boolean is(Expression expression, double value) {
        return expression instanceof Constant c && c.is(value);
    }

    /**
     * @return v when the expression is {@code -1 * v}, otherwise null
     */
    private static Expression negationOperand(Expression expression) {
        if (expression instanceof Multiply product && is(product.left(), -1)) {
            return product.right();
        }
        return null;
    }

    /**
     * Merges {@code c1 * t} and {@code c2 * t} (a bare {@code t} counts as
     * {@code 1 * t}) into {@code (c1 ± c2) * t}.
     *
     * @return The merged term, or null if the terms are unlike
     */
    private static Expression mergeLikeTerms(Expression a, Expression b, boolean subtract) {
        Constant ca = coefficient(a);
        Constant cb = coefficient(b);
        Expression ta = term(a);
        Expression tb = term(b);
        if (ta.isConstant() || !equivalent(ta, tb)) {
            return null;
        }
        Expression sum = fold(subtract ? new Subtract(ca, cb) : new Add(ca, cb));
        if (!(sum instanceof Constant c)) {
            return null;
        }
        if (c.is(0)) {
            return ZERO;
        }
        return c.is(1) ? ta : new Multiply(c, ta);
    }

    private static Constant coefficient(Expression expression) {
        if (expression instanceof Multiply product && product.left() instanceof Constant c) {
            return c;
        }
        return ONE;
    }

    private static Expression term(Expression expression) {
        if (expression instanceof Multiply product && product.left() instanceof Constant) {
            return product.right();
        }
        return expression;
    }

    /**
     * {@code f * a + f * b -> f * (a + b)} for a non-constant shared factor f.
     */
    private static Expression extractCommonFactor(Expression a, Expression b) {
        if (!(a instanceof Multiply ma) || !(b instanceof Multiply mb)) {
            return null;
        }
        if (!ma.left().isConstant() && equivalent(ma.left(), mb.left())) {
            return new Multiply(ma.left(), new Add(ma.right(), mb.right()));
        }
        if (!ma.right().isConstant() && equivalent(ma.right(), mb.right())) {
            return new Multiply(new Add(ma.left(), mb.left()), ma.right());
        }
        if (!ma.left().isConstant() && equivalent(ma.left(), mb.right())) {
            return new Multiply(ma.left(), new Add(ma.right(), mb.left()));
        }
        if (!ma.right().isConstant() && equivalent(ma.right(), mb.left())) {
            return new Multiply(ma.right(), new Add(ma.left(), mb.right()));
        }
        return null;
    }

    /**
     * {@code (a * b) / (a * d) -> b / d}, for any pairing of the factors.
     */
    private static Expression crossCancel(Multiply numerator, Multiply denominator) {
        if (equivalent(numerator.left(), denominator.left())) {
            return new Divide(numerator.right(), denominator.right());
        }
        if (equivalent(numerator.left(), denominator.right())) {
            return new Divide(numerator.right(), denominator.left());
        }
        if (equivalent(numerator.right(), denominator.left())) {
            return new Divide(numerator.left(), denominator.right());
        }
        if (equivalent(numerator.right(), denominator.right())) {
            return new Divide(numerator.left(), denominator.left());
        }
        return null;
    }
}
