package org.finos.legend.calculus.expr;

import org.finos.legend.calculus.eval.Evaluator;
import org.finos.legend.calculus.transform.Differentiator;
import org.finos.legend.calculus.transform.Simplifier;

import java.util.List;
import java.util.Map;

/**
 * Sealed interface representing a real-valued expression tree.
 *
 * Type hierarchy:
 * Expression
 * ├── Constant, Variable (leaves)
 * ├── Add, Subtract, Multiply, Divide, Power, Log (two operands)
 * └── UnaryExpression (ln, ld, exp, roots, trigonometry, angle conversion)
 *
 * Trees are immutable. Every operation ({@link #compute}, {@link #differentiate},
 * {@link #simplify}) returns a value or a new tree and leaves the receiver untouched.
 */
public sealed interface Expression
        permits Constant, Variable, Add, Subtract, Multiply, Divide, Power, Log, UnaryExpression {

    /**
     * Accept method for the expression visitor pattern.
     *
     * @param visitor The visitor to accept
     * @param <T>     The return type of the visitor
     * @return The result of visiting this expression
     */
    <T> T accept(ExpressionVisitor<T> visitor);

    /**
     * @return The direct operands of this node, left to right
     */
    List<Expression> children();

    /**
     * @return true if no {@link Variable} is reachable from this node
     */
    default boolean isConstant() {
        for (Expression child : children()) {
            if (!child.isConstant()) {
                return false;
            }
        }
        return true;
    }

    // ==================== Operations ====================

    /**
     * Evaluates this expression. Each variable is resolved through the bindings,
     * and the bound expression is itself evaluated against the same bindings.
     */
    default double compute(Map<Character, Expression> bindings) {
        return new Evaluator(bindings).evaluate(this);
    }

    default double compute(double x) {
        return compute(Constant.of(x));
    }

    default double compute(Expression x) {
        return compute(Map.of(Variable.DEFAULT_SYMBOL, x));
    }

    default double compute() {
        return compute(Map.of());
    }

    /**
     * Returns the simplified derivative with respect to the given symbol.
     */
    default Expression differentiate(char symbol) {
        return Simplifier.DEFAULT.simplify(new Differentiator(symbol).differentiate(this));
    }

    default Expression simplify() {
        return Simplifier.DEFAULT.simplify(this);
    }

    // ==================== Construction ====================

    default Expression plus(Expression other) {
        return new Add(this, other);
    }

    default Expression plus(double other) {
        return plus(Constant.of(other));
    }

    default Expression minus(Expression other) {
        return new Subtract(this, other);
    }

    default Expression minus(double other) {
        return minus(Constant.of(other));
    }

    default Expression multiply(Expression other) {
        return new Multiply(this, other);
    }

    default Expression multiply(double other) {
        return multiply(Constant.of(other));
    }

    default Expression divide(Expression other) {
        return new Divide(this, other);
    }

    default Expression divide(double other) {
        return divide(Constant.of(other));
    }

    default Expression pow(Expression exponent) {
        return new Power(this, exponent);
    }

    default Expression pow(double exponent) {
        return pow(Constant.of(exponent));
    }

    default Expression log(Expression base) {
        return new Log(this, base);
    }

    default Expression log(double base) {
        return log(Constant.of(base));
    }

    /**
     * Negation is expressed as multiplication by -1.
     */
    default Expression negate() {
        return new Multiply(Constant.MINUS_ONE, this);
    }

    default Expression ln() {
        return new Ln(this);
    }

    default Expression ld() {
        return new Ld(this);
    }

    default Expression exp() {
        return new Exp(this);
    }

    default Expression sqrt() {
        return new Sqrt(this);
    }

    default Expression cbrt() {
        return new Cbrt(this);
    }

    default Expression nthRoot(int degree) {
        return new NthRoot(this, degree);
    }

    default Expression sin() {
        return new Sin(this);
    }

    default Expression asin() {
        return new Asin(this);
    }

    default Expression cos() {
        return new Cos(this);
    }

    default Expression acos() {
        return new Acos(this);
    }

    default Expression tan() {
        return new Tan(this);
    }

    default Expression atan() {
        return new Atan(this);
    }

    default Expression toRadians() {
        return new ToRadians(this);
    }

    default Expression toDegrees() {
        return new ToDegrees(this);
    }
}
