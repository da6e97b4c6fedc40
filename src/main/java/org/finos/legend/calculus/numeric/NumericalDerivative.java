package org.finos.legend.calculus.numeric;

import org.finos.legend.calculus.eval.Evaluator;
import org.finos.legend.calculus.expr.Constant;
import org.finos.legend.calculus.expr.Expression;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Approximates first derivatives of expressions with finite differences.
 * Useful to cross-check symbolic derivatives at sample points.
 */
public final class NumericalDerivative {

    public static final double DEFAULT_STEP = 1e-5;

    private final double defaultStep;

    public NumericalDerivative() {
        this(DEFAULT_STEP);
    }

    /**
     * @param defaultStep step size used when none is specified for a call
     */
    public NumericalDerivative(double defaultStep) {
        if (defaultStep <= 0.0) {
            throw new IllegalArgumentException("Step size must be positive");
        }
        this.defaultStep = defaultStep;
    }

    public double forwardDifference(Expression expression, char symbol, double point) {
        return forwardDifference(expression, symbol, point, defaultStep);
    }

    public double centralDifference(Expression expression, char symbol, double point) {
        return centralDifference(expression, symbol, point, defaultStep);
    }

    public double forwardDifference(Expression expression, char symbol, double point, double step) {
        validate(expression, step);
        double fx = evaluateAt(expression, symbol, point);
        double fxStep = evaluateAt(expression, symbol, point + step);
        return (fxStep - fx) / step;
    }

    public double centralDifference(Expression expression, char symbol, double point, double step) {
        validate(expression, step);
        double fxForward = evaluateAt(expression, symbol, point + step);
        double fxBackward = evaluateAt(expression, symbol, point - step);
        return (fxForward - fxBackward) / (2.0 * step);
    }

    private static double evaluateAt(Expression expression, char symbol, double point) {
        Map<Character, Expression> bindings = new HashMap<>();
        bindings.put(symbol, Constant.of(point));
        return new Evaluator(bindings).evaluate(expression);
    }

    private static void validate(Expression expression, double step) {
        Objects.requireNonNull(expression, "Expression cannot be null");
        if (step <= 0.0) {
            throw new IllegalArgumentException("Step size must be positive");
        }
    }
}
