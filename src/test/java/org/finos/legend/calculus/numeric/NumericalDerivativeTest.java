package org.finos.legend.calculus.numeric;

import org.finos.legend.calculus.eval.UnboundVariableException;
import org.finos.legend.calculus.expr.Expression;
import org.finos.legend.calculus.expr.Variable;
import org.junit.jupiter.api.Test;

import static org.finos.legend.calculus.expr.Expressions.variable;
import static org.junit.jupiter.api.Assertions.*;

class NumericalDerivativeTest {

    private static final Variable X = variable('x');

    private final NumericalDerivative derivative = new NumericalDerivative();

    @Test
    void testCentralDifference() {
        assertEquals(6.0, derivative.centralDifference(X.pow(2), 'x', 3.0), 1e-8);
        assertEquals(Math.cos(0.4), derivative.centralDifference(X.sin(), 'x', 0.4), 1e-8);
    }

    @Test
    void testForwardDifference() {
        // Truncation error is first order in the step
        assertEquals(6.0, derivative.forwardDifference(X.pow(2), 'x', 3.0), 1e-4);
        assertEquals(1.0, derivative.forwardDifference(X.exp(), 'x', 0.0, 1e-7), 1e-6);
    }

    @Test
    void testOtherSymbolsMustBeBound() {
        Expression expression = X.multiply(variable('y'));
        assertThrows(UnboundVariableException.class, () -> derivative.centralDifference(expression, 'x', 1.0));
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new NumericalDerivative(0.0));
        assertThrows(IllegalArgumentException.class, () -> derivative.centralDifference(X, 'x', 1.0, -1e-3));
        assertThrows(NullPointerException.class, () -> derivative.forwardDifference(null, 'x', 1.0));
    }
}
