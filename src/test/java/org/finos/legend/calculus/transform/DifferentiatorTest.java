package org.finos.legend.calculus.transform;

import org.finos.legend.calculus.expr.*;
import org.finos.legend.calculus.numeric.NumericalDerivative;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.finos.legend.calculus.expr.Expressions.constant;
import static org.finos.legend.calculus.expr.Expressions.variable;
import static org.junit.jupiter.api.Assertions.*;

class DifferentiatorTest {

    private static final Variable X = variable('x');
    private static final Variable Y = variable('y');

    @Nested
    @DisplayName("Simplified symbolic results")
    class SymbolicTests {

        @Test
        void testSimpleDifferentiation() {
            assertEquals("5", X.multiply(5).differentiate('x').toString());
            assertEquals("1", X.differentiate('x').toString());
            assertEquals("5.5", X.multiply(5.5).differentiate('x').toString());
            assertEquals(Constant.of(5), X.multiply(5).differentiate('x'));
        }

        @Test
        void testConstantsAndForeignSymbols() {
            assertEquals(Constant.ZERO, constant(7).differentiate('x'));
            assertEquals(Constant.ZERO, Y.differentiate('x'));
            assertEquals(Constant.ONE, Y.differentiate('y'));
            assertEquals(Constant.ZERO, constant(2).plus(3).sin().differentiate('x'));
        }

        @Test
        void testPowerRule() {
            assertEquals("3x^2", X.pow(3).differentiate('x').toString());
            assertEquals("2x", X.pow(2).differentiate('x').toString());
        }

        @Test
        void testSumAndDifference() {
            assertEquals("1 + 2x", X.pow(2).plus(X).differentiate('x').toString());
            assertEquals(new Subtract(new Multiply(Constant.TWO, X), Constant.ONE),
                    X.pow(2).minus(X).differentiate('x'));
        }

        @Test
        void testElementaryFunctions() {
            assertEquals("cos(x)", X.sin().differentiate('x').toString());
            assertEquals("-sin(x)", X.cos().differentiate('x').toString());
            assertEquals("exp(x)", X.exp().differentiate('x').toString());
            assertEquals("1 / x", X.ln().differentiate('x').toString());
        }

        @Test
        void testProductRule() {
            assertEquals("sin(x) + x * cos(x)", X.multiply(X.sin()).differentiate('x').toString());
        }

        @Test
        void testOtherSymbolsAreConstants() {
            assertEquals(Y, X.multiply(Y).differentiate('x'));
            assertEquals(X, X.multiply(Y).differentiate('y'));
        }
    }

    @Nested
    @DisplayName("Raw derivative trees")
    class RawTreeTests {

        private final Differentiator d = new Differentiator('x');

        @Test
        void testProductRuleShape() {
            Expression a = X.sin();
            Expression b = X.cos();
            Expression expected = new Add(
                    new Multiply(new Multiply(new Cos(X), Constant.ONE), b),
                    new Multiply(a, new Multiply(new Multiply(Constant.MINUS_ONE, new Sin(X)), Constant.ONE)));
            assertEquals(expected, d.differentiate(a.multiply(b)));
        }

        @Test
        void testQuotientRuleShape() {
            Expression expected = new Divide(
                    new Subtract(new Multiply(Constant.ONE, X), new Multiply(X, Constant.ONE)),
                    new Power(X, Constant.TWO));
            assertEquals(expected, d.differentiate(X.divide(X)));
        }

        @Test
        @DisplayName("Power rule, exponential rule and logarithmic differentiation")
        void testPowerCaseSelection() {
            assertEquals(new Multiply(
                            new Multiply(Constant.THREE, new Power(X, new Subtract(Constant.THREE, Constant.ONE))),
                            Constant.ONE),
                    d.differentiate(X.pow(3)));

            Expression exponential = Constant.TWO.pow(X);
            assertEquals(new Multiply(new Multiply(exponential, new Ln(Constant.TWO)), Constant.ONE),
                    d.differentiate(exponential));

            Expression both = X.pow(X);
            assertEquals(new Multiply(both, new Add(
                            new Multiply(Constant.ONE, new Ln(X)),
                            new Divide(new Multiply(X, Constant.ONE), X))),
                    d.differentiate(both));
        }

        @Test
        void testNthRootShape() {
            Expression root = X.nthRoot(4);
            assertEquals(new Divide(Constant.ONE,
                            new Multiply(Constant.of(4), new Power(root, Constant.THREE))),
                    d.differentiate(root));
        }

        @Test
        void testDependsOn() {
            assertTrue(d.dependsOn(X.sin().plus(1)));
            assertFalse(d.dependsOn(Y.sin().plus(1)));
            assertFalse(d.dependsOn(constant(3)));
        }

        @Test
        void testAngleConversionIsRewrapped() {
            assertEquals(new ToRadians(Constant.ONE), d.differentiate(X.toRadians()));
            assertEquals(new ToDegrees(Constant.ONE), d.differentiate(X.toDegrees()));
        }
    }

    static Stream<Arguments> smoothFunctions() {
        return Stream.of(
                Arguments.of(X.pow(3).plus(X.multiply(2)), 0.7),
                Arguments.of(X.sin().multiply(X), 1.9),
                Arguments.of(X.sin().divide(X), 0.7),
                Arguments.of(constant(2).pow(X), 1.9),
                Arguments.of(X.pow(X), 0.7),
                Arguments.of(X.pow(X.sin()), 1.9),
                Arguments.of(X.ln(), 0.7),
                Arguments.of(X.log(3), 1.9),
                Arguments.of(X.pow(2).plus(1).log(10), 0.7),
                Arguments.of(X.ld(), 1.9),
                Arguments.of(X.exp().multiply(X.cos()), 0.7),
                Arguments.of(X.sqrt(), 1.9),
                Arguments.of(X.pow(2).plus(1).cbrt(), 0.7),
                Arguments.of(X.nthRoot(4), 1.9),
                Arguments.of(X.pow(2).plus(3).nthRoot(5), 0.7),
                Arguments.of(X.tan(), 0.7),
                Arguments.of(X.multiply(0.3).asin(), 1.9),
                Arguments.of(X.multiply(0.3).acos(), 1.9),
                Arguments.of(X.atan(), 0.7),
                Arguments.of(X.pow(2).plus(1).ln(), 1.9),
                Arguments.of(X.toRadians().sin(), 30.0),
                Arguments.of(X.toDegrees(), 0.7),
                Arguments.of(X.multiply(X.minus(1)).divide(X.plus(2)), 1.9),
                Arguments.of(X.ln().multiply(3).exp(), 0.7)
        );
    }

    @ParameterizedTest
    @MethodSource("smoothFunctions")
    @DisplayName("Symbolic derivative agrees with a central finite difference")
    void testNumericalCrossCheck(Expression function, double point) {
        NumericalDerivative numerical = new NumericalDerivative(1e-5);
        double expected = numerical.centralDifference(function, 'x', point);
        double actual = function.differentiate('x').compute(point);
        assertEquals(expected, actual, 1e-6 * Math.max(1.0, Math.abs(expected)),
                () -> "d/dx " + function + " = " + function.differentiate('x'));
    }
}
