package org.finos.legend.calculus.expr;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.finos.legend.calculus.expr.Expressions.constant;
import static org.finos.legend.calculus.expr.Expressions.variable;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the expression node model: construction contracts, cached
 * constants and the fluent builder.
 */
class ExpressionModelTest {

    private final Variable x = variable('x');

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("Constant rejects NaN and infinity")
        void testConstantRejectsNonFinite() {
            assertThrows(IllegalArgumentException.class, () -> new Constant(Double.NaN));
            assertThrows(IllegalArgumentException.class, () -> new Constant(Double.POSITIVE_INFINITY));
            assertThrows(IllegalArgumentException.class, () -> constant(Double.NEGATIVE_INFINITY));
        }

        @Test
        @DisplayName("NthRoot rejects degree below 2")
        void testNthRootDegree() {
            assertThrows(IllegalArgumentException.class, () -> x.nthRoot(1));
            assertThrows(IllegalArgumentException.class, () -> new NthRoot(x, -3));
            assertEquals(2, new NthRoot(x, 2).degree());
        }

        @Test
        @DisplayName("Null operands are rejected")
        void testNullOperands() {
            assertThrows(NullPointerException.class, () -> new Add(null, x));
            assertThrows(NullPointerException.class, () -> new Power(x, null));
            assertThrows(NullPointerException.class, () -> new Sin(null));
        }
    }

    @Nested
    @DisplayName("Cached constants")
    class CachedConstantTests {

        @Test
        void testOfReturnsCachedInstances() {
            assertSame(Constant.ZERO, Constant.of(0));
            assertSame(Constant.ZERO, Constant.of(-0.0));
            assertSame(Constant.ONE, Constant.of(1));
            assertSame(Constant.TWO, Constant.of(2.0));
            assertSame(Constant.THREE, Constant.of(3));
            assertSame(Constant.MINUS_ONE, Constant.of(-1));
            assertSame(Constant.E, Constant.of(Math.E));
            assertSame(Constant.PI, Constant.of(Math.PI));
        }

        @Test
        void testUncachedValuesAreOrdinaryConstants() {
            Constant c = Constant.of(4.5);
            assertEquals(new Constant(4.5), c);
            assertFalse(c.isInteger());
            assertTrue(Constant.of(7).isInteger());
        }

        @Test
        void testLnTwoIsShared() {
            assertSame(Constant.lnTwo(), Constant.lnTwo());
            assertEquals(Math.log(2), Constant.lnTwo().value());
        }
    }

    @Nested
    @DisplayName("Fluent builder")
    class BuilderTests {

        @Test
        void testArithmeticShapes() {
            assertEquals(new Add(x, Constant.of(2)), x.plus(2));
            assertEquals(new Subtract(x, Constant.ONE), x.minus(1));
            assertEquals(new Multiply(x, Constant.of(5)), x.multiply(5));
            assertEquals(new Divide(x, x), x.divide(x));
            assertEquals(new Power(x, Constant.THREE), x.pow(3));
            assertEquals(new Log(x, Constant.TWO), x.log(2));
        }

        @Test
        void testNegationIsMultiplicationByMinusOne() {
            assertEquals(new Multiply(Constant.MINUS_ONE, x), x.negate());
        }

        @Test
        void testFunctionShapes() {
            assertEquals(new Ln(x), x.ln());
            assertEquals(new Ld(x), x.ld());
            assertEquals(new Exp(x), x.exp());
            assertEquals(new Sqrt(x), x.sqrt());
            assertEquals(new Cbrt(x), x.cbrt());
            assertEquals(new NthRoot(x, 4), x.nthRoot(4));
            assertEquals(new Sin(x), x.sin());
            assertEquals(new Asin(x), x.asin());
            assertEquals(new Cos(x), x.cos());
            assertEquals(new Acos(x), x.acos());
            assertEquals(new Tan(x), x.tan());
            assertEquals(new Atan(x), x.atan());
            assertEquals(new ToRadians(x), x.toRadians());
            assertEquals(new ToDegrees(x), x.toDegrees());
        }

        @Test
        void testWithOperandKeepsFunction() {
            assertEquals(new NthRoot(Constant.TWO, 5), new NthRoot(x, 5).withOperand(Constant.TWO));
            assertEquals(new Tan(Constant.ONE), new Tan(x).withOperand(Constant.ONE));
        }
    }

    @Test
    @DisplayName("isConstant is true iff no variable is reachable")
    void testIsConstant() {
        assertTrue(constant(5).isConstant());
        assertTrue(constant(5).plus(7).sin().multiply(2).ln().isConstant());
        assertFalse(x.isConstant());
        assertFalse(constant(5).plus(x.cos()).isConstant());
        assertFalse(new NthRoot(x, 3).isConstant());
    }

    @Test
    void testChildren() {
        Expression sum = x.plus(1);
        assertEquals(List.of(x, Constant.ONE), sum.children());
        assertEquals(List.of(x), x.sin().children());
        assertTrue(x.children().isEmpty());
        assertTrue(constant(1).children().isEmpty());
    }

    @Test
    @DisplayName("simplify and differentiate leave the input tree unchanged")
    void testOperationsDoNotMutate() {
        Expression original = x.plus(0).multiply(x.pow(2));
        Expression copy = new Multiply(new Add(x, Constant.ZERO), new Power(x, Constant.TWO));

        original.simplify();
        original.differentiate('x');

        assertEquals(copy, original);
    }
}
