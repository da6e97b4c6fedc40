package org.finos.legend.calculus.expr;

import java.util.List;

/**
 * A function applied to a single operand: ln(v), sin(v), root3(v), ...
 */
public sealed interface UnaryExpression extends Expression
        permits Ln, Ld, Exp, Sqrt, Cbrt, NthRoot, Sin, Asin, Cos, Acos, Tan, Atan, ToRadians, ToDegrees {

    Expression operand();

    /**
     * @return The same function applied to a different operand
     */
    UnaryExpression withOperand(Expression operand);

    @Override
    default List<Expression> children() {
        return List.of(operand());
    }
}
