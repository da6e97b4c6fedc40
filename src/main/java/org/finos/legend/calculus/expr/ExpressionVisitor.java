package org.finos.legend.calculus.expr;

/**
 * Visitor interface for traversing Expression trees.
 *
 * There is one method per variant, so every visitor handles the complete
 * node set.
 *
 * @param <T> The return type of the visitor methods
 */
public interface ExpressionVisitor<T> {

    // ==================== Leaves ====================

    T visit(Constant constant);

    T visit(Variable variable);

    // ==================== Binary ====================

    T visit(Add add);

    T visit(Subtract subtract);

    T visit(Multiply multiply);

    T visit(Divide divide);

    T visit(Power power);

    T visit(Log log);

    // ==================== Unary ====================

    T visit(Ln ln);

    T visit(Ld ld);

    T visit(Exp exp);

    T visit(Sqrt sqrt);

    T visit(Cbrt cbrt);

    T visit(NthRoot root);

    T visit(Sin sin);

    T visit(Asin asin);

    T visit(Cos cos);

    T visit(Acos acos);

    T visit(Tan tan);

    T visit(Atan atan);

    T visit(ToRadians toRadians);

    T visit(ToDegrees toDegrees);
}
