package org.finos.legend.calculus.eval;

import org.finos.legend.calculus.expr.*;

import java.util.Map;
import java.util.Objects;

/**
 * Evaluates an expression tree to a double.
 *
 * Variables are looked up in the bindings; the bound expression is evaluated
 * recursively against the same bindings, so a binding may itself be symbolic.
 */
public final class Evaluator implements ExpressionVisitor<Double> {

    private final Map<Character, Expression> bindings;

    public Evaluator(Map<Character, Expression> bindings) {
        this.bindings = Map.copyOf(Objects.requireNonNull(bindings, "Bindings cannot be null"));
    }

    /**
     * @return An evaluator without bindings, for variable-free expressions
     */
    public static Evaluator empty() {
        return new Evaluator(Map.of());
    }

    public double evaluate(Expression expression) {
        return expression.accept(this);
    }

    // ==================== Leaves ====================

    @Override
    public Double visit(Constant constant) {
        return constant.value();
    }

    @Override
    public Double visit(Variable variable) {
        Expression bound = bindings.get(variable.symbol());
        if (bound == null) {
            throw new UnboundVariableException(variable.symbol());
        }
        return bound.accept(this);
    }

    // ==================== Binary ====================

    @Override
    public Double visit(Add add) {
        return evaluate(add.left()) + evaluate(add.right());
    }

    @Override
    public Double visit(Subtract subtract) {
        return evaluate(subtract.left()) - evaluate(subtract.right());
    }

    @Override
    public Double visit(Multiply multiply) {
        return evaluate(multiply.left()) * evaluate(multiply.right());
    }

    @Override
    public Double visit(Divide divide) {
        double divisor = evaluate(divide.right());
        if (divisor == 0.0) {
            throw new DivisionByZeroException("Division by zero in " + divide);
        }
        return evaluate(divide.left()) / divisor;
    }

    @Override
    public Double visit(Power power) {
        return Math.pow(evaluate(power.base()), evaluate(power.exponent()));
    }

    @Override
    public Double visit(Log log) {
        return Math.log(evaluate(log.value())) / Math.log(evaluate(log.base()));
    }

    // ==================== Unary ====================

    @Override
    public Double visit(Ln ln) {
        return Math.log(evaluate(ln.operand()));
    }

    @Override
    public Double visit(Ld ld) {
        return Math.log(evaluate(ld.operand())) / Constant.lnTwo().value();
    }

    @Override
    public Double visit(Exp exp) {
        return Math.exp(evaluate(exp.operand()));
    }

    @Override
    public Double visit(Sqrt sqrt) {
        return Math.sqrt(evaluate(sqrt.operand()));
    }

    @Override
    public Double visit(Cbrt cbrt) {
        return Math.cbrt(evaluate(cbrt.operand()));
    }

    @Override
    public Double visit(NthRoot root) {
        return RootSolver.nthRoot(evaluate(root.operand()), root.degree());
    }

    @Override
    public Double visit(Sin sin) {
        return Math.sin(evaluate(sin.operand()));
    }

    @Override
    public Double visit(Asin asin) {
        return Math.asin(evaluate(asin.operand()));
    }

    @Override
    public Double visit(Cos cos) {
        return Math.cos(evaluate(cos.operand()));
    }

    @Override
    public Double visit(Acos acos) {
        return Math.acos(evaluate(acos.operand()));
    }

    @Override
    public Double visit(Tan tan) {
        return Math.tan(evaluate(tan.operand()));
    }

    @Override
    public Double visit(Atan atan) {
        return Math.atan(evaluate(atan.operand()));
    }

    @Override
    public Double visit(ToRadians toRadians) {
        return Math.toRadians(evaluate(toRadians.operand()));
    }

    @Override
    public Double visit(ToDegrees toDegrees) {
        return Math.toDegrees(evaluate(toDegrees.operand()));
    }
}
