package org.tensorlatex.symbolic;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies the differentiation rules for sums, products, powers and elementary functions.
 * Subclasses decide what the derivative of an atom (symbol, tensor reference, ...) is,
 * which lets the same rules serve coordinate derivatives and derivative tensors.
 */
public abstract class Differentiator {

    /**
     * Differentiates an expression.
     * @param expr The expression.
     * @return The derivative in canonical form.
     */
    public Expr differentiate(Expr expr) {
        if (expr instanceof Numeric || expr instanceof Constant) {
            return Rational.ZERO;
        }
        if (expr instanceof Sum sum) {
            List<Expr> terms = new ArrayList<>(sum.terms().size());
            for (Expr term : sum.terms()) {
                terms.add(differentiate(term));
            }
            return Expressions.add(terms);
        }
        if (expr instanceof Product product) {
            return differentiateProduct(product.factors());
        }
        if (expr instanceof Power power) {
            return differentiatePower(power);
        }
        if (expr instanceof FunctionCall call) {
            Expr inner = differentiate(call.argument());
            if (inner.isZero()) {
                return Rational.ZERO;
            }
            return Expressions.multiply(outerDerivative(call.function(), call.argument()), inner);
        }
        return differentiateAtom(expr);
    }

    /**
     * Returns the derivative of an expression that has no differentiation rule of its own.
     * @param atom A {@link Symbol}, {@link TensorRef} or {@link Derivative}.
     * @return Its derivative.
     */
    protected abstract Expr differentiateAtom(Expr atom);

    private Expr differentiateProduct(List<Expr> factors) {
        List<Expr> terms = new ArrayList<>();
        for (int i = 0; i < factors.size(); i++) {
            Expr derivative = differentiate(factors.get(i));
            if (derivative.isZero()) {
                continue;
            }
            List<Expr> term = new ArrayList<>(factors);
            term.set(i, derivative);
            terms.add(Expressions.multiply(term));
        }
        return Expressions.add(terms);
    }

    private Expr differentiatePower(Power power) {
        Expr base = power.base();
        Expr exponent = power.exponent();
        Expr baseDerivative = differentiate(base);
        Expr exponentDerivative = differentiate(exponent);
        if (exponentDerivative.isZero()) {
            if (baseDerivative.isZero()) {
                return Rational.ZERO;
            }
            return Expressions.multiply(exponent,
                    Expressions.power(base, Expressions.subtract(exponent, Rational.ONE)), baseDerivative);
        }
        // d(b^e) = b^e * (e' ln b + e b'/b)
        Expr logarithmic = Expressions.multiply(exponentDerivative, Expressions.function(FunctionName.LOG, base));
        Expr polynomial = Expressions.multiply(exponent, baseDerivative, Expressions.power(base, Rational.MINUS_ONE));
        return Expressions.multiply(power, Expressions.add(logarithmic, polynomial));
    }

    private static Expr outerDerivative(FunctionName function, Expr x) {
        Expr xSquared = Expressions.power(x, 2);
        return switch (function) {
            case SIN -> Expressions.function(FunctionName.COS, x);
            case COS -> Expressions.negate(Expressions.function(FunctionName.SIN, x));
            case TAN -> Expressions.power(Expressions.function(FunctionName.COS, x), -2);
            case SINH -> Expressions.function(FunctionName.COSH, x);
            case COSH -> Expressions.function(FunctionName.SINH, x);
            case TANH -> Expressions.subtract(Rational.ONE,
                    Expressions.power(Expressions.function(FunctionName.TANH, x), 2));
            case ASIN -> Expressions.power(Expressions.subtract(Rational.ONE, xSquared), Rational.of(-1, 2));
            case ACOS -> Expressions.negate(
                    Expressions.power(Expressions.subtract(Rational.ONE, xSquared), Rational.of(-1, 2)));
            case ATAN -> Expressions.power(Expressions.add(Rational.ONE, xSquared), -1);
            case ASINH -> Expressions.power(Expressions.add(xSquared, Rational.ONE), Rational.of(-1, 2));
            case ACOSH -> Expressions.power(Expressions.subtract(xSquared, Rational.ONE), Rational.of(-1, 2));
            case ATANH -> Expressions.power(Expressions.subtract(Rational.ONE, xSquared), -1);
            case LOG -> Expressions.power(x, -1);
            case EXP -> Expressions.function(FunctionName.EXP, x);
        };
    }
}
