package org.tensorlatex.symbolic;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Distributes products over sums, so that every additive term of the result is a product of
 * non-sum factors. Integer powers of sums are multiplied out up to {@link #MAX_EXPANDED_POWER},
 * unless the sum carries index labels: those are summed inside the base before it is raised.
 * Derivatives are linear and are split over the terms of their operand.
 */
public final class Expansion {

    static final int MAX_EXPANDED_POWER = 16;

    private Expansion() {
    }

    public static Expr expand(Expr expr) {
        if (expr instanceof Sum sum) {
            List<Expr> terms = new ArrayList<>(sum.terms().size());
            for (Expr term : sum.terms()) {
                terms.add(expand(term));
            }
            return Expressions.add(terms);
        }
        if (expr instanceof Product product) {
            List<Expr> factors = new ArrayList<>(product.factors().size());
            for (Expr factor : product.factors()) {
                factors.add(expand(factor));
            }
            return distribute(factors);
        }
        if (expr instanceof Power power) {
            Expr base = expand(power.base());
            if (base instanceof Sum && !Expressions.hasIndexLabels(base) && power.exponent() instanceof Rational r
                    && r.isInteger() && r.signum() > 0
                    && r.numerator().compareTo(BigInteger.valueOf(MAX_EXPANDED_POWER)) <= 0) {
                return distribute(Collections.nCopies(r.intValueExact(), base));
            }
            return Expressions.power(base, expand(power.exponent()));
        }
        if (expr instanceof FunctionCall call) {
            return Expressions.function(call.function(), expand(call.argument()));
        }
        if (expr instanceof Derivative derivative) {
            return expandDerivative(derivative);
        }
        return expr;
    }

    private static Expr distribute(List<Expr> factors) {
        List<Expr> terms = List.of(Rational.ONE);
        for (Expr factor : factors) {
            List<Expr> summands = factor instanceof Sum sum ? sum.terms() : List.of(factor);
            List<Expr> next = new ArrayList<>(terms.size() * summands.size());
            for (Expr term : terms) {
                for (Expr summand : summands) {
                    next.add(Expressions.multiply(term, summand));
                }
            }
            terms = next;
        }
        return Expressions.add(terms);
    }

    private static Expr expandDerivative(Derivative derivative) {
        Expr operand = expand(derivative.operand());
        List<Expr> summands = operand instanceof Sum sum ? sum.terms() : List.of(operand);
        List<Expr> terms = new ArrayList<>(summands.size());
        for (Expr summand : summands) {
            Numeric coefficient = Expressions.coefficientOf(summand);
            Expr rest = Expressions.withoutCoefficient(summand);
            terms.add(Expressions.multiply(coefficient,
                    Expressions.derivative(rest, derivative.indices(), derivative.coordinates())));
        }
        return Expressions.add(terms);
    }
}
