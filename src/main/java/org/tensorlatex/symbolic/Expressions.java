package org.tensorlatex.symbolic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Factory for canonical expressions.
 * <p>
 * All arithmetic goes through this class so that:
 * <ul>
 *     <li>nested sums and products are flattened,</li>
 *     <li>numeric parts are folded into one constant or coefficient,</li>
 *     <li>like terms are collected ({@code x + x -> 2*x}) and equal bases are merged ({@code x*x -> x**2}),</li>
 *     <li>terms and factors appear in a fixed order given by {@link ExprOrder}.</li>
 * </ul>
 * The result is a structural normal form, which keeps equality checks cheap and deterministic.
 */
public final class Expressions {

    private Expressions() {
    }

    public static Symbol symbol(String name) {
        return new Symbol(name);
    }

    public static Expr add(Expr... terms) {
        return add(Arrays.asList(terms));
    }

    /**
     * Builds a canonical sum.
     * @param terms The summands.
     * @return The canonical sum, a single term, or zero.
     */
    public static Expr add(List<? extends Expr> terms) {
        Numeric constant = Rational.ZERO;
        Map<Expr, Numeric> coefficients = new LinkedHashMap<>();
        Deque<Expr> pending = new ArrayDeque<>(terms);
        while (!pending.isEmpty()) {
            Expr term = pending.poll();
            if (term instanceof Sum sum) {
                sum.terms().forEach(pending::addLast);
            } else if (term instanceof Numeric n) {
                constant = constant.add(n);
            } else {
                coefficients.merge(withoutCoefficient(term), coefficientOf(term), Numeric::add);
            }
        }

        List<Expr> result = new ArrayList<>();
        for (Map.Entry<Expr, Numeric> entry : coefficients.entrySet()) {
            if (entry.getValue().signum() != 0) {
                result.add(scaled(entry.getValue(), entry.getKey()));
            }
        }
        result.sort(ExprOrder.INSTANCE);
        if (constant.signum() != 0) {
            result.add(0, constant);
        }
        if (result.isEmpty()) {
            return Rational.ZERO;
        }
        return result.size() == 1 ? result.get(0) : new Sum(result);
    }

    public static Expr subtract(Expr minuend, Expr subtrahend) {
        return add(minuend, negate(subtrahend));
    }

    public static Expr negate(Expr expr) {
        return multiply(Rational.MINUS_ONE, expr);
    }

    public static Expr multiply(Expr... factors) {
        return multiply(Arrays.asList(factors));
    }

    /**
     * Builds a canonical product.
     * @param factors The factors.
     * @return The canonical product, a single factor, or a number.
     */
    public static Expr multiply(List<? extends Expr> factors) {
        Numeric coefficient = Rational.ONE;
        Map<Expr, Expr> exponents = new LinkedHashMap<>();
        Deque<Expr> pending = new ArrayDeque<>(factors);
        while (!pending.isEmpty()) {
            Expr factor = pending.poll();
            if (factor instanceof Product product) {
                product.factors().forEach(pending::addLast);
            } else if (factor instanceof Numeric n) {
                coefficient = coefficient.multiply(n);
            } else if (factor instanceof Power power) {
                exponents.merge(power.base(), power.exponent(), Expressions::add);
            } else {
                exponents.merge(factor, Rational.ONE, Expressions::add);
            }
        }
        if (coefficient.signum() == 0) {
            return Rational.ZERO;
        }

        List<Expr> result = new ArrayList<>();
        for (Map.Entry<Expr, Expr> entry : exponents.entrySet()) {
            Expr combined = power(entry.getKey(), entry.getValue());
            if (combined instanceof Numeric n) {
                coefficient = coefficient.multiply(n);
            } else if (combined instanceof Product product) {
                for (Expr inner : product.factors()) {
                    if (inner instanceof Numeric n) {
                        coefficient = coefficient.multiply(n);
                    } else {
                        result.add(inner);
                    }
                }
            } else {
                result.add(combined);
            }
        }
        if (coefficient.signum() == 0) {
            return Rational.ZERO;
        }
        result.sort(ExprOrder.INSTANCE);
        if (!coefficient.isOne()) {
            result.add(0, coefficient);
        }
        if (result.isEmpty()) {
            return coefficient;
        }
        return result.size() == 1 ? result.get(0) : new Product(result);
    }

    public static Expr divide(Expr numerator, Expr denominator) {
        return multiply(numerator, power(denominator, Rational.MINUS_ONE));
    }

    /**
     * Builds a canonical power.
     * @param base     The base.
     * @param exponent The exponent.
     * @return The simplified power.
     */
    public static Expr power(Expr base, Expr exponent) {
        if (exponent instanceof Numeric e) {
            if (e.signum() == 0) {
                return Rational.ONE;
            }
            if (e.isOne()) {
                return base;
            }
        }
        if (base instanceof Numeric b) {
            if (b.isOne()) {
                return Rational.ONE;
            }
            if (exponent instanceof Numeric e) {
                Optional<Numeric> exact = b.pow(e);
                if (exact.isPresent()) {
                    return exact.get();
                }
            }
            return new Power(base, exponent);
        }
        if (exponent instanceof Rational r && r.isInteger()) {
            if (base instanceof Power inner) {
                return power(inner.base(), multiply(inner.exponent(), r));
            }
            if (base instanceof Product product && !hasIndexLabels(product)) {
                List<Expr> powered = new ArrayList<>(product.factors().size());
                for (Expr factor : product.factors()) {
                    powered.add(power(factor, r));
                }
                return multiply(powered);
            }
        }
        return new Power(base, exponent);
    }

    public static Expr power(Expr base, long exponent) {
        return power(base, Rational.of(exponent));
    }

    public static Expr sqrt(Expr radicand) {
        return power(radicand, Rational.HALF);
    }

    /**
     * Applies an elementary function, evaluating it for a few exact arguments and for decimals.
     * @param function The function.
     * @param argument The argument.
     * @return The application or its value.
     */
    public static Expr function(FunctionName function, Expr argument) {
        if (argument.isZero()) {
            switch (function) {
                case COS, COSH, EXP:
                    return Rational.ONE;
                case LOG, ACOS, ACOSH:
                    break;
                default:
                    return Rational.ZERO;
            }
        }
        if (function == FunctionName.LOG) {
            if (argument instanceof Numeric n && n.isOne()) {
                return Rational.ZERO;
            }
            if (argument == Constant.E) {
                return Rational.ONE;
            }
        }
        if (argument instanceof Decimal d) {
            double value = function.apply(d.value());
            if (!Double.isNaN(value) && !Double.isInfinite(value)) {
                return new Decimal(value);
            }
        }
        return new FunctionCall(function, argument);
    }

    /**
     * Logarithm to an arbitrary base, represented as {@code log(x)/log(b)}.
     * @param argument The argument.
     * @param base     The base.
     * @return The quotient of natural logarithms.
     */
    public static Expr log(Expr argument, Expr base) {
        return divide(function(FunctionName.LOG, argument), function(FunctionName.LOG, base));
    }

    /**
     * Builds a symbolic derivative node, dropping it when the operand is numeric.
     * @param operand     The differentiated expression.
     * @param indices     Derivative index slots.
     * @param coordinates Coordinates differentiated against directly.
     * @return The derivative node or zero.
     */
    public static Expr derivative(Expr operand, List<Index> indices, List<Symbol> coordinates) {
        if (operand instanceof Numeric || operand instanceof Constant) {
            return Rational.ZERO;
        }
        return new Derivative(operand, indices, coordinates);
    }

    /**
     * Returns the numeric coefficient of a term, e.g. {@code 3} for {@code 3*x*y}.
     * @param term The term.
     * @return The coefficient, one if there is none.
     */
    public static Numeric coefficientOf(Expr term) {
        if (term instanceof Numeric n) {
            return n;
        }
        if (term instanceof Product product && product.factors().get(0) instanceof Numeric n) {
            return n;
        }
        return Rational.ONE;
    }

    /**
     * Returns a term without its numeric coefficient, e.g. {@code x*y} for {@code 3*x*y}.
     * @param term The term.
     * @return The term stripped of its coefficient.
     */
    public static Expr withoutCoefficient(Expr term) {
        if (term instanceof Numeric) {
            return Rational.ONE;
        }
        if (term instanceof Product product && product.factors().get(0) instanceof Numeric) {
            List<Expr> rest = product.factors().subList(1, product.factors().size());
            return rest.size() == 1 ? rest.get(0) : new Product(rest);
        }
        return term;
    }

    private static Expr scaled(Numeric coefficient, Expr rest) {
        if (coefficient.isOne()) {
            return rest;
        }
        if (rest instanceof Numeric n) {
            return coefficient.multiply(n);
        }
        List<Expr> factors = new ArrayList<>();
        factors.add(coefficient);
        if (rest instanceof Product product) {
            factors.addAll(product.factors());
        } else {
            factors.add(rest);
        }
        return new Product(factors);
    }

    /**
     * Visits an expression and all of its subexpressions in pre-order.
     * @param expr    The root.
     * @param visitor Called once per node.
     */
    public static void walk(Expr expr, Consumer<Expr> visitor) {
        visitor.accept(expr);
        for (Expr child : children(expr)) {
            walk(child, visitor);
        }
    }

    /**
     * Returns the direct children of a node.
     * @param expr The node.
     * @return The children, empty for leaves.
     */
    public static List<Expr> children(Expr expr) {
        if (expr instanceof Sum sum) {
            return sum.terms();
        }
        if (expr instanceof Product product) {
            return product.factors();
        }
        if (expr instanceof Power power) {
            return List.of(power.base(), power.exponent());
        }
        if (expr instanceof FunctionCall call) {
            return List.of(call.argument());
        }
        if (expr instanceof Derivative derivative) {
            return List.of(derivative.operand());
        }
        return List.of();
    }

    /**
     * Checks whether an expression contains a given symbol.
     * @param expr   The expression.
     * @param symbol The symbol.
     * @return true if the symbol occurs anywhere in the tree.
     */
    public static boolean contains(Expr expr, Symbol symbol) {
        if (expr.equals(symbol)) {
            return true;
        }
        for (Expr child : children(expr)) {
            if (contains(child, symbol)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks whether an expression carries index labels, on a tensor reference or a derivative.
     * Such a factor cannot be split without changing which labels are summed together.
     * @param expr The expression.
     * @return true if any label occurs in the tree.
     */
    public static boolean hasIndexLabels(Expr expr) {
        List<Index> indices = List.of();
        if (expr instanceof TensorRef ref) {
            indices = ref.indices();
        } else if (expr instanceof Derivative derivative) {
            indices = derivative.indices();
        }
        if (indices.stream().anyMatch(Index::isLabel)) {
            return true;
        }
        for (Expr child : children(expr)) {
            if (hasIndexLabels(child)) {
                return true;
            }
        }
        return false;
    }
}
