package org.tensorlatex.symbolic;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders expressions in a compact infix notation close to what computer-algebra systems print,
 * e.g. {@code (1 + x/n)**n} or {@code hUD00 + hUD11}.
 */
public final class ExprPrinter {

    private ExprPrinter() {
    }

    public static String print(Expr expr) {
        if (expr instanceof Rational r) {
            return r.isInteger() ? r.numerator().toString() : r.numerator() + "/" + r.denominator();
        }
        if (expr instanceof Decimal d) {
            return Double.toString(d.value());
        }
        if (expr instanceof Symbol s) {
            return s.name();
        }
        if (expr instanceof Constant c) {
            return c.toString();
        }
        if (expr instanceof Sum sum) {
            return printSum(sum);
        }
        if (expr instanceof Product product) {
            return printProduct(product);
        }
        if (expr instanceof Power power) {
            return printPower(power);
        }
        if (expr instanceof FunctionCall call) {
            return call.function().display() + "(" + print(call.argument()) + ")";
        }
        if (expr instanceof Derivative derivative) {
            List<String> variables = new ArrayList<>();
            derivative.coordinates().forEach(c -> variables.add(c.name()));
            derivative.indices().forEach(i -> variables.add(i.toString()));
            return "Derivative(" + print(derivative.operand()) + ", " + String.join(", ", variables) + ")";
        }
        TensorRef ref = (TensorRef) expr;
        return ref.name() + ref.indices().stream().map(i -> "[" + i + "]").collect(Collectors.joining());
    }

    private static String printSum(Sum sum) {
        StringBuilder sb = new StringBuilder(print(sum.terms().get(0)));
        for (Expr term : sum.terms().subList(1, sum.terms().size())) {
            if (Expressions.coefficientOf(term).signum() < 0) {
                sb.append(" - ").append(print(Expressions.negate(term)));
            } else {
                sb.append(" + ").append(print(term));
            }
        }
        return sb.toString();
    }

    private static String printProduct(Product product) {
        Numeric coefficient = Expressions.coefficientOf(product);
        List<String> numerator = new ArrayList<>();
        List<String> denominator = new ArrayList<>();
        if (coefficient instanceof Rational r && !r.isInteger()) {
            if (!r.numerator().abs().equals(java.math.BigInteger.ONE)) {
                numerator.add(r.numerator().abs().toString());
            }
            denominator.add(r.denominator().toString());
        } else if (!coefficient.isOne() && !coefficient.equals(Rational.MINUS_ONE)) {
            numerator.add(print(coefficient.signum() < 0 ? coefficient.negate() : coefficient));
        }
        for (Expr factor : product.factors()) {
            if (factor instanceof Numeric) {
                continue;
            }
            if (factor instanceof Power power && power.exponent() instanceof Numeric e && e.signum() < 0) {
                denominator.add(wrapFactor(Expressions.power(power.base(), e.negate())));
            } else {
                numerator.add(wrapFactor(factor));
            }
        }
        String sign = coefficient.signum() < 0 ? "-" : "";
        String top = numerator.isEmpty() ? "1" : String.join("*", numerator);
        if (denominator.isEmpty()) {
            return sign + top;
        }
        String bottom = denominator.size() == 1 ? denominator.get(0) : "(" + String.join("*", denominator) + ")";
        return sign + top + "/" + bottom;
    }

    private static String printPower(Power power) {
        if (power.exponent() instanceof Rational r) {
            if (r.equals(Rational.MINUS_ONE)) {
                return "1/" + wrap(power.base());
            }
            if (r.equals(Rational.HALF)) {
                return "sqrt(" + print(power.base()) + ")";
            }
        }
        return wrap(power.base()) + "**" + wrap(power.exponent());
    }

    private static String wrapFactor(Expr expr) {
        return expr instanceof Sum ? "(" + print(expr) + ")" : print(expr);
    }

    private static String wrap(Expr expr) {
        boolean compound = expr instanceof Sum || expr instanceof Product || expr instanceof Power
                || (expr instanceof Rational r && (!r.isInteger() || r.signum() < 0))
                || (expr instanceof Decimal d && d.value() < 0);
        return compound ? "(" + print(expr) + ")" : print(expr);
    }
}
