package org.tensorlatex.symbolic;

/**
 * Differentiates with respect to a single symbol. Every other symbol is treated as a constant.
 */
public class SymbolDifferentiator extends Differentiator {

    private final Symbol variable;

    public SymbolDifferentiator(Symbol variable) {
        this.variable = variable;
    }

    @Override
    protected Expr differentiateAtom(Expr atom) {
        if (atom instanceof Symbol) {
            return atom.equals(variable) ? Rational.ONE : Rational.ZERO;
        }
        throw new IllegalArgumentException("Cannot differentiate unevaluated node " + atom + " with respect to " + variable);
    }

    /**
     * Convenience for {@code new SymbolDifferentiator(variable).differentiate(expr)}.
     * @param expr     The expression.
     * @param variable The variable.
     * @return The derivative.
     */
    public static Expr diff(Expr expr, Symbol variable) {
        return new SymbolDifferentiator(variable).differentiate(expr);
    }
}
