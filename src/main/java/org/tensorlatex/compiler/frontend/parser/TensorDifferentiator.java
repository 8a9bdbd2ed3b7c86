package org.tensorlatex.compiler.frontend.parser;

import org.tensorlatex.symbolic.Derivative;
import org.tensorlatex.symbolic.Differentiator;
import org.tensorlatex.symbolic.Expr;
import org.tensorlatex.symbolic.Expressions;
import org.tensorlatex.symbolic.Index;
import org.tensorlatex.symbolic.Rational;
import org.tensorlatex.symbolic.TensorRef;

import java.util.List;

/**
 * Differentiates an expression in {@code _d} mode: every tensor reference {@code T} becomes its
 * derivative tensor {@code T_dD} carrying the derivative index, and the product and chain rules
 * apply as usual. Plain symbols are constants.
 */
final class TensorDifferentiator extends Differentiator {

    private final Index index;

    TensorDifferentiator(Index index) {
        this.index = index;
    }

    /**
     * Differentiates successively with respect to each index.
     * @param expr    The operand.
     * @param indices The derivative indices, innermost first.
     * @return The derivative.
     */
    static Expr differentiate(Expr expr, List<Index> indices) {
        Expr result = expr;
        for (Index index : indices) {
            result = new TensorDifferentiator(index).differentiate(result);
        }
        return result;
    }

    @Override
    protected Expr differentiateAtom(Expr atom) {
        if (atom instanceof TensorRef ref) {
            return TensorParser.partialRef(ref, List.of(index));
        }
        if (atom instanceof Derivative) {
            return Expressions.derivative(atom, List.of(index), List.of());
        }
        return Rational.ZERO;
    }
}
