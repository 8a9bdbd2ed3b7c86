package org.tensorlatex.symbolic;

import java.util.List;

/**
 * An unevaluated partial derivative in {@link DerivativeMode#SYMBOLIC} mode. Index labels are
 * resolved to basis coordinates during evaluation; coordinates are used as written.
 *
 * @param operand     The differentiated expression.
 * @param indices     Lower derivative indices, e.g. {@code b} in {@code \partial_b g_{cd}}.
 * @param coordinates Basis coordinates differentiated against directly, e.g. {@code r} in {@code \partial_r}.
 */
public record Derivative(Expr operand, List<Index> indices, List<Symbol> coordinates) implements Expr {

    public Derivative {
        indices = List.copyOf(indices);
        coordinates = List.copyOf(coordinates);
    }

    @Override
    public String toString() {
        return ExprPrinter.print(this);
    }
}
