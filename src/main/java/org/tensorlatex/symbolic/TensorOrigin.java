package org.tensorlatex.symbolic;

import java.util.List;

/**
 * Describes how a tensor that is referenced but not yet declared can be derived.
 * The parser attaches an origin to each {@link TensorRef} it builds for a derivative or a
 * connection, so the semantic layer can materialize the tensor on first use.
 */
public sealed interface TensorOrigin {

    /**
     * A partial-derivative tensor such as {@code vU_dD}, produced by {@code \partial} in
     * {@link DerivativeMode#TENSOR} mode or by comma notation {@code v^a{}_{,b}}.
     *
     * @param operandName The differentiated tensor, e.g. {@code vU}.
     * @param order       Number of derivative indices appended to the operand's indices.
     */
    record Partial(String operandName, int order) implements TensorOrigin {
    }

    /**
     * A covariant derivative such as {@code vU_cdD}.
     *
     * @param operandName          The differentiated tensor, e.g. {@code vU}.
     * @param operandLatex         LaTeX spelling of the operand's symbol, e.g. {@code \hat{v}}.
     * @param operandPositions     Index positions of the operand.
     * @param operandCommaOrder    Number of trailing comma-derivative indices of the operand.
     * @param derivativePositions  Positions of the derivative indices, outermost operator first.
     * @param diacritic            Diacritic of the connection ({@code ""} for the plain metric).
     * @param mode                 How the partial derivatives of the expansion are represented.
     */
    record Covariant(String operandName, String operandLatex, List<IndexPosition> operandPositions,
                     int operandCommaOrder, List<IndexPosition> derivativePositions, String diacritic, DerivativeMode mode)
            implements TensorOrigin {

        public Covariant {
            operandPositions = List.copyOf(operandPositions);
            derivativePositions = List.copyOf(derivativePositions);
        }
    }

    /**
     * Christoffel symbols of the second kind, {@code GammaUDD}.
     *
     * @param diacritic Diacritic selecting the metric context.
     */
    record Christoffel(String diacritic) implements TensorOrigin {
    }
}
