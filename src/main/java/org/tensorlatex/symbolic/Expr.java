package org.tensorlatex.symbolic;

/**
 * An immutable node of a symbolic expression tree.
 * <p>
 * Instances are built through {@link Expressions}, which keeps sums, products and powers in a
 * canonical form. Two canonical trees describing the same expression are equal under
 * {@link Object#equals(Object)}, so expressions can be compared, hashed and shared as subtrees.
 * <p>
 * {@link TensorRef} and {@link Derivative} only occur in trees produced by the parser; index
 * evaluation replaces them by component values before results are handed to callers.
 */
public sealed interface Expr permits Numeric, Symbol, Constant, Sum, Product, Power, FunctionCall, Derivative, TensorRef {

    /**
     * Checks whether this expression is the exact or floating-point number zero.
     * @return true if this is a numeric zero.
     */
    default boolean isZero() {
        return this instanceof Numeric n && n.signum() == 0;
    }

    /**
     * Checks whether this expression is a numeric literal.
     * @return true if this is a {@link Numeric}.
     */
    default boolean isNumeric() {
        return this instanceof Numeric;
    }
}
