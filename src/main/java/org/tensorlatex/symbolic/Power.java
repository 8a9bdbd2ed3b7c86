package org.tensorlatex.symbolic;

/**
 * {@code base} raised to {@code exponent}. Use {@link Expressions#power} to construct one.
 */
public record Power(Expr base, Expr exponent) implements Expr {

    @Override
    public String toString() {
        return ExprPrinter.print(this);
    }
}
