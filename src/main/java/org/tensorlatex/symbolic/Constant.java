package org.tensorlatex.symbolic;

/**
 * Mathematical constants with a dedicated LaTeX spelling.
 */
public enum Constant implements Expr {
    /** {@code \pi}. */
    PI("pi", Math.PI),
    /** Euler's number, a bare {@code e}. */
    E("E", Math.E);

    private final String display;
    private final double value;

    Constant(String display, double value) {
        this.display = display;
        this.value = value;
    }

    public double value() {
        return value;
    }

    @Override
    public String toString() {
        return display;
    }
}
