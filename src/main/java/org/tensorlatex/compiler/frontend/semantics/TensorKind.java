package org.tensorlatex.compiler.frontend.semantics;

/**
 * How the components of a declared tensor are produced.
 */
public enum TensorKind {
    /** One symbol per independent component, e.g. {@code hUD01}. */
    SYMBOLIC,
    /** Symmetric rank-2 symbols that also open a metric context. */
    METRIC,
    /** The identity. */
    KRONECKER,
    /** The Levi-Civita sign. */
    PERMUTATION,
    /** A scalar constant without components. */
    CONSTANT,
    /** Components come from an equation or from a derivation. */
    COMPUTED;

    /**
     * Maps a symmetry keyword of a {@code define} item to a kind.
     * @param keyword {@code const}, {@code metric}, {@code kronecker}, {@code permutation}, or a symmetry.
     * @return The kind; symmetries such as {@code sym01} or {@code nosym} yield {@link #SYMBOLIC}.
     */
    public static TensorKind fromKeyword(String keyword) {
        if (keyword == null) {
            return SYMBOLIC;
        }
        return switch (keyword) {
            case "const" -> CONSTANT;
            case "metric" -> METRIC;
            case "kronecker" -> KRONECKER;
            case "permutation" -> PERMUTATION;
            default -> SYMBOLIC;
        };
    }
}
