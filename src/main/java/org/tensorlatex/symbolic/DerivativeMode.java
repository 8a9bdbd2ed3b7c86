package org.tensorlatex.symbolic;

/**
 * How a partial derivative {@code \partial_a} is represented.
 */
public enum DerivativeMode {
    /** Differentiate component expressions against the declared coordinate basis. */
    SYMBOLIC("symbolic"),
    /** Introduce derivative tensors named with a {@code _d} suffix, e.g. {@code vU_dD}. */
    TENSOR("_d");

    private final String keyword;

    DerivativeMode(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Resolves the keyword used in {@code % define deriv ...} and in configuration files.
     * @param keyword {@code "symbolic"} or {@code "_d"}.
     * @return The mode.
     * @throws IllegalArgumentException for any other keyword.
     */
    public static DerivativeMode fromKeyword(String keyword) {
        for (DerivativeMode mode : values()) {
            if (mode.keyword.equalsIgnoreCase(keyword)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown derivative mode: " + keyword);
    }
}
