package org.tensorlatex.compiler.frontend.semantics;

/**
 * Values an index label runs over, declared with {@code % define index i = 0:2}.
 *
 * @param start First value (inclusive).
 * @param stop  Last value (exclusive).
 */
public record IndexRange(int start, int stop) {

    public static IndexRange of(int dimension) {
        return new IndexRange(0, dimension);
    }

    public int size() {
        return Math.max(0, stop - start);
    }
}
