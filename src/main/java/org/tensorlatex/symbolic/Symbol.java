package org.tensorlatex.symbolic;

/**
 * A named scalar symbol, e.g. {@code x}, {@code theta} or the component symbol {@code gDD01}.
 *
 * @param name The symbol name. Greek letters are stored without the leading backslash.
 */
public record Symbol(String name) implements Expr {

    @Override
    public String toString() {
        return name;
    }
}
