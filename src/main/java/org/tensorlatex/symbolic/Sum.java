package org.tensorlatex.symbolic;

import java.util.List;

/**
 * A canonical sum. Use {@link Expressions#add} to construct one.
 *
 * @param terms At least two terms, numeric constant first, remaining terms sorted.
 */
public record Sum(List<Expr> terms) implements Expr {

    public Sum {
        terms = List.copyOf(terms);
    }

    @Override
    public String toString() {
        return ExprPrinter.print(this);
    }
}
