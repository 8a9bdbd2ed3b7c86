package org.tensorlatex.symbolic;

import java.util.List;

/**
 * A canonical product. Use {@link Expressions#multiply} to construct one.
 *
 * @param factors At least two factors, numeric coefficient first, no two factors share a base.
 */
public record Product(List<Expr> factors) implements Expr {

    public Product {
        factors = List.copyOf(factors);
    }

    @Override
    public String toString() {
        return ExprPrinter.print(this);
    }
}
