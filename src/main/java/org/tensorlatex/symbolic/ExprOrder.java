package org.tensorlatex.symbolic;

import java.util.Comparator;

/**
 * Total order used to arrange the terms of a sum and the factors of a product.
 * Numbers come first, then constants, symbols, tensor references and compound nodes.
 * Powers and scaled terms sort next to their base, so {@code x} and {@code x**2} stay adjacent.
 */
final class ExprOrder implements Comparator<Expr> {

    static final ExprOrder INSTANCE = new ExprOrder();

    private ExprOrder() {
    }

    @Override
    public int compare(Expr a, Expr b) {
        Expr keyA = sortKey(a);
        Expr keyB = sortKey(b);
        int byKind = Integer.compare(rank(keyA), rank(keyB));
        if (byKind != 0) {
            return byKind;
        }
        int byKey = keyA.toString().compareTo(keyB.toString());
        if (byKey != 0) {
            return byKey;
        }
        return a.toString().compareTo(b.toString());
    }

    private static Expr sortKey(Expr expr) {
        if (expr instanceof Power power) {
            return power.base();
        }
        if (expr instanceof Product product && product.factors().size() == 2
                && product.factors().get(0) instanceof Numeric) {
            return sortKey(product.factors().get(1));
        }
        return expr;
    }

    private static int rank(Expr expr) {
        if (expr instanceof Numeric) return 0;
        if (expr instanceof Constant) return 1;
        if (expr instanceof Symbol) return 2;
        if (expr instanceof TensorRef) return 3;
        if (expr instanceof FunctionCall) return 4;
        if (expr instanceof Derivative) return 5;
        if (expr instanceof Product) return 6;
        if (expr instanceof Sum) return 7;
        return 8;
    }
}
