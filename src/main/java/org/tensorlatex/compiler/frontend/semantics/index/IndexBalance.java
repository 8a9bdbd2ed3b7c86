package org.tensorlatex.compiler.frontend.semantics.index;

import org.tensorlatex.compiler.diagnostics.TensorException;
import org.tensorlatex.symbolic.Derivative;
import org.tensorlatex.symbolic.Expr;
import org.tensorlatex.symbolic.FunctionCall;
import org.tensorlatex.symbolic.Index;
import org.tensorlatex.symbolic.IndexPosition;
import org.tensorlatex.symbolic.Power;
import org.tensorlatex.symbolic.Product;
import org.tensorlatex.symbolic.Rational;
import org.tensorlatex.symbolic.Sum;
import org.tensorlatex.symbolic.TensorRef;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Occurrences of index labels at one level of an expression tree.
 * <p>
 * A tensor reference contributes its labels, a product the free labels of its factors, a
 * derivative the free labels of its operand plus its own indices. Function arguments and
 * non-integer powers are opaque: only their free labels take part in the enclosing term.
 * A label seen twice at one level, once upper and once lower, is bound there; any other
 * repetition is illegal. All terms of a sum must have the same free labels.
 */
final class IndexBalance {

    /**
     * A label in a given position.
     */
    record Occurrence(String label, IndexPosition position) {
    }

    private final Set<Occurrence> free;
    private final Set<String> bound;

    private IndexBalance(Set<Occurrence> free, Set<String> bound) {
        this.free = Collections.unmodifiableSet(free);
        this.bound = Collections.unmodifiableSet(bound);
    }

    /**
     * Balances the labels of an expression.
     * @param expr  The expression.
     * @param fixed Labels already bound to values by an enclosing level; they are ignored.
     * @return The free labels and the labels summed at the top level of {@code expr}.
     * @throws TensorException {@code illegal bound index} or {@code unbalanced free index}.
     */
    static IndexBalance of(Expr expr, Collection<String> fixed) {
        if (expr instanceof Sum sum) {
            Set<Occurrence> free = null;
            for (Expr term : sum.terms()) {
                Set<Occurrence> termFree = of(term, fixed).free();
                if (free == null) {
                    free = termFree;
                } else if (!free.equals(termFree)) {
                    throw new TensorException("unbalanced free index");
                }
            }
            return new IndexBalance(free == null ? Set.of() : free, Set.of());
        }

        List<Occurrence> occurrences = new ArrayList<>();
        if (expr instanceof TensorRef ref) {
            addLabels(ref.indices(), fixed, occurrences);
        } else if (expr instanceof Product product) {
            for (Expr factor : product.factors()) {
                occurrences.addAll(of(factor, fixed).free());
            }
        } else if (expr instanceof Power power) {
            Set<Occurrence> baseFree = of(power.base(), fixed).free();
            if (power.exponent() instanceof Rational r && r.isInteger() && r.signum() > 0) {
                int repeats = baseFree.isEmpty() ? 0 : r.numerator().min(BigInteger.valueOf(3)).intValue();
                for (int i = 0; i < repeats; i++) {
                    occurrences.addAll(baseFree);
                }
            } else {
                occurrences.addAll(baseFree);
                occurrences.addAll(of(power.exponent(), fixed).free());
            }
        } else if (expr instanceof FunctionCall call) {
            occurrences.addAll(of(call.argument(), fixed).free());
        } else if (expr instanceof Derivative derivative) {
            occurrences.addAll(of(derivative.operand(), fixed).free());
            addLabels(derivative.indices(), fixed, occurrences);
        }
        return balance(occurrences);
    }

    /**
     * Free labels of a tensor reference that stands alone, e.g. an assignment target.
     * @param ref The reference.
     * @return Its labels.
     * @throws TensorException if a label repeats.
     */
    static Set<Occurrence> targetLabels(TensorRef ref) {
        Set<Occurrence> labels = new LinkedHashSet<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Index index : ref.indices()) {
            if (index.isLabel()) {
                if (!seen.add(index.label())) {
                    throw new TensorException(String.format("illegal bound index '%s' on left-hand side", index.label()));
                }
                labels.add(new Occurrence(index.label(), index.position()));
            }
        }
        return labels;
    }

    Set<Occurrence> free() {
        return free;
    }

    Set<String> bound() {
        return bound;
    }

    private static void addLabels(List<Index> indices, Collection<String> fixed, List<Occurrence> occurrences) {
        for (Index index : indices) {
            if (index.isLabel() && !fixed.contains(index.label())) {
                occurrences.add(new Occurrence(index.label(), index.position()));
            }
        }
    }

    private static IndexBalance balance(List<Occurrence> occurrences) {
        Map<String, List<IndexPosition>> positions = new LinkedHashMap<>();
        for (Occurrence occurrence : occurrences) {
            positions.computeIfAbsent(occurrence.label(), label -> new ArrayList<>()).add(occurrence.position());
        }
        Set<Occurrence> free = new LinkedHashSet<>();
        Set<String> bound = new LinkedHashSet<>();
        for (Map.Entry<String, List<IndexPosition>> entry : positions.entrySet()) {
            List<IndexPosition> seen = entry.getValue();
            if (seen.size() == 1) {
                free.add(new Occurrence(entry.getKey(), seen.get(0)));
            } else if (seen.size() == 2 && seen.get(0) != seen.get(1)) {
                bound.add(entry.getKey());
            } else {
                throw new TensorException(String.format("illegal bound index '%s'", entry.getKey()));
            }
        }
        return new IndexBalance(free, bound);
    }
}
