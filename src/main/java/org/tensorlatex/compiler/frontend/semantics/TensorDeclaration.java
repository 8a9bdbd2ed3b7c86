package org.tensorlatex.compiler.frontend.semantics;

import org.tensorlatex.symbolic.Expr;
import org.tensorlatex.symbolic.Expressions;
import org.tensorlatex.symbolic.IndexPosition;
import org.tensorlatex.symbolic.Rational;
import org.tensorlatex.symbolic.Symbol;

import java.util.ArrayList;
import java.util.List;

/**
 * The index structure and component rule of a tensor known to the session.
 *
 * @param name      The tensor name, e.g. {@code hUD}.
 * @param positions Index positions in order.
 * @param dimension The range of every index; 0 for a constant.
 * @param symmetry  Index symmetries used to share components.
 * @param kind      How components are produced.
 */
public record TensorDeclaration(String name, List<IndexPosition> positions, int dimension,
                                Symmetry symmetry, TensorKind kind) {

    public TensorDeclaration {
        positions = List.copyOf(positions);
    }

    public int rank() {
        return positions.size();
    }

    public String componentName(int[] values) {
        return TensorNames.component(name, values);
    }

    /**
     * Lists all components in row-major order, first index outermost.
     * @return One array of index values per component; a single empty array for a scalar.
     */
    public List<int[]> components() {
        List<IndexRange> ranges = new ArrayList<>();
        for (int i = 0; i < rank(); i++) {
            ranges.add(IndexRange.of(dimension));
        }
        return combinations(ranges);
    }

    /**
     * The value a component has right after declaration.
     * @param values The component's index values.
     * @return A symbol, a number, or zero for computed tensors.
     */
    public Expr initialValue(int[] values) {
        switch (kind) {
            case CONSTANT:
                return new Symbol(name);
            case COMPUTED:
                return Rational.ZERO;
            case KRONECKER:
                return values[0] == values[1] ? Rational.ONE : Rational.ZERO;
            case PERMUTATION:
                return Rational.of(permutationSign(values));
            default:
                Symmetry.Canonical canonical = symmetry.canonicalize(values);
                if (canonical.sign() == 0) {
                    return Rational.ZERO;
                }
                Symbol symbol = new Symbol(componentName(canonical.indices()));
                return canonical.sign() > 0 ? symbol : Expressions.negate(symbol);
        }
    }

    /**
     * Enumerates index combinations in row-major order.
     * @param ranges One range per index.
     * @return All combinations, first range outermost.
     */
    public static List<int[]> combinations(List<IndexRange> ranges) {
        List<int[]> result = new ArrayList<>();
        if (ranges.stream().anyMatch(range -> range.size() == 0)) {
            return result;
        }
        int[] current = new int[ranges.size()];
        for (int i = 0; i < current.length; i++) {
            current[i] = ranges.get(i).start();
        }
        while (true) {
            result.add(current.clone());
            int slot = current.length - 1;
            while (slot >= 0) {
                current[slot]++;
                if (current[slot] < ranges.get(slot).stop()) {
                    break;
                }
                current[slot] = ranges.get(slot).start();
                slot--;
            }
            if (slot < 0) {
                return result;
            }
        }
    }

    private static int permutationSign(int[] values) {
        int sign = 1;
        for (int i = 0; i < values.length; i++) {
            for (int j = i + 1; j < values.length; j++) {
                if (values[i] == values[j]) {
                    return 0;
                }
                if (values[i] > values[j]) {
                    sign = -sign;
                }
            }
        }
        return sign;
    }
}
