package org.tensorlatex.symbolic;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A reference to a tensor or scalar in the session namespace, as written in the source.
 * The name already encodes the index positions ({@code hUD} for {@code h^a{}_b}).
 *
 * @param name    Full tensor name.
 * @param indices Index slots in order; empty for a scalar.
 * @param origin  How the tensor can be derived if it is not declared, or {@code null}.
 */
public record TensorRef(String name, List<Index> indices, TensorOrigin origin) implements Expr {

    public TensorRef {
        indices = List.copyOf(indices);
    }

    public static TensorRef scalar(String name) {
        return new TensorRef(name, List.of(), null);
    }

    public int rank() {
        return indices.size();
    }

    public List<IndexPosition> positions() {
        return indices.stream().map(Index::position).toList();
    }

    /**
     * Checks whether all index slots carry concrete component numbers.
     * @return true if no slot is labelled.
     */
    public boolean isConcrete() {
        return indices.stream().noneMatch(Index::isLabel);
    }

    /**
     * Replaces labels by concrete values.
     * @param bindings Label values; labels without a binding are kept.
     * @return A reference with the bound labels replaced.
     */
    public TensorRef bind(Map<String, Integer> bindings) {
        List<Index> bound = new ArrayList<>(indices.size());
        for (Index index : indices) {
            Integer value = index.isLabel() ? bindings.get(index.label()) : null;
            bound.add(value != null ? index.bind(value) : index);
        }
        return new TensorRef(name, bound, origin);
    }

    /**
     * Returns the concrete component numbers.
     * @return One value per index slot.
     * @throws IllegalStateException if a slot is still labelled.
     */
    public int[] components() {
        int[] values = new int[indices.size()];
        for (int i = 0; i < values.length; i++) {
            Index index = indices.get(i);
            if (index.isLabel()) {
                throw new IllegalStateException("Unbound index '" + index.label() + "' in " + name);
            }
            values[i] = index.value();
        }
        return values;
    }

    @Override
    public String toString() {
        return ExprPrinter.print(this);
    }
}
