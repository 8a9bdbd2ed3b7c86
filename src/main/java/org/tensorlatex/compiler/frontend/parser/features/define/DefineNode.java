package org.tensorlatex.compiler.frontend.parser.features.define;

import org.tensorlatex.compiler.frontend.parser.ast.AstNode;
import org.tensorlatex.symbolic.DerivativeMode;

import java.util.List;

/**
 * A {@code % define} line with its comma-separated items.
 *
 * @param items    The items in source order.
 * @param position The offset of the {@code define} keyword.
 */
public record DefineNode(List<Item> items, int position) implements AstNode {

    public DefineNode {
        items = List.copyOf(items);
    }

    /**
     * One item of a {@code define} line.
     */
    public sealed interface Item {
        int position();
    }

    /**
     * {@code [SYMMETRY] NAME [(dim)]}.
     *
     * @param keyword   The symmetry or kind keyword, or {@code null}.
     * @param name      The tensor name, e.g. {@code hUD}.
     * @param dimension The dimension, or {@code null} if omitted.
     * @param position  The offset of the item.
     */
    public record Declaration(String keyword, String name, Integer dimension, int position) implements Item {
    }

    /**
     * {@code basis [x, y, z]}.
     */
    public record Basis(List<String> coordinates, int position) implements Item {
        public Basis {
            coordinates = List.copyOf(coordinates);
        }
    }

    /**
     * {@code deriv symbolic} or {@code deriv _d}.
     */
    public record DerivativeSetting(DerivativeMode mode, int position) implements Item {
    }

    /**
     * {@code index i = 0:2} or {@code index [i-l] = 0:2}.
     *
     * @param labels The labels the range applies to.
     * @param start  The first value.
     * @param stop   The last value (inclusive).
     */
    public record IndexRangeSetting(List<String> labels, int start, int stop, int position) implements Item {
        public IndexRangeSetting {
            labels = List.copyOf(labels);
        }
    }
}
