package org.tensorlatex.compiler.frontend.semantics.derived;

import org.tensorlatex.compiler.diagnostics.TensorException;
import org.tensorlatex.symbolic.DerivativeMode;
import org.tensorlatex.symbolic.IndexPosition;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Spells the equations of derived objects in the input dialect, so that they run through the
 * same parser and index engine as user input.
 */
final class LatexWriter {

    private static final String LABELS = "abcdfghijklmnopqrstuvwxyz";

    private LatexWriter() {
    }

    /**
     * Spells a tensor whose upper indices precede its lower ones, e.g. {@code v^{a}_{b,c}}.
     * @param symbolLatex The symbol, e.g. {@code \hat{v}}.
     * @param positions   One position per label.
     * @param labels      The index labels.
     * @param commaOrder  The number of trailing comma-derivative labels.
     * @return The LaTeX spelling.
     * @throws TensorException if an upper index follows a lower one.
     */
    static String tensor(String symbolLatex, List<IndexPosition> positions, List<String> labels, int commaOrder) {
        List<String> upper = new ArrayList<>();
        List<String> lower = new ArrayList<>();
        for (int i = 0; i < positions.size(); i++) {
            if (positions.get(i) == IndexPosition.UPPER) {
                if (!lower.isEmpty()) {
                    throw new TensorException(String.format("cannot spell '%s' with mixed index order", symbolLatex));
                }
                upper.add(labels.get(i));
            } else {
                lower.add(labels.get(i));
            }
        }
        StringBuilder latex = new StringBuilder(symbolLatex);
        if (!upper.isEmpty()) {
            latex.append("^{").append(String.join(" ", upper)).append('}');
        }
        if (!lower.isEmpty()) {
            int own = lower.size() - commaOrder;
            latex.append("_{").append(String.join(" ", lower.subList(0, own)));
            if (commaOrder > 0) {
                latex.append(',').append(String.join(" ", lower.subList(own, lower.size())));
            }
            latex.append('}');
        }
        return latex.toString();
    }

    /**
     * Spells a chain of covariant derivative operators, outermost first.
     */
    static String nablas(String diacritic, List<IndexPosition> positions, List<String> labels) {
        String nabla = decorate("\\nabla", diacritic);
        StringBuilder latex = new StringBuilder();
        for (int i = 0; i < positions.size(); i++) {
            latex.append(nabla).append(positions.get(i) == IndexPosition.UPPER ? "^{" : "_{")
                    .append(labels.get(i)).append("} ");
        }
        return latex.toString();
    }

    static String christoffel(String diacritic) {
        return decorate("\\Gamma", diacritic);
    }

    static String mode(DerivativeMode mode) {
        return "\\vphantom{" + mode.keyword() + "}";
    }

    static String decorate(String latex, String diacritic) {
        return diacritic.isEmpty() ? latex : "\\" + diacritic + "{" + latex + "}";
    }

    /**
     * Hands out index labels that cannot collide with coordinates or restricted ranges.
     */
    static final class Labels {

        private final List<String> pool = new ArrayList<>();
        private int next;

        Labels(Collection<String> excluded) {
            Set<String> skip = new HashSet<>(excluded);
            for (char c : LABELS.toCharArray()) {
                String label = String.valueOf(c);
                if (!skip.contains(label)) {
                    pool.add(label);
                }
            }
        }

        String next() {
            if (next >= pool.size()) {
                throw new TensorException("too many indices in derived equation");
            }
            return pool.get(next++);
        }

        List<String> next(int count) {
            List<String> labels = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                labels.add(next());
            }
            return labels;
        }
    }
}
