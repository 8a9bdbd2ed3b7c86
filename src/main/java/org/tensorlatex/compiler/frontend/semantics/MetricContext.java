package org.tensorlatex.compiler.frontend.semantics;

import org.tensorlatex.compiler.diagnostics.TensorException;
import org.tensorlatex.symbolic.IndexPosition;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A metric together with the objects derived from it. Contexts are keyed by the diacritic
 * of the metric symbol, so {@code g} and {@code \hat{g}} coexist independently.
 */
public final class MetricContext {

    private final String diacritic;
    private final String metricName;
    private final String inverseName;
    private final String determinantName;
    private final String symbolLatex;
    private final boolean upper;
    private final int dimension;
    private final Set<String> synthesized = new LinkedHashSet<>();

    private MetricContext(String diacritic, String metricName, String inverseName, String determinantName,
                          String symbolLatex, boolean upper, int dimension) {
        this.diacritic = diacritic;
        this.metricName = metricName;
        this.inverseName = inverseName;
        this.determinantName = determinantName;
        this.symbolLatex = symbolLatex;
        this.upper = upper;
        this.dimension = dimension;
    }

    /**
     * Opens a context for a declared metric.
     * @param metric A rank-2 declaration with both indices in the same position.
     * @return The context.
     * @throws TensorException if the declaration cannot serve as a metric.
     */
    public static MetricContext of(TensorDeclaration metric) {
        List<IndexPosition> positions = metric.positions();
        if (positions.size() != 2 || positions.get(0) != positions.get(1)) {
            throw new TensorException(String.format("metric '%s' must have two indices in the same position", metric.name()));
        }
        String base = TensorNames.baseSymbol(metric.name());
        boolean upper = positions.get(0) == IndexPosition.UPPER;
        return new MetricContext(TensorNames.diacritic(base), metric.name(), base + (upper ? "DD" : "UU"),
                base + "det", TensorNames.latex(base), upper, metric.dimension());
    }

    public String diacritic() {
        return diacritic;
    }

    public String metricName() {
        return metricName;
    }

    public String inverseName() {
        return inverseName;
    }

    public String determinantName() {
        return determinantName;
    }

    /**
     * @return The LaTeX spelling of the metric symbol, e.g. {@code \hat{g}}.
     */
    public String symbolLatex() {
        return symbolLatex;
    }

    /**
     * @return true if the declared metric carries upper indices, as in {@code gUU}.
     */
    public boolean isUpper() {
        return upper;
    }

    public int dimension() {
        return dimension;
    }

    public boolean derives(String name) {
        return name.equals(inverseName) || name.equals(determinantName);
    }

    public void markSynthesized(String name) {
        synthesized.add(name);
    }

    public Set<String> synthesized() {
        return Collections.unmodifiableSet(synthesized);
    }

    public void clearSynthesized() {
        synthesized.clear();
    }
}
