package org.tensorlatex.compiler.frontend.semantics;

import com.typesafe.config.ConfigFactory;
import org.tensorlatex.compiler.config.SessionConfig;
import org.tensorlatex.compiler.frontend.parser.ast.AssignmentNode;
import org.tensorlatex.symbolic.DerivativeMode;
import org.tensorlatex.symbolic.Symbol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The mutable state shared by consecutive translations: declarations and values, the coordinate
 * basis, index ranges, the derivative mode, metric contexts and the equations that defined
 * each tensor. A session is not thread-safe; callers serialize access.
 */
public class TranslationSession {

    private final SessionConfig config;
    private final Namespace namespace = new Namespace();
    private final List<Symbol> basis = new ArrayList<>();
    private final Map<String, IndexRange> indexRanges = new HashMap<>();
    private final Map<String, MetricContext> metrics = new LinkedHashMap<>();
    private final Map<String, AssignmentNode> definingEquations = new HashMap<>();
    private DerivativeMode derivativeMode;
    private int defaultDimension;

    /**
     * Creates a session with settings from the given configuration.
     * @param config The session settings.
     */
    public TranslationSession(SessionConfig config) {
        this.config = config;
        reset();
    }

    /**
     * Creates a session configured from {@code ConfigFactory.load()}.
     * @return A fresh session.
     */
    public static TranslationSession create() {
        return new TranslationSession(SessionConfig.fromConfig(ConfigFactory.load()));
    }

    /**
     * Forgets everything but the configuration.
     */
    public void reset() {
        namespace.clear();
        basis.clear();
        indexRanges.clear();
        metrics.clear();
        definingEquations.clear();
        derivativeMode = config.derivativeMode();
        defaultDimension = config.defaultDimension();
    }

    public SessionConfig config() {
        return config;
    }

    public Namespace namespace() {
        return namespace;
    }

    public List<Symbol> basis() {
        return Collections.unmodifiableList(basis);
    }

    public void setBasis(List<Symbol> coordinates) {
        basis.clear();
        basis.addAll(coordinates);
    }

    public boolean isBasisSymbol(String name) {
        return basis.contains(new Symbol(name));
    }

    public DerivativeMode derivativeMode() {
        return derivativeMode;
    }

    public void setDerivativeMode(DerivativeMode derivativeMode) {
        this.derivativeMode = derivativeMode;
    }

    /**
     * @return The dimension assumed when a declaration omits it; 0 if there is none yet.
     */
    public int defaultDimension() {
        return defaultDimension;
    }

    public void setDefaultDimension(int defaultDimension) {
        this.defaultDimension = defaultDimension;
    }

    public Optional<IndexRange> indexRange(String label) {
        return Optional.ofNullable(indexRanges.get(label));
    }

    public void setIndexRange(String label, IndexRange range) {
        indexRanges.put(label, range);
    }

    public Collection<String> rangedLabels() {
        return Collections.unmodifiableSet(indexRanges.keySet());
    }

    public Optional<MetricContext> metric(String diacritic) {
        return Optional.ofNullable(metrics.get(diacritic));
    }

    /**
     * Registers a metric context, replacing the one with the same diacritic.
     * @param context The context.
     * @return The replaced context, if any.
     */
    public Optional<MetricContext> registerMetric(MetricContext context) {
        return Optional.ofNullable(metrics.put(context.diacritic(), context));
    }

    public Collection<MetricContext> metrics() {
        return Collections.unmodifiableCollection(metrics.values());
    }

    /**
     * Finds the context whose declared metric has the given name.
     * @param name A tensor name.
     * @return The context, if {@code name} is a registered metric.
     */
    public Optional<MetricContext> metricNamed(String name) {
        return metrics.values().stream().filter(context -> context.metricName().equals(name)).findFirst();
    }

    /**
     * Finds the context that can derive the given inverse or determinant name.
     * @param name A tensor or scalar name.
     * @return The context, if {@code name} is derivable from a registered metric.
     */
    public Optional<MetricContext> metricDeriving(String name) {
        return metrics.values().stream().filter(context -> context.derives(name)).findFirst();
    }

    /**
     * Checks whether a name is declared, has a value, or can be derived from a metric.
     * @param name A tensor name.
     * @return true if a reference to {@code name} resolves.
     */
    public boolean isKnown(String name) {
        return namespace.isDeclared(name) || namespace.hasValue(name) || metricDeriving(name).isPresent();
    }

    public Optional<AssignmentNode> definingEquation(String name) {
        return Optional.ofNullable(definingEquations.get(name));
    }

    public void recordDefiningEquation(String name, AssignmentNode equation) {
        definingEquations.put(name, equation);
    }

    public void forgetDefiningEquation(String name) {
        definingEquations.remove(name);
    }
}
