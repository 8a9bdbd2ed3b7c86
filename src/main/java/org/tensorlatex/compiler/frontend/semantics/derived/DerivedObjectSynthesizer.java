package org.tensorlatex.compiler.frontend.semantics.derived;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tensorlatex.compiler.diagnostics.TensorException;
import org.tensorlatex.compiler.frontend.semantics.AnalysisContext;
import org.tensorlatex.compiler.frontend.semantics.MetricContext;
import org.tensorlatex.compiler.frontend.semantics.Namespace;
import org.tensorlatex.compiler.frontend.semantics.Symmetry;
import org.tensorlatex.compiler.frontend.semantics.TensorDeclaration;
import org.tensorlatex.compiler.frontend.semantics.TensorKind;
import org.tensorlatex.compiler.frontend.semantics.TensorNames;
import org.tensorlatex.compiler.frontend.semantics.TranslationSession;
import org.tensorlatex.symbolic.Expr;
import org.tensorlatex.symbolic.Expressions;
import org.tensorlatex.symbolic.IndexPosition;
import org.tensorlatex.symbolic.MatrixAlgebra;
import org.tensorlatex.symbolic.Rational;
import org.tensorlatex.symbolic.TensorOrigin;
import org.tensorlatex.symbolic.TensorRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Materializes tensors that are referenced before being declared but can be derived: the
 * inverse and determinant of a metric, Christoffel symbols, covariant derivatives and
 * partial-derivative tensors.
 * <p>
 * Christoffel symbols and covariant derivatives are spelled as LaTeX equations and executed
 * against the same session, so they go through the regular summation and symmetry handling.
 */
public class DerivedObjectSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(DerivedObjectSynthesizer.class);

    private static final Symmetry LOWER_PAIR = Symmetry.symmetric(1, 2);

    /**
     * Checks whether a reference can be derived.
     * @param ref     The reference.
     * @param session The session.
     * @return true if {@link #derive(TensorRef, AnalysisContext)} knows how to build it.
     */
    public boolean canDerive(TensorRef ref, TranslationSession session) {
        return ref.origin() != null || session.metricDeriving(ref.name()).isPresent();
    }

    /**
     * Declares the referenced tensor and computes its components.
     * @param ref     The reference.
     * @param context The analysis context; generated equations bind their results here.
     * @throws TensorException {@code undefined metric} if the object needs a metric that does not
     *                         exist, or {@code circular derivation} if it depends on itself.
     */
    public void derive(TensorRef ref, AnalysisContext context) {
        String name = ref.name();
        context.beginDerivation(name);
        try {
            MetricContext metric = context.session().metricDeriving(name).orElse(null);
            if (metric != null) {
                computeMetricObjects(metric, context);
            } else if (ref.origin() instanceof TensorOrigin.Christoffel christoffel) {
                christoffel(christoffel, context);
            } else if (ref.origin() instanceof TensorOrigin.Covariant covariant) {
                covariant(name, covariant, context);
            } else if (ref.origin() instanceof TensorOrigin.Partial partial) {
                partial(ref, partial, context);
            } else {
                throw new TensorException(String.format("undefined tensor '%s'", name));
            }
        } finally {
            context.endDerivation(name);
        }
    }

    /**
     * Drops everything derived from a metric, so it is recomputed on the next reference.
     * @param metric  The metric context.
     * @param session The session.
     */
    public void invalidate(MetricContext metric, TranslationSession session) {
        if (metric.synthesized().isEmpty()) {
            return;
        }
        for (String name : metric.synthesized()) {
            session.namespace().remove(name);
            session.forgetDefiningEquation(name);
        }
        log.debug("Invalidated {} object(s) derived from {}", metric.synthesized().size(), metric.metricName());
        metric.clearSynthesized();
    }

    /**
     * Recomputes the inverse and determinant of a metric right away.
     * @param metric  The metric context.
     * @param context The analysis context.
     */
    public void refreshMetric(MetricContext metric, AnalysisContext context) {
        invalidate(metric, context.session());
        computeMetricObjects(metric, context);
    }

    private void computeMetricObjects(MetricContext metric, AnalysisContext context) {
        Namespace namespace = context.session().namespace();
        TensorDeclaration declaration = namespace.declaration(metric.metricName())
                .orElseThrow(() -> new TensorException("undefined metric"));
        int n = declaration.dimension();
        Expr[][] matrix = new Expr[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                matrix[i][j] = namespace.value(declaration.componentName(new int[] {i, j})).orElse(Rational.ZERO);
            }
        }
        Expr determinant = MatrixAlgebra.determinant(matrix);
        Expr[][] inverse;
        try {
            inverse = MatrixAlgebra.inverse(matrix);
        } catch (ArithmeticException e) {
            throw new TensorException(String.format("singular metric '%s'", metric.metricName()));
        }

        boolean ownInverse = !namespace.isDeclared(metric.inverseName()) || metric.synthesized().contains(metric.inverseName());
        if (ownInverse) {
            IndexPosition position = metric.isUpper() ? IndexPosition.LOWER : IndexPosition.UPPER;
            TensorDeclaration inverseDeclaration = new TensorDeclaration(metric.inverseName(),
                    List.of(position, position), n, Symmetry.symmetric(0, 1), TensorKind.COMPUTED);
            namespace.declare(inverseDeclaration);
            for (int[] component : inverseDeclaration.components()) {
                context.bind(inverseDeclaration.componentName(component), inverse[component[0]][component[1]]);
            }
            metric.markSynthesized(metric.inverseName());
        }
        context.bind(metric.determinantName(),
                metric.isUpper() ? Expressions.power(determinant, Rational.MINUS_ONE) : determinant);
        metric.markSynthesized(metric.determinantName());
        log.debug("Inverted metric {} of dimension {}", metric.metricName(), n);
    }

    private void christoffel(TensorOrigin.Christoffel origin, AnalysisContext context) {
        TranslationSession session = context.session();
        MetricContext metric = session.metric(origin.diacritic())
                .orElseThrow(() -> new TensorException("undefined metric"));
        String name = TensorNames.christoffel(origin.diacritic());
        TensorDeclaration declaration = new TensorDeclaration(name, TensorNames.positions(name), metric.dimension(),
                LOWER_PAIR, TensorKind.COMPUTED);

        LatexWriter.Labels labels = labels(session);
        String a = labels.next();
        String b = labels.next();
        String c = labels.next();
        String d = labels.next();
        String g = metric.symbolLatex();
        String equation = LatexWriter.christoffel(origin.diacritic()) + "^{" + a + "}_{" + b + " " + c + "} = "
                + "\\frac{1}{2} " + g + "^{" + a + " " + d + "} ("
                + "\\partial_{" + b + "} " + g + "_{" + c + " " + d + "} + "
                + "\\partial_{" + c + "} " + g + "_{" + d + " " + b + "} - "
                + "\\partial_{" + d + "} " + g + "_{" + b + " " + c + "})";
        run(declaration, equation, metric, context);
    }

    private void covariant(String name, TensorOrigin.Covariant origin, AnalysisContext context) {
        TranslationSession session = context.session();
        MetricContext metric = session.metric(origin.diacritic())
                .orElseThrow(() -> new TensorException("undefined metric"));
        List<IndexPosition> positions = new ArrayList<>(origin.operandPositions());
        positions.addAll(origin.derivativePositions());
        TensorDeclaration declaration = new TensorDeclaration(name, positions, metric.dimension(),
                Symmetry.NONE, TensorKind.COMPUTED);

        int rank = origin.operandPositions().size();
        int order = origin.derivativePositions().size();
        LatexWriter.Labels labels = labels(session);
        List<String> operandLabels = labels.next(rank);
        List<String> derivativeLabels = labels.next(order);
        String dummy = labels.next();

        StringBuilder equation = new StringBuilder()
                .append(LatexWriter.nablas(origin.diacritic(), origin.derivativePositions(), derivativeLabels))
                .append(operand(origin, operandLabels))
                .append(" = ");

        List<IndexPosition> innerPositions = origin.derivativePositions().subList(1, order);
        List<String> innerLabels = derivativeLabels.subList(1, order);
        String outer = derivativeLabels.get(0);
        if (origin.derivativePositions().get(0) == IndexPosition.UPPER) {
            List<IndexPosition> lowered = new ArrayList<>();
            lowered.add(IndexPosition.LOWER);
            lowered.addAll(innerPositions);
            List<String> loweredLabels = new ArrayList<>();
            loweredLabels.add(dummy);
            loweredLabels.addAll(innerLabels);
            equation.append(metric.symbolLatex()).append("^{").append(outer).append(' ').append(dummy).append("} ")
                    .append(LatexWriter.nablas(origin.diacritic(), lowered, loweredLabels))
                    .append(operand(origin, operandLabels));
        } else {
            List<String> slots = new ArrayList<>(operandLabels);
            slots.addAll(innerLabels);
            List<IndexPosition> slotPositions = new ArrayList<>(origin.operandPositions());
            slotPositions.addAll(innerPositions);
            String inner = inner(origin, innerPositions, slots);
            equation.append(LatexWriter.mode(origin.mode())).append(" \\partial_{").append(outer).append("} ")
                    .append(order > 1 ? "(" + inner + ")" : inner);
            String gamma = LatexWriter.christoffel(origin.diacritic());
            for (int i = 0; i < slots.size(); i++) {
                List<String> replaced = new ArrayList<>(slots);
                replaced.set(i, dummy);
                String term = inner(origin, innerPositions, replaced);
                if (slotPositions.get(i) == IndexPosition.UPPER) {
                    equation.append(" + ").append(gamma).append("^{").append(slots.get(i)).append("}_{")
                            .append(dummy).append(' ').append(outer).append("} ").append(term);
                } else {
                    equation.append(" - ").append(gamma).append("^{").append(dummy).append("}_{")
                            .append(slots.get(i)).append(' ').append(outer).append("} ").append(term);
                }
            }
        }
        run(declaration, equation.toString(), metric, context);
    }

    /**
     * Declares a partial-derivative tensor with one symbol per independent component.
     */
    private void partial(TensorRef ref, TensorOrigin.Partial origin, AnalysisContext context) {
        TranslationSession session = context.session();
        Namespace namespace = session.namespace();
        TensorDeclaration operand = namespace.declaration(origin.operandName()).orElse(null);
        int dimension;
        Symmetry symmetry = Symmetry.NONE;
        if (operand != null) {
            dimension = operand.dimension();
            symmetry = operand.symmetry();
        } else {
            dimension = session.defaultDimension() > 0 ? session.defaultDimension() : session.basis().size();
        }
        if (dimension == 0) {
            throw new TensorException(String.format("cannot infer dimension of '%s'", ref.name()));
        }
        int operandRank = ref.rank() - origin.order();
        if (origin.order() >= 2) {
            List<Integer> derivativeSlots = new ArrayList<>();
            for (int i = operandRank; i < ref.rank(); i++) {
                derivativeSlots.add(i);
            }
            symmetry = symmetry.with(new Symmetry.Group(false, derivativeSlots));
        }
        TensorDeclaration declaration = new TensorDeclaration(ref.name(), ref.positions(), dimension, symmetry,
                TensorKind.SYMBOLIC);
        namespace.declare(declaration);
        for (int[] component : declaration.components()) {
            context.bind(declaration.componentName(component), declaration.initialValue(component));
        }
        log.debug("Declared derivative tensor {} of dimension {}", ref.name(), dimension);
    }

    private static void run(TensorDeclaration declaration, String equation, MetricContext metric,
                            AnalysisContext context) {
        Namespace namespace = context.session().namespace();
        namespace.declare(declaration);
        log.debug("Deriving {}: {}", declaration.name(), equation);
        try {
            context.execute(equation);
        } catch (RuntimeException e) {
            namespace.remove(declaration.name());
            throw e;
        }
        metric.markSynthesized(declaration.name());
    }

    private static String operand(TensorOrigin.Covariant origin, List<String> labels) {
        return LatexWriter.tensor(origin.operandLatex(), origin.operandPositions(), labels, origin.operandCommaOrder());
    }

    /**
     * Spells the tensor differentiated by the outermost operator: the remaining operators applied
     * to the operand. The operand's labels come first in {@code slots}, then the derivative labels.
     */
    private static String inner(TensorOrigin.Covariant origin, List<IndexPosition> innerPositions, List<String> slots) {
        int rank = origin.operandPositions().size();
        return LatexWriter.nablas(origin.diacritic(), innerPositions, slots.subList(rank, slots.size()))
                + operand(origin, slots.subList(0, rank));
    }

    private static LatexWriter.Labels labels(TranslationSession session) {
        List<String> excluded = new ArrayList<>(session.rangedLabels());
        session.basis().forEach(symbol -> excluded.add(symbol.name()));
        return new LatexWriter.Labels(excluded);
    }
}
