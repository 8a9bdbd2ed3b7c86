package org.tensorlatex.compiler.frontend.semantics.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tensorlatex.compiler.diagnostics.TensorException;
import org.tensorlatex.compiler.frontend.parser.ast.AssignmentNode;
import org.tensorlatex.compiler.frontend.parser.ast.AstNode;
import org.tensorlatex.compiler.frontend.parser.features.update.UpdateNode;
import org.tensorlatex.compiler.frontend.semantics.AnalysisContext;
import org.tensorlatex.compiler.frontend.semantics.MetricContext;
import org.tensorlatex.compiler.frontend.semantics.TensorDeclaration;
import org.tensorlatex.compiler.frontend.semantics.TranslationSession;
import org.tensorlatex.compiler.frontend.semantics.derived.DerivedObjectSynthesizer;
import org.tensorlatex.compiler.frontend.semantics.index.IndexEngine;

/**
 * Handles the semantic analysis of {@link UpdateNode}s.
 * <ul>
 *     <li>{@code update metric NAME} (re-)registers NAME as a metric and recomputes its inverse and determinant.</li>
 *     <li>{@code update NAME} re-runs the equation that last defined NAME, or re-instantiates its declaration.</li>
 * </ul>
 */
public class UpdateAnalysisHandler implements IAnalysisHandler {

    private static final Logger log = LoggerFactory.getLogger(UpdateAnalysisHandler.class);

    private final IndexEngine engine;
    private final DerivedObjectSynthesizer synthesizer;

    public UpdateAnalysisHandler(IndexEngine engine, DerivedObjectSynthesizer synthesizer) {
        this.engine = engine;
        this.synthesizer = synthesizer;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void analyze(AstNode node, AnalysisContext context) {
        if (!(node instanceof UpdateNode update)) {
            return;
        }
        TranslationSession session = context.session();
        String name = update.name();
        TensorDeclaration declaration = session.namespace().declaration(name).orElse(null);

        if (update.metric()) {
            if (declaration == null) {
                throw undefined(name);
            }
            MetricContext metric = MetricContext.of(declaration);
            session.registerMetric(metric).ifPresent(replaced -> synthesizer.invalidate(replaced, session));
            synthesizer.refreshMetric(metric, context);
            log.debug("Refreshed metric {}", name);
            return;
        }

        AssignmentNode equation = session.definingEquation(name).orElse(null);
        if (equation != null) {
            log.debug("Re-running the defining equation of {}", name);
            engine.assign(equation, context.child(equation.sentence()));
            return;
        }
        if (declaration == null) {
            throw undefined(name);
        }
        session.metricNamed(name).ifPresent(metric -> synthesizer.invalidate(metric, session));
        for (int[] component : declaration.components()) {
            context.bind(declaration.componentName(component), declaration.initialValue(component));
        }
        log.debug("Re-instantiated {}", name);
    }

    private static TensorException undefined(String name) {
        return new TensorException(String.format("cannot update undefined tensor '%s'", name));
    }
}
