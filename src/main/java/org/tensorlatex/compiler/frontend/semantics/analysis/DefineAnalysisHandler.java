package org.tensorlatex.compiler.frontend.semantics.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tensorlatex.compiler.diagnostics.Diagnostic;
import org.tensorlatex.compiler.diagnostics.TensorException;
import org.tensorlatex.compiler.frontend.parser.ast.AstNode;
import org.tensorlatex.compiler.frontend.parser.features.define.DefineNode;
import org.tensorlatex.compiler.frontend.semantics.AnalysisContext;
import org.tensorlatex.compiler.frontend.semantics.IndexRange;
import org.tensorlatex.compiler.frontend.semantics.MetricContext;
import org.tensorlatex.compiler.frontend.semantics.Namespace;
import org.tensorlatex.compiler.frontend.semantics.Symmetry;
import org.tensorlatex.compiler.frontend.semantics.TensorDeclaration;
import org.tensorlatex.compiler.frontend.semantics.TensorKind;
import org.tensorlatex.compiler.frontend.semantics.TensorNames;
import org.tensorlatex.compiler.frontend.semantics.TranslationSession;
import org.tensorlatex.compiler.frontend.semantics.derived.DerivedObjectSynthesizer;
import org.tensorlatex.symbolic.IndexPosition;
import org.tensorlatex.symbolic.Symbol;

import java.util.List;

/**
 * Handles the semantic analysis of {@link DefineNode}s: session settings are applied and each
 * declared tensor is validated, entered into the namespace and instantiated with its initial
 * components.
 */
public class DefineAnalysisHandler implements IAnalysisHandler {

    private static final Logger log = LoggerFactory.getLogger(DefineAnalysisHandler.class);

    private final DerivedObjectSynthesizer synthesizer;

    public DefineAnalysisHandler(DerivedObjectSynthesizer synthesizer) {
        this.synthesizer = synthesizer;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void analyze(AstNode node, AnalysisContext context) {
        if (!(node instanceof DefineNode defineNode)) {
            return;
        }
        TranslationSession session = context.session();
        for (DefineNode.Item item : defineNode.items()) {
            if (item instanceof DefineNode.Basis basis) {
                session.setBasis(basis.coordinates().stream().map(Symbol::new).toList());
            } else if (item instanceof DefineNode.DerivativeSetting setting) {
                session.setDerivativeMode(setting.mode());
            } else if (item instanceof DefineNode.IndexRangeSetting range) {
                for (String label : range.labels()) {
                    session.setIndexRange(label, new IndexRange(range.start(), range.stop() + 1));
                }
            } else if (item instanceof DefineNode.Declaration declaration) {
                try {
                    declare(declaration, context);
                } catch (TensorException e) {
                    throw e.locate(context.sentence(), declaration.position());
                }
            }
        }
    }

    private void declare(DefineNode.Declaration item, AnalysisContext context) {
        TranslationSession session = context.session();
        Namespace namespace = session.namespace();
        String name = item.name();
        TensorKind kind = TensorKind.fromKeyword(item.keyword());
        List<IndexPosition> positions = TensorNames.positions(name);
        int rank = positions.size();

        if (kind == TensorKind.CONSTANT && rank > 0) {
            throw new TensorException(String.format("constant '%s' cannot carry indices", name));
        }
        int dimension = dimension(item, kind, rank, session);
        Symmetry symmetry = symmetry(item.keyword(), kind);
        symmetry.validate(name, rank);
        if ((kind == TensorKind.KRONECKER || kind == TensorKind.METRIC) && rank != 2) {
            throw new TensorException(String.format("%s '%s' must have rank 2", item.keyword(), name));
        }
        if (kind == TensorKind.PERMUTATION && rank != dimension) {
            throw new TensorException(String.format("permutation '%s' must have rank equal to its dimension %d", name, dimension));
        }
        TensorDeclaration declaration = new TensorDeclaration(name, positions, dimension, symmetry, kind);
        MetricContext metric = kind == TensorKind.METRIC ? MetricContext.of(declaration) : null;

        TensorDeclaration existing = namespace.declaration(name).orElse(null);
        if (existing != null) {
            if (existing.dimension() != dimension) {
                throw new TensorException(String.format("inconsistent tensor dimension of '%s': %d, was %d",
                        name, dimension, existing.dimension()));
            }
            if (!session.config().silentRedefinition()) {
                String message = String.format("redefinition of '%s'", name);
                log.warn("{} in '{}'", message, context.sentence());
                context.diagnostics().reportWarning(Diagnostic.Kind.OVERRIDE_WARNING, message,
                        context.sentence(), item.position());
            }
            session.metricNamed(name).ifPresent(old -> synthesizer.invalidate(old, session));
            namespace.remove(name);
            session.forgetDefiningEquation(name);
        }

        namespace.declare(declaration);
        if (metric != null) {
            session.registerMetric(metric).ifPresent(replaced -> synthesizer.invalidate(replaced, session));
        }
        if (kind == TensorKind.CONSTANT) {
            context.bind(name, new Symbol(name));
        } else {
            for (int[] component : declaration.components()) {
                context.bind(declaration.componentName(component), declaration.initialValue(component));
            }
        }
        log.debug("Declared {} {} of dimension {}", kind, name, dimension);
    }

    /**
     * Resolves the dimension of a declaration; a given dimension becomes the new session default.
     */
    private static int dimension(DefineNode.Declaration item, TensorKind kind, int rank, TranslationSession session) {
        if (item.dimension() != null) {
            session.setDefaultDimension(item.dimension());
            return item.dimension();
        }
        if (kind == TensorKind.CONSTANT || rank == 0) {
            return 0;
        }
        if (session.defaultDimension() == 0) {
            throw new TensorException(String.format("missing dimension of '%s'", item.name()));
        }
        return session.defaultDimension();
    }

    private static Symmetry symmetry(String keyword, TensorKind kind) {
        switch (kind) {
            case METRIC:
            case KRONECKER:
                return Symmetry.symmetric(0, 1);
            case SYMBOLIC:
                try {
                    return Symmetry.parse(keyword);
                } catch (IllegalArgumentException e) {
                    throw new TensorException(String.format("unknown symmetry '%s'", keyword));
                }
            default:
                return Symmetry.NONE;
        }
    }
}
