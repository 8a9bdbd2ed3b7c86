package org.tensorlatex.compiler.frontend.semantics;

import org.tensorlatex.compiler.diagnostics.TensorException;
import org.tensorlatex.compiler.frontend.parser.ast.AssignmentNode;
import org.tensorlatex.compiler.frontend.parser.ast.AstNode;
import org.tensorlatex.compiler.frontend.parser.features.define.DefineNode;
import org.tensorlatex.compiler.frontend.parser.features.update.UpdateNode;
import org.tensorlatex.compiler.frontend.semantics.analysis.AssignmentAnalysisHandler;
import org.tensorlatex.compiler.frontend.semantics.analysis.DefineAnalysisHandler;
import org.tensorlatex.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.tensorlatex.compiler.frontend.semantics.analysis.UpdateAnalysisHandler;
import org.tensorlatex.compiler.frontend.semantics.derived.DerivedObjectSynthesizer;
import org.tensorlatex.compiler.frontend.semantics.index.IndexEngine;
import org.tensorlatex.symbolic.Expr;

import java.util.HashMap;
import java.util.Map;

/**
 * Performs semantic analysis on the structures handed over by the parser. Each structure is
 * dispatched to the handler registered for its node type and executed against the session
 * right away, so that it affects how the following structures are parsed.
 */
public class SemanticAnalyzer {

    private final Map<Class<? extends AstNode>, IAnalysisHandler> handlers = new HashMap<>();
    private final IndexEngine engine;

    /**
     * Constructs a new semantic analyzer with the default handlers.
     */
    public SemanticAnalyzer() {
        DerivedObjectSynthesizer synthesizer = new DerivedObjectSynthesizer();
        this.engine = new IndexEngine(synthesizer);
        handlers.put(DefineNode.class, new DefineAnalysisHandler(synthesizer));
        handlers.put(UpdateNode.class, new UpdateAnalysisHandler(engine, synthesizer));
        handlers.put(AssignmentNode.class, new AssignmentAnalysisHandler(engine));
    }

    /**
     * Analyzes and executes one structure.
     * @param node    The structure.
     * @param context The context of the current call.
     * @throws TensorException located at the structure if it violates tensor semantics.
     */
    public void analyze(AstNode node, AnalysisContext context) {
        IAnalysisHandler handler = handlers.get(node.getClass());
        if (handler == null) {
            throw new IllegalStateException("No analysis handler for " + node.getClass().getSimpleName());
        }
        try {
            handler.analyze(node, context);
        } catch (TensorException e) {
            throw e.locate(context.sentence(), node.position());
        }
    }

    /**
     * Evaluates a standalone expression, summing over its contracted indices.
     * @param expression The parsed expression.
     * @param context    The context of the current call.
     * @return The evaluated expression.
     */
    public Expr evaluate(Expr expression, AnalysisContext context) {
        try {
            return engine.evaluate(expression, context);
        } catch (TensorException e) {
            throw e.locate(context.sentence(), 0);
        }
    }
}
