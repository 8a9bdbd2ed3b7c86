package org.tensorlatex.compiler.frontend.semantics.analysis;

import org.tensorlatex.compiler.frontend.parser.ast.AssignmentNode;
import org.tensorlatex.compiler.frontend.parser.ast.AstNode;
import org.tensorlatex.compiler.frontend.semantics.AnalysisContext;
import org.tensorlatex.compiler.frontend.semantics.index.IndexEngine;

/**
 * Handles the semantic analysis of {@link AssignmentNode}s by expanding them into component
 * equations.
 */
public class AssignmentAnalysisHandler implements IAnalysisHandler {

    private final IndexEngine engine;

    public AssignmentAnalysisHandler(IndexEngine engine) {
        this.engine = engine;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void analyze(AstNode node, AnalysisContext context) {
        if (node instanceof AssignmentNode assignment) {
            engine.assign(assignment, context);
        }
    }
}
