package org.tensorlatex.compiler.frontend.semantics.analysis;

import org.tensorlatex.compiler.frontend.parser.ast.AstNode;
import org.tensorlatex.compiler.frontend.semantics.AnalysisContext;

/**
 * Interface for specialized handlers in semantic analysis.
 * Each handler is responsible for executing a specific type of AST node against the session.
 */
@FunctionalInterface
public interface IAnalysisHandler {
    /**
     * Analyzes and executes a single AST node.
     * @param node    The node to analyze.
     * @param context The session, diagnostics and result bindings of the current call.
     */
    void analyze(AstNode node, AnalysisContext context);
}
