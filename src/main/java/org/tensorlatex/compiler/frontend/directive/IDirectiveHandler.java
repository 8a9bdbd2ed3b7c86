package org.tensorlatex.compiler.frontend.directive;

import org.tensorlatex.compiler.frontend.parser.ParsingContext;
import org.tensorlatex.compiler.frontend.parser.ast.AstNode;

/**
 * The base interface for all directive handlers.
 * Each handler is responsible for one macro of a {@code %} configuration line (e.g. {@code define}).
 */
public interface IDirectiveHandler {

    /**
     * Parses the directive and its arguments. The current token is the macro keyword.
     *
     * @param context The context that provides access to the token stream and the session.
     * @return A corresponding AST node for this directive, or {@code null}
     *         if the directive produces no node.
     */
    AstNode parse(ParsingContext context);
}
