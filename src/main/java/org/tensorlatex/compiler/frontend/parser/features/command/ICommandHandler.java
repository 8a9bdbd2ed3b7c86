package org.tensorlatex.compiler.frontend.parser.features.command;

import org.tensorlatex.compiler.frontend.parser.ParsingContext;
import org.tensorlatex.symbolic.Expr;

/**
 * Parses one named LaTeX command such as {@code \sqrt} or {@code \frac}.
 */
public interface ICommandHandler {

    /**
     * Parses the command and its arguments. The current token is the command itself.
     * @param context The parsing context.
     * @return The expression the command denotes.
     */
    Expr parse(ParsingContext context);
}
