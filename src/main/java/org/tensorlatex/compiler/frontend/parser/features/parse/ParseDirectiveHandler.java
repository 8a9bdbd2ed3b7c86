package org.tensorlatex.compiler.frontend.parser.features.parse;

import org.tensorlatex.compiler.frontend.directive.IDirectiveHandler;
import org.tensorlatex.compiler.frontend.parser.ParsingContext;
import org.tensorlatex.compiler.frontend.parser.ast.AstNode;

/**
 * Handler for the {@code parse} macro, which runs an assignment from inside a configuration
 * line: {@code % parse g_{0 0} = -1}.
 */
public class ParseDirectiveHandler implements IDirectiveHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        context.advance(); // consume parse
        return context.assignment();
    }
}
