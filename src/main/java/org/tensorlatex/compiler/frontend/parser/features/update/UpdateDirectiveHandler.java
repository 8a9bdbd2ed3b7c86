package org.tensorlatex.compiler.frontend.parser.features.update;

import org.tensorlatex.compiler.frontend.directive.IDirectiveHandler;
import org.tensorlatex.compiler.frontend.lexer.Token;
import org.tensorlatex.compiler.frontend.lexer.TokenType;
import org.tensorlatex.compiler.frontend.parser.ParsingContext;
import org.tensorlatex.compiler.frontend.parser.ast.AstNode;

/**
 * Handler for the {@code update} macro (alias {@code assign}).
 * Expected format: {@code % update [metric] NAME}.
 */
public class UpdateDirectiveHandler implements IDirectiveHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token macro = context.advance(); // consume update
        boolean metric = false;
        if (context.check(TokenType.SYMMETRY)) {
            Token keyword = context.peek();
            if (!keyword.text().equals("metric")) {
                throw context.unexpected(keyword);
            }
            context.advance();
            metric = true;
        }
        return new UpdateNode(metric, context.tensors().declaredName(), macro.position());
    }
}
