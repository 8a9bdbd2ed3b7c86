package org.tensorlatex.compiler.frontend.parser.features.command;

import org.tensorlatex.compiler.diagnostics.ParseException;
import org.tensorlatex.compiler.frontend.lexer.Token;
import org.tensorlatex.compiler.frontend.lexer.TokenType;
import org.tensorlatex.compiler.frontend.parser.ParsingContext;
import org.tensorlatex.symbolic.Expr;
import org.tensorlatex.symbolic.Expressions;
import org.tensorlatex.symbolic.Rational;

/**
 * {@code \sqrt{x}} and {@code \sqrt[n]{x}}; the root index must be a positive integer.
 */
public class SqrtCommandHandler implements ICommandHandler {

    @Override
    public Expr parse(ParsingContext context) {
        context.expect(TokenType.SQRT_CMD);
        long root = 2;
        if (context.accept(TokenType.LEFT_BRACKET)) {
            Token index = context.peek();
            root = context.expectInteger();
            if (root == 0) {
                throw new ParseException("root index must be positive at position " + index.position(),
                        context.sentence(), index.position());
            }
            context.expect(TokenType.RIGHT_BRACKET);
        }
        context.expect(TokenType.LEFT_BRACE);
        Expr radicand = context.expressions().expression();
        context.expect(TokenType.RIGHT_BRACE);
        return Expressions.power(radicand, Rational.of(1, root));
    }
}
