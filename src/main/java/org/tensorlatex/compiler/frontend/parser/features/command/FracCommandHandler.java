package org.tensorlatex.compiler.frontend.parser.features.command;

import org.tensorlatex.compiler.frontend.lexer.TokenType;
import org.tensorlatex.compiler.frontend.parser.ParsingContext;
import org.tensorlatex.symbolic.Expr;
import org.tensorlatex.symbolic.Expressions;

/**
 * {@code \frac{a}{b}} with arbitrary expressions. Purely numeric fractions such as
 * {@code \frac{1}{2}} are already rational literals.
 */
public class FracCommandHandler implements ICommandHandler {

    @Override
    public Expr parse(ParsingContext context) {
        context.expect(TokenType.FRAC_CMD);
        context.expect(TokenType.LEFT_BRACE);
        Expr numerator = context.expressions().expression();
        context.expect(TokenType.RIGHT_BRACE);
        context.expect(TokenType.LEFT_BRACE);
        Expr denominator = context.expressions().expression();
        context.expect(TokenType.RIGHT_BRACE);
        return Expressions.divide(numerator, denominator);
    }
}
