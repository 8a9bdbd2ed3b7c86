package org.tensorlatex.compiler.frontend.parser.features.command;

import org.tensorlatex.compiler.frontend.lexer.Token;
import org.tensorlatex.compiler.frontend.lexer.TokenType;
import org.tensorlatex.compiler.frontend.parser.ParsingContext;
import org.tensorlatex.symbolic.Expr;
import org.tensorlatex.symbolic.Expressions;
import org.tensorlatex.symbolic.FunctionName;

/**
 * Trigonometric and hyperbolic functions. {@code \sin^{-1} x} is the inverse function,
 * {@code \sin^2 x} the square of {@code \sin x}.
 */
public class TrigCommandHandler implements ICommandHandler {

    @Override
    public Expr parse(ParsingContext context) {
        Token command = context.expect(TokenType.TRIG_CMD);
        FunctionName function = FunctionName.fromCommand(command.text().substring(1));
        Long exponent = null;
        if (context.accept(TokenType.CARET)) {
            boolean braced = context.accept(TokenType.LEFT_BRACE);
            boolean negative = context.accept(TokenType.MINUS);
            long value = context.expectInteger();
            if (braced) {
                context.expect(TokenType.RIGHT_BRACE);
            }
            exponent = negative ? -value : value;
        }
        Expr argument = FunctionArgument.parse(context);
        if (exponent == null) {
            return Expressions.function(function, argument);
        }
        if (exponent == -1) {
            return Expressions.function(function.inverse(), argument);
        }
        return Expressions.power(Expressions.function(function, argument), exponent);
    }
}
