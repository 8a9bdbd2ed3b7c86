package org.tensorlatex.compiler.frontend.parser.features.command;

import org.tensorlatex.compiler.frontend.lexer.Token;
import org.tensorlatex.compiler.frontend.lexer.TokenType;
import org.tensorlatex.compiler.frontend.parser.ParsingContext;
import org.tensorlatex.symbolic.Expr;
import org.tensorlatex.symbolic.Expressions;
import org.tensorlatex.symbolic.FunctionName;
import org.tensorlatex.symbolic.Rational;

/**
 * {@code \ln x}, {@code \log x} (base 10) and {@code \log_b x} / {@code \log_{b} x}.
 */
public class LogarithmCommandHandler implements ICommandHandler {

    private static final Rational DEFAULT_BASE = Rational.of(10);

    @Override
    public Expr parse(ParsingContext context) {
        Token command = context.expect(TokenType.NLOG_CMD);
        boolean natural = command.text().equals("\\ln");
        Expr base = natural ? null : DEFAULT_BASE;
        if (context.accept(TokenType.UNDERSCORE)) {
            if (context.accept(TokenType.LEFT_BRACE)) {
                base = context.expressions().expression();
                context.expect(TokenType.RIGHT_BRACE);
            } else {
                base = context.expressions().atom();
            }
        }
        Expr argument = FunctionArgument.parse(context);
        return base == null ? Expressions.function(FunctionName.LOG, argument) : Expressions.log(argument, base);
    }
}
