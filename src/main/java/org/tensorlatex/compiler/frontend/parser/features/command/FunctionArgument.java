package org.tensorlatex.compiler.frontend.parser.features.command;

import org.tensorlatex.compiler.frontend.lexer.TokenType;
import org.tensorlatex.compiler.frontend.parser.ParsingContext;
import org.tensorlatex.symbolic.Expr;

/**
 * The argument of a function command: {@code \sin x}, {@code \sin 2}, {@code \sin(x + y)}
 * or {@code \sin{x + y}}.
 */
final class FunctionArgument {

    private FunctionArgument() {
    }

    static Expr parse(ParsingContext context) {
        if (context.accept(TokenType.LEFT_PAREN)) {
            Expr argument = context.expressions().expression();
            context.expect(TokenType.RIGHT_PAREN);
            return argument;
        }
        if (context.accept(TokenType.LEFT_BRACE)) {
            Expr argument = context.expressions().expression();
            context.expect(TokenType.RIGHT_BRACE);
            return argument;
        }
        if (context.check(TokenType.INTEGER) || context.check(TokenType.DECIMAL) || context.check(TokenType.RATIONAL)) {
            return context.expressions().number();
        }
        if (context.check(TokenType.LETTER) || context.check(TokenType.DIACRITIC) || context.check(TokenType.MATHOP)) {
            return context.tensors().tensor(false);
        }
        throw context.unexpected(context.peek());
    }
}
