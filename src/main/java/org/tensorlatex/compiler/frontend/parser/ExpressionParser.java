package org.tensorlatex.compiler.frontend.parser;

import org.tensorlatex.compiler.diagnostics.ParseException;
import org.tensorlatex.compiler.frontend.lexer.Token;
import org.tensorlatex.compiler.frontend.lexer.TokenType;
import org.tensorlatex.compiler.frontend.parser.features.command.CommandHandlerRegistry;
import org.tensorlatex.compiler.frontend.parser.features.command.ICommandHandler;
import org.tensorlatex.symbolic.Constant;
import org.tensorlatex.symbolic.Decimal;
import org.tensorlatex.symbolic.Expr;
import org.tensorlatex.symbolic.Expressions;
import org.tensorlatex.symbolic.FunctionName;
import org.tensorlatex.symbolic.Rational;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for arithmetic. Each nonterminal has one method; precedence follows
 * from the call structure.
 * <pre>
 * EXPRESSION -> TERM { ('+'|'-') TERM }*
 * TERM       -> FACTOR { [ '/' ] FACTOR }*
 * FACTOR     -> ['-'] (BASE | EULER) { '^' EXPONENT }*
 * BASE       -> [ '-' ] ( ATOM | '(' EXPRESSION ')' )
 * EXPONENT   -> BASE | '{' EXPRESSION '}' | '{{' EXPRESSION '}}'
 * ATOM       -> NUMBER | TENSOR | COMMAND | OPERATOR
 * </pre>
 */
public class ExpressionParser {

    private static final Pattern FRAC_LITERAL = Pattern.compile("\\\\frac\\{([0-9]+)\\}\\{([0-9]+)\\}");

    /** Tokens that can start a factor, and so continue an implicit product. */
    private static final Set<TokenType> FACTOR_START = EnumSet.of(
            TokenType.LEFT_PAREN, TokenType.RATIONAL, TokenType.DECIMAL, TokenType.INTEGER,
            TokenType.LETTER, TokenType.DIACRITIC, TokenType.MATHOP, TokenType.PI, TokenType.EULER,
            TokenType.NABLA, TokenType.PARTIAL, TokenType.VPHANTOM,
            TokenType.SQRT_CMD, TokenType.FRAC_CMD, TokenType.TRIG_CMD, TokenType.NLOG_CMD, TokenType.COMMAND);

    private final ParsingContext context;
    private final CommandHandlerRegistry commands;

    public ExpressionParser(ParsingContext context, CommandHandlerRegistry commands) {
        this.context = context;
        this.commands = commands;
    }

    public Expr expression() {
        Expr result = term();
        while (true) {
            if (context.accept(TokenType.PLUS)) {
                result = Expressions.add(result, term());
            } else if (context.accept(TokenType.MINUS)) {
                result = Expressions.subtract(result, term());
            } else {
                return result;
            }
        }
    }

    public Expr term() {
        Expr result = factor();
        while (true) {
            if (context.accept(TokenType.DIVIDE)) {
                result = Expressions.divide(result, factor());
            } else if (FACTOR_START.contains(context.peek().type())) {
                result = Expressions.multiply(result, factor());
            } else {
                return result;
            }
        }
    }

    /**
     * Parses a factor. A leading minus applies to the whole power, so {@code -a^b} is {@code -(a^b)};
     * stacked exponents associate to the right.
     * @return The factor.
     */
    public Expr factor() {
        boolean negate = context.accept(TokenType.MINUS);
        boolean euler = context.accept(TokenType.EULER);
        Expr base = euler ? Constant.E : base();

        List<Expr> exponents = new ArrayList<>();
        while (context.accept(TokenType.CARET)) {
            exponents.add(exponent());
        }
        Expr exponent = null;
        for (int i = exponents.size() - 1; i >= 0; i--) {
            exponent = exponent == null ? exponents.get(i) : Expressions.power(exponents.get(i), exponent);
        }

        Expr result;
        if (exponent == null) {
            result = base;
        } else if (euler) {
            result = Expressions.function(FunctionName.EXP, exponent);
        } else {
            result = Expressions.power(base, exponent);
        }
        return negate ? Expressions.negate(result) : result;
    }

    public Expr base() {
        boolean negate = context.accept(TokenType.MINUS);
        Expr value;
        if (context.accept(TokenType.LEFT_PAREN)) {
            value = expression();
            context.expect(TokenType.RIGHT_PAREN);
        } else {
            value = atom();
        }
        return negate ? Expressions.negate(value) : value;
    }

    /**
     * Parses an exponent. {@code ^{{...}}} always denotes a power, even after a tensor name.
     * @return The exponent.
     */
    public Expr exponent() {
        if (context.check(TokenType.LEFT_BRACE) && context.checkAhead(1, TokenType.LEFT_BRACE)) {
            context.advance();
            context.advance();
            Expr value = expression();
            context.expect(TokenType.RIGHT_BRACE);
            context.expect(TokenType.RIGHT_BRACE);
            return value;
        }
        if (context.accept(TokenType.LEFT_BRACE)) {
            Expr value = expression();
            context.expect(TokenType.RIGHT_BRACE);
            return value;
        }
        return base();
    }

    public Expr atom() {
        Token token = context.peek();
        switch (token.type()) {
            case RATIONAL:
            case DECIMAL:
            case INTEGER:
                return number();
            case PI:
                context.advance();
                return Constant.PI;
            case EULER:
                context.advance();
                return Constant.E;
            case SQRT_CMD:
            case FRAC_CMD:
            case TRIG_CMD:
            case NLOG_CMD:
            case COMMAND:
                return command();
            case PARTIAL:
            case VPHANTOM:
                return context.tensors().partialDerivative();
            case NABLA:
                return context.tensors().covariantDerivative();
            case DIACRITIC:
                return context.tensors().startsCovariantDerivative()
                        ? context.tensors().covariantDerivative()
                        : context.tensors().tensor(false);
            case LETTER:
            case MATHOP:
                return context.tensors().tensor(false);
            default:
                throw context.unexpected(token);
        }
    }

    /**
     * Parses an integer, a decimal or a rational literal ({@code 3/4} or {@code \frac{3}{4}}).
     * @return The number.
     */
    public Expr number() {
        Token token = context.peek();
        switch (token.type()) {
            case INTEGER:
                context.advance();
                return new Rational(new BigInteger(token.text()), BigInteger.ONE);
            case DECIMAL:
                context.advance();
                return new Decimal(Double.parseDouble(token.text()));
            case RATIONAL:
                context.advance();
                Matcher frac = FRAC_LITERAL.matcher(token.text());
                if (frac.matches()) {
                    return new Rational(new BigInteger(frac.group(1)), new BigInteger(frac.group(2)));
                }
                return Rational.parse(token.text());
            default:
                throw context.unexpected(token);
        }
    }

    private Expr command() {
        Token token = context.peek();
        ICommandHandler handler = commands.get(token.type()).orElseThrow(() -> new ParseException(
                String.format("unsupported command '%s' at position %d", token.text(), token.position()),
                context.sentence(), token.position()));
        return handler.parse(context);
    }
}
