package org.tensorlatex.compiler.frontend.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tensorlatex.compiler.diagnostics.LatexException;
import org.tensorlatex.compiler.diagnostics.LexException;
import org.tensorlatex.compiler.diagnostics.ParseException;
import org.tensorlatex.compiler.frontend.directive.DirectiveHandlerRegistry;
import org.tensorlatex.compiler.frontend.directive.IDirectiveHandler;
import org.tensorlatex.compiler.frontend.lexer.Lexer;
import org.tensorlatex.compiler.frontend.lexer.Token;
import org.tensorlatex.compiler.frontend.lexer.TokenType;
import org.tensorlatex.compiler.frontend.parser.ast.AssignmentNode;
import org.tensorlatex.compiler.frontend.parser.ast.AstNode;
import org.tensorlatex.compiler.frontend.parser.features.command.CommandHandlerRegistry;
import org.tensorlatex.compiler.frontend.semantics.TranslationSession;
import org.tensorlatex.symbolic.Expr;
import org.tensorlatex.symbolic.TensorRef;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * The main parser for the LaTeX dialect. It pulls tokens lazily from a {@link Lexer} and hands
 * every structure (configuration line or assignment) to a {@link StructureSink} as soon as it
 * is complete, so that a declaration affects how the following structures are parsed.
 * <p>
 * Expressions and tensors are delegated to {@link ExpressionParser} and {@link TensorParser};
 * directives and named commands are resolved through their registries.
 */
public class Parser implements ParsingContext {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private static final Set<TokenType> STRUCTURE_END = Set.of(TokenType.LINE_BREAK, TokenType.COMMENT);
    private static final Set<TokenType> ENVIRONMENT_LINE_END = Set.of(TokenType.LINE_BREAK, TokenType.END_ALIGN);

    private final Lexer lexer;
    private final Iterator<Token> stream;
    private final List<Token> tokens = new ArrayList<>();
    private final TranslationSession session;
    private final DirectiveHandlerRegistry directiveRegistry;
    private final ExpressionParser expressions;
    private final TensorParser tensors;
    private int current = 0;

    private boolean continueOnError;
    private Consumer<LatexException> errorListener = error -> {
        throw error;
    };

    /**
     * Constructs a new Parser.
     * @param lexer             The lexer over the sentence.
     * @param session           The session consulted for declarations, basis and derivative mode.
     * @param directiveRegistry Handlers for {@code %} lines.
     * @param commandRegistry   Handlers for named commands.
     */
    public Parser(Lexer lexer, TranslationSession session, DirectiveHandlerRegistry directiveRegistry,
                  CommandHandlerRegistry commandRegistry) {
        this.lexer = lexer;
        this.stream = lexer.tokenize();
        this.session = session;
        this.directiveRegistry = directiveRegistry;
        this.expressions = new ExpressionParser(this, commandRegistry);
        this.tensors = new TensorParser(this);
    }

    /**
     * Switches to continue-on-error mode: a failing structure, or a failing assignment inside an
     * environment, is passed to the listener and skipped up to the next line break.
     * @param listener Receives each error of a skipped structure.
     * @return This parser.
     */
    public Parser continueOnError(Consumer<LatexException> listener) {
        this.continueOnError = true;
        this.errorListener = listener;
        return this;
    }

    /**
     * Parses the whole sentence.
     * <pre>ROOT -> [STRUCTURE] { LINE_BREAK [STRUCTURE] }*</pre>
     * @param sink Receives each structure as soon as it is parsed.
     * @throws LatexException on the first error, unless in continue-on-error mode.
     */
    public void parse(StructureSink sink) {
        while (true) {
            boolean environment = false;
            try {
                while (accept(TokenType.LINE_BREAK)) {
                    // blank structure
                }
                if (isAtEnd()) {
                    return;
                }
                environment = check(TokenType.BEGIN_ALIGN);
                structure(sink);
                if (!isAtEnd() && !check(TokenType.LINE_BREAK) && !check(TokenType.COMMENT)) {
                    throw unexpected(peek());
                }
            } catch (LatexException e) {
                if (!continueOnError) {
                    throw e;
                }
                errorListener.accept(e);
                if (environment) {
                    synchronize(Set.of(TokenType.END_ALIGN));
                    accept(TokenType.END_ALIGN);
                } else {
                    synchronize(STRUCTURE_END);
                }
            }
        }
    }

    /**
     * Parses the whole sentence as a single expression.
     * @return The expression.
     */
    public Expr parseExpression() {
        while (accept(TokenType.LINE_BREAK)) {
            // leading separators
        }
        Expr expression = expressions.expression();
        while (accept(TokenType.LINE_BREAK)) {
            // trailing separators
        }
        if (!isAtEnd()) {
            throw unexpected(peek());
        }
        return expression;
    }

    /**
     * <pre>STRUCTURE -> CONFIG | ENVIRONMENT | ASSIGNMENT</pre>
     */
    private void structure(StructureSink sink) {
        if (check(TokenType.COMMENT)) {
            config(sink);
        } else if (check(TokenType.BEGIN_ALIGN)) {
            environment(sink);
        } else {
            sink.accept(assignment());
        }
    }

    /**
     * <pre>CONFIG -> '%' MACRO ...</pre>
     */
    private void config(StructureSink sink) {
        expect(TokenType.COMMENT);
        Token macro = peek();
        IDirectiveHandler handler = directiveRegistry.get(macro.text()).orElseThrow(() -> new ParseException(
                String.format("unsupported macro '%s' at position %d", macro.text(), macro.position()),
                sentence(), macro.position()));
        AstNode node = handler.parse(this);
        if (node != null) {
            sink.accept(node);
        }
    }

    /**
     * <pre>ENVIRONMENT -> BEGIN_ALIGN ASSIGNMENT { LINE_BREAK ASSIGNMENT }* END_ALIGN</pre>
     * A line break right before {@code \end{align}} is allowed.
     */
    private void environment(StructureSink sink) {
        expect(TokenType.BEGIN_ALIGN);
        do {
            while (accept(TokenType.LINE_BREAK)) {
                // empty line
            }
            if (check(TokenType.END_ALIGN)) {
                break;
            }
            try {
                sink.accept(assignment());
                if (!check(TokenType.LINE_BREAK) && !check(TokenType.END_ALIGN)) {
                    throw unexpected(peek());
                }
            } catch (LatexException e) {
                if (!continueOnError) {
                    throw e;
                }
                errorListener.accept(e);
                synchronize(ENVIRONMENT_LINE_END);
            }
        } while (accept(TokenType.LINE_BREAK));
        expect(TokenType.END_ALIGN);
    }

    /**
     * <pre>ASSIGNMENT -> (TENSOR | COVDRV) '=' EXPRESSION</pre>
     */
    @Override
    public AssignmentNode assignment() {
        int position = peek().position();
        TensorRef target = tensors.startsCovariantDerivative()
                ? tensors.covariantDerivative()
                : tensors.tensor(true);
        expect(TokenType.EQUAL);
        Expr value = expressions.expression();
        return new AssignmentNode(target, value, sentence(), position);
    }

    private void synchronize(Set<TokenType> stops) {
        while (true) {
            try {
                if (isAtEnd() || stops.contains(peek().type())) {
                    return;
                }
                advance();
            } catch (LexException e) {
                log.debug("Skipping unreadable input at position {} while recovering", e.position());
                lexer.recover();
            }
        }
    }

    private Token fill(int index) {
        while (tokens.size() <= index) {
            if (!stream.hasNext()) {
                return tokens.get(tokens.size() - 1);
            }
            tokens.add(stream.next());
        }
        return tokens.get(index);
    }

    @Override
    public boolean accept(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        return peek().type() == type;
    }

    @Override
    public boolean checkAhead(int offset, TokenType type) {
        return peekAhead(offset).type() == type;
    }

    @Override
    public Token expect(TokenType type) {
        if (check(type)) {
            return advance();
        }
        Token found = peek();
        throw new ParseException(String.format("expected token %s at position %d", type, found.position()),
                sentence(), found.position());
    }

    @Override
    public Token advance() {
        Token token = peek();
        if (token.type() != TokenType.END_OF_INPUT) {
            current++;
        }
        return token;
    }

    @Override
    public Token peek() {
        return fill(current);
    }

    @Override
    public Token peekAhead(int offset) {
        return fill(current + offset);
    }

    @Override
    public Token previous() {
        return tokens.get(current - 1);
    }

    @Override
    public boolean isAtEnd() {
        return check(TokenType.END_OF_INPUT);
    }

    @Override
    public int mark() {
        return current;
    }

    @Override
    public void reset(int mark) {
        current = mark;
    }

    @Override
    public ParseException unexpected(Token token) {
        if (token.type() == TokenType.END_OF_INPUT) {
            return new ParseException("unexpected end of input at position " + token.position(), sentence(), token.position());
        }
        return new ParseException(String.format("unexpected '%s' at position %d", token.text(), token.position()),
                sentence(), token.position());
    }

    @Override
    public ExpressionParser expressions() {
        return expressions;
    }

    @Override
    public TensorParser tensors() {
        return tensors;
    }

    @Override
    public TranslationSession getSession() {
        return session;
    }

    @Override
    public String sentence() {
        return lexer.sentence();
    }
}
