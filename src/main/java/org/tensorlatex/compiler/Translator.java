package org.tensorlatex.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tensorlatex.compiler.api.ITranslator;
import org.tensorlatex.compiler.api.ParseOptions;
import org.tensorlatex.compiler.api.ParseResult;
import org.tensorlatex.compiler.diagnostics.DiagnosticsEngine;
import org.tensorlatex.compiler.diagnostics.LatexException;
import org.tensorlatex.compiler.frontend.directive.DirectiveHandlerRegistry;
import org.tensorlatex.compiler.frontend.lexer.Lexer;
import org.tensorlatex.compiler.frontend.lexer.TokenPatternRegistry;
import org.tensorlatex.compiler.frontend.parser.Parser;
import org.tensorlatex.compiler.frontend.parser.StructureSink;
import org.tensorlatex.compiler.frontend.parser.features.command.CommandHandlerRegistry;
import org.tensorlatex.compiler.frontend.semantics.AnalysisContext;
import org.tensorlatex.compiler.frontend.semantics.SemanticAnalyzer;
import org.tensorlatex.compiler.frontend.semantics.SentenceExecutor;
import org.tensorlatex.compiler.frontend.semantics.TranslationSession;
import org.tensorlatex.symbolic.Expr;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The main translator implementation. It runs the lexer, the parser and the semantic analysis
 * as one pipeline: every structure is analyzed as soon as it has been parsed. Errors are
 * collected at structure boundaries into a {@link DiagnosticsEngine}.
 * <p>
 * The translator itself keeps no per-call state; all of it lives in the {@link TranslationSession}.
 * It also runs the equations generated for derived objects, see {@link SentenceExecutor}.
 */
public class Translator implements ITranslator, SentenceExecutor {

    private static final Logger log = LoggerFactory.getLogger(Translator.class);

    private final TokenPatternRegistry patterns;
    private final DirectiveHandlerRegistry directives = DirectiveHandlerRegistry.initialize();
    private final CommandHandlerRegistry commands = CommandHandlerRegistry.initialize();
    private final SemanticAnalyzer analyzer = new SemanticAnalyzer();

    /**
     * Creates a translator for the built-in dialect.
     */
    public Translator() {
        this(TokenPatternRegistry.defaults());
    }

    /**
     * Creates a translator with an extended token registry.
     * @param patterns The ordered token patterns.
     */
    public Translator(TokenPatternRegistry patterns) {
        this.patterns = patterns;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public ParseResult parse(String sentence, TranslationSession session, ParseOptions options) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Map<String, Expr> bindings = new LinkedHashMap<>();
        AnalysisContext context = new AnalysisContext(session, diagnostics, bindings, this, sentence);

        Parser parser = parser(sentence, session);
        if (options.continueOnError()) {
            parser.continueOnError(error -> {
                log.error("Skipping structure: {}", error.getMessage());
                diagnostics.report(error);
            });
        }
        try {
            parser.parse(sink(context));
        } catch (LatexException e) {
            log.debug("Translation stopped: {}", e.getMessage());
            diagnostics.report(e);
        }
        return new ParseResult(bindings, diagnostics.getDiagnostics(), null);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public ParseResult parseExpression(String sentence, TranslationSession session) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Map<String, Expr> bindings = new LinkedHashMap<>();
        AnalysisContext context = new AnalysisContext(session, diagnostics, bindings, this, sentence);
        Expr value = null;
        try {
            Expr parsed = parser(sentence, session).parseExpression();
            value = analyzer.evaluate(parsed, context);
        } catch (LatexException e) {
            log.debug("Evaluation stopped: {}", e.getMessage());
            diagnostics.report(e);
        }
        return new ParseResult(bindings, diagnostics.getDiagnostics(), value);
    }

    /**
     * Runs a generated sentence in strict mode; errors propagate to the structure that caused it.
     * @param sentence The generated LaTeX.
     * @param context  A child of the context of the current call.
     */
    @Override
    public void execute(String sentence, AnalysisContext context) {
        parser(sentence, context.session()).parse(sink(context));
    }

    private Parser parser(String sentence, TranslationSession session) {
        return new Parser(new Lexer(sentence, patterns), session, directives, commands);
    }

    private StructureSink sink(AnalysisContext context) {
        return node -> {
            log.debug("Executing {} at position {}", node.getClass().getSimpleName(), node.position());
            analyzer.analyze(node, context);
        };
    }
}
