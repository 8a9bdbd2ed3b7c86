package org.tensorlatex.compiler.api;

import org.tensorlatex.compiler.frontend.semantics.TranslationSession;

/**
 * Defines the public interface of the LaTeX tensor translator.
 * <p>
 * Errors do not escape as exceptions: they are recorded in the returned {@link ParseResult},
 * and {@link ParseResult#orElseThrow()} turns them into a {@link TranslationException} on request.
 */
public interface ITranslator {

    /**
     * Translates a sentence of equations and configuration lines against a session.
     * Continue-on-error follows the session configuration.
     *
     * @param sentence The LaTeX sentence.
     * @param session  The session that holds declarations and values across calls.
     * @return The bindings produced by this call and the diagnostics.
     */
    default ParseResult parse(String sentence, TranslationSession session) {
        return parse(sentence, session, ParseOptions.from(session.config()));
    }

    /**
     * Translates a sentence with explicit per-call options.
     *
     * @param sentence The LaTeX sentence.
     * @param session  The session.
     * @param options  Per-call options.
     * @return The bindings produced by this call and the diagnostics.
     */
    ParseResult parse(String sentence, TranslationSession session, ParseOptions options);

    /**
     * Evaluates a single expression. Contracted indices are summed; the session is read but
     * only changed by objects derived on the way.
     *
     * @param sentence The LaTeX expression.
     * @param session  The session.
     * @return A result whose {@link ParseResult#expression()} holds the value.
     */
    ParseResult parseExpression(String sentence, TranslationSession session);
}
